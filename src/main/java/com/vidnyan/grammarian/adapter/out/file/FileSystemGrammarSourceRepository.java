package com.vidnyan.grammarian.adapter.out.file;

import com.vidnyan.grammarian.application.port.out.GrammarSourceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * File system based grammar source repository.
 * Reads grammar files as UTF-8.
 */
@Slf4j
@Component
public class FileSystemGrammarSourceRepository implements GrammarSourceRepository {

    static final String EXTENSION = ".g4";
    static final String IMPORTS_DIRECTORY = "imports";

    @Override
    public ReadResult read(Path path) {
        if (path == null) {
            return ReadResult.failed(null, "no path given");
        }
        if (!Files.isRegularFile(path)) {
            return ReadResult.failed(path, "file not found");
        }
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            log.debug("Read {} ({} chars)", path, content.length());
            return ReadResult.ok(path, content);
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", path, e.getMessage());
            return ReadResult.failed(path, e.getMessage());
        }
    }

    @Override
    public Optional<Path> locate(Path basePath, String grammarName) {
        List<Path> candidates = List.of(
                basePath.resolve(grammarName + EXTENSION),
                basePath.resolve(IMPORTS_DIRECTORY).resolve(grammarName + EXTENSION)
        );
        return candidates.stream().filter(Files::isRegularFile).findFirst();
    }
}
