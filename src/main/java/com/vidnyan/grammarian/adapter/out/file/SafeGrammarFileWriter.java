package com.vidnyan.grammarian.adapter.out.file;

import com.vidnyan.grammarian.application.port.out.GrammarFileWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes grammar files, refusing content that looks truncated.
 *
 * A write is refused when the existing file has more than {@value #GUARDED_LINE_COUNT} lines
 * and the new content keeps fewer than half of them.
 */
@Slf4j
@Component
public class SafeGrammarFileWriter implements GrammarFileWriter {

    static final int GUARDED_LINE_COUNT = 10;
    static final double MIN_KEPT_RATIO = 0.5;

    @Override
    public WriteResult write(Path path, String content) {
        if (path == null || content == null) {
            return WriteResult.failed(path, "path and content are required");
        }
        try {
            String existing = Files.isRegularFile(path) ? Files.readString(path, StandardCharsets.UTF_8) : null;
            int oldLines = existing == null ? 0 : lineCount(existing);
            int newLines = lineCount(content);

            if (content.equals(existing)) {
                return new WriteResult(path, WriteStatus.UNCHANGED, oldLines, newLines, "Content unchanged");
            }
            if (oldLines > GUARDED_LINE_COUNT && newLines < oldLines * MIN_KEPT_RATIO) {
                log.warn("Refusing to write {}: {} lines would replace {}", path, newLines, oldLines);
                return WriteResult.refused(path, oldLines, newLines, String.format(
                        "New content has %d lines, less than half of the existing %d; refusing to overwrite",
                        newLines, oldLines));
            }

            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, content, StandardCharsets.UTF_8);
            log.info("Wrote {} ({} -> {} lines)", path, oldLines, newLines);
            return new WriteResult(path, WriteStatus.WRITTEN, oldLines, newLines, "Written");
        } catch (IOException e) {
            log.error("Failed to write {}: {}", path, e.getMessage());
            return WriteResult.failed(path, e.getMessage());
        }
    }

    static int lineCount(String text) {
        if (text.isEmpty()) {
            return 0;
        }
        int lines = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n' && i < text.length() - 1) {
                lines++;
            }
        }
        return lines;
    }
}
