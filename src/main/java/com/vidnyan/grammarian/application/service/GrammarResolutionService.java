package com.vidnyan.grammarian.application.service;

import com.vidnyan.grammarian.application.port.in.ResolveGrammarUseCase;
import com.vidnyan.grammarian.application.port.out.GrammarSourceRepository;
import com.vidnyan.grammarian.application.port.out.GrammarSourceRepository.ReadResult;
import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.GrammarImport;
import com.vidnyan.grammarian.domain.model.Issue;
import com.vidnyan.grammarian.domain.model.Severity;
import com.vidnyan.grammarian.domain.model.builder.GrammarModelBuilder;
import com.vidnyan.grammarian.domain.resolve.GrammarMerger;
import com.vidnyan.grammarian.domain.resolve.LoadedGrammar;
import com.vidnyan.grammarian.domain.resolve.ResolvedGrammar;
import com.vidnyan.grammarian.domain.rewrite.GrammarRewriter;
import com.vidnyan.grammarian.domain.rewrite.RuleRenamer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Loads a grammar with its imports and token vocabulary, transitively.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GrammarResolutionService implements ResolveGrammarUseCase {

    private final GrammarSourceRepository sourceRepository;
    private final GrammarModelBuilder modelBuilder;
    private final GrammarRewriter rewriter;

    @Override
    public ResolvedGrammar resolve(Path mainFile, Path basePath) {
        Path base = basePath != null ? basePath : directoryOf(mainFile);
        log.info("Resolving {} (imports from {})", mainFile, base);

        List<Issue> issues = new ArrayList<>();
        List<LoadedGrammar> files = new ArrayList<>();
        LoadedGrammar main = loadMain(mainFile, issues);
        files.add(main);

        Set<String> attempted = new HashSet<>();
        attempted.add(grammarName(main));
        Deque<String> chain = new ArrayDeque<>();
        chain.addLast(grammarName(main));
        loadDependencies(main.grammar(), base, chain, attempted, files, issues);

        Grammar merged = GrammarMerger.merge(main.grammar(), files.subList(1, files.size()), issues);
        log.info("Resolved '{}': {} files, {} rules, {} resolution issues",
                merged.name(), files.size(), merged.rules().size(), issues.size());
        return new ResolvedGrammar(files, merged, issues);
    }

    @Override
    public MultiFileRenameResult renameAcrossFiles(Path mainFile, Path basePath, String oldName, String newName) {
        ResolvedGrammar resolved = resolve(mainFile, basePath);
        List<LoadedGrammar> files = resolved.files();

        if (files.stream().noneMatch(f -> f.grammar().hasRule(oldName))) {
            return MultiFileRenameResult.failure(
                    String.format("Rule '%s' is not defined in any of %d loaded grammars", oldName, files.size()));
        }
        String problem = RuleRenamer.validateNewName(oldName, newName);
        if (problem != null) {
            return MultiFileRenameResult.failure(problem);
        }
        for (LoadedGrammar file : files) {
            if (file.grammar().hasRule(newName)) {
                return MultiFileRenameResult.failure(
                        String.format("Rule '%s' already exists in %s", newName, file.path()));
            }
        }

        Map<Path, FileChange> changes = new LinkedHashMap<>();
        for (LoadedGrammar file : files) {
            RuleRenamer.Replacement replacement = rewriter.renameOccurrences(file.source(), oldName, newName);
            if (!replacement.changed()) {
                continue;
            }
            Grammar renamed = modelBuilder.build(replacement.content());
            if (renamed.rules().size() != file.grammar().rules().size()) {
                return MultiFileRenameResult.failure(
                        String.format("Rename would change the rule count of %s; nothing was renamed", file.path()));
            }
            changes.put(file.path(), new FileChange(replacement.content(), replacement.occurrences()));
        }

        int total = changes.values().stream().mapToInt(FileChange::occurrences).sum();
        log.info("Renamed '{}' to '{}' in {} of {} files ({} occurrences)",
                oldName, newName, changes.size(), files.size(), total);
        return new MultiFileRenameResult(true,
                String.format("Renamed '%s' to '%s': %d occurrences in %d files", oldName, newName, total, changes.size()),
                changes);
    }

    private LoadedGrammar loadMain(Path mainFile, List<Issue> issues) {
        ReadResult read = sourceRepository.read(mainFile);
        if (read.isOk()) {
            return new LoadedGrammar(null, mainFile, read.content(), modelBuilder.build(read.content()));
        }
        log.error("Cannot read main grammar {}: {}", mainFile, read.error());
        issues.add(Issue.error("unreadable-grammar", String.format("Cannot read %s: %s", mainFile, read.error())));
        return new LoadedGrammar(null, mainFile, "", modelBuilder.build(""));
    }

    /**
     * Depth-first, so files appear in the order a reader would follow the imports.
     */
    private void loadDependencies(Grammar grammar, Path base, Deque<String> chain, Set<String> attempted,
                                  List<LoadedGrammar> files, List<Issue> issues) {
        for (GrammarImport dependency : dependenciesOf(grammar)) {
            String name = dependency.name();
            if (chain.contains(name)) {
                List<String> cycle = new ArrayList<>(chain);
                cycle.add(name);
                issues.add(Issue.builder()
                        .severity(Severity.WARNING)
                        .type("circular-import")
                        .message("Circular import: " + String.join(" -> ", cycle))
                        .lineNumber(lineOrNull(dependency))
                        .build());
                continue;
            }
            if (!attempted.add(name)) {
                continue;
            }
            Optional<Path> located = sourceRepository.locate(base, name);
            if (located.isEmpty()) {
                issues.add(Issue.builder()
                        .severity(Severity.WARNING)
                        .type("unresolved-import")
                        .message(String.format("Cannot resolve '%s' imported by '%s' (looked for %s and %s)",
                                name, chain.peekLast(), base.resolve(name + ".g4"),
                                base.resolve("imports").resolve(name + ".g4")))
                        .lineNumber(lineOrNull(dependency))
                        .suggestion("Check the base path or place the file under imports/")
                        .build());
                continue;
            }
            ReadResult read = sourceRepository.read(located.get());
            if (!read.isOk()) {
                issues.add(Issue.error("unreadable-grammar",
                        String.format("Cannot read %s: %s", located.get(), read.error())));
                continue;
            }
            Grammar loaded = modelBuilder.build(read.content());
            files.add(new LoadedGrammar(name, located.get(), read.content(), loaded));
            log.debug("Loaded '{}' from {}", name, located.get());

            chain.addLast(name);
            loadDependencies(loaded, base, chain, attempted, files, issues);
            chain.removeLast();
        }
    }

    /**
     * Imported grammars, then the token vocabulary. The vocabulary has no line of its own.
     */
    private static List<GrammarImport> dependenciesOf(Grammar grammar) {
        List<GrammarImport> dependencies = new ArrayList<>(grammar.imports());
        grammar.tokenVocab().ifPresent(vocab -> dependencies.add(new GrammarImport(vocab, 0)));
        return dependencies;
    }

    private static Integer lineOrNull(GrammarImport dependency) {
        return dependency.lineNumber() > 0 ? dependency.lineNumber() : null;
    }

    private static String grammarName(LoadedGrammar file) {
        if (file.grammar().name() != null) {
            return file.grammar().name();
        }
        if (file.path() == null || file.path().getFileName() == null) {
            return "<unnamed>";
        }
        String fileName = file.path().getFileName().toString();
        return fileName.endsWith(".g4") ? fileName.substring(0, fileName.length() - 3) : fileName;
    }

    private static Path directoryOf(Path file) {
        if (file == null) {
            return Path.of(".");
        }
        Path parent = file.toAbsolutePath().getParent();
        return parent != null ? parent : Path.of(".");
    }
}
