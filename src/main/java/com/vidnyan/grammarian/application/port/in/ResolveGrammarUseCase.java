package com.vidnyan.grammarian.application.port.in;

import com.vidnyan.grammarian.domain.resolve.ResolvedGrammar;

import java.nio.file.Path;
import java.util.Map;

/**
 * Load a grammar together with everything it imports.
 */
public interface ResolveGrammarUseCase {

    /**
     * Resolve imports and token vocabularies transitively and merge them.
     * @param mainFile the grammar to start from
     * @param basePath directory to look up imports in; null = directory of mainFile
     */
    ResolvedGrammar resolve(Path mainFile, Path basePath);

    /**
     * Rename a rule in every file of a resolved grammar.
     * Nothing is written; the caller decides what to do with the new contents.
     */
    MultiFileRenameResult renameAcrossFiles(Path mainFile, Path basePath, String oldName, String newName);

    /**
     * Outcome of a multi-file rename.
     *
     * @param changes modified files only, in load order
     */
    record MultiFileRenameResult(
        boolean success,
        String message,
        Map<Path, FileChange> changes
    ) {
        public MultiFileRenameResult {
            changes = changes == null ? Map.of() : changes;
        }

        public static MultiFileRenameResult failure(String reason) {
            return new MultiFileRenameResult(false, reason, Map.of());
        }

        public int totalOccurrences() {
            return changes.values().stream().mapToInt(FileChange::occurrences).sum();
        }
    }

    /**
     * New content of one file and the number of names replaced in it.
     */
    record FileChange(String content, int occurrences) {}
}
