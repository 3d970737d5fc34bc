package com.vidnyan.grammarian.application.port.out;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Port for reading grammar files.
 * Implemented by adapters that read from the file system or elsewhere.
 */
public interface GrammarSourceRepository {

    /**
     * Read a grammar file. Never throws; failures come back as {@link ReadResult#failed}.
     */
    ReadResult read(Path path);

    /**
     * Locate the file of a grammar by name, trying {@code basePath/Name.g4} and then
     * {@code basePath/imports/Name.g4}.
     */
    Optional<Path> locate(Path basePath, String grammarName);

    /**
     * Content of a grammar file, or the reason it could not be read.
     */
    record ReadResult(Path path, String content, String error) {

        public static ReadResult ok(Path path, String content) {
            return new ReadResult(path, content, null);
        }

        public static ReadResult failed(Path path, String error) {
            return new ReadResult(path, null, error);
        }

        public boolean isOk() {
            return error == null;
        }
    }
}
