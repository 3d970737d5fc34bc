package com.vidnyan.grammarian.application.port.out;

import java.nio.file.Path;

/**
 * Port for writing grammar files back.
 * Implementations must refuse writes that look like truncation and never throw.
 */
public interface GrammarFileWriter {

    WriteResult write(Path path, String content);

    enum WriteStatus {
        WRITTEN,
        UNCHANGED,
        REFUSED,
        FAILED
    }

    /**
     * Outcome of a write.
     */
    record WriteResult(
        Path path,
        WriteStatus status,
        int oldLineCount,
        int newLineCount,
        String message
    ) {
        public boolean isWritten() {
            return status == WriteStatus.WRITTEN || status == WriteStatus.UNCHANGED;
        }

        public static WriteResult refused(Path path, int oldLines, int newLines, String reason) {
            return new WriteResult(path, WriteStatus.REFUSED, oldLines, newLines, reason);
        }

        public static WriteResult failed(Path path, String reason) {
            return new WriteResult(path, WriteStatus.FAILED, 0, 0, reason);
        }
    }
}
