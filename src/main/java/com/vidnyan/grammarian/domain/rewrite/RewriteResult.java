package com.vidnyan.grammarian.domain.rewrite;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a text rewrite.
 * On failure {@code content} is the unmodified input, so callers can always write it back.
 */
public record RewriteResult(
    RewriteStatus status,
    String content,
    String message,
    Map<String, Object> stats
) {

    public enum RewriteStatus {
        SUCCESS,
        FAILURE
    }

    public RewriteResult {
        stats = stats == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stats));
    }

    /**
     * Create a successful result.
     */
    public static RewriteResult success(String content, String message, Map<String, Object> stats) {
        return new RewriteResult(RewriteStatus.SUCCESS, content, message, stats);
    }

    public static RewriteResult success(String content, String message) {
        return success(content, message, Map.of());
    }

    /**
     * Create a failed result carrying the original text.
     */
    public static RewriteResult failure(String original, String reason) {
        return new RewriteResult(RewriteStatus.FAILURE, original, reason, Map.of());
    }

    public boolean isSuccess() {
        return status == RewriteStatus.SUCCESS;
    }
}
