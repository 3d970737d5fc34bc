package com.vidnyan.grammarian.domain.check;

import com.vidnyan.grammarian.domain.model.Issue;

import java.time.Duration;
import java.util.List;

/**
 * Result of running one check against a grammar.
 */
public record CheckResult(
    String checkName,
    List<Issue> issues,
    Duration executionTime,
    CheckStatus status,
    String errorMessage
) {

    public enum CheckStatus {
        SUCCESS,
        ERROR,
        SKIPPED
    }

    /**
     * Create a successful result.
     */
    public static CheckResult success(String checkName, List<Issue> issues, Duration duration) {
        return new CheckResult(checkName, List.copyOf(issues), duration, CheckStatus.SUCCESS, null);
    }

    /**
     * Create an error result.
     */
    public static CheckResult error(String checkName, String message) {
        return new CheckResult(checkName, List.of(), Duration.ZERO, CheckStatus.ERROR, message);
    }

    /**
     * Create a skipped result.
     */
    public static CheckResult skipped(String checkName, String reason) {
        return new CheckResult(checkName, List.of(), Duration.ZERO, CheckStatus.SKIPPED, reason);
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
