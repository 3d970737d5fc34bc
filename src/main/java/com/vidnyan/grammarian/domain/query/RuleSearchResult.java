package com.vidnyan.grammarian.domain.query;

import java.util.List;

/**
 * Rule names matching a search, or the reason the pattern was rejected.
 */
public record RuleSearchResult(String pattern, MatchMode mode, List<String> matches, String error) {

    public static RuleSearchResult success(String pattern, MatchMode mode, List<String> matches) {
        return new RuleSearchResult(pattern, mode, List.copyOf(matches), null);
    }

    public static RuleSearchResult error(String pattern, MatchMode mode, String error) {
        return new RuleSearchResult(pattern, mode, List.of(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
