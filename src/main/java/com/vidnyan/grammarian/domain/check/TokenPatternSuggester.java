package com.vidnyan.grammarian.domain.check;

import com.vidnyan.grammarian.domain.model.RuleKind;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Proposes a lexer pattern for an undefined token from its name.
 * More specific name patterns are tried first.
 */
public final class TokenPatternSuggester {

    public record TokenSuggestion(String tokenName, String pattern, String reasoning) {

        public String definition() {
            return tokenName + " : " + pattern + " ;";
        }
    }

    private TokenPatternSuggester() {
    }

    /**
     * A suggestion for names that would be lexer rules; parser rule names get none.
     */
    public static Optional<TokenSuggestion> suggest(String tokenName) {
        if (tokenName == null || tokenName.isEmpty() || RuleKind.classify(tokenName) != RuleKind.LEXER) {
            return Optional.empty();
        }
        if (tokenName.contains("USER")) {
            return of(tokenName, "[a-zA-Z][a-zA-Z0-9_@.-]*", "Usernames may include @ and dots");
        }
        if (tokenName.contains("ADDRESS")) {
            return of(tokenName, "[a-zA-Z0-9][a-zA-Z0-9._-]*", "Addresses can include dots and dashes");
        }
        if (tokenName.contains("INTERFACE")) {
            return of(tokenName, "[a-zA-Z][a-zA-Z0-9_/-]*", "Interface names often include slashes");
        }
        if (tokenName.contains("EVENT")) {
            return of(tokenName, "[a-zA-Z][a-zA-Z0-9_-]*", "Event names are usually alphanumeric");
        }
        if (tokenName.endsWith("_REGEX")) {
            return of(tokenName, "~[ \\t\\r\\n]+", "Regular expressions usually run up to the next whitespace");
        }
        if (tokenName.endsWith("_TYPE")) {
            return of(tokenName, "[a-zA-Z][a-zA-Z0-9_-]*", "Type identifiers are usually alphanumeric with dashes");
        }
        if (tokenName.endsWith("_ID") || tokenName.endsWith("_IDENTIFIER")) {
            return of(tokenName, "[a-zA-Z_][a-zA-Z0-9_]*", "Identifiers start with a letter or underscore");
        }
        return of(tokenName, "[a-zA-Z_][a-zA-Z0-9_-]*", "Generic token pattern");
    }

    public static List<TokenSuggestion> suggestAll(Collection<String> tokenNames) {
        return tokenNames.stream()
                .map(TokenPatternSuggester::suggest)
                .flatMap(Optional::stream)
                .toList();
    }

    private static Optional<TokenSuggestion> of(String name, String pattern, String reasoning) {
        return Optional.of(new TokenSuggestion(name, pattern, reasoning));
    }
}
