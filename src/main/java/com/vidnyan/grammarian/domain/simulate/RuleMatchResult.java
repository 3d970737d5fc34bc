package com.vidnyan.grammarian.domain.simulate;

import java.util.List;

/**
 * Result of testing a parser rule against input.
 *
 * @param tokensConsumed  longest prefix the rule accepted
 * @param unexpectedToken token at the failure point, null when input ended
 * @param expected        token types acceptable at the failure point
 * @param source          who produced the verdict
 */
public record RuleMatchResult(
    String ruleName,
    MatchOutcome outcome,
    Confidence confidence,
    int tokensConsumed,
    int tokenCount,
    Token unexpectedToken,
    List<String> expected,
    String message,
    List<String> notes,
    Source source
) {

    public enum Source {
        SIMULATION,
        ORACLE
    }

    public RuleMatchResult {
        expected = expected == null ? List.of() : List.copyOf(expected);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public boolean matched() {
        return outcome == MatchOutcome.MATCHED;
    }

    public boolean partialMatch() {
        return outcome == MatchOutcome.PARTIAL;
    }

    /**
     * Result for input the lexer could not fully tokenize.
     */
    public static RuleMatchResult tokenizationFailed(String ruleName, List<LexError> errors, int tokenCount) {
        String detail = errors.stream().limit(3).map(LexError::message).toList().toString();
        return new RuleMatchResult(ruleName, MatchOutcome.MISMATCH, Confidence.HIGH, 0, tokenCount, null,
                List.of(), "Input has tokenization errors: " + detail, List.of(), Source.SIMULATION);
    }

    /**
     * Result for an entry rule that is not a parser rule of the grammar.
     */
    public static RuleMatchResult unknownRule(String ruleName) {
        return new RuleMatchResult(ruleName, MatchOutcome.MISMATCH, Confidence.HIGH, 0, 0, null,
                List.of(), String.format("Parser rule '%s' not found", ruleName), List.of(), Source.SIMULATION);
    }
}
