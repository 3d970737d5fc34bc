package com.vidnyan.grammarian.domain.simulate;

/**
 * Outcome of matching a parser rule against a token stream.
 */
public enum MatchOutcome {
    MATCHED,    // Rule consumed the whole input
    PARTIAL,    // Input is a correct prefix, or the rule finished before the input did
    MISMATCH    // A token the rule cannot accept at that point
}
