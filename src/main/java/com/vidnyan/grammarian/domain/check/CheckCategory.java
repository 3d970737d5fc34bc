package com.vidnyan.grammarian.domain.check;

/**
 * Families of grammar checks, selected per use case.
 */
public enum CheckCategory {
    VALIDATION,     // Structure, references, recursion, naming
    AMBIGUITY,      // Alternative and lexer rule overlaps
    MODES,          // Lexer mode transitions
    QUALITY         // Quantifier and coverage heuristics
}
