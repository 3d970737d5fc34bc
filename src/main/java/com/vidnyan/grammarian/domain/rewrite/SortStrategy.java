package com.vidnyan.grammarian.domain.rewrite;

/**
 * Orderings supported by rule sorting.
 */
public enum SortStrategy {
    ALPHABETICAL,   // parser rules, then lexer rules, each A-Z ignoring case
    TYPE,           // parser/lexer grouping, original order within a group
    DEPENDENCY,     // anchor's dependencies, anchor, dependents, rest A-Z
    USAGE           // most referenced first
}
