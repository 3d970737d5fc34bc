package com.vidnyan.grammarian.domain.query;

/**
 * How a rule search pattern is interpreted.
 */
public enum MatchMode {
    EXACT,
    REGEX,
    WILDCARD,   // * and ?
    PARTIAL     // case-insensitive substring
}
