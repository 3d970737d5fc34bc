package com.vidnyan.grammarian.domain.model;

/**
 * Issue severity levels.
 */
public enum Severity {
    ERROR,      // Rejected by the ANTLR tool or breaks tokenization
    WARNING,    // Legal but very likely a mistake
    INFO        // Style findings and accepted constructs
}
