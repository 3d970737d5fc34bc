package com.vidnyan.grammarian.domain.simulate;

/**
 * How far a simulated result can be trusted.
 */
public enum Confidence {
    HIGH,       // Exact, unambiguous consumption or a deterministic mismatch
    MEDIUM,     // Ambiguous match, partial match or approximated constructs
    LOW         // Search limits hit or undefined rules involved
}
