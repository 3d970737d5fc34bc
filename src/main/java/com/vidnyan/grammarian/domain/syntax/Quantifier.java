package com.vidnyan.grammarian.domain.syntax;

/**
 * Element suffix.
 */
public enum Quantifier {
    ONE(""),
    OPTIONAL("?"),
    STAR("*"),
    PLUS("+");

    private final String suffix;

    Quantifier(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }

    public boolean allowsZero() {
        return this == OPTIONAL || this == STAR;
    }

    public boolean repeats() {
        return this == STAR || this == PLUS;
    }
}
