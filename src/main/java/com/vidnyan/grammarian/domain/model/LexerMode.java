package com.vidnyan.grammarian.domain.model;

import java.util.List;

/**
 * A lexer mode and the lexer rules declared in it, in declaration order.
 * The implicit default mode has line number 0.
 */
public record LexerMode(String name, int lineNumber, List<String> rules) {

    public static final String DEFAULT_MODE = "DEFAULT_MODE";

    public LexerMode {
        rules = List.copyOf(rules);
    }

    public boolean isDefault() {
        return DEFAULT_MODE.equals(name);
    }
}
