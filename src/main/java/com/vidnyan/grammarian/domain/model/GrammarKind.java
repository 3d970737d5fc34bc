package com.vidnyan.grammarian.domain.model;

/**
 * Grammar flavour taken from the declaration line.
 */
public enum GrammarKind {
    LEXER,
    PARSER,
    COMBINED;

    public boolean allowsLexerRules() {
        return this != PARSER;
    }

    public boolean allowsParserRules() {
        return this != LEXER;
    }
}
