package com.vidnyan.grammarian.domain.simulate;

/**
 * Input position no lexer rule could match.
 */
public record LexError(int offset, int line, int column, String character, String message) {}
