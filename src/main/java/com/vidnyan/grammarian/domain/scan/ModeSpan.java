package com.vidnyan.grammarian.domain.scan;

/**
 * A {@code mode NAME;} declaration.
 */
public record ModeSpan(String name, int startOffset, int endOffset, int line) {}
