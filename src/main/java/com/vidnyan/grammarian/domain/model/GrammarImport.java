package com.vidnyan.grammarian.domain.model;

/**
 * One grammar named in an {@code import} statement.
 */
public record GrammarImport(String name, int lineNumber) {}
