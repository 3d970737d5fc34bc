package com.vidnyan.grammarian.domain.syntax;

/**
 * A lexer command written after {@code ->}, e.g. {@code skip} or {@code pushMode(STRING)}.
 */
public record LexerCommand(String name, String argument) {

    public boolean is(String commandName) {
        return name.equals(commandName);
    }

    public String text() {
        return argument == null ? name : name + "(" + argument + ")";
    }
}
