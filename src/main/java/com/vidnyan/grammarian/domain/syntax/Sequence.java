package com.vidnyan.grammarian.domain.syntax;

import java.util.List;

/**
 * One alternative: elements in order, trailing lexer commands and an optional
 * {@code # Label}.
 */
public record Sequence(List<Element> elements, List<LexerCommand> commands, String altLabel) {

    public Sequence {
        elements = List.copyOf(elements);
        commands = List.copyOf(commands);
    }

    /**
     * Elements without actions and predicates.
     */
    public List<Element> matchable() {
        return elements.stream().filter(e -> !e.isAction()).toList();
    }

    /**
     * Whitespace-normalized text ignoring labels, actions and commands.
     */
    public String signature() {
        return String.join(" ", matchable().stream().map(Element::text).toList());
    }
}
