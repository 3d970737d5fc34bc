package com.vidnyan.grammarian.domain.syntax;

import java.util.List;
import java.util.stream.Stream;

/**
 * Top-level alternatives of a rule body or group.
 */
public record Alternation(List<Sequence> alternatives) {

    public Alternation {
        alternatives = List.copyOf(alternatives);
    }

    public String text() {
        return String.join(" | ", alternatives.stream().map(Sequence::signature).toList());
    }

    /**
     * Lexer commands of every alternative.
     */
    public List<LexerCommand> commands() {
        return alternatives.stream().flatMap(s -> s.commands().stream()).toList();
    }

    public boolean hasAltLabels() {
        return alternatives.stream().anyMatch(s -> s.altLabel() != null);
    }

    /**
     * All atoms, nested groups included.
     */
    public Stream<Atom> atoms() {
        return alternatives.stream()
                .flatMap(s -> s.elements().stream())
                .flatMap(e -> flatten(e.atom()));
    }

    private static Stream<Atom> flatten(Atom atom) {
        if (atom instanceof Atom.Group g) {
            return Stream.concat(Stream.of(atom), g.body().atoms());
        }
        if (atom instanceof Atom.Not not) {
            return Stream.concat(Stream.of(atom), flatten(not.inner()));
        }
        return Stream.of(atom);
    }
}
