package com.vidnyan.grammarian.domain.syntax;

/**
 * An atom with its suffix and optional label ({@code x=ID}).
 */
public record Element(Atom atom, Quantifier quantifier, boolean greedy, String label) {

    public String text() {
        return atom.text() + quantifier.suffix() + (greedy ? "" : "?");
    }

    public boolean isAction() {
        return atom instanceof Atom.Action;
    }

    /**
     * Text of the atom with a single-alternative group unwrapped, so {@code (X)} and
     * {@code X} compare equal.
     */
    public String coreText() {
        if (atom instanceof Atom.Group g && g.body().alternatives().size() == 1) {
            return g.body().alternatives().get(0).signature();
        }
        return atom.text();
    }
}
