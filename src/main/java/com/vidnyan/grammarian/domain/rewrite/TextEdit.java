package com.vidnyan.grammarian.domain.rewrite;

import java.util.Comparator;
import java.util.List;

/**
 * Replacement of {@code [start, end)} in the original text.
 */
record TextEdit(int start, int end, String replacement) {

    static TextEdit insert(int at, String text) {
        return new TextEdit(at, at, text);
    }

    static TextEdit delete(int start, int end) {
        return new TextEdit(start, end, "");
    }

    /**
     * Apply non-overlapping edits, right to left so earlier offsets stay valid.
     */
    static String apply(String text, List<TextEdit> edits) {
        StringBuilder sb = new StringBuilder(text);
        edits.stream()
                .sorted(Comparator.comparingInt(TextEdit::start).thenComparingInt(TextEdit::end).reversed())
                .forEach(e -> sb.replace(e.start(), e.end(), e.replacement()));
        return sb.toString();
    }
}
