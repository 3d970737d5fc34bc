package com.vidnyan.grammarian.domain.scan;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Maps character offsets to 1-based line numbers and back.
 */
public final class LineIndex {

    private final int[] lineStarts;
    private final int length;

    private LineIndex(int[] lineStarts, int length) {
        this.lineStarts = lineStarts;
        this.length = length;
    }

    public static LineIndex of(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return new LineIndex(starts.stream().mapToInt(Integer::intValue).toArray(), text.length());
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Line containing the offset (1-based).
     */
    public int lineOf(int offset) {
        int idx = Arrays.binarySearch(lineStarts, Math.max(0, Math.min(offset, length)));
        return idx >= 0 ? idx + 1 : -idx - 1;
    }

    /**
     * Column of the offset within its line (0-based).
     */
    public int columnOf(int offset) {
        return offset - lineStart(lineOf(offset));
    }

    /**
     * Offset of the first character of a line.
     */
    public int lineStart(int line) {
        return lineStarts[Math.max(0, Math.min(line, lineStarts.length) - 1)];
    }

    /**
     * Offset of the line terminator of a line, or the text length for the last line.
     */
    public int lineEnd(int line) {
        return line < lineStarts.length ? lineStarts[line] - 1 : length;
    }

    /**
     * Offset just past the line terminator, i.e. the start of the next line.
     */
    public int nextLineStart(int line) {
        return line < lineStarts.length ? lineStarts[line] : length;
    }

    public String line(String text, int line) {
        return text.substring(lineStart(line), lineEnd(line));
    }

    public boolean isBlank(String text, int line) {
        return line >= 1 && line <= lineCount() && line(text, line).isBlank();
    }
}
