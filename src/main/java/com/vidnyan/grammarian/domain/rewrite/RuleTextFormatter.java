package com.vidnyan.grammarian.domain.rewrite;

import com.vidnyan.grammarian.domain.model.FormattingStyle;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders rule text in a file's style.
 */
final class RuleTextFormatter {

    private RuleTextFormatter() {
    }

    /**
     * Full rule text without a trailing line separator.
     */
    static String format(FormattingStyle style, String header, String body, String lexerCommand) {
        String sep = style.lineSeparator();
        List<String> bodyLines = bodyLines(body);
        if (lexerCommand != null && !lexerCommand.isBlank()) {
            int last = bodyLines.size() - 1;
            bodyLines.set(last, (bodyLines.get(last) + " -> " + lexerCommand.strip()).strip());
        }

        StringBuilder sb = new StringBuilder(header);
        if (style.colonOnNewLine()) {
            sb.append(sep).append(style.indent()).append(": ").append(bodyLines.get(0));
        } else {
            sb.append(style.spaceBeforeColon() ? " : " : ": ").append(bodyLines.get(0));
        }
        for (int i = 1; i < bodyLines.size(); i++) {
            sb.append(sep).append(style.indent()).append(bodyLines.get(i));
        }
        boolean multiLine = style.colonOnNewLine() || bodyLines.size() > 1;
        if (style.semicolonOnNewLine() && multiLine) {
            sb.append(sep).append(style.indent()).append(';');
        } else {
            sb.append(style.spaceBeforeColon() ? " ;" : ";");
        }
        return sb.toString();
    }

    /**
     * Re-indent a replacement body: the first line stays, later lines get {@code indent}.
     */
    static String reindent(String body, String indent, String sep) {
        List<String> lines = bodyLines(body);
        StringBuilder sb = new StringBuilder(lines.get(0));
        for (int i = 1; i < lines.size(); i++) {
            sb.append(sep).append(indent).append(lines.get(i));
        }
        return sb.toString();
    }

    /**
     * Trimmed non-empty lines of a body; never empty.
     */
    static List<String> bodyLines(String body) {
        List<String> lines = new ArrayList<>();
        for (String line : body.strip().split("\\R")) {
            if (!line.isBlank()) {
                lines.add(line.strip());
            }
        }
        if (lines.isEmpty()) {
            lines.add("");
        }
        return lines;
    }

    /**
     * Collapse whitespace runs to single spaces outside literals and character sets.
     */
    static String collapse(String text) {
        StringBuilder sb = new StringBuilder();
        char close = 0;
        boolean pendingSpace = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (close != 0) {
                sb.append(c);
                if (c == '\\' && i + 1 < text.length()) {
                    sb.append(text.charAt(++i));
                } else if (c == close) {
                    close = 0;
                }
                continue;
            }
            if (Character.isWhitespace(c)) {
                pendingSpace = sb.length() > 0;
                continue;
            }
            if (pendingSpace) {
                sb.append(' ');
                pendingSpace = false;
            }
            sb.append(c);
            if (c == '\'') {
                close = '\'';
            } else if (c == '[') {
                close = ']';
            }
        }
        return sb.toString();
    }
}
