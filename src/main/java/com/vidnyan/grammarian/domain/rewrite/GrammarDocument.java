package com.vidnyan.grammarian.domain.rewrite;

import com.vidnyan.grammarian.domain.format.FormattingInferencer;
import com.vidnyan.grammarian.domain.model.FormattingStyle;
import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.model.builder.GrammarModelBuilder;
import com.vidnyan.grammarian.domain.scan.LineIndex;
import com.vidnyan.grammarian.domain.scan.ModeSpan;
import com.vidnyan.grammarian.domain.scan.RuleSpan;
import com.vidnyan.grammarian.domain.scan.ScanResult;

import java.util.Optional;

/**
 * A grammar text with its scan, model and style, plus the line arithmetic every rewrite
 * shares.
 */
final class GrammarDocument {

    final String source;
    final ScanResult scan;
    final Grammar grammar;
    final FormattingStyle style;

    private GrammarDocument(String source, ScanResult scan, Grammar grammar, FormattingStyle style) {
        this.source = source;
        this.scan = scan;
        this.grammar = grammar;
        this.style = style;
    }

    static GrammarDocument load(String source, GrammarModelBuilder builder, FormattingInferencer inferencer) {
        String text = source == null ? "" : source;
        ScanResult scan = builder.scanner().scan(text);
        return new GrammarDocument(text, scan, builder.build(scan), inferencer.infer(scan));
    }

    LineIndex lines() {
        return scan.lines();
    }

    Optional<GrammarRule> rule(String name) {
        return grammar.findRule(name);
    }

    String separator() {
        return style.lineSeparator();
    }

    /**
     * Whether nothing but whitespace shares the rule's first and last lines.
     */
    boolean ownsLines(RuleSpan span) {
        LineIndex lines = lines();
        String before = source.substring(lines.lineStart(span.startLine()), span.startOffset());
        String after = scan.cleanSource().substring(span.endOffset(), lines.lineEnd(span.endLine()));
        return before.isBlank() && after.isBlank();
    }

    /**
     * First line of the rule including comment lines directly above it.
     */
    int chunkStartLine(RuleSpan span, int floorLine) {
        int line = span.startLine();
        while (line - 1 > floorLine && isCommentLine(line - 1)) {
            line--;
        }
        return line;
    }

    /**
     * A line holding only a comment.
     */
    boolean isCommentLine(int line) {
        LineIndex lines = lines();
        return !lines.line(source, line).isBlank() && lines.line(scan.cleanSource(), line).isBlank();
    }

    /**
     * Line of the last rule or mode declaration ending before the span, or the header's last line.
     */
    int floorLineBefore(RuleSpan span) {
        int floor = scan.hasDeclaration() ? scan.declarationLine() : 0;
        for (RuleSpan other : scan.rules()) {
            if (other.endOffset() <= span.startOffset()) {
                floor = Math.max(floor, other.endLine());
            }
        }
        for (ModeSpan mode : scan.modes()) {
            if (mode.endOffset() <= span.startOffset()) {
                floor = Math.max(floor, lines().lineOf(mode.startOffset()));
            }
        }
        return floor;
    }

    /**
     * Index of the mode section containing an offset: 0 before the first {@code mode} line.
     */
    int sectionOf(int offset) {
        int section = 0;
        for (ModeSpan mode : scan.modes()) {
            if (mode.startOffset() < offset) {
                section++;
            }
        }
        return section;
    }

    /**
     * Insert a block of lines at a line boundary, adding blank lines around it when the
     * file separates rules with blank lines.
     */
    TextEdit insertBlock(int at, String block) {
        String sep = separator();
        LineIndex lines = lines();
        StringBuilder text = new StringBuilder();
        boolean atEnd = at >= source.length();
        if (atEnd && !source.isEmpty() && !source.endsWith("\n")) {
            text.append(sep);
        }
        int lineAt = lines.lineOf(at);
        int previousLine = atEnd && !source.endsWith("\n") ? lineAt : lineAt - 1;
        boolean previousBlank = previousLine < 1 || lines.isBlank(source, previousLine);
        boolean nextBlank = atEnd || lines.isBlank(source, lineAt);
        if (style.blankLinesBetweenRules() && !previousBlank) {
            text.append(sep);
        }
        text.append(block).append(sep);
        if (style.blankLinesBetweenRules() && !nextBlank) {
            text.append(sep);
        }
        return TextEdit.insert(at, text.toString());
    }

    /**
     * Edit removing a rule: whole lines plus one following blank line when the rule has its
     * lines to itself, otherwise the exact span.
     */
    TextEdit removal(RuleSpan span) {
        if (!ownsLines(span)) {
            return TextEdit.delete(span.startOffset(), span.endOffset());
        }
        LineIndex lines = lines();
        int start = lines.lineStart(span.startLine());
        int end = lines.nextLineStart(span.endLine());
        if (span.endLine() + 1 <= lines.lineCount() && lines.isBlank(source, span.endLine() + 1)
                && end < source.length()) {
            end = lines.nextLineStart(span.endLine() + 1);
        }
        return TextEdit.delete(start, end);
    }
}
