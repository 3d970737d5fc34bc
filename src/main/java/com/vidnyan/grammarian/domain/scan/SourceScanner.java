package com.vidnyan.grammarian.domain.scan;

import com.vidnyan.grammarian.domain.model.GrammarImport;
import com.vidnyan.grammarian.domain.model.GrammarKind;
import com.vidnyan.grammarian.domain.model.Issue;
import com.vidnyan.grammarian.domain.model.LexerMode;
import com.vidnyan.grammarian.domain.model.RuleKind;
import com.vidnyan.grammarian.domain.model.Severity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Comment and literal aware scanner for grammar files.
 *
 * Locates the grammar declaration, imports, options, modes and rule spans without
 * parsing rule bodies. A rule body that runs for more than {@code lineCeiling} lines
 * without a terminating semicolon is cut off and reported instead of scanned further.
 */
@Slf4j
public final class SourceScanner {

    public static final int DEFAULT_LINE_CEILING = 10_000;

    private static final Set<String> RULE_HEADER_KEYWORDS = Set.of("returns", "locals", "options", "throws");

    private final int lineCeiling;

    public SourceScanner() {
        this(DEFAULT_LINE_CEILING);
    }

    public SourceScanner(int lineCeiling) {
        if (lineCeiling < 1) {
            throw new IllegalArgumentException("lineCeiling must be positive: " + lineCeiling);
        }
        this.lineCeiling = lineCeiling;
    }

    /**
     * Scan grammar text.
     */
    public ScanResult scan(String source) {
        String text = source == null ? "" : source;
        String clean = stripComments(text);
        ScanResult result = new Pass(text, clean).run();
        log.debug("Scanned grammar '{}': {} rules, {} modes, {} issues",
                result.grammarName(), result.rules().size(), result.modes().size(), result.issues().size());
        return result;
    }

    /**
     * Blank out comments, keeping offsets and line breaks.
     * Comment markers inside literals, character sets and action strings are left alone.
     */
    public static String stripComments(String text) {
        char[] out = text.toCharArray();
        int n = text.length();
        int i = 0;
        while (i < n) {
            char c = text.charAt(i);
            if (c == '/' && i + 1 < n && text.charAt(i + 1) == '/') {
                i = blankLineComment(text, out, i);
            } else if (c == '/' && i + 1 < n && text.charAt(i + 1) == '*') {
                i = blankBlockComment(text, out, i);
            } else if (c == '\'') {
                i = skipQuoted(text, i, '\'');
            } else if (c == '[') {
                i = skipQuoted(text, i, ']');
            } else if (c == '{') {
                i = skipAction(text, out, i);
            } else {
                i++;
            }
        }
        return new String(out);
    }

    /**
     * Skip a quoted region starting at {@code start}. Stops before a line break when the
     * region is not closed on its own line.
     */
    static int skipQuoted(String text, int start, char close) {
        int n = text.length();
        int j = start + 1;
        while (j < n) {
            char ch = text.charAt(j);
            if (ch == '\\') {
                j += 2;
            } else if (ch == close) {
                return j + 1;
            } else if (ch == '\n') {
                return j;
            } else {
                j++;
            }
        }
        return n;
    }

    /**
     * Skip a brace-balanced action. When {@code out} is non-null, comments inside the
     * action are blanked as well.
     */
    static int skipAction(String text, char[] out, int start) {
        int n = text.length();
        int depth = 0;
        int j = start;
        while (j < n) {
            char ch = text.charAt(j);
            if (ch == '{') {
                depth++;
                j++;
            } else if (ch == '}') {
                depth--;
                j++;
                if (depth == 0) {
                    return j;
                }
            } else if (ch == '"' || ch == '\'') {
                j = skipQuoted(text, j, ch);
            } else if (ch == '/' && j + 1 < n && text.charAt(j + 1) == '/') {
                j = out != null ? blankLineComment(text, out, j) : skipToLineEnd(text, j);
            } else if (ch == '/' && j + 1 < n && text.charAt(j + 1) == '*') {
                j = out != null ? blankBlockComment(text, out, j) : skipBlockComment(text, j);
            } else {
                j++;
            }
        }
        return n;
    }

    private static int blankLineComment(String text, char[] out, int start) {
        int j = start;
        while (j < text.length() && text.charAt(j) != '\n') {
            out[j] = ' ';
            j++;
        }
        return j;
    }

    private static int blankBlockComment(String text, char[] out, int start) {
        int end = skipBlockComment(text, start);
        for (int j = start; j < end; j++) {
            char ch = text.charAt(j);
            if (ch != '\n' && ch != '\r') {
                out[j] = ' ';
            }
        }
        return end;
    }

    private static int skipToLineEnd(String text, int start) {
        int idx = text.indexOf('\n', start);
        return idx < 0 ? text.length() : idx;
    }

    private static int skipBlockComment(String text, int start) {
        int idx = text.indexOf("*/", start + 2);
        return idx < 0 ? text.length() : idx + 2;
    }

    static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    /**
     * One scan over the comment-free text.
     */
    private final class Pass {

        private final String text;
        private final String clean;
        private final int n;
        private final LineIndex lines;

        private int pos;
        private String currentMode = LexerMode.DEFAULT_MODE;
        private String grammarName;
        private GrammarKind grammarKind;
        private int declarationLine;
        private int headerEnd = -1;
        private final List<GrammarImport> imports = new ArrayList<>();
        private final Map<String, String> options = new LinkedHashMap<>();
        private final List<String> tokens = new ArrayList<>();
        private final List<String> channels = new ArrayList<>();
        private final List<RuleSpan> rules = new ArrayList<>();
        private final List<ModeSpan> modes = new ArrayList<>();
        private final List<Issue> issues = new ArrayList<>();

        Pass(String text, String clean) {
            this.text = text;
            this.clean = clean;
            this.n = clean.length();
            this.lines = LineIndex.of(text);
        }

        ScanResult run() {
            while (true) {
                skipWhitespace();
                if (pos >= n) {
                    break;
                }
                char c = clean.charAt(pos);
                if (c == '@') {
                    skipNamedAction();
                    continue;
                }
                if (!isIdentStart(c)) {
                    pos++;
                    continue;
                }
                int wordStart = pos;
                String word = readIdent();
                if (peekNonWhitespace() == ':') {
                    scanRule(wordStart, wordStart, word, false);
                    continue;
                }
                switch (word) {
                    case "lexer", "parser" -> readDeclaration(wordStart, word);
                    case "grammar" -> readDeclaration(wordStart, null);
                    case "import" -> readImports(wordStart);
                    case "options" -> readOptions();
                    case "tokens" -> tokens.addAll(readNameBlock());
                    case "channels" -> channels.addAll(readNameBlock());
                    case "mode" -> readMode(wordStart);
                    case "catch", "finally" -> skipExceptionHandler();
                    case "fragment" -> {
                        skipWhitespace();
                        if (pos < n && isIdentStart(clean.charAt(pos))) {
                            int nameStart = pos;
                            String name = readIdent();
                            scanRule(wordStart, nameStart, name, true);
                        }
                    }
                    default -> scanRule(wordStart, wordStart, word, false);
                }
            }
            return new ScanResult(
                    text,
                    clean,
                    lines,
                    grammarName,
                    grammarKind,
                    declarationLine,
                    List.copyOf(imports),
                    Collections.unmodifiableMap(new LinkedHashMap<>(options)),
                    List.copyOf(tokens),
                    List.copyOf(channels),
                    List.copyOf(rules),
                    List.copyOf(modes),
                    List.copyOf(issues),
                    headerEnd < 0 ? n : headerEnd
            );
        }

        private void readDeclaration(int start, String kindWord) {
            if (kindWord != null) {
                skipWhitespace();
                if (!"grammar".equals(readIdent())) {
                    return;
                }
            }
            skipWhitespace();
            String name = readIdent();
            skipWhitespace();
            if (pos < n && clean.charAt(pos) == ';') {
                pos++;
            }
            if (grammarName != null || name.isEmpty()) {
                return;
            }
            grammarName = name;
            declarationLine = lines.lineOf(start);
            if (kindWord == null) {
                grammarKind = GrammarKind.COMBINED;
            } else {
                grammarKind = "lexer".equals(kindWord) ? GrammarKind.LEXER : GrammarKind.PARSER;
            }
        }

        private void readImports(int start) {
            int semi = clean.indexOf(';', pos);
            int end = semi < 0 ? n : semi;
            int line = lines.lineOf(start);
            for (String part : clean.substring(pos, end).split(",")) {
                String name = part.trim();
                int eq = name.indexOf('=');
                if (eq >= 0) {
                    name = name.substring(eq + 1).trim();
                }
                if (!name.isEmpty()) {
                    imports.add(new GrammarImport(name, line));
                }
            }
            pos = semi < 0 ? n : semi + 1;
        }

        private void readOptions() {
            skipWhitespace();
            if (pos >= n || clean.charAt(pos) != '{') {
                return;
            }
            int end = skipAction(clean, null, pos);
            String body = clean.substring(pos + 1, Math.max(pos + 1, end - 1));
            for (String entry : body.split(";")) {
                int eq = entry.indexOf('=');
                if (eq > 0) {
                    String key = entry.substring(0, eq).trim();
                    String value = entry.substring(eq + 1).trim();
                    if (value.length() >= 2 && value.startsWith("'") && value.endsWith("'")) {
                        value = value.substring(1, value.length() - 1);
                    }
                    options.put(key, value);
                }
            }
            pos = end;
        }

        private List<String> readNameBlock() {
            skipWhitespace();
            if (pos >= n || clean.charAt(pos) != '{') {
                return List.of();
            }
            int end = skipAction(clean, null, pos);
            List<String> names = new ArrayList<>();
            for (String part : clean.substring(pos + 1, Math.max(pos + 1, end - 1)).split(",")) {
                String name = part.trim();
                if (!name.isEmpty()) {
                    names.add(name);
                }
            }
            pos = end;
            return names;
        }

        private void readMode(int start) {
            skipWhitespace();
            String name = readIdent();
            skipWhitespace();
            if (pos < n && clean.charAt(pos) == ';') {
                pos++;
            }
            if (name.isEmpty()) {
                return;
            }
            markHeaderEnd(start);
            modes.add(new ModeSpan(name, start, pos, lines.lineOf(start)));
            currentMode = name;
        }

        private void skipNamedAction() {
            pos++;
            readIdent();
            if (pos + 1 < n && clean.charAt(pos) == ':' && clean.charAt(pos + 1) == ':') {
                pos += 2;
                readIdent();
            }
            skipWhitespace();
            if (pos < n && clean.charAt(pos) == '{') {
                pos = skipAction(clean, null, pos);
            }
        }

        private void skipExceptionHandler() {
            skipWhitespace();
            if (pos < n && clean.charAt(pos) == '[') {
                pos = skipQuoted(clean, pos, ']');
                skipWhitespace();
            }
            if (pos < n && clean.charAt(pos) == '{') {
                pos = skipAction(clean, null, pos);
            }
        }

        private void scanRule(int startOffset, int nameOffset, String name, boolean fragment) {
            int nameLine = lines.lineOf(nameOffset);
            if (!scanRuleHeader(name, nameLine)) {
                return;
            }
            int colon = pos;
            pos++;
            markHeaderEnd(startOffset);

            int line = lines.lineOf(pos);
            while (pos < n) {
                if (line - nameLine >= lineCeiling) {
                    int limitLine = nameLine + lineCeiling - 1;
                    int end = lines.lineEnd(limitLine);
                    issues.add(Issue.builder()
                            .severity(Severity.ERROR)
                            .type("missing-semicolon")
                            .message(String.format("Rule '%s' appears to be missing a semicolon "
                                    + "(no ';' within %d lines)", name, lineCeiling))
                            .ruleName(name)
                            .lineNumber(nameLine)
                            .suggestion("Terminate the rule with ';'")
                            .build());
                    addRule(name, fragment, startOffset, nameOffset, colon, end, nameLine, false);
                    pos = lines.nextLineStart(limitLine);
                    return;
                }
                char c = clean.charAt(pos);
                switch (c) {
                    case ';' -> {
                        pos++;
                        addRule(name, fragment, startOffset, nameOffset, colon, pos, nameLine, true);
                        return;
                    }
                    case '\n' -> {
                        line++;
                        pos++;
                    }
                    case '\'' -> pos = skipQuoted(clean, pos, '\'');
                    case '[' -> pos = skipQuoted(clean, pos, ']');
                    case '{' -> {
                        pos = skipAction(clean, null, pos);
                        line = lines.lineOf(pos);
                    }
                    default -> pos++;
                }
            }
            issues.add(Issue.builder()
                    .severity(Severity.ERROR)
                    .type("missing-semicolon")
                    .message(String.format("Rule '%s' is not terminated by ';' before end of file", name))
                    .ruleName(name)
                    .lineNumber(nameLine)
                    .suggestion("Terminate the rule with ';'")
                    .build());
            addRule(name, fragment, startOffset, nameOffset, colon, n, nameLine, false);
        }

        /**
         * Walk the part between rule name and colon ({@code returns}, {@code locals},
         * {@code options}, {@code @init} ...). Leaves {@code pos} on the colon when one is found.
         */
        private boolean scanRuleHeader(String name, int nameLine) {
            boolean inThrows = false;
            while (true) {
                skipWhitespace();
                if (pos >= n) {
                    return false;
                }
                char c = clean.charAt(pos);
                if (c == ':') {
                    return true;
                }
                if (c == '[') {
                    pos = skipQuoted(clean, pos, ']');
                } else if (c == '{') {
                    pos = skipAction(clean, null, pos);
                } else if (c == '@') {
                    pos++;
                    readIdent();
                } else if (c == ',' && inThrows) {
                    pos++;
                } else if (isIdentStart(c)) {
                    int identStart = pos;
                    String word = readIdent();
                    if (RULE_HEADER_KEYWORDS.contains(word)) {
                        inThrows = "throws".equals(word);
                    } else if (!inThrows) {
                        unrecognized(name, nameLine);
                        pos = identStart;
                        return false;
                    }
                } else {
                    unrecognized(name, nameLine);
                    pos++;
                    return false;
                }
            }
        }

        private void unrecognized(String word, int line) {
            issues.add(Issue.builder()
                    .severity(Severity.WARNING)
                    .type("unrecognized-content")
                    .message(String.format("'%s' does not start a rule, declaration or mode", word))
                    .lineNumber(line)
                    .build());
        }

        private void addRule(String name, boolean fragment, int start, int nameOffset, int colon,
                             int end, int nameLine, boolean terminated) {
            String mode = RuleKind.classify(name) == RuleKind.LEXER ? currentMode : null;
            rules.add(new RuleSpan(
                    name,
                    fragment,
                    mode,
                    start,
                    nameOffset,
                    colon,
                    end,
                    lines.lineOf(start),
                    nameLine,
                    lines.lineOf(Math.max(start, end - 1)),
                    terminated
            ));
        }

        private void markHeaderEnd(int offset) {
            if (headerEnd < 0) {
                headerEnd = offset;
            }
        }

        private void skipWhitespace() {
            while (pos < n && Character.isWhitespace(clean.charAt(pos))) {
                pos++;
            }
        }

        private char peekNonWhitespace() {
            int j = pos;
            while (j < n && Character.isWhitespace(clean.charAt(j))) {
                j++;
            }
            return j < n ? clean.charAt(j) : 0;
        }

        private String readIdent() {
            int start = pos;
            while (pos < n && isIdentPart(clean.charAt(pos))) {
                pos++;
            }
            return clean.substring(start, pos);
        }
    }
}
