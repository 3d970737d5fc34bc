package com.vidnyan.grammarian.domain.syntax;

import com.vidnyan.grammarian.domain.syntax.BodyToken.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits comment-free rule text into {@link BodyToken}s.
 */
public final class BodyTokenizer {

    private BodyTokenizer() {
    }

    /**
     * Tokenize {@code text[from, to)}. The text must already have its comments blanked.
     */
    public static List<BodyToken> tokenize(String text, int from, int to) {
        List<BodyToken> tokens = new ArrayList<>();
        int end = Math.min(to, text.length());
        int i = Math.max(0, from);
        while (i < end) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            int start = i;
            Type type;
            if (Character.isLetter(c) || c == '_') {
                while (i < end && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
                    i++;
                }
                type = Type.IDENT;
            } else if (c == '\'') {
                i = Math.min(end, closeOf(text, i, '\'', end));
                type = Type.LITERAL;
            } else if (c == '[') {
                i = Math.min(end, closeOf(text, i, ']', end));
                type = Type.CHAR_SET;
            } else if (c == '{') {
                i = Math.min(end, actionEnd(text, i, end));
                type = Type.ACTION;
                if (i < end && text.charAt(i) == '?') {
                    i++;
                    type = Type.PREDICATE;
                }
            } else if (c == '<') {
                int close = text.indexOf('>', i);
                i = close < 0 || close >= end ? i + 1 : close + 1;
                type = close < 0 || close >= end ? Type.OTHER : Type.ELEMENT_OPTIONS;
            } else if (c == '-' && i + 1 < end && text.charAt(i + 1) == '>') {
                i += 2;
                type = Type.ARROW;
            } else if (c == '.' && i + 1 < end && text.charAt(i + 1) == '.') {
                i += 2;
                type = Type.RANGE;
            } else if (c == '+' && i + 1 < end && text.charAt(i + 1) == '=') {
                i += 2;
                type = Type.PLUS_ASSIGN;
            } else {
                i++;
                type = switch (c) {
                    case '(' -> Type.LPAREN;
                    case ')' -> Type.RPAREN;
                    case '|' -> Type.PIPE;
                    case '?' -> Type.QUESTION;
                    case '*' -> Type.STAR;
                    case '+' -> Type.PLUS;
                    case '~' -> Type.TILDE;
                    case '.' -> Type.DOT;
                    case ':' -> Type.COLON;
                    case ';' -> Type.SEMI;
                    case ',' -> Type.COMMA;
                    case '#' -> Type.HASH;
                    case '=' -> Type.ASSIGN;
                    case '@' -> Type.AT;
                    default -> Type.OTHER;
                };
            }
            tokens.add(new BodyToken(type, text.substring(start, i), start, i));
        }
        return tokens;
    }

    private static int closeOf(String text, int start, char close, int end) {
        int j = start + 1;
        while (j < end) {
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
        return end;
    }

    private static int actionEnd(String text, int start, int end) {
        int depth = 0;
        int j = start;
        while (j < end) {
            char ch = text.charAt(j);
            if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
                if (depth == 0) {
                    return j + 1;
                }
            } else if (ch == '"' || ch == '\'') {
                j = closeOf(text, j, ch, end) - 1;
            }
            j++;
        }
        return end;
    }
}
