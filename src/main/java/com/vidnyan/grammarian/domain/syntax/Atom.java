package com.vidnyan.grammarian.domain.syntax;

/**
 * Smallest matchable unit of a rule expression.
 */
public interface Atom {

    /**
     * Normalized source text.
     */
    String text();

    record RuleRef(String name) implements Atom {
        @Override
        public String text() {
            return name;
        }
    }

    record Literal(String raw) implements Atom {
        @Override
        public String text() {
            return raw;
        }

        /**
         * Literal content with escapes resolved.
         */
        public String value() {
            String inner = raw.length() >= 2 && raw.endsWith("'") ? raw.substring(1, raw.length() - 1) : raw.substring(1);
            return unescape(inner);
        }
    }

    record CharSet(String raw) implements Atom {
        @Override
        public String text() {
            return raw;
        }

        /**
         * Set content between the brackets, escapes untouched.
         */
        public String content() {
            return raw.length() >= 2 && raw.endsWith("]") ? raw.substring(1, raw.length() - 1) : raw.substring(1);
        }
    }

    record Range(Literal from, Literal to) implements Atom {
        @Override
        public String text() {
            return from.text() + ".." + to.text();
        }
    }

    record Wildcard() implements Atom {
        @Override
        public String text() {
            return ".";
        }
    }

    record Not(Atom inner) implements Atom {
        @Override
        public String text() {
            return "~" + inner.text();
        }
    }

    record Group(Alternation body) implements Atom {
        @Override
        public String text() {
            return "(" + body.text() + ")";
        }
    }

    record Action(String code, boolean predicate) implements Atom {
        @Override
        public String text() {
            return code;
        }
    }

    /**
     * Resolve the escapes the grammar language allows inside literals and sets.
     */
    static String unescape(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != '\\' || i + 1 >= s.length()) {
                sb.append(c);
                continue;
            }
            char e = s.charAt(++i);
            switch (e) {
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'u' -> i = appendUnicode(s, i, sb);
                default -> sb.append(e);
            }
        }
        return sb.toString();
    }

    /**
     * Append the code point of a {@code \\uXXXX} or {@code \\u{X...}} escape whose 'u' sits at
     * {@code i}; returns the index of the last consumed character.
     */
    private static int appendUnicode(String s, int i, StringBuilder sb) {
        int start;
        int end;
        int last;
        if (i + 1 < s.length() && s.charAt(i + 1) == '{') {
            start = i + 2;
            end = s.indexOf('}', start);
            last = end;
        } else {
            start = i + 1;
            end = Math.min(s.length(), i + 5);
            last = end - 1;
        }
        if (end < 0 || end <= start || !isHex(s.substring(start, end))) {
            sb.append('u');
            return i;
        }
        sb.appendCodePoint(Integer.parseInt(s.substring(start, end), 16));
        return last;
    }

    private static boolean isHex(String digits) {
        return !digits.isEmpty() && digits.length() <= 6 && digits.chars().allMatch(ch -> Character.digit(ch, 16) >= 0);
    }
}
