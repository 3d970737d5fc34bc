package com.vidnyan.grammarian.domain.simulate;

import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.syntax.Alternation;
import com.vidnyan.grammarian.domain.syntax.Atom;
import com.vidnyan.grammarian.domain.syntax.Element;
import com.vidnyan.grammarian.domain.syntax.Quantifier;
import com.vidnyan.grammarian.domain.syntax.Sequence;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Translates lexer rule expressions into {@link Pattern}s.
 * References to other lexer rules and fragments are expanded inline.
 */
@Slf4j
public final class LexerPatternCompiler {

    private final Map<String, GrammarRule> lexerRules = new LinkedHashMap<>();
    private final Map<String, String> regexCache = new HashMap<>();
    private final Deque<String> inProgress = new ArrayDeque<>();
    private final List<String> warnings = new ArrayList<>();
    private final int flags;

    public LexerPatternCompiler(Grammar grammar) {
        grammar.lexerRules().forEach(r -> lexerRules.put(r.name(), r));
        boolean caseInsensitive = "true".equalsIgnoreCase(grammar.options().get("caseInsensitive"));
        this.flags = caseInsensitive ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE : 0;
    }

    /**
     * Compile a lexer rule, or return empty with a warning when its pattern uses constructs
     * outside the supported subset.
     */
    public Optional<Pattern> compile(GrammarRule rule) {
        try {
            return Optional.of(Pattern.compile(regexOf(rule), flags));
        } catch (UnsupportedPatternException | PatternSyntaxException e) {
            String warning = String.format("Rule '%s' cannot be simulated: %s", rule.name(), e.getMessage());
            log.debug(warning);
            warnings.add(warning);
            return Optional.empty();
        }
    }

    /**
     * Compile each top-level alternative of a lexer rule on its own, so the caller can keep
     * the longest match across alternatives instead of the first one the regex engine takes.
     */
    public Optional<List<Pattern>> compileAlternatives(GrammarRule rule) {
        try {
            List<Pattern> patterns = new ArrayList<>();
            for (Sequence alt : rule.expression().alternatives()) {
                inProgress.push(rule.name());
                try {
                    patterns.add(Pattern.compile(sequence(alt), flags));
                } finally {
                    inProgress.pop();
                }
            }
            return Optional.of(List.copyOf(patterns));
        } catch (UnsupportedPatternException | PatternSyntaxException e) {
            String warning = String.format("Rule '%s' cannot be simulated: %s", rule.name(), e.getMessage());
            log.debug(warning);
            warnings.add(warning);
            return Optional.empty();
        }
    }

    /**
     * Compile a single literal, used for implicit tokens.
     */
    public Pattern compileLiteral(Atom.Literal literal) {
        return Pattern.compile(Pattern.quote(literal.value()), flags);
    }

    public List<String> warnings() {
        return List.copyOf(warnings);
    }

    private String regexOf(GrammarRule rule) {
        String cached = regexCache.get(rule.name());
        if (cached != null) {
            return cached;
        }
        if (inProgress.contains(rule.name())) {
            throw new UnsupportedPatternException("recursive reference to '" + rule.name() + "'");
        }
        inProgress.push(rule.name());
        try {
            String regex = alternation(rule.expression());
            regexCache.put(rule.name(), regex);
            return regex;
        } finally {
            inProgress.pop();
        }
    }

    private String alternation(Alternation alternation) {
        List<Sequence> alts = alternation.alternatives();
        if (alts.size() == 1) {
            return sequence(alts.get(0));
        }
        if (alts.stream().allMatch(LexerPatternCompiler::isPlainLiteral)) {
            // longest literal first, so a nested group prefers '==' over '='
            alts = alts.stream()
                    .sorted(Comparator.comparingInt((Sequence alt) -> literalOf(alt).length()).reversed())
                    .toList();
        }
        List<String> parts = alts.stream().map(this::sequence).toList();
        return "(?:" + String.join("|", parts) + ")";
    }

    private static boolean isPlainLiteral(Sequence alt) {
        return alt.elements().size() == 1
                && alt.elements().get(0).quantifier() == Quantifier.ONE
                && alt.elements().get(0).atom() instanceof Atom.Literal;
    }

    private static String literalOf(Sequence alt) {
        return ((Atom.Literal) alt.elements().get(0).atom()).value();
    }

    private String sequence(Sequence sequence) {
        StringBuilder sb = new StringBuilder();
        for (Element element : sequence.elements()) {
            sb.append(element(element));
        }
        return sb.toString();
    }

    private String element(Element element) {
        String atom = atom(element.atom());
        if (element.quantifier() == Quantifier.ONE || atom.isEmpty()) {
            return atom;
        }
        return "(?:" + atom + ")" + element.quantifier().suffix() + (element.greedy() ? "" : "?");
    }

    private String atom(Atom atom) {
        if (atom instanceof Atom.Literal literal) {
            String value = literal.value();
            return value.isEmpty() ? "" : Pattern.quote(value);
        }
        if (atom instanceof Atom.CharSet set) {
            String items = setItems(set.content());
            return items.isEmpty() ? "(?!)" : "[" + items + "]";
        }
        if (atom instanceof Atom.Range range) {
            return "[" + rangeItem(range) + "]";
        }
        if (atom instanceof Atom.Wildcard) {
            return "[\\s\\S]";
        }
        if (atom instanceof Atom.Not not) {
            return "[^" + negatedItems(not.inner()) + "]";
        }
        if (atom instanceof Atom.Group group) {
            return "(?:" + alternation(group.body()) + ")";
        }
        if (atom instanceof Atom.Action) {
            return "";
        }
        if (atom instanceof Atom.RuleRef ref) {
            GrammarRule target = lexerRules.get(ref.name());
            if (target == null) {
                throw new UnsupportedPatternException("reference to unknown lexer rule '" + ref.name() + "'");
            }
            return "(?:" + regexOf(target) + ")";
        }
        throw new UnsupportedPatternException("unsupported element " + atom.text());
    }

    /**
     * Class items for the operand of {@code ~}.
     */
    private String negatedItems(Atom inner) {
        if (inner instanceof Atom.CharSet set) {
            return setItems(set.content());
        }
        if (inner instanceof Atom.Range range) {
            return rangeItem(range);
        }
        if (inner instanceof Atom.Literal literal && literal.value().codePointCount(0, literal.value().length()) == 1) {
            return codePoint(literal.value().codePointAt(0));
        }
        if (inner instanceof Atom.Group group) {
            StringBuilder sb = new StringBuilder();
            for (Sequence alt : group.body().alternatives()) {
                if (alt.elements().size() != 1 || alt.elements().get(0).quantifier() != Quantifier.ONE) {
                    throw new UnsupportedPatternException("negated group must list single characters or sets");
                }
                sb.append(negatedItems(alt.elements().get(0).atom()));
            }
            return sb.toString();
        }
        if (inner instanceof Atom.RuleRef ref && lexerRules.containsKey(ref.name())) {
            Alternation body = lexerRules.get(ref.name()).expression();
            if (body.alternatives().size() == 1 && body.alternatives().get(0).elements().size() == 1) {
                return negatedItems(body.alternatives().get(0).elements().get(0).atom());
            }
        }
        throw new UnsupportedPatternException("cannot negate " + inner.text());
    }

    private String rangeItem(Atom.Range range) {
        String from = range.from().value();
        String to = range.to().value();
        if (from.isEmpty() || to.isEmpty()) {
            throw new UnsupportedPatternException("empty range bound in " + range.text());
        }
        return codePoint(from.codePointAt(0)) + "-" + codePoint(to.codePointAt(0));
    }

    /**
     * Translate the inside of a {@code [...]} set into regex class items.
     */
    static String setItems(String content) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '\\' && i + 2 < content.length()
                    && (content.charAt(i + 1) == 'p' || content.charAt(i + 1) == 'P')
                    && content.charAt(i + 2) == '{') {
                int close = content.indexOf('}', i);
                if (close < 0) {
                    throw new UnsupportedPatternException("unterminated property class in [" + content + "]");
                }
                sb.append(content, i, close + 1);
                i = close + 1;
                continue;
            }
            int[] lo = readSetChar(content, i);
            i = lo[1];
            if (i + 1 < content.length() && content.charAt(i) == '-') {
                int[] hi = readSetChar(content, i + 1);
                sb.append(codePoint(lo[0])).append('-').append(codePoint(hi[0]));
                i = hi[1];
            } else {
                sb.append(codePoint(lo[0]));
            }
        }
        return sb.toString();
    }

    /**
     * Read one possibly escaped character; returns {codePoint, nextIndex}.
     */
    private static int[] readSetChar(String s, int i) {
        char c = s.charAt(i);
        if (c != '\\' || i + 1 >= s.length()) {
            int cp = s.codePointAt(i);
            return new int[]{cp, i + Character.charCount(cp)};
        }
        char e = s.charAt(i + 1);
        switch (e) {
            case 'n':
                return new int[]{'\n', i + 2};
            case 'r':
                return new int[]{'\r', i + 2};
            case 't':
                return new int[]{'\t', i + 2};
            case 'b':
                return new int[]{'\b', i + 2};
            case 'f':
                return new int[]{'\f', i + 2};
            case 'u':
                if (i + 2 < s.length() && s.charAt(i + 2) == '{') {
                    int close = s.indexOf('}', i);
                    if (close > 0) {
                        return new int[]{parseHex(s.substring(i + 3, close)), close + 1};
                    }
                }
                if (i + 6 <= s.length()) {
                    return new int[]{parseHex(s.substring(i + 2, i + 6)), i + 6};
                }
                throw new UnsupportedPatternException("malformed unicode escape in set");
            default:
                return new int[]{e, i + 2};
        }
    }

    private static int parseHex(String digits) {
        try {
            return Integer.parseInt(digits, 16);
        } catch (NumberFormatException e) {
            throw new UnsupportedPatternException("malformed unicode escape '" + digits + "'");
        }
    }

    private static String codePoint(int cp) {
        return "\\x{" + Integer.toHexString(cp) + "}";
    }

    /**
     * Raised for lexer constructs outside the simulated subset.
     */
    static class UnsupportedPatternException extends RuntimeException {
        UnsupportedPatternException(String message) {
            super(message);
        }
    }
}
