package com.vidnyan.grammarian.domain.simulate;

import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.GrammarKind;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.model.LexerMode;
import com.vidnyan.grammarian.domain.syntax.Atom;
import com.vidnyan.grammarian.domain.syntax.Element;
import com.vidnyan.grammarian.domain.syntax.Quantifier;
import com.vidnyan.grammarian.domain.syntax.Sequence;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maximal munch lexer over the lexer rules of a grammar.
 *
 * At each position every rule of the current mode is tried; the longest match wins and
 * ties go to the rule declared first. Implicit literal tokens of a combined grammar come
 * before all explicit rules.
 */
@Slf4j
public final class LexerSimulator {

    private final List<CompiledLexerRule> rules;
    private final Map<String, String> literalTypes;
    private final List<String> warnings;

    private LexerSimulator(List<CompiledLexerRule> rules, Map<String, String> literalTypes, List<String> warnings) {
        this.rules = List.copyOf(rules);
        this.literalTypes = Map.copyOf(literalTypes);
        this.warnings = List.copyOf(warnings);
    }

    /**
     * Compile the lexer of a grammar.
     */
    public static LexerSimulator forGrammar(Grammar grammar) {
        LexerPatternCompiler compiler = new LexerPatternCompiler(grammar);
        Map<String, String> literalTypes = new LinkedHashMap<>();
        List<CompiledLexerRule> compiled = new ArrayList<>();

        for (GrammarRule rule : grammar.lexerRules()) {
            if (rule.fragment()) {
                continue;
            }
            singleLiteral(rule).ifPresent(value -> literalTypes.putIfAbsent(value, rule.name()));
        }

        if (grammar.kind() != GrammarKind.LEXER) {
            for (GrammarRule rule : grammar.parserRules()) {
                rule.expression().atoms()
                        .filter(a -> a instanceof Atom.Literal)
                        .map(a -> (Atom.Literal) a)
                        .filter(l -> !l.value().isEmpty() && !literalTypes.containsKey(l.value()))
                        .forEach(l -> {
                            literalTypes.put(l.value(), l.raw());
                            compiled.add(new CompiledLexerRule(
                                    l.raw(), List.of(compiler.compileLiteral(l)), LexerMode.DEFAULT_MODE, List.of(), true));
                        });
            }
        }

        for (GrammarRule rule : grammar.lexerRules()) {
            if (rule.fragment()) {
                continue;
            }
            compiler.compileAlternatives(rule).ifPresent(patterns -> compiled.add(new CompiledLexerRule(
                    rule.name(), patterns, rule.mode(), rule.expression().commands(), false)));
        }
        log.debug("Compiled {} lexer rules ({} warnings)", compiled.size(), compiler.warnings().size());
        return new LexerSimulator(compiled, literalTypes, compiler.warnings());
    }

    /**
     * Literal value to token type, for matching literals inside parser rules.
     */
    public Map<String, String> literalTypes() {
        return literalTypes;
    }

    public List<CompiledLexerRule> rules() {
        return rules;
    }

    /**
     * Tokenize input. Unmatched characters are reported and skipped one at a time.
     */
    public TokenizationResult tokenize(String input) {
        String text = input == null ? "" : input;
        List<Token> tokens = new ArrayList<>();
        List<LexError> errors = new ArrayList<>();
        List<String> runWarnings = new ArrayList<>(warnings);
        Deque<String> modeStack = new ArrayDeque<>();
        String mode = LexerMode.DEFAULT_MODE;

        int pos = 0;
        int line = 1;
        int column = 0;
        int moreStart = -1;
        int moreLine = 0;
        int moreColumn = 0;

        while (pos < text.length()) {
            CompiledLexerRule best = null;
            int bestLength = 0;
            for (CompiledLexerRule rule : rules) {
                if (!rule.mode().equals(mode)) {
                    continue;
                }
                int end = rule.longestMatch(text, pos);
                if (end - pos > bestLength) {
                    best = rule;
                    bestLength = end - pos;
                }
            }

            if (best == null) {
                String ch = new String(Character.toChars(text.codePointAt(pos)));
                errors.add(new LexError(pos, line, column, ch,
                        String.format("No lexer rule matches '%s' in mode %s", printable(ch), mode)));
                int width = ch.length();
                if (ch.equals("\n")) {
                    line++;
                    column = 0;
                } else {
                    column += width;
                }
                pos += width;
                continue;
            }

            int start = moreStart >= 0 ? moreStart : pos;
            int startLine = moreStart >= 0 ? moreLine : line;
            int startColumn = moreStart >= 0 ? moreColumn : column;
            int end = pos + bestLength;

            if (best.has("more")) {
                if (moreStart < 0) {
                    moreStart = pos;
                    moreLine = line;
                    moreColumn = column;
                }
            } else {
                tokens.add(new Token(
                        best.tokenType(),
                        text.substring(start, end),
                        best.channel(),
                        best.has("skip"),
                        start,
                        end - 1,
                        startLine,
                        startColumn
                ));
                moreStart = -1;
            }

            if (best.has("popMode")) {
                if (modeStack.isEmpty()) {
                    runWarnings.add(String.format("Rule '%s' pops an empty mode stack at offset %d", best.name(), pos));
                } else {
                    mode = modeStack.pop();
                }
            }
            Optional<String> push = best.argumentOf("pushMode");
            if (push.isPresent()) {
                modeStack.push(mode);
                mode = push.get();
            }
            Optional<String> switchTo = best.argumentOf("mode");
            if (switchTo.isPresent()) {
                mode = switchTo.get();
            }

            for (int i = pos; i < end; i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                    column = 0;
                } else {
                    column++;
                }
            }
            pos = end;
        }

        if (moreStart >= 0) {
            runWarnings.add("Input ended inside a 'more' token starting at offset " + moreStart);
        }
        return new TokenizationResult(tokens, errors, runWarnings);
    }

    /**
     * Value of a rule whose whole body is one literal, e.g. {@code IF : 'if' ;}.
     */
    public static Optional<String> singleLiteral(GrammarRule rule) {
        List<Sequence> alts = rule.expression().alternatives();
        if (alts.size() != 1) {
            return Optional.empty();
        }
        List<Element> elements = alts.get(0).matchable();
        if (elements.size() == 1 && elements.get(0).quantifier() == Quantifier.ONE
                && elements.get(0).atom() instanceof Atom.Literal literal) {
            return Optional.of(literal.value());
        }
        return Optional.empty();
    }

    private static String printable(String ch) {
        return switch (ch) {
            case "\n" -> "\\n";
            case "\r" -> "\\r";
            case "\t" -> "\\t";
            default -> ch;
        };
    }

    /**
     * Convenience for one-off calls.
     */
    public static TokenizationResult tokenize(Grammar grammar, String input) {
        return forGrammar(grammar).tokenize(input);
    }
}
