package com.vidnyan.grammarian.domain.simulate;

import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.model.RuleKind;
import com.vidnyan.grammarian.domain.syntax.Alternation;
import com.vidnyan.grammarian.domain.syntax.Atom;
import com.vidnyan.grammarian.domain.syntax.Element;
import com.vidnyan.grammarian.domain.syntax.Sequence;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Bounded-depth matcher for parser rules.
 *
 * Every expression is evaluated to the set of token positions where it can end, so
 * alternatives are explored without committing. Left-recursive rules are handled by
 * growing a seed result until it stops changing.
 */
@Slf4j
public final class ParserRuleSimulator {

    public static final int DEFAULT_MAX_DEPTH = 64;
    public static final int DEFAULT_STEP_BUDGET = 200_000;

    private final Grammar grammar;
    private final Map<String, String> literalTypes;
    private final int maxDepth;
    private final int stepBudget;

    public ParserRuleSimulator(Grammar grammar, Map<String, String> literalTypes) {
        this(grammar, literalTypes, DEFAULT_MAX_DEPTH, DEFAULT_STEP_BUDGET);
    }

    public ParserRuleSimulator(Grammar grammar, Map<String, String> literalTypes, int maxDepth, int stepBudget) {
        this.grammar = grammar;
        this.literalTypes = literalTypes;
        this.maxDepth = maxDepth;
        this.stepBudget = stepBudget;
    }

    /**
     * Match a parser rule against tokens the parser would see.
     */
    public RuleMatchResult match(String ruleName, List<Token> tokens) {
        Optional<GrammarRule> rule = grammar.findRule(ruleName).filter(GrammarRule::isParser);
        if (rule.isEmpty()) {
            return RuleMatchResult.unknownRule(ruleName);
        }
        Run run = new Run(tokens);
        Set<Integer> ends = run.matchRule(rule.get(), 0, 0);
        int n = tokens.size();

        long completeAlternatives = rule.get().expression().alternatives().stream()
                .filter(alt -> run.matchSequence(alt, 0, 0).contains(n))
                .count();
        return run.result(ruleName, ends, completeAlternatives > 1);
    }

    /**
     * State of one match call.
     */
    private final class Run {

        private final List<Token> tokens;
        private final int n;
        private final Map<String, Set<Integer>> completed = new HashMap<>();
        private final Map<String, Set<Integer>> inProgress = new HashMap<>();
        private final Deque<Set<String>> seedReads = new ArrayDeque<>();
        private final Set<String> notes = new LinkedHashSet<>();
        private final Set<String> undefined = new LinkedHashSet<>();
        private final Set<String> expected = new TreeSet<>();
        private int furthestFailure = -1;
        private int furthestConsumed;
        private int steps;
        private boolean limited;
        private boolean heuristic;

        Run(List<Token> tokens) {
            this.tokens = tokens;
            this.n = tokens.size();
        }

        Set<Integer> matchRule(GrammarRule rule, int pos, int depth) {
            String key = rule.name() + "@" + pos;
            Set<Integer> done = completed.get(key);
            if (done != null) {
                return done;
            }
            Set<Integer> seed = inProgress.get(key);
            if (seed != null) {
                if (!seedReads.isEmpty()) {
                    seedReads.peek().add(key);
                }
                return seed;
            }
            if (depth > maxDepth) {
                limited = true;
                notes.add("Rule nesting deeper than " + maxDepth + " was cut off");
                return Set.of();
            }

            inProgress.put(key, Set.of());
            seedReads.push(new HashSet<>());
            Set<Integer> result = Set.of();
            while (!limited) {
                Set<Integer> next = matchAlternation(rule.expression(), pos, depth + 1);
                if (result.containsAll(next)) {
                    break;
                }
                Set<Integer> grown = new TreeSet<>(result);
                grown.addAll(next);
                result = Collections.unmodifiableSet(grown);
                inProgress.put(key, result);
            }
            inProgress.remove(key);
            Set<String> reads = seedReads.pop();
            reads.remove(key);
            if (reads.isEmpty()) {
                completed.put(key, result);
            } else if (!seedReads.isEmpty()) {
                seedReads.peek().addAll(reads);
            }
            return result;
        }

        Set<Integer> matchAlternation(Alternation alternation, int pos, int depth) {
            Set<Integer> ends = new TreeSet<>();
            for (Sequence alt : alternation.alternatives()) {
                ends.addAll(matchSequence(alt, pos, depth));
            }
            return ends;
        }

        Set<Integer> matchSequence(Sequence sequence, int pos, int depth) {
            Set<Integer> current = Set.of(pos);
            for (Element element : sequence.elements()) {
                Set<Integer> next = new TreeSet<>();
                for (int p : current) {
                    next.addAll(matchElement(element, p, depth));
                }
                if (next.isEmpty()) {
                    return Set.of();
                }
                current = next;
            }
            return current;
        }

        private Set<Integer> matchElement(Element element, int pos, int depth) {
            return switch (element.quantifier()) {
                case ONE -> matchAtom(element.atom(), pos, depth);
                case OPTIONAL -> {
                    Set<Integer> ends = new TreeSet<>(matchAtom(element.atom(), pos, depth));
                    ends.add(pos);
                    yield ends;
                }
                case STAR -> closure(element.atom(), Set.of(pos), depth);
                case PLUS -> closure(element.atom(), matchAtom(element.atom(), pos, depth), depth);
            };
        }

        private Set<Integer> closure(Atom atom, Set<Integer> start, int depth) {
            Set<Integer> result = new TreeSet<>(start);
            Set<Integer> frontier = new TreeSet<>(start);
            while (!frontier.isEmpty() && !limited) {
                Set<Integer> next = new TreeSet<>();
                for (int p : frontier) {
                    for (int end : matchAtom(atom, p, depth)) {
                        if (result.add(end)) {
                            next.add(end);
                        }
                    }
                }
                frontier = next;
            }
            return result;
        }

        private Set<Integer> matchAtom(Atom atom, int pos, int depth) {
            if (++steps > stepBudget) {
                if (!limited) {
                    notes.add("Search budget of " + stepBudget + " steps exhausted");
                }
                limited = true;
                return Set.of();
            }
            if (atom instanceof Atom.RuleRef ref) {
                return matchReference(ref.name(), pos, depth);
            }
            if (atom instanceof Atom.Literal literal) {
                return terminal(pos, literal.raw(), t -> literalMatches(literal, t));
            }
            if (atom instanceof Atom.Wildcard) {
                return terminal(pos, "any token", t -> true);
            }
            if (atom instanceof Atom.Not not) {
                if (pos >= n) {
                    return fail(pos, atom.text());
                }
                boolean excluded = singleTokenMatch(not.inner(), pos, depth);
                return excluded ? fail(pos, atom.text()) : consume(pos);
            }
            if (atom instanceof Atom.Group group) {
                return matchAlternation(group.body(), pos, depth);
            }
            if (atom instanceof Atom.Action action) {
                if (action.predicate()) {
                    heuristic = true;
                    notes.add("Semantic predicates are assumed to be true");
                }
                return Set.of(pos);
            }
            heuristic = true;
            notes.add("Element " + atom.text() + " is not valid in a parser rule and never matches");
            return Set.of();
        }

        private Set<Integer> matchReference(String name, int pos, int depth) {
            if ("EOF".equals(name)) {
                return pos == n ? Set.of(pos) : fail(pos, "EOF");
            }
            if (RuleKind.classify(name) == RuleKind.LEXER) {
                return terminal(pos, name, t -> t.type().equals(name));
            }
            Optional<GrammarRule> target = grammar.findRule(name);
            if (target.isEmpty()) {
                if (undefined.add(name)) {
                    notes.add("Rule '" + name + "' is not defined and never matches");
                }
                return Set.of();
            }
            return matchRule(target.get(), pos, depth);
        }

        private boolean singleTokenMatch(Atom atom, int pos, int depth) {
            return matchAtom(atom, pos, depth).contains(pos + 1);
        }

        private boolean literalMatches(Atom.Literal literal, Token token) {
            String mapped = literalTypes.get(literal.value());
            if (mapped != null) {
                return token.type().equals(mapped);
            }
            if (token.text().equals(literal.value())) {
                heuristic = true;
                notes.add("Literal " + literal.raw() + " has no token type; matched by text");
                return true;
            }
            return false;
        }

        private Set<Integer> terminal(int pos, String expectedName, Predicate<Token> test) {
            if (pos < n && test.test(tokens.get(pos))) {
                return consume(pos);
            }
            return fail(pos, expectedName);
        }

        private Set<Integer> consume(int pos) {
            furthestConsumed = Math.max(furthestConsumed, pos + 1);
            return Set.of(pos + 1);
        }

        private Set<Integer> fail(int pos, String expectedName) {
            if (pos > furthestFailure) {
                furthestFailure = pos;
                expected.clear();
            }
            if (pos == furthestFailure) {
                expected.add(expectedName);
            }
            return Set.of();
        }

        RuleMatchResult result(String ruleName, Set<Integer> ends, boolean ambiguous) {
            List<String> noteList = new ArrayList<>(notes);
            boolean weak = limited || !undefined.isEmpty();

            if (ends.contains(n)) {
                Confidence confidence = weak ? Confidence.LOW
                        : (heuristic || ambiguous) ? Confidence.MEDIUM : Confidence.HIGH;
                if (ambiguous) {
                    noteList.add("More than one alternative of '" + ruleName + "' matches the whole input");
                }
                return new RuleMatchResult(ruleName, MatchOutcome.MATCHED, confidence, n, n, null, List.of(),
                        String.format("Rule '%s' matched all %d tokens", ruleName, n), noteList,
                        RuleMatchResult.Source.SIMULATION);
            }

            Confidence failureConfidence = weak ? Confidence.LOW : heuristic ? Confidence.MEDIUM : Confidence.HIGH;
            int longestEnd = ends.stream().mapToInt(Integer::intValue).max().orElse(-1);

            if (n == 0) {
                return new RuleMatchResult(ruleName, MatchOutcome.MISMATCH, failureConfidence, 0, 0, null,
                        List.copyOf(expected),
                        String.format("Input is empty but '%s' expects %s", ruleName,
                                expected.isEmpty() ? "at least one token" : String.join(" or ", expected)),
                        noteList, RuleMatchResult.Source.SIMULATION);
            }
            if (furthestFailure >= n) {
                return new RuleMatchResult(ruleName, MatchOutcome.PARTIAL,
                        weak ? Confidence.LOW : Confidence.MEDIUM, furthestConsumed, n, null,
                        List.copyOf(expected),
                        String.format("Input is a valid prefix of '%s' but ends early; expected %s",
                                ruleName, String.join(" or ", expected)),
                        noteList, RuleMatchResult.Source.SIMULATION);
            }
            if (longestEnd >= 0 && longestEnd >= furthestFailure) {
                Token extra = tokens.get(longestEnd);
                return new RuleMatchResult(ruleName, MatchOutcome.PARTIAL,
                        weak ? Confidence.LOW : Confidence.MEDIUM, longestEnd, n, extra, List.of(),
                        String.format("Rule '%s' matched the first %d of %d tokens; %s is left over",
                                ruleName, longestEnd, n, extra.display()),
                        noteList, RuleMatchResult.Source.SIMULATION);
            }
            Token unexpected = furthestFailure >= 0 ? tokens.get(furthestFailure) : null;
            String message = unexpected == null
                    ? String.format("Rule '%s' cannot match this input", ruleName)
                    : String.format("Unexpected %s at token %d (line %d:%d); expected %s",
                            unexpected.display(), furthestFailure, unexpected.line(), unexpected.column(),
                            String.join(" or ", expected));
            return new RuleMatchResult(ruleName, MatchOutcome.MISMATCH, failureConfidence,
                    Math.max(0, furthestFailure), n, unexpected, List.copyOf(expected), message, noteList,
                    RuleMatchResult.Source.SIMULATION);
        }
    }
}
