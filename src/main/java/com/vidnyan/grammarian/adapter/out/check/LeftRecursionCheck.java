package com.vidnyan.grammarian.adapter.out.check;

import com.vidnyan.grammarian.domain.check.CheckCategory;
import com.vidnyan.grammarian.domain.check.CheckContext;
import com.vidnyan.grammarian.domain.check.CheckResult;
import com.vidnyan.grammarian.domain.check.GrammarCheck;
import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.model.Issue;
import com.vidnyan.grammarian.domain.model.Severity;
import com.vidnyan.grammarian.domain.syntax.Alternation;
import com.vidnyan.grammarian.domain.syntax.Atom;
import com.vidnyan.grammarian.domain.syntax.Element;
import com.vidnyan.grammarian.domain.syntax.Sequence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Left recursion analysis over the leftmost symbols of every alternative.
 *
 * Direct left recursion ({@code expr : expr '+' term}) is rewritten by ANTLR and only
 * reported as information. Indirect left recursion through other rules is rejected by
 * the tool and reported as an error for every rule on the cycle.
 */
@Slf4j
@Component
@Order(40)
public class LeftRecursionCheck implements GrammarCheck {

    @Override
    public boolean supports(CheckCategory category) {
        return category == CheckCategory.VALIDATION || category == CheckCategory.AMBIGUITY;
    }

    @Override
    public CheckResult evaluate(CheckContext context) {
        Instant start = Instant.now();
        Grammar grammar = context.grammar();
        Map<String, Set<String>> leftmost = leftmostGraph(grammar);
        List<Issue> issues = new ArrayList<>();

        for (GrammarRule rule : grammar.parserRules()) {
            if (leftmost.get(rule.name()).contains(rule.name())) {
                issues.add(Issue.builder()
                        .severity(Severity.INFO)
                        .type("direct-left-recursion")
                        .message(String.format("Rule '%s' is directly left-recursive", rule.name()))
                        .ruleName(rule.name())
                        .lineNumber(rule.lineNumber())
                        .suggestion("Supported by ANTLR4; keep the non-recursive alternative last")
                        .build());
            }
            findIndirectCycle(rule.name(), leftmost).ifPresent(path -> issues.add(Issue.builder()
                    .severity(Severity.ERROR)
                    .type("hidden-left-recursion")
                    .message(String.format("Rule '%s' is indirectly left-recursive: %s",
                            rule.name(), String.join(" -> ", path)))
                    .ruleName(rule.name())
                    .lineNumber(rule.lineNumber())
                    .suggestion("Rewrite the rules so the recursion is direct or starts with a token")
                    .build()));
        }

        log.debug("Left recursion check found {} issues", issues.size());
        return CheckResult.success(getName(), issues, Duration.between(start, Instant.now()));
    }

    /**
     * Parser rule name to the rules that can appear first in one of its alternatives.
     */
    static Map<String, Set<String>> leftmostGraph(Grammar grammar) {
        Set<String> nullable = nullableRules(grammar);
        Map<String, Set<String>> graph = new LinkedHashMap<>();
        for (GrammarRule rule : grammar.parserRules()) {
            Set<String> first = new LinkedHashSet<>();
            collectLeftmost(rule.expression(), nullable, first);
            first.removeIf(name -> grammar.findRule(name).map(r -> !r.isParser()).orElse(true));
            graph.put(rule.name(), first);
        }
        return graph;
    }

    private static void collectLeftmost(Alternation alternation, Set<String> nullable, Set<String> out) {
        for (Sequence alt : alternation.alternatives()) {
            for (Element element : alt.elements()) {
                if (element.atom() instanceof Atom.RuleRef ref) {
                    out.add(ref.name());
                } else if (element.atom() instanceof Atom.Group group) {
                    collectLeftmost(group.body(), nullable, out);
                }
                if (!canBeEmpty(element, nullable)) {
                    break;
                }
            }
        }
    }

    /**
     * Parser rules that can match without consuming a token, computed to a fixpoint.
     */
    private static Set<String> nullableRules(Grammar grammar) {
        Set<String> nullable = new HashSet<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (GrammarRule rule : grammar.parserRules()) {
                if (!nullable.contains(rule.name()) && isNullable(rule.expression(), nullable)) {
                    nullable.add(rule.name());
                    changed = true;
                }
            }
        }
        return nullable;
    }

    private static boolean isNullable(Alternation alternation, Set<String> nullable) {
        return alternation.alternatives().stream()
                .anyMatch(alt -> alt.elements().stream().allMatch(e -> canBeEmpty(e, nullable)));
    }

    private static boolean canBeEmpty(Element element, Set<String> nullable) {
        if (element.quantifier().allowsZero() || element.isAction()) {
            return true;
        }
        if (element.atom() instanceof Atom.RuleRef ref) {
            return nullable.contains(ref.name());
        }
        if (element.atom() instanceof Atom.Group group) {
            return isNullable(group.body(), nullable);
        }
        return false;
    }

    /**
     * Shortest leftmost path from the rule back to itself through at least one other rule.
     */
    private Optional<List<String>> findIndirectCycle(String rule, Map<String, Set<String>> graph) {
        Map<String, String> parent = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String next : graph.getOrDefault(rule, Set.of())) {
            if (!next.equals(rule) && !parent.containsKey(next)) {
                parent.put(next, rule);
                queue.add(next);
            }
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : graph.getOrDefault(current, Set.of())) {
                if (next.equals(rule)) {
                    List<String> path = new ArrayList<>();
                    path.add(rule);
                    for (String step = current; !step.equals(rule); step = parent.get(step)) {
                        path.add(1, step);
                    }
                    path.add(rule);
                    return Optional.of(path);
                }
                if (!parent.containsKey(next)) {
                    parent.put(next, current);
                    queue.add(next);
                }
            }
        }
        return Optional.empty();
    }
}
