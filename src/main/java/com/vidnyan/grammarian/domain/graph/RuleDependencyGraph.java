package com.vidnyan.grammarian.domain.graph;

import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.GrammarRule;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rule reference graph: an edge {@code a -> b} means rule a references b.
 * References to names no rule defines are kept as edges to undefined nodes.
 */
public final class RuleDependencyGraph {

    private final Map<String, Set<String>> dependencies; // rule → names it references
    private final Map<String, Set<String>> dependents;   // name → rules referencing it
    private final Set<String> rules;

    private RuleDependencyGraph(
            Map<String, Set<String>> dependencies,
            Map<String, Set<String>> dependents,
            Set<String> rules
    ) {
        this.dependencies = Collections.unmodifiableMap(dependencies);
        this.dependents = Collections.unmodifiableMap(dependents);
        this.rules = Collections.unmodifiableSet(rules);
    }

    /**
     * Build the graph from a grammar model.
     */
    public static RuleDependencyGraph build(Grammar grammar) {
        Map<String, Set<String>> deps = new LinkedHashMap<>();
        Map<String, Set<String>> revDeps = new LinkedHashMap<>();
        Set<String> names = new LinkedHashSet<>();

        for (GrammarRule rule : grammar.rules()) {
            names.add(rule.name());
            Set<String> refs = deps.computeIfAbsent(rule.name(), k -> new LinkedHashSet<>());
            for (String ref : rule.referencedRules()) {
                refs.add(ref);
                revDeps.computeIfAbsent(ref, k -> new LinkedHashSet<>()).add(rule.name());
            }
        }
        return new RuleDependencyGraph(deps, revDeps, names);
    }

    /**
     * Get names a rule references.
     */
    public Set<String> getDependencies(String rule) {
        return dependencies.getOrDefault(rule, Set.of());
    }

    /**
     * Get rules that reference a name.
     */
    public Set<String> getDependents(String rule) {
        return dependents.getOrDefault(rule, Set.of());
    }

    /**
     * Rules other than itself that reference a name.
     */
    public int referenceCount(String rule) {
        Set<String> users = getDependents(rule);
        return users.contains(rule) ? users.size() - 1 : users.size();
    }

    public boolean isDefined(String name) {
        return rules.contains(name);
    }

    /**
     * Get referenced names that no rule defines, keyed by referencing rule.
     */
    public Map<String, List<String>> undefinedReferences() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        dependencies.forEach((rule, refs) -> {
            List<String> missing = refs.stream().filter(r -> !rules.contains(r)).toList();
            if (!missing.isEmpty()) {
                result.put(rule, missing);
            }
        });
        return result;
    }

    /**
     * Every defined rule reachable from {@code rule}, excluding the rule itself unless it
     * lies on a cycle. Breadth-first order.
     */
    public Set<String> transitiveDependencies(String rule) {
        return reach(rule, dependencies);
    }

    /**
     * Every rule from which {@code rule} is reachable. Breadth-first order.
     */
    public Set<String> transitiveDependents(String rule) {
        return reach(rule, dependents);
    }

    /**
     * Check if ruleA depends on ruleB (directly or transitively).
     */
    public boolean dependsOn(String ruleA, String ruleB) {
        return transitiveDependencies(ruleA).contains(ruleB);
    }

    /**
     * Whether the rule can reach itself.
     */
    public boolean isOnCycle(String rule) {
        return dependsOn(rule, rule);
    }

    private Set<String> reach(String start, Map<String, Set<String>> edges) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(edges.getOrDefault(start, Set.of()));
        while (!queue.isEmpty()) {
            String next = queue.poll();
            if (!rules.contains(next) || !seen.add(next)) {
                continue;
            }
            queue.addAll(edges.getOrDefault(next, Set.of()));
        }
        return seen;
    }

    /**
     * Get statistics.
     */
    public Stats stats() {
        return new Stats(
                rules.size(),
                dependencies.values().stream().mapToInt(Set::size).sum(),
                undefinedReferences().values().stream().mapToInt(List::size).sum()
        );
    }

    public record Stats(int ruleCount, int edgeCount, int undefinedCount) {}
}
