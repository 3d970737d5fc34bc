package com.vidnyan.grammarian.domain.check;

import com.vidnyan.grammarian.domain.graph.RuleDependencyGraph;
import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.Issue;
import com.vidnyan.grammarian.domain.model.Severity;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Aggregated view of an issue list: counts per severity and per type, the undefined
 * names referenced most often and a proposed pattern for each undefined token among them.
 */
public record IssueReport(
    int total,
    Map<Severity, Long> bySeverity,
    Map<String, Long> byType,
    List<NameCount> topUndefined,
    List<TokenPatternSuggester.TokenSuggestion> tokenSuggestions,
    String suggestion
) {

    public static final int TOP_UNDEFINED = 10;

    public record NameCount(String name, int count) {}

    /**
     * Build the report. Undefined names are counted only when undefined references were
     * actually reported.
     */
    public static IssueReport of(List<Issue> issues, Grammar grammar, RuleDependencyGraph graph) {
        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity, issues.stream().filter(i -> i.severity() == severity).count());
        }

        Map<String, Long> counted = issues.stream()
                .collect(Collectors.groupingBy(Issue::type, LinkedHashMap::new, Collectors.counting()));
        Map<String, Long> byType = counted.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));

        List<NameCount> topUndefined = List.of();
        if (counted.containsKey("undefined-reference")) {
            Map<String, Integer> frequency = new HashMap<>();
            graph.undefinedReferences().values().forEach(names -> names.stream()
                    .filter(n -> !"EOF".equals(n) && !grammar.declaredTokens().contains(n))
                    .forEach(n -> frequency.merge(n, 1, Integer::sum)));
            topUndefined = frequency.entrySet().stream()
                    .map(e -> new NameCount(e.getKey(), e.getValue()))
                    .sorted(Comparator.comparingInt(NameCount::count).reversed().thenComparing(NameCount::name))
                    .limit(TOP_UNDEFINED)
                    .toList();
        }

        String suggestion = null;
        if (!topUndefined.isEmpty()) {
            String names = topUndefined.stream().limit(3).map(NameCount::name).collect(Collectors.joining(", "));
            suggestion = "Most referenced undefined names: " + names
                    + ". Define them, or analyze with imports resolved if they come from another grammar";
        }
        List<TokenPatternSuggester.TokenSuggestion> tokenSuggestions =
                TokenPatternSuggester.suggestAll(topUndefined.stream().map(NameCount::name).toList());
        return new IssueReport(issues.size(), bySeverity, byType, topUndefined, tokenSuggestions, suggestion);
    }

    public long count(Severity severity) {
        return bySeverity.getOrDefault(severity, 0L);
    }

    public boolean hasErrors() {
        return count(Severity.ERROR) > 0;
    }
}
