package com.vidnyan.grammarian.domain.query;

import com.vidnyan.grammarian.domain.graph.RuleDependencyGraph;
import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.GrammarImport;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.model.LexerMode;
import com.vidnyan.grammarian.domain.model.builder.GrammarModelBuilder;
import com.vidnyan.grammarian.domain.scan.RuleSpan;
import com.vidnyan.grammarian.domain.scan.ScanResult;
import com.vidnyan.grammarian.domain.syntax.BodyToken;
import com.vidnyan.grammarian.domain.syntax.RuleReferences;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Read-only lookups over a grammar.
 */
public final class GrammarQueries {

    public static final int TOP_REFERENCED = 10;

    private GrammarQueries() {
    }

    /**
     * Rule names matching a pattern, in declaration order.
     */
    public static RuleSearchResult findRules(Grammar grammar, String pattern, MatchMode mode) {
        if (pattern == null || pattern.isEmpty()) {
            return RuleSearchResult.error(pattern, mode, "Pattern must not be empty");
        }
        Predicate<String> matcher;
        try {
            matcher = switch (mode) {
                case EXACT -> pattern::equals;
                case REGEX -> Pattern.compile(pattern).asMatchPredicate();
                case WILDCARD -> Pattern.compile(wildcardToRegex(pattern)).asMatchPredicate();
                case PARTIAL -> {
                    String needle = pattern.toLowerCase(Locale.ROOT);
                    yield name -> name.toLowerCase(Locale.ROOT).contains(needle);
                }
            };
        } catch (PatternSyntaxException e) {
            return RuleSearchResult.error(pattern, mode, "Invalid regular expression: " + e.getDescription());
        }
        List<String> matches = grammar.rules().stream().map(GrammarRule::name).filter(matcher).toList();
        return RuleSearchResult.success(pattern, mode, matches);
    }

    static String wildcardToRegex(String wildcard) {
        StringBuilder sb = new StringBuilder();
        for (char c : wildcard.toCharArray()) {
            switch (c) {
                case '*' -> sb.append(".*");
                case '?' -> sb.append('.');
                default -> sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return sb.toString();
    }

    /**
     * Every reference to a rule, one entry per reference site.
     */
    public static List<RuleUsage> findUsages(ScanResult scan, String ruleName) {
        List<RuleUsage> usages = new ArrayList<>();
        for (RuleSpan span : scan.rules()) {
            if (!span.hasColon()) {
                continue;
            }
            List<BodyToken> body = GrammarModelBuilder.bodyTokens(scan, span);
            for (BodyToken site : RuleReferences.sites(body)) {
                if (site.text().equals(ruleName)) {
                    int line = scan.lines().lineOf(site.start());
                    usages.add(new RuleUsage(ruleName, line, scan.lines().line(scan.source(), line).strip(), span.name()));
                }
            }
        }
        return usages;
    }

    public static Optional<RuleStatistics> statistics(Grammar grammar, RuleDependencyGraph graph, String ruleName) {
        return grammar.findRule(ruleName).map(rule -> statistics(rule, graph));
    }

    static RuleStatistics statistics(GrammarRule rule, RuleDependencyGraph graph) {
        return new RuleStatistics(
                rule.name(),
                rule.kind().name(),
                rule.fragment(),
                rule.lineNumber(),
                rule.referencedRules().size(),
                graph.referenceCount(rule.name()),
                rule.alternativeCount(),
                rule.isSelfRecursive() || graph.isOnCycle(rule.name())
        );
    }

    public static GrammarSummary summary(Grammar grammar, RuleDependencyGraph graph) {
        List<RuleStatistics> top = grammar.rules().stream()
                .map(r -> statistics(r, graph))
                .filter(s -> s.fanIn() > 0)
                .sorted(Comparator.comparingInt(RuleStatistics::fanIn).reversed()
                        .thenComparing(RuleStatistics::name))
                .limit(TOP_REFERENCED)
                .toList();
        return new GrammarSummary(
                grammar.name(),
                grammar.kind() == null ? null : grammar.kind().name(),
                grammar.parserRules().size(),
                (int) grammar.lexerRules().stream().filter(r -> !r.fragment()).count(),
                (int) grammar.lexerRules().stream().filter(GrammarRule::fragment).count(),
                grammar.modes().stream().map(LexerMode::name).toList(),
                grammar.imports().stream().map(GrammarImport::name).toList(),
                grammar.tokenVocab().orElse(null),
                top
        );
    }
}
