package com.vidnyan.grammarian.domain.check;

import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.syntax.Alternation;
import com.vidnyan.grammarian.domain.syntax.Atom;
import com.vidnyan.grammarian.domain.syntax.Element;
import com.vidnyan.grammarian.domain.syntax.Quantifier;
import com.vidnyan.grammarian.domain.syntax.Sequence;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Finds {@code ?} suffixes that probably mean {@code *}: runs of optional elements, the same
 * optional element repeated, and optional items in rules whose names describe collections.
 */
public final class SuspiciousQuantifiers {

    static final int MIN_OPTIONAL_RUN = 3;

    private static final List<String> COLLECTION_MARKERS = List.of("_rule", "_setting", "_property");

    public enum Kind {
        OPTIONAL_RUN,
        REPEATED_OPTIONAL,
        COLLECTION_NAME
    }

    public record Finding(
        String ruleName,
        int lineNumber,
        Kind kind,
        String text,
        String suggestion,
        String reasoning
    ) {}

    private SuspiciousQuantifiers() {
    }

    public static List<Finding> find(Grammar grammar) {
        List<Finding> findings = new ArrayList<>();
        for (GrammarRule rule : grammar.rules()) {
            findings.addAll(find(rule));
        }
        return findings;
    }

    public static List<Finding> find(GrammarRule rule) {
        List<Finding> findings = new ArrayList<>();
        List<Element> optionals = new ArrayList<>();
        scan(rule, rule.expression(), findings, optionals);

        String lower = rule.name().toLowerCase(Locale.ROOT);
        if (!optionals.isEmpty() && COLLECTION_MARKERS.stream().anyMatch(lower::contains)) {
            findings.add(new Finding(rule.name(), rule.lineNumber(), Kind.COLLECTION_NAME,
                    String.join(" ", optionals.stream().map(Element::text).toList()),
                    "Rule name suggests multiple items; consider changing ? to *",
                    "Names with '_rule', '_setting' or '_property' usually allow several occurrences"));
        }
        return findings;
    }

    private static void scan(GrammarRule rule, Alternation alternation, List<Finding> findings, List<Element> optionals) {
        for (Sequence alt : alternation.alternatives()) {
            List<Element> elements = alt.matchable();
            List<Element> run = new ArrayList<>();
            Map<String, Integer> repeated = new LinkedHashMap<>();
            for (Element element : elements) {
                if (element.atom() instanceof Atom.Group group) {
                    scan(rule, group.body(), findings, optionals);
                }
                if (isOptional(element)) {
                    optionals.add(element);
                    run.add(element);
                    repeated.merge(element.coreText(), 1, Integer::sum);
                } else {
                    flushRun(rule, run, findings);
                }
            }
            flushRun(rule, run, findings);

            repeated.forEach((core, count) -> {
                if (count > 1) {
                    String shown = core.contains(" ") ? "(" + core + ")" : core;
                    findings.add(new Finding(rule.name(), rule.lineNumber(), Kind.REPEATED_OPTIONAL,
                            String.format("%s? appears %d times", shown, count),
                            "Use " + shown + "* for multiple occurrences",
                            "The same optional element appears more than once"));
                }
            });
        }
    }

    private static void flushRun(GrammarRule rule, List<Element> run, List<Finding> findings) {
        if (run.size() >= MIN_OPTIONAL_RUN) {
            List<String> cores = run.stream().map(Element::coreText).toList();
            findings.add(new Finding(rule.name(), rule.lineNumber(), Kind.OPTIONAL_RUN,
                    String.join(" ", run.stream().map(Element::text).toList()),
                    "Consider (" + String.join(" | ", cores) + ")* instead of a run of optional elements",
                    "Several optional elements in a row suggest zero or more alternatives"));
        }
        run.clear();
    }

    private static boolean isOptional(Element element) {
        return element.quantifier() == Quantifier.OPTIONAL && element.greedy();
    }
}
