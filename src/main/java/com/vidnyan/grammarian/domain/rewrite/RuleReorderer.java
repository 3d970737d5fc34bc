package com.vidnyan.grammarian.domain.rewrite;

import com.vidnyan.grammarian.domain.graph.RuleDependencyGraph;
import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.model.RuleKind;
import com.vidnyan.grammarian.domain.rewrite.RewriteVerifier.Expectation;
import com.vidnyan.grammarian.domain.scan.LineIndex;
import com.vidnyan.grammarian.domain.scan.RuleSpan;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Sorts and moves rules by permuting them among the slots rules already occupy.
 *
 * A slot is a rule's lines plus the comment lines directly above it. Text between slots
 * (blank lines, other comments, mode declarations) stays where it is, and rules never leave
 * their mode section.
 */
@Slf4j
class RuleReorderer {

    static final Comparator<String> BY_NAME = String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder());

    private final RewriteVerifier verifier;

    RuleReorderer(RewriteVerifier verifier) {
        this.verifier = verifier;
    }

    /**
     * A rule and the line range it occupies.
     */
    private record Chunk(RuleSpan span, int section, int startLine, int endLine) {

        String name() {
            return span.name();
        }

        RuleKind kind() {
            return RuleKind.classify(span.name());
        }
    }

    RewriteResult sort(GrammarDocument doc, SortStrategy strategy, SortOptions options) {
        SortOptions opts = options == null ? SortOptions.defaults() : options;
        Optional<String> layoutProblem = sharedLines(doc);
        if (layoutProblem.isPresent()) {
            return RewriteResult.failure(doc.source, layoutProblem.get());
        }
        List<Chunk> chunks = chunks(doc);
        if (chunks.size() < 2) {
            return RewriteResult.success(doc.source, "Nothing to sort", Map.of("rulesMoved", 0));
        }

        Grammar grammar = doc.grammar;
        RuleDependencyGraph graph = RuleDependencyGraph.build(grammar);
        RuleKind orderedKind = grammar.parserRules().isEmpty() ? RuleKind.LEXER : RuleKind.PARSER;
        List<String> order;
        RuleKind onlyKind = null;
        switch (strategy) {
            case ALPHABETICAL -> order = alphabetical(chunks);
            case TYPE -> order = byType(chunks, opts.parserFirst());
            case DEPENDENCY -> {
                if (opts.anchor() == null || grammar.findRule(opts.anchor()).isEmpty()) {
                    return RewriteResult.failure(doc.source,
                            "Dependency sort needs an existing anchor rule, got '" + opts.anchor() + "'");
                }
                if (RuleKind.classify(opts.anchor()) != orderedKind) {
                    return RewriteResult.failure(doc.source, String.format(
                            "Dependency sort orders %s rules; '%s' is not one",
                            orderedKind.name().toLowerCase(), opts.anchor()));
                }
                order = dependencyOrder(grammar, graph, opts.anchor(), orderedKind);
                onlyKind = orderedKind;
            }
            case USAGE -> {
                order = usageOrder(grammar, graph, orderedKind);
                onlyKind = orderedKind;
            }
            default -> throw new IllegalArgumentException("Unknown strategy: " + strategy);
        }

        return permute(doc, chunks, order, onlyKind, strategy.name().toLowerCase() + " sort");
    }

    RewriteResult move(GrammarDocument doc, String ruleName, String anchorName, MovePosition position) {
        if (ruleName == null || anchorName == null) {
            return RewriteResult.failure(doc.source, "Both the rule and the anchor must be named");
        }
        if (ruleName.equals(anchorName)) {
            return RewriteResult.failure(doc.source, "Cannot move a rule relative to itself");
        }
        Optional<GrammarRule> rule = doc.rule(ruleName);
        Optional<GrammarRule> anchor = doc.rule(anchorName);
        if (rule.isEmpty()) {
            return RewriteResult.failure(doc.source, String.format("Rule '%s' not found", ruleName));
        }
        if (anchor.isEmpty()) {
            return RewriteResult.failure(doc.source, String.format("Anchor rule '%s' not found", anchorName));
        }
        if (doc.sectionOf(rule.get().span().startOffset()) != doc.sectionOf(anchor.get().span().startOffset())) {
            return RewriteResult.failure(doc.source,
                    String.format("Cannot move '%s' next to '%s': they are in different modes", ruleName, anchorName));
        }
        Optional<String> layoutProblem = sharedLines(doc);
        if (layoutProblem.isPresent()) {
            return RewriteResult.failure(doc.source, layoutProblem.get());
        }

        List<Chunk> chunks = chunks(doc);
        List<String> order = new ArrayList<>(chunks.stream().map(Chunk::name).toList());
        int ruleIndex = order.indexOf(ruleName);
        int anchorIndex = order.indexOf(anchorName);
        int target = position == MovePosition.BEFORE ? anchorIndex - 1 : anchorIndex + 1;
        if (ruleIndex == target) {
            return RewriteResult.success(doc.source,
                    String.format("Rule '%s' is already %s '%s'", ruleName, position.name().toLowerCase(), anchorName),
                    Map.of("rulesMoved", 0));
        }
        order.remove(ruleIndex);
        int insertAt = order.indexOf(anchorName) + (position == MovePosition.AFTER ? 1 : 0);
        order.add(insertAt, ruleName);
        return permute(doc, chunks, order, null,
                String.format("moved '%s' %s '%s'", ruleName, position.name().toLowerCase(), anchorName));
    }

    /**
     * Rebuild the text with chunks placed in {@code order}, each section keeping its own slots.
     * With {@code onlyKind} set, rules of the other kind keep their slots.
     */
    private RewriteResult permute(GrammarDocument doc, List<Chunk> chunks, List<String> order,
                                  RuleKind onlyKind, String what) {
        Map<String, Chunk> byName = new HashMap<>();
        chunks.forEach(c -> byName.putIfAbsent(c.name(), c));
        Map<Integer, List<Chunk>> slotsBySection = chunks.stream()
                .filter(c -> onlyKind == null || c.kind() == onlyKind)
                .collect(Collectors.groupingBy(Chunk::section, LinkedHashMap::new, Collectors.toList()));
        Map<Integer, List<Chunk>> placedBySection = new LinkedHashMap<>();
        for (String name : order) {
            Chunk chunk = byName.get(name);
            placedBySection.computeIfAbsent(chunk.section(), k -> new ArrayList<>()).add(chunk);
        }

        LineIndex lines = doc.lines();
        List<TextEdit> edits = new ArrayList<>();
        int moved = 0;
        for (Map.Entry<Integer, List<Chunk>> entry : slotsBySection.entrySet()) {
            List<Chunk> slots = entry.getValue();
            List<Chunk> placed = placedBySection.getOrDefault(entry.getKey(), List.of());
            for (int i = 0; i < slots.size(); i++) {
                Chunk slot = slots.get(i);
                Chunk chunk = placed.get(i);
                if (slot == chunk) {
                    continue;
                }
                moved++;
                edits.add(new TextEdit(lines.lineStart(slot.startLine()), lines.lineEnd(slot.endLine()),
                        doc.source.substring(lines.lineStart(chunk.startLine()), lines.lineEnd(chunk.endLine()))));
            }
        }
        if (moved == 0) {
            return RewriteResult.success(doc.source, "Rules are already in order", Map.of("rulesMoved", 0));
        }
        String result = TextEdit.apply(doc.source, edits);
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("rulesMoved", moved);
        stats.put("order", order);
        log.debug("Reordered {} rules ({})", moved, what);
        return verifier.verify(doc, result, Expectation.sameRules(),
                String.format("Reordered %d rules (%s)", moved, what), stats);
    }

    private List<Chunk> chunks(GrammarDocument doc) {
        List<Chunk> chunks = new ArrayList<>();
        for (RuleSpan span : doc.scan.rules()) {
            int start = doc.chunkStartLine(span, doc.floorLineBefore(span));
            chunks.add(new Chunk(span, doc.sectionOf(span.startOffset()), start, span.endLine()));
        }
        return chunks;
    }

    /**
     * Sorting works on whole lines, so every rule needs lines of its own.
     */
    private static Optional<String> sharedLines(GrammarDocument doc) {
        Set<String> names = new HashSet<>();
        List<RuleSpan> rules = doc.scan.rules();
        for (int i = 0; i < rules.size(); i++) {
            if (!names.add(rules.get(i).name())) {
                return Optional.of(String.format("Rule '%s' is defined more than once", rules.get(i).name()));
            }
            if (i > 0 && rules.get(i).startLine() <= rules.get(i - 1).endLine()) {
                return Optional.of(String.format("Rules '%s' and '%s' share a line; put each rule on its own lines first",
                        rules.get(i - 1).name(), rules.get(i).name()));
            }
            if (!doc.ownsLines(rules.get(i))) {
                return Optional.of(String.format("Rule '%s' shares its lines with other content", rules.get(i).name()));
            }
        }
        return Optional.empty();
    }

    private static List<String> alphabetical(List<Chunk> chunks) {
        List<String> parser = chunks.stream().filter(c -> c.kind() == RuleKind.PARSER).map(Chunk::name).sorted(BY_NAME).toList();
        List<String> lexer = chunks.stream().filter(c -> c.kind() == RuleKind.LEXER).map(Chunk::name).sorted(BY_NAME).toList();
        List<String> order = new ArrayList<>(parser);
        order.addAll(lexer);
        return order;
    }

    private static List<String> byType(List<Chunk> chunks, boolean parserFirst) {
        RuleKind first = parserFirst ? RuleKind.PARSER : RuleKind.LEXER;
        List<String> order = new ArrayList<>();
        chunks.stream().filter(c -> c.kind() == first).map(Chunk::name).forEach(order::add);
        chunks.stream().filter(c -> c.kind() != first).map(Chunk::name).forEach(order::add);
        return order;
    }

    /**
     * Anchor's dependencies (deepest first), the anchor, its dependents, then the rest A-Z.
     */
    private static List<String> dependencyOrder(Grammar grammar, RuleDependencyGraph graph, String anchor, RuleKind kind) {
        Set<String> order = new LinkedHashSet<>();
        collectDependencies(graph, anchor, kind, new HashSet<>(), order);
        order.remove(anchor);
        order.add(anchor);
        graph.transitiveDependents(anchor).stream()
                .filter(r -> RuleKind.classify(r) == kind)
                .forEach(order::add);
        grammar.rules().stream()
                .filter(r -> r.kind() == kind)
                .map(GrammarRule::name)
                .sorted(BY_NAME)
                .forEach(order::add);
        return new ArrayList<>(order);
    }

    private static void collectDependencies(RuleDependencyGraph graph, String rule, RuleKind kind,
                                            Set<String> visited, Set<String> out) {
        if (!visited.add(rule)) {
            return;
        }
        for (String dep : graph.getDependencies(rule)) {
            if (graph.isDefined(dep) && RuleKind.classify(dep) == kind) {
                collectDependencies(graph, dep, kind, visited, out);
            }
        }
        out.add(rule);
    }

    private static List<String> usageOrder(Grammar grammar, RuleDependencyGraph graph, RuleKind kind) {
        return grammar.rules().stream()
                .filter(r -> r.kind() == kind)
                .map(GrammarRule::name)
                .sorted(Comparator.comparingInt((String r) -> graph.referenceCount(r)).reversed().thenComparing(BY_NAME))
                .toList();
    }
}
