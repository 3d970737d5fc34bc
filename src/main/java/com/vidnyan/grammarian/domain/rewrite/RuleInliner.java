package com.vidnyan.grammarian.domain.rewrite;

import com.vidnyan.grammarian.domain.graph.RuleDependencyGraph;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.model.RuleKind;
import com.vidnyan.grammarian.domain.model.builder.GrammarModelBuilder;
import com.vidnyan.grammarian.domain.rewrite.RewriteVerifier.Expectation;
import com.vidnyan.grammarian.domain.scan.RuleSpan;
import com.vidnyan.grammarian.domain.syntax.BodyToken;
import com.vidnyan.grammarian.domain.syntax.BodyToken.Type;
import com.vidnyan.grammarian.domain.syntax.Element;
import com.vidnyan.grammarian.domain.syntax.Quantifier;
import com.vidnyan.grammarian.domain.syntax.RuleReferences;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Replaces every reference to a rule with its body and deletes the rule.
 */
@Slf4j
class RuleInliner {

    private final RewriteVerifier verifier;

    RuleInliner(RewriteVerifier verifier) {
        this.verifier = verifier;
    }

    RewriteResult inline(GrammarDocument doc, String ruleName, boolean forceParentheses, boolean dryRun) {
        Optional<GrammarRule> found = doc.rule(ruleName);
        if (found.isEmpty()) {
            return RewriteResult.failure(doc.source, String.format("Rule '%s' not found", ruleName));
        }
        GrammarRule rule = found.get();
        RuleDependencyGraph graph = RuleDependencyGraph.build(doc.grammar);
        if (rule.isSelfRecursive()) {
            return RewriteResult.failure(doc.source,
                    String.format("Rule '%s' is recursive and cannot be inlined", ruleName));
        }
        if (graph.isOnCycle(ruleName)) {
            return RewriteResult.failure(doc.source,
                    String.format("Rule '%s' is part of a reference cycle and cannot be inlined", ruleName));
        }
        if (graph.referenceCount(ruleName) == 0) {
            return RewriteResult.failure(doc.source,
                    String.format("Rule '%s' is not referenced by any rule; nothing to inline", ruleName));
        }
        if (rule.isLexer() && !rule.expression().commands().isEmpty()) {
            return RewriteResult.failure(doc.source,
                    String.format("Rule '%s' has lexer commands and cannot be inlined", ruleName));
        }
        if (rule.isLexer() && graph.getDependents(ruleName).stream().anyMatch(d -> RuleKind.classify(d) == RuleKind.PARSER)) {
            return RewriteResult.failure(doc.source,
                    String.format("Token '%s' is used by parser rules and cannot be inlined", ruleName));
        }
        if (!rule.span().terminated()) {
            return RewriteResult.failure(doc.source,
                    String.format("Rule '%s' is not terminated by ';'", ruleName));
        }

        List<BodyToken> bodyTokens = GrammarModelBuilder.bodyTokens(doc.scan, rule.span());
        String body = inlineText(doc, bodyTokens);
        List<Element> elements = rule.expression().alternatives().get(0).elements();
        // a suffix at the site must not fuse with the body's own: x? with x : ID+ is (ID+)?
        boolean needsGroupForSuffix = elements.size() > 1
                || (elements.size() == 1 && elements.get(0).quantifier() != Quantifier.ONE);
        boolean multiAlternative = rule.alternativeCount() >= 2;
        boolean labelled = rule.expression().hasAltLabels();

        List<TextEdit> edits = new ArrayList<>();
        Set<String> referencingRules = new LinkedHashSet<>();
        for (RuleSpan span : doc.scan.rules()) {
            if (span.equals(rule.span()) || !span.hasColon()) {
                continue;
            }
            List<BodyToken> tokens = GrammarModelBuilder.bodyTokens(doc.scan, span);
            for (BodyToken site : RuleReferences.sites(tokens)) {
                if (!site.text().equals(ruleName)) {
                    continue;
                }
                boolean quantified = hasSuffix(tokens, site);
                boolean wrap = forceParentheses || multiAlternative || labelled || (quantified && needsGroupForSuffix);
                edits.add(new TextEdit(site.start(), site.end(), wrap ? "(" + body + ")" : body));
                referencingRules.add(span.name());
            }
        }
        edits.add(doc.removal(rule.span()));

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("referencesReplaced", edits.size() - 1);
        stats.put("referencingRules", List.copyOf(referencingRules));
        stats.put("ruleDefinition", rule.name() + rule.definition());

        if (dryRun) {
            return RewriteResult.success(doc.source,
                    String.format("Dry run: inlining '%s' would replace %d references in %d rules",
                            ruleName, edits.size() - 1, referencingRules.size()),
                    stats);
        }
        String result = TextEdit.apply(doc.source, edits);
        log.debug("Inlined '{}' at {} sites", ruleName, edits.size() - 1);
        return verifier.verify(doc, result, new Expectation(-1, Set.of(), Set.of(ruleName)),
                String.format("Inlined '%s' into %d references", ruleName, edits.size() - 1), stats);
    }

    /**
     * Body text with alternative labels dropped and whitespace collapsed, read from the
     * comment-free view.
     */
    private static String inlineText(GrammarDocument doc, List<BodyToken> tokens) {
        StringBuilder sb = new StringBuilder();
        BodyToken previous = null;
        for (int i = 0; i < tokens.size(); i++) {
            BodyToken t = tokens.get(i);
            if (t.is(Type.HASH)) {
                if (i + 1 < tokens.size() && tokens.get(i + 1).is(Type.IDENT)) {
                    i++;
                }
                continue;
            }
            if (previous != null && previous.end() < t.start()) {
                sb.append(' ');
            }
            sb.append(doc.scan.cleanText(t.start(), t.end()));
            previous = t;
        }
        return sb.toString().strip();
    }

    private static boolean hasSuffix(List<BodyToken> tokens, BodyToken site) {
        int index = tokens.indexOf(site);
        if (index < 0 || index + 1 >= tokens.size()) {
            return false;
        }
        BodyToken next = tokens.get(index + 1);
        // arguments sit between a rule reference and its suffix: expr[1]*
        if (next.is(Type.CHAR_SET) && next.start() == site.end() && index + 2 < tokens.size()) {
            next = tokens.get(index + 2);
        }
        return next.is(Type.QUESTION) || next.is(Type.STAR) || next.is(Type.PLUS);
    }
}
