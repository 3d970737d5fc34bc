package com.vidnyan.grammarian.domain.rewrite;

import com.vidnyan.grammarian.domain.check.SuspiciousQuantifiers;
import com.vidnyan.grammarian.domain.check.SuspiciousQuantifiers.Finding;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.model.builder.GrammarModelBuilder;
import com.vidnyan.grammarian.domain.rewrite.RewriteVerifier.Expectation;
import com.vidnyan.grammarian.domain.syntax.BodyToken;
import com.vidnyan.grammarian.domain.syntax.BodyToken.Type;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns {@code (...)?} into {@code (...)*} where a group closes an alternative of a rule
 * with suspicious quantifiers.
 */
@Slf4j
class QuantifierFixer {

    private final RewriteVerifier verifier;

    QuantifierFixer(RewriteVerifier verifier) {
        this.verifier = verifier;
    }

    /**
     * @param ruleNames rules to fix; null or empty fixes every flagged rule
     */
    RewriteResult fix(GrammarDocument doc, Set<String> ruleNames, boolean dryRun) {
        List<Finding> findings = SuspiciousQuantifiers.find(doc.grammar);
        Set<String> flagged = new LinkedHashSet<>();
        for (Finding finding : findings) {
            if (ruleNames == null || ruleNames.isEmpty() || ruleNames.contains(finding.ruleName())) {
                flagged.add(finding.ruleName());
            }
        }

        List<TextEdit> edits = new ArrayList<>();
        List<Map<String, Object>> changes = new ArrayList<>();
        for (String name : flagged) {
            Optional<GrammarRule> rule = doc.rule(name);
            if (rule.isEmpty() || !rule.get().span().terminated()) {
                continue;
            }
            List<BodyToken> sites = trailingOptionalGroups(GrammarModelBuilder.bodyTokens(doc.scan, rule.get().span()));
            if (sites.isEmpty()) {
                continue;
            }
            sites.forEach(q -> edits.add(new TextEdit(q.start(), q.end(), "*")));
            Map<String, Object> change = new LinkedHashMap<>();
            change.put("ruleName", name);
            change.put("lineNumber", rule.get().lineNumber());
            change.put("oldPattern", ")?");
            change.put("newPattern", ")*");
            change.put("sites", sites.size());
            changes.add(change);
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("detected", findings.size());
        stats.put("changes", List.copyOf(changes));

        if (dryRun || edits.isEmpty()) {
            String verb = dryRun ? "Would fix" : "Fixed";
            return RewriteResult.success(doc.source,
                    String.format("%s %d of %d flagged rules", verb, changes.size(), flagged.size()), stats);
        }
        String result = TextEdit.apply(doc.source, edits);
        log.debug("Changed {} optional groups in {} rules", edits.size(), changes.size());
        return verifier.verify(doc, result, Expectation.sameRules(),
                String.format("Fixed %d of %d flagged rules", changes.size(), flagged.size()), stats);
    }

    /**
     * {@code ?} tokens of top-level groups that end an alternative.
     */
    static List<BodyToken> trailingOptionalGroups(List<BodyToken> tokens) {
        List<BodyToken> sites = new ArrayList<>();
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            BodyToken t = tokens.get(i);
            if (t.is(Type.LPAREN)) {
                depth++;
                continue;
            }
            if (!t.is(Type.RPAREN)) {
                continue;
            }
            depth--;
            if (depth != 0 || i + 1 >= tokens.size()) {
                continue;
            }
            BodyToken suffix = tokens.get(i + 1);
            if (!suffix.is(Type.QUESTION) || suffix.start() != t.end()) {
                continue;
            }
            BodyToken after = i + 2 < tokens.size() ? tokens.get(i + 2) : null;
            if (after == null || after.is(Type.PIPE) || after.is(Type.ARROW) || after.is(Type.HASH)) {
                sites.add(suffix);
            }
        }
        return sites;
    }
}
