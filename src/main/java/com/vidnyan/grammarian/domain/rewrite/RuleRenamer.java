package com.vidnyan.grammarian.domain.rewrite;

import com.vidnyan.grammarian.domain.model.RuleKind;
import com.vidnyan.grammarian.domain.model.builder.GrammarModelBuilder;
import com.vidnyan.grammarian.domain.rewrite.RewriteVerifier.Expectation;
import com.vidnyan.grammarian.domain.scan.RuleSpan;
import com.vidnyan.grammarian.domain.syntax.BodyToken;
import com.vidnyan.grammarian.domain.syntax.RuleReferences;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Whole-word rename of a rule at its definition and at every reference site.
 * Sites come from the body tokenizer, so comments, literals and actions are never touched.
 */
public class RuleRenamer {

    /**
     * Renamed text with counts.
     *
     * @param occurrences definitions plus references replaced
     * @param references  reference sites replaced
     */
    public record Replacement(String content, int occurrences, int references) {

        public boolean changed() {
            return occurrences > 0;
        }
    }

    RewriteResult rename(GrammarDocument doc, String oldName, String newName, RewriteVerifier verifier) {
        if (doc.rule(oldName).isEmpty()) {
            return RewriteResult.failure(doc.source, String.format("Rule '%s' not found", oldName));
        }
        String problem = validateNewName(oldName, newName);
        if (problem != null) {
            return RewriteResult.failure(doc.source, problem);
        }
        if (doc.rule(newName).isPresent()) {
            return RewriteResult.failure(doc.source, String.format("Rule '%s' already exists", newName));
        }

        Replacement replacement = replaceAll(doc, oldName, newName);
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("oldName", oldName);
        stats.put("newName", newName);
        stats.put("occurrences", replacement.occurrences());
        stats.put("references", replacement.references());
        return verifier.verify(doc, replacement.content(), new Expectation(0, Set.of(newName), Set.of(oldName)),
                String.format("Renamed '%s' to '%s' (%d occurrences, %d references)",
                        oldName, newName, replacement.occurrences(), replacement.references()),
                stats);
    }

    /**
     * Problem with a proposed name, or null when it is acceptable.
     */
    public static String validateNewName(String oldName, String newName) {
        if (newName == null || !GrammarRewriter.IDENTIFIER.matcher(newName).matches()) {
            return "Invalid rule name: '" + newName + "'";
        }
        if (oldName.equals(newName)) {
            return "New name is the same as the old name";
        }
        if (RuleKind.classify(oldName) != RuleKind.classify(newName)) {
            return String.format("Renaming '%s' to '%s' would change the rule kind", oldName, newName);
        }
        return null;
    }

    Replacement replaceAll(GrammarDocument doc, String oldName, String newName) {
        List<TextEdit> edits = new ArrayList<>();
        int references = 0;
        for (RuleSpan span : doc.scan.rules()) {
            if (span.name().equals(oldName)) {
                edits.add(new TextEdit(span.nameOffset(), span.nameOffset() + oldName.length(), newName));
            }
            if (!span.hasColon()) {
                continue;
            }
            List<BodyToken> body = GrammarModelBuilder.bodyTokens(doc.scan, span);
            for (BodyToken site : RuleReferences.sites(body)) {
                if (site.text().equals(oldName)) {
                    edits.add(new TextEdit(site.start(), site.end(), newName));
                    references++;
                }
            }
        }
        return new Replacement(TextEdit.apply(doc.source, edits), edits.size(), references);
    }
}
