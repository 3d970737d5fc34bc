package com.vidnyan.grammarian.adapter.out.check;

import com.vidnyan.grammarian.domain.check.CheckCategory;
import com.vidnyan.grammarian.domain.check.CheckContext;
import com.vidnyan.grammarian.domain.check.CheckResult;
import com.vidnyan.grammarian.domain.check.GrammarCheck;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.model.Issue;
import com.vidnyan.grammarian.domain.model.Severity;
import com.vidnyan.grammarian.domain.syntax.Atom;
import com.vidnyan.grammarian.domain.syntax.Element;
import com.vidnyan.grammarian.domain.syntax.Sequence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds rules that swallow input instead of parsing it: references to a
 * {@code null_rest_of_line} catch-all, and short lexer rules that are just a repeated
 * negated set.
 */
@Slf4j
@Component
@Order(150)
public class IncompleteParsingCheck implements GrammarCheck {

    static final String REST_OF_LINE = "null_rest_of_line";

    // longer definitions usually add structure around the negation
    private static final int SHORT_DEFINITION = 50;

    @Override
    public boolean supports(CheckCategory category) {
        return category == CheckCategory.QUALITY;
    }

    @Override
    public CheckResult evaluate(CheckContext context) {
        Instant start = Instant.now();
        List<Issue> issues = new ArrayList<>();
        for (GrammarRule rule : context.grammar().rules()) {
            if (rule.references(REST_OF_LINE)) {
                issues.add(issue(rule,
                        String.format("Rule '%s' discards the rest of the line through '%s'", rule.name(), REST_OF_LINE),
                        "Parse the structure of '" + rule.name() + "' instead of discarding it"));
            }
            if (rule.isLexer() && isBareNegation(rule)) {
                issues.add(issue(rule,
                        String.format("Lexer rule '%s' is only a repeated negated set", rule.name()),
                        "~[...] may match more than intended; consider specific token types"));
            }
        }
        return CheckResult.success(getName(), issues, Duration.between(start, Instant.now()));
    }

    private static boolean isBareNegation(GrammarRule rule) {
        if (rule.definition().length() >= SHORT_DEFINITION || rule.alternativeCount() != 1) {
            return false;
        }
        Sequence only = rule.expression().alternatives().get(0);
        List<Element> elements = only.matchable();
        return elements.size() == 1
                && elements.get(0).quantifier().repeats()
                && elements.get(0).atom() instanceof Atom.Not not
                && not.inner() instanceof Atom.CharSet;
    }

    private static Issue issue(GrammarRule rule, String message, String suggestion) {
        return Issue.builder()
                .severity(Severity.INFO)
                .type("incomplete-parsing")
                .message(message)
                .ruleName(rule.name())
                .lineNumber(rule.lineNumber())
                .suggestion(suggestion)
                .build();
    }
}
