package com.vidnyan.grammarian.adapter.out.check;

import com.vidnyan.grammarian.domain.check.CheckCategory;
import com.vidnyan.grammarian.domain.check.CheckContext;
import com.vidnyan.grammarian.domain.check.CheckResult;
import com.vidnyan.grammarian.domain.check.GrammarCheck;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.model.Issue;
import com.vidnyan.grammarian.domain.model.Severity;
import com.vidnyan.grammarian.domain.syntax.Alternation;
import com.vidnyan.grammarian.domain.syntax.Atom;
import com.vidnyan.grammarian.domain.syntax.Element;
import com.vidnyan.grammarian.domain.syntax.Quantifier;
import com.vidnyan.grammarian.domain.syntax.Sequence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds an optional element directly followed by the same element: {@code X? X} is
 * {@code X+} in disguise and {@code X? X*} is just {@code X*}.
 */
@Slf4j
@Component
@Order(130)
public class OptionalElementCheck implements GrammarCheck {

    @Override
    public boolean supports(CheckCategory category) {
        return category == CheckCategory.AMBIGUITY;
    }

    @Override
    public CheckResult evaluate(CheckContext context) {
        Instant start = Instant.now();
        List<Issue> issues = new ArrayList<>();
        for (GrammarRule rule : context.grammar().rules()) {
            scan(rule, rule.expression(), issues);
        }
        return CheckResult.success(getName(), issues, Duration.between(start, Instant.now()));
    }

    private void scan(GrammarRule rule, Alternation alternation, List<Issue> issues) {
        for (Sequence alt : alternation.alternatives()) {
            List<Element> elements = alt.matchable();
            for (int i = 0; i < elements.size(); i++) {
                Element current = elements.get(i);
                if (current.atom() instanceof Atom.Group group) {
                    scan(rule, group.body(), issues);
                }
                if (i + 1 >= elements.size() || current.quantifier() != Quantifier.OPTIONAL) {
                    continue;
                }
                Element next = elements.get(i + 1);
                if (!current.coreText().equals(next.coreText())) {
                    continue;
                }
                String core = wrap(current.coreText());
                if (next.quantifier() == Quantifier.ONE) {
                    issues.add(issue(rule, "ambiguous-optional",
                            String.format("Rule '%s': '%s %s' matches one or more '%s'",
                                    rule.name(), current.text(), next.text(), core),
                            "use `" + core + "+`"));
                } else if (next.quantifier() == Quantifier.STAR) {
                    issues.add(issue(rule, "redundant-optional",
                            String.format("Rule '%s': the optional '%s' before '%s' is redundant",
                                    rule.name(), current.text(), next.text()),
                            "use `" + core + "*`"));
                }
            }
        }
    }

    private static Issue issue(GrammarRule rule, String type, String message, String suggestion) {
        return Issue.builder()
                .severity(Severity.WARNING)
                .type(type)
                .message(message)
                .ruleName(rule.name())
                .lineNumber(rule.lineNumber())
                .suggestion(suggestion)
                .build();
    }

    private static String wrap(String text) {
        return text.contains(" ") ? "(" + text + ")" : text;
    }
}
