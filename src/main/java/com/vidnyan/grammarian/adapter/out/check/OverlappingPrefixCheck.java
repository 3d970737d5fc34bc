package com.vidnyan.grammarian.adapter.out.check;

import com.vidnyan.grammarian.domain.check.CheckCategory;
import com.vidnyan.grammarian.domain.check.CheckContext;
import com.vidnyan.grammarian.domain.check.CheckResult;
import com.vidnyan.grammarian.domain.check.GrammarCheck;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.model.Issue;
import com.vidnyan.grammarian.domain.model.Severity;
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
 * Reports pairs of parser rule alternatives that start with the same elements.
 * The parser needs extra lookahead to choose between them.
 */
@Slf4j
@Component
@Order(120)
public class OverlappingPrefixCheck implements GrammarCheck {

    @Override
    public boolean supports(CheckCategory category) {
        return category == CheckCategory.AMBIGUITY;
    }

    @Override
    public CheckResult evaluate(CheckContext context) {
        Instant start = Instant.now();
        int minLength = context.options().minPrefixLength();
        List<Issue> issues = new ArrayList<>();

        for (GrammarRule rule : context.grammar().parserRules()) {
            List<Sequence> alternatives = rule.expression().alternatives();
            for (int i = 0; i < alternatives.size(); i++) {
                for (int j = i + 1; j < alternatives.size(); j++) {
                    Sequence a = alternatives.get(i);
                    Sequence b = alternatives.get(j);
                    if (a.signature().equals(b.signature())) {
                        continue;
                    }
                    List<String> prefix = sharedPrefix(a.matchable(), b.matchable());
                    if (prefix.size() < minLength) {
                        continue;
                    }
                    issues.add(Issue.builder()
                            .severity(Severity.WARNING)
                            .type("overlapping-prefix")
                            .message(String.format("Alternatives %d and %d of rule '%s' share the prefix '%s'",
                                    i + 1, j + 1, rule.name(), String.join(" ", prefix)))
                            .ruleName(rule.name())
                            .lineNumber(rule.lineNumber())
                            .suggestion("Factor the common prefix out, e.g. '"
                                    + String.join(" ", prefix) + " (...)?'")
                            .build());
                }
            }
        }

        log.debug("Found {} overlapping prefixes", issues.size());
        return CheckResult.success(getName(), issues, Duration.between(start, Instant.now()));
    }

    static List<String> sharedPrefix(List<Element> a, List<Element> b) {
        List<String> prefix = new ArrayList<>();
        for (int k = 0; k < Math.min(a.size(), b.size()); k++) {
            String text = a.get(k).text();
            if (!text.equals(b.get(k).text())) {
                break;
            }
            prefix.add(text);
        }
        return prefix;
    }
}
