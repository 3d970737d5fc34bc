package com.vidnyan.grammarian.adapter.out.check;

import com.vidnyan.grammarian.domain.check.CheckCategory;
import com.vidnyan.grammarian.domain.check.CheckContext;
import com.vidnyan.grammarian.domain.check.CheckResult;
import com.vidnyan.grammarian.domain.check.GrammarCheck;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.model.Issue;
import com.vidnyan.grammarian.domain.model.Severity;
import com.vidnyan.grammarian.domain.syntax.Sequence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Detects alternatives of one rule that are identical once labels, actions and
 * whitespace are ignored.
 */
@Slf4j
@Component
@Order(110)
public class IdenticalAlternativesCheck implements GrammarCheck {

    @Override
    public boolean supports(CheckCategory category) {
        return category == CheckCategory.AMBIGUITY;
    }

    @Override
    public CheckResult evaluate(CheckContext context) {
        Instant start = Instant.now();
        List<Issue> issues = new ArrayList<>();

        for (GrammarRule rule : context.grammar().rules()) {
            List<Sequence> alternatives = rule.expression().alternatives();
            Map<String, Integer> firstSeen = new HashMap<>();
            for (int i = 0; i < alternatives.size(); i++) {
                String signature = alternatives.get(i).signature();
                Integer earlier = firstSeen.putIfAbsent(signature, i);
                if (earlier == null) {
                    continue;
                }
                issues.add(Issue.builder()
                        .severity(Severity.ERROR)
                        .type("identical-alternatives")
                        .message(String.format("Rule '%s' has identical alternatives %d and %d: %s",
                                rule.name(), earlier + 1, i + 1, signature.isEmpty() ? "<empty>" : signature))
                        .ruleName(rule.name())
                        .lineNumber(rule.lineNumber())
                        .suggestion("Remove duplicate alternative")
                        .build());
            }
        }

        log.debug("Found {} identical alternatives", issues.size());
        return CheckResult.success(getName(), issues, Duration.between(start, Instant.now()));
    }
}
