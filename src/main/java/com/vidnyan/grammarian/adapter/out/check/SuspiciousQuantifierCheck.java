package com.vidnyan.grammarian.adapter.out.check;

import com.vidnyan.grammarian.domain.check.CheckCategory;
import com.vidnyan.grammarian.domain.check.CheckContext;
import com.vidnyan.grammarian.domain.check.CheckResult;
import com.vidnyan.grammarian.domain.check.GrammarCheck;
import com.vidnyan.grammarian.domain.check.SuspiciousQuantifiers;
import com.vidnyan.grammarian.domain.model.Issue;
import com.vidnyan.grammarian.domain.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Flags {@code ?} suffixes that likely should be {@code *}.
 * The rewriter can fix trailing optional groups of flagged rules.
 */
@Slf4j
@Component
@Order(140)
public class SuspiciousQuantifierCheck implements GrammarCheck {

    @Override
    public boolean supports(CheckCategory category) {
        return category == CheckCategory.QUALITY;
    }

    @Override
    public CheckResult evaluate(CheckContext context) {
        Instant start = Instant.now();
        List<Issue> issues = SuspiciousQuantifiers.find(context.grammar()).stream()
                .map(f -> Issue.builder()
                        .severity(Severity.INFO)
                        .type("suspicious-quantifier")
                        .message(String.format("Rule '%s': %s (%s)", f.ruleName(), f.text(), f.reasoning()))
                        .ruleName(f.ruleName())
                        .lineNumber(f.lineNumber())
                        .suggestion(f.suggestion())
                        .build())
                .toList();
        log.debug("Found {} suspicious quantifiers", issues.size());
        return CheckResult.success(getName(), issues, Duration.between(start, Instant.now()));
    }
}
