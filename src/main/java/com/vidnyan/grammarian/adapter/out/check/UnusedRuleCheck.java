package com.vidnyan.grammarian.adapter.out.check;

import com.vidnyan.grammarian.domain.check.CheckCategory;
import com.vidnyan.grammarian.domain.check.CheckContext;
import com.vidnyan.grammarian.domain.check.CheckResult;
import com.vidnyan.grammarian.domain.check.GrammarCheck;
import com.vidnyan.grammarian.domain.model.Grammar;
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
 * Reports parser rules and fragments that no other rule references.
 * Non-fragment lexer rules are tokens in their own right and are never reported.
 */
@Slf4j
@Component
@Order(30)
public class UnusedRuleCheck implements GrammarCheck {

    @Override
    public boolean supports(CheckCategory category) {
        return category == CheckCategory.VALIDATION;
    }

    @Override
    public CheckResult evaluate(CheckContext context) {
        Instant start = Instant.now();
        Grammar grammar = context.grammar();
        List<Issue> issues = new ArrayList<>();

        String firstParserRule = grammar.parserRules().isEmpty() ? null : grammar.parserRules().get(0).name();

        for (GrammarRule rule : grammar.rules()) {
            if (rule.isLexer() && !rule.fragment()) {
                continue;
            }
            if (rule.name().equals(firstParserRule) || isEntryPoint(rule)) {
                continue;
            }
            if (context.dependencyGraph().referenceCount(rule.name()) > 0) {
                continue;
            }
            issues.add(Issue.builder()
                    .severity(Severity.INFO)
                    .type("unused-rule")
                    .message(String.format("%s '%s' is never referenced",
                            rule.fragment() ? "Fragment" : "Rule", rule.name()))
                    .ruleName(rule.name())
                    .lineNumber(rule.lineNumber())
                    .suggestion("Remove the rule or reference it")
                    .build());
        }

        log.debug("Found {} unused rules", issues.size());
        return CheckResult.success(getName(), issues, Duration.between(start, Instant.now()));
    }

    /**
     * A parser rule with an alternative ending in EOF is a start rule.
     */
    static boolean isEntryPoint(GrammarRule rule) {
        if (!rule.isParser()) {
            return false;
        }
        for (Sequence alt : rule.expression().alternatives()) {
            List<Element> elements = alt.matchable();
            if (!elements.isEmpty() && elements.get(elements.size() - 1).atom() instanceof Atom.RuleRef ref
                    && "EOF".equals(ref.name())) {
                return true;
            }
        }
        return false;
    }
}
