package com.vidnyan.grammarian.adapter.out.check;

import com.vidnyan.grammarian.domain.check.CheckCategory;
import com.vidnyan.grammarian.domain.check.CheckContext;
import com.vidnyan.grammarian.domain.check.CheckResult;
import com.vidnyan.grammarian.domain.check.GrammarCheck;
import com.vidnyan.grammarian.domain.check.TokenPatternSuggester;
import com.vidnyan.grammarian.domain.graph.RuleDependencyGraph;
import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.model.Issue;
import com.vidnyan.grammarian.domain.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reports references to names that no rule, declared token or built-in defines.
 */
@Slf4j
@Component
@Order(20)
public class UndefinedReferenceCheck implements GrammarCheck {

    static final String BUILTIN_EOF = "EOF";

    @Override
    public boolean supports(CheckCategory category) {
        return category == CheckCategory.VALIDATION;
    }

    @Override
    public CheckResult evaluate(CheckContext context) {
        Instant start = Instant.now();
        Grammar grammar = context.grammar();

        // names may come from an imported grammar or a token vocabulary we have not loaded
        if (!context.options().multiFile() && grammar.hasExternalVocabulary()) {
            log.debug("Skipping undefined references for '{}': external vocabulary", grammar.name());
            return CheckResult.success(getName(), List.of(), Duration.between(start, Instant.now()));
        }

        RuleDependencyGraph graph = context.dependencyGraph();
        List<Issue> issues = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : graph.undefinedReferences().entrySet()) {
            GrammarRule rule = grammar.findRule(entry.getKey()).orElseThrow();
            for (String name : entry.getValue()) {
                if (BUILTIN_EOF.equals(name) || grammar.declaredTokens().contains(name)) {
                    continue;
                }
                issues.add(Issue.builder()
                        .severity(Severity.WARNING)
                        .type("undefined-reference")
                        .message(String.format("Rule '%s' references undefined rule '%s'", rule.name(), name))
                        .ruleName(rule.name())
                        .lineNumber(rule.lineNumber())
                        .suggestion(suggestionFor(name))
                        .build());
            }
        }

        log.debug("Found {} undefined references", issues.size());
        return CheckResult.success(getName(), issues, Duration.between(start, Instant.now()));
    }

    static String suggestionFor(String name) {
        return TokenPatternSuggester.suggest(name)
                .map(s -> String.format("Define it, e.g. '%s' (%s), or declare it in a tokens block",
                        s.definition(), s.reasoning()))
                .orElse(String.format("Define '%s' or declare it in a tokens block", name));
    }
}
