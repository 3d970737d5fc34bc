package com.vidnyan.grammarian.adapter.out.check;

import com.vidnyan.grammarian.domain.check.CheckCategory;
import com.vidnyan.grammarian.domain.check.CheckContext;
import com.vidnyan.grammarian.domain.check.CheckResult;
import com.vidnyan.grammarian.domain.check.GrammarCheck;
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

/**
 * Reports structural problems: issues recorded while scanning and building the model,
 * a missing grammar declaration and rules of the wrong kind for the grammar.
 */
@Slf4j
@Component
@Order(10)
public class GrammarStructureCheck implements GrammarCheck {

    @Override
    public boolean supports(CheckCategory category) {
        return category == CheckCategory.VALIDATION;
    }

    @Override
    public CheckResult evaluate(CheckContext context) {
        Instant start = Instant.now();
        Grammar grammar = context.grammar();
        List<Issue> issues = new ArrayList<>(grammar.issues());

        if (!grammar.isDeclared()) {
            issues.add(Issue.builder()
                    .severity(Severity.ERROR)
                    .type("missing-grammar-declaration")
                    .message("No grammar declaration found")
                    .lineNumber(1)
                    .suggestion("Start the file with 'grammar Name;', 'lexer grammar Name;' or 'parser grammar Name;'")
                    .build());
        } else {
            for (GrammarRule rule : grammar.rules()) {
                if (rule.isParser() && !grammar.kind().allowsParserRules()) {
                    issues.add(Issue.builder()
                            .severity(Severity.ERROR)
                            .type("parser-rule-in-lexer-grammar")
                            .message(String.format("Parser rule '%s' is not allowed in lexer grammar '%s'",
                                    rule.name(), grammar.name()))
                            .ruleName(rule.name())
                            .lineNumber(rule.lineNumber())
                            .suggestion("Move the rule to a parser grammar or rename it in upper case")
                            .build());
                } else if (rule.isLexer() && !grammar.kind().allowsLexerRules()) {
                    issues.add(Issue.builder()
                            .severity(Severity.ERROR)
                            .type("lexer-rule-in-parser-grammar")
                            .message(String.format("Lexer rule '%s' is not allowed in parser grammar '%s'",
                                    rule.name(), grammar.name()))
                            .ruleName(rule.name())
                            .lineNumber(rule.lineNumber())
                            .suggestion("Move the rule to the lexer grammar")
                            .build());
                }
            }
        }

        log.debug("Structure check found {} issues", issues.size());
        return CheckResult.success(getName(), issues, Duration.between(start, Instant.now()));
    }
}
