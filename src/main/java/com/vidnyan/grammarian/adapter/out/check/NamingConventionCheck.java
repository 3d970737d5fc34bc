package com.vidnyan.grammarian.adapter.out.check;

import com.vidnyan.grammarian.domain.check.CheckCategory;
import com.vidnyan.grammarian.domain.check.CheckContext;
import com.vidnyan.grammarian.domain.check.CheckResult;
import com.vidnyan.grammarian.domain.check.GrammarCheck;
import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.model.Issue;
import com.vidnyan.grammarian.domain.model.LexerMode;
import com.vidnyan.grammarian.domain.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Naming conventions: PascalCase grammar names, upper case lexer rules and modes.
 */
@Slf4j
@Component
@Order(50)
public class NamingConventionCheck implements GrammarCheck {

    private static final Pattern PASCAL_CASE = Pattern.compile("[A-Z][A-Za-z0-9]*");

    @Override
    public boolean supports(CheckCategory category) {
        return category == CheckCategory.VALIDATION;
    }

    @Override
    public CheckResult evaluate(CheckContext context) {
        Instant start = Instant.now();
        Grammar grammar = context.grammar();
        List<Issue> issues = new ArrayList<>();

        if (grammar.isDeclared() && !PASCAL_CASE.matcher(grammar.name()).matches()) {
            issues.add(Issue.builder()
                    .severity(Severity.WARNING)
                    .type("naming-convention")
                    .message(String.format("Grammar name '%s' should be PascalCase", grammar.name()))
                    .lineNumber(grammar.declarationLine())
                    .suggestion("Rename the grammar and its file, e.g. '" + toPascalCase(grammar.name()) + "'")
                    .build());
        }

        for (GrammarRule rule : grammar.lexerRules()) {
            if (!rule.name().equals(rule.name().toUpperCase(Locale.ROOT))) {
                issues.add(Issue.builder()
                        .severity(Severity.INFO)
                        .type("naming-convention")
                        .message(String.format("Lexer rule '%s' contains lower case letters", rule.name()))
                        .ruleName(rule.name())
                        .lineNumber(rule.lineNumber())
                        .suggestion("Lexer rules are conventionally UPPER_CASE, e.g. '"
                                + rule.name().toUpperCase(Locale.ROOT) + "'")
                        .build());
            }
        }

        for (LexerMode mode : grammar.modes()) {
            if (!mode.name().equals(mode.name().toUpperCase(Locale.ROOT))) {
                issues.add(Issue.builder()
                        .severity(Severity.INFO)
                        .type("naming-convention")
                        .message(String.format("Mode '%s' should be upper case", mode.name()))
                        .lineNumber(mode.lineNumber())
                        .suggestion("Rename to '" + mode.name().toUpperCase(Locale.ROOT) + "'")
                        .build());
            }
        }

        return CheckResult.success(getName(), issues, Duration.between(start, Instant.now()));
    }

    private static String toPascalCase(String name) {
        StringBuilder sb = new StringBuilder();
        boolean upper = true;
        for (char c : name.toCharArray()) {
            if (c == '_' || c == '-') {
                upper = true;
            } else {
                sb.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return sb.toString();
    }
}
