package com.vidnyan.grammarian.adapter.out.check;

import com.vidnyan.grammarian.domain.check.CheckCategory;
import com.vidnyan.grammarian.domain.check.CheckContext;
import com.vidnyan.grammarian.domain.check.CheckResult;
import com.vidnyan.grammarian.domain.check.GrammarCheck;
import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.model.Issue;
import com.vidnyan.grammarian.domain.model.Severity;
import com.vidnyan.grammarian.domain.simulate.LexerPatternCompiler;
import com.vidnyan.grammarian.domain.simulate.LexerSimulator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Finds literal lexer rules whose text another lexer rule of the same mode also matches.
 *
 * With equal match lengths the rule declared first wins, so a keyword declared after a
 * broader identifier rule can never be produced.
 */
@Slf4j
@Component
@Order(140)
public class LexerConflictCheck implements GrammarCheck {

    @Override
    public boolean supports(CheckCategory category) {
        return category == CheckCategory.AMBIGUITY;
    }

    @Override
    public CheckResult evaluate(CheckContext context) {
        Instant start = Instant.now();
        Grammar grammar = context.grammar();
        LexerPatternCompiler compiler = new LexerPatternCompiler(grammar);

        List<GrammarRule> tokens = grammar.lexerRules().stream().filter(r -> !r.fragment()).toList();
        Map<String, Optional<Pattern>> patterns = new LinkedHashMap<>();
        tokens.forEach(r -> patterns.put(r.name(), compiler.compile(r)));

        List<Issue> issues = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            GrammarRule literalRule = tokens.get(i);
            Optional<String> literal = LexerSimulator.singleLiteral(literalRule);
            if (literal.isEmpty() || literal.get().isEmpty()) {
                continue;
            }
            for (int j = 0; j < tokens.size(); j++) {
                GrammarRule other = tokens.get(j);
                if (i == j || !other.mode().equals(literalRule.mode())) {
                    continue;
                }
                Optional<Pattern> pattern = patterns.get(other.name());
                if (pattern.isEmpty() || !pattern.get().matcher(literal.get()).matches()) {
                    continue;
                }
                issues.add(j < i ? shadowed(literalRule, other, literal.get()) : ordered(literalRule, other, literal.get()));
            }
        }

        log.debug("Found {} lexer conflicts", issues.size());
        return CheckResult.success(getName(), issues, Duration.between(start, Instant.now()));
    }

    private static Issue shadowed(GrammarRule literalRule, GrammarRule broader, String text) {
        return Issue.builder()
                .severity(Severity.WARNING)
                .type("lexer-conflict")
                .message(String.format("Token '%s' can never be matched: '%s' is also matched by '%s', declared earlier",
                        literalRule.name(), text, broader.name()))
                .ruleName(literalRule.name())
                .lineNumber(literalRule.lineNumber())
                .suggestion(String.format("Move '%s' above '%s'", literalRule.name(), broader.name()))
                .build();
    }

    private static Issue ordered(GrammarRule literalRule, GrammarRule broader, String text) {
        return Issue.builder()
                .severity(Severity.INFO)
                .type("lexer-conflict")
                .message(String.format("'%s' is matched by both '%s' and '%s'; '%s' wins by declaration order",
                        text, literalRule.name(), broader.name(), literalRule.name()))
                .ruleName(literalRule.name())
                .lineNumber(literalRule.lineNumber())
                .build();
    }
}
