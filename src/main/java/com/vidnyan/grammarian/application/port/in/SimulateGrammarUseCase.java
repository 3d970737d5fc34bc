package com.vidnyan.grammarian.application.port.in;

import com.vidnyan.grammarian.domain.simulate.RuleMatchResult;
import com.vidnyan.grammarian.domain.simulate.TokenizationResult;

import java.time.Duration;

/**
 * Run a grammar's lexer and parser rules against sample input.
 */
public interface SimulateGrammarUseCase {

    /**
     * Tokenize input with the grammar's lexer rules.
     */
    TokenizationResult tokenize(String source, String input);

    /**
     * Check whether input matches a parser rule.
     */
    RuleMatchResult testRule(TestRuleRequest request);

    /**
     * Rule test parameters.
     */
    record TestRuleRequest(
        String source,
        String ruleName,
        String input,
        Duration oracleTimeout   // null = configured default
    ) {
        public static TestRuleRequest of(String source, String ruleName, String input) {
            return new TestRuleRequest(source, ruleName, input, null);
        }
    }
}
