package com.vidnyan.grammarian.application.service;

import com.vidnyan.grammarian.GrammarianProperties;
import com.vidnyan.grammarian.adapter.out.oracle.UnavailableGroundTruthOracle;
import com.vidnyan.grammarian.application.port.in.SimulateGrammarUseCase.TestRuleRequest;
import com.vidnyan.grammarian.application.port.out.GroundTruthOracle;
import com.vidnyan.grammarian.application.port.out.GroundTruthOracle.OracleResult;
import com.vidnyan.grammarian.domain.model.builder.GrammarModelBuilder;
import com.vidnyan.grammarian.domain.simulate.Confidence;
import com.vidnyan.grammarian.domain.simulate.MatchOutcome;
import com.vidnyan.grammarian.domain.simulate.RuleMatchResult;
import com.vidnyan.grammarian.domain.simulate.TokenizationResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GrammarSimulationServiceTest {

    private static final String EXPR = "grammar Expr;\n"
            + "expr : expr '+' term | term ;\n"
            + "term : NUMBER ;\n"
            + "NUMBER : [0-9]+ ;\n"
            + "WS : [ ]+ -> skip ;\n";

    private static GrammarSimulationService service(GroundTruthOracle oracle) {
        return new GrammarSimulationService(new GrammarModelBuilder(), oracle, new GrammarianProperties());
    }

    @Test
    void tokenize_ShouldUseGrammarLexerRules() {
        // Act
        TokenizationResult result = service(new UnavailableGroundTruthOracle()).tokenize(EXPR, "12 + 3");

        // Assert
        assertTrue(result.success());
        assertEquals(3, result.parserTokens().size());
    }

    @Test
    void testRule_ShouldSimulateWhenOracleIsUnavailable() {
        // Act
        RuleMatchResult result = service(new UnavailableGroundTruthOracle())
                .testRule(TestRuleRequest.of(EXPR, "expr", "1 + 2 + 3"));

        // Assert
        assertEquals(MatchOutcome.MATCHED, result.outcome());
        assertEquals(Confidence.HIGH, result.confidence());
        assertEquals(RuleMatchResult.Source.SIMULATION, result.source());
    }

    @Test
    void testRule_ShouldReportTokenizationErrors() {
        // Act
        RuleMatchResult result = service(new UnavailableGroundTruthOracle())
                .testRule(TestRuleRequest.of(EXPR, "expr", "1 $ 2"));

        // Assert
        assertEquals(MatchOutcome.MISMATCH, result.outcome());
        assertTrue(result.message().startsWith("Input has tokenization errors"), result.message());
    }

    @Test
    void testRule_ShouldRejectLexerRuleAsEntry() {
        // Act
        RuleMatchResult result = service(new UnavailableGroundTruthOracle())
                .testRule(TestRuleRequest.of(EXPR, "NUMBER", "1"));

        // Assert
        assertFalse(result.matched());
        assertTrue(result.message().contains("not found"));
    }

    @Test
    void testRule_ShouldPreferOracleVerdict() {
        // Arrange
        GroundTruthOracle oracle = (grammar, rule, input) ->
                OracleResult.answered(false, "(expr (term 1))", List.of("line 1:2 extraneous input"));

        // Act
        RuleMatchResult result = service(oracle).testRule(TestRuleRequest.of(EXPR, "expr", "1 + 2"));

        // Assert
        assertEquals(RuleMatchResult.Source.ORACLE, result.source());
        assertEquals(MatchOutcome.MISMATCH, result.outcome());
        assertTrue(result.message().contains("extraneous input"));
        assertTrue(result.notes().contains("Parse tree: (expr (term 1))"));
    }

    @Test
    void testRule_ShouldFallBackWhenOracleTimesOut() {
        // Arrange
        GroundTruthOracle slow = (grammar, rule, input) -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return OracleResult.answered(false, null, List.of());
        };
        TestRuleRequest request = new TestRuleRequest(EXPR, "expr", "1 + 2", Duration.ofMillis(50));

        // Act
        RuleMatchResult result = service(slow).testRule(request);

        // Assert
        assertEquals(RuleMatchResult.Source.SIMULATION, result.source());
        assertTrue(result.matched());
    }

    @Test
    void testRule_ShouldFallBackWhenOracleFails() {
        // Arrange
        GroundTruthOracle failing = (grammar, rule, input) -> {
            throw new IllegalStateException("tool missing");
        };

        // Act
        RuleMatchResult result = service(failing).testRule(TestRuleRequest.of(EXPR, "expr", "1"));

        // Assert
        assertEquals(RuleMatchResult.Source.SIMULATION, result.source());
        assertTrue(result.matched());
    }
}
