package com.vidnyan.grammarian.domain.query;

import com.vidnyan.grammarian.application.service.GrammarQueryService;
import com.vidnyan.grammarian.domain.model.LexerMode;
import com.vidnyan.grammarian.domain.model.builder.GrammarModelBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GrammarQueriesTest {

    private static final String CALC = "grammar Calc;\n"
            + "expr : expr PLUS term | term ;\n"
            + "term : NUMBER | '(' expr ')' ;\n"
            + "fragment DIGIT : [0-9] ;\n"
            + "NUMBER : DIGIT+ ;\n"
            + "PLUS : '+' ;\n";

    private final GrammarQueryService queries = new GrammarQueryService(new GrammarModelBuilder());

    @Test
    void findRules_ShouldSupportEveryMatchMode() {
        assertEquals(List.of("term"), queries.findRules(CALC, "term", MatchMode.EXACT).matches());
        assertEquals(List.of("expr", "term"), queries.findRules(CALC, "[a-z]+", MatchMode.REGEX).matches());
        assertEquals(List.of("NUMBER"), queries.findRules(CALC, "*ER*", MatchMode.WILDCARD).matches());
        assertEquals(List.of("term", "NUMBER"), queries.findRules(CALC, "er", MatchMode.PARTIAL).matches());
    }

    @Test
    void findRules_ShouldReportInvalidRegex() {
        // Act
        RuleSearchResult result = queries.findRules(CALC, "(", MatchMode.REGEX);

        // Assert
        assertFalse(result.isSuccess());
        assertTrue(result.matches().isEmpty());
    }

    @Test
    void findUsages_ShouldListEveryReferenceSite() {
        // Act
        List<RuleUsage> usages = queries.findUsages(CALC, "expr");

        // Assert
        assertEquals(2, usages.size());
        assertEquals(List.of("expr", "term"), usages.stream().map(RuleUsage::enclosingRule).toList());
        assertEquals(3, usages.get(1).lineNumber());
        assertEquals("term : NUMBER | '(' expr ')' ;", usages.get(1).lineText());
    }

    @Test
    void ruleStatistics_ShouldCountFanInAndFanOut() {
        // Act
        RuleStatistics stats = queries.ruleStatistics(CALC, "expr").orElseThrow();

        // Assert
        assertEquals(3, stats.fanOut());
        assertEquals(1, stats.fanIn());
        assertEquals(2, stats.alternatives());
        assertTrue(stats.recursive());
        assertTrue(queries.ruleStatistics(CALC, "missing").isEmpty());
    }

    @Test
    void summarize_ShouldCountRuleKinds() {
        // Act
        GrammarSummary summary = queries.summarize(CALC);

        // Assert
        assertEquals("Calc", summary.name());
        assertEquals("COMBINED", summary.kind());
        assertEquals(2, summary.parserRules());
        assertEquals(2, summary.lexerRules());
        assertEquals(1, summary.fragments());
        assertEquals(List.of(LexerMode.DEFAULT_MODE), summary.modes());
        assertFalse(summary.mostReferenced().isEmpty());
    }
}
