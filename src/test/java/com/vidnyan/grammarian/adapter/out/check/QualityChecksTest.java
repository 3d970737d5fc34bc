package com.vidnyan.grammarian.adapter.out.check;

import com.vidnyan.grammarian.domain.check.CheckCategory;
import com.vidnyan.grammarian.domain.check.CheckContext;
import com.vidnyan.grammarian.domain.check.CheckOptions;
import com.vidnyan.grammarian.domain.check.CheckResult;
import com.vidnyan.grammarian.domain.model.Issue;
import com.vidnyan.grammarian.domain.model.Severity;
import com.vidnyan.grammarian.domain.model.builder.GrammarModelBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QualityChecksTest {

    private final GrammarModelBuilder builder = new GrammarModelBuilder();

    private CheckContext context(String source) {
        return CheckContext.of(builder.build(source), CheckOptions.defaults());
    }

    @Test
    void suspiciousQuantifier_ShouldFlagRunOfOptionalElements() {
        // Arrange
        CheckContext context = context("grammar T;\nopts : A? B? C? D ;\nA : 'a' ;\nB : 'b' ;\nC : 'c' ;\nD : 'd' ;\n");

        // Act
        CheckResult result = new SuspiciousQuantifierCheck().evaluate(context);

        // Assert
        assertEquals(1, result.issues().size());
        Issue issue = result.issues().get(0);
        assertEquals(Severity.INFO, issue.severity());
        assertEquals("suspicious-quantifier", issue.type());
        assertEquals("opts", issue.ruleName());
        assertEquals(2, issue.lineNumber());
        assertTrue(issue.message().contains("A? B? C?"));
        assertTrue(issue.suggestion().contains("(A | B | C)*"));
    }

    @Test
    void suspiciousQuantifier_ShouldFlagSameOptionalElementTwice() {
        // Act
        CheckResult result = new SuspiciousQuantifierCheck()
                .evaluate(context("grammar T;\npair : KEY? VALUE KEY? ;\nKEY : 'k' ;\nVALUE : 'v' ;\n"));

        // Assert
        assertEquals(1, result.issues().size());
        assertTrue(result.issues().get(0).message().contains("KEY? appears 2 times"));
        assertEquals("Use KEY* for multiple occurrences", result.issues().get(0).suggestion());
    }

    @Test
    void suspiciousQuantifier_ShouldFlagOptionalItemInCollectionNamedRule() {
        // Act
        CheckResult result = new SuspiciousQuantifierCheck()
                .evaluate(context("grammar T;\nconfig_setting : KEY (VALUE)? ;\nKEY : 'k' ;\nVALUE : 'v' ;\n"));

        // Assert
        assertEquals(1, result.issues().size());
        assertEquals("config_setting", result.issues().get(0).ruleName());
        assertTrue(result.issues().get(0).message().contains("(VALUE)?"));
    }

    @Test
    void suspiciousQuantifier_ShouldIgnoreSingleOptionalsAndNonGreedySuffixes() {
        // Act
        CheckResult result = new SuspiciousQuantifierCheck()
                .evaluate(context("grammar T;\nstmt : ID? ';' ;\nlazy : A?? B?? C?? ;\n"
                        + "ID : [a-z]+ ;\nA : 'a' ;\nB : 'b' ;\nC : 'c' ;\n"));

        // Assert
        assertFalse(result.hasIssues());
    }

    @Test
    void incompleteParsing_ShouldFlagRestOfLineAndBareNegation() {
        // Arrange
        CheckContext context = context("grammar T;\n"
                + "line : KEY null_rest_of_line ;\n"
                + "null_rest_of_line : REST ;\n"
                + "KEY : [a-z]+ ;\n"
                + "REST : ~[\\r\\n]+ ;\n");

        // Act
        CheckResult result = new IncompleteParsingCheck().evaluate(context);

        // Assert
        assertEquals(2, result.issues().size());
        assertEquals(List.of("line", "REST"), result.issues().stream().map(Issue::ruleName).toList());
        assertTrue(result.issues().stream().allMatch(i -> i.type().equals("incomplete-parsing")));
    }

    @Test
    void incompleteParsing_ShouldIgnoreStructuredLexerRules() {
        // Act
        CheckResult result = new IncompleteParsingCheck()
                .evaluate(context("grammar T;\nstart : STRING ;\nSTRING : '\"' ~[\"]* '\"' ;\n"));

        // Assert
        assertFalse(result.hasIssues());
    }

    @Test
    void qualityChecks_ShouldOnlyJoinQualityCategory() {
        assertTrue(new SuspiciousQuantifierCheck().supports(CheckCategory.QUALITY));
        assertTrue(new IncompleteParsingCheck().supports(CheckCategory.QUALITY));
        assertFalse(new IncompleteParsingCheck().supports(CheckCategory.VALIDATION));
    }
}
