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
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AmbiguityChecksTest {

    private final GrammarModelBuilder builder = new GrammarModelBuilder();

    private CheckContext context(String source) {
        return CheckContext.of(builder.build(source), CheckOptions.defaults());
    }

    @Test
    void identicalAlternatives_ShouldReportRepeatedAlternative() {
        // Arrange
        CheckContext context = context("grammar T;\nexpr : ID | NUMBER | ID ;\nID : [a-z]+ ;\nNUMBER : [0-9]+ ;\n");

        // Act
        CheckResult result = new IdenticalAlternativesCheck().evaluate(context);

        // Assert
        assertEquals(CheckResult.CheckStatus.SUCCESS, result.status());
        assertEquals(1, result.issues().size());
        Issue issue = result.issues().get(0);
        assertEquals(Severity.ERROR, issue.severity());
        assertEquals("identical-alternatives", issue.type());
        assertEquals("expr", issue.ruleName());
        assertTrue(issue.message().contains("1 and 3"));
    }

    @Test
    void identicalAlternatives_ShouldIgnoreDistinctAlternatives() {
        CheckResult result = new IdenticalAlternativesCheck()
                .evaluate(context("grammar T;\nexpr : ID | NUMBER ;\nID : [a-z]+ ;\nNUMBER : [0-9]+ ;\n"));

        assertFalse(result.hasIssues());
    }

    @Test
    void overlappingPrefix_ShouldWarnAboutSharedLeadingElements() {
        // Arrange
        CheckContext context = context("grammar T;\n"
                + "stmt : IF e THEN s | IF e THEN s ELSE s ;\n"
                + "e : ID ;\n"
                + "s : ID ;\n");

        // Act
        CheckResult result = new OverlappingPrefixCheck().evaluate(context);

        // Assert
        List<Issue> warnings = result.issues().stream()
                .filter(i -> i.type().equals("overlapping-prefix"))
                .toList();
        assertEquals(1, warnings.size());
        assertEquals(Severity.WARNING, warnings.get(0).severity());
        assertTrue(warnings.get(0).message().contains("IF e THEN s"));
    }

    @Test
    void overlappingPrefix_ShouldRespectMinimumPrefixLength() {
        // Arrange
        String source = "grammar T;\nr : A B | A C ;\nA : 'a' ;\nB : 'b' ;\nC : 'c' ;\n";
        CheckContext strict = CheckContext.of(builder.build(source), new CheckOptions(false, 2, Set.of()));
        CheckContext loose = CheckContext.of(builder.build(source), new CheckOptions(false, 1, Set.of()));

        // Act & Assert
        assertFalse(new OverlappingPrefixCheck().evaluate(strict).hasIssues());
        assertEquals(1, new OverlappingPrefixCheck().evaluate(loose).issues().size());
    }

    @Test
    void lexerConflict_ShouldWarnWhenBroaderRuleIsDeclaredFirst() {
        // Arrange
        CheckContext context = context("lexer grammar L;\nID : [a-z]+ ;\nIF : 'if' ;\n");

        // Act
        CheckResult result = new LexerConflictCheck().evaluate(context);

        // Assert
        assertEquals(1, result.issues().size());
        Issue issue = result.issues().get(0);
        assertEquals(Severity.WARNING, issue.severity());
        assertEquals("lexer-conflict", issue.type());
        assertEquals("IF", issue.ruleName());
    }

    @Test
    void lexerConflict_ShouldOnlyNoteConflictWhenLiteralComesFirst() {
        // Arrange
        CheckContext context = context("lexer grammar L;\nIF : 'if' ;\nID : [a-z]+ ;\n");

        // Act
        CheckResult result = new LexerConflictCheck().evaluate(context);

        // Assert
        assertEquals(1, result.issues().size());
        assertEquals(Severity.INFO, result.issues().get(0).severity());
    }

    @Test
    void supports_ShouldPlaceChecksInAmbiguityFamily() {
        assertTrue(new IdenticalAlternativesCheck().supports(CheckCategory.AMBIGUITY));
        assertTrue(new OverlappingPrefixCheck().supports(CheckCategory.AMBIGUITY));
        assertFalse(new OverlappingPrefixCheck().supports(CheckCategory.VALIDATION));
        assertTrue(new LexerModeCheck().supports(CheckCategory.MODES));
    }
}
