package com.vidnyan.grammarian.adapter.out.check;

import com.vidnyan.grammarian.domain.check.CheckContext;
import com.vidnyan.grammarian.domain.check.CheckOptions;
import com.vidnyan.grammarian.domain.check.CheckResult;
import com.vidnyan.grammarian.domain.check.ModeAnalysis;
import com.vidnyan.grammarian.domain.model.Severity;
import com.vidnyan.grammarian.domain.model.builder.GrammarModelBuilder;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LexerModeCheckTest {

    private static final String STRING_LEXER = "lexer grammar StrLexer;\n"
            + "QUOTE : '\"' -> pushMode(STRING_MODE) ;\n"
            + "COMMENT_START : '/*' -> pushMode(COMMENT_MODE) ;\n"
            + "\n"
            + "mode STRING_MODE;\n"
            + "STR_TEXT : ~[\"]+ ;\n"
            + "STR_END : '\"' -> popMode ;\n"
            + "\n"
            + "mode COMMENT_MODE;\n"
            + "COMMENT_END : '*/' -> popMode ;\n"
            + "COMMENT_TEXT : . ;\n";

    private static CheckContext context(String source) {
        return CheckContext.of(new GrammarModelBuilder().build(source), CheckOptions.defaults());
    }

    @Test
    void evaluate_ShouldAcceptBalancedModes() {
        // Arrange
        CheckContext context = context(STRING_LEXER);

        // Act
        CheckResult result = new LexerModeCheck().evaluate(context);
        ModeAnalysis modes = ModeAnalysis.of(context.grammar(), context.modeGraph());

        // Assert
        assertTrue(result.issues().stream().noneMatch(i -> i.severity() != Severity.INFO), () -> "" + result.issues());
        assertEquals(3, modes.modeCount());
        assertEquals(2, modes.entryPoints().size());
        assertEquals(2, modes.exitPoints().size());
    }

    @Test
    void evaluate_ShouldReportUndefinedMode() {
        // Act
        CheckResult result = new LexerModeCheck()
                .evaluate(context("lexer grammar L;\nOPEN : '<' -> pushMode(TAG) ;\n"));

        // Assert
        assertTrue(result.issues().stream()
                .anyMatch(i -> i.type().equals("undefined-mode") && i.ruleName().equals("OPEN")));
    }

    @Test
    void evaluate_ShouldReportPopFromDefaultMode() {
        // Act
        CheckResult result = new LexerModeCheck()
                .evaluate(context("lexer grammar L;\nCLOSE : '>' -> popMode ;\n"));

        // Assert
        assertTrue(result.issues().stream()
                .anyMatch(i -> i.type().equals("pop-from-default-mode") && i.severity() == Severity.ERROR));
    }

    @Test
    void evaluate_ShouldWarnAboutModeNeverEntered() {
        // Act
        CheckResult result = new LexerModeCheck()
                .evaluate(context("lexer grammar L;\nA : 'a' ;\nmode ISLAND;\nB : 'b' -> popMode ;\n"));

        // Assert
        assertTrue(result.issues().stream().anyMatch(i -> i.type().equals("unreachable-mode")));
    }
}
