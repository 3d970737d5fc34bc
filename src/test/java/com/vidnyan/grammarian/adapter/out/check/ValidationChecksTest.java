package com.vidnyan.grammarian.adapter.out.check;

import com.vidnyan.grammarian.domain.check.CheckContext;
import com.vidnyan.grammarian.domain.check.CheckOptions;
import com.vidnyan.grammarian.domain.check.CheckResult;
import com.vidnyan.grammarian.domain.model.Issue;
import com.vidnyan.grammarian.domain.model.Severity;
import com.vidnyan.grammarian.domain.model.builder.GrammarModelBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValidationChecksTest {

    private static CheckContext context(String source) {
        return CheckContext.of(new GrammarModelBuilder().build(source), CheckOptions.defaults());
    }

    @Test
    void undefinedReference_ShouldReportMissingRuleButNotEof() {
        // Act
        CheckResult result = new UndefinedReferenceCheck()
                .evaluate(context("grammar T;\nstart : item EOF ;\nitem : ID | missing ;\nID : [a-z]+ ;\n"));

        // Assert
        assertEquals(1, result.issues().size());
        assertTrue(result.issues().get(0).message().contains("'missing'"));
    }

    @Test
    void undefinedReference_ShouldSkipGrammarWithImportsWhenAnalyzedAlone() {
        // Act
        CheckResult result = new UndefinedReferenceCheck()
                .evaluate(context("grammar T;\nimport Common;\nstart : value EOF ;\n"));

        // Assert
        assertFalse(result.hasIssues());
    }

    @Test
    void unusedRule_ShouldIgnoreStartRuleAndTokens() {
        // Act
        CheckResult result = new UnusedRuleCheck().evaluate(context("grammar T;\n"
                + "start : ID EOF ;\n"
                + "orphan : ID ;\n"
                + "fragment DIGIT : [0-9] ;\n"
                + "ID : [a-z]+ ;\n"));

        // Assert
        List<String> unused = result.issues().stream().map(Issue::ruleName).toList();
        assertEquals(List.of("orphan", "DIGIT"), unused);
    }

    @Test
    void structure_ShouldRejectParserRuleInLexerGrammar() {
        // Act
        CheckResult result = new GrammarStructureCheck()
                .evaluate(context("lexer grammar L;\nexpr : ID ;\nID : [a-z]+ ;\n"));

        // Assert
        assertTrue(result.issues().stream().anyMatch(i -> i.type().equals("parser-rule-in-lexer-grammar")));
    }

    @Test
    void structure_ShouldReportMissingDeclaration() {
        // Act
        CheckResult result = new GrammarStructureCheck().evaluate(context("start : ID ;\nID : [a-z]+ ;\n"));

        // Assert
        assertTrue(result.issues().stream().anyMatch(i -> i.type().equals("missing-grammar-declaration")));
    }

    @Test
    void namingConvention_ShouldFlagGrammarLexerRuleAndMode() {
        // Act
        CheckResult result = new NamingConventionCheck().evaluate(context("lexer grammar my_lexer;\n"
                + "Id : [a-z]+ ;\n"
                + "mode inner;\n"
                + "X : 'x' -> popMode ;\n"));

        // Assert
        assertEquals(3, result.issues().size());
        assertEquals(1, result.issues().stream().filter(i -> i.severity() == Severity.WARNING).count());
        assertTrue(result.issues().get(0).suggestion().contains("'MyLexer'"));
    }
}
