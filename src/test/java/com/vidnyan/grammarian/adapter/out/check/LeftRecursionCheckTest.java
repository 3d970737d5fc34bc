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

class LeftRecursionCheckTest {

    private final LeftRecursionCheck check = new LeftRecursionCheck();

    private CheckResult run(String source) {
        return check.evaluate(CheckContext.of(new GrammarModelBuilder().build(source), CheckOptions.defaults()));
    }

    private static List<Issue> ofType(CheckResult result, String type) {
        return result.issues().stream().filter(i -> i.type().equals(type)).toList();
    }

    @Test
    void evaluate_ShouldReportHiddenLeftRecursionWithPath() {
        // Act
        CheckResult result = run("grammar T;\n"
                + "expr : term PLUS expr | term ;\n"
                + "term : expr TIMES NUMBER | NUMBER ;\n"
                + "PLUS : '+' ;\nTIMES : '*' ;\nNUMBER : [0-9]+ ;\n");

        // Assert
        Issue exprIssue = ofType(result, "hidden-left-recursion").stream()
                .filter(i -> i.ruleName().equals("expr"))
                .findFirst()
                .orElseThrow();
        assertEquals(Severity.ERROR, exprIssue.severity());
        assertTrue(exprIssue.message().endsWith("expr -> term -> expr"), exprIssue.message());
    }

    @Test
    void evaluate_ShouldAcceptDirectLeftRecursion() {
        // Act
        CheckResult result = run("grammar T;\n"
                + "expr : expr PLUS term | term ;\n"
                + "term : NUMBER ;\n"
                + "PLUS : '+' ;\nNUMBER : [0-9]+ ;\n");

        // Assert
        assertTrue(ofType(result, "hidden-left-recursion").isEmpty());
        List<Issue> direct = ofType(result, "direct-left-recursion");
        assertEquals(1, direct.size());
        assertEquals(Severity.INFO, direct.get(0).severity());
    }

    @Test
    void evaluate_ShouldSeeRecursionBehindNullablePrefix() {
        // Act
        CheckResult result = run("grammar T;\n"
                + "a : opt b ;\n"
                + "opt : X? ;\n"
                + "b : a Y | Y ;\n"
                + "X : 'x' ;\nY : 'y' ;\n");

        // Assert
        assertTrue(ofType(result, "hidden-left-recursion").stream().anyMatch(i -> i.ruleName().equals("a")));
    }
}
