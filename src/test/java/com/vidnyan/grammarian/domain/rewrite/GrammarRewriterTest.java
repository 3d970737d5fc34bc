package com.vidnyan.grammarian.domain.rewrite;

import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.model.builder.GrammarModelBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GrammarRewriterTest {

    private static final String CALC = "grammar Calc;\n"
            + "\n"
            + "expr : term (PLUS term)* ;\n"
            + "\n"
            + "term : NUMBER ;\n"
            + "\n"
            + "PLUS : '+' ;\n"
            + "NUMBER : [0-9]+ ;\n";

    private static final String COMPACT = "grammar T;\n"
            + "a : B ;\n"
            + "c : D ;\n"
            + "B : 'b' ;\n"
            + "D : 'd' ;\n";

    private final GrammarRewriter rewriter = new GrammarRewriter();

    private static List<String> ruleOrder(String source) {
        Grammar grammar = new GrammarModelBuilder().build(source);
        return grammar.rules().stream().map(GrammarRule::name).toList();
    }

    @Test
    void updateRule_ShouldOnlyTouchTheRuleBody() {
        // Act
        RewriteResult result = rewriter.updateRule(CALC, "term", "NUMBER | '(' expr ')'");

        // Assert
        assertTrue(result.isSuccess(), result.message());
        assertEquals(CALC.replace("term : NUMBER ;", "term : NUMBER | '(' expr ')' ;"), result.content());
    }

    @Test
    void updateRule_ShouldFailForUnknownRule() {
        RewriteResult result = rewriter.updateRule(CALC, "factor", "NUMBER");

        assertFalse(result.isSuccess());
        assertEquals(CALC, result.content());
    }

    @Test
    void addRule_ShouldInsertAlphabeticallyAmongParserRules() {
        // Act
        RewriteResult result = rewriter.addRule(COMPACT, AddRuleRequest.of("b", "D"));

        // Assert
        assertTrue(result.isSuccess(), result.message());
        assertEquals("grammar T;\na : B ;\nb : D ;\nc : D ;\nB : 'b' ;\nD : 'd' ;\n", result.content());
    }

    @Test
    void addRule_ShouldInsertLexerRuleAmongLexerRules() {
        // Act
        RewriteResult result = rewriter.addRule(COMPACT, AddRuleRequest.of("A", "'a'"));

        // Assert
        assertTrue(result.isSuccess(), result.message());
        assertEquals(List.of("a", "c", "A", "B", "D"), ruleOrder(result.content()));
    }

    @Test
    void addRule_ShouldRejectExistingName() {
        // Act
        RewriteResult result = rewriter.addRule(COMPACT, AddRuleRequest.of("a", "D"));

        // Assert
        assertFalse(result.isSuccess());
        assertTrue(result.message().contains("already exists"));
        assertEquals(COMPACT, result.content());
    }

    @Test
    void addRule_ShouldKeepBlankLineConvention() {
        // Act
        RewriteResult result = rewriter.addRule(CALC, AddRuleRequest.builder().name("factor").body("NUMBER").build());

        // Assert
        assertTrue(result.isSuccess(), result.message());
        assertTrue(result.content().contains("expr : term (PLUS term)* ;\n\nfactor : NUMBER ;\n\nterm : NUMBER ;\n"),
                result.content());
    }

    @Test
    void removeRule_ShouldDropRuleAndFollowingBlankLine() {
        // Act
        RewriteResult result = rewriter.removeRule(CALC, "term");

        // Assert
        assertTrue(result.isSuccess(), result.message());
        assertEquals("grammar Calc;\n\nexpr : term (PLUS term)* ;\n\nPLUS : '+' ;\nNUMBER : [0-9]+ ;\n",
                result.content());
        assertEquals(1L, result.stats().get("remainingReferences"));
    }

    @Test
    void renameRule_ShouldRenameDefinitionAndReferences() {
        // Act
        RewriteResult result = rewriter.renameRule(CALC, "term", "operand");

        // Assert
        assertTrue(result.isSuccess(), result.message());
        assertFalse(result.content().contains("term"));
        assertEquals(3, result.stats().get("occurrences"));
        assertEquals(2, result.stats().get("references"));
    }

    @Test
    void renameRule_ShouldRefuseKindChange() {
        RewriteResult result = rewriter.renameRule(CALC, "term", "TERM");

        assertFalse(result.isSuccess());
        assertTrue(result.message().contains("rule kind"));
    }

    @Test
    void sortRules_ShouldOrderAlphabeticallyAndBeIdempotent() {
        // Arrange
        String source = "grammar T;\n\n"
                + "stmt : expr SEMI ;\n\n"
                + "expr : atom ;\n\n"
                + "atom : ID ;\n\n"
                + "SEMI : ';' ;\n\n"
                + "ID : [a-z]+ ;\n";

        // Act
        RewriteResult first = rewriter.sortRules(source, SortStrategy.ALPHABETICAL, SortOptions.defaults());
        RewriteResult second = rewriter.sortRules(first.content(), SortStrategy.ALPHABETICAL, SortOptions.defaults());

        // Assert
        assertTrue(first.isSuccess(), first.message());
        assertEquals("grammar T;\n\n"
                + "atom : ID ;\n\n"
                + "expr : atom ;\n\n"
                + "stmt : expr SEMI ;\n\n"
                + "ID : [a-z]+ ;\n\n"
                + "SEMI : ';' ;\n", first.content());
        assertTrue(second.isSuccess());
        assertEquals("Rules are already in order", second.message());
        assertEquals(first.content(), second.content());
    }

    @Test
    void sortRules_ShouldRefuseRulesSharingALine() {
        // Arrange
        String source = "grammar T;\nb : A ; a : A ;\nA : 'a' ;\n";

        // Act
        RewriteResult result = rewriter.sortRules(source, SortStrategy.ALPHABETICAL, SortOptions.defaults());

        // Assert
        assertFalse(result.isSuccess());
        assertEquals(source, result.content());
    }

    @Test
    void moveRule_ShouldPlaceRuleBeforeAnchor() {
        // Act
        RewriteResult result = rewriter.moveRule(COMPACT, "c", "a", MovePosition.BEFORE);

        // Assert
        assertTrue(result.isSuccess(), result.message());
        assertEquals(List.of("c", "a", "B", "D"), ruleOrder(result.content()));
    }

    @Test
    void inlineRule_ShouldReplaceReferenceAndRemoveRule() {
        // Arrange
        String source = "grammar T;\n\nstart : value EOF ;\n\nvalue : ID ;\n\nID : [a-z]+ ;\n";

        // Act
        RewriteResult result = rewriter.inlineRule(source, "value", false, false);

        // Assert
        assertTrue(result.isSuccess(), result.message());
        assertEquals("grammar T;\n\nstart : ID EOF ;\n\nID : [a-z]+ ;\n", result.content());
    }

    @Test
    void inlineRule_ShouldWrapMultiAlternativeBodies() {
        // Arrange
        String source = "grammar T;\nstart : value EOF ;\nvalue : ID | NUM ;\nID : [a-z]+ ;\nNUM : [0-9]+ ;\n";

        // Act
        RewriteResult result = rewriter.inlineRule(source, "value", false, false);

        // Assert
        assertTrue(result.isSuccess(), result.message());
        assertTrue(result.content().contains("start : (ID | NUM) EOF ;"), result.content());
    }

    @Test
    void inlineRule_ShouldWrapQuantifiedBodyAtQuantifiedSites() {
        // Arrange
        String source = "grammar G;\ns : x? x* EOF ;\nx : ID+ ;\nID : [a-z]+ ;\n";

        // Act
        RewriteResult result = rewriter.inlineRule(source, "x", false, false);

        // Assert
        assertTrue(result.isSuccess(), result.message());
        assertTrue(result.content().contains("s : (ID+)? (ID+)* EOF ;"), result.content());
        assertFalse(result.content().contains("x :"));
    }

    @Test
    void inlineRule_DryRunShouldLeaveContentUntouched() {
        // Arrange
        String source = "grammar T;\nstart : value EOF ;\nvalue : ID ;\nID : [a-z]+ ;\n";

        // Act
        RewriteResult result = rewriter.inlineRule(source, "value", false, true);

        // Assert
        assertTrue(result.isSuccess());
        assertEquals(source, result.content());
        assertEquals(1, result.stats().get("referencesReplaced"));
    }

    @Test
    void inlineRule_ShouldRefuseRecursiveRules() {
        // Arrange
        String selfRecursive = "grammar T;\nstart : list EOF ;\nlist : ID list | ID ;\nID : [a-z]+ ;\n";
        String cycle = "grammar T;\nstart : a EOF ;\na : b C ;\nb : a D | E ;\nC : 'c' ;\nD : 'd' ;\nE : 'e' ;\n";

        // Act
        RewriteResult recursive = rewriter.inlineRule(selfRecursive, "list", false, false);
        RewriteResult cyclic = rewriter.inlineRule(cycle, "b", false, false);

        // Assert
        assertFalse(recursive.isSuccess());
        assertEquals(selfRecursive, recursive.content());
        assertFalse(cyclic.isSuccess());
        assertTrue(cyclic.message().contains("cycle"));
        assertEquals(cycle, cyclic.content());
    }

    @Test
    void inlineRule_ShouldRefuseTokenUsedByParserRules() {
        // Act
        RewriteResult result = rewriter.inlineRule(COMPACT, "B", false, false);

        // Assert
        assertFalse(result.isSuccess());
        assertTrue(result.message().contains("parser rules"));
    }

    @Test
    void mergeRules_ShouldJoinBodiesAtEarlierPosition() {
        // Arrange
        String source = "grammar T;\na : B ;\nb : C ;\nstart : a b EOF ;\nB : 'b' ;\nC : 'c' ;\n";

        // Act
        RewriteResult result = rewriter.mergeRules(source, "a", "b", "ab");

        // Assert
        assertTrue(result.isSuccess(), result.message());
        assertEquals("grammar T;\nab : B | C ;\nstart : a b EOF ;\nB : 'b' ;\nC : 'c' ;\n", result.content());
    }

    @Test
    void mergeRules_ShouldRefuseWhenOnlyOneRuleLabelsAlternatives() {
        // Arrange
        String source = "grammar T;\na : B # First\n  | C # Second\n  ;\nb : C ;\nstart : a b EOF ;\n"
                + "B : 'b' ;\nC : 'c' ;\n";

        // Act
        RewriteResult result = rewriter.mergeRules(source, "a", "b", "ab");

        // Assert
        assertFalse(result.isSuccess());
        assertTrue(result.message().contains("labels"));
        assertEquals(source, result.content());
    }

    @Test
    void mergeRules_ShouldRefuseMixedKinds() {
        RewriteResult result = rewriter.mergeRules(COMPACT, "a", "B", "ab");

        assertFalse(result.isSuccess());
    }

    @Test
    void extractFragment_ShouldAppendAfterLastDefaultModeToken() {
        // Arrange
        String source = "lexer grammar L;\nID : LETTER+ ;\nWS : ' ' -> skip ;\n";

        // Act
        RewriteResult result = rewriter.extractFragment(source, "LETTER", "[a-zA-Z]");

        // Assert
        assertTrue(result.isSuccess(), result.message());
        assertEquals(source + "fragment LETTER : [a-zA-Z] ;\n", result.content());
    }

    @Test
    void addMode_ShouldOnlyWorkForLexerGrammars() {
        // Act
        RewriteResult lexer = rewriter.addMode("lexer grammar L;\nA : 'a' ;\n", "ISLAND");
        RewriteResult combined = rewriter.addMode(COMPACT, "ISLAND");

        // Assert
        assertTrue(lexer.isSuccess(), lexer.message());
        assertTrue(lexer.content().contains("mode ISLAND;"));
        assertFalse(combined.isSuccess());
        assertEquals(COMPACT, combined.content());
    }

    @Test
    void fixSuspiciousQuantifiers_ShouldTurnTrailingOptionalGroupIntoStar() {
        // Arrange
        String source = "grammar Q;\n"
                + "config_setting : KEY (VALUE)? ;\n"
                + "plain : KEY (VALUE)? ;\n"
                + "KEY : 'k' ;\n"
                + "VALUE : 'v' ;\n";

        // Act
        RewriteResult result = rewriter.fixSuspiciousQuantifiers(source, Set.of(), false);

        // Assert
        assertTrue(result.isSuccess(), result.message());
        assertEquals(source.replace("config_setting : KEY (VALUE)? ;", "config_setting : KEY (VALUE)* ;"),
                result.content());
        assertEquals(1, result.stats().get("detected"));
        List<?> changes = (List<?>) result.stats().get("changes");
        assertEquals("config_setting", ((Map<?, ?>) changes.get(0)).get("ruleName"));
    }

    @Test
    void fixSuspiciousQuantifiers_ShouldLeaveSourceAloneOnDryRun() {
        // Arrange
        String source = "grammar Q;\nconfig_setting : KEY (VALUE)? ;\nKEY : 'k' ;\nVALUE : 'v' ;\n";

        // Act
        RewriteResult result = rewriter.fixSuspiciousQuantifiers(source, null, true);

        // Assert
        assertTrue(result.isSuccess(), result.message());
        assertEquals(source, result.content());
        assertTrue(result.message().startsWith("Would fix 1 of 1"), result.message());
    }

    @Test
    void fixSuspiciousQuantifiers_ShouldOnlyFixNamedRules() {
        // Arrange
        String source = "grammar Q;\n"
                + "config_setting : KEY (VALUE)? ;\n"
                + "user_property : KEY (VALUE)? ;\n"
                + "KEY : 'k' ;\n"
                + "VALUE : 'v' ;\n";

        // Act
        RewriteResult result = rewriter.fixSuspiciousQuantifiers(source, Set.of("user_property"), false);

        // Assert
        assertTrue(result.isSuccess(), result.message());
        assertTrue(result.content().contains("config_setting : KEY (VALUE)? ;"));
        assertTrue(result.content().contains("user_property : KEY (VALUE)* ;"));
    }
}
