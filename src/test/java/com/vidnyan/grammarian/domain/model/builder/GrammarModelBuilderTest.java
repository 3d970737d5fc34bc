package com.vidnyan.grammarian.domain.model.builder;

import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.GrammarKind;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.model.LexerMode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GrammarModelBuilderTest {

    private final GrammarModelBuilder builder = new GrammarModelBuilder();

    static final String STRING_LEXER = "lexer grammar StrLexer;\n"
            + "QUOTE : '\"' -> pushMode(STRING_MODE) ;\n"
            + "COMMENT_START : '/*' -> pushMode(COMMENT_MODE) ;\n"
            + "ID : [a-z]+ ;\n"
            + "\n"
            + "mode STRING_MODE;\n"
            + "STR_TEXT : ~[\"]+ ;\n"
            + "STR_END : '\"' -> popMode ;\n"
            + "\n"
            + "mode COMMENT_MODE;\n"
            + "COMMENT_END : '*/' -> popMode ;\n"
            + "COMMENT_TEXT : . ;\n";

    @Test
    void build_ShouldGroupLexerRulesByMode() {
        // Act
        Grammar grammar = builder.build(STRING_LEXER);

        // Assert
        assertEquals(GrammarKind.LEXER, grammar.kind());
        assertEquals(List.of(LexerMode.DEFAULT_MODE, "STRING_MODE", "COMMENT_MODE"),
                grammar.modes().stream().map(LexerMode::name).toList());
        assertEquals(List.of("STR_TEXT", "STR_END"), grammar.findMode("STRING_MODE").orElseThrow().rules());
        assertEquals(List.of("QUOTE", "COMMENT_START", "ID"),
                grammar.findMode(LexerMode.DEFAULT_MODE).orElseThrow().rules());
        assertEquals("COMMENT_MODE", grammar.findRule("COMMENT_TEXT").orElseThrow().mode());
    }

    @Test
    void build_ShouldAlwaysIncludeDefaultMode() {
        // Act
        Grammar grammar = builder.build("grammar T;\nstart : ID EOF ;\nID : [a-z]+ ;\n");

        // Assert
        assertEquals(1, grammar.modes().size());
        assertTrue(grammar.modes().get(0).isDefault());
        assertNull(grammar.findRule("start").orElseThrow().mode());
    }

    @Test
    void build_ShouldKeepFirstDefinitionOfDuplicateRule() {
        // Arrange
        String source = "grammar T;\na : B ;\na : C ;\nB : 'b' ;\nC : 'c' ;\n";

        // Act
        Grammar grammar = builder.build(source);

        // Assert
        assertEquals(3, grammar.rules().size());
        assertEquals(List.of("B"), grammar.findRule("a").orElseThrow().referencedRules());
        assertTrue(grammar.issues().stream().anyMatch(i -> i.type().equals("duplicate-rule")));
    }

    @Test
    void build_ShouldCaptureBodyAndReferencesVerbatim() {
        // Arrange
        String source = "grammar Calc;\n"
                + "expr : term (PLUS term)* ; // sum\n"
                + "term : NUMBER ;\n"
                + "PLUS : '+' ;\n"
                + "NUMBER : [0-9]+ ;\n";

        // Act
        Grammar grammar = builder.build(source);

        // Assert
        GrammarRule expr = grammar.findRule("expr").orElseThrow();
        assertEquals(" term (PLUS term)* ", expr.body());
        assertEquals(": term (PLUS term)* ;", expr.definition());
        assertEquals(List.of("term", "PLUS"), expr.referencedRules());
        assertEquals(2, expr.lineNumber());
        assertEquals(List.of("expr", "term"), grammar.parserRules().stream().map(GrammarRule::name).toList());
        assertEquals("grammar Calc;\n", grammar.header());
    }
}
