package com.vidnyan.grammarian.domain.simulate;

import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.builder.GrammarModelBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexerSimulatorTest {

    private final GrammarModelBuilder builder = new GrammarModelBuilder();

    private static List<String> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }

    @Test
    void tokenize_ShouldPreferLongestMatchThenDeclarationOrder() {
        // Arrange
        Grammar grammar = builder.build("lexer grammar Kw;\nIF : 'if' ;\nID : [a-zA-Z]+ ;\nWS : [ ]+ -> skip ;\n");

        // Act
        TokenizationResult result = LexerSimulator.tokenize(grammar, "if ifx");

        // Assert
        assertTrue(result.success());
        List<Token> visible = result.parserTokens();
        assertEquals(List.of("IF", "ID"), types(visible));
        assertEquals("if", visible.get(0).text());
        Token id = visible.get(1);
        assertEquals("ifx", id.text());
        assertEquals(3, id.startOffset());
        assertEquals(5, id.endOffset());
        assertEquals(1, id.line());
        assertEquals(3, id.column());
        assertEquals(3, result.tokens().size());
        assertTrue(result.tokens().get(1).skipped());
    }

    @Test
    void tokenize_ShouldFollowModeStack() {
        // Arrange
        Grammar grammar = builder.build("lexer grammar Str;\n"
                + "QUOTE : '\"' -> pushMode(STRING_MODE) ;\n"
                + "ID : [a-z]+ ;\n"
                + "mode STRING_MODE;\n"
                + "STR_TEXT : ~[\"]+ ;\n"
                + "STR_END : '\"' -> popMode ;\n");

        // Act
        TokenizationResult result = LexerSimulator.tokenize(grammar, "a\"x y\"b");

        // Assert
        assertTrue(result.success(), () -> "" + result.errors());
        assertEquals(List.of("ID", "QUOTE", "STR_TEXT", "STR_END", "ID"), types(result.tokens()));
        assertEquals("x y", result.tokens().get(2).text());
    }

    @Test
    void tokenize_ShouldReportUnmatchedCharacterAndContinue() {
        // Arrange
        Grammar grammar = builder.build("lexer grammar L;\nID : [a-z]+ ;\n");

        // Act
        TokenizationResult result = LexerSimulator.tokenize(grammar, "a#b");

        // Assert
        assertFalse(result.success());
        assertEquals(1, result.errors().size());
        LexError error = result.errors().get(0);
        assertEquals(1, error.offset());
        assertEquals("#", error.character());
        assertEquals(List.of("ID", "ID"), types(result.tokens()));
    }

    @Test
    void tokenize_ShouldGiveParserLiteralsTheirOwnTokenType() {
        // Arrange
        Grammar grammar = builder.build("grammar Sum;\nsum : NUMBER '+' NUMBER ;\nNUMBER : [0-9]+ ;\n");

        // Act
        LexerSimulator lexer = LexerSimulator.forGrammar(grammar);
        TokenizationResult result = lexer.tokenize("1+2");

        // Assert
        assertEquals(List.of("NUMBER", "'+'", "NUMBER"), types(result.tokens()));
        assertEquals("'+'", lexer.literalTypes().get("+"));
    }

    @Test
    void tokenize_ShouldTakeLongestAlternativeWithinOneRule() {
        // Arrange
        Grammar grammar = builder.build("lexer grammar L;\nOP : '=' | '==' ;\n");

        // Act
        TokenizationResult result = LexerSimulator.tokenize(grammar, "==");

        // Assert
        assertTrue(result.success());
        assertEquals(1, result.tokens().size());
        assertEquals("==", result.tokens().get(0).text());
    }

    @Test
    void tokenize_ShouldTakeLongestLiteralInsideNestedGroup() {
        // Arrange
        Grammar grammar = builder.build("lexer grammar L;\nCMP : ('<' | '<=') '>'? ;\nEQ : '=' ;\n");

        // Act
        TokenizationResult result = LexerSimulator.tokenize(grammar, "<=");

        // Assert
        assertEquals(List.of("CMP"), types(result.tokens()));
        assertEquals("<=", result.tokens().get(0).text());
    }
}
