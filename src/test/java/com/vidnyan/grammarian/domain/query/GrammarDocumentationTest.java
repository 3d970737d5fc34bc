package com.vidnyan.grammarian.domain.query;

import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.Issue;
import com.vidnyan.grammarian.domain.model.Severity;
import com.vidnyan.grammarian.domain.model.builder.GrammarModelBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GrammarDocumentationTest {

    private static final String PARSER = "parser grammar P;\n"
            + "options { tokenVocab = PLexer; }\n"
            + "import Common;\n"
            + "start : item+ EOF ;\n"
            + "item : ID ;\n";

    private static final String CALC = "grammar Calc;\n"
            + "expr : term PLUS term ;\n"
            + "term : NUMBER ;\n"
            + "fragment DIGIT : [0-9] ;\n"
            + "NUMBER : DIGIT+ ;\n"
            + "PLUS : '+' ;\n";

    private final GrammarModelBuilder builder = new GrammarModelBuilder();

    @Test
    void outline_ShouldListRulesImportsOptionsAndIssues() {
        // Arrange
        Grammar grammar = builder.build(PARSER);
        List<Issue> issues = List.of(Issue.builder()
                .severity(Severity.WARNING)
                .type("unused-rule")
                .message("Rule 'item' looks odd")
                .lineNumber(5)
                .build());

        // Act
        String outline = GrammarDocumentation.outline(grammar, issues);

        // Assert
        assertTrue(outline.startsWith("Grammar: P (parser)\n\n"));
        assertTrue(outline.contains("Rules (2):\n  - start (parser)\n  - item (parser)\n"));
        assertTrue(outline.contains("Imports:\n  - Common\n"));
        assertTrue(outline.contains("Options:\n  - tokenVocab: PLexer\n"));
        assertTrue(outline.contains("Issues (1):\n  - [WARNING] Rule 'item' looks odd (line 5)\n"));
    }

    @Test
    void outline_ShouldLeaveOutEmptySections() {
        // Act
        String outline = GrammarDocumentation.outline(builder.build(CALC), List.of());

        // Assert
        assertTrue(outline.startsWith("Grammar: Calc (combined)"));
        assertFalse(outline.contains("Imports:"));
        assertFalse(outline.contains("Options:"));
        assertFalse(outline.contains("Issues"));
    }

    @Test
    void markdown_ShouldSplitParserAndLexerRules() {
        // Act
        String markdown = GrammarDocumentation.markdown(builder.build(CALC), List.of());

        // Assert
        assertTrue(markdown.startsWith("# Grammar: Calc\n\n**Type**: combined\n\n"));
        assertTrue(markdown.contains("## Parser Rules\n\n### `expr`\n\n**Definition**:\n```antlr\nterm PLUS term\n```\n\n"));
        assertTrue(markdown.contains("**References**: `term`, `PLUS`"));
        assertTrue(markdown.contains("## Lexer Rules"));
        assertTrue(markdown.contains("### `DIGIT` (fragment)\n\n**Pattern**:\n```antlr\n[0-9]\n```"));
        assertTrue(markdown.indexOf("## Parser Rules") < markdown.indexOf("## Lexer Rules"));
        assertFalse(markdown.contains("## Issues"));
    }

    @Test
    void markdown_ShouldRenderOptionsImportsAndIssues() {
        // Arrange
        Grammar grammar = builder.build(PARSER);

        // Act
        String markdown = GrammarDocumentation.markdown(grammar, List.of(Issue.error("syntax", "Broken")));

        // Assert
        assertTrue(markdown.contains("## Imports\n\n- `Common`\n"));
        assertTrue(markdown.contains("## Options\n\n```\ntokenVocab = PLexer;\n```"));
        assertTrue(markdown.contains("## Issues\n\n- **[ERROR]** Broken\n"));
        assertFalse(markdown.contains("## Lexer Rules"));
    }
}
