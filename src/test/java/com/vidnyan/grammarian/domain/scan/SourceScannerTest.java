package com.vidnyan.grammarian.domain.scan;

import com.vidnyan.grammarian.domain.model.GrammarKind;
import com.vidnyan.grammarian.domain.model.Issue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceScannerTest {

    @Test
    void scan_ShouldIgnoreCommentMarkersInsideLiterals() {
        // Arrange
        String source = "grammar T;\n"
                + "SLASHES : '//' ;\n"
                + "SEMI : ';' ;\n"
                + "OPEN : '/*' ;\n"
                + "ID : [a-z]+ ; // trailing comment ; with 'quote\n"
                + "/* block\n"
                + "X : 'y'; */\n"
                + "WS : [ \\t]+ -> skip ;\n";

        // Act
        ScanResult result = new SourceScanner().scan(source);

        // Assert
        List<String> names = result.rules().stream().map(RuleSpan::name).toList();
        assertEquals(List.of("SLASHES", "SEMI", "OPEN", "ID", "WS"), names);
        assertTrue(result.issues().isEmpty(), () -> "Unexpected issues: " + result.issues());
        assertTrue(result.rules().stream().allMatch(RuleSpan::terminated));
        RuleSpan semi = result.findRule("SEMI").orElseThrow();
        assertEquals(3, semi.nameLine());
        assertEquals(semi.startLine(), semi.endLine());
    }

    @Test
    void stripComments_ShouldKeepOffsetsAndLineBreaks() {
        // Arrange
        String source = "a : B ; // note\n/* two\nlines */ c : D ;";

        // Act
        String clean = SourceScanner.stripComments(source);

        // Assert
        assertEquals(source.length(), clean.length());
        assertEquals(source.indexOf("c : D"), clean.indexOf("c : D"));
        assertFalse(clean.contains("note"));
        assertFalse(clean.contains("lines"));
        assertEquals(2, clean.chars().filter(ch -> ch == '\n').count());
    }

    @Test
    void scan_ShouldCutOffRuleWithoutSemicolonAtLineCeiling() {
        // Arrange
        String source = "grammar T;\n"
                + "r : A\n"
                + "  B\n"
                + "  C\n"
                + "  D\n"
                + "  E\n"
                + ";\n"
                + "s : A ;\n";
        SourceScanner scanner = new SourceScanner(3);

        // Act
        ScanResult result = scanner.scan(source);

        // Assert
        RuleSpan r = result.findRule("r").orElseThrow();
        assertFalse(r.terminated());
        assertEquals(4, r.endLine());
        assertTrue(result.findRule("s").orElseThrow().terminated());
        Issue missing = result.issues().stream()
                .filter(i -> i.type().equals("missing-semicolon"))
                .findFirst()
                .orElseThrow();
        assertEquals("r", missing.ruleName());
        assertTrue(missing.message().contains("within 3 lines"));
    }

    @Test
    void scan_ShouldReportRuleNotTerminatedBeforeEndOfFile() {
        // Arrange
        String source = "grammar T;\nr : A B\n";

        // Act
        ScanResult result = new SourceScanner().scan(source);

        // Assert
        assertFalse(result.findRule("r").orElseThrow().terminated());
        assertTrue(result.issues().stream().anyMatch(i -> i.type().equals("missing-semicolon")));
    }

    @Test
    void scan_ShouldReadDeclarationOptionsAndImports() {
        // Arrange
        String source = "parser grammar P;\n"
                + "options { tokenVocab = PLexer; }\n"
                + "import Common, Shared;\n"
                + "start : ID EOF ;\n";

        // Act
        ScanResult result = new SourceScanner().scan(source);

        // Assert
        assertEquals("P", result.grammarName());
        assertEquals(GrammarKind.PARSER, result.grammarKind());
        assertEquals(1, result.declarationLine());
        assertEquals("PLexer", result.options().get("tokenVocab"));
        assertEquals(List.of("Common", "Shared"), result.imports().stream().map(i -> i.name()).toList());
        assertEquals(List.of("start"), result.rules().stream().map(RuleSpan::name).toList());
    }

    @Test
    void scan_ShouldAssignLexerRulesToTheirMode() {
        // Arrange
        String source = "lexer grammar L;\n"
                + "QUOTE : '\"' -> pushMode(STR) ;\n"
                + "mode STR;\n"
                + "TEXT : ~[\"]+ ;\n";

        // Act
        ScanResult result = new SourceScanner().scan(source);

        // Assert
        assertEquals("DEFAULT_MODE", result.findRule("QUOTE").orElseThrow().mode());
        assertEquals("STR", result.findRule("TEXT").orElseThrow().mode());
        assertEquals(1, result.modes().size());
    }
}
