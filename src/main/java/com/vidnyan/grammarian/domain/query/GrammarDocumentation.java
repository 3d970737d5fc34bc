package com.vidnyan.grammarian.domain.query;

import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.GrammarImport;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.model.Issue;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Human-readable renderings of a grammar: a plain text outline and a Markdown document.
 */
public final class GrammarDocumentation {

    private GrammarDocumentation() {
    }

    /**
     * Plain text outline: header, rules with their kind, imports, options and issues.
     * Empty sections are left out.
     */
    public static String outline(Grammar grammar, List<Issue> issues) {
        StringBuilder sb = new StringBuilder();
        sb.append("Grammar: ").append(displayName(grammar)).append(" (").append(kindOf(grammar)).append(")\n\n");

        sb.append("Rules (").append(grammar.rules().size()).append("):\n");
        for (GrammarRule rule : grammar.rules()) {
            sb.append("  - ").append(rule.name())
                    .append(" (").append(rule.kind().name().toLowerCase(Locale.ROOT)).append(")\n");
        }

        if (!grammar.imports().isEmpty()) {
            sb.append("\nImports:\n");
            for (GrammarImport imported : grammar.imports()) {
                sb.append("  - ").append(imported.name()).append('\n');
            }
        }

        if (!grammar.options().isEmpty()) {
            sb.append("\nOptions:\n");
            for (Map.Entry<String, String> option : grammar.options().entrySet()) {
                sb.append("  - ").append(option.getKey()).append(": ").append(option.getValue()).append('\n');
            }
        }

        if (!issues.isEmpty()) {
            sb.append("\nIssues (").append(issues.size()).append("):\n");
            for (Issue issue : issues) {
                sb.append("  - ").append(issueLine(issue, false)).append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * Markdown document with one section per parser and lexer rule.
     * Parser rules list what they reference; lexer rules show their pattern.
     */
    public static String markdown(Grammar grammar, List<Issue> issues) {
        StringBuilder md = new StringBuilder();
        md.append("# Grammar: ").append(displayName(grammar)).append("\n\n");
        md.append("**Type**: ").append(kindOf(grammar)).append("\n\n");

        if (!grammar.imports().isEmpty()) {
            md.append("## Imports\n\n");
            for (GrammarImport imported : grammar.imports()) {
                md.append("- `").append(imported.name()).append("`\n");
            }
            md.append('\n');
        }

        if (!grammar.options().isEmpty()) {
            md.append("## Options\n\n```\n");
            grammar.options().forEach((key, value) -> md.append(key).append(" = ").append(value).append(";\n"));
            md.append("```\n\n");
        }

        List<GrammarRule> parserRules = grammar.parserRules();
        if (!parserRules.isEmpty()) {
            md.append("## Parser Rules\n\n");
            for (GrammarRule rule : parserRules) {
                md.append("### `").append(rule.name()).append("`\n\n");
                md.append("**Definition**:\n```antlr\n").append(rule.body().strip()).append("\n```\n\n");
                if (!rule.referencedRules().isEmpty()) {
                    md.append("**References**: ")
                            .append(rule.referencedRules().stream()
                                    .map(name -> "`" + name + "`")
                                    .collect(Collectors.joining(", ")))
                            .append("\n\n");
                }
            }
        }

        List<GrammarRule> lexerRules = grammar.lexerRules();
        if (!lexerRules.isEmpty()) {
            md.append("## Lexer Rules\n\n");
            for (GrammarRule rule : lexerRules) {
                md.append("### `").append(rule.name()).append("`");
                if (rule.fragment()) {
                    md.append(" (fragment)");
                }
                md.append("\n\n**Pattern**:\n```antlr\n").append(rule.body().strip()).append("\n```\n\n");
            }
        }

        if (!issues.isEmpty()) {
            md.append("## Issues\n\n");
            for (Issue issue : issues) {
                md.append("- ").append(issueLine(issue, true)).append('\n');
            }
        }
        return md.toString();
    }

    private static String issueLine(Issue issue, boolean bold) {
        String tag = "[" + issue.severity() + "]";
        StringBuilder line = new StringBuilder(bold ? "**" + tag + "**" : tag)
                .append(' ').append(issue.message());
        if (issue.lineNumber() != null && issue.lineNumber() > 0) {
            line.append(" (line ").append(issue.lineNumber()).append(')');
        }
        return line.toString();
    }

    private static String displayName(Grammar grammar) {
        return grammar.name() != null ? grammar.name() : "<unnamed>";
    }

    private static String kindOf(Grammar grammar) {
        return grammar.kind() != null ? grammar.kind().name().toLowerCase(Locale.ROOT) : "undeclared";
    }
}
