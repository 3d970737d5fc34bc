package com.vidnyan.grammarian.domain.model;

import com.vidnyan.grammarian.domain.scan.RuleSpan;
import com.vidnyan.grammarian.domain.syntax.Alternation;

import java.util.List;

/**
 * A lexer or parser rule.
 *
 * @param definition      verbatim text from the colon through the semicolon
 * @param body            verbatim text between colon and semicolon
 * @param lineNumber      line of the rule name
 * @param referencedRules names referenced by the body, first-use order
 * @param mode            lexer mode, null for parser rules
 * @param expression      parsed body
 * @param span            location in the source the rule was built from
 */
public record GrammarRule(
    String name,
    RuleKind kind,
    boolean fragment,
    String definition,
    String body,
    int lineNumber,
    List<String> referencedRules,
    String mode,
    Alternation expression,
    RuleSpan span
) {

    public GrammarRule {
        referencedRules = List.copyOf(referencedRules);
    }

    public boolean isLexer() {
        return kind == RuleKind.LEXER;
    }

    public boolean isParser() {
        return kind == RuleKind.PARSER;
    }

    public boolean references(String ruleName) {
        return referencedRules.contains(ruleName);
    }

    public boolean isSelfRecursive() {
        return referencedRules.contains(name);
    }

    public int alternativeCount() {
        return expression.alternatives().size();
    }
}
