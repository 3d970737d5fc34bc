package com.vidnyan.grammarian.domain.model;

/**
 * Kind of a grammar rule, decided purely by the casing of its name.
 */
public enum RuleKind {
    PARSER,
    LEXER;

    /**
     * Classify a rule name: leading upper case letter means lexer rule.
     */
    public static RuleKind classify(String name) {
        if (name == null || name.isEmpty()) {
            return PARSER;
        }
        return Character.isUpperCase(name.charAt(0)) ? LEXER : PARSER;
    }
}
