package com.vidnyan.grammarian.domain.query;

/**
 * One place where a rule is referenced.
 *
 * @param lineText      the referencing line, trimmed
 * @param enclosingRule rule whose body contains the reference
 */
public record RuleUsage(String ruleName, int lineNumber, String lineText, String enclosingRule) {}
