package com.vidnyan.grammarian.domain.query;

import java.util.List;

/**
 * Size overview of a grammar.
 */
public record GrammarSummary(
    String name,
    String kind,
    int parserRules,
    int lexerRules,
    int fragments,
    List<String> modes,
    List<String> imports,
    String tokenVocab,
    List<RuleStatistics> mostReferenced
) {}
