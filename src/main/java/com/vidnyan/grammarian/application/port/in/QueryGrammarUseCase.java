package com.vidnyan.grammarian.application.port.in;

import com.vidnyan.grammarian.domain.query.GrammarSummary;
import com.vidnyan.grammarian.domain.query.MatchMode;
import com.vidnyan.grammarian.domain.query.RuleSearchResult;
import com.vidnyan.grammarian.domain.query.RuleStatistics;
import com.vidnyan.grammarian.domain.query.RuleUsage;

import java.util.List;
import java.util.Optional;

/**
 * Read-only lookups over grammar text.
 */
public interface QueryGrammarUseCase {

    RuleSearchResult findRules(String source, String pattern, MatchMode mode);

    /**
     * Every reference site of a rule, with its line and the rule it appears in.
     */
    List<RuleUsage> findUsages(String source, String ruleName);

    Optional<RuleStatistics> ruleStatistics(String source, String ruleName);

    GrammarSummary summarize(String source);

    /**
     * Plain text outline of the grammar: rules, imports, options and the issues found while reading it.
     */
    String outline(String source);

    String exportMarkdown(String source);
}
