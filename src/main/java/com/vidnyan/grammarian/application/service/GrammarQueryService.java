package com.vidnyan.grammarian.application.service;

import com.vidnyan.grammarian.application.port.in.QueryGrammarUseCase;
import com.vidnyan.grammarian.domain.graph.RuleDependencyGraph;
import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.builder.GrammarModelBuilder;
import com.vidnyan.grammarian.domain.query.GrammarDocumentation;
import com.vidnyan.grammarian.domain.query.GrammarQueries;
import com.vidnyan.grammarian.domain.query.GrammarSummary;
import com.vidnyan.grammarian.domain.query.MatchMode;
import com.vidnyan.grammarian.domain.query.RuleSearchResult;
import com.vidnyan.grammarian.domain.query.RuleStatistics;
import com.vidnyan.grammarian.domain.query.RuleUsage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class GrammarQueryService implements QueryGrammarUseCase {

    private final GrammarModelBuilder modelBuilder;

    @Override
    public RuleSearchResult findRules(String source, String pattern, MatchMode mode) {
        return GrammarQueries.findRules(modelBuilder.build(source), pattern, mode);
    }

    @Override
    public List<RuleUsage> findUsages(String source, String ruleName) {
        return GrammarQueries.findUsages(modelBuilder.scanner().scan(source), ruleName);
    }

    @Override
    public Optional<RuleStatistics> ruleStatistics(String source, String ruleName) {
        Grammar grammar = modelBuilder.build(source);
        return GrammarQueries.statistics(grammar, RuleDependencyGraph.build(grammar), ruleName);
    }

    @Override
    public GrammarSummary summarize(String source) {
        Grammar grammar = modelBuilder.build(source);
        return GrammarQueries.summary(grammar, RuleDependencyGraph.build(grammar));
    }

    @Override
    public String outline(String source) {
        Grammar grammar = modelBuilder.build(source);
        return GrammarDocumentation.outline(grammar, grammar.issues());
    }

    @Override
    public String exportMarkdown(String source) {
        Grammar grammar = modelBuilder.build(source);
        return GrammarDocumentation.markdown(grammar, grammar.issues());
    }
}
