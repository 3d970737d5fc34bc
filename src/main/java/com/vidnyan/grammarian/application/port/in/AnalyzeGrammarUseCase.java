package com.vidnyan.grammarian.application.port.in;

import com.vidnyan.grammarian.domain.check.CheckCategory;
import com.vidnyan.grammarian.domain.check.CheckResult;
import com.vidnyan.grammarian.domain.check.IssueReport;
import com.vidnyan.grammarian.domain.check.ModeAnalysis;
import com.vidnyan.grammarian.domain.model.FormattingStyle;
import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.Issue;
import com.vidnyan.grammarian.domain.model.Severity;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Primary use case: find structural, semantic and ambiguity problems in a grammar.
 */
public interface AnalyzeGrammarUseCase {

    /**
     * Analyze a grammar and return every issue found.
     * @param request grammar text or file, and which check families to run
     * @return issues, per-check results and aggregated reports
     */
    AnalysisResult analyze(AnalysisRequest request);

    /**
     * Analysis request parameters.
     * Exactly one of {@code source} and {@code path} is set.
     */
    record AnalysisRequest(
        String source,
        Path path,
        Path basePath,           // null = directory of path
        boolean resolveImports,
        Set<CheckCategory> categories,
        Set<String> disabledChecks
    ) {
        public AnalysisRequest {
            categories = categories == null || categories.isEmpty()
                    ? EnumSet.allOf(CheckCategory.class)
                    : EnumSet.copyOf(categories);
            disabledChecks = disabledChecks == null ? Set.of() : Set.copyOf(disabledChecks);
        }

        public static AnalysisRequest forSource(String source) {
            return new AnalysisRequest(source, null, null, false, null, null);
        }

        public static AnalysisRequest forPath(Path path) {
            return new AnalysisRequest(null, path, null, true, null, null);
        }

        public AnalysisRequest only(CheckCategory first, CheckCategory... rest) {
            return new AnalysisRequest(source, path, basePath, resolveImports, EnumSet.of(first, rest), disabledChecks);
        }
    }

    /**
     * Analysis result.
     */
    record AnalysisResult(
        Grammar grammar,
        List<Issue> issues,
        List<CheckResult> checkResults,
        IssueReport report,
        ModeAnalysis modes,
        FormattingStyle style,
        AnalysisStats stats
    ) {
        public boolean hasErrors() {
            return issues.stream().anyMatch(i -> i.severity() == Severity.ERROR);
        }

        public int issueCount(Severity severity) {
            return (int) issues.stream()
                    .filter(i -> i.severity() == severity)
                    .count();
        }

        public List<Issue> issuesOfType(String type) {
            return issues.stream().filter(i -> i.type().equals(type)).toList();
        }
    }

    /**
     * Analysis statistics.
     */
    record AnalysisStats(
        int filesAnalyzed,
        int parserRules,
        int lexerRules,
        int modes,
        int checksRun,
        long totalDurationMs
    ) {}
}
