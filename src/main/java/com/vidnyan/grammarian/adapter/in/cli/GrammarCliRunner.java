package com.vidnyan.grammarian.adapter.in.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.grammarian.application.port.in.AnalyzeGrammarUseCase;
import com.vidnyan.grammarian.application.port.in.AnalyzeGrammarUseCase.AnalysisRequest;
import com.vidnyan.grammarian.application.port.in.AnalyzeGrammarUseCase.AnalysisResult;
import com.vidnyan.grammarian.domain.check.IssueReport;
import com.vidnyan.grammarian.domain.check.ModeAnalysis;
import com.vidnyan.grammarian.domain.model.Issue;
import com.vidnyan.grammarian.domain.model.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * CLI Runner for standalone grammar analysis.
 * Runs analysis when grammarian.analyze.path property is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GrammarCliRunner implements CommandLineRunner {

    private static final int MAX_LISTED_ISSUES = 100;

    private final AnalyzeGrammarUseCase analyzeGrammarUseCase;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext context;

    @Value("${grammarian.analyze.path:}")
    private String grammarPath;

    @Value("${grammarian.analyze.report:}")
    private String reportPath;

    @Override
    public void run(String... args) throws Exception {
        if (grammarPath == null || grammarPath.isBlank()) {
            log.info("No grammar specified. Set grammarian.analyze.path property.");
            return;
        }

        int exitCode = 0;
        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║           Grammarian - ANTLR4 grammar analysis                ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Analyzing: {}", truncatePath(grammarPath, 50));
            log.info("╚══════════════════════════════════════════════════════════════╝");

            AnalysisResult result = analyzeGrammarUseCase.analyze(AnalysisRequest.forPath(Path.of(grammarPath)));
            printResults(result);
            if (reportPath != null && !reportPath.isBlank()) {
                writeReport(result, Path.of(reportPath));
            }
            exitCode = result.hasErrors() ? 1 : 0;

            log.info("");
            log.info("Analysis complete!");
        } finally {
            int code = exitCode;
            SpringApplication.exit(context, () -> code);
        }
    }

    private void printResults(AnalysisResult result) {
        IssueReport report = result.report();
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" ANALYSIS RESULTS: {} ({})", result.grammar().name(), result.grammar().kind());
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Files analyzed:  {}", result.stats().filesAnalyzed());
        log.info(" Parser rules:    {}", result.stats().parserRules());
        log.info(" Lexer rules:     {}", result.stats().lexerRules());
        log.info(" Modes:           {}", result.stats().modes());
        log.info(" Checks run:      {}", result.stats().checksRun());
        log.info(" Duration:        {}ms", result.stats().totalDurationMs());
        log.info("───────────────────────────────────────────────────────────────");
        log.info(" ISSUES:");
        log.info("   Errors:   {}", report.count(Severity.ERROR));
        log.info("   Warnings: {}", report.count(Severity.WARNING));
        log.info("   Info:     {}", report.count(Severity.INFO));
        report.byType().forEach((type, count) -> log.info("   {} x {}", count, type));
        if (report.suggestion() != null) {
            log.info(" Hint: {}", report.suggestion());
        }
        log.info("═══════════════════════════════════════════════════════════════");

        if (result.issues().isEmpty()) {
            log.info("");
            log.info("No issues found.");
            return;
        }

        log.info("");
        log.info(" ISSUE DETAILS:");
        log.info("───────────────────────────────────────────────────────────────");
        int count = 0;
        for (Issue issue : result.issues()) {
            if (++count > MAX_LISTED_ISSUES) {
                log.info(" ... and {} more issues", result.issues().size() - MAX_LISTED_ISSUES);
                break;
            }
            log.info(" {}", issue.format());
            if (issue.suggestion() != null) {
                log.info("     Fix: {}", issue.suggestion());
            }
        }
    }

    private void writeReport(AnalysisResult result, Path target) {
        CliReport report = reportOf(result);
        try {
            objectMapper.writeValue(target.toFile(), report);
            log.info("Report written to {}", target);
        } catch (IOException e) {
            log.error("Failed to write report to {}: {}", target, e.getMessage());
        }
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }

    /**
     * JSON report layout.
     */
    static CliReport reportOf(AnalysisResult result) {
        return new CliReport(
                result.grammar().name(),
                result.grammar().kind() != null ? result.grammar().kind().name() : null,
                result.stats(),
                result.report(),
                result.modes(),
                result.issues(),
                Map.of("colonPlacement", result.style().colonPlacement().name(),
                        "semicolonPlacement", result.style().semicolonPlacement().name())
        );
    }

    record CliReport(
        String grammar,
        String kind,
        AnalyzeGrammarUseCase.AnalysisStats stats,
        IssueReport summary,
        ModeAnalysis modes,
        List<Issue> issues,
        Map<String, String> style
    ) {}
}
