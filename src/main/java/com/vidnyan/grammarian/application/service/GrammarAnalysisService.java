package com.vidnyan.grammarian.application.service;

import com.vidnyan.grammarian.GrammarianProperties;
import com.vidnyan.grammarian.application.port.in.AnalyzeGrammarUseCase;
import com.vidnyan.grammarian.application.port.in.ResolveGrammarUseCase;
import com.vidnyan.grammarian.application.port.out.GrammarSourceRepository;
import com.vidnyan.grammarian.domain.check.CheckContext;
import com.vidnyan.grammarian.domain.check.CheckOptions;
import com.vidnyan.grammarian.domain.check.CheckResult;
import com.vidnyan.grammarian.domain.check.GrammarCheck;
import com.vidnyan.grammarian.domain.check.IssueReport;
import com.vidnyan.grammarian.domain.check.ModeAnalysis;
import com.vidnyan.grammarian.domain.format.FormattingInferencer;
import com.vidnyan.grammarian.domain.model.FormattingStyle;
import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.Issue;
import com.vidnyan.grammarian.domain.model.builder.GrammarModelBuilder;
import com.vidnyan.grammarian.domain.resolve.ResolvedGrammar;
import com.vidnyan.grammarian.domain.scan.ScanResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Application service that orchestrates the analysis workflow.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GrammarAnalysisService implements AnalyzeGrammarUseCase {

    private final GrammarSourceRepository sourceRepository;
    private final ResolveGrammarUseCase resolveGrammarUseCase;
    private final List<GrammarCheck> checks;
    private final GrammarModelBuilder modelBuilder;
    private final FormattingInferencer formattingInferencer;
    private final GrammarianProperties properties;

    @Override
    public AnalysisResult analyze(AnalysisRequest request) {
        Instant startTime = Instant.now();
        log.info("Starting analysis of: {}", request.path() != null ? request.path() : "<inline grammar>");

        // Step 1: Load the grammar
        log.info("Step 1: Loading grammar...");
        if (request.source() == null && request.path() == null) {
            log.error("Analysis request carries neither grammar text nor a path");
            return unreadable(request, "no grammar text or path given", startTime);
        }
        String mainSource;
        Grammar grammar;
        int files = 1;
        boolean multiFile = false;
        if (request.source() != null) {
            mainSource = request.source();
            grammar = modelBuilder.build(mainSource);
        } else if (request.resolveImports()) {
            ResolvedGrammar resolved = resolveGrammarUseCase.resolve(request.path(), request.basePath());
            mainSource = resolved.main().source();
            grammar = resolved.merged();
            files = resolved.files().size();
            multiFile = true;
        } else {
            GrammarSourceRepository.ReadResult read = sourceRepository.read(request.path());
            if (!read.isOk()) {
                log.error("Cannot read {}: {}", request.path(), read.error());
                return unreadable(request, read.error(), startTime);
            }
            mainSource = read.content();
            grammar = modelBuilder.build(mainSource);
        }
        ScanResult scan = modelBuilder.scanner().scan(mainSource);
        log.info("Loaded grammar '{}' ({}): {} parser rules, {} lexer rules from {} file(s)",
                grammar.name(), grammar.kind(), grammar.parserRules().size(), grammar.lexerRules().size(), files);

        // Step 2: Build graphs
        log.info("Step 2: Building graphs...");
        CheckOptions options = new CheckOptions(multiFile, properties.getMinPrefixLength(), request.disabledChecks());
        CheckContext context = CheckContext.of(grammar, options);
        log.info("Built: {} dependency edges, {} mode transitions",
                context.dependencyGraph().stats().edgeCount(),
                context.modeGraph().stats().transitionCount());

        // Step 3: Run checks
        log.info("Step 3: Running checks for {}...", request.categories());
        List<CheckResult> checkResults = new ArrayList<>();
        List<Issue> allIssues = new ArrayList<>();
        for (GrammarCheck check : checks) {
            if (request.categories().stream().noneMatch(check::supports)) {
                continue;
            }
            if (options.isDisabled(check.getName())) {
                checkResults.add(CheckResult.skipped(check.getName(), "Disabled by request"));
                continue;
            }
            try {
                CheckResult result = check.evaluate(context);
                checkResults.add(result);
                allIssues.addAll(result.issues());
                if (result.hasIssues()) {
                    log.debug("  {} found {} issues", check.getName(), result.issues().size());
                }
            } catch (Exception e) {
                log.error("Error running check {}: {}", check.getName(), e.getMessage(), e);
                checkResults.add(CheckResult.error(check.getName(), e.getMessage()));
                allIssues.add(Issue.error("check-failed",
                        String.format("Check %s failed: %s", check.getName(), e.getMessage())));
            }
        }

        // Step 4: Summarize
        log.info("Step 4: Building reports...");
        IssueReport report = IssueReport.of(allIssues, grammar, context.dependencyGraph());
        ModeAnalysis modes = ModeAnalysis.of(grammar, context.modeGraph());
        FormattingStyle style = formattingInferencer.infer(scan);

        Duration totalDuration = Duration.between(startTime, Instant.now());
        AnalysisStats stats = new AnalysisStats(
                files,
                grammar.parserRules().size(),
                grammar.lexerRules().size(),
                modes.modeCount(),
                checkResults.size(),
                totalDuration.toMillis()
        );

        log.info("Analysis complete: {} issues in {}ms", allIssues.size(), stats.totalDurationMs());
        return new AnalysisResult(grammar, List.copyOf(allIssues), checkResults, report, modes, style, stats);
    }

    private AnalysisResult unreadable(AnalysisRequest request, String error, Instant startTime) {
        Grammar empty = modelBuilder.build("");
        Object target = request.path() != null ? request.path() : "<inline grammar>";
        Issue issue = Issue.error("unreadable-grammar", String.format("Cannot read %s: %s", target, error));
        List<Issue> issues = List.of(issue);
        CheckContext context = CheckContext.of(empty, CheckOptions.defaults());
        return new AnalysisResult(
                empty,
                issues,
                List.of(),
                IssueReport.of(issues, empty, context.dependencyGraph()),
                ModeAnalysis.of(empty, context.modeGraph()),
                FormattingStyle.defaults(),
                new AnalysisStats(0, 0, 0, 0, 0, Duration.between(startTime, Instant.now()).toMillis())
        );
    }
}
