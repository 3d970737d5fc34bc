package com.vidnyan.grammarian.api;

import com.vidnyan.grammarian.application.port.in.AnalyzeGrammarUseCase;
import com.vidnyan.grammarian.application.port.in.AnalyzeGrammarUseCase.AnalysisRequest;
import com.vidnyan.grammarian.application.port.in.AnalyzeGrammarUseCase.AnalysisResult;
import com.vidnyan.grammarian.application.port.in.QueryGrammarUseCase;
import com.vidnyan.grammarian.application.port.in.SimulateGrammarUseCase;
import com.vidnyan.grammarian.application.port.in.SimulateGrammarUseCase.TestRuleRequest;
import com.vidnyan.grammarian.domain.check.CheckCategory;
import com.vidnyan.grammarian.domain.check.IssueReport;
import com.vidnyan.grammarian.domain.check.ModeAnalysis;
import com.vidnyan.grammarian.domain.model.Issue;
import com.vidnyan.grammarian.domain.simulate.RuleMatchResult;
import com.vidnyan.grammarian.domain.simulate.TokenizationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * REST API for grammar analysis and simulation.
 */
@RestController
@RequestMapping("/api/grammar")
public class GrammarController {

    private static final Logger log = LoggerFactory.getLogger(GrammarController.class);

    private final AnalyzeGrammarUseCase analyzeGrammarUseCase;
    private final SimulateGrammarUseCase simulateGrammarUseCase;
    private final QueryGrammarUseCase queryGrammarUseCase;

    public GrammarController(AnalyzeGrammarUseCase analyzeGrammarUseCase,
                             SimulateGrammarUseCase simulateGrammarUseCase,
                             QueryGrammarUseCase queryGrammarUseCase) {
        this.analyzeGrammarUseCase = analyzeGrammarUseCase;
        this.simulateGrammarUseCase = simulateGrammarUseCase;
        this.queryGrammarUseCase = queryGrammarUseCase;
    }

    @PostMapping("/analyze")
    public AnalyzeResponse analyze(@RequestBody AnalyzeRequest request) {
        log.info("Received analysis request");
        log.info("  Path: {}", request.path());
        log.info("  Categories: {}", request.categories());

        AnalysisResult result = analyzeGrammarUseCase.analyze(new AnalysisRequest(
                request.source(),
                request.source() == null && request.path() != null ? Path.of(request.path()) : null,
                request.basePath() != null ? Path.of(request.basePath()) : null,
                request.resolveImports(),
                request.categories(),
                request.disabledChecks()
        ));

        return new AnalyzeResponse(
                result.grammar().name(),
                result.grammar().kind() != null ? result.grammar().kind().name() : null,
                result.stats(),
                result.report(),
                result.modes(),
                result.issues()
        );
    }

    @PostMapping("/tokenize")
    public TokenizationResult tokenize(@RequestBody TokenizeRequest request) {
        log.info("Received tokenize request ({} chars)", request.input() == null ? 0 : request.input().length());
        return simulateGrammarUseCase.tokenize(request.source(), request.input());
    }

    @PostMapping("/test-rule")
    public RuleMatchResult testRule(@RequestBody RuleTestRequest request) {
        log.info("Received rule test request for '{}'", request.ruleName());
        return simulateGrammarUseCase.testRule(new TestRuleRequest(
                request.source(),
                request.ruleName(),
                request.input(),
                request.oracleTimeoutMs() != null ? Duration.ofMillis(request.oracleTimeoutMs()) : null
        ));
    }

    @PostMapping(value = "/outline", produces = "text/plain")
    public String outline(@RequestBody SourceRequest request) {
        log.info("Received outline request");
        return queryGrammarUseCase.outline(request.source());
    }

    @PostMapping(value = "/export-markdown", produces = "text/markdown")
    public String exportMarkdown(@RequestBody SourceRequest request) {
        log.info("Received markdown export request");
        return queryGrammarUseCase.exportMarkdown(request.source());
    }

    @GetMapping("/health")
    public String health() {
        return "OK - Grammarian";
    }

    public record AnalyzeRequest(
        String source,          // Grammar text; takes precedence over path
        String path,            // Grammar file on the server
        String basePath,
        boolean resolveImports,
        Set<CheckCategory> categories,
        Set<String> disabledChecks
    ) {}

    public record AnalyzeResponse(
        String grammar,
        String kind,
        AnalyzeGrammarUseCase.AnalysisStats stats,
        IssueReport summary,
        ModeAnalysis modes,
        List<Issue> issues
    ) {}

    public record SourceRequest(String source) {}

    public record TokenizeRequest(String source, String input) {}

    public record RuleTestRequest(String source, String ruleName, String input, Long oracleTimeoutMs) {}
}
