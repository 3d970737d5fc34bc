package com.vidnyan.grammarian.application.service;

import com.vidnyan.grammarian.GrammarianProperties;
import com.vidnyan.grammarian.application.port.in.SimulateGrammarUseCase;
import com.vidnyan.grammarian.application.port.out.GroundTruthOracle;
import com.vidnyan.grammarian.application.port.out.GroundTruthOracle.OracleResult;
import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.model.builder.GrammarModelBuilder;
import com.vidnyan.grammarian.domain.simulate.Confidence;
import com.vidnyan.grammarian.domain.simulate.LexerSimulator;
import com.vidnyan.grammarian.domain.simulate.MatchOutcome;
import com.vidnyan.grammarian.domain.simulate.ParserRuleSimulator;
import com.vidnyan.grammarian.domain.simulate.RuleMatchResult;
import com.vidnyan.grammarian.domain.simulate.TokenizationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs sample input through a grammar.
 * Rule tests ask the ground-truth oracle first and fall back to simulation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GrammarSimulationService implements SimulateGrammarUseCase {

    private final GrammarModelBuilder modelBuilder;
    private final GroundTruthOracle oracle;
    private final GrammarianProperties properties;

    @Override
    public TokenizationResult tokenize(String source, String input) {
        Grammar grammar = modelBuilder.build(source);
        TokenizationResult result = LexerSimulator.forGrammar(grammar).tokenize(input);
        log.info("Tokenized {} chars with '{}': {} tokens, {} errors",
                input == null ? 0 : input.length(), grammar.name(), result.tokens().size(), result.errors().size());
        return result;
    }

    @Override
    public RuleMatchResult testRule(TestRuleRequest request) {
        Grammar grammar = modelBuilder.build(request.source());
        if (grammar.findRule(request.ruleName()).filter(GrammarRule::isParser).isEmpty()) {
            return RuleMatchResult.unknownRule(request.ruleName());
        }

        // Step 1: Tokenize
        LexerSimulator lexer = LexerSimulator.forGrammar(grammar);
        TokenizationResult tokens = lexer.tokenize(request.input());
        int tokenCount = tokens.parserTokens().size();

        // Step 2: Ask the oracle
        Duration timeout = request.oracleTimeout() != null ? request.oracleTimeout() : properties.getOracleTimeout();
        OracleResult verdict = consultOracle(request, timeout);
        if (verdict.isAvailable()) {
            log.info("Oracle answered for rule '{}': matched={}", request.ruleName(), verdict.matched());
            return fromOracle(request.ruleName(), verdict, tokenCount);
        }

        // Step 3: Simulate
        if (!tokens.success()) {
            return RuleMatchResult.tokenizationFailed(request.ruleName(), tokens.errors(), tokens.tokens().size());
        }
        ParserRuleSimulator simulator = new ParserRuleSimulator(grammar, lexer.literalTypes(),
                properties.getSimulatorMaxDepth(), properties.getSimulatorStepBudget());
        RuleMatchResult result = simulator.match(request.ruleName(), tokens.parserTokens());
        log.info("Simulated rule '{}' on {} tokens: {} ({} confidence)",
                request.ruleName(), tokenCount, result.outcome(), result.confidence());
        return result;
    }

    private OracleResult consultOracle(TestRuleRequest request, Duration timeout) {
        CompletableFuture<OracleResult> future = CompletableFuture.supplyAsync(
                () -> oracle.parse(request.source(), request.ruleName(), request.input()));
        try {
            OracleResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : OracleResult.unavailable();
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Oracle did not answer within {}ms, using simulation", timeout.toMillis());
            return OracleResult.unavailable();
        } catch (ExecutionException e) {
            log.warn("Oracle failed, using simulation: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return OracleResult.unavailable();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the oracle, using simulation");
            return OracleResult.unavailable();
        }
    }

    private static RuleMatchResult fromOracle(String ruleName, OracleResult verdict, int tokenCount) {
        List<String> notes = new ArrayList<>(verdict.diagnostics());
        if (verdict.tree() != null) {
            notes.add("Parse tree: " + verdict.tree());
        }
        String message = verdict.matched()
                ? String.format("Rule '%s' matched the input", ruleName)
                : String.format("Rule '%s' did not match: %s", ruleName,
                        verdict.diagnostics().isEmpty() ? "syntax error" : verdict.diagnostics().get(0));
        return new RuleMatchResult(
                ruleName,
                verdict.matched() ? MatchOutcome.MATCHED : MatchOutcome.MISMATCH,
                Confidence.HIGH,
                verdict.matched() ? tokenCount : 0,
                tokenCount,
                null,
                List.of(),
                message,
                notes,
                RuleMatchResult.Source.ORACLE
        );
    }
}
