package com.vidnyan.grammarian.domain.model.builder;

import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.model.Issue;
import com.vidnyan.grammarian.domain.model.LexerMode;
import com.vidnyan.grammarian.domain.model.RuleKind;
import com.vidnyan.grammarian.domain.model.Severity;
import com.vidnyan.grammarian.domain.scan.ModeSpan;
import com.vidnyan.grammarian.domain.scan.RuleSpan;
import com.vidnyan.grammarian.domain.scan.ScanResult;
import com.vidnyan.grammarian.domain.scan.SourceScanner;
import com.vidnyan.grammarian.domain.syntax.BodyToken;
import com.vidnyan.grammarian.domain.syntax.BodyTokenizer;
import com.vidnyan.grammarian.domain.syntax.RuleExpressionParser;
import com.vidnyan.grammarian.domain.syntax.RuleReferences;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the {@link Grammar} model from scanned spans.
 */
@Slf4j
public class GrammarModelBuilder {

    private final SourceScanner scanner;

    public GrammarModelBuilder() {
        this(new SourceScanner());
    }

    public GrammarModelBuilder(SourceScanner scanner) {
        this.scanner = scanner;
    }

    public SourceScanner scanner() {
        return scanner;
    }

    /**
     * Scan and build in one step.
     */
    public Grammar build(String source) {
        return build(scanner.scan(source));
    }

    /**
     * Build the model from a scan result.
     */
    public Grammar build(ScanResult scan) {
        List<Issue> issues = new ArrayList<>(scan.issues());
        List<GrammarRule> rules = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (RuleSpan span : scan.rules()) {
            if (!seen.add(span.name())) {
                issues.add(Issue.builder()
                        .severity(Severity.ERROR)
                        .type("duplicate-rule")
                        .message(String.format("Rule '%s' is defined more than once", span.name()))
                        .ruleName(span.name())
                        .lineNumber(span.nameLine())
                        .suggestion("Remove or rename the duplicate definition")
                        .build());
                continue;
            }
            rules.add(buildRule(scan, span));
        }

        Grammar grammar = new Grammar(
                scan.grammarName(),
                scan.grammarKind(),
                scan.declarationLine(),
                scan.source().substring(0, scan.headerEnd()),
                List.copyOf(rules),
                scan.imports(),
                scan.options(),
                scan.declaredTokens(),
                scan.declaredChannels(),
                buildModes(scan, rules),
                List.copyOf(issues)
        );
        log.debug("Built model for '{}': {} rules", grammar.name(), rules.size());
        return grammar;
    }

    /**
     * Body tokens of a rule, read from the comment-free view.
     */
    public static List<BodyToken> bodyTokens(ScanResult scan, RuleSpan span) {
        return BodyTokenizer.tokenize(scan.cleanSource(), span.colonOffset() + 1, span.semicolonOffset());
    }

    private GrammarRule buildRule(ScanResult scan, RuleSpan span) {
        List<BodyToken> tokens = bodyTokens(scan, span);
        RuleKind kind = RuleKind.classify(span.name());
        return new GrammarRule(
                span.name(),
                kind,
                span.fragment(),
                scan.text(span.colonOffset(), span.endOffset()),
                scan.text(span.colonOffset() + 1, span.semicolonOffset()),
                span.nameLine(),
                RuleReferences.names(tokens),
                kind == RuleKind.LEXER ? span.mode() : null,
                RuleExpressionParser.parse(tokens),
                span
        );
    }

    private List<LexerMode> buildModes(ScanResult scan, List<GrammarRule> rules) {
        Map<String, List<String>> members = new LinkedHashMap<>();
        Map<String, Integer> lines = new LinkedHashMap<>();
        members.put(LexerMode.DEFAULT_MODE, new ArrayList<>());
        lines.put(LexerMode.DEFAULT_MODE, 0);
        for (ModeSpan mode : scan.modes()) {
            members.putIfAbsent(mode.name(), new ArrayList<>());
            lines.putIfAbsent(mode.name(), mode.line());
        }
        for (GrammarRule rule : rules) {
            if (rule.isLexer()) {
                members.computeIfAbsent(rule.mode(), k -> new ArrayList<>()).add(rule.name());
            }
        }
        return members.entrySet().stream()
                .map(e -> new LexerMode(e.getKey(), lines.getOrDefault(e.getKey(), 0), e.getValue()))
                .toList();
    }
}
