package com.vidnyan.grammarian.domain.rewrite;

import com.vidnyan.grammarian.domain.format.FormattingInferencer;
import com.vidnyan.grammarian.domain.model.GrammarKind;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.model.LexerMode;
import com.vidnyan.grammarian.domain.model.RuleKind;
import com.vidnyan.grammarian.domain.model.builder.GrammarModelBuilder;
import com.vidnyan.grammarian.domain.rewrite.RewriteVerifier.Expectation;
import com.vidnyan.grammarian.domain.scan.LineIndex;
import com.vidnyan.grammarian.domain.scan.ModeSpan;
import com.vidnyan.grammarian.domain.scan.RuleSpan;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Formatting-preserving edits of grammar text.
 *
 * Every operation splices the original text at scanner offsets, so everything outside the
 * touched spans stays byte-for-byte identical. Results are re-scanned before they are
 * returned; a rewrite that breaks the file comes back as a failure with the original text.
 */
@Slf4j
public class GrammarRewriter {

    static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

    private final GrammarModelBuilder builder;
    private final FormattingInferencer inferencer;
    private final RewriteVerifier verifier;
    private final RuleRenamer renamer;
    private final RuleInliner inliner;
    private final RuleReorderer reorderer;
    private final QuantifierFixer quantifierFixer;

    public GrammarRewriter() {
        this(new GrammarModelBuilder(), new FormattingInferencer());
    }

    public GrammarRewriter(GrammarModelBuilder builder, FormattingInferencer inferencer) {
        this.builder = builder;
        this.inferencer = inferencer;
        this.verifier = new RewriteVerifier(builder.scanner());
        this.renamer = new RuleRenamer();
        this.inliner = new RuleInliner(verifier);
        this.reorderer = new RuleReorderer(verifier);
        this.quantifierFixer = new QuantifierFixer(verifier);
    }

    /**
     * Add a rule, alphabetically within its kind (and mode) unless an anchor is given.
     */
    public RewriteResult addRule(String source, AddRuleRequest request) {
        GrammarDocument doc = load(source);
        String name = request.name();
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            return RewriteResult.failure(doc.source, "Invalid rule name: '" + name + "'");
        }
        if (doc.rule(name).isPresent()) {
            return RewriteResult.failure(doc.source, String.format("Rule '%s' already exists", name));
        }
        if (request.body() == null || request.body().isBlank()) {
            return RewriteResult.failure(doc.source, "Rule body must not be empty");
        }
        RuleKind kind = RuleKind.classify(name);
        GrammarKind grammarKind = doc.grammar.kind();
        if (grammarKind != null && kind == RuleKind.PARSER && !grammarKind.allowsParserRules()) {
            return RewriteResult.failure(doc.source, "Parser rules are not allowed in a lexer grammar");
        }
        if (grammarKind != null && kind == RuleKind.LEXER && !grammarKind.allowsLexerRules()) {
            return RewriteResult.failure(doc.source, "Lexer rules are not allowed in a parser grammar");
        }
        if (kind == RuleKind.PARSER && (request.fragment() || request.lexerCommand() != null)) {
            return RewriteResult.failure(doc.source, "Only lexer rules can be fragments or carry lexer commands");
        }
        String mode = request.mode() == null ? LexerMode.DEFAULT_MODE : request.mode();
        if (kind == RuleKind.LEXER && doc.grammar.findMode(mode).isEmpty()) {
            return RewriteResult.failure(doc.source, String.format("Mode '%s' does not exist", mode));
        }

        int at;
        if (request.anchor() != null) {
            Optional<GrammarRule> anchor = doc.rule(request.anchor());
            if (anchor.isEmpty()) {
                return RewriteResult.failure(doc.source,
                        String.format("Anchor rule '%s' not found", request.anchor()));
            }
            at = request.position() == MovePosition.BEFORE
                    ? beforeRule(doc, anchor.get().span())
                    : afterRule(doc, anchor.get().span());
        } else {
            at = alphabeticalPosition(doc, name, kind, mode);
        }

        String header = (request.fragment() ? "fragment " : "") + name
                + (request.returns() != null && !request.returns().isBlank() ? " returns " + request.returns().strip() : "");
        String text = RuleTextFormatter.format(doc.style, header, request.body(), request.lexerCommand());
        String result = TextEdit.apply(doc.source, List.of(doc.insertBlock(at, text)));

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("ruleName", name);
        stats.put("kind", kind.name());
        stats.put("line", doc.lines().lineOf(at));
        log.debug("Adding rule '{}' at offset {}", name, at);
        return verifier.verify(doc, result, new Expectation(1, Set.of(name), Set.of()),
                String.format("Added %s rule '%s'", kind.name().toLowerCase(), name), stats);
    }

    /**
     * Remove a rule. References to it are left alone.
     */
    public RewriteResult removeRule(String source, String ruleName) {
        GrammarDocument doc = load(source);
        Optional<GrammarRule> rule = doc.rule(ruleName);
        if (rule.isEmpty()) {
            return RewriteResult.failure(doc.source, String.format("Rule '%s' not found", ruleName));
        }
        RuleSpan span = rule.get().span();
        String result = TextEdit.apply(doc.source, List.of(doc.removal(span)));
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("ruleName", ruleName);
        stats.put("remainingReferences", doc.grammar.rules().stream().filter(r -> r.references(ruleName)
                && !r.name().equals(ruleName)).count());
        return verifier.verify(doc, result, new Expectation(-1, Set.of(), Set.of()),
                String.format("Removed rule '%s'", ruleName), stats);
    }

    /**
     * Replace the body of a rule, keeping its name, header and surrounding layout.
     */
    public RewriteResult updateRule(String source, String ruleName, String newBody) {
        GrammarDocument doc = load(source);
        Optional<GrammarRule> rule = doc.rule(ruleName);
        if (rule.isEmpty()) {
            return RewriteResult.failure(doc.source, String.format("Rule '%s' not found", ruleName));
        }
        if (newBody == null || newBody.isBlank()) {
            return RewriteResult.failure(doc.source, "Rule body must not be empty");
        }
        RuleSpan span = rule.get().span();
        if (!span.terminated()) {
            return RewriteResult.failure(doc.source,
                    String.format("Rule '%s' is not terminated by ';' and cannot be updated safely", ruleName));
        }
        String oldBody = doc.source.substring(span.colonOffset() + 1, span.semicolonOffset());
        String leading = oldBody.isBlank() ? " " : oldBody.substring(0, oldBody.length() - oldBody.stripLeading().length());
        String trailing = oldBody.isBlank() ? " " : oldBody.substring(oldBody.stripTrailing().length());

        String body = RuleTextFormatter.reindent(newBody, continuationIndent(doc, span), doc.separator());
        String replacement = leading + body + trailing;
        String result = TextEdit.apply(doc.source,
                List.of(new TextEdit(span.colonOffset() + 1, span.semicolonOffset(), replacement)));

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("ruleName", ruleName);
        stats.put("oldBody", oldBody.strip());
        stats.put("newBody", body);
        return verifier.verify(doc, result, new Expectation(0, Set.of(ruleName), Set.of()),
                String.format("Updated rule '%s'", ruleName), stats);
    }

    public RewriteResult renameRule(String source, String oldName, String newName) {
        return renamer.rename(load(source), oldName, newName, verifier);
    }

    /**
     * Rename every occurrence without checking that the rule is defined in this file.
     * Used for files that only reference a rule defined elsewhere.
     */
    public RuleRenamer.Replacement renameOccurrences(String source, String oldName, String newName) {
        return renamer.replaceAll(load(source), oldName, newName);
    }

    public RewriteResult inlineRule(String source, String ruleName, boolean forceParentheses, boolean dryRun) {
        return inliner.inline(load(source), ruleName, forceParentheses, dryRun);
    }

    /**
     * Change trailing {@code (...)?} groups of rules with suspicious quantifiers to
     * {@code (...)*}. An empty or null name set selects every flagged rule.
     */
    public RewriteResult fixSuspiciousQuantifiers(String source, Set<String> ruleNames, boolean dryRun) {
        return quantifierFixer.fix(load(source), ruleNames, dryRun);
    }

    public RewriteResult sortRules(String source, SortStrategy strategy, SortOptions options) {
        return reorderer.sort(load(source), strategy, options);
    }

    public RewriteResult moveRule(String source, String ruleName, String anchor, MovePosition position) {
        return reorderer.move(load(source), ruleName, anchor, position);
    }

    /**
     * Merge two rules of the same kind into {@code newName : body1 | body2 ;} at the
     * position of the earlier one. References to the old names are not rewritten. Rules
     * that disagree on alternative labels are refused.
     */
    public RewriteResult mergeRules(String source, String first, String second, String newName) {
        GrammarDocument doc = load(source);
        Optional<GrammarRule> a = doc.rule(first);
        Optional<GrammarRule> b = doc.rule(second);
        if (a.isEmpty() || b.isEmpty()) {
            return RewriteResult.failure(doc.source,
                    String.format("Rule '%s' not found", a.isEmpty() ? first : second));
        }
        if (first.equals(second)) {
            return RewriteResult.failure(doc.source, "Cannot merge a rule with itself");
        }
        if (a.get().kind() != b.get().kind()) {
            return RewriteResult.failure(doc.source,
                    String.format("Cannot merge %s rule '%s' with %s rule '%s'",
                            a.get().kind().name().toLowerCase(), first, b.get().kind().name().toLowerCase(), second));
        }
        if (newName == null || !IDENTIFIER.matcher(newName).matches()) {
            return RewriteResult.failure(doc.source, "Invalid rule name: '" + newName + "'");
        }
        if (RuleKind.classify(newName) != a.get().kind()) {
            return RewriteResult.failure(doc.source,
                    String.format("Name '%s' would change the rule kind", newName));
        }
        if (doc.rule(newName).isPresent()) {
            return RewriteResult.failure(doc.source, String.format("Rule '%s' already exists", newName));
        }
        if (a.get().isLexer() && !a.get().mode().equals(b.get().mode())) {
            return RewriteResult.failure(doc.source, "Cannot merge lexer rules from different modes");
        }
        // labels may only sit on outermost alternatives, and then on all of them
        if (a.get().expression().hasAltLabels() != b.get().expression().hasAltLabels()) {
            return RewriteResult.failure(doc.source, String.format(
                    "Cannot merge '%s' and '%s': one labels its alternatives and the other does not", first, second));
        }

        GrammarRule earlier = a.get().span().startOffset() < b.get().span().startOffset() ? a.get() : b.get();
        GrammarRule later = earlier == a.get() ? b.get() : a.get();
        boolean fragment = a.get().fragment() && b.get().fragment();
        String body = RuleTextFormatter.collapse(bodyOf(doc, a.get())) + " | "
                + RuleTextFormatter.collapse(bodyOf(doc, b.get()));
        String text = RuleTextFormatter.format(doc.style, (fragment ? "fragment " : "") + newName, body, null);

        List<TextEdit> edits = new ArrayList<>();
        edits.add(new TextEdit(earlier.span().startOffset(), earlier.span().endOffset(), text));
        edits.add(doc.removal(later.span()));
        String result = TextEdit.apply(doc.source, edits);

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("mergedRules", List.of(first, second));
        stats.put("newRule", newName);
        return verifier.verify(doc, result, new Expectation(-1, Set.of(newName), Set.of(first, second)),
                String.format("Merged '%s' and '%s' into '%s'", first, second, newName), stats);
    }

    /**
     * Add {@code fragment NAME : pattern ;} after the last default-mode lexer rule.
     */
    public RewriteResult extractFragment(String source, String fragmentName, String pattern) {
        GrammarDocument doc = load(source);
        if (fragmentName == null || RuleKind.classify(fragmentName) != RuleKind.LEXER) {
            return RewriteResult.failure(doc.source, "Fragment names must start with an upper case letter");
        }
        AddRuleRequest.Builder request = AddRuleRequest.builder().name(fragmentName).body(pattern).fragment(true);
        doc.grammar.lexerRules().stream()
                .filter(r -> LexerMode.DEFAULT_MODE.equals(r.mode()))
                .reduce((x, y) -> y)
                .ifPresent(last -> request.after(last.name()));
        return addRule(doc.source, request.build());
    }

    /**
     * Append a {@code mode NAME;} declaration to a lexer grammar.
     */
    public RewriteResult addMode(String source, String modeName) {
        GrammarDocument doc = load(source);
        if (doc.grammar.kind() != GrammarKind.LEXER) {
            return RewriteResult.failure(doc.source, "Modes are only allowed in lexer grammars");
        }
        if (modeName == null || !IDENTIFIER.matcher(modeName).matches()) {
            return RewriteResult.failure(doc.source, "Invalid mode name: '" + modeName + "'");
        }
        if (doc.grammar.findMode(modeName).isPresent()) {
            return RewriteResult.failure(doc.source, String.format("Mode '%s' already exists", modeName));
        }
        String result = TextEdit.apply(doc.source,
                List.of(doc.insertBlock(doc.source.length(), "mode " + modeName + ";")));
        String after = builder.scanner().scan(result).modes().stream()
                .map(ModeSpan::name)
                .filter(modeName::equals)
                .findFirst()
                .orElse(null);
        if (after == null) {
            return RewriteResult.failure(doc.source, "Verification failed: mode declaration not found in the result");
        }
        return RewriteResult.success(result, String.format("Added mode '%s'", modeName), Map.of("modeName", modeName));
    }

    private GrammarDocument load(String source) {
        return GrammarDocument.load(source, builder, inferencer);
    }

    /**
     * Comment-free body text, so comments inside a merged body cannot swallow the new {@code |}.
     */
    private static String bodyOf(GrammarDocument doc, GrammarRule rule) {
        return doc.scan.cleanText(rule.span().colonOffset() + 1, rule.span().semicolonOffset());
    }

    private static String continuationIndent(GrammarDocument doc, RuleSpan span) {
        LineIndex lines = doc.lines();
        for (int line = span.nameLine() + 1; line <= span.endLine(); line++) {
            String text = lines.line(doc.source, line);
            if (!text.isBlank()) {
                return text.substring(0, text.length() - text.stripLeading().length());
            }
        }
        return doc.style.indent();
    }

    private static int beforeRule(GrammarDocument doc, RuleSpan span) {
        return doc.lines().lineStart(doc.chunkStartLine(span, doc.floorLineBefore(span)));
    }

    private static int afterRule(GrammarDocument doc, RuleSpan span) {
        return doc.lines().nextLineStart(span.endLine());
    }

    /**
     * Offset before the first rule of the same kind (and mode) whose name sorts after
     * {@code name}, or after the last such rule.
     */
    private static int alphabeticalPosition(GrammarDocument doc, String name, RuleKind kind, String mode) {
        List<GrammarRule> peers = doc.grammar.rules().stream()
                .filter(r -> r.kind() == kind)
                .filter(r -> kind == RuleKind.PARSER || mode.equals(r.mode()))
                .toList();
        for (GrammarRule peer : peers) {
            if (peer.name().compareToIgnoreCase(name) > 0) {
                return beforeRule(doc, peer.span());
            }
        }
        if (!peers.isEmpty()) {
            return afterRule(doc, peers.get(peers.size() - 1).span());
        }
        return emptySectionPosition(doc, kind, mode);
    }

    /**
     * Position for the first rule of its kind: parser rules go before the lexer rules, lexer
     * rules at the end of their mode section.
     */
    private static int emptySectionPosition(GrammarDocument doc, RuleKind kind, String mode) {
        if (kind == RuleKind.PARSER) {
            Optional<GrammarRule> firstLexer = doc.grammar.lexerRules().stream().findFirst();
            if (firstLexer.isPresent()) {
                return beforeRule(doc, firstLexer.get().span());
            }
        }
        List<ModeSpan> modes = doc.scan.modes();
        int sectionEnd = doc.source.length();
        boolean inSection = LexerMode.DEFAULT_MODE.equals(mode);
        for (ModeSpan span : modes) {
            if (inSection) {
                sectionEnd = doc.lines().lineStart(doc.lines().lineOf(span.startOffset()));
                break;
            }
            inSection = span.name().equals(mode);
        }
        if (kind == RuleKind.PARSER && !modes.isEmpty()) {
            sectionEnd = doc.lines().lineStart(doc.lines().lineOf(modes.get(0).startOffset()));
        }
        return sectionEnd;
    }
}
