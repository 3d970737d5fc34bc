package com.vidnyan.grammarian.domain.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Model of one grammar file.
 * Immutable aggregate, rebuilt from text on every operation.
 */
public record Grammar(
    String name,
    GrammarKind kind,
    int declarationLine,
    String header,
    List<GrammarRule> rules,
    List<GrammarImport> imports,
    Map<String, String> options,
    List<String> declaredTokens,
    List<String> declaredChannels,
    List<LexerMode> modes,
    List<Issue> issues
) {

    /**
     * Whether a grammar declaration line was found.
     */
    public boolean isDeclared() {
        return name != null;
    }

    /**
     * Get rule by name.
     */
    public Optional<GrammarRule> findRule(String ruleName) {
        return rules.stream().filter(r -> r.name().equals(ruleName)).findFirst();
    }

    public boolean hasRule(String ruleName) {
        return findRule(ruleName).isPresent();
    }

    public Set<String> ruleNames() {
        return rules.stream().map(GrammarRule::name).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public List<GrammarRule> parserRules() {
        return rules.stream().filter(GrammarRule::isParser).toList();
    }

    public List<GrammarRule> lexerRules() {
        return rules.stream().filter(GrammarRule::isLexer).toList();
    }

    /**
     * Lexer vocabulary named in the options block.
     */
    public Optional<String> tokenVocab() {
        return Optional.ofNullable(options.get("tokenVocab"));
    }

    public Optional<LexerMode> findMode(String modeName) {
        return modes.stream().filter(m -> m.name().equals(modeName)).findFirst();
    }

    /**
     * Whether some names may be defined outside this file.
     */
    public boolean hasExternalVocabulary() {
        return !imports.isEmpty() || tokenVocab().isPresent();
    }
}
