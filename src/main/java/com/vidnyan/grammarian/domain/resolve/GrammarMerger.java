package com.vidnyan.grammarian.domain.resolve;

import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.GrammarKind;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.model.Issue;
import com.vidnyan.grammarian.domain.model.LexerMode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combines a main grammar with the grammars it imports into one model.
 */
@Slf4j
public final class GrammarMerger {

    private GrammarMerger() {
    }

    /**
     * Merge in load order. A rule name already defined earlier is skipped, matching how the
     * tool lets the importing grammar override imported rules.
     */
    public static Grammar merge(Grammar main, List<LoadedGrammar> imported, List<Issue> resolutionIssues) {
        Map<String, GrammarRule> rules = new LinkedHashMap<>();
        main.rules().forEach(r -> rules.putIfAbsent(r.name(), r));

        List<Issue> issues = new ArrayList<>(main.issues());
        issues.addAll(resolutionIssues);
        Set<String> tokens = new LinkedHashSet<>(main.declaredTokens());
        Set<String> channels = new LinkedHashSet<>(main.declaredChannels());
        Map<String, List<String>> modeMembers = new LinkedHashMap<>();
        Map<String, Integer> modeLines = new LinkedHashMap<>();
        collectModes(main, modeMembers, modeLines);

        int skipped = 0;
        for (LoadedGrammar file : imported) {
            Grammar g = file.grammar();
            for (GrammarRule rule : g.rules()) {
                if (rules.putIfAbsent(rule.name(), rule) != null) {
                    skipped++;
                }
            }
            String prefix = "[" + (g.name() != null ? g.name() : file.importedAs()) + "] ";
            g.issues().forEach(i -> issues.add(i.withMessagePrefix(prefix)));
            tokens.addAll(g.declaredTokens());
            channels.addAll(g.declaredChannels());
            collectModes(g, modeMembers, modeLines);
        }

        Set<String> kept = rules.keySet();
        List<LexerMode> modes = modeMembers.entrySet().stream()
                .map(e -> new LexerMode(e.getKey(), modeLines.get(e.getKey()),
                        e.getValue().stream().filter(kept::contains).distinct().toList()))
                .toList();

        // a parser grammar merged with its token vocabulary holds both kinds of rules
        GrammarKind kind = main.kind();
        if (kind == GrammarKind.PARSER && rules.values().stream().anyMatch(GrammarRule::isLexer)) {
            kind = GrammarKind.COMBINED;
        }
        log.debug("Merged '{}' with {} grammars: {} rules ({} overridden)",
                main.name(), imported.size(), rules.size(), skipped);
        return new Grammar(
                main.name(),
                kind,
                main.declarationLine(),
                main.header(),
                List.copyOf(rules.values()),
                main.imports(),
                main.options(),
                List.copyOf(tokens),
                List.copyOf(channels),
                modes,
                List.copyOf(issues)
        );
    }

    private static void collectModes(Grammar grammar, Map<String, List<String>> members, Map<String, Integer> lines) {
        for (LexerMode mode : grammar.modes()) {
            members.computeIfAbsent(mode.name(), k -> new ArrayList<>()).addAll(mode.rules());
            lines.putIfAbsent(mode.name(), mode.lineNumber());
        }
    }
}
