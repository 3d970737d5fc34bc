package com.vidnyan.grammarian.domain.check;

import com.vidnyan.grammarian.domain.graph.ModeTransitionGraph;
import com.vidnyan.grammarian.domain.graph.ModeTransitionGraph.ModeExit;
import com.vidnyan.grammarian.domain.graph.ModeTransitionGraph.Transition;
import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.LexerMode;

import java.util.List;

/**
 * Lexer mode overview: modes with their rule counts, every transition, and the rules
 * through which modes are entered and left.
 */
public record ModeAnalysis(
    List<ModeInfo> modes,
    List<Transition> transitions,
    List<Transition> entryPoints,
    List<ModeExit> exitPoints
) {

    public record ModeInfo(String name, int lineNumber, int ruleCount, List<String> rules) {}

    public static ModeAnalysis of(Grammar grammar, ModeTransitionGraph graph) {
        List<ModeInfo> modes = grammar.modes().stream()
                .map(m -> new ModeInfo(m.name(), m.lineNumber(), m.rules().size(), m.rules()))
                .toList();
        List<Transition> entries = graph.getTransitions().stream()
                .filter(t -> !LexerMode.DEFAULT_MODE.equals(t.to()) && !t.from().equals(t.to()))
                .toList();
        return new ModeAnalysis(modes, graph.getTransitions(), entries, graph.getExits());
    }

    public int modeCount() {
        return modes.size();
    }
}
