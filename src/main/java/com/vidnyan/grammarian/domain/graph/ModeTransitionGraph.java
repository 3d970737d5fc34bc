package com.vidnyan.grammarian.domain.graph;

import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.GrammarRule;
import com.vidnyan.grammarian.domain.model.LexerMode;
import com.vidnyan.grammarian.domain.syntax.LexerCommand;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Lexer mode graph. Edges come from {@code pushMode(X)} and {@code mode(X)} commands;
 * the implicit {@code DEFAULT_MODE} is always a node.
 */
public final class ModeTransitionGraph {

    /**
     * A mode change caused by a lexer rule.
     */
    public record Transition(String from, String to, String rule, String command) {}

    /**
     * A rule that leaves its mode with {@code popMode}.
     */
    public record ModeExit(String mode, String rule) {}

    private final Set<String> modes;
    private final List<Transition> transitions;
    private final List<ModeExit> exits;

    private ModeTransitionGraph(Set<String> modes, List<Transition> transitions, List<ModeExit> exits) {
        this.modes = Collections.unmodifiableSet(modes);
        this.transitions = List.copyOf(transitions);
        this.exits = List.copyOf(exits);
    }

    /**
     * Build mode graph from a grammar model.
     */
    public static ModeTransitionGraph build(Grammar grammar) {
        Set<String> modes = new LinkedHashSet<>();
        modes.add(LexerMode.DEFAULT_MODE);
        grammar.modes().forEach(m -> modes.add(m.name()));

        List<Transition> transitions = new ArrayList<>();
        List<ModeExit> exits = new ArrayList<>();
        for (GrammarRule rule : grammar.lexerRules()) {
            for (LexerCommand command : rule.expression().commands()) {
                if ((command.is("pushMode") || command.is("mode")) && command.argument() != null) {
                    transitions.add(new Transition(rule.mode(), command.argument(), rule.name(), command.name()));
                } else if (command.is("popMode")) {
                    exits.add(new ModeExit(rule.mode(), rule.name()));
                }
            }
        }
        return new ModeTransitionGraph(modes, transitions, exits);
    }

    public Set<String> getModes() {
        return modes;
    }

    public boolean isDeclared(String mode) {
        return modes.contains(mode);
    }

    public List<Transition> getTransitions() {
        return transitions;
    }

    public List<ModeExit> getExits() {
        return exits;
    }

    /**
     * Get transitions leaving a mode.
     */
    public List<Transition> outgoing(String mode) {
        return transitions.stream().filter(t -> t.from().equals(mode)).toList();
    }

    /**
     * Get transitions entering a mode from another mode.
     */
    public List<Transition> incoming(String mode) {
        return transitions.stream().filter(t -> t.to().equals(mode) && !t.from().equals(mode)).toList();
    }

    /**
     * Find transition cycles, each listing its modes and repeating the first at the end.
     */
    public List<List<String>> findCycles() {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> inStack = new HashSet<>();
        for (String mode : modes) {
            if (!visited.contains(mode)) {
                findCyclesRecursive(mode, visited, inStack, new ArrayList<>(), cycles);
            }
        }
        return cycles;
    }

    private void findCyclesRecursive(
            String current,
            Set<String> visited,
            Set<String> inStack,
            List<String> path,
            List<List<String>> cycles
    ) {
        visited.add(current);
        inStack.add(current);
        path.add(current);

        Set<String> targets = new LinkedHashSet<>();
        outgoing(current).forEach(t -> targets.add(t.to()));
        for (String target : targets) {
            if (!modes.contains(target) || target.equals(current)) {
                continue;
            }
            if (!visited.contains(target)) {
                findCyclesRecursive(target, visited, inStack, path, cycles);
            } else if (inStack.contains(target)) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(target), path.size()));
                cycle.add(target);
                cycles.add(cycle);
            }
        }

        path.remove(path.size() - 1);
        inStack.remove(current);
    }

    /**
     * Get statistics.
     */
    public Stats stats() {
        return new Stats(modes.size(), transitions.size());
    }

    public record Stats(int modeCount, int transitionCount) {}
}
