package com.vidnyan.grammarian.domain.check;

import com.vidnyan.grammarian.domain.graph.ModeTransitionGraph;
import com.vidnyan.grammarian.domain.graph.RuleDependencyGraph;
import com.vidnyan.grammarian.domain.model.Grammar;

/**
 * Context provided to grammar checks.
 */
public record CheckContext(
    Grammar grammar,
    RuleDependencyGraph dependencyGraph,
    ModeTransitionGraph modeGraph,
    CheckOptions options
) {

    /**
     * Create context, building both graphs.
     */
    public static CheckContext of(Grammar grammar, CheckOptions options) {
        return new CheckContext(
                grammar,
                RuleDependencyGraph.build(grammar),
                ModeTransitionGraph.build(grammar),
                options
        );
    }
}
