package com.vidnyan.grammarian.adapter.out.check;

import com.vidnyan.grammarian.domain.check.CheckCategory;
import com.vidnyan.grammarian.domain.check.CheckContext;
import com.vidnyan.grammarian.domain.check.CheckResult;
import com.vidnyan.grammarian.domain.check.GrammarCheck;
import com.vidnyan.grammarian.domain.graph.ModeTransitionGraph;
import com.vidnyan.grammarian.domain.graph.ModeTransitionGraph.ModeExit;
import com.vidnyan.grammarian.domain.graph.ModeTransitionGraph.Transition;
import com.vidnyan.grammarian.domain.model.Grammar;
import com.vidnyan.grammarian.domain.model.Issue;
import com.vidnyan.grammarian.domain.model.LexerMode;
import com.vidnyan.grammarian.domain.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates lexer mode transitions.
 */
@Slf4j
@Component
@Order(210)
public class LexerModeCheck implements GrammarCheck {

    @Override
    public boolean supports(CheckCategory category) {
        return category == CheckCategory.MODES;
    }

    @Override
    public CheckResult evaluate(CheckContext context) {
        Instant start = Instant.now();
        Grammar grammar = context.grammar();
        ModeTransitionGraph graph = context.modeGraph();
        List<Issue> issues = new ArrayList<>();

        for (Transition t : graph.getTransitions()) {
            if (!graph.isDeclared(t.to())) {
                issues.add(Issue.builder()
                        .severity(Severity.ERROR)
                        .type("undefined-mode")
                        .message(String.format("Rule '%s' switches to undefined mode '%s' with %s",
                                t.rule(), t.to(), t.command()))
                        .ruleName(t.rule())
                        .lineNumber(lineOf(grammar, t.rule()))
                        .suggestion(String.format("Declare 'mode %s;' or fix the mode name", t.to()))
                        .build());
            }
        }

        for (ModeExit exit : graph.getExits()) {
            if (LexerMode.DEFAULT_MODE.equals(exit.mode())) {
                issues.add(Issue.builder()
                        .severity(Severity.ERROR)
                        .type("pop-from-default-mode")
                        .message(String.format("Rule '%s' calls popMode in DEFAULT_MODE, where the mode stack is empty",
                                exit.rule()))
                        .ruleName(exit.rule())
                        .lineNumber(lineOf(grammar, exit.rule()))
                        .suggestion("Only pop from modes entered with pushMode")
                        .build());
            }
        }

        for (LexerMode mode : grammar.modes()) {
            if (mode.isDefault()) {
                continue;
            }
            if (graph.incoming(mode.name()).isEmpty()) {
                issues.add(Issue.builder()
                        .severity(Severity.WARNING)
                        .type("unreachable-mode")
                        .message(String.format("Mode '%s' is never entered", mode.name()))
                        .lineNumber(mode.lineNumber())
                        .suggestion(String.format("Add a rule with '-> pushMode(%s)' or remove the mode", mode.name()))
                        .build());
            }
            if (mode.rules().isEmpty()) {
                issues.add(Issue.builder()
                        .severity(Severity.WARNING)
                        .type("empty-mode")
                        .message(String.format("Mode '%s' has no rules", mode.name()))
                        .lineNumber(mode.lineNumber())
                        .build());
            }
            boolean pushed = graph.incoming(mode.name()).stream().anyMatch(t -> t.command().equals("pushMode"));
            boolean leaves = graph.getExits().stream().anyMatch(e -> e.mode().equals(mode.name()))
                    || !graph.outgoing(mode.name()).isEmpty();
            if (pushed && !leaves && !mode.rules().isEmpty()) {
                issues.add(Issue.builder()
                        .severity(Severity.INFO)
                        .type("mode-without-exit")
                        .message(String.format("Mode '%s' is pushed but no rule in it pops or switches mode",
                                mode.name()))
                        .lineNumber(mode.lineNumber())
                        .suggestion("Add a rule with '-> popMode'")
                        .build());
            }
        }

        for (List<String> cycle : graph.findCycles()) {
            issues.add(Issue.builder()
                    .severity(Severity.INFO)
                    .type("mode-cycle")
                    .message("Mode transition cycle: " + String.join(" -> ", cycle))
                    .build());
        }

        log.debug("Mode check found {} issues across {} modes", issues.size(), graph.getModes().size());
        return CheckResult.success(getName(), issues, Duration.between(start, Instant.now()));
    }

    private static Integer lineOf(Grammar grammar, String rule) {
        return grammar.findRule(rule).map(r -> r.lineNumber()).orElse(null);
    }
}
