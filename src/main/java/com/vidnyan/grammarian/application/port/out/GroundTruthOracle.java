package com.vidnyan.grammarian.application.port.out;

import java.util.List;

/**
 * Port for an external tool that can parse input with a real generated parser.
 * When it answers, its verdict is preferred over the built-in simulation.
 */
public interface GroundTruthOracle {

    /**
     * Parse input starting from an entry rule.
     * @param grammarText full grammar text
     * @param entryRule   parser rule to start from
     * @param input       text to parse
     * @return verdict, or {@link OracleResult#unavailable()} when the tool cannot answer
     */
    OracleResult parse(String grammarText, String entryRule, String input);

    enum OracleStatus {
        ANSWERED,
        UNAVAILABLE
    }

    /**
     * Oracle verdict.
     *
     * @param tree        parse tree in LISP form, null when not produced
     * @param diagnostics syntax errors reported by the tool
     */
    record OracleResult(
        OracleStatus status,
        boolean matched,
        String tree,
        List<String> diagnostics
    ) {
        public OracleResult {
            diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        }

        public static OracleResult unavailable() {
            return new OracleResult(OracleStatus.UNAVAILABLE, false, null, List.of());
        }

        public static OracleResult answered(boolean matched, String tree, List<String> diagnostics) {
            return new OracleResult(OracleStatus.ANSWERED, matched, tree, diagnostics);
        }

        public boolean isAvailable() {
            return status == OracleStatus.ANSWERED;
        }
    }
}
