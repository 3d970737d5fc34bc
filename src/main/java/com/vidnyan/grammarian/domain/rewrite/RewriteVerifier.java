package com.vidnyan.grammarian.domain.rewrite;

import com.vidnyan.grammarian.domain.model.Issue;
import com.vidnyan.grammarian.domain.model.Severity;
import com.vidnyan.grammarian.domain.scan.RuleSpan;
import com.vidnyan.grammarian.domain.scan.ScanResult;
import com.vidnyan.grammarian.domain.scan.SourceScanner;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;

/**
 * Re-scans rewritten text and turns a rewrite that broke the file into a failure.
 */
@Slf4j
final class RewriteVerifier {

    /**
     * What the rewritten text must look like.
     *
     * @param ruleCountDelta expected change in the number of rule declarations
     * @param present        names that must be declared afterwards
     * @param absent         names that must no longer be declared
     */
    record Expectation(int ruleCountDelta, Set<String> present, Set<String> absent) {

        static Expectation sameRules() {
            return new Expectation(0, Set.of(), Set.of());
        }
    }

    private final SourceScanner scanner;

    RewriteVerifier(SourceScanner scanner) {
        this.scanner = scanner;
    }

    RewriteResult verify(GrammarDocument before, String after, Expectation expectation,
                         String message, Map<String, Object> stats) {
        ScanResult rescan = scanner.scan(after);
        String problem = check(before.scan, rescan, expectation);
        if (problem != null) {
            log.warn("Rewrite rejected: {}", problem);
            return RewriteResult.failure(before.source, "Verification failed: " + problem);
        }
        return RewriteResult.success(after, message, stats);
    }

    private static String check(ScanResult before, ScanResult after, Expectation expectation) {
        int expectedCount = before.rules().size() + expectation.ruleCountDelta();
        if (after.rules().size() != expectedCount) {
            return String.format("expected %d rules after the change but found %d", expectedCount, after.rules().size());
        }
        for (String name : expectation.present()) {
            if (after.findRule(name).isEmpty()) {
                return "rule '" + name + "' is missing from the result";
            }
        }
        for (String name : expectation.absent()) {
            if (after.findRule(name).isPresent()) {
                return "rule '" + name + "' is still defined";
            }
        }
        if (errorCount(after) > errorCount(before)) {
            return "the result has new structural errors";
        }
        if (unterminated(after) > unterminated(before)) {
            return "a rule lost its terminating semicolon";
        }
        if (!equalDeclaration(before, after)) {
            return "the grammar declaration changed";
        }
        return null;
    }

    private static long errorCount(ScanResult scan) {
        return scan.issues().stream().map(Issue::severity).filter(s -> s == Severity.ERROR).count();
    }

    private static long unterminated(ScanResult scan) {
        return scan.rules().stream().filter(r -> !r.terminated()).map(RuleSpan::name).count();
    }

    private static boolean equalDeclaration(ScanResult before, ScanResult after) {
        return before.hasDeclaration() == after.hasDeclaration()
                && (!before.hasDeclaration() || before.grammarName().equals(after.grammarName()));
    }
}
