package com.vidnyan.grammarian.adapter.out.oracle;

import com.vidnyan.grammarian.application.port.out.GroundTruthOracle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default oracle with no generated parser behind it.
 * Can be replaced with an adapter that runs the real tool.
 */
@Slf4j
@Component
public class UnavailableGroundTruthOracle implements GroundTruthOracle {

    @Override
    public OracleResult parse(String grammarText, String entryRule, String input) {
        log.debug("No ground-truth parser configured; rule '{}' will be simulated", entryRule);
        return OracleResult.unavailable();
    }
}
