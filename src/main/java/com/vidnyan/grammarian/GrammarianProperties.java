package com.vidnyan.grammarian;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the grammar engine.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "grammarian")
public class GrammarianProperties {

    /**
     * Files longer than this are only scanned up to the limit.
     */
    private int scanLineCeiling = 10_000;

    /**
     * Rules sampled when inferring formatting style.
     */
    private int formattingSampleSize = 50;

    /**
     * Leading elements two alternatives must share to be reported as overlapping.
     */
    private int minPrefixLength = 2;

    private int simulatorMaxDepth = 64;

    private int simulatorStepBudget = 200_000;

    /**
     * How long to wait for the ground-truth oracle before falling back to simulation.
     */
    private Duration oracleTimeout = Duration.ofSeconds(5);
}
