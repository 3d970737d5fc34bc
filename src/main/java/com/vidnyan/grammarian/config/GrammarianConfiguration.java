package com.vidnyan.grammarian.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.grammarian.GrammarianProperties;
import com.vidnyan.grammarian.domain.check.GrammarCheck;
import com.vidnyan.grammarian.domain.format.FormattingInferencer;
import com.vidnyan.grammarian.domain.model.builder.GrammarModelBuilder;
import com.vidnyan.grammarian.domain.rewrite.GrammarRewriter;
import com.vidnyan.grammarian.domain.scan.SourceScanner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for grammar engine components.
 * The domain layer is framework free, so its entry objects are created here.
 */
@Slf4j
@Configuration
public class GrammarianConfiguration {

    /**
     * ObjectMapper for JSON requests and reports.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .findAndRegisterModules()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public GrammarModelBuilder grammarModelBuilder(GrammarianProperties properties) {
        return new GrammarModelBuilder(new SourceScanner(properties.getScanLineCeiling()));
    }

    @Bean
    public FormattingInferencer formattingInferencer(GrammarianProperties properties) {
        return new FormattingInferencer(properties.getFormattingSampleSize());
    }

    @Bean
    public GrammarRewriter grammarRewriter(GrammarModelBuilder builder, FormattingInferencer inferencer) {
        return new GrammarRewriter(builder, inferencer);
    }

    /**
     * Log available checks on startup.
     */
    @Bean
    public String logChecks(List<GrammarCheck> checks) {
        log.info("Registered {} grammar checks:", checks.size());
        checks.forEach(c -> log.info("  - {}", c.getName()));
        return "checks-logged";
    }
}
