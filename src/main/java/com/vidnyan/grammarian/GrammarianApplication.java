package com.vidnyan.grammarian;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Grammarian - analysis and refactoring engine for ANTLR4 grammars.
 */
@SpringBootApplication
public class GrammarianApplication {

    public static void main(String[] args) {
        SpringApplication.run(GrammarianApplication.class, args);
    }
}
