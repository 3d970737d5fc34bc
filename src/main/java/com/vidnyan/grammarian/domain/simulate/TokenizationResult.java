package com.vidnyan.grammarian.domain.simulate;

import java.util.List;

/**
 * Tokens in input order plus errors and compilation warnings.
 */
public record TokenizationResult(List<Token> tokens, List<LexError> errors, List<String> warnings) {

    public TokenizationResult {
        tokens = List.copyOf(tokens);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean success() {
        return errors.isEmpty();
    }

    /**
     * Tokens on the default channel that were not skipped.
     */
    public List<Token> parserTokens() {
        return tokens.stream().filter(Token::isVisibleToParser).toList();
    }
}
