package com.vidnyan.grammarian.domain.check;

import com.vidnyan.grammarian.domain.check.TokenPatternSuggester.TokenSuggestion;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenPatternSuggesterTest {

    @Test
    void suggest_ShouldPreferSpecificNamePatterns() {
        assertEquals("[a-zA-Z][a-zA-Z0-9_@.-]*", TokenPatternSuggester.suggest("USER_ADDRESS").orElseThrow().pattern());
        assertEquals("[a-zA-Z0-9][a-zA-Z0-9._-]*", TokenPatternSuggester.suggest("IP_ADDRESS").orElseThrow().pattern());
        assertEquals("[a-zA-Z][a-zA-Z0-9_/-]*", TokenPatternSuggester.suggest("INTERFACE_NAME").orElseThrow().pattern());
        assertEquals("~[ \\t\\r\\n]+", TokenPatternSuggester.suggest("MATCH_REGEX").orElseThrow().pattern());
        assertEquals("[a-zA-Z_][a-zA-Z0-9_]*", TokenPatternSuggester.suggest("SESSION_ID").orElseThrow().pattern());
    }

    @Test
    void suggest_ShouldFallBackToGenericPattern() {
        // Act
        TokenSuggestion suggestion = TokenPatternSuggester.suggest("WORD").orElseThrow();

        // Assert
        assertEquals("Generic token pattern", suggestion.reasoning());
        assertEquals("WORD : [a-zA-Z_][a-zA-Z0-9_-]* ;", suggestion.definition());
    }

    @Test
    void suggest_ShouldIgnoreParserRuleNames() {
        assertTrue(TokenPatternSuggester.suggest("user_id").isEmpty());
        assertTrue(TokenPatternSuggester.suggest("").isEmpty());
        assertTrue(TokenPatternSuggester.suggest(null).isEmpty());
    }

    @Test
    void suggestAll_ShouldKeepOrderAndSkipParserNames() {
        // Act
        List<TokenSuggestion> suggestions = TokenPatternSuggester.suggestAll(List.of("EVENT_NAME", "expr", "NODE_TYPE"));

        // Assert
        assertEquals(List.of("EVENT_NAME", "NODE_TYPE"), suggestions.stream().map(TokenSuggestion::tokenName).toList());
    }
}
