package com.vidnyan.grammarian.domain.check;

/**
 * A static check over a grammar model.
 * Implementations are stateless and never modify the grammar.
 */
public interface GrammarCheck {

    /**
     * Check if this check belongs to the requested family.
     */
    boolean supports(CheckCategory category);

    /**
     * Run the check.
     */
    CheckResult evaluate(CheckContext context);

    /**
     * Get the check name for logging and for disabling.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
