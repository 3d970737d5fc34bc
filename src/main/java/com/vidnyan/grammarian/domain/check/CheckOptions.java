package com.vidnyan.grammarian.domain.check;

import java.util.Set;

/**
 * Tunables shared by all checks.
 *
 * @param multiFile        the grammar is a merged multi-file model, so every name is local
 * @param minPrefixLength  shared leading elements needed to report overlapping alternatives
 * @param disabledChecks   check names to skip
 */
public record CheckOptions(boolean multiFile, int minPrefixLength, Set<String> disabledChecks) {

    public static final int DEFAULT_MIN_PREFIX_LENGTH = 2;

    public CheckOptions {
        disabledChecks = disabledChecks == null ? Set.of() : Set.copyOf(disabledChecks);
        if (minPrefixLength < 1) {
            minPrefixLength = DEFAULT_MIN_PREFIX_LENGTH;
        }
    }

    public static CheckOptions defaults() {
        return new CheckOptions(false, DEFAULT_MIN_PREFIX_LENGTH, Set.of());
    }

    public CheckOptions withMultiFile(boolean value) {
        return new CheckOptions(value, minPrefixLength, disabledChecks);
    }

    public boolean isDisabled(String checkName) {
        return disabledChecks.contains(checkName);
    }
}
