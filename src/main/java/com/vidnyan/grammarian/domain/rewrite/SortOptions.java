package com.vidnyan.grammarian.domain.rewrite;

/**
 * @param parserFirst order for {@link SortStrategy#TYPE}
 * @param anchor      rule the {@link SortStrategy#DEPENDENCY} order is built around
 */
public record SortOptions(boolean parserFirst, String anchor) {

    public static SortOptions defaults() {
        return new SortOptions(true, null);
    }

    public static SortOptions anchoredAt(String anchor) {
        return new SortOptions(true, anchor);
    }
}
