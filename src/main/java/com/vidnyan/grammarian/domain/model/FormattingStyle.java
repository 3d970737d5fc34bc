package com.vidnyan.grammarian.domain.model;

/**
 * House style of a grammar file, inferred once and reused by every write.
 */
public record FormattingStyle(
    Placement colonPlacement,
    Placement semicolonPlacement,
    boolean spaceBeforeColon,
    String indent,
    boolean blankLinesBetweenRules,
    String lineSeparator
) {

    public enum Placement {
        SAME_LINE,
        NEW_LINE,
        MIXED
    }

    /**
     * Style used when a file has no rules to learn from.
     */
    public static FormattingStyle defaults() {
        return new FormattingStyle(Placement.SAME_LINE, Placement.SAME_LINE, true, "  ", true, "\n");
    }

    public boolean colonOnNewLine() {
        return colonPlacement == Placement.NEW_LINE;
    }

    public boolean semicolonOnNewLine() {
        return semicolonPlacement == Placement.NEW_LINE;
    }
}
