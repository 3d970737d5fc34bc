package com.vidnyan.grammarian.domain.scan;

/**
 * Location of one rule declaration in the source.
 * Offsets index the original text; {@code endOffset} is exclusive and sits just past the
 * terminating semicolon (or at the point where scanning gave up for an unterminated rule).
 */
public record RuleSpan(
    String name,
    boolean fragment,
    String mode,
    int startOffset,
    int nameOffset,
    int colonOffset,
    int endOffset,
    int startLine,
    int nameLine,
    int endLine,
    boolean terminated
) {

    /**
     * Offset of the terminating semicolon.
     */
    public int semicolonOffset() {
        return terminated ? endOffset - 1 : endOffset;
    }

    public boolean hasColon() {
        return colonOffset >= 0;
    }
}
