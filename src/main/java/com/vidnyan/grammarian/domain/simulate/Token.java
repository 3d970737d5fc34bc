package com.vidnyan.grammarian.domain.simulate;

/**
 * A token produced by the lexer simulation.
 *
 * @param endOffset inclusive, like the runtime's stop index
 * @param line      1-based
 * @param column    0-based
 */
public record Token(
    String type,
    String text,
    String channel,
    boolean skipped,
    int startOffset,
    int endOffset,
    int line,
    int column
) {

    public static final String DEFAULT_CHANNEL = "DEFAULT_TOKEN_CHANNEL";

    /**
     * Whether a parser would see this token.
     */
    public boolean isVisibleToParser() {
        return !skipped && DEFAULT_CHANNEL.equals(channel);
    }

    public String display() {
        return type + "(\"" + text + "\")";
    }
}
