package com.vidnyan.grammarian.domain.model;

/**
 * A finding about a grammar.
 * Immutable value object, always derived from source text.
 */
public record Issue(
    Severity severity,
    String type,
    String message,
    String ruleName,
    Integer lineNumber,
    String suggestion
) {

    public static Issue error(String type, String message) {
        return builder().severity(Severity.ERROR).type(type).message(message).build();
    }

    public static Issue warning(String type, String message) {
        return builder().severity(Severity.WARNING).type(type).message(message).build();
    }

    public static Issue info(String type, String message) {
        return builder().severity(Severity.INFO).type(type).message(message).build();
    }

    /**
     * Copy with the message prefixed, used when issues of imported grammars are merged.
     */
    public Issue withMessagePrefix(String prefix) {
        return new Issue(severity, type, prefix + message, ruleName, lineNumber, suggestion);
    }

    /**
     * Format as a single readable line.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity).append(" [").append(type).append("] ");
        if (lineNumber != null && lineNumber > 0) {
            sb.append("line ").append(lineNumber).append(": ");
        }
        sb.append(message);
        if (suggestion != null && !suggestion.isBlank()) {
            sb.append(" (").append(suggestion).append(")");
        }
        return sb.toString();
    }

    /**
     * Builder for Issue.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Severity severity = Severity.WARNING;
        private String type;
        private String message;
        private String ruleName;
        private Integer lineNumber;
        private String suggestion;

        public Builder severity(Severity sev) { this.severity = sev; return this; }
        public Builder type(String type) { this.type = type; return this; }
        public Builder message(String msg) { this.message = msg; return this; }
        public Builder ruleName(String name) { this.ruleName = name; return this; }
        public Builder lineNumber(Integer line) { this.lineNumber = line; return this; }
        public Builder suggestion(String text) { this.suggestion = text; return this; }

        public Issue build() {
            return new Issue(severity, type, message, ruleName, lineNumber, suggestion);
        }
    }
}
