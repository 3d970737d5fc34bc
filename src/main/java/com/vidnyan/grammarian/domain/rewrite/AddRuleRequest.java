package com.vidnyan.grammarian.domain.rewrite;

/**
 * Everything needed to add a rule.
 *
 * @param body           rule body without colon and semicolon
 * @param lexerCommand   raw command text appended after {@code ->}, e.g. {@code skip} or {@code channel(HIDDEN)}
 * @param returns        parser rule return clause content, e.g. {@code [int value]}
 * @param mode           target mode for lexer rules, null for {@code DEFAULT_MODE}
 * @param anchor         existing rule to insert next to; null for alphabetical placement
 * @param position       side of the anchor
 */
public record AddRuleRequest(
    String name,
    String body,
    boolean fragment,
    String lexerCommand,
    String returns,
    String mode,
    String anchor,
    MovePosition position
) {

    public static AddRuleRequest of(String name, String body) {
        return builder().name(name).body(body).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String body;
        private boolean fragment;
        private String lexerCommand;
        private String returns;
        private String mode;
        private String anchor;
        private MovePosition position = MovePosition.AFTER;

        public Builder name(String name) { this.name = name; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder fragment(boolean fragment) { this.fragment = fragment; return this; }
        public Builder lexerCommand(String command) { this.lexerCommand = command; return this; }
        public Builder returns(String returns) { this.returns = returns; return this; }
        public Builder mode(String mode) { this.mode = mode; return this; }
        public Builder after(String anchor) { this.anchor = anchor; this.position = MovePosition.AFTER; return this; }
        public Builder before(String anchor) { this.anchor = anchor; this.position = MovePosition.BEFORE; return this; }

        public AddRuleRequest build() {
            return new AddRuleRequest(name, body, fragment, lexerCommand, returns, mode, anchor, position);
        }
    }
}
