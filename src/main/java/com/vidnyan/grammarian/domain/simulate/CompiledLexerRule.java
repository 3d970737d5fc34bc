package com.vidnyan.grammarian.domain.simulate;

import com.vidnyan.grammarian.domain.syntax.LexerCommand;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A lexer rule ready for matching.
 *
 * @param implicit true for literal tokens a combined grammar defines implicitly in parser rules
 */
public record CompiledLexerRule(
    String name,
    List<Pattern> alternatives,
    String mode,
    List<LexerCommand> commands,
    boolean implicit
) {

    public CompiledLexerRule {
        alternatives = List.copyOf(alternatives);
        commands = List.copyOf(commands);
    }

    /**
     * End offset of the longest match of any alternative starting at {@code start}, or -1.
     */
    public int longestMatch(CharSequence text, int start) {
        int end = -1;
        for (Pattern alternative : alternatives) {
            Matcher m = alternative.matcher(text);
            m.region(start, text.length());
            if (m.lookingAt() && m.end() > end) {
                end = m.end();
            }
        }
        return end;
    }

    public boolean has(String command) {
        return commands.stream().anyMatch(c -> c.is(command));
    }

    public Optional<String> argumentOf(String command) {
        return commands.stream()
                .filter(c -> c.is(command) && c.argument() != null)
                .map(LexerCommand::argument)
                .findFirst();
    }

    /**
     * Token type after {@code type(X)} retyping.
     */
    public String tokenType() {
        return argumentOf("type").orElse(name);
    }

    public String channel() {
        return argumentOf("channel").orElse(Token.DEFAULT_CHANNEL);
    }
}
