package com.vidnyan.grammarian.domain.syntax;

import com.vidnyan.grammarian.domain.syntax.BodyToken.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser from body tokens to an {@link Alternation} tree.
 * Never fails: tokens it cannot place are skipped.
 */
public final class RuleExpressionParser {

    private final List<BodyToken> tokens;
    private int pos;
    private int depth;

    private RuleExpressionParser(List<BodyToken> tokens) {
        this.tokens = tokens;
    }

    public static Alternation parse(List<BodyToken> tokens) {
        return new RuleExpressionParser(tokens).alternation();
    }

    private Alternation alternation() {
        List<Sequence> alternatives = new ArrayList<>();
        alternatives.add(sequence());
        while (peek(Type.PIPE)) {
            pos++;
            alternatives.add(sequence());
        }
        return new Alternation(alternatives);
    }

    private Sequence sequence() {
        List<Element> elements = new ArrayList<>();
        List<LexerCommand> commands = new ArrayList<>();
        String label = null;
        while (pos < tokens.size()) {
            BodyToken t = tokens.get(pos);
            if (t.is(Type.PIPE) || t.is(Type.SEMI) || (t.is(Type.RPAREN) && depth > 0)) {
                break;
            }
            switch (t.type()) {
                case ARROW -> {
                    pos++;
                    commands.addAll(commands());
                }
                case HASH -> {
                    pos++;
                    if (peek(Type.IDENT)) {
                        label = tokens.get(pos++).text();
                    }
                }
                case RPAREN, ELEMENT_OPTIONS, COMMA, COLON, AT, OTHER, QUESTION, STAR, PLUS,
                     ASSIGN, PLUS_ASSIGN, RANGE -> pos++;
                default -> {
                    Element element = element();
                    if (element != null) {
                        elements.add(element);
                    }
                }
            }
        }
        return new Sequence(elements, commands, label);
    }

    private Element element() {
        String label = null;
        if (peek(Type.IDENT) && pos + 1 < tokens.size()
                && (tokens.get(pos + 1).is(Type.ASSIGN) || tokens.get(pos + 1).is(Type.PLUS_ASSIGN))) {
            label = tokens.get(pos).text();
            pos += 2;
        }
        Atom atom = atom();
        if (atom == null) {
            return null;
        }
        Quantifier quantifier = Quantifier.ONE;
        boolean greedy = true;
        if (peek(Type.QUESTION) || peek(Type.STAR) || peek(Type.PLUS)) {
            quantifier = switch (tokens.get(pos).type()) {
                case QUESTION -> Quantifier.OPTIONAL;
                case STAR -> Quantifier.STAR;
                default -> Quantifier.PLUS;
            };
            pos++;
            if (peek(Type.QUESTION)) {
                greedy = false;
                pos++;
            }
        }
        return new Element(atom, quantifier, greedy, label);
    }

    private Atom atom() {
        if (pos >= tokens.size()) {
            return null;
        }
        BodyToken t = tokens.get(pos++);
        return switch (t.type()) {
            case IDENT -> {
                // rule arguments are written directly after the name: expr[5]
                if (peek(Type.CHAR_SET) && tokens.get(pos).start() == t.end()) {
                    pos++;
                }
                yield new Atom.RuleRef(t.text());
            }
            case LITERAL -> {
                Atom.Literal from = new Atom.Literal(t.text());
                if (peek(Type.RANGE) && pos + 1 < tokens.size() && tokens.get(pos + 1).is(Type.LITERAL)) {
                    Atom.Literal to = new Atom.Literal(tokens.get(pos + 1).text());
                    pos += 2;
                    yield new Atom.Range(from, to);
                }
                yield from;
            }
            case CHAR_SET -> new Atom.CharSet(t.text());
            case DOT -> new Atom.Wildcard();
            case TILDE -> {
                Atom inner = atom();
                yield inner == null ? null : new Atom.Not(inner);
            }
            case LPAREN -> {
                depth++;
                Alternation body = alternation();
                depth--;
                if (peek(Type.RPAREN)) {
                    pos++;
                }
                yield new Atom.Group(body);
            }
            case ACTION -> new Atom.Action(t.text(), false);
            case PREDICATE -> new Atom.Action(t.text(), true);
            default -> null;
        };
    }

    private List<LexerCommand> commands() {
        List<LexerCommand> commands = new ArrayList<>();
        while (pos < tokens.size()) {
            if (peek(Type.COMMA)) {
                pos++;
                continue;
            }
            if (!peek(Type.IDENT)) {
                break;
            }
            String name = tokens.get(pos++).text();
            String argument = null;
            if (peek(Type.LPAREN)) {
                pos++;
                StringBuilder arg = new StringBuilder();
                while (pos < tokens.size() && !peek(Type.RPAREN)) {
                    arg.append(tokens.get(pos++).text());
                }
                if (peek(Type.RPAREN)) {
                    pos++;
                }
                argument = arg.toString();
            }
            commands.add(new LexerCommand(name, argument));
        }
        return commands;
    }

    private boolean peek(Type type) {
        return pos < tokens.size() && tokens.get(pos).is(type);
    }
}
