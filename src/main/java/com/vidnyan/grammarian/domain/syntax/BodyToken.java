package com.vidnyan.grammarian.domain.syntax;

/**
 * Lexical unit of a rule definition. Offsets index the full grammar text.
 */
public record BodyToken(Type type, String text, int start, int end) {

    public enum Type {
        IDENT,
        LITERAL,            // 'abc'
        CHAR_SET,           // [a-z] or parser rule arguments
        ACTION,             // { ... }
        PREDICATE,          // { ... }?
        ELEMENT_OPTIONS,    // <assoc=right>
        LPAREN,
        RPAREN,
        PIPE,
        QUESTION,
        STAR,
        PLUS,
        TILDE,
        DOT,
        RANGE,              // ..
        ARROW,              // ->
        COLON,
        SEMI,
        COMMA,
        HASH,
        ASSIGN,
        PLUS_ASSIGN,
        AT,
        OTHER
    }

    public boolean is(Type t) {
        return type == t;
    }

    public boolean isIdent(String name) {
        return type == Type.IDENT && text.equals(name);
    }
}
