package com.vidnyan.lre.domain.expression;

/**
 * One element of a tokenized expression.
 * Literals and folded intermediate results both carry a {@link Value}.
 */
public record Token(Type type, String text, Value value) {

    public enum Type {
        LEFT_PAREN,
        RIGHT_PAREN,
        COMMA,
        AND,
        OR,
        NOT,
        COMPARISON,
        IDENTIFIER,
        LITERAL
    }

    public static Token of(Type type, String text) {
        return new Token(type, text, null);
    }

    public static Token literal(Value value) {
        return new Token(Type.LITERAL, value.render(), value);
    }

    public static Token identifier(String name) {
        return new Token(Type.IDENTIFIER, name, null);
    }

    public boolean is(Type expected) {
        return type == expected;
    }

    public boolean isOperand() {
        return type == Type.LITERAL || type == Type.IDENTIFIER;
    }
}
