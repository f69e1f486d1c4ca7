package com.wayq.expr;

public record Token(Type type, String text, int position) {

    public enum Type {
        IDENTIFIER,
        INTEGER,
        FLOAT,
        STRING,
        OPERATOR,
        PUNCTUATION,
        EOF
    }

    public boolean is(Type type, String text) {
        return this.type == type && this.text.equals(text);
    }

    public boolean isOperator(String text) {
        return is(Type.OPERATOR, text);
    }

    public boolean isPunctuation(String text) {
        return is(Type.PUNCTUATION, text);
    }

    public String describe() {
        return type == Type.EOF ? "end of input" : "'" + text + "'";
    }
}
