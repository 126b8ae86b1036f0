package com.github.musiKk.torque.ast;

// postfix only, the language has no prefix form
public enum Unary {
    INCREMENT("++"),
    DECREMENT("--");

    private final String token;

    private Unary(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public Op operator() {
        return this == INCREMENT ? Op.PLUS : Op.MINUS;
    }
}
