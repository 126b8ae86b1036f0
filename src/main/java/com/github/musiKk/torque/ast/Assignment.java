package com.github.musiKk.torque.ast;

import java.util.Optional;

public enum Assignment {
    EQUALS("=", null),
    PLUS_EQUALS("+=", Op.PLUS),
    MINUS_EQUALS("-=", Op.MINUS),
    TIMES_EQUALS("*=", Op.TIMES),
    DIV_EQUALS("/=", Op.DIV),
    AND_EQUALS("&=", Op.AND),
    OR_EQUALS("|=", Op.OR),
    XOR_EQUALS("^=", Op.XOR),
    LEFT_SHIFT_EQUALS("<<=", Op.LEFT_SHIFT),
    RIGHT_SHIFT_EQUALS(">>=", Op.RIGHT_SHIFT);

    private final String token;
    private final Op operator;

    private Assignment(String token, Op operator) {
        this.token = token;
        this.operator = operator;
    }

    public String token() {
        return token;
    }

    /**
     * The operator a compound assignment applies between the current value
     * of the target and the assigned value; empty for plain {@code =}.
     */
    public Optional<Op> operator() {
        return Optional.ofNullable(operator);
    }

    public boolean isCompound() {
        return operator != null;
    }
}
