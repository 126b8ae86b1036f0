package com.github.musiKk.torque.ast;

public enum Op {
    PLUS("+"), MINUS("-"),
    TIMES("*"), DIV("/"),

    COMPLEMENT("~"), AND("&"), OR("|"), XOR("^"),
    LEFT_SHIFT("<<"), RIGHT_SHIFT(">>"),

    CAT("@"), SPACE("SPC"), LINE("NL"), TAB("TAB"),

    IS_EQUAL("=="), IS_STRING_EQUAL("$="),
    IS_NOT_EQUAL("!="), IS_NOT_STRING_EQUAL("!$="),
    LESS_THAN("<"), GREATER_THAN(">"),
    LESS_THAN_EQUAL("<="), GREATER_THAN_EQUAL(">=");

    private final String token;

    private Op(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public boolean isComparison() {
        return compareTo(IS_EQUAL) >= 0;
    }

    // SPC, NL and TAB are @ with a separator in between
    public boolean isConcatenation() {
        return this == CAT || this == SPACE || this == LINE || this == TAB;
    }
}
