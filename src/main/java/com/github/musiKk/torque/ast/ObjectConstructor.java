package com.github.musiKk.torque.ast;

public enum ObjectConstructor {
    NEW("new"),
    DATABLOCK("datablock"),
    SINGLETON("singleton");

    private final String keyword;

    private ObjectConstructor(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
