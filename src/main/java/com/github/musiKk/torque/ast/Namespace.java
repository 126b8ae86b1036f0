package com.github.musiKk.torque.ast;

public record Namespace(String ident) implements Comparable<Namespace> {

    @Override
    public int compareTo(Namespace other) {
        return ident.compareTo(other.ident);
    }

}
