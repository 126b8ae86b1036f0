package com.github.musiKk.torque.ast;

import java.util.List;
import java.util.Optional;

/**
 * {@code function Namespace::name(%a, %b) { ... }}
 * <p>
 * The namespace is metadata about where the function is defined. It plays no
 * part in resolving the function's own name.
 */
public record FunctionDeclaration(Optional<Namespace> namespace, String name, List<Name> params, List<Statement> body)
        implements Comparable<FunctionDeclaration> {

    public FunctionDeclaration {
        params = List.copyOf(params);
        body = List.copyOf(body);
    }

    public FunctionDeclaration(String name, List<Name> params, List<Statement> body) {
        this(Optional.empty(), name, params, body);
    }

    public FunctionDeclaration(Namespace namespace, String name, List<Name> params, List<Statement> body) {
        this(Optional.of(namespace), name, params, body);
    }

    public String qualifiedName() {
        return namespace.map(ns -> ns.ident() + "::" + name).orElse(name);
    }

    @Override
    public int compareTo(FunctionDeclaration other) {
        return AstOrder.FUNCTION.compare(this, other);
    }

}
