package com.github.musiKk.torque.ast;

import java.util.List;

public sealed interface Definition extends Comparable<Definition> {

    Kind kind();

    <R> R accept(Visitor<R> visitor);

    @Override
    default int compareTo(Definition other) {
        return AstOrder.compare(this, other);
    }

    enum Kind {
        FUNCTION_DEF, PACKAGE_DEF
    }

    interface Visitor<R> {
        R visitFunctionDef(FunctionDef functionDef);
        R visitPackageDef(PackageDef packageDef);
    }

    record FunctionDef(FunctionDeclaration function) implements Definition {
        public Kind kind() { return Kind.FUNCTION_DEF; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitFunctionDef(this); }
    }

    /**
     * A package overrides functions and nothing else; the element type makes
     * statements or nested packages unrepresentable.
     */
    record PackageDef(String name, List<FunctionDeclaration> functions) implements Definition {
        public PackageDef {
            functions = List.copyOf(functions);
        }
        public Kind kind() { return Kind.PACKAGE_DEF; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitPackageDef(this); }
    }

}
