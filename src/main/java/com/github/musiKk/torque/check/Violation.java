package com.github.musiKk.torque.check;

/**
 * A tree shape TorqueScript would reject. {@code node} is the offending
 * statement or expression.
 */
public record Violation(Kind kind, Object node) {

    public enum Kind {
        BARE_EXPRESSION("expression has no effect as a statement"),
        ASSIGN_TARGET("cannot assign to this expression"),
        TOP_LEVEL_STATEMENT("statement outside of a function");

        private final String description;

        private Kind(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    public String message() {
        return kind.description() + ": " + node;
    }

}
