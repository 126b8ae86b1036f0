package com.github.musiKk.torque.ast;

import java.util.List;
import java.util.Optional;

/**
 * Program structure built from expressions and blocks. A block is a plain
 * {@code List<Statement>}.
 * <p>
 * Any expression may stand as an {@link Exp} statement, including ones the
 * TorqueScript compiler would refuse such as {@code 5;}.
 */
public sealed interface Statement extends Comparable<Statement> {

    Kind kind();

    <R> R accept(Visitor<R> visitor);

    @Override
    default int compareTo(Statement other) {
        return AstOrder.compare(this, other);
    }

    enum Kind {
        IF_ELSE, WHILE, FOR, FOR_EACH, FOR_EACH_STRING, EXP
    }

    interface Visitor<R> {
        R visitIfElse(IfElse ifElse);
        R visitWhile(While whileStatement);
        R visitFor(For forStatement);
        R visitForEach(ForEach forEach);
        R visitForEachString(ForEachString forEachString);
        R visitExp(Exp exp);
    }

    /**
     * An absent else branch ({@code Optional.empty()}) is not the same tree as
     * an empty one ({@code Optional.of(List.of())}).
     */
    record IfElse(Expression condition, List<Statement> thenBlock, Optional<List<Statement>> elseBlock) implements Statement {
        public IfElse {
            thenBlock = List.copyOf(thenBlock);
            elseBlock = elseBlock.map(List::copyOf);
        }
        public IfElse(Expression condition, List<Statement> thenBlock) {
            this(condition, thenBlock, Optional.empty());
        }
        public IfElse(Expression condition, List<Statement> thenBlock, List<Statement> elseBlock) {
            this(condition, thenBlock, Optional.of(elseBlock));
        }
        public Kind kind() { return Kind.IF_ELSE; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitIfElse(this); }
    }

    record While(Expression condition, List<Statement> body) implements Statement {
        public While {
            body = List.copyOf(body);
        }
        public Kind kind() { return Kind.WHILE; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitWhile(this); }
    }

    /**
     * All three clauses are required. A builder fills an omitted clause with a
     * placeholder expression of its choosing.
     */
    record For(Expression init, Expression condition, Expression step, List<Statement> body) implements Statement {
        public For {
            body = List.copyOf(body);
        }
        public Kind kind() { return Kind.FOR; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitFor(this); }
    }

    // foreach (%obj in %set)
    record ForEach(Name variable, Expression collection, List<Statement> body) implements Statement {
        public ForEach {
            body = List.copyOf(body);
        }
        public Kind kind() { return Kind.FOR_EACH; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitForEach(this); }
    }

    // foreach$ (%word in %sentence)
    record ForEachString(Name variable, Expression string, List<Statement> body) implements Statement {
        public ForEachString {
            body = List.copyOf(body);
        }
        public Kind kind() { return Kind.FOR_EACH_STRING; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitForEachString(this); }
    }

    record Exp(Expression expression) implements Statement {
        public Kind kind() { return Kind.EXP; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitExp(this); }
    }

}
