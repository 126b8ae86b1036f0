package com.github.musiKk.torque.ast;

import java.util.List;
import java.util.Optional;

/**
 * Anything that has a value. Parentheses and operator precedence are already
 * resolved into the shape of the tree.
 */
public sealed interface Expression extends Comparable<Expression> {

    Kind kind();

    <R> R accept(Visitor<R> visitor);

    @Override
    default int compareTo(Expression other) {
        return AstOrder.compare(this, other);
    }

    enum Kind {
        ASSIGN, CALL, BINARY, POST, SLOT_ACCESS, ARRAY_ACCESS,
        INT_LIT, FLOAT_LIT, STRING_LIT, TAGGED_STRING_LIT,
        VARIABLE, OBJECT_EXP
    }

    interface Visitor<R> {
        R visitAssign(Assign assign);
        R visitCall(Call call);
        R visitBinary(Binary binary);
        R visitPost(Post post);
        R visitSlotAccess(SlotAccess slotAccess);
        R visitArrayAccess(ArrayAccess arrayAccess);
        R visitIntLit(IntLit intLit);
        R visitFloatLit(FloatLit floatLit);
        R visitStringLit(StringLit stringLit);
        R visitTaggedStringLit(TaggedStringLit taggedStringLit);
        R visitVariable(Variable variable);
        R visitObjectExp(ObjectExp objectExp);
    }

    /**
     * {@code target} is any expression; whether it can be assigned to is not
     * decided here.
     */
    record Assign(Expression target, Assignment assignment, Expression value) implements Expression {
        public Assign(Expression target, Expression value) {
            this(target, Assignment.EQUALS, value);
        }
        public Kind kind() { return Kind.ASSIGN; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitAssign(this); }
    }

    record Call(Optional<Namespace> namespace, String name, List<Expression> arguments) implements Expression {
        public Call {
            arguments = List.copyOf(arguments);
        }
        public Call(String name, List<Expression> arguments) {
            this(Optional.empty(), name, arguments);
        }
        public Call(Namespace namespace, String name, List<Expression> arguments) {
            this(Optional.of(namespace), name, arguments);
        }
        public Kind kind() { return Kind.CALL; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitCall(this); }
    }

    record Binary(Expression left, Op op, Expression right) implements Expression {
        public Kind kind() { return Kind.BINARY; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitBinary(this); }
    }

    record Post(Unary unary, Expression operand) implements Expression {
        public Kind kind() { return Kind.POST; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitPost(this); }
    }

    // %obj.member; the member side is an expression so that %obj.(%field) fits
    record SlotAccess(Expression object, Expression member) implements Expression {
        public Kind kind() { return Kind.SLOT_ACCESS; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitSlotAccess(this); }
    }

    record ArrayAccess(Expression array, Expression index) implements Expression {
        public Kind kind() { return Kind.ARRAY_ACCESS; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitArrayAccess(this); }
    }

    record IntLit(long value) implements Expression {
        public Kind kind() { return Kind.INT_LIT; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitIntLit(this); }
    }

    record FloatLit(double value) implements Expression {
        public Kind kind() { return Kind.FLOAT_LIT; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitFloatLit(this); }
    }

    record StringLit(String value) implements Expression {
        public Kind kind() { return Kind.STRING_LIT; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitStringLit(this); }
    }

    // 'tagged' string, single quoted in source
    record TaggedStringLit(String value) implements Expression {
        public Kind kind() { return Kind.TAGGED_STRING_LIT; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitTaggedStringLit(this); }
    }

    record Variable(Name name) implements Expression {
        public Kind kind() { return Kind.VARIABLE; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitVariable(this); }
    }

    record ObjectExp(ObjectCreation object) implements Expression {
        public Kind kind() { return Kind.OBJECT_EXP; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitObjectExp(this); }
    }

}
