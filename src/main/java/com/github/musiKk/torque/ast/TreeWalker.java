package com.github.musiKk.torque.ast;

import java.util.List;
import java.util.Optional;

import com.github.musiKk.torque.ast.Definition.FunctionDef;
import com.github.musiKk.torque.ast.Definition.PackageDef;
import com.github.musiKk.torque.ast.Expression.ArrayAccess;
import com.github.musiKk.torque.ast.Expression.Assign;
import com.github.musiKk.torque.ast.Expression.Binary;
import com.github.musiKk.torque.ast.Expression.Call;
import com.github.musiKk.torque.ast.Expression.FloatLit;
import com.github.musiKk.torque.ast.Expression.IntLit;
import com.github.musiKk.torque.ast.Expression.ObjectExp;
import com.github.musiKk.torque.ast.Expression.Post;
import com.github.musiKk.torque.ast.Expression.SlotAccess;
import com.github.musiKk.torque.ast.Expression.StringLit;
import com.github.musiKk.torque.ast.Expression.TaggedStringLit;
import com.github.musiKk.torque.ast.Expression.Variable;
import com.github.musiKk.torque.ast.Statement.Exp;
import com.github.musiKk.torque.ast.Statement.For;
import com.github.musiKk.torque.ast.Statement.ForEach;
import com.github.musiKk.torque.ast.Statement.ForEachString;
import com.github.musiKk.torque.ast.Statement.IfElse;
import com.github.musiKk.torque.ast.Statement.While;

/**
 * Visits every node of a tree in pre-order, children left to right.
 * <p>
 * Subclasses override the {@code visit} hooks they care about. A hook that
 * returns {@code false} keeps the walker out of that node's children.
 */
public class TreeWalker {

    private final Descender descender = new Descender();

    protected boolean visitFile(ScriptFile file) { return true; }
    protected boolean visitDefinition(Definition definition) { return true; }
    protected boolean visitFunction(FunctionDeclaration function) { return true; }
    protected boolean visitStatement(Statement statement) { return true; }
    protected boolean visitExpression(Expression expression) { return true; }
    protected boolean visitObject(ObjectCreation object) { return true; }
    protected boolean visitMember(Member member) { return true; }
    protected void visitName(Name name) {}
    protected void visitNamespace(Namespace namespace) {}

    public final void walk(ScriptFile file) {
        if (visitFile(file)) {
            for (var entry : file.entries()) {
                entry.fold(
                    s -> { walk(s); return null; },
                    d -> { walk(d); return null; });
            }
        }
    }

    public final void walk(Definition definition) {
        if (visitDefinition(definition)) {
            definition.accept(descender);
        }
    }

    public final void walk(FunctionDeclaration function) {
        if (visitFunction(function)) {
            function.namespace().ifPresent(this::visitNamespace);
            function.params().forEach(this::visitName);
            walk(function.body());
        }
    }

    public final void walk(List<Statement> block) {
        block.forEach(this::walk);
    }

    public final void walk(Statement statement) {
        if (visitStatement(statement)) {
            statement.accept(descender);
        }
    }

    public final void walk(Expression expression) {
        if (visitExpression(expression)) {
            expression.accept(descender);
        }
    }

    public final void walk(ObjectCreation object) {
        if (visitObject(object)) {
            object.objectClass().fold(ident -> null, e -> { walk(e); return null; });
            for (var content : object.contents()) {
                content.fold(
                    m -> { walk(m); return null; },
                    o -> { walk(o); return null; });
            }
        }
    }

    public final void walk(Member member) {
        if (visitMember(member)) {
            walk(member.value());
        }
    }

    private void walk(Optional<List<Statement>> block) {
        block.ifPresent(this::walk);
    }

    private class Descender implements Expression.Visitor<Void>, Statement.Visitor<Void>, Definition.Visitor<Void> {

        @Override
        public Void visitFunctionDef(FunctionDef functionDef) {
            walk(functionDef.function());
            return null;
        }

        @Override
        public Void visitPackageDef(PackageDef packageDef) {
            packageDef.functions().forEach(TreeWalker.this::walk);
            return null;
        }

        @Override
        public Void visitIfElse(IfElse ifElse) {
            walk(ifElse.condition());
            walk(ifElse.thenBlock());
            walk(ifElse.elseBlock());
            return null;
        }

        @Override
        public Void visitWhile(While whileStatement) {
            walk(whileStatement.condition());
            walk(whileStatement.body());
            return null;
        }

        @Override
        public Void visitFor(For forStatement) {
            walk(forStatement.init());
            walk(forStatement.condition());
            walk(forStatement.step());
            walk(forStatement.body());
            return null;
        }

        @Override
        public Void visitForEach(ForEach forEach) {
            visitName(forEach.variable());
            walk(forEach.collection());
            walk(forEach.body());
            return null;
        }

        @Override
        public Void visitForEachString(ForEachString forEachString) {
            visitName(forEachString.variable());
            walk(forEachString.string());
            walk(forEachString.body());
            return null;
        }

        @Override
        public Void visitExp(Exp exp) {
            walk(exp.expression());
            return null;
        }

        @Override
        public Void visitAssign(Assign assign) {
            walk(assign.target());
            walk(assign.value());
            return null;
        }

        @Override
        public Void visitCall(Call call) {
            call.namespace().ifPresent(TreeWalker.this::visitNamespace);
            call.arguments().forEach(TreeWalker.this::walk);
            return null;
        }

        @Override
        public Void visitBinary(Binary binary) {
            walk(binary.left());
            walk(binary.right());
            return null;
        }

        @Override
        public Void visitPost(Post post) {
            walk(post.operand());
            return null;
        }

        @Override
        public Void visitSlotAccess(SlotAccess slotAccess) {
            walk(slotAccess.object());
            walk(slotAccess.member());
            return null;
        }

        @Override
        public Void visitArrayAccess(ArrayAccess arrayAccess) {
            walk(arrayAccess.array());
            walk(arrayAccess.index());
            return null;
        }

        @Override
        public Void visitIntLit(IntLit intLit) { return null; }

        @Override
        public Void visitFloatLit(FloatLit floatLit) { return null; }

        @Override
        public Void visitStringLit(StringLit stringLit) { return null; }

        @Override
        public Void visitTaggedStringLit(TaggedStringLit taggedStringLit) { return null; }

        @Override
        public Void visitVariable(Variable variable) {
            visitName(variable.name());
            return null;
        }

        @Override
        public Void visitObjectExp(ObjectExp objectExp) {
            walk(objectExp.object());
            return null;
        }
    }

}
