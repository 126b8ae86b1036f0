package com.github.musiKk.torque.ast;

import java.util.List;

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
 * Rebuilds a tree bottom-up. Every node is reconstructed from its rewritten
 * children and then passed to the matching {@code rewrite} hook, which returns
 * its argument unchanged unless overridden.
 * <p>
 * With no hook overridden the result is a fresh copy equal to the input.
 */
public class TreeRewriter {

    private final Rebuilder rebuilder = new Rebuilder();

    protected ScriptFile rewriteFile(ScriptFile file) { return file; }
    protected Definition rewriteDefinition(Definition definition) { return definition; }
    protected FunctionDeclaration rewriteFunction(FunctionDeclaration function) { return function; }
    protected Statement rewriteStatement(Statement statement) { return statement; }
    protected Expression rewriteExpression(Expression expression) { return expression; }
    protected ObjectCreation rewriteObject(ObjectCreation object) { return object; }
    protected Member rewriteMember(Member member) { return member; }
    protected Name rewriteName(Name name) { return name; }
    protected Namespace rewriteNamespace(Namespace namespace) { return namespace; }

    public final ScriptFile rewrite(ScriptFile file) {
        var entries = file.entries().stream()
                .map(e -> e.map(this::rewrite, this::rewrite))
                .toList();
        return rewriteFile(new ScriptFile(entries));
    }

    public final Definition rewrite(Definition definition) {
        return rewriteDefinition(definition.accept(rebuilder));
    }

    public final FunctionDeclaration rewrite(FunctionDeclaration function) {
        var rebuilt = new FunctionDeclaration(
                function.namespace().map(this::rewrite),
                function.name(),
                function.params().stream().map(this::rewrite).toList(),
                rewriteBlock(function.body()));
        return rewriteFunction(rebuilt);
    }

    public final Statement rewrite(Statement statement) {
        return rewriteStatement(statement.accept(rebuilder));
    }

    public final Expression rewrite(Expression expression) {
        return rewriteExpression(expression.accept(rebuilder));
    }

    public final ObjectCreation rewrite(ObjectCreation object) {
        var rebuilt = new ObjectCreation(
                object.constructor(),
                object.objectClass().map(ident -> ident, this::rewrite),
                object.name(),
                object.contents().stream()
                        .map(c -> c.map(this::rewrite, this::rewrite))
                        .toList());
        return rewriteObject(rebuilt);
    }

    public final Member rewrite(Member member) {
        return rewriteMember(new Member(member.ident(), rewrite(member.value())));
    }

    public final Name rewrite(Name name) {
        return rewriteName(name);
    }

    public final Namespace rewrite(Namespace namespace) {
        return rewriteNamespace(namespace);
    }

    public final List<Statement> rewriteBlock(List<Statement> block) {
        return block.stream().map(this::rewrite).toList();
    }

    private List<Expression> rewriteAll(List<Expression> expressions) {
        return expressions.stream().map(this::rewrite).toList();
    }

    private class Rebuilder implements Expression.Visitor<Expression>, Statement.Visitor<Statement>, Definition.Visitor<Definition> {

        @Override
        public Definition visitFunctionDef(FunctionDef functionDef) {
            return new FunctionDef(rewrite(functionDef.function()));
        }

        @Override
        public Definition visitPackageDef(PackageDef packageDef) {
            var functions = packageDef.functions().stream()
                    .map(TreeRewriter.this::rewrite)
                    .toList();
            return new PackageDef(packageDef.name(), functions);
        }

        @Override
        public Statement visitIfElse(IfElse ifElse) {
            return new IfElse(
                    rewrite(ifElse.condition()),
                    rewriteBlock(ifElse.thenBlock()),
                    ifElse.elseBlock().map(TreeRewriter.this::rewriteBlock));
        }

        @Override
        public Statement visitWhile(While whileStatement) {
            return new While(rewrite(whileStatement.condition()), rewriteBlock(whileStatement.body()));
        }

        @Override
        public Statement visitFor(For forStatement) {
            return new For(
                    rewrite(forStatement.init()),
                    rewrite(forStatement.condition()),
                    rewrite(forStatement.step()),
                    rewriteBlock(forStatement.body()));
        }

        @Override
        public Statement visitForEach(ForEach forEach) {
            return new ForEach(
                    rewrite(forEach.variable()),
                    rewrite(forEach.collection()),
                    rewriteBlock(forEach.body()));
        }

        @Override
        public Statement visitForEachString(ForEachString forEachString) {
            return new ForEachString(
                    rewrite(forEachString.variable()),
                    rewrite(forEachString.string()),
                    rewriteBlock(forEachString.body()));
        }

        @Override
        public Statement visitExp(Exp exp) {
            return new Exp(rewrite(exp.expression()));
        }

        @Override
        public Expression visitAssign(Assign assign) {
            return new Assign(rewrite(assign.target()), assign.assignment(), rewrite(assign.value()));
        }

        @Override
        public Expression visitCall(Call call) {
            return new Call(
                    call.namespace().map(TreeRewriter.this::rewrite),
                    call.name(),
                    rewriteAll(call.arguments()));
        }

        @Override
        public Expression visitBinary(Binary binary) {
            return new Binary(rewrite(binary.left()), binary.op(), rewrite(binary.right()));
        }

        @Override
        public Expression visitPost(Post post) {
            return new Post(post.unary(), rewrite(post.operand()));
        }

        @Override
        public Expression visitSlotAccess(SlotAccess slotAccess) {
            return new SlotAccess(rewrite(slotAccess.object()), rewrite(slotAccess.member()));
        }

        @Override
        public Expression visitArrayAccess(ArrayAccess arrayAccess) {
            return new ArrayAccess(rewrite(arrayAccess.array()), rewrite(arrayAccess.index()));
        }

        @Override
        public Expression visitIntLit(IntLit intLit) {
            return new IntLit(intLit.value());
        }

        @Override
        public Expression visitFloatLit(FloatLit floatLit) {
            return new FloatLit(floatLit.value());
        }

        @Override
        public Expression visitStringLit(StringLit stringLit) {
            return new StringLit(stringLit.value());
        }

        @Override
        public Expression visitTaggedStringLit(TaggedStringLit taggedStringLit) {
            return new TaggedStringLit(taggedStringLit.value());
        }

        @Override
        public Expression visitVariable(Variable variable) {
            return new Variable(rewrite(variable.name()));
        }

        @Override
        public Expression visitObjectExp(ObjectExp objectExp) {
            return new ObjectExp(rewrite(objectExp.object()));
        }
    }

}
