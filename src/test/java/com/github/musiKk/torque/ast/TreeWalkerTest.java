package com.github.musiKk.torque.ast;

import static com.github.musiKk.torque.ast.SampleTrees.global;
import static com.github.musiKk.torque.ast.SampleTrees.local;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.github.musiKk.torque.ast.Expression.Assign;
import com.github.musiKk.torque.ast.Expression.Binary;
import com.github.musiKk.torque.ast.Expression.IntLit;

public class TreeWalkerTest {

    static class KindRecorder extends TreeWalker {
        Set<Expression.Kind> expressions = EnumSet.noneOf(Expression.Kind.class);
        Set<Statement.Kind> statements = EnumSet.noneOf(Statement.Kind.class);
        Set<Definition.Kind> definitions = EnumSet.noneOf(Definition.Kind.class);
        Set<Name.Kind> names = EnumSet.noneOf(Name.Kind.class);
        Set<ObjectConstructor> constructors = EnumSet.noneOf(ObjectConstructor.class);
        int members;
        int namespaces;

        @Override
        protected boolean visitExpression(Expression expression) {
            expressions.add(expression.kind());
            return true;
        }

        @Override
        protected boolean visitStatement(Statement statement) {
            statements.add(statement.kind());
            return true;
        }

        @Override
        protected boolean visitDefinition(Definition definition) {
            definitions.add(definition.kind());
            return true;
        }

        @Override
        protected boolean visitObject(ObjectCreation object) {
            constructors.add(object.constructor());
            return true;
        }

        @Override
        protected boolean visitMember(Member member) {
            members++;
            return true;
        }

        @Override
        protected void visitName(Name name) {
            names.add(name.kind());
        }

        @Override
        protected void visitNamespace(Namespace namespace) {
            namespaces++;
        }
    }

    @Test
    public void testEveryVariantIsVisited() {
        var recorder = new KindRecorder();
        recorder.walk(SampleTrees.everyVariant());

        assertEquals(EnumSet.allOf(Expression.Kind.class), recorder.expressions);
        assertEquals(EnumSet.allOf(Statement.Kind.class), recorder.statements);
        assertEquals(EnumSet.allOf(Definition.Kind.class), recorder.definitions);
        assertEquals(EnumSet.allOf(Name.Kind.class), recorder.names);
        assertEquals(EnumSet.allOf(ObjectConstructor.class), recorder.constructors);
        assertEquals(2, recorder.members);
        assertEquals(2, recorder.namespaces);
    }

    @Test
    public void testPreOrderLeftToRight() {
        List<String> visited = new ArrayList<>();
        var walker = new TreeWalker() {
            @Override
            protected boolean visitExpression(Expression expression) {
                visited.add(expression.getClass().getSimpleName());
                return true;
            }

            @Override
            protected void visitName(Name name) {
                visited.add(name.sigil() + name.ident());
            }
        };

        // %a = $b + 1
        walker.walk(new Assign(local("a"), new Binary(global("b"), Op.PLUS, new IntLit(1))));

        assertEquals(List.of("Assign", "Variable", "%a", "Binary", "Variable", "$b", "IntLit"), visited);
    }

    @Test
    public void testPruning() {
        var walker = new KindRecorder() {
            @Override
            protected boolean visitFunction(FunctionDeclaration function) {
                return false;
            }
        };
        walker.walk(SampleTrees.everyVariant());

        // only the top-level statements remain
        assertEquals(EnumSet.of(Statement.Kind.EXP), walker.statements);
        assertEquals(EnumSet.of(Name.Kind.GLOBAL), walker.names);
        assertEquals(0, walker.namespaces);
        assertTrue(walker.expressions.contains(Expression.Kind.OBJECT_EXP));
        assertEquals(EnumSet.allOf(Definition.Kind.class), walker.definitions);
    }

}
