package com.github.musiKk.torque.ast;

import java.util.ArrayList;
import java.util.List;

import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;

/**
 * Collects every node of a given type, in the order {@link TreeWalker} visits
 * them.
 * <pre>
 * var calls = NodeCollector.collect(file, Expression.Call.class);
 * var names = NodeCollector.collect(file, Name.class);
 * </pre>
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class NodeCollector<T> extends TreeWalker {

    private final Class<T> type;
    private final List<T> found = new ArrayList<>();

    public static <T> List<T> collect(ScriptFile file, Class<T> type) {
        var collector = new NodeCollector<>(type);
        collector.walk(file);
        return List.copyOf(collector.found);
    }

    public static <T> List<T> collect(Statement statement, Class<T> type) {
        var collector = new NodeCollector<>(type);
        collector.walk(statement);
        return List.copyOf(collector.found);
    }

    public static <T> List<T> collect(Expression expression, Class<T> type) {
        var collector = new NodeCollector<>(type);
        collector.walk(expression);
        return List.copyOf(collector.found);
    }

    private boolean offer(Object node) {
        if (type.isInstance(node)) {
            found.add(type.cast(node));
        }
        return true;
    }

    @Override
    protected boolean visitFile(ScriptFile file) { return offer(file); }

    @Override
    protected boolean visitDefinition(Definition definition) { return offer(definition); }

    @Override
    protected boolean visitFunction(FunctionDeclaration function) { return offer(function); }

    @Override
    protected boolean visitStatement(Statement statement) { return offer(statement); }

    @Override
    protected boolean visitExpression(Expression expression) { return offer(expression); }

    @Override
    protected boolean visitObject(ObjectCreation object) { return offer(object); }

    @Override
    protected boolean visitMember(Member member) { return offer(member); }

    @Override
    protected void visitName(Name name) { offer(name); }

    @Override
    protected void visitNamespace(Namespace namespace) { offer(namespace); }

}
