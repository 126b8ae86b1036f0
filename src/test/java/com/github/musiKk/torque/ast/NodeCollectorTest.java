package com.github.musiKk.torque.ast;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.github.musiKk.torque.ast.Expression.Call;
import com.github.musiKk.torque.ast.Name.Global;
import com.github.musiKk.torque.ast.Name.Local;

public class NodeCollectorTest {

    private final ScriptFile file = SampleTrees.everyVariant();

    @Test
    public void testCollectCallsInSourceOrder() {
        var calls = NodeCollector.collect(file, Call.class).stream()
                .map(Call::name)
                .toList();
        assertEquals(List.of("echo", "delete", "echo"), calls);
    }

    @Test
    public void testCollectNames() {
        assertEquals(List.of(new Global("count")), NodeCollector.collect(file, Global.class));

        var locals = NodeCollector.collect(file, Local.class);
        assertEquals(21, locals.size());
        assertEquals(List.of(new Local("this"), new Local("obj"), new Local("obj"), new Local("list")), locals.subList(0, 4));
        assertEquals(22, NodeCollector.collect(file, Name.class).size());
    }

    @Test
    public void testCollectNamespaces() {
        assertEquals(List.of(new Namespace("Player"), new Namespace("Parent")), NodeCollector.collect(file, Namespace.class));
    }

    @Test
    public void testCollectObjects() {
        var classes = NodeCollector.collect(file, ObjectCreation.class).stream()
                .map(o -> o.objectClass().fold(ident -> ident, e -> "(dynamic)"))
                .toList();
        assertEquals(List.of("ScriptObject", "SimSet", "(dynamic)", "PlayerData", "Material"), classes);
        assertEquals(List.of("field", "mass"), NodeCollector.collect(file, Member.class).stream().map(Member::ident).toList());
    }

    @Test
    public void testCollectFunctionsIncludingPackaged() {
        var functions = NodeCollector.collect(file, FunctionDeclaration.class).stream()
                .map(FunctionDeclaration::qualifiedName)
                .toList();
        assertEquals(List.of("Player::onAdd", "echo"), functions);
    }

    @Test
    public void testCollectFromSubtree() {
        var statement = file.statements().get(0);
        assertEquals(List.of(new Global("count")), NodeCollector.collect(statement, Name.class));
        assertEquals(List.of(statement), NodeCollector.collect(statement, Statement.class));
        assertEquals(file, NodeCollector.collect(file, ScriptFile.class).get(0));
    }

}
