package com.github.musiKk.torque.check;

import static com.github.musiKk.torque.ast.SampleTrees.call;
import static com.github.musiKk.torque.ast.SampleTrees.local;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.musiKk.torque.ast.Definition;
import com.github.musiKk.torque.ast.Definition.FunctionDef;
import com.github.musiKk.torque.ast.Either;
import com.github.musiKk.torque.ast.Expression.ArrayAccess;
import com.github.musiKk.torque.ast.Expression.Assign;
import com.github.musiKk.torque.ast.Expression.Binary;
import com.github.musiKk.torque.ast.Expression.Call;
import com.github.musiKk.torque.ast.Expression.IntLit;
import com.github.musiKk.torque.ast.Expression.ObjectExp;
import com.github.musiKk.torque.ast.Expression.Post;
import com.github.musiKk.torque.ast.Expression.SlotAccess;
import com.github.musiKk.torque.ast.Expression.StringLit;
import com.github.musiKk.torque.ast.FunctionDeclaration;
import com.github.musiKk.torque.ast.ObjectConstructor;
import com.github.musiKk.torque.ast.ObjectCreation;
import com.github.musiKk.torque.ast.Op;
import com.github.musiKk.torque.ast.SampleTrees;
import com.github.musiKk.torque.ast.ScriptFile;
import com.github.musiKk.torque.ast.Statement;
import com.github.musiKk.torque.ast.Statement.Exp;
import com.github.musiKk.torque.ast.Statement.IfElse;
import com.github.musiKk.torque.ast.Unary;

public class LegalityCheckerTest {

    @Test
    public void testSampleFileIsLegal() {
        var checker = new LegalityChecker();
        assertEquals(List.of(), checker.check(SampleTrees.everyVariant()));
        assertDoesNotThrow(() -> checker.requireLegal(SampleTrees.everyVariant()));
    }

    @ParameterizedTest
    @MethodSource("illegalStatements")
    public void testIllegalStatement(String code, Statement statement, Violation.Kind expected) {
        var violations = new LegalityChecker().check(statement);
        assertEquals(1, violations.size(), violations.toString());
        assertEquals(expected, violations.get(0).kind());
    }

    private static Object[][] illegalStatements() {
        return new Object[][] {
            {
                "5;",
                new Exp(new IntLit(5)),
                Violation.Kind.BARE_EXPRESSION
            }, {
                "%a + 1;",
                new Exp(new Binary(local("a"), Op.PLUS, new IntLit(1))),
                Violation.Kind.BARE_EXPRESSION
            }, {
                "%a;",
                new Exp(local("a")),
                Violation.Kind.BARE_EXPRESSION
            }, {
                "1 = 2;",
                new Exp(new Assign(new IntLit(1), new IntLit(2))),
                Violation.Kind.ASSIGN_TARGET
            }, {
                "foo() = 2;",
                new Exp(new Assign(new Call("foo", List.of()), new IntLit(2))),
                Violation.Kind.ASSIGN_TARGET
            }, {
                "\"a\"++;",
                new Exp(new Post(Unary.INCREMENT, new StringLit("a"))),
                Violation.Kind.ASSIGN_TARGET
            }, {
                "if (%c) { 5; }",
                new IfElse(local("c"), List.of(new Exp(new IntLit(5)))),
                Violation.Kind.BARE_EXPRESSION
            }
        };
    }

    @Test
    public void testAssignableShapes() {
        assertTrue(LegalityChecker.isAssignable(local("a")));
        assertTrue(LegalityChecker.isAssignable(new SlotAccess(local("a"), new StringLit("b"))));
        assertTrue(LegalityChecker.isAssignable(new ArrayAccess(local("a"), new IntLit(0))));
        assertFalse(LegalityChecker.isAssignable(new IntLit(0)));
        assertFalse(LegalityChecker.isAssignable(new Post(Unary.INCREMENT, local("a"))));
    }

    @Test
    public void testStatementExpressions() {
        assertTrue(LegalityChecker.isStatementExpression(new Call("echo", List.of())));
        assertTrue(LegalityChecker.isStatementExpression(new ObjectExp(
            new ObjectCreation(ObjectConstructor.NEW, "SimSet", Optional.empty(), List.of()))));
        assertFalse(LegalityChecker.isStatementExpression(new StringLit("x")));
    }

    @Test
    public void testViolationsInsideFunctions() {
        List<Statement> body = List.of(new Exp(new IntLit(1)), call("echo"), new Exp(new Assign(new IntLit(1), new IntLit(2))));
        var file = new ScriptFile(List.of(
            Either.right(new FunctionDef(new FunctionDeclaration("f", List.of(), body)))));

        var violations = new LegalityChecker().check(file);

        assertEquals(List.of(Violation.Kind.BARE_EXPRESSION, Violation.Kind.ASSIGN_TARGET),
            violations.stream().map(Violation::kind).toList());
        assertEquals(body.get(0), violations.get(0).node());
    }

    @Test
    public void testRequireLegalThrows() {
        var file = new ScriptFile(List.of(Either.left(new Exp(new IntLit(5)))));

        var e = assertThrows(IllegalTreeException.class, () -> new LegalityChecker().requireLegal(file));
        assertEquals(1, e.violations().size());
        assertTrue(e.getMessage().contains("expression has no effect"), e.getMessage());
    }

    @Test
    public void testChecksCanBeSwitchedOff() {
        var file = new ScriptFile(List.of(Either.left(new Exp(new Assign(new IntLit(1), new IntLit(2)))),
            Either.left(new Exp(new IntLit(5)))));

        var checker = new LegalityChecker();
        checker.setCheckAssignTargets(false);
        assertEquals(List.of(Violation.Kind.BARE_EXPRESSION),
            checker.check(file).stream().map(Violation::kind).toList());

        checker.setCheckBareExpressions(false);
        assertEquals(List.of(), checker.check(file));
    }

    @Test
    public void testTopLevelStatements() {
        var checker = new LegalityChecker();
        checker.setCheckTopLevelStatements(true);

        var violations = checker.check(SampleTrees.everyVariant());

        assertEquals(3, violations.size());
        assertTrue(violations.stream().allMatch(v -> v.kind() == Violation.Kind.TOP_LEVEL_STATEMENT));
    }

    @Test
    public void testTopLevelViolationsKeepSourceOrder() {
        var first = new Exp(new IntLit(1));
        var nested = new Exp(new IntLit(2));
        var last = new Exp(new IntLit(3));
        var file = new ScriptFile(List.of(
            Either.left(first),
            Either.right(new FunctionDef(new FunctionDeclaration("f", List.of(), List.of(nested)))),
            Either.left(last)));

        var checker = new LegalityChecker();
        checker.setCheckTopLevelStatements(true);
        var violations = checker.check(file);

        assertEquals(
            List.of(
                new Violation(Violation.Kind.TOP_LEVEL_STATEMENT, first),
                new Violation(Violation.Kind.BARE_EXPRESSION, first),
                new Violation(Violation.Kind.BARE_EXPRESSION, nested),
                new Violation(Violation.Kind.TOP_LEVEL_STATEMENT, last),
                new Violation(Violation.Kind.BARE_EXPRESSION, last)),
            violations);
    }

    @Test
    public void testFromConfigUsesClasspathDefaults() {
        var checker = LegalityChecker.fromConfig();
        List<Either<Statement, Definition>> entries = List.of(Either.left(new Exp(new IntLit(5))));
        assertEquals(1, checker.check(new ScriptFile(entries)).size());
    }

}
