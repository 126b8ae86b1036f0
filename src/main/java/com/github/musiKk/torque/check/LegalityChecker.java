package com.github.musiKk.torque.check;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.github.musiKk.torque.ConfigReader;
import com.github.musiKk.torque.ast.Expression;
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
import com.github.musiKk.torque.ast.ScriptFile;
import com.github.musiKk.torque.ast.Statement;
import com.github.musiKk.torque.ast.Statement.Exp;
import com.github.musiKk.torque.ast.TreeWalker;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds trees the AST accepts but the TorqueScript compiler does not. The
 * model itself never runs this; it is for consumers that want the check.
 */
@Slf4j
public class LegalityChecker implements ConfigReader.ConfigTarget {

    private static final Set<Expression.Kind> STATEMENT_EXPRESSIONS =
            EnumSet.of(Expression.Kind.ASSIGN, Expression.Kind.CALL, Expression.Kind.POST, Expression.Kind.OBJECT_EXP);

    @Setter
    private boolean checkBareExpressions = true;
    @Setter
    private boolean checkAssignTargets = true;
    @Setter
    private boolean checkTopLevelStatements = false;

    public static LegalityChecker fromConfig() {
        var checker = new LegalityChecker();
        ConfigReader.readConfig().applyConfig(checker);
        return checker;
    }

    public List<Violation> check(ScriptFile file) {
        List<Violation> violations = new ArrayList<>();
        var collector = new Collector(violations);
        for (var entry : file.entries()) {
            entry.fold(
                s -> {
                    if (checkTopLevelStatements) {
                        violations.add(new Violation(Violation.Kind.TOP_LEVEL_STATEMENT, s));
                    }
                    collector.walk(s);
                    return null;
                },
                d -> {
                    collector.walk(d);
                    return null;
                });
        }
        log.debug("{} violation(s) in file with {} entries", violations.size(), file.entries().size());
        return List.copyOf(violations);
    }

    public List<Violation> check(Statement statement) {
        List<Violation> violations = new ArrayList<>();
        new Collector(violations).walk(statement);
        return List.copyOf(violations);
    }

    public void requireLegal(ScriptFile file) {
        var violations = check(file);
        if (!violations.isEmpty()) {
            throw new IllegalTreeException(violations);
        }
    }

    public static boolean isAssignable(Expression target) {
        return target.accept(ASSIGNABLE);
    }

    public static boolean isStatementExpression(Expression expression) {
        return STATEMENT_EXPRESSIONS.contains(expression.kind());
    }

    private class Collector extends TreeWalker {
        private final List<Violation> violations;

        Collector(List<Violation> violations) {
            this.violations = violations;
        }

        @Override
        protected boolean visitStatement(Statement statement) {
            if (checkBareExpressions && statement instanceof Exp exp && !isStatementExpression(exp.expression())) {
                log.trace("bare expression {}", statement);
                violations.add(new Violation(Violation.Kind.BARE_EXPRESSION, statement));
            }
            return true;
        }

        @Override
        protected boolean visitExpression(Expression expression) {
            if (checkAssignTargets) {
                if (expression instanceof Assign assign && !isAssignable(assign.target())
                        || expression instanceof Post post && !isAssignable(post.operand())) {
                    log.trace("bad assignment target in {}", expression);
                    violations.add(new Violation(Violation.Kind.ASSIGN_TARGET, expression));
                }
            }
            return true;
        }
    }

    private static final Expression.Visitor<Boolean> ASSIGNABLE = new Expression.Visitor<>() {
        public Boolean visitAssign(Assign assign) { return false; }
        public Boolean visitCall(Call call) { return false; }
        public Boolean visitBinary(Binary binary) { return false; }
        public Boolean visitPost(Post post) { return false; }
        public Boolean visitSlotAccess(SlotAccess slotAccess) { return true; }
        public Boolean visitArrayAccess(ArrayAccess arrayAccess) { return true; }
        public Boolean visitIntLit(IntLit intLit) { return false; }
        public Boolean visitFloatLit(FloatLit floatLit) { return false; }
        public Boolean visitStringLit(StringLit stringLit) { return false; }
        public Boolean visitTaggedStringLit(TaggedStringLit taggedStringLit) { return false; }
        public Boolean visitVariable(Variable variable) { return true; }
        public Boolean visitObjectExp(ObjectExp objectExp) { return false; }
    };

}
