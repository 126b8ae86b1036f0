package com.github.musiKk.torque.ast;

import java.util.Comparator;
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
 * Structural total order over all nodes: variant first, in declaration order,
 * then fields from left to right. Consistent with {@code equals}.
 */
final class AstOrder {

    private AstOrder() {}

    static <T> Comparator<List<T>> lexicographic(Comparator<? super T> elementOrder) {
        return (a, b) -> {
            int shared = Math.min(a.size(), b.size());
            for (int i = 0; i < shared; i++) {
                int c = elementOrder.compare(a.get(i), b.get(i));
                if (c != 0) {
                    return c;
                }
            }
            return Integer.compare(a.size(), b.size());
        };
    }

    // empty first
    static <T> Comparator<Optional<T>> optional(Comparator<? super T> elementOrder) {
        return (a, b) -> {
            if (a.isPresent() && b.isPresent()) {
                return elementOrder.compare(a.get(), b.get());
            }
            return Boolean.compare(a.isPresent(), b.isPresent());
        };
    }

    // Local before Global
    static final Comparator<Name> NAME = Comparator.comparing(Name::kind)
            .thenComparing(Name::ident);

    static final Comparator<List<Expression>> EXPRESSIONS = lexicographic(Comparator.<Expression>naturalOrder());
    static final Comparator<List<Statement>> BLOCK = lexicographic(Comparator.<Statement>naturalOrder());
    static final Comparator<Optional<List<Statement>>> OPTIONAL_BLOCK = optional(BLOCK);
    static final Comparator<List<Name>> NAMES = lexicographic(Comparator.<Name>naturalOrder());
    static final Comparator<Optional<Namespace>> OPTIONAL_NAMESPACE = optional(Comparator.<Namespace>naturalOrder());
    static final Comparator<Optional<String>> OPTIONAL_STRING = optional(Comparator.<String>naturalOrder());

    static final Comparator<Member> MEMBER = Comparator.comparing(Member::ident)
            .thenComparing(Member::value);

    static final Comparator<Either<String, Expression>> OBJECT_CLASS =
            Either.comparator(Comparator.<String>naturalOrder(), Comparator.<Expression>naturalOrder());
    static final Comparator<List<Either<Member, ObjectCreation>>> OBJECT_CONTENTS =
            lexicographic(Either.comparator(Comparator.<Member>naturalOrder(), Comparator.<ObjectCreation>naturalOrder()));

    static final Comparator<ObjectCreation> OBJECT = Comparator.comparing(ObjectCreation::constructor)
            .thenComparing(ObjectCreation::objectClass, OBJECT_CLASS)
            .thenComparing(ObjectCreation::name, OPTIONAL_STRING)
            .thenComparing(ObjectCreation::contents, OBJECT_CONTENTS);

    static final Comparator<FunctionDeclaration> FUNCTION = Comparator.comparing(FunctionDeclaration::namespace, OPTIONAL_NAMESPACE)
            .thenComparing(FunctionDeclaration::name)
            .thenComparing(FunctionDeclaration::params, NAMES)
            .thenComparing(FunctionDeclaration::body, BLOCK);

    static final Comparator<Either<Statement, Definition>> ENTRY =
            Either.comparator(Comparator.<Statement>naturalOrder(), Comparator.<Definition>naturalOrder());
    static final Comparator<ScriptFile> FILE = Comparator.comparing(ScriptFile::entries, lexicographic(ENTRY));

    private static final Comparator<Assign> ASSIGN = Comparator.comparing(Assign::target)
            .thenComparing(Assign::assignment)
            .thenComparing(Assign::value);
    private static final Comparator<Call> CALL = Comparator.comparing(Call::namespace, OPTIONAL_NAMESPACE)
            .thenComparing(Call::name)
            .thenComparing(Call::arguments, EXPRESSIONS);
    private static final Comparator<Binary> BINARY = Comparator.comparing(Binary::left)
            .thenComparing(Binary::op)
            .thenComparing(Binary::right);
    private static final Comparator<Post> POST = Comparator.comparing(Post::unary)
            .thenComparing(Post::operand);
    private static final Comparator<SlotAccess> SLOT_ACCESS = Comparator.comparing(SlotAccess::object)
            .thenComparing(SlotAccess::member);
    private static final Comparator<ArrayAccess> ARRAY_ACCESS = Comparator.comparing(ArrayAccess::array)
            .thenComparing(ArrayAccess::index);

    static int compare(Expression a, Expression b) {
        int byKind = a.kind().compareTo(b.kind());
        if (byKind != 0) {
            return byKind;
        }
        return switch (a.kind()) {
            case ASSIGN -> ASSIGN.compare((Assign) a, (Assign) b);
            case CALL -> CALL.compare((Call) a, (Call) b);
            case BINARY -> BINARY.compare((Binary) a, (Binary) b);
            case POST -> POST.compare((Post) a, (Post) b);
            case SLOT_ACCESS -> SLOT_ACCESS.compare((SlotAccess) a, (SlotAccess) b);
            case ARRAY_ACCESS -> ARRAY_ACCESS.compare((ArrayAccess) a, (ArrayAccess) b);
            case INT_LIT -> Long.compare(((IntLit) a).value(), ((IntLit) b).value());
            case FLOAT_LIT -> Double.compare(((FloatLit) a).value(), ((FloatLit) b).value());
            case STRING_LIT -> ((StringLit) a).value().compareTo(((StringLit) b).value());
            case TAGGED_STRING_LIT -> ((TaggedStringLit) a).value().compareTo(((TaggedStringLit) b).value());
            case VARIABLE -> ((Variable) a).name().compareTo(((Variable) b).name());
            case OBJECT_EXP -> ((ObjectExp) a).object().compareTo(((ObjectExp) b).object());
        };
    }

    private static final Comparator<IfElse> IF_ELSE = Comparator.comparing(IfElse::condition)
            .thenComparing(IfElse::thenBlock, BLOCK)
            .thenComparing(IfElse::elseBlock, OPTIONAL_BLOCK);
    private static final Comparator<While> WHILE = Comparator.comparing(While::condition)
            .thenComparing(While::body, BLOCK);
    private static final Comparator<For> FOR = Comparator.comparing(For::init)
            .thenComparing(For::condition)
            .thenComparing(For::step)
            .thenComparing(For::body, BLOCK);
    private static final Comparator<ForEach> FOR_EACH = Comparator.comparing(ForEach::variable)
            .thenComparing(ForEach::collection)
            .thenComparing(ForEach::body, BLOCK);
    private static final Comparator<ForEachString> FOR_EACH_STRING = Comparator.comparing(ForEachString::variable)
            .thenComparing(ForEachString::string)
            .thenComparing(ForEachString::body, BLOCK);

    static int compare(Statement a, Statement b) {
        int byKind = a.kind().compareTo(b.kind());
        if (byKind != 0) {
            return byKind;
        }
        return switch (a.kind()) {
            case IF_ELSE -> IF_ELSE.compare((IfElse) a, (IfElse) b);
            case WHILE -> WHILE.compare((While) a, (While) b);
            case FOR -> FOR.compare((For) a, (For) b);
            case FOR_EACH -> FOR_EACH.compare((ForEach) a, (ForEach) b);
            case FOR_EACH_STRING -> FOR_EACH_STRING.compare((ForEachString) a, (ForEachString) b);
            case EXP -> ((Exp) a).expression().compareTo(((Exp) b).expression());
        };
    }

    private static final Comparator<PackageDef> PACKAGE_DEF = Comparator.comparing(PackageDef::name)
            .thenComparing(PackageDef::functions, lexicographic(FUNCTION));

    static int compare(Definition a, Definition b) {
        int byKind = a.kind().compareTo(b.kind());
        if (byKind != 0) {
            return byKind;
        }
        return switch (a.kind()) {
            case FUNCTION_DEF -> FUNCTION.compare(((FunctionDef) a).function(), ((FunctionDef) b).function());
            case PACKAGE_DEF -> PACKAGE_DEF.compare((PackageDef) a, (PackageDef) b);
        };
    }

}
