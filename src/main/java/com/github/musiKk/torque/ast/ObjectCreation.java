package com.github.musiKk.torque.ast;

import java.util.List;
import java.util.Optional;

/**
 * {@code new Class(Name) { member = value; new Child() {}; };}
 * <p>
 * The class is either a bare identifier ({@link Either.Left}) or, for
 * {@code new (%class)()}, an arbitrary expression ({@link Either.Right}).
 * Contents are member assignments and nested objects, in source order.
 */
public record ObjectCreation(
        ObjectConstructor constructor,
        Either<String, Expression> objectClass,
        Optional<String> name,
        List<Either<Member, ObjectCreation>> contents) implements Comparable<ObjectCreation> {

    public ObjectCreation {
        contents = List.copyOf(contents);
    }

    public ObjectCreation(ObjectConstructor constructor, String className, Optional<String> name, List<Either<Member, ObjectCreation>> contents) {
        this(constructor, Either.left(className), name, contents);
    }

    public ObjectCreation(ObjectConstructor constructor, Expression classExpression, Optional<String> name, List<Either<Member, ObjectCreation>> contents) {
        this(constructor, Either.right(classExpression), name, contents);
    }

    public List<Member> members() {
        return contents.stream()
                .<Member>map(c -> c.fold(m -> m, o -> null))
                .filter(m -> m != null)
                .toList();
    }

    public List<ObjectCreation> children() {
        return contents.stream()
                .<ObjectCreation>map(c -> c.fold(m -> null, o -> o))
                .filter(o -> o != null)
                .toList();
    }

    @Override
    public int compareTo(ObjectCreation other) {
        return AstOrder.OBJECT.compare(this, other);
    }

}
