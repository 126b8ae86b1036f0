package com.github.musiKk.torque.ast;

import java.util.Comparator;
import java.util.function.Function;

/**
 * Exactly one of two shapes. Used where a slot may hold two unrelated node
 * types: file entries, object classes and object contents.
 * <p>
 * {@code Left} sorts before {@code Right}.
 */
public sealed interface Either<L, R> {

    static <L, R> Either<L, R> left(L value) {
        return new Left<>(value);
    }

    static <L, R> Either<L, R> right(R value) {
        return new Right<>(value);
    }

    <T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight);

    default <L2, R2> Either<L2, R2> map(Function<? super L, ? extends L2> onLeft, Function<? super R, ? extends R2> onRight) {
        return fold(l -> Either.<L2, R2>left(onLeft.apply(l)), r -> Either.<L2, R2>right(onRight.apply(r)));
    }

    record Left<L, R>(L value) implements Either<L, R> {
        @Override
        public <T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight) {
            return onLeft.apply(value);
        }
    }

    record Right<L, R>(R value) implements Either<L, R> {
        @Override
        public <T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight) {
            return onRight.apply(value);
        }
    }

    static <L, R> Comparator<Either<L, R>> comparator(Comparator<? super L> leftOrder, Comparator<? super R> rightOrder) {
        return (a, b) -> a.fold(
            al -> b.fold(bl -> leftOrder.compare(al, bl), br -> -1),
            ar -> b.fold(bl -> 1, br -> rightOrder.compare(ar, br)));
    }

}
