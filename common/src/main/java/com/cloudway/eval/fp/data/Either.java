/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.eval.fp.data;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

import com.cloudway.eval.fp.$;
import com.cloudway.eval.fp.typeclass.Monad;

/**
 * The {@code Either} class represents values with two possibilities: a value of
 * type {@code Either a b} is either {@code Left a} or {@code Right b}.
 *
 * <p>The {@code Either} type is sometimes used to represent a value which is
 * either correct or an error; by convention, the 'Left' constructor is used
 * to hold an error value and the 'Right' constructor is used to hold a correct
 * value (mnemonic: "right" also means "correct").</p>
 *
 * @param <A> the type of the left value
 * @param <B> the type of the right value
 */
public abstract class Either<A, B> implements $<Either.µ<A>, B> {
    private static final class Left<A, B> extends Either<A, B> {
        private final A a;

        Left(A a) {
            this.a = a;
        }

        @Override
        public boolean isLeft() {
            return true;
        }

        @Override
        public A left() {
            return a;
        }

        @Override
        public boolean equals(Object obj) {
            return obj == this || (obj instanceof Left && Objects.equals(a, ((Left<?,?>)obj).a));
        }

        @Override
        public int hashCode() {
            return 31 * Objects.hashCode(a);
        }

        @Override
        public String toString() {
            return "Left(" + a + ")";
        }
    }

    private static final class Right<A, B> extends Either<A, B> {
        private final B b;

        Right(B b) {
            this.b = b;
        }

        @Override
        public boolean isRight() {
            return true;
        }

        @Override
        public B right() {
            return b;
        }

        @Override
        public boolean equals(Object obj) {
            return obj == this || (obj instanceof Right && Objects.equals(b, ((Right<?,?>)obj).b));
        }

        @Override
        public int hashCode() {
            return 37 * Objects.hashCode(b);
        }

        @Override
        public String toString() {
            return "Right(" + b + ")";
        }
    }

    private Either() {}

    /**
     * Construct a 'Left' value.
     */
    public static <A, B> Either<A, B> left(A left) {
        return new Left<>(left);
    }

    /**
     * Construct a 'Right' value.
     */
    public static <A, B> Either<A, B> right(B right) {
        return new Right<>(right);
    }

    /**
     * Returns true if the given value is a 'Left'-value, false otherwise.
     */
    public boolean isLeft() {
        return false;
    }

    /**
     * Returns true if the given value is a 'Right'-value, false otherwise.
     */
    public boolean isRight() {
        return false;
    }

    /**
     * Returns the 'Left' value.
     *
     * @throws NoSuchElementException if this is a 'Right' value
     */
    public A left() {
        throw new NoSuchElementException();
    }

    /**
     * Returns the 'Right' value.
     *
     * @throws NoSuchElementException if this is a 'Left' value
     */
    public B right() {
        throw new NoSuchElementException();
    }

    /**
     * If the given value is 'Right', apply the provided mapping function to it,
     * otherwise return the 'Left' value.
     */
    @SuppressWarnings("unchecked")
    public <C> Either<A, C> map(Function<? super B, ? extends C> f) {
        return isLeft() ? (Either<A,C>)this
                        : right(f.apply(right()));
    }

    /**
     * If the given value is 'Left', apply the provided mapping function to it,
     * otherwise return the 'Right' value.
     */
    @SuppressWarnings("unchecked")
    public <C> Either<C, B> mapLeft(Function<? super A, ? extends C> f) {
        return isRight() ? (Either<C,B>)this
                         : left(f.apply(left()));
    }

    /**
     * If the given value is 'Right', apply the provided mapping function to it,
     * return that result, otherwise return the 'Left' value.  This method is
     * similar to {@link #map(Function)}, but the provided mapper is one whose
     * result is already an {@code Either}, and if invoked, {@code flatMap} does
     * not wrap it with an additional {@code Either}.
     */
    @SuppressWarnings("unchecked")
    public <C> Either<A, C> flatMap(Function<? super B, ? extends $<µ<A>, C>> f) {
        return isLeft() ? (Either<A,C>)this
                        : narrow(f.apply(right()));
    }

    /**
     * Case analysis for the Either type. If the value is Left a, apply the first
     * function to a; if it is Right b, apply the second function b.
     */
    public <C> C either(Function<? super A, ? extends C> af, Function<? super B, ? extends C> bf) {
        return isLeft() ? af.apply(left()) : bf.apply(right());
    }

    /**
     * Returns the 'Right' value, if present, otherwise throw an exception
     * to be created by the provided supplier.
     */
    public <X extends Throwable> B getOrThrow(Function<? super A, ? extends X> exceptionSupplier) throws X {
        if (isRight()) {
            return right();
        } else {
            throw exceptionSupplier.apply(left());
        }
    }

    // Type Classes

    public static final class µ<A> implements Monad<µ<A>> {
        private µ() {}

        @Override
        public <B> Either<A, B> pure(B b) {
            return right(b);
        }

        @Override
        public <B, C> Either<A, C> map($<µ<A>, B> a, Function<? super B, ? extends C> f) {
            return narrow(a).map(f);
        }

        @Override
        public <B, C> Either<A, C> bind($<µ<A>, B> a, Function<? super B, ? extends $<µ<A>, C>> k) {
            return narrow(a).flatMap(k);
        }
    }

    public static <A, B> Either<A, B> narrow($<µ<A>, B> value) {
        return (Either<A,B>)value;
    }

    private static final µ<?> _TCLASS = new µ<>();

    @SuppressWarnings("unchecked")
    public static <A> µ<A> tclass() {
        return (µ<A>)_TCLASS;
    }

    @Override
    public µ<A> getTypeClass() {
        return tclass();
    }
}
