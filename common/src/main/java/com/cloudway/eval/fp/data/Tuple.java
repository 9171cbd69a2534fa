/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.eval.fp.data;

import java.io.Serializable;
import java.util.Objects;
import java.util.function.Function;

/**
 * A tuple with two elements. State programs use it to carry the final
 * state in the first element and the result in the second.
 */
public final class Tuple<A, B> implements Serializable {
    private static final long serialVersionUID = 6021746465072972306L;

    private final A first;
    private final B second;

    /**
     * Construct a new Tuple with two arguments.
     *
     * @param first the first argument
     * @param second the second argument
     */
    public Tuple(A first, B second) {
        this.first = first;
        this.second = second;
    }

    /**
     * Construct a new Tuple with two arguments.
     *
     * @param first the first argument
     * @param second the second argument
     */
    public static <A, B> Tuple<A, B> of(A first, B second) {
        return new Tuple<>(first, second);
    }

    /**
     * Returns the first element.
     */
    public A first() {
        return first;
    }

    /**
     * Returns the second element.
     */
    public B second() {
        return second;
    }

    /**
     * Apply second element as argument to a function and return a new tuple
     * with the substituted argument.
     */
    public <R> Tuple<A, R> mapSecond(Function<? super B, ? extends R> fn) {
        return of(first, fn.apply(second));
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Tuple))
            return false;
        Tuple<?, ?> other = (Tuple<?, ?>)obj;
        return Objects.equals(first, other.first)
            && Objects.equals(second, other.second);
    }

    @Override
    public int hashCode() {
        return 31 * (31 + Objects.hashCode(first)) + Objects.hashCode(second);
    }

    @Override
    public String toString() {
        return "(" + first + "," + second + ")";
    }
}
