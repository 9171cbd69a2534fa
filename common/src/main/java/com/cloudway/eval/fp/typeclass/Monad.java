/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.eval.fp.typeclass;

import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

import com.cloudway.eval.fp.$;

/**
 * The {@code Monad} typeclass defines the basic operations over a monad,
 * a concept from a branch of mathematics known as category theory. From
 * the perspective of a Haskell programmer, however, it is best to think
 * of a monad as an abstract datatype of actions.
 *
 * <p>Instances of {@code Monad} should satisfy the following laws:
 *
 * <pre>{@code
 * pure a >>= k = k a
 * m >>= pure = m
 * m >>= (\x -> k x >>= h) = (m >>= k) >>= h
 * }</pre>
 *
 * <p>The above laws imply:
 *
 * <pre>{@code
 * map f xs = xs >>= pure . f
 * }</pre>
 *
 * @param <M> the type class of the monad
 */
public interface Monad<M> {
    /**
     * Lift a value into the monad.
     *
     * <pre>{@code pure :: a -> m a}</pre>
     */
    <A> $<M, A> pure(A a);

    /**
     * Sequentially compose two actions, passing any value produced by the
     * first as an argument to the second.
     *
     * <pre>{@code (>>=) :: m a -> (a -> m b) -> m b}</pre>
     */
    <A, B> $<M, B> bind($<M, A> a, Function<? super A, ? extends $<M, B>> k);

    /**
     * Returns an action that applies the given function to the result
     * of the given action.
     *
     * <pre>{@code fmap :: (a -> b) -> m a -> m b}</pre>
     */
    default <A, B> $<M, B> map($<M, A> a, Function<? super A, ? extends B> f) {
        return bind(a, x -> pure(f.apply(x)));
    }

    /**
     * Sequentially compose two actions, discarding any value produced by the
     * first.
     *
     * <pre>{@code (>>) :: m a -> m b -> m b}</pre>
     */
    default <A, B> $<M, B> seqR($<M, A> a, $<M, B> b) {
        return bind(a, __ -> b);
    }

    /**
     * Sequentially compose two actions, discarding any value produced by the
     * first. The second action is not constructed until the first one has
     * produced its value.
     */
    default <A, B> $<M, B> seqR($<M, A> a, Supplier<? extends $<M, B>> b) {
        return bind(a, __ -> b.get());
    }

    /**
     * The {@code foldM} is analogous to a left fold, except that its result
     * is encapsulated in the monad. Elements are visited from left to right.
     */
    default <A, B> $<M, B> foldM(B r0, Iterable<A> xs, BiFunction<B, ? super A, ? extends $<M, B>> f) {
        $<M, B> result = pure(r0);
        for (A x : xs) {
            result = bind(result, r -> f.apply(r, x));
        }
        return result;
    }

    /**
     * Kleisli composition of monads.
     */
    default <A, B, C> Function<A, $<M, C>>
    compose(Function<A, ? extends $<M, B>> f, Function<B, ? extends $<M, C>> g) {
        return x -> bind(f.apply(x), g);
    }
}
