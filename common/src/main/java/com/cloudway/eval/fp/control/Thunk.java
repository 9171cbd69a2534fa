/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.eval.fp.control;

import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

import com.google.common.collect.Lists;

import com.cloudway.eval.fp.$;
import com.cloudway.eval.fp.typeclass.Monad;

/**
 * A Thunk is a suspended computation that can be composed without growing
 * the call stack. Composition builds an immutable tree of nodes that the
 * {@link Trampoline} evaluates in a loop, so forcing a thunk built from an
 * arbitrary number of {@link #defer deferred}, {@link #map mapped} or
 * {@link #bind bound} steps runs in constant stack.
 *
 * <p>Three evaluation strategies are available:</p>
 * <ul>
 * <li>{@link #now(Object) now} - an already computed value</li>
 * <li>{@link #later(Supplier) later} - computed on first force, then cached</li>
 * <li>{@link #always(Supplier) always} - computed on every force</li>
 * </ul>
 *
 * <p>The engine cannot detect a never ending chain of deferred steps, a
 * producer that keeps deferring forever makes {@link #force()} diverge.</p>
 *
 * @param <A> the type of computation result
 */
public abstract class Thunk<A> implements $<Thunk.µ, A> {
    Thunk() {}

    /**
     * An already computed value at the leaf of a computation.
     */
    static final class Done<A> extends Thunk<A> {
        final A value;

        Done(A value) {
            this.value = value;
        }

        @Override
        public Thunk<A> memoize() {
            return this;
        }

        @Override
        public String toString() {
            return "Done(" + value + ")";
        }
    }

    /**
     * A suspended step that yields another thunk when forced.
     */
    static final class Defer<A> extends Thunk<A> {
        private final Supplier<? extends Thunk<A>> producer;

        Defer(Supplier<? extends Thunk<A>> producer) {
            this.producer = producer;
        }

        Thunk<A> produce() {
            return Objects.requireNonNull(producer.get(), "deferred producer returned null");
        }
    }

    /**
     * A value transformation applied lazily to the result of a source thunk.
     */
    static final class Mapped<S, A> extends Thunk<A> {
        final Thunk<S> source;
        private final Function<? super S, ? extends A> transform;

        Mapped(Thunk<S> source, Function<? super S, ? extends A> transform) {
            this.source = source;
            this.transform = transform;
        }

        @SuppressWarnings("unchecked")
        Object apply(Object value) {
            return transform.apply((S)value);
        }
    }

    /**
     * A continuation that constructs the next thunk from the result of a
     * source thunk.
     */
    static final class Bind<S, A> extends Thunk<A> {
        final Thunk<S> source;
        private final Function<? super S, ? extends Thunk<A>> cont;

        Bind(Thunk<S> source, Function<? super S, ? extends Thunk<A>> cont) {
            this.source = source;
            this.cont = cont;
        }

        @SuppressWarnings("unchecked")
        Thunk<A> resume(Object value) {
            return Objects.requireNonNull(cont.apply((S)value), "continuation returned null");
        }
    }

    /**
     * Caches the result of the source thunk once it has been forced.
     */
    static final class Memo<A> extends Thunk<A> {
        final Thunk<A> source;
        private volatile boolean computed;
        private A value;

        Memo(Thunk<A> source) {
            this.source = source;
        }

        boolean isComputed() {
            return computed;
        }

        A value() {
            return value;
        }

        @SuppressWarnings("unchecked")
        void complete(Object result) {
            value = (A)result;
            computed = true;
        }

        @Override
        public Thunk<A> memoize() {
            return this;
        }

        @Override
        public String toString() {
            return computed ? "Memo(" + value + ")" : "Memo(?)";
        }
    }

    /**
     * Constructs a computation whose result is already known.
     *
     * @param a the value of the result
     * @return a thunk that results in the given value
     */
    public static <A> Thunk<A> now(A a) {
        return new Done<>(a);
    }

    /**
     * Synonym for {@link #now(Object) now}.
     */
    public static <A> Thunk<A> pure(A a) {
        return now(a);
    }

    /**
     * Suspends the construction of a thunk. The producer is invoked by the
     * trampoline each time the returned thunk is forced.
     *
     * @param producer the supplier of the next computation step
     * @return a thunk whose next step runs the given producer
     */
    public static <A> Thunk<A> defer(Supplier<? extends Thunk<A>> producer) {
        return new Defer<>(Objects.requireNonNull(producer));
    }

    /**
     * Constructs a lazy computation that is evaluated again on every force.
     */
    public static <A> Thunk<A> always(Supplier<? extends A> a) {
        Objects.requireNonNull(a);
        return defer(() -> now(a.get()));
    }

    /**
     * Constructs a lazy computation that is evaluated at most once, on the
     * first force.
     */
    public static <A> Thunk<A> later(Supplier<? extends A> a) {
        return Thunk.<A>always(a).memoize();
    }

    /**
     * Runs this computation all the way to the end, in constant stack.
     * Exceptions raised by producers and transforms propagate unchanged.
     *
     * @return the end result of this computation
     */
    public A force() {
        return Trampoline.force(this);
    }

    /**
     * Maps the given function across the result of this thunk.
     *
     * @param f a function that gets applied to the result of this thunk
     * @return a new thunk that runs this thunk, then applies the given function
     *         to the result
     */
    public <B> Thunk<B> map(Function<? super A, ? extends B> f) {
        return new Mapped<>(this, Objects.requireNonNull(f));
    }

    /**
     * Binds the given continuation to the result of this thunk.
     *
     * @param f a function that constructs a thunk from the result of this thunk
     * @return a new thunk that runs this thunk, then continues with the given
     *         function
     */
    @SuppressWarnings("unchecked")
    public <B> Thunk<B> bind(Function<? super A, ? extends $<µ, B>> f) {
        Objects.requireNonNull(f);
        return new Bind<>(this, (Function<? super A, ? extends Thunk<B>>)f);
    }

    /**
     * Transfer a thunk by discarding the intermediate value.
     */
    public <B> Thunk<B> then($<µ, B> next) {
        return bind(__ -> next);
    }

    /**
     * Transfer a thunk by discarding the intermediate value. The next thunk
     * is not constructed until this thunk has produced its value.
     */
    public <B> Thunk<B> then(Supplier<? extends $<µ, B>> next) {
        return bind(__ -> next.get());
    }

    /**
     * Returns a thunk that caches the result of this computation chain after
     * it has been forced once. Steps composed after the returned thunk keep
     * their own strategy.
     */
    public Thunk<A> memoize() {
        return new Memo<>(this);
    }

    /**
     * Combines the results of two thunks with the given function. The first
     * thunk is evaluated before the second.
     */
    public static <A, B, C> Thunk<C>
    zip(Thunk<A> ta, Thunk<B> tb, BiFunction<? super A, ? super B, ? extends C> f) {
        return ta.bind(a -> tb.map(b -> f.apply(a, b)));
    }

    /**
     * A right fold over the given list that runs in constant stack. The
     * combining function receives the fold of the remaining elements as a
     * thunk, so it can decide whether to evaluate it at all.
     *
     * <p>A list without random access is copied when the fold is built.</p>
     */
    public static <A, B> Thunk<B>
    foldRight(List<A> xs, Thunk<B> z, BiFunction<? super A, Thunk<B>, Thunk<B>> f) {
        Objects.requireNonNull(z);
        Objects.requireNonNull(f);
        List<A> items = xs instanceof RandomAccess ? xs : Lists.newArrayList(xs);
        return foldRight(items, 0, z, f);
    }

    private static <A, B> Thunk<B>
    foldRight(List<A> xs, int i, Thunk<B> z, BiFunction<? super A, Thunk<B>, Thunk<B>> f) {
        return i == xs.size() ? z : defer(() -> f.apply(xs.get(i), foldRight(xs, i + 1, z, f)));
    }

    // Monad

    public static final class µ implements Monad<µ> {
        private µ() {}

        @Override
        public <A> Thunk<A> pure(A a) {
            return Thunk.now(a);
        }

        @Override
        public <A, B> Thunk<B> map($<µ, A> a, Function<? super A, ? extends B> f) {
            return narrow(a).map(f);
        }

        @Override
        public <A, B> Thunk<B> bind($<µ, A> a, Function<? super A, ? extends $<µ, B>> k) {
            return narrow(a).bind(k);
        }

        @Override
        public <A, B> Thunk<B> seqR($<µ, A> a, $<µ, B> b) {
            return narrow(a).then(b);
        }

        @Override
        public <A, B> Thunk<B> seqR($<µ, A> a, Supplier<? extends $<µ, B>> b) {
            return narrow(a).then(b);
        }
    }

    public static final µ tclass = new µ();

    @Override
    public µ getTypeClass() {
        return tclass;
    }

    public static <A> Thunk<A> narrow($<µ, A> value) {
        return (Thunk<A>)value;
    }

    public static <A> A force($<µ, A> m) {
        return narrow(m).force();
    }

    // Convenient static monad methods

    public static <A, B> Thunk<B>
    foldM(B r0, Iterable<A> xs, BiFunction<B, ? super A, ? extends $<µ, B>> f) {
        return narrow(tclass.foldM(r0, xs, f));
    }
}
