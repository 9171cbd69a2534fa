/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.eval.fp.control;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

import com.cloudway.eval.fp.$;
import com.cloudway.eval.fp.data.Fn;
import com.cloudway.eval.fp.data.Tuple;
import com.cloudway.eval.fp.data.Unit;
import com.cloudway.eval.fp.typeclass.Monad;

/**
 * The state monad, passing an updatable state through a computation.
 *
 * <p>A state computation wraps a pure transition function from a state to a
 * tuple of the new state and a result. Every sequencing step is recorded as
 * a deferred {@link Thunk} continuation, so running a chain of any length
 * through the {@link Trampoline} takes constant stack.</p>
 *
 * <p>States are passed along as values. A transition must return a new
 * state instead of mutating the one it received, which keeps a computation
 * repeatable: running it twice from the same initial state gives equal
 * results.</p>
 *
 * @param <S> the type of state passing to the computation
 * @param <A> the type of result of computation
 */
public final class State<S, A> implements $<State.µ<S>, A> {
    /**
     * The state transfer function.
     */
    private final Function<S, Thunk<Tuple<S, A>>> sf;

    private State(Function<S, Thunk<Tuple<S, A>>> f) {
        this.sf = f;
    }

    private Thunk<Tuple<S, A>> step(S s) {
        return Thunk.defer(() -> sf.apply(s));
    }

    /**
     * Create a state computation from the given state transfer function.
     *
     * @param f the state transfer function, returns the new state and the result
     * @return the state computation
     */
    public static <S, A> State<S, A> state(Function<? super S, Tuple<S, A>> f) {
        Objects.requireNonNull(f);
        return new State<>(s -> Thunk.now(f.apply(s)));
    }

    /**
     * Constructs a pure computation that results in the given value.
     *
     * @param a the final result
     * @return the state computation that hold the final result
     */
    public static <S, A> State<S, A> pure(A a) {
        return new State<>(s -> Thunk.now(Tuple.of(s, a)));
    }

    /**
     * Returns a do nothing computation.
     */
    public static <S> State<S, Unit> unit() {
        return pure(Unit.U);
    }

    /**
     * Constructs a pure computation that results in the given lazy evaluation
     * thunk. The thunk is evaluated at most once.
     *
     * @param a a thunk that eventually produce computation result
     * @return the state computation that hold the computation
     */
    public static <S, A> State<S, A> lazy(Supplier<A> a) {
        Supplier<A> t = Fn.lazy(a);
        return new State<>(s -> Thunk.now(Tuple.of(s, t.get())));
    }

    /**
     * Evaluate a state computation with the given initial state and return
     * a tuple of final state and final value.
     *
     * @param s the initial state
     * @return the tuple of final state and final value
     */
    public Tuple<S, A> run(S s) {
        return Trampoline.force(step(s));
    }

    /**
     * Evaluate a state computation with the given initial state and return
     * the final value, discarding the final state.
     */
    public A eval(S s) {
        return run(s).second();
    }

    /**
     * Evaluate a state computation with the given initial state and return
     * the final state, discarding the final value.
     */
    public S exec(S s) {
        return run(s).first();
    }

    /**
     * Returns the deferred computation of running this state computation
     * from the given state, to be composed with other thunks.
     */
    public Thunk<Tuple<S, A>> toThunk(S s) {
        return step(s);
    }

    /**
     * Transfer a state computation by feeding the value to the given function
     * and wrapping the result to new state.
     */
    public <B> State<S, B> map(Function<? super A, ? extends B> f) {
        Objects.requireNonNull(f);
        return new State<>(s -> step(s).map(t -> t.<B>mapSecond(f)));
    }

    /**
     * Transfer a state computation by feeding the value to the given function.
     * The returned computation runs this computation, then runs the computation
     * produced by the function on the resulting state.
     */
    public <B> State<S, B> bind(Function<? super A, ? extends $<µ<S>, B>> f) {
        Objects.requireNonNull(f);
        return new State<>(s -> step(s).bind(t -> narrow(f.apply(t.second())).step(t.first())));
    }

    /**
     * Synonym for {@link #bind(Function) bind}.
     */
    public <B> State<S, B> andThen(Function<? super A, ? extends $<µ<S>, B>> f) {
        return bind(f);
    }

    /**
     * Transfer a state computation by discarding the intermediate value.
     */
    public <B> State<S, B> then(Supplier<? extends $<µ<S>, B>> next) {
        return bind(__ -> next.get());
    }

    /**
     * Transfer a state computation by discarding the intermediate value.
     */
    public <B> State<S, B> then($<µ<S>, B> next) {
        return bind(__ -> next);
    }

    /**
     * Sequence two state computations and combine their results with the
     * given function. The state flows from the first computation into the
     * second.
     */
    public static <S, A, B, C> State<S, C>
    zip(State<S, A> sa, State<S, B> sb, BiFunction<? super A, ? super B, ? extends C> f) {
        return sa.bind(a -> sb.map(b -> f.apply(a, b)));
    }

    /**
     * Map both the final state and return value of computation using the given
     * function.
     */
    public <B> State<S, B> mapState(Function<Tuple<S, A>, Tuple<S, B>> f) {
        Objects.requireNonNull(f);
        return new State<>(s -> step(s).map(f));
    }

    /**
     * Executes action on a state modified by applying function.
     */
    public State<S, A> withState(Function<S, S> f) {
        Objects.requireNonNull(f);
        return new State<>(s -> Thunk.defer(() -> step(f.apply(s))));
    }

    /**
     * Fetch the current value of the state within the monad.
     */
    public static <S> State<S, S> get() {
        return state(s -> Tuple.of(s, s));
    }

    /**
     * Replace the state within the monad, the result is {@link Unit}.
     */
    public static <S> State<S, Unit> set(S s) {
        return state(__ -> Tuple.of(s, Unit.U));
    }

    /**
     * Updates the state to the result of applying a function to the current state.
     */
    public static <S> State<S, Unit> modify(Function<? super S, ? extends S> f) {
        Objects.requireNonNull(f);
        return state(s -> Tuple.of(f.apply(s), Unit.U));
    }

    /**
     * Get a specific component of the state, using a projection function supplied.
     * The state is left unchanged.
     */
    public static <S, A> State<S, A> inspect(Function<? super S, ? extends A> f) {
        Objects.requireNonNull(f);
        return state(s -> Tuple.of(s, f.apply(s)));
    }

    // Type Class

    public static final class µ<S> implements Monad<µ<S>> {
        private µ() {}

        @Override
        public <A> State<S, A> pure(A a) {
            return State.pure(a);
        }

        @Override
        public <A, B> State<S, B> map($<µ<S>, A> a, Function<? super A, ? extends B> f) {
            return narrow(a).map(f);
        }

        @Override
        public <A, B> State<S, B> bind($<µ<S>, A> a, Function<? super A, ? extends $<µ<S>, B>> k) {
            return narrow(a).bind(k);
        }

        @Override
        public <A, B> State<S, B> seqR($<µ<S>, A> a, $<µ<S>, B> b) {
            return narrow(a).then(b);
        }

        @Override
        public <A, B> State<S, B> seqR($<µ<S>, A> a, Supplier<? extends $<µ<S>, B>> b) {
            return narrow(a).then(b);
        }
    }

    private static final µ<?> _TCLASS = new µ<>();

    @SuppressWarnings("unchecked")
    public static <S> µ<S> tclass() {
        return (µ<S>)_TCLASS;
    }

    @Override
    public µ<S> getTypeClass() {
        return tclass();
    }

    public static <S, A> State<S, A> narrow($<µ<S>, A> value) {
        return (State<S, A>)value;
    }

    public static <S, A> Tuple<S, A> run($<µ<S>, A> m, S s) {
        return narrow(m).run(s);
    }

    public static <S, A> A eval($<µ<S>, A> m, S s) {
        return narrow(m).eval(s);
    }

    public static <S, A> S exec($<µ<S>, A> m, S s) {
        return narrow(m).exec(s);
    }

    // Convenient static monad methods

    public static <S, A, B> State<S, B>
    foldM(B r0, Iterable<A> xs, BiFunction<B, ? super A, ? extends $<µ<S>, B>> f) {
        return narrow(State.<S>tclass().foldM(r0, xs, f));
    }
}
