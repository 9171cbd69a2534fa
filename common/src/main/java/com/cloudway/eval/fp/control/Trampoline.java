/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.eval.fp.control;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * The trampoline drives a {@link Thunk} to its final value in constant stack.
 *
 * <p>Instead of recursing into nested nodes the evaluator keeps a cursor on
 * the node being evaluated and an explicit stack of pending frames. Mapped,
 * bound and memoized nodes push themselves as a frame and move the cursor to
 * their source; a deferred node replaces the cursor with the thunk its
 * producer yields. When the cursor reaches a value, pending frames are popped
 * and applied, innermost first, until a bound frame yields a new thunk to
 * evaluate or no frame is left.</p>
 *
 * <p>Every producer and transform is invoked exactly once per force, in
 * dependency order. Exceptions thrown by them are not caught, they propagate
 * unchanged to the caller of {@link #force(Thunk)}.</p>
 */
public final class Trampoline {
    private Trampoline() {}

    /**
     * Runs the given computation all the way to the end, in constant stack.
     *
     * @param thunk the computation to evaluate
     * @return the end result of the computation
     */
    @SuppressWarnings("unchecked")
    public static <A> A force(Thunk<A> thunk) {
        Deque<Thunk<?>> pending = new ArrayDeque<>();
        Thunk<?> current = Objects.requireNonNull(thunk);

        while (true) {
            Object value;

            if (current instanceof Thunk.Done) {
                value = ((Thunk.Done<?>)current).value;
            } else if (current instanceof Thunk.Defer) {
                current = ((Thunk.Defer<?>)current).produce();
                continue;
            } else if (current instanceof Thunk.Mapped) {
                pending.push(current);
                current = ((Thunk.Mapped<?,?>)current).source;
                continue;
            } else if (current instanceof Thunk.Bind) {
                pending.push(current);
                current = ((Thunk.Bind<?,?>)current).source;
                continue;
            } else {
                Thunk.Memo<?> memo = (Thunk.Memo<?>)current;
                if (!memo.isComputed()) {
                    pending.push(memo);
                    current = memo.source;
                    continue;
                }
                value = memo.value();
            }

            // feed the value through pending frames until a continuation
            // produces a new node to evaluate
            current = null;
            while (current == null) {
                Thunk<?> frame = pending.poll();
                if (frame == null) {
                    return (A)value;
                } else if (frame instanceof Thunk.Mapped) {
                    value = ((Thunk.Mapped<?,?>)frame).apply(value);
                } else if (frame instanceof Thunk.Memo) {
                    ((Thunk.Memo<?>)frame).complete(value);
                } else {
                    current = ((Thunk.Bind<?,?>)frame).resume(value);
                }
            }
        }
    }
}
