/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.eval.fp.data;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Transformations on functions.
 */
public final class Fn {
    private Fn() {}

    /**
     * Create a lazy evaluation thunk from the given supplier. The supplier
     * is invoked at most once, on first access.
     *
     * @param thunk a thunk to be lazily evaluated
     * @return a thunk for lazy evaluation
     */
    public static <T> Supplier<T> lazy(Supplier<T> thunk) {
        Objects.requireNonNull(thunk);
        if (thunk instanceof LazyThunk) {
            return thunk;
        } else {
            return new LazyThunk<>(thunk);
        }
    }

    private static class LazyThunk<T> implements Supplier<T> {
        private volatile Supplier<T> thunk;
        private T value;

        LazyThunk(Supplier<T> t) {
            thunk = t;
        }

        @Override
        public T get() {
            if (thunk != null) {
                synchronized (this) {
                    Supplier<T> t = thunk;
                    if (t != null) {
                        value = t.get();
                        thunk = null;
                    }
                }
            }
            return value;
        }
    }
}
