/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.eval.fp.data;

import java.util.NoSuchElementException;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

final class IntSeqImpl {
    private IntSeqImpl() {}

    private static final IntSeq NIL = new IntSeq() {
        @Override
        public boolean isEmpty() {
            return true;
        }

        @Override
        public int head() {
            throw new NoSuchElementException();
        }

        @Override
        public IntSeq tail() {
            throw new NoSuchElementException();
        }

        @Override
        public int size() {
            return 0;
        }

        @Override
        public IntSeq reverse() {
            return this;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof IntSeq && ((IntSeq)obj).isEmpty();
        }

        @Override
        public int hashCode() {
            return 1;
        }

        @Override
        public String toString() {
            return "[]";
        }
    };

    private static final class Cons implements IntSeq {
        private final int head;
        private final IntSeq tail;
        private final int size;

        Cons(int head, IntSeq tail) {
            this.head = head;
            this.tail = tail;
            this.size = tail.size() + 1;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public int head() {
            return head;
        }

        @Override
        public IntSeq tail() {
            return tail;
        }

        @Override
        public int size() {
            return size;
        }

        @Override
        public boolean equals(Object obj) {
            return obj == this || (obj instanceof IntSeq && IntSeqImpl.equals(this, (IntSeq)obj));
        }

        @Override
        public int hashCode() {
            return IntSeqImpl.hashCode(this);
        }

        @Override
        public String toString() {
            return IntSeqImpl.toString(this);
        }
    }

    static IntSeq nil() {
        return NIL;
    }

    static IntSeq cons(int head, IntSeq tail) {
        return new Cons(head, requireNonNull(tail));
    }

    static boolean equals(IntSeq xs, IntSeq ys) {
        if (xs.size() != ys.size())
            return false;
        while (!xs.isEmpty()) {
            if (xs == ys)
                return true;
            if (xs.head() != ys.head())
                return false;
            xs = xs.tail();
            ys = ys.tail();
        }
        return true;
    }

    static int hashCode(IntSeq xs) {
        int hash = 1;
        for (; !xs.isEmpty(); xs = xs.tail()) {
            hash = 31 * hash + xs.head();
        }
        return hash;
    }

    static String toString(IntSeq xs) {
        StringJoiner joiner = new StringJoiner(",", "[", "]");
        for (; !xs.isEmpty(); xs = xs.tail()) {
            joiner.add(String.valueOf(xs.head()));
        }
        return joiner.toString();
    }
}
