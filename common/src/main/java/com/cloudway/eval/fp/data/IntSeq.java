/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.eval.fp.data;

import java.util.List;
import java.util.NoSuchElementException;

import com.google.common.collect.ImmutableList;

/**
 * An immutable, persistent sequence of int values. The head is the most
 * recently consed element, which makes the sequence a natural operand
 * stack: {@link #cons(int, IntSeq) cons} pushes, {@link #tail() tail} pops.
 * Sequences share structure, so deriving a new sequence never changes the
 * one it was derived from.
 */
public interface IntSeq {
    /**
     * Returns true if this sequence is empty.
     */
    boolean isEmpty();

    /**
     * Returns the first element of this sequence.
     *
     * @throws NoSuchElementException if this sequence is empty
     */
    int head();

    /**
     * Returns the remaining elements after the head.
     *
     * @throws NoSuchElementException if this sequence is empty
     */
    IntSeq tail();

    /**
     * Returns the number of elements in this sequence. Runs in constant time.
     */
    int size();

    /**
     * Returns an empty sequence.
     */
    static IntSeq nil() {
        return IntSeqImpl.nil();
    }

    /**
     * Construct a new sequence with the given head and tail.
     */
    static IntSeq cons(int head, IntSeq tail) {
        return IntSeqImpl.cons(head, tail);
    }

    /**
     * Construct a sequence holding the given elements, the first element
     * becomes the head.
     */
    static IntSeq of(int... elements) {
        IntSeq result = nil();
        for (int i = elements.length; --i >= 0; ) {
            result = cons(elements[i], result);
        }
        return result;
    }

    /**
     * Construct a sequence holding the given elements, the first element
     * becomes the head.
     */
    static IntSeq fromList(List<Integer> elements) {
        IntSeq result = nil();
        for (int i = elements.size(); --i >= 0; ) {
            result = cons(elements.get(i), result);
        }
        return result;
    }

    /**
     * Returns a sequence with elements in reverse order.
     */
    default IntSeq reverse() {
        IntSeq result = nil();
        for (IntSeq xs = this; !xs.isEmpty(); xs = xs.tail()) {
            result = cons(xs.head(), result);
        }
        return result;
    }

    /**
     * Returns an immutable list of the elements from head to last.
     */
    default ImmutableList<Integer> toList() {
        ImmutableList.Builder<Integer> builder = ImmutableList.builder();
        for (IntSeq xs = this; !xs.isEmpty(); xs = xs.tail()) {
            builder.add(xs.head());
        }
        return builder.build();
    }
}
