/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.eval.calc;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/**
 * Binary operators understood by the calculator.
 *
 * <p>Operands are taken from the stack in push order: the element below the
 * top is the left operand and the top element is the right operand, so the
 * expression {@code "7 2 -"} evaluates to {@code 5}.</p>
 */
public enum Operator {
    ADD("+") {
        @Override
        int exact(int left, int right) {
            return Math.addExact(left, right);
        }

        @Override
        int wrapping(int left, int right) {
            return left + right;
        }
    },

    SUBTRACT("-") {
        @Override
        int exact(int left, int right) {
            return Math.subtractExact(left, right);
        }

        @Override
        int wrapping(int left, int right) {
            return left - right;
        }
    },

    MULTIPLY("*") {
        @Override
        int exact(int left, int right) {
            return Math.multiplyExact(left, right);
        }

        @Override
        int wrapping(int left, int right) {
            return left * right;
        }
    },

    DIVIDE("/") {
        @Override
        int exact(int left, int right) {
            if (left == Integer.MIN_VALUE && right == -1)
                throw new ArithmeticException("integer overflow");
            return wrapping(left, right);
        }

        @Override
        int wrapping(int left, int right) {
            if (right == 0)
                throw new ArithmeticException("division by zero");
            return left / right;
        }
    };

    private static final ImmutableMap<String, Operator> BY_SYMBOL =
        Maps.uniqueIndex(Arrays.asList(values()), Operator::symbol);

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the token that denotes this operator.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Returns the operator denoted by the given token, if any.
     */
    public static Optional<Operator> forSymbol(String token) {
        return Optional.ofNullable(BY_SYMBOL.get(token));
    }

    /**
     * Applies this operator.
     *
     * @param left the left operand, the element below the stack top
     * @param right the right operand, the stack top
     * @param exactArithmetic true to fail on overflow, false to wrap around
     * @return the result of the operation
     * @throws ArithmeticException on division by zero, or on overflow when
     *         exact arithmetic is requested
     */
    public int apply(int left, int right, boolean exactArithmetic) {
        return exactArithmetic ? exact(left, right) : wrapping(left, right);
    }

    abstract int exact(int left, int right);

    abstract int wrapping(int left, int right);
}
