/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.eval.calc;

import java.io.Serializable;
import java.util.Objects;
import java.util.function.Function;

import com.google.common.base.MoreObjects;

/**
 * The reasons a postfix expression can fail to evaluate. Each variant is a
 * plain value, so callers can compare and pattern match on failures instead
 * of parsing messages.
 */
public abstract class EvalError implements Serializable {
    private static final long serialVersionUID = 4478023117712436285L;

    private EvalError() {}

    /**
     * A token is neither a recognized operator nor a valid integer literal.
     */
    public static final class ParseError extends EvalError {
        private static final long serialVersionUID = -6152386207931486431L;

        private final String token;

        ParseError(String token) {
            this.token = Objects.requireNonNull(token);
        }

        public String token() {
            return token;
        }

        @Override
        public String getMessage() {
            return token.isEmpty() ? "empty expression" : "not an integer or operator: '" + token + "'";
        }

        @Override
        public <R> R fold(Function<? super ParseError, ? extends R> parse,
                          Function<? super StackUnderflowError, ? extends R> underflow,
                          Function<? super ArithmeticError, ? extends R> arithmetic) {
            return parse.apply(this);
        }

        @Override
        public boolean equals(Object obj) {
            return obj == this || (obj instanceof ParseError && token.equals(((ParseError)obj).token));
        }

        @Override
        public int hashCode() {
            return token.hashCode();
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this).add("token", token).toString();
        }
    }

    /**
     * An operator requires two operands but fewer are available on the stack.
     */
    public static final class StackUnderflowError extends EvalError {
        private static final long serialVersionUID = 3893617284096311207L;

        private final String operator;
        private final int availableDepth;

        StackUnderflowError(String operator, int availableDepth) {
            this.operator = Objects.requireNonNull(operator);
            this.availableDepth = availableDepth;
        }

        public String operator() {
            return operator;
        }

        public int availableDepth() {
            return availableDepth;
        }

        @Override
        public String getMessage() {
            return "operator '" + operator + "' requires 2 operands, but the stack holds " + availableDepth;
        }

        @Override
        public <R> R fold(Function<? super ParseError, ? extends R> parse,
                          Function<? super StackUnderflowError, ? extends R> underflow,
                          Function<? super ArithmeticError, ? extends R> arithmetic) {
            return underflow.apply(this);
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof StackUnderflowError))
                return false;
            StackUnderflowError other = (StackUnderflowError)obj;
            return operator.equals(other.operator) && availableDepth == other.availableDepth;
        }

        @Override
        public int hashCode() {
            return Objects.hash(operator, availableDepth);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                .add("operator", operator)
                .add("availableDepth", availableDepth)
                .toString();
        }
    }

    /**
     * An operator could not produce an integer result, such as a division
     * by zero or an overflow.
     */
    public static final class ArithmeticError extends EvalError {
        private static final long serialVersionUID = -1487093365502118812L;

        private final String operator;
        private final String reason;

        ArithmeticError(String operator, String reason) {
            this.operator = Objects.requireNonNull(operator);
            this.reason = Objects.requireNonNull(reason);
        }

        public String operator() {
            return operator;
        }

        public String reason() {
            return reason;
        }

        @Override
        public String getMessage() {
            return "operator '" + operator + "' failed: " + reason;
        }

        @Override
        public <R> R fold(Function<? super ParseError, ? extends R> parse,
                          Function<? super StackUnderflowError, ? extends R> underflow,
                          Function<? super ArithmeticError, ? extends R> arithmetic) {
            return arithmetic.apply(this);
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof ArithmeticError))
                return false;
            ArithmeticError other = (ArithmeticError)obj;
            return operator.equals(other.operator) && reason.equals(other.reason);
        }

        @Override
        public int hashCode() {
            return Objects.hash(operator, reason);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                .add("operator", operator)
                .add("reason", reason)
                .toString();
        }
    }

    public static ParseError parseError(String token) {
        return new ParseError(token);
    }

    public static StackUnderflowError stackUnderflow(String operator, int availableDepth) {
        return new StackUnderflowError(operator, availableDepth);
    }

    public static ArithmeticError arithmeticError(String operator, String reason) {
        return new ArithmeticError(operator, reason);
    }

    /**
     * Returns a human readable description of the failure.
     */
    public abstract String getMessage();

    /**
     * Case analysis over the failure variants.
     */
    public abstract <R> R fold(Function<? super ParseError, ? extends R> parse,
                               Function<? super StackUnderflowError, ? extends R> underflow,
                               Function<? super ArithmeticError, ? extends R> arithmetic);
}
