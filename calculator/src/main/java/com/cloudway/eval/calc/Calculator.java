/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.eval.calc;

import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.primitives.Ints;

import com.cloudway.eval.fp.control.State;
import com.cloudway.eval.fp.data.Either;
import com.cloudway.eval.fp.data.IntSeq;
import com.cloudway.eval.fp.data.Tuple;

/**
 * A postfix calculator implemented as a stack machine.
 *
 * <p>Each token becomes a state program over the operand stack: a number
 * is pushed, an operator pops two operands and pushes its result. A whole
 * expression is the left to right sequence of its token programs, run from
 * an empty stack. The result of an expression is the result of its last
 * step, which for a well formed expression is the single value left on the
 * stack.</p>
 *
 * <pre>{@code
 *     new Calculator().evaluate("1 2 + 3 *")   // Right(9)
 * }</pre>
 *
 * <p>Instances are immutable and can be shared between threads.</p>
 */
public class Calculator {
    private static final Logger logger = Logger.getLogger(Calculator.class.getName());

    private final boolean exactArithmetic;

    public Calculator() {
        this(CalculatorConfig.getDefault());
    }

    public Calculator(CalculatorConfig config) {
        this.exactArithmetic = config.isExactArithmetic();
    }

    /**
     * Returns the program for a single token. The token is classified when
     * the program runs, so an invalid token fails the run that reaches it.
     */
    public State<IntSeq, Integer> evalOne(String token) {
        return State.state(stack -> step(token, stack));
    }

    /**
     * Returns the program that pushes the given number.
     */
    public State<IntSeq, Integer> operand(int n) {
        return State.state(stack -> Tuple.of(IntSeq.cons(n, stack), n));
    }

    /**
     * Returns the program that applies the given operator to the two topmost
     * numbers of the stack.
     */
    public State<IntSeq, Integer> operator(Operator op) {
        return State.state(stack -> operate(op, stack));
    }

    /**
     * Returns the program for a whole token sequence. The tokens are
     * sequenced from left to right, each step discarding the result of
     * the previous one. The program for no tokens leaves the stack alone
     * and results in zero.
     */
    public State<IntSeq, Integer> evalAll(List<String> tokens) {
        return State.foldM(0, tokens, (result, token) -> evalOne(token));
    }

    /**
     * Runs the given tokens from the given initial stack.
     *
     * @return the final stack and the result of the last step, or the error
     *         that stopped the evaluation
     */
    public Either<EvalError, Tuple<IntSeq, Integer>> run(List<String> tokens, IntSeq initial) {
        try {
            return Either.right(evalAll(tokens).run(initial));
        } catch (EvalException ex) {
            logger.log(Level.FINE, "Evaluation of {0} failed: {1}", new Object[] {tokens, ex.getMessage()});
            return Either.left(ex.getError());
        }
    }

    /**
     * Evaluates the given postfix tokens from an empty stack.
     *
     * @return the result of the expression or the reason it failed
     */
    public Either<EvalError, Integer> evaluate(List<String> tokens) {
        if (tokens.isEmpty()) {
            return Either.left(EvalError.parseError(""));
        }
        return run(tokens, IntSeq.nil()).map(Tuple::second);
    }

    /**
     * Evaluates a postfix expression whose tokens are separated by whitespace.
     *
     * @return the result of the expression or the reason it failed
     */
    public Either<EvalError, Integer> evaluate(String expression) {
        return evaluate(Tokenizer.tokenize(expression));
    }

    private Tuple<IntSeq, Integer> step(String token, IntSeq stack) {
        Optional<Operator> op = Operator.forSymbol(token);
        if (op.isPresent()) {
            return operate(op.get(), stack);
        }

        Integer n = Ints.tryParse(token);
        if (n == null) {
            throw new EvalException(EvalError.parseError(token));
        }
        return Tuple.of(IntSeq.cons(n, stack), n);
    }

    private Tuple<IntSeq, Integer> operate(Operator op, IntSeq stack) {
        if (stack.size() < 2) {
            throw new EvalException(EvalError.stackUnderflow(op.symbol(), stack.size()));
        }

        int right = stack.head();
        int left = stack.tail().head();
        IntSeq rest = stack.tail().tail();

        int result;
        try {
            result = op.apply(left, right, exactArithmetic);
        } catch (ArithmeticException ex) {
            throw new EvalException(EvalError.arithmeticError(op.symbol(), ex.getMessage()));
        }
        return Tuple.of(IntSeq.cons(result, rest), result);
    }
}
