/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.eval.calc;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import org.junit.Test;
import static org.junit.Assert.*;

import com.cloudway.eval.fp.control.State;
import com.cloudway.eval.fp.data.Either;
import com.cloudway.eval.fp.data.IntSeq;
import com.cloudway.eval.fp.data.Tuple;

import static com.cloudway.eval.calc.Matchers.left;
import static com.cloudway.eval.calc.Matchers.leftOf;
import static com.cloudway.eval.calc.Matchers.right;

// @formatter:off
public class CalculatorTest
{
    private final Calculator calc = new Calculator(new CalculatorConfig());

    private static List<String> tokens(String... tokens) {
        return ImmutableList.copyOf(tokens);
    }

    @Test
    public void evaluatesExpressions() {
        assertThat(calc.evaluate(tokens("1", "2", "+", "3", "*")), right(9));
        assertThat(calc.evaluate(tokens("2", "2", "*")), right(4));
        assertThat(calc.evaluate("1 2 + 3 *"), right(9));
        assertThat(calc.evaluate("42"), right(42));
        assertThat(calc.evaluate("5 1 2 + 4 * + 3 -"), right(14));
    }

    @Test
    public void earlierPushedOperandIsLeftOperand() {
        assertThat(calc.evaluate("7 2 -"), right(5));
        assertThat(calc.evaluate("2 7 -"), right(-5));
        assertThat(calc.evaluate("8 2 /"), right(4));
        assertThat(calc.evaluate("2 8 /"), right(0));
        assertThat(calc.evaluate("-7 2 /"), right(-3));
        assertThat(calc.evaluate("10 2 8 * + 3 -"), right(23));
    }

    @Test
    public void singleSteps() {
        assertEquals(Tuple.of(IntSeq.of(4), 4), calc.evalOne("*").run(IntSeq.of(2, 2)));
        assertEquals(Integer.valueOf(42), calc.evalOne("42").eval(IntSeq.nil()));
        assertEquals(Tuple.of(IntSeq.of(3, 1), 3), calc.operand(3).run(IntSeq.of(1)));
        assertEquals(Tuple.of(IntSeq.of(2, 9), 2), calc.operator(Operator.SUBTRACT).run(IntSeq.of(3, 5, 9)));
    }

    @Test
    public void stepsComposeAsPrograms() {
        State<IntSeq, Integer> program =
            calc.evalOne("1").then(() ->
            calc.evalOne("2")).then(() ->
            calc.evalOne("+"));
        assertEquals(Integer.valueOf(3), program.eval(IntSeq.nil()));
    }

    @Test
    public void subProgramsCompose() {
        List<String> all = new ArrayList<>();
        Iterables.addAll(all, Tokenizer.tokenize("1 2 +"));
        Iterables.addAll(all, Tokenizer.tokenize("3 4 +"));
        all.add("*");
        assertThat(calc.evaluate(all), right(21));

        State<IntSeq, Integer> program =
            calc.evalAll(Tokenizer.tokenize("1 2 +")).then(() ->
            calc.evalAll(Tokenizer.tokenize("3 4 +"))).then(() ->
            calc.evalOne("*"));
        assertEquals(Tuple.of(IntSeq.of(21), 21), program.run(IntSeq.nil()));
    }

    @Test
    public void finalStackIsExposed() {
        Either<EvalError, Tuple<IntSeq, Integer>> result = calc.run(tokens("1", "2"), IntSeq.nil());
        assertTrue(result.isRight());
        assertEquals(IntSeq.of(2, 1), result.right().first());
        assertEquals(Integer.valueOf(2), result.right().second());

        assertThat(calc.run(tokens("+"), IntSeq.of(4, 5)), right(Tuple.of(IntSeq.of(9), 9)));
    }

    @Test
    public void emptyTokenListProgramResultsInZero() {
        assertEquals(Tuple.of(IntSeq.of(8), 0), calc.evalAll(tokens()).run(IntSeq.of(8)));
    }

    @Test
    public void stackUnderflow() {
        assertThat(calc.evaluate(tokens("+")), left(EvalError.stackUnderflow("+", 0)));
        assertThat(calc.evaluate("1 +"), left(EvalError.stackUnderflow("+", 1)));
        assertThat(calc.evaluate("1 2 + *"), left(EvalError.stackUnderflow("*", 1)));
        assertThat(calc.evaluate("-"), leftOf(EvalError.StackUnderflowError.class));
    }

    @Test
    public void divisionByZero() {
        assertThat(calc.evaluate(tokens("4", "0", "/")), left(EvalError.arithmeticError("/", "division by zero")));
        assertThat(calc.evaluate("1 1 1 - /"), leftOf(EvalError.ArithmeticError.class));
    }

    @Test
    public void parseErrors() {
        assertThat(calc.evaluate(tokens("1", "x", "+")), left(EvalError.parseError("x")));
        assertThat(calc.evaluate("1.5"), left(EvalError.parseError("1.5")));
        assertThat(calc.evaluate("1 2 %"), left(EvalError.parseError("%")));
        assertThat(calc.evaluate("99999999999"), left(EvalError.parseError("99999999999")));
        assertThat(calc.evaluate("++"), left(EvalError.parseError("++")));
    }

    @Test
    public void firstFailureWins() {
        assertThat(calc.evaluate("+ x"), left(EvalError.stackUnderflow("+", 0)));
        assertThat(calc.evaluate("x +"), left(EvalError.parseError("x")));
    }

    @Test
    public void emptyExpression() {
        assertThat(calc.evaluate(""), left(EvalError.parseError("")));
        assertThat(calc.evaluate("   "), left(EvalError.parseError("")));
        assertThat(calc.evaluate(tokens()), left(EvalError.parseError("")));
    }

    @Test
    public void negativeLiterals() {
        assertThat(calc.evaluate("-3 4 +"), right(1));
        assertThat(calc.evaluate("-3 -4 *"), right(12));
    }

    @Test
    public void overflowIsAnError() {
        EvalError overflow = EvalError.arithmeticError("+", "integer overflow");
        assertThat(calc.evaluate("2147483647 1 +"), left(overflow));
        assertThat(calc.evaluate("-2147483648 1 -"), leftOf(EvalError.ArithmeticError.class));
        assertThat(calc.evaluate("65536 65536 *"), leftOf(EvalError.ArithmeticError.class));
        assertThat(calc.evaluate("-2147483648 -1 /"), left(EvalError.arithmeticError("/", "integer overflow")));
    }

    @Test
    public void wrappingArithmeticWhenConfigured() {
        Properties props = new Properties();
        props.setProperty(CalculatorConfig.EXACT_KEY, "false");
        Calculator wrapping = new Calculator(new CalculatorConfig(props));

        assertThat(wrapping.evaluate("2147483647 1 +"), right(Integer.MIN_VALUE));
        assertThat(wrapping.evaluate("-2147483648 -1 /"), right(Integer.MIN_VALUE));
        assertThat(wrapping.evaluate("1 0 /"), left(EvalError.arithmeticError("/", "division by zero")));
    }

    @Test
    public void longExpressionsAreStackSafe() {
        List<String> expr = new ArrayList<>();
        expr.add("1");
        for (int i = 0; i < 100_000; i++) {
            expr.add("1");
            expr.add("+");
        }
        assertThat(calc.evaluate(expr), right(100_001));
    }

    @Test
    public void deepStackIsStackSafe() {
        List<String> expr = new ArrayList<>();
        for (int i = 0; i < 50_000; i++) {
            expr.add("2");
        }
        for (int i = 1; i < 50_000; i++) {
            expr.add("+");
        }
        assertThat(calc.evaluate(expr), right(100_000));
    }

    @Test
    public void programsAreRepeatable() {
        State<IntSeq, Integer> program = calc.evalAll(Tokenizer.tokenize("3 4 * 2 -"));
        IntSeq initial = IntSeq.of(100);
        Tuple<IntSeq, Integer> first = program.run(initial);
        assertEquals(first, program.run(initial));
        assertEquals(Tuple.of(IntSeq.of(10, 100), 10), first);
        assertEquals(IntSeq.of(100), initial);
    }

    @Test
    public void errorCaseAnalysis() {
        String kind = EvalError.parseError("x").fold(p -> "parse " + p.token(), u -> "underflow", a -> "arithmetic");
        assertEquals("parse x", kind);
        assertEquals("operator '+' requires 2 operands, but the stack holds 1",
                     EvalError.stackUnderflow("+", 1).getMessage());
        assertEquals("not an integer or operator: 'x'", EvalError.parseError("x").getMessage());
    }

    @Test
    public void failedStepThrowsInsideProgram() {
        try {
            calc.evalOne("+").run(IntSeq.nil());
            fail("expected EvalException");
        } catch (EvalException ex) {
            assertEquals(EvalError.stackUnderflow("+", 0), ex.getError());
        }
    }
}
