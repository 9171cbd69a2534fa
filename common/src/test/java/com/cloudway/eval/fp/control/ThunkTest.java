/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.eval.fp.control;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import static org.junit.Assert.*;

import com.cloudway.eval.fp.$;
import com.cloudway.eval.fp.typeclass.MonadLaws;

import static com.cloudway.eval.fp.control.Thunk.always;
import static com.cloudway.eval.fp.control.Thunk.defer;
import static com.cloudway.eval.fp.control.Thunk.later;
import static com.cloudway.eval.fp.control.Thunk.now;

// @formatter:off
public class ThunkTest
{
    static Thunk<BigInteger> factorial(int n) {
        if (n <= 1) {
            return now(BigInteger.ONE);
        } else {
            return defer(() -> factorial(n - 1)).map(x -> x.multiply(BigInteger.valueOf(n)));
        }
    }

    static BigInteger factorialLoop(int n) {
        BigInteger result = BigInteger.ONE;
        for (int i = 2; i <= n; i++) {
            result = result.multiply(BigInteger.valueOf(i));
        }
        return result;
    }

    static Thunk<Integer> countdown(int n) {
        return n == 0 ? now(0) : defer(() -> countdown(n - 1));
    }

    static Thunk<Long> sum(int n) {
        return n == 0 ? now(0L) : defer(() -> sum(n - 1)).bind(s -> now(s + n));
    }

    @Test
    public void factorialIsStackSafe() {
        assertEquals(factorialLoop(50000), factorial(50000).force());
    }

    @Test
    public void smallFactorials() {
        assertEquals(BigInteger.ONE, factorial(1).force());
        assertEquals(BigInteger.valueOf(120), factorial(5).force());
        assertEquals(factorialLoop(25), factorial(25).force());
    }

    @Test
    public void longDeferChain() {
        assertEquals(Integer.valueOf(0), countdown(1_000_000).force());
    }

    @Test
    public void longBindChain() {
        assertEquals(Long.valueOf(100_000L * 100_001L / 2), sum(100_000).force());
    }

    @Test
    public void deeplyNestedMaps() {
        Thunk<Integer> t = now(0);
        for (int i = 0; i < 200_000; i++) {
            t = t.map(x -> x + 1);
        }
        assertEquals(Integer.valueOf(200_000), t.force());
    }

    @Test
    public void deeplyNestedBinds() {
        Thunk<Integer> t = now(0);
        for (int i = 0; i < 200_000; i++) {
            t = t.bind(x -> now(x + 1));
        }
        assertEquals(Integer.valueOf(200_000), t.force());
    }

    @Test
    public void innermostTransformAppliesFirst() {
        Thunk<String> t = now("a").map(s -> s + "1").map(s -> s + "2").map(s -> s + "3");
        assertEquals("a123", t.force());
    }

    @Test
    public void producersRunOncePerForceInDependencyOrder() {
        List<String> trace = new ArrayList<>();
        Thunk<Integer> t = defer(() -> { trace.add("produce"); return now(1); })
            .map(x -> { trace.add("map"); return x + 1; })
            .bind(x -> { trace.add("bind"); return now(x * 10); });

        assertEquals(Integer.valueOf(20), t.force());
        assertEquals(ImmutableList.of("produce", "map", "bind"), trace);

        assertEquals(Integer.valueOf(20), t.force());
        assertEquals(6, trace.size());
    }

    @Test
    public void evaluationStrategies() {
        AtomicInteger counter = new AtomicInteger();

        Thunk<Integer> eager = now(counter.incrementAndGet());
        assertEquals(1, counter.get());
        assertEquals(Integer.valueOf(1), eager.force());
        assertEquals(1, counter.get());

        Thunk<Number> lazy = Thunk.<Number>later(counter::incrementAndGet);
        assertEquals(1, counter.get());
        assertEquals(Integer.valueOf(2), lazy.force());
        assertEquals(Integer.valueOf(2), lazy.force());
        assertEquals(2, counter.get());

        Thunk<Integer> every = always(counter::incrementAndGet);
        assertEquals(Integer.valueOf(3), every.force());
        assertEquals(Integer.valueOf(4), every.force());
    }

    @Test
    public void memoizeCachesChainUpToThatPoint() {
        List<String> trace = new ArrayList<>();
        Thunk<String> saying = always(() -> { trace.add("Step 1"); return "The cat"; })
            .map(s -> { trace.add("Step 2"); return s + " sat on"; })
            .memoize()
            .map(s -> { trace.add("Step 3"); return s + " the mat"; });

        assertEquals("The cat sat on the mat", saying.force());
        assertEquals(ImmutableList.of("Step 1", "Step 2", "Step 3"), trace);

        assertEquals("The cat sat on the mat", saying.force());
        assertEquals(ImmutableList.of("Step 1", "Step 2", "Step 3", "Step 3"), trace);
    }

    @Test
    public void memoizeDeepChain() {
        AtomicInteger calls = new AtomicInteger();
        Thunk<Integer> t = always(calls::incrementAndGet);
        for (int i = 0; i < 100_000; i++) {
            t = t.map(x -> x + 1).memoize();
        }
        assertEquals(Integer.valueOf(100_001), t.force());
        assertEquals(Integer.valueOf(100_001), t.force());
        assertEquals(1, calls.get());
    }

    @Test
    public void memoizeIsIdempotent() {
        Thunk<Integer> m = always(() -> 1).memoize();
        assertSame(m, m.memoize());
        Thunk<Integer> done = now(1);
        assertSame(done, done.memoize());
    }

    @Test
    public void exceptionsPropagateUnchanged() {
        IllegalStateException boom = new IllegalStateException("boom");
        Thunk<Integer> t = countdown(10_000).map(x -> { throw boom; });
        try {
            t.force();
            fail("expected exception");
        } catch (IllegalStateException ex) {
            assertSame(boom, ex);
        }
    }

    @Test
    public void failedMemoIsRetried() {
        AtomicInteger attempts = new AtomicInteger();
        Thunk<Integer> t = always(() -> {
            if (attempts.incrementAndGet() == 1)
                throw new IllegalStateException();
            return 42;
        }).memoize();

        try {
            t.force();
            fail("expected exception");
        } catch (IllegalStateException ex) {
            // first attempt fails
        }
        assertEquals(Integer.valueOf(42), t.force());
        assertEquals(Integer.valueOf(42), t.force());
        assertEquals(2, attempts.get());
    }

    @Test(expected = NullPointerException.class)
    public void producerMustNotReturnNull() {
        defer(() -> null).force();
    }

    @Test
    public void foldRightIsStackSafe() {
        List<Integer> xs = IntStream.rangeClosed(1, 100_000).boxed().collect(Collectors.toList());
        Thunk<Long> total = Thunk.foldRight(xs, now(0L), (x, acc) -> acc.map(s -> s + x));
        assertEquals(Long.valueOf(100_000L * 100_001L / 2), total.force());
    }

    @Test(timeout = 10_000)
    public void foldRightOverLinkedList() {
        List<Integer> xs = new LinkedList<>();
        for (int i = 1; i <= 200_000; i++) {
            xs.add(i);
        }
        Thunk<Long> total = Thunk.foldRight(xs, now(0L), (x, acc) -> acc.map(s -> s + x));
        assertEquals(Long.valueOf(200_000L * 200_001L / 2), total.force());
        assertEquals(Long.valueOf(200_000L * 200_001L / 2), total.force());
    }

    @Test
    public void foldRightPreservesOrder() {
        Thunk<String> s = Thunk.foldRight(ImmutableList.of("a", "b", "c"), now(""), (x, acc) -> acc.map(r -> x + r));
        assertEquals("abc", s.force());
    }

    @Test
    public void foldRightCanShortCircuit() {
        List<Integer> xs = IntStream.range(0, 1_000).boxed().collect(Collectors.toList());
        AtomicInteger visited = new AtomicInteger();
        Thunk<Boolean> anyAboveTen = Thunk.foldRight(xs, now(false), (x, acc) -> {
            visited.incrementAndGet();
            return x > 10 ? now(true) : acc;
        });
        assertTrue(anyAboveTen.force());
        assertEquals(12, visited.get());
    }

    @Test
    public void zipEvaluatesLeftToRight() {
        List<String> trace = new ArrayList<>();
        Thunk<Integer> a = always(() -> { trace.add("a"); return 3; });
        Thunk<Integer> b = always(() -> { trace.add("b"); return 4; });
        assertEquals(Integer.valueOf(7), Thunk.zip(a, b, Integer::sum).force());
        assertEquals(ImmutableList.of("a", "b"), trace);
    }

    @Test
    public void foldM() {
        Thunk<Integer> t = Thunk.foldM(0, ImmutableList.of(1, 2, 3, 4), (acc, x) -> now(acc + x));
        assertEquals(Integer.valueOf(10), t.force());
    }

    @Test
    public void kleisliComposition() {
        Function<Integer, $<Thunk.µ, String>> f =
            Thunk.tclass.compose(x -> defer(() -> now(x + 1)), (Integer y) -> always(() -> "n" + y * 2));
        assertEquals("n8", Thunk.force(f.apply(3)));
    }

    @Test
    public void monadLaws() {
        MonadLaws<Thunk.µ> laws = new MonadLaws<>(Thunk.tclass, t -> Thunk.narrow(t).force());
        Random random = new Random(42);

        for (int i = 0; i < 100; i++) {
            int a = random.nextInt(1000);
            int k = random.nextInt(100), c = random.nextInt(100);
            Function<Integer, $<Thunk.µ, Integer>> f = x -> defer(() -> now(x * k + c));
            Function<Integer, $<Thunk.µ, String>> g = x -> always(() -> "v" + (x - c));
            Thunk<Integer> p = countdown(random.nextInt(50)).map(x -> x + a);

            laws.leftIdentity(a, f);
            laws.rightIdentity(p);
            laws.associativity(p, f, g);
            laws.mapIsBindPure(p, x -> x * k);
        }
    }
}
