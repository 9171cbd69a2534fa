/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.eval.calc;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import com.cloudway.eval.fp.data.Either;

/**
 * Evaluates independent expressions in parallel.
 *
 * <p>Each expression is run as its own program on a worker thread. Programs
 * share no state, so no coordination is needed beyond joining the results,
 * which are returned in the order the expressions were given.</p>
 */
public class BatchEvaluator implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(BatchEvaluator.class.getName());

    private final Calculator calculator;
    private final ListeningExecutorService executor;
    private final boolean ownsExecutor;

    /**
     * Creates a batch evaluator with its own thread pool, sized by the
     * configured parallelism. The pool is shut down by {@link #close()}.
     */
    public BatchEvaluator(CalculatorConfig config) {
        this(new Calculator(config), newExecutor(config.getParallelism()), true);
    }

    /**
     * Creates a batch evaluator running on the given executor. The executor
     * is left running when this evaluator is closed.
     */
    public BatchEvaluator(Calculator calculator, ListeningExecutorService executor) {
        this(calculator, executor, false);
    }

    BatchEvaluator(Calculator calculator, ListeningExecutorService executor, boolean ownsExecutor) {
        this.calculator = calculator;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    private static ListeningExecutorService newExecutor(int threads) {
        return MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(threads,
            new ThreadFactoryBuilder().setNameFormat("calculator-%d").setDaemon(true).build()));
    }

    /**
     * Schedules the evaluation of a single expression.
     */
    public ListenableFuture<Either<EvalError, Integer>> submit(String expression) {
        return executor.submit(() -> calculator.evaluate(expression));
    }

    /**
     * Evaluates all expressions in parallel. The returned future completes
     * when every expression has been evaluated; a failed expression yields a
     * 'Left' entry and does not affect the others.
     */
    public ListenableFuture<List<Either<EvalError, Integer>>> evaluateAll(List<String> expressions) {
        logger.log(Level.FINE, "Evaluating {0} expressions", expressions.size());
        List<ListenableFuture<Either<EvalError, Integer>>> futures =
            expressions.stream().map(this::submit).collect(Collectors.toList());
        return Futures.allAsList(futures);
    }

    /**
     * Evaluates two expressions in parallel and joins their results with the
     * given function. The first failure, in argument order, is reported.
     */
    public <R> ListenableFuture<Either<EvalError, R>>
    zip(String first, String second, BiFunction<? super Integer, ? super Integer, ? extends R> f) {
        ListenableFuture<Either<EvalError, Integer>> fa = submit(first);
        ListenableFuture<Either<EvalError, Integer>> fb = submit(second);
        return Futures.whenAllSucceed(fa, fb).call(() -> {
            Either<EvalError, Integer> a = Futures.getDone(fa);
            Either<EvalError, Integer> b = Futures.getDone(fb);
            return a.<R>flatMap(x -> b.<R>map(y -> f.apply(x, y)));
        }, MoreExecutors.directExecutor());
    }

    /**
     * Stops the owned worker pool, waiting for running evaluations to finish.
     * If the calling thread is interrupted while waiting, the workers are
     * stopped immediately and the interrupt status is restored.
     */
    @Override
    public void close() {
        if (ownsExecutor) {
            if (MoreExecutors.shutdownAndAwaitTermination(executor, 10, TimeUnit.SECONDS)) {
                logger.info("Calculator workers stopped");
            } else {
                logger.warning("Calculator workers did not terminate in time");
            }
        }
    }
}
