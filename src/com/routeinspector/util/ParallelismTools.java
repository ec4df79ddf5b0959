/*
 * Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of RouteInspector.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.routeinspector.util;

import java.util.ArrayList;
import java.util.List;
import java.util.ListIterator;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.jetbrains.annotations.NotNull;

/**
 * Utilities to aid in parallel processing
 *
 * A class that abstracts away single-threaded and multi-threaded execution.
 * Single-threaded mode means that all tasks submitted will be executed
 * immediately (on the submitting thread).
 */
public class ParallelismTools {
    /**
     * Name of the environment variable to disable parallel processing, set
     * ROUTE_INSPECTOR_PARALLEL=0 to disable
     */
    public static final String ROUTE_INSPECTOR_PARALLEL = "ROUTE_INSPECTOR_PARALLEL";

    private static final int POOL_SIZE = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

    /** A fixed-size thread pool with as many threads as there are processors
     * minus one, fed by a single task queue */
    private static final ThreadPoolExecutor pool = new ThreadPoolExecutor(
            POOL_SIZE,
            POOL_SIZE,
            0, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(),
            (r) -> {
                Thread t = Executors.defaultThreadFactory().newThread(r);
                t.setDaemon(true);
                return t;
            });

    private static boolean parallel = true;

    static {
        String value = System.getenv(ROUTE_INSPECTOR_PARALLEL);
        setParallel(value == null || !(value.equals("0") || value.equalsIgnoreCase("false")));
    }

    /**
     * Global setter to control parallel processing.
     * @param parallel Enable parallel processing.
     */
    public static void setParallel(boolean parallel) {
        ParallelismTools.parallel = parallel;
        if (parallel) {
            pool.prestartAllCoreThreads();
        }
    }

    /**
     * Global getter for current parallel processing state.
     * @return Current parallel processing state.
     */
    public static boolean getParallel() {
        return parallel;
    }

    /**
     * Submit a task-with-return-value to the thread pool.
     * @param task Task to be performed.
     * @param <T> Type returned by task.
     * @return A Future object holding the value returned by task.
     */
    public static <T> Future<T> submit(Callable<T> task) {
        if (!getParallel()) {
            try {
                return CompletableFuture.completedFuture(task.call());
            } catch (Exception e) {
                CompletableFuture<T> f = new CompletableFuture<>();
                f.completeExceptionally(e);
                return f;
            }
        }
        return pool.submit(task);
    }

    /**
     * Block until the task behind the given Future is complete.
     * If necessary, steal the task from the job queue for immediate execution
     * on the current thread.
     * @param future Future representing previously submitted task.
     * @return Value returned by task.
     */
    public static <T> T get(Future<T> future) {
        trySteal(future);

        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new RuntimeException(e.getCause());
        }
    }

    /**
     * Submits every task and then collects their values in submission order.
     * Tasks that are still queued when their turn comes are stolen and run on the
     * current thread.
     * @param tasks Tasks to be executed.
     * @param <T> Type returned by all tasks.
     * @return The values returned by the tasks, in the same order as the tasks.
     */
    public static <T> List<T> invokeAllInOrder(@NotNull List<? extends Callable<T>> tasks) {
        List<Future<T>> futures = new ArrayList<>(tasks.size());
        for (Callable<T> task : tasks) {
            futures.add(submit(task));
        }
        if (getParallel()) {
            // Walk backwards and try and steal those not done
            ListIterator<Future<T>> it = futures.listIterator(futures.size());
            while (it.hasPrevious()) {
                trySteal(it.previous());
            }
        }
        List<T> results = new ArrayList<>(futures.size());
        for (Future<T> f : futures) {
            results.add(get(f));
        }
        return results;
    }

    private static <T> boolean trySteal(Future<T> future) {
        boolean doneOrStolen = future.isDone();
        if (!doneOrStolen && (future instanceof Runnable)) {
            doneOrStolen = pool.remove((Runnable) future);
            if (doneOrStolen) {
                ((Runnable) future).run();
            }
        }
        return doneOrStolen;
    }
}
