/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.testbridge.core;

import io.testbridge.engine.ExecutionContext;
import io.testbridge.engine.FailFastTracker;
import io.testbridge.engine.ModuleOptions;
import io.testbridge.engine.ModulePermissions;
import io.testbridge.engine.NameFilter;
import io.testbridge.engine.TestEngine;
import io.testbridge.engine.TestEvent;
import io.testbridge.engine.TestEventSender;
import io.testbridge.engine.UncaughtModuleException;
import io.testbridge.log.LogContext;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the queued modules with bounded concurrency.
 * <p>
 * Modules are handed to workers in lexicographic uri order; a free slot always goes to the next
 * module in that order. With more than one slot, modules handed over back to back may begin on
 * their worker threads in either order, and completion order is left to the engine. Right before a module would start,
 * the fail-fast tracker and cancellation token are checked: a module skipped there emits no
 * events at all. Modules already running are never interrupted.
 */
public class Dispatcher {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final TestEngine engine;
    private final int concurrency;
    private final Long shuffle;
    private final boolean traceOps;
    private final boolean debug;
    private final List<String> dispatched = new CopyOnWriteArrayList<>();

    public Dispatcher(TestEngine engine, int concurrency, Long shuffle, boolean traceOps, boolean debug) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1: " + concurrency);
        }
        this.engine = engine;
        this.concurrency = concurrency;
        this.shuffle = shuffle;
        this.traceOps = traceOps;
        this.debug = debug;
    }

    /**
     * Run every module of the plan, feeding their events into {@code channel}, which is closed
     * once every module has finished or been skipped.
     *
     * @throws TestRunException for the first infrastructure failure, after all modules are done
     */
    public void run(RunPlan plan, TestEventChannel channel, FailFastTracker tracker, CancellationToken token) {
        List<String> queue = sorted(plan.queue());
        Semaphore slots = new Semaphore(concurrency);
        ExecutorService executor = Executors.newCachedThreadPool(new ModuleThreadFactory());
        List<Future<?>> futures = new ArrayList<>(queue.size());
        dispatched.clear();
        try {
            for (String moduleUri : queue) {
                slots.acquire();
                if (tracker.shouldStop() || token.isCancelled()) {
                    slots.release();
                    logger.debug("skipping module (fail-fast: {}, cancelled: {}): {}",
                            tracker.shouldStop(), token.isCancelled(), moduleUri);
                    continue;
                }
                ModuleOptions options = new ModuleOptions(toNameFilter(plan, moduleUri), shuffle, traceOps, debug);
                TestEventSender sender = channel.newSender(tracker);
                dispatched.add(moduleUri);
                logger.debug("dispatching module: {}", moduleUri);
                futures.add(executor.submit(() -> {
                    try {
                        runModule(moduleUri, sender, tracker, options);
                    } finally {
                        slots.release();
                    }
                    return null;
                }));
            }
            RuntimeException failure = awaitAll(futures);
            if (failure != null) {
                throw failure;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new TestRunException("interrupted while dispatching modules", e);
        } finally {
            executor.shutdown();
            channel.close();
        }
    }

    /**
     * Modules handed to a worker by the last {@link #run}, in hand-over order.
     */
    List<String> getDispatched() {
        return List.copyOf(dispatched);
    }

    private void runModule(String moduleUri, TestEventSender sender, FailFastTracker tracker, ModuleOptions options) {
        logger.debug("starting module: {}", moduleUri);
        ModulePermissions permissions = engine.getPermissions().fork();
        try (ExecutionContext context = engine.getContextFactory().create(moduleUri)) {
            engine.runModule(context, permissions, moduleUri, sender, tracker, options);
        } catch (UncaughtModuleException e) {
            logger.debug("uncaught error in module {}: {}", moduleUri, e.getMessage());
            sender.send(new TestEvent.UncaughtError(moduleUri, e.getError()));
        }
        logger.debug("finished module: {}", moduleUri);
    }

    private static RuntimeException awaitAll(List<Future<?>> futures) throws InterruptedException {
        RuntimeException first = null;
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                logger.warn("module execution failed: {}", cause.getMessage());
                if (first == null) {
                    first = cause instanceof TestRunException tre
                            ? tre : new TestRunException("module execution failed: " + cause.getMessage(), cause);
                }
            }
        }
        return first;
    }

    private static NameFilter toNameFilter(RunPlan plan, String moduleUri) {
        TestFilter filter = plan.filters().get(moduleUri);
        return filter == null ? NameFilter.all() : filter.toNameFilter();
    }

    private static List<String> sorted(Collection<String> queue) {
        List<String> list = new ArrayList<>(queue);
        list.sort(null);
        return list;
    }

    private static class ModuleThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "testbridge-module-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

}
