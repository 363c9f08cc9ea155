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

import io.testbridge.client.EnqueuedTestModule;
import io.testbridge.client.TestingClient;
import io.testbridge.engine.EnginePreparationException;
import io.testbridge.engine.FailFastTracker;
import io.testbridge.log.LogContext;
import io.testbridge.model.RunKind;
import io.testbridge.model.RunRequest;
import io.testbridge.model.TestInventory;
import io.testbridge.model.TestModule;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;

/**
 * One execution of a {@link RunRequest}. The plan is fixed when the run is created; later
 * inventory changes do not affect which modules run.
 */
public class TestRun {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final RunRequest request;
    private final TestInventory inventory;
    private final TestRunSettings settings;
    private final RunPlan plan;
    private final CancellationToken token = new CancellationToken();

    public TestRun(RunRequest request, TestInventory inventory, TestRunSettings settings) {
        this.request = request;
        this.inventory = inventory;
        this.settings = settings;
        this.plan = inventory.withLock(modules -> RunPlanner.compute(request, modules));
    }

    public int getId() {
        return request.id();
    }

    public RunPlan getPlan() {
        return plan;
    }

    /**
     * The queued modules with the stable ids of the tests that will run, in dispatch order.
     */
    public List<EnqueuedTestModule> asEnqueued() {
        return inventory.withLock(modules -> {
            List<EnqueuedTestModule> list = new ArrayList<>(plan.queue().size());
            for (String moduleUri : plan.queue()) {
                TestModule module = modules.get(moduleUri);
                if (module != null) {
                    list.add(new EnqueuedTestModule(moduleUri, plan.filterFor(moduleUri).asIds(module)));
                }
            }
            return list;
        });
    }

    /**
     * Stop starting new modules. Modules already running finish normally.
     */
    public void cancel() {
        logger.debug("cancelling run {}", request.id());
        token.cancel();
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    /**
     * Execute the run, reporting progress to {@code client}. Blocks until every module has
     * finished or been skipped and all events are reported.
     *
     * @return the passing outcome
     * @throws TestRunException if preparation fails, module execution fails outside test code, or
     *                          the verdict is a failure
     */
    public RunOutcome exec(TestingClient client) {
        List<String> queue = new ArrayList<>(plan.queue());
        logger.info("run {}: {} module(s), concurrency {}", request.id(), queue.size(), settings.getConcurrency());
        try {
            settings.getEngine().checkAndPrepare(queue);
        } catch (EnginePreparationException e) {
            logger.warn("run {}: preparation failed: {}", request.id(), e.getMessage());
            throw new TestRunException("failed to prepare modules: " + e.getMessage(), e);
        }
        TestEventChannel channel = new TestEventChannel();
        FailFastTracker tracker = new FailFastTracker(settings.getFailFast());
        TestReporter reporter = new TestReporter(request.id(), inventory, client, settings.getRootUri(), new IdentityResolver());
        FutureTask<RunOutcome> aggregation = new FutureTask<>(new EventAggregator(channel, reporter));
        Thread thread = new Thread(aggregation, "testbridge-aggregator-" + request.id());
        thread.setDaemon(true);
        thread.start();
        Dispatcher dispatcher = new Dispatcher(settings.getEngine(), settings.getConcurrency(),
                settings.getShuffle(), settings.isTraceOps(), request.kind() == RunKind.DEBUG);
        TestRunException dispatchFailure = null;
        try {
            dispatcher.run(plan, channel, tracker, token);
        } catch (TestRunException e) {
            dispatchFailure = e;
        }
        RunOutcome outcome;
        try {
            outcome = aggregation.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TestRunException("interrupted while waiting for test results", e);
        } catch (ExecutionException e) {
            throw new TestRunException("failed to aggregate test events: " + e.getCause().getMessage(), e.getCause());
        }
        if (dispatchFailure != null) {
            throw dispatchFailure;
        }
        if (!outcome.passed()) {
            throw new TestRunException(outcome);
        }
        return outcome;
    }

}
