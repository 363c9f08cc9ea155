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
import io.testbridge.client.ProgressMessage;
import io.testbridge.client.TestingClient;
import io.testbridge.client.TestingNotification;
import io.testbridge.log.LogContext;
import io.testbridge.model.RunRequest;
import io.testbridge.model.TestInventory;
import org.slf4j.Logger;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Entry point for editor run requests: keeps the active runs by request id, executes them in the
 * background and closes every run with an {@code End} message.
 */
public class TestRunManager implements AutoCloseable {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final TestInventory inventory;
    private final TestingClient client;
    private final TestRunSettings settings;
    private final Map<Integer, TestRun> runs = new ConcurrentHashMap<>();
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "testbridge-run");
        thread.setDaemon(true);
        return thread;
    });

    public TestRunManager(TestInventory inventory, TestingClient client, TestRunSettings settings) {
        this.inventory = inventory;
        this.client = client;
        this.settings = settings;
    }

    /**
     * Plan the request, announce the queued modules and start executing in the background.
     *
     * @return completes with the outcome once the {@code End} message has been sent; a failed
     * verdict completes normally with a failing outcome, other failures complete exceptionally
     */
    public CompletableFuture<RunOutcome> runRequest(RunRequest request) {
        TestRun run = new TestRun(request, inventory, settings);
        if (runs.putIfAbsent(request.id(), run) != null) {
            throw new IllegalStateException("run already active: " + request.id());
        }
        for (EnqueuedTestModule module : run.asEnqueued()) {
            send(request.id(), new ProgressMessage.Enqueued(module.moduleUri(), module.ids()));
        }
        return CompletableFuture.supplyAsync(() -> execute(run), executor);
    }

    private RunOutcome execute(TestRun run) {
        try {
            RunOutcome outcome = run.exec(client);
            send(run.getId(), new ProgressMessage.End(true, null));
            return outcome;
        } catch (TestRunException e) {
            send(run.getId(), new ProgressMessage.End(false, e.getMessage()));
            if (e.getOutcome() != null) {
                return e.getOutcome();
            }
            logger.warn("run {} failed: {}", run.getId(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            send(run.getId(), new ProgressMessage.End(false, e.getMessage()));
            logger.warn("run {} failed: {}", run.getId(), e.getMessage());
            throw e;
        } finally {
            runs.remove(run.getId());
        }
    }

    /**
     * @return true if the run was active and is now cancelled
     */
    public boolean cancel(int id) {
        TestRun run = runs.get(id);
        if (run == null) {
            return false;
        }
        run.cancel();
        return true;
    }

    public boolean isActive(int id) {
        return runs.containsKey(id);
    }

    private void send(int runId, ProgressMessage message) {
        client.sendTestNotification(new TestingNotification.Progress(runId, message));
    }

    @Override
    public void close() {
        runs.values().forEach(TestRun::cancel);
        executor.shutdown();
    }

}
