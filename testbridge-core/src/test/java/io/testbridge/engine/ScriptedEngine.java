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
package io.testbridge.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory engine whose modules are scripted by the test. Records which modules ran, in which
 * order and how many at once. Modules without a script run one test named after the module that
 * fails when the uri contains "fail".
 */
public class ScriptedEngine implements TestEngine {

    @FunctionalInterface
    public interface ModuleScript {
        void run(ScriptedEngine engine, String moduleUri, TestEventSender sender, ModuleOptions options);
    }

    private final Map<String, ModuleScript> scripts = new ConcurrentHashMap<>();
    private final List<String> log = Collections.synchronizedList(new ArrayList<>());
    private final List<ModulePermissions> forked = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, ModuleOptions> options = new ConcurrentHashMap<>();
    private final List<String> closed = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger nextId = new AtomicInteger();
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxRunning = new AtomicInteger();
    private final Permissions base = new Permissions();
    private volatile List<String> prepared;
    private volatile RuntimeException prepareFailure;

    public ScriptedEngine script(String moduleUri, ModuleScript script) {
        scripts.put(moduleUri, script);
        return this;
    }

    public ScriptedEngine failPrepare(RuntimeException e) {
        this.prepareFailure = e;
        return this;
    }

    public int nextId() {
        return nextId.incrementAndGet();
    }

    @Override
    public void checkAndPrepare(List<String> moduleUris) {
        prepared = List.copyOf(moduleUris);
        if (prepareFailure != null) {
            throw prepareFailure;
        }
    }

    @Override
    public ExecutionContextFactory getContextFactory() {
        return moduleUri -> new ExecutionContext() {
            @Override
            public String getModuleUri() {
                return moduleUri;
            }

            @Override
            public void close() {
                closed.add(moduleUri);
            }
        };
    }

    @Override
    public ModulePermissions getPermissions() {
        return base;
    }

    @Override
    public void runModule(ExecutionContext context, ModulePermissions permissions, String moduleUri,
                          TestEventSender sender, FailFastTracker tracker, ModuleOptions moduleOptions) {
        forked.add(permissions);
        options.put(moduleUri, moduleOptions);
        maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
        log.add("start:" + moduleUri);
        try {
            ModuleScript script = scripts.get(moduleUri);
            if (script == null) {
                String name = moduleUri.substring(moduleUri.lastIndexOf('/') + 1);
                script = moduleUri.contains("fail") ? failing(name) : passing(name);
            }
            script.run(this, moduleUri, sender, moduleOptions);
        } finally {
            log.add("end:" + moduleUri);
            running.decrementAndGet();
        }
    }

    // ========== Scripts ==========

    public static ModuleScript passing(String... names) {
        Map<String, TestResult> results = new LinkedHashMap<>();
        for (String name : names) {
            results.put(name, TestResult.ok());
        }
        return tests(results);
    }

    public static ModuleScript failing(String name) {
        return tests(Map.of(name, TestResult.failed(TestFailure.error(TestError.of("AssertionError", "expected true")))));
    }

    /**
     * Register every test, send the plan, then run the tests the filter selects in order.
     */
    public static ModuleScript tests(Map<String, TestResult> results) {
        return (engine, moduleUri, sender, options) -> {
            Map<String, Integer> ids = new LinkedHashMap<>();
            for (String name : results.keySet()) {
                int id = engine.nextId();
                ids.put(name, id);
                sender.send(new TestEvent.Register(TestDescription.of(id, name, moduleUri)));
            }
            int selected = 0;
            for (String name : results.keySet()) {
                if (options.filter().matches(name)) {
                    selected++;
                }
            }
            sender.send(new TestEvent.Plan(new TestPlan(moduleUri, selected, results.size() - selected, false)));
            results.forEach((name, result) -> {
                if (options.filter().matches(name)) {
                    int id = ids.get(name);
                    sender.send(new TestEvent.Wait(id));
                    sender.send(new TestEvent.Result(id, result, 1));
                }
            });
        };
    }

    public static ModuleScript uncaught(String message) {
        return (engine, moduleUri, sender, options) -> {
            int id = engine.nextId();
            sender.send(new TestEvent.Register(TestDescription.of(id, "before crash", moduleUri)));
            sender.send(new TestEvent.Plan(new TestPlan(moduleUri, 1, 0, false)));
            sender.send(new TestEvent.Wait(id));
            sender.send(new TestEvent.Result(id, TestResult.ok(), 1));
            throw new UncaughtModuleException(TestError.of("Error", message));
        };
    }

    public static ModuleScript sleeping(long millis, ModuleScript then) {
        return (engine, moduleUri, sender, options) -> {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            then.run(engine, moduleUri, sender, options);
        };
    }

    // ========== Recorded state ==========

    public List<String> getLog() {
        synchronized (log) {
            return new ArrayList<>(log);
        }
    }

    public List<String> getStarted() {
        List<String> started = new ArrayList<>();
        for (String entry : getLog()) {
            if (entry.startsWith("start:")) {
                started.add(entry.substring(6));
            }
        }
        return started;
    }

    public List<ModulePermissions> getForked() {
        synchronized (forked) {
            return new ArrayList<>(forked);
        }
    }

    public ModuleOptions getOptions(String moduleUri) {
        return options.get(moduleUri);
    }

    public List<String> getClosed() {
        synchronized (closed) {
            return new ArrayList<>(closed);
        }
    }

    public List<String> getPrepared() {
        return prepared;
    }

    public int getMaxRunning() {
        return maxRunning.get();
    }

    public Permissions getBase() {
        return base;
    }

    public static class Permissions implements ModulePermissions {

        private final Permissions parent;

        Permissions() {
            this(null);
        }

        private Permissions(Permissions parent) {
            this.parent = parent;
        }

        @Override
        public ModulePermissions fork() {
            return new Permissions(this);
        }

        public Permissions getParent() {
            return parent;
        }
    }

}
