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

import io.testbridge.engine.FailFastTracker;
import io.testbridge.engine.ModuleOptions;
import io.testbridge.engine.ModulePermissions;
import io.testbridge.engine.ScriptedEngine;
import io.testbridge.engine.TestEvent;
import io.testbridge.model.RunRequest;
import io.testbridge.model.TestDefinition;
import io.testbridge.model.TestIdentifier;
import io.testbridge.model.TestModule;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static io.testbridge.engine.ScriptedEngine.*;
import static org.junit.jupiter.api.Assertions.*;

class DispatcherTest {

    static final String A = "file:///a_test.ts";
    static final String B = "file:///b_test.ts";
    static final String C = "file:///c_test.ts";

    TestEventChannel channel = new TestEventChannel();
    CancellationToken token = new CancellationToken();

    static RunPlan plan(String... uris) {
        return new RunPlan(new TreeSet<>(List.of(uris)), Map.of());
    }

    List<TestEvent> drain() throws InterruptedException {
        List<TestEvent> events = new ArrayList<>();
        TestEvent event;
        while ((event = channel.receive()) != null) {
            events.add(event);
        }
        return events;
    }

    static Set<String> origins(List<TestEvent> events) {
        Set<String> origins = new HashSet<>();
        for (TestEvent event : events) {
            if (event instanceof TestEvent.Register r) {
                origins.add(r.description().origin());
            }
        }
        return origins;
    }

    @Test
    void testConcurrencyOneRunsModulesOneAfterAnother() throws Exception {
        ScriptedEngine engine = new ScriptedEngine()
                .script(A, sleeping(30, passing("a")))
                .script(B, sleeping(30, passing("b")))
                .script(C, sleeping(30, passing("c")));
        Dispatcher dispatcher = new Dispatcher(engine, 1, null, true, false);
        dispatcher.run(plan(C, A, B), channel, FailFastTracker.disabled(), token);
        assertEquals(List.of(A, B, C), dispatcher.getDispatched());
        assertEquals(List.of("start:" + A, "end:" + A, "start:" + B, "end:" + B, "start:" + C, "end:" + C), engine.getLog());
        assertEquals(1, engine.getMaxRunning());
        assertEquals(Set.of(A, B, C), origins(drain()));
    }

    @Test
    void testConcurrencyIsBounded() throws Exception {
        ScriptedEngine engine = new ScriptedEngine();
        List<String> uris = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            String uri = "file:///m" + i + "_test.ts";
            uris.add(uri);
            engine.script(uri, sleeping(40, passing("t" + i)));
        }
        Dispatcher dispatcher = new Dispatcher(engine, 2, null, true, false);
        dispatcher.run(plan(uris.toArray(new String[0])), channel, FailFastTracker.disabled(), token);
        assertTrue(engine.getMaxRunning() <= 2, "max running: " + engine.getMaxRunning());
        assertEquals(uris, dispatcher.getDispatched());
        assertEquals(new HashSet<>(uris), new HashSet<>(engine.getStarted()));
        assertEquals(6, origins(drain()).size());
    }

    @Test
    void testFailFastSkipsModulesNotYetStarted() throws Exception {
        ScriptedEngine engine = new ScriptedEngine()
                .script(A, failing("a"))
                .script(B, passing("b"))
                .script(C, passing("c"));
        FailFastTracker tracker = new FailFastTracker(1);
        new Dispatcher(engine, 1, null, true, false).run(plan(A, B, C), channel, tracker, token);
        assertEquals(List.of(A), engine.getStarted());
        assertTrue(tracker.shouldStop());
        assertEquals(Set.of(A), origins(drain()));
    }

    @Test
    void testFailFastLetsRunningModulesFinish() throws Exception {
        ScriptedEngine engine = new ScriptedEngine()
                .script(A, sleeping(50, failing("a")))
                .script(B, sleeping(200, passing("b")))
                .script(C, passing("c"));
        Dispatcher dispatcher = new Dispatcher(engine, 2, null, true, false);
        dispatcher.run(plan(A, B, C), channel, new FailFastTracker(1), token);
        assertEquals(List.of(A, B), dispatcher.getDispatched());
        assertEquals(Set.of(A, B), new HashSet<>(engine.getStarted()));
        List<TestEvent> events = drain();
        assertEquals(Set.of(A, B), origins(events));
        long results = events.stream().filter(e -> e instanceof TestEvent.Result).count();
        assertEquals(2, results);
    }

    @Test
    void testCancelledBeforeStartRunsNothing() throws Exception {
        ScriptedEngine engine = new ScriptedEngine();
        token.cancel();
        new Dispatcher(engine, 2, null, true, false).run(plan(A, B), channel, FailFastTracker.disabled(), token);
        assertTrue(engine.getStarted().isEmpty());
        assertTrue(drain().isEmpty());
        assertTrue(channel.isClosed());
    }

    @Test
    void testCancelWhileRunningSkipsRemainingModules() throws Exception {
        ScriptedEngine engine = new ScriptedEngine()
                .script(A, (e, uri, sender, options) -> {
                    token.cancel();
                    passing("a").run(e, uri, sender, options);
                });
        new Dispatcher(engine, 1, null, true, false).run(plan(A, B, C), channel, FailFastTracker.disabled(), token);
        assertEquals(List.of(A), engine.getStarted());
        assertEquals(Set.of(A), origins(drain()));
    }

    @Test
    void testEachModuleGetsItsOwnPermissionsAndContext() {
        ScriptedEngine engine = new ScriptedEngine();
        new Dispatcher(engine, 3, null, true, false).run(plan(A, B, C), channel, FailFastTracker.disabled(), token);
        List<ModulePermissions> forked = engine.getForked();
        assertEquals(3, forked.size());
        Map<ModulePermissions, Boolean> distinct = new IdentityHashMap<>();
        for (ModulePermissions permissions : forked) {
            assertNotSame(engine.getBase(), permissions);
            assertSame(engine.getBase(), ((ScriptedEngine.Permissions) permissions).getParent());
            distinct.put(permissions, true);
        }
        assertEquals(3, distinct.size());
        assertEquals(Set.of(A, B, C), new HashSet<>(engine.getClosed()));
    }

    @Test
    void testUncaughtModuleErrorBecomesEvent() throws Exception {
        ScriptedEngine engine = new ScriptedEngine()
                .script(A, uncaught("top-level boom"))
                .script(B, passing("b"));
        new Dispatcher(engine, 1, null, true, false).run(plan(A, B), channel, FailFastTracker.disabled(), token);
        List<TestEvent> events = drain();
        List<TestEvent.UncaughtError> errors = new ArrayList<>();
        for (TestEvent event : events) {
            if (event instanceof TestEvent.UncaughtError u) {
                errors.add(u);
            }
        }
        assertEquals(1, errors.size());
        assertEquals(A, errors.get(0).origin());
        assertEquals("top-level boom", errors.get(0).error().message());
        assertEquals(List.of(A, B), engine.getStarted());
    }

    @Test
    void testInfrastructureFailureRaisedAfterOtherModules() throws Exception {
        ScriptedEngine engine = new ScriptedEngine()
                .script(A, (e, uri, sender, options) -> {
                    throw new IllegalStateException("engine broke");
                })
                .script(B, passing("b"));
        Dispatcher dispatcher = new Dispatcher(engine, 1, null, true, false);
        TestRunException e = assertThrows(TestRunException.class,
                () -> dispatcher.run(plan(A, B), channel, FailFastTracker.disabled(), token));
        assertTrue(e.getMessage().contains("engine broke"));
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertNull(e.getOutcome());
        assertEquals(List.of(A, B), engine.getStarted());
        assertTrue(channel.isClosed());
        assertEquals(Set.of(B), origins(drain()));
        assertEquals(Set.of(A, B), new HashSet<>(engine.getClosed()));
    }

    @Test
    void testModuleOptionsCarryFilterAndSettings() {
        TestModule module = new TestModule(A, "1")
                .add(TestDefinition.root("t1", "keep", null))
                .add(TestDefinition.root("t2", "drop", null));
        RunPlan plan = RunPlanner.compute(RunRequest.of(1, null, List.of(TestIdentifier.test(A, "t2"))), Map.of(A, module));
        ScriptedEngine engine = new ScriptedEngine().script(A, passing("keep", "drop"));
        new Dispatcher(engine, 1, 7L, false, true).run(plan, channel, FailFastTracker.disabled(), token);
        ModuleOptions options = engine.getOptions(A);
        assertEquals(7L, options.shuffle());
        assertFalse(options.traceOps());
        assertTrue(options.debug());
        assertEquals(Set.of("drop"), options.filter().exclude());
        assertNull(options.filter().include());
    }

    @Test
    void testConcurrencyMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new Dispatcher(new ScriptedEngine(), 0, null, true, false));
    }

}
