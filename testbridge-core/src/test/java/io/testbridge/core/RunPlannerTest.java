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

import io.testbridge.model.RunRequest;
import io.testbridge.model.TestDefinition;
import io.testbridge.model.TestIdentifier;
import io.testbridge.model.TestModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RunPlannerTest {

    static final String A = "file:///project/a_test.ts";
    static final String B = "file:///project/b_test.ts";
    static final String EMPTY = "file:///project/empty_test.ts";

    Map<String, TestModule> modules;

    @BeforeEach
    void beforeEach() {
        modules = new LinkedHashMap<>();
        TestModule a = new TestModule(A, "1")
                .add(TestDefinition.root("t1", "first", null))
                .add(TestDefinition.root("t2", "second", null))
                .add(new TestDefinition("s1", "step", null, false, "t1"));
        modules.put(A, a);
        modules.put(B, new TestModule(B, "1").add(TestDefinition.root("t3", "third", null)));
    }

    @Test
    void testIncludeWholeModule() {
        RunRequest request = RunRequest.of(1, List.of(TestIdentifier.module(A)), List.of());
        RunPlan plan = RunPlanner.compute(request, modules);
        assertEquals(List.of(A), List.copyOf(plan.queue()));
        assertEquals(List.of("t1", "t2"), plan.filterFor(A).asIds(modules.get(A)));
        assertNull(plan.filterFor(A).getInclude());
    }

    @Test
    void testExcludeSingleTest() {
        RunRequest request = RunRequest.of(1, null, List.of(TestIdentifier.test(A, "t1")));
        RunPlan plan = RunPlanner.compute(request, modules);
        assertEquals(List.of(A, B), List.copyOf(plan.queue()));
        assertEquals(List.of("t1"), List.copyOf(plan.filters().get(A).getExclude().keySet()));
        assertEquals(List.of("t2"), plan.filterFor(A).asIds(modules.get(A)));
        assertFalse(plan.filters().containsKey(B));
        assertEquals(List.of("t3"), plan.filterFor(B).asIds(modules.get(B)));
    }

    @Test
    void testNoIncludeRunsEveryNonEmptyModule() {
        modules.put(EMPTY, new TestModule(EMPTY, "1"));
        RunPlan plan = RunPlanner.compute(RunRequest.of(1, null, List.of()), modules);
        assertEquals(List.of(A, B), List.copyOf(plan.queue()));
    }

    @Test
    void testEmptyModuleNeverQueuedEvenWhenRequested() {
        modules.put(EMPTY, new TestModule(EMPTY, "1"));
        RunRequest request = RunRequest.of(1, List.of(TestIdentifier.module(EMPTY)), List.of());
        RunPlan plan = RunPlanner.compute(request, modules);
        assertTrue(plan.queue().isEmpty());
    }

    @Test
    void testWholeModuleExcludeOverridesInclude() {
        RunRequest request = RunRequest.of(1,
                List.of(TestIdentifier.test(A, "t1"), TestIdentifier.module(B)),
                List.of(TestIdentifier.module(A)));
        RunPlan plan = RunPlanner.compute(request, modules);
        assertEquals(List.of(B), List.copyOf(plan.queue()));
    }

    @Test
    void testIncludesAccumulate() {
        RunRequest request = RunRequest.of(1,
                List.of(TestIdentifier.test(A, "t2"), TestIdentifier.test(A, "t1")),
                List.of());
        RunPlan plan = RunPlanner.compute(request, modules);
        assertEquals(List.of("t2", "t1"), plan.filterFor(A).asIds(modules.get(A)));
        assertEquals(2, plan.filterFor(A).getInclude().size());
    }

    @Test
    void testStepExcludeIgnored() {
        RunRequest request = RunRequest.of(1, null, List.of(TestIdentifier.step(A, "t1", "s1")));
        RunPlan plan = RunPlanner.compute(request, modules);
        assertFalse(plan.filters().containsKey(A));
        assertEquals(List.of("t1", "t2"), plan.filterFor(A).asIds(modules.get(A)));
    }

    @Test
    void testUnknownModulesAndIdsOmitted() {
        RunRequest request = RunRequest.of(1,
                List.of(TestIdentifier.module("file:///project/missing.ts"), TestIdentifier.test(A, "nope")),
                List.of(TestIdentifier.test(B, "nope"), TestIdentifier.module("file:///project/other.ts")));
        RunPlan plan = RunPlanner.compute(request, modules);
        assertEquals(List.of(A), List.copyOf(plan.queue()));
        assertNull(plan.filterFor(A).getInclude());
        assertFalse(plan.filters().containsKey(B));
    }

    @Test
    void testQueueIsSorted() {
        RunRequest request = RunRequest.of(1, List.of(TestIdentifier.module(B), TestIdentifier.module(A)), List.of());
        RunPlan plan = RunPlanner.compute(request, modules);
        assertEquals(List.of(A, B), List.copyOf(plan.queue()));
    }

}
