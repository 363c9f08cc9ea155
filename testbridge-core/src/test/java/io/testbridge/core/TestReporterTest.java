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

import io.testbridge.client.ProgressMessage;
import io.testbridge.client.RecordingClient;
import io.testbridge.client.TestingNotification;
import io.testbridge.engine.TestDescription;
import io.testbridge.engine.TestStepDescription;
import io.testbridge.model.TestData;
import io.testbridge.model.TestIdentifier;
import io.testbridge.model.TestInventory;
import io.testbridge.model.TestModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TestReporterTest {

    static final String ROOT = "file:///project/";
    static final String A = "file:///project/a_test.ts";

    TestInventory inventory;
    RecordingClient client;
    IdentityResolver resolver;
    TestReporter reporter;

    @BeforeEach
    void beforeEach() {
        inventory = new TestInventory();
        client = new RecordingClient();
        resolver = new IdentityResolver();
        reporter = new TestReporter(5, inventory, client, ROOT, resolver);
    }

    @Test
    void testRegisterCreatesMissingModule() {
        reporter.reportRegister(TestDescription.of(1, "adds", A));
        TestModule module = inventory.withLock(m -> m.get(A));
        assertNotNull(module);
        assertEquals("1", module.getScriptVersion());
        assertEquals(1, module.size());

        List<TestingNotification.Module> modules = client.modules();
        assertEquals(1, modules.size());
        TestingNotification.Module notification = modules.get(0);
        assertEquals(TestingNotification.ModuleKind.INSERT, notification.kind());
        assertEquals("a_test.ts", notification.label());
        assertEquals(1, notification.tests().size());
        assertEquals("adds", notification.tests().get(0).label());
        assertEquals(TestIdentifier.test(A, notification.tests().get(0).id()), resolver.identifierFor(1));
    }

    @Test
    void testSecondRegistrationOfSameTestSendsNothing() {
        reporter.reportRegister(TestDescription.of(1, "adds", A));
        reporter.reportRegister(TestDescription.of(2, "adds", A));
        assertEquals(1, client.modules().size());
        assertEquals(resolver.identifierFor(1), resolver.identifierFor(2));
    }

    @Test
    void testStepRegistrationSendsRootTree() {
        reporter.reportRegister(TestDescription.of(1, "outer", A));
        reporter.reportStepRegister(TestStepDescription.of(2, "inner", A, 1, 1, 1, "outer"));
        reporter.reportStepRegister(TestStepDescription.of(3, "deeper", A, 2, 2, 1, "outer"));
        List<TestingNotification.Module> modules = client.modules();
        assertEquals(3, modules.size());
        TestData tree = modules.get(2).tests().get(0);
        assertEquals("outer", tree.label());
        assertEquals("inner", tree.steps().get(0).label());
        assertEquals("deeper", tree.steps().get(0).steps().get(0).label());
        TestIdentifier deeper = resolver.identifierFor(3);
        assertEquals(tree.id(), deeper.id());
        assertEquals(tree.steps().get(0).steps().get(0).id(), deeper.stepId());
    }

    @Test
    void testStepWithUnknownParentDropped() {
        reporter.reportStepRegister(TestStepDescription.of(2, "orphan", A, 1, 99, 99, "gone"));
        assertTrue(client.getNotifications().isEmpty());
        assertFalse(resolver.isRegistered(2));
    }

    @Test
    void testNotificationsSentOutsideInventoryLock() {
        List<Boolean> lockFree = new ArrayList<>();
        TestReporter probing = new TestReporter(5, inventory, notification -> {
            // another thread must be able to take the inventory lock right now
            try {
                CompletableFuture.supplyAsync(inventory::size).get(5, TimeUnit.SECONDS);
                lockFree.add(true);
            } catch (Exception e) {
                lockFree.add(false);
            }
        }, ROOT, resolver);
        probing.reportRegister(TestDescription.of(1, "adds", A));
        probing.reportStepRegister(TestStepDescription.of(2, "step", A, 1, 1, 1, "adds"));
        assertEquals(List.of(true, true), lockFree);
    }

    @Test
    void testProgressCarriesRunId() {
        reporter.progress(new ProgressMessage.Skipped(TestIdentifier.test(A, "x")));
        TestingNotification.Progress progress = (TestingNotification.Progress) client.getNotifications().get(0);
        assertEquals(5, progress.runId());
        assertEquals("testing/progress", progress.method());
    }

}
