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
import io.testbridge.client.TestingClient;
import io.testbridge.client.TestingNotification;
import io.testbridge.common.Json;
import io.testbridge.engine.TestDescription;
import io.testbridge.engine.TestStepDescription;
import io.testbridge.log.LogContext;
import io.testbridge.model.TestData;
import io.testbridge.model.TestInventory;
import io.testbridge.model.TestModule;
import org.slf4j.Logger;

import java.util.List;

/**
 * Turns registrations and progress into editor notifications for one run.
 * <p>
 * Registrations update the shared inventory under its lock; the resulting module notification is
 * sent only after the lock is released.
 */
public class TestReporter {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;
    private static final Logger protocol = LogContext.PROTOCOL_LOGGER;

    private final int runId;
    private final TestInventory inventory;
    private final TestingClient client;
    private final String rootUri;
    private final IdentityResolver resolver;

    private record Pending(String stableId, TestingNotification.Module notification) {
    }

    public TestReporter(int runId, TestInventory inventory, TestingClient client, String rootUri, IdentityResolver resolver) {
        this.runId = runId;
        this.inventory = inventory;
        this.client = client;
        this.rootUri = rootUri;
        this.resolver = resolver;
    }

    public IdentityResolver getResolver() {
        return resolver;
    }

    public void reportRegister(TestDescription desc) {
        Pending pending = inventory.withLock(modules -> {
            TestModule module = modules.computeIfAbsent(desc.origin(), uri -> new TestModule(uri, "1"));
            TestModule.Registration reg = module.registerDynamic(desc);
            return new Pending(reg.stableId(), reg.isNew() ? insert(module, reg.stableId()) : null);
        });
        resolver.register(desc.id(), new IdentityResolver.Entry(desc.origin(), desc.name(), null, pending.stableId()));
        if (pending.notification() != null) {
            send(pending.notification());
        }
    }

    public void reportStepRegister(TestStepDescription desc) {
        IdentityResolver.Entry parent = resolver.get(desc.parentId());
        if (parent == null) {
            logger.debug("dropping step '{}' ({}): parent {} not registered", desc.name(), desc.id(), desc.parentId());
            return;
        }
        IdentityResolver.Entry root = resolver.get(resolver.rootIdOf(desc.parentId()));
        Pending pending = inventory.withLock(modules -> {
            TestModule module = modules.computeIfAbsent(desc.origin(), uri -> new TestModule(uri, "1"));
            TestModule.Registration reg = module.registerStepDynamic(desc, parent.stableId());
            return new Pending(reg.stableId(), reg.isNew() ? insert(module, root.stableId()) : null);
        });
        resolver.register(desc.id(), new IdentityResolver.Entry(desc.origin(), desc.name(), desc.parentId(), pending.stableId()));
        if (pending.notification() != null) {
            send(pending.notification());
        }
    }

    private TestingNotification.Module insert(TestModule module, String stableId) {
        TestData data = module.getTestData(stableId);
        List<TestData> tests = data == null ? List.of() : List.of(data);
        return new TestingNotification.Module(module.getModuleUri(), TestingNotification.ModuleKind.INSERT,
                module.label(rootUri), tests);
    }

    public void progress(ProgressMessage message) {
        send(new TestingNotification.Progress(runId, message));
    }

    private void send(TestingNotification notification) {
        if (protocol.isTraceEnabled()) {
            protocol.trace("{} {}", notification.method(), Json.stringifyStrict(notification.toJson()));
        }
        client.sendTestNotification(notification);
    }

}
