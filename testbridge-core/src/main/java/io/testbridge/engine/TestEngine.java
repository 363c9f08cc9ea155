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

import java.util.List;

/**
 * The engine that actually executes test code.
 * <p>
 * Implementations are looked up with {@link java.util.ServiceLoader} by the command line and
 * passed in directly by embedders.
 */
public interface TestEngine {

    /**
     * Load and check every module before any of them runs.
     *
     * @throws EnginePreparationException if any module cannot be prepared
     */
    void checkAndPrepare(List<String> moduleUris);

    ExecutionContextFactory getContextFactory();

    /**
     * @return the permissions every module starts from; forked once per module
     */
    ModulePermissions getPermissions();

    /**
     * Run the tests of one module, sending every lifecycle event to {@code sender}. Called on a
     * dispatcher thread; calls for different modules may overlap.
     *
     * @throws UncaughtModuleException if module code failed outside any test
     */
    void runModule(ExecutionContext context, ModulePermissions permissions, String moduleUri,
                   TestEventSender sender, FailFastTracker tracker, ModuleOptions options);

}
