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

import io.testbridge.log.LogContext;
import io.testbridge.model.RunRequest;
import io.testbridge.model.TestDefinition;
import io.testbridge.model.TestIdentifier;
import io.testbridge.model.TestModule;
import org.slf4j.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Turns a run request into the set of modules to execute and the per-module filters. Unknown
 * modules and test ids are silently left out.
 */
public final class RunPlanner {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private RunPlanner() {
    }

    public static RunPlan compute(RunRequest request, Map<String, TestModule> modules) {
        SortedSet<String> queue = new TreeSet<>();
        Map<String, TestFilter> filters = new HashMap<>();

        if (request.include() != null) {
            for (TestIdentifier item : request.include()) {
                TestModule module = modules.get(item.moduleUri());
                if (module == null) {
                    logger.debug("run {}: include of unknown module {}", request.id(), item.moduleUri());
                    continue;
                }
                queue.add(item.moduleUri());
                if (item.id() != null) {
                    TestDefinition def = module.get(item.id());
                    if (def != null) {
                        filters.computeIfAbsent(item.moduleUri(), k -> new TestFilter()).include(def);
                    }
                }
            }
        } else {
            queue.addAll(modules.keySet());
        }

        for (TestIdentifier item : request.exclude()) {
            TestModule module = modules.get(item.moduleUri());
            if (module == null) {
                continue;
            }
            if (item.id() == null) {
                queue.remove(item.moduleUri());
            } else if (item.stepId() == null) {
                TestDefinition def = module.get(item.id());
                if (def != null) {
                    filters.computeIfAbsent(item.moduleUri(), k -> new TestFilter()).exclude(def);
                }
            }
            // steps cannot be excluded, only whole tests
        }

        queue.removeIf(uri -> modules.get(uri).isEmpty());
        logger.debug("run {}: planned {} module(s)", request.id(), queue.size());
        return new RunPlan(queue, filters);
    }

}
