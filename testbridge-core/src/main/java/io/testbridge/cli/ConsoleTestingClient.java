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
package io.testbridge.cli;

import io.testbridge.client.ProgressMessage;
import io.testbridge.client.TestMessage;
import io.testbridge.client.TestingClient;
import io.testbridge.client.TestingNotification;
import io.testbridge.core.RunOutcome;
import io.testbridge.core.TestSummary;
import io.testbridge.model.TestData;
import io.testbridge.model.TestIdentifier;

import java.util.HashMap;
import java.util.Map;

/**
 * Prints run progress for a terminal instead of sending it to an editor.
 */
public class ConsoleTestingClient implements TestingClient {

    private final Map<String, String> labels = new HashMap<>();
    private final Map<String, String> moduleLabels = new HashMap<>();

    @Override
    public synchronized void sendTestNotification(TestingNotification notification) {
        if (notification instanceof TestingNotification.Module module) {
            moduleLabels.put(module.moduleUri(), module.label());
            for (TestData data : module.tests()) {
                collectLabels(data);
            }
        } else if (notification instanceof TestingNotification.Progress progress) {
            print(progress.message());
        }
    }

    private void collectLabels(TestData data) {
        labels.put(data.id(), data.label());
        for (TestData step : data.steps()) {
            collectLabels(step);
        }
    }

    private void print(ProgressMessage message) {
        if (message instanceof ProgressMessage.Enqueued m) {
            Console.println(Console.enqueued(m.ids().size(), moduleLabel(m.moduleUri())));
        } else if (message instanceof ProgressMessage.Started m) {
            Console.println(Console.started(nameOf(m.test()), isStep(m.test())));
        } else if (message instanceof ProgressMessage.Output m) {
            Console.print(m.value().replace("\r\n", "\n"));
        } else if (message instanceof ProgressMessage.Passed m) {
            Console.println(Console.finished(nameOf(m.test()), isStep(m.test()), Console.Status.OK, m.duration()));
        } else if (message instanceof ProgressMessage.Skipped m) {
            Console.println(Console.finished(nameOf(m.test()), isStep(m.test()), Console.Status.IGNORED, null));
        } else if (message instanceof ProgressMessage.Failed m) {
            boolean step = isStep(m.test());
            Console.println(Console.finished(nameOf(m.test()), step, Console.Status.FAILED, m.duration()));
            for (TestMessage tm : m.messages()) {
                Console.failureDetail(tm.value(), step).forEach(Console::println);
            }
        } else if (message instanceof ProgressMessage.End m) {
            Console.println();
            Console.println(Console.verdict(m.passed(), m.message()));
        }
    }

    private String moduleLabel(String moduleUri) {
        return moduleLabels.getOrDefault(moduleUri, moduleUri);
    }

    private String nameOf(TestIdentifier test) {
        String id = test.stepId() != null ? test.stepId() : test.id();
        return labels.getOrDefault(id, id);
    }

    private static boolean isStep(TestIdentifier test) {
        return test.stepId() != null;
    }

    /**
     * Print the counters of a finished run.
     */
    public void printSummary(RunOutcome outcome, int concurrency) {
        TestSummary summary = outcome.summary();
        Console.println();
        Console.println(Console.frame());
        Console.println(String.format("elapsed: %6.2fs | concurrency: %3d",
                summary.getDurationMillis() / 1000.0, concurrency));
        String status = Console.failedCount(summary.getFailed());
        Console.println(String.format("tests: %6d | passed: %4d | ignored: %4d | %s",
                summary.getTotal(), summary.getPassed(), summary.getIgnored(), status));
        Console.println(String.format("steps passed: %d | failed: %d | ignored: %d | filtered out: %d",
                summary.getPassedSteps(), summary.getFailedSteps(), summary.getIgnoredSteps(), summary.getFilteredOut()));
        Console.println(Console.frame());
        if (!summary.getFailures().isEmpty() || !summary.getUncaughtErrors().isEmpty()) {
            Console.println();
            Console.println(Console.Status.FAILED.render() + " tests:");
            for (TestSummary.Failure f : summary.getFailures()) {
                Console.println("  " + moduleLabel(f.origin()) + " => " + f.name());
            }
            for (TestSummary.UncaughtFailure u : summary.getUncaughtErrors()) {
                Console.println("  " + moduleLabel(u.origin()) + " (uncaught error)");
            }
            Console.println();
        }
        if (!outcome.passed()) {
            Console.println(Console.verdict(false, outcome.message()));
        }
    }

}
