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
import io.testbridge.client.TestMessage;
import io.testbridge.engine.TestEvent;
import io.testbridge.engine.TestFailure;
import io.testbridge.engine.TestPlan;
import io.testbridge.engine.TestResult;
import io.testbridge.engine.TestStepResult;
import io.testbridge.log.LogContext;
import io.testbridge.model.TestIdentifier;
import org.slf4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * The single consumer of a run's event channel.
 * <p>
 * Events are handled strictly in arrival order. Each runtime id gets at most one terminal result;
 * later results for the same id are dropped. Once the channel closes the verdict is computed and
 * the summary reported.
 */
public class EventAggregator implements Callable<RunOutcome> {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    static final String UNCAUGHT_ERROR_FORMAT = "Uncaught error from %s: %s\n"
            + "This error was not caught from a test and caused the test runner to fail on the referenced module.\n"
            + "It most likely originated from a dangling promise, event/timeout handler or top-level code.";

    private final TestEventChannel channel;
    private final TestReporter reporter;
    private final IdentityResolver resolver;
    private final TestSummary summary = new TestSummary();
    private final Set<Integer> finished = new HashSet<>();
    private boolean usedOnly;

    public EventAggregator(TestEventChannel channel, TestReporter reporter) {
        this.channel = channel;
        this.reporter = reporter;
        this.resolver = reporter.getResolver();
    }

    @Override
    public RunOutcome call() throws InterruptedException {
        summary.setStartTime(System.currentTimeMillis());
        TestEvent event;
        while ((event = channel.receive()) != null) {
            handle(event);
        }
        summary.setEndTime(System.currentTimeMillis());
        RunOutcome outcome = RunOutcome.of(summary, usedOnly);
        logger.info("tests: {} | passed: {} | failed: {} | ignored: {} | filtered out: {} | steps passed: {} | steps failed: {} | steps ignored: {}",
                summary.getTotal(), summary.getPassed(), summary.getFailed(), summary.getIgnored(),
                summary.getFilteredOut(), summary.getPassedSteps(), summary.getFailedSteps(), summary.getIgnoredSteps());
        if (!outcome.passed()) {
            logger.info("{}", outcome.message());
        }
        return outcome;
    }

    public TestSummary getSummary() {
        return summary;
    }

    void handle(TestEvent event) {
        if (logger.isTraceEnabled()) {
            logger.trace("event: {}", event.toJson());
        }
        Runnable action = switch (event.kind()) {
            case REGISTER -> () -> reporter.reportRegister(((TestEvent.Register) event).description());
            case PLAN -> () -> onPlan(((TestEvent.Plan) event).plan());
            case WAIT -> () -> onWait(((TestEvent.Wait) event).id());
            case OUTPUT -> () -> onOutput(((TestEvent.Output) event).bytes());
            case RESULT -> () -> onResult((TestEvent.Result) event);
            case STEP_REGISTER -> () -> reporter.reportStepRegister(((TestEvent.StepRegister) event).description());
            case STEP_WAIT -> () -> onStepWait(((TestEvent.StepWait) event).id());
            case STEP_RESULT -> () -> onStepResult((TestEvent.StepResult) event);
            case UNCAUGHT_ERROR -> () -> onUncaughtError((TestEvent.UncaughtError) event);
            case SIGINT -> () -> logger.debug("ignoring interrupt signal event");
        };
        action.run();
    }

    private void onPlan(TestPlan plan) {
        summary.total += plan.total();
        summary.filteredOut += plan.filteredOut();
        if (plan.usedOnly()) {
            usedOnly = true;
        }
    }

    private void onWait(int id) {
        resolver.onWait(id);
        TestIdentifier test = resolver.identifierFor(id);
        if (test != null) {
            reporter.progress(new ProgressMessage.Started(test));
        }
    }

    private void onStepWait(int id) {
        resolver.onStepWait(id);
        TestIdentifier test = resolver.identifierFor(id);
        if (test != null) {
            reporter.progress(new ProgressMessage.Started(test));
        }
    }

    private void onOutput(byte[] bytes) {
        String value = new String(bytes, StandardCharsets.UTF_8).replace("\n", "\r\n");
        Integer current = resolver.getCurrent();
        TestIdentifier test = current == null ? null : resolver.identifierFor(current);
        reporter.progress(new ProgressMessage.Output(value, test, null));
    }

    private void onResult(TestEvent.Result event) {
        int id = event.id();
        if (!finished.add(id)) {
            logger.debug("dropping duplicate result for test {}", id);
            return;
        }
        TestResult result = event.result();
        switch (result.status()) {
            case OK -> summary.passed++;
            case IGNORED -> summary.ignored++;
            case FAILED -> {
                summary.failed++;
                IdentityResolver.Entry entry = resolver.get(id);
                summary.addFailure(new TestSummary.Failure(
                        entry == null ? null : entry.origin(), entry == null ? null : entry.name(), result.failure()));
            }
            case CANCELLED -> summary.failed++;
        }
        TestIdentifier test = resolver.identifierFor(id);
        if (test != null) {
            Long duration = event.elapsedMillis();
            ProgressMessage message = switch (result.status()) {
                case OK -> new ProgressMessage.Passed(test, duration);
                case IGNORED -> new ProgressMessage.Skipped(test);
                case FAILED -> new ProgressMessage.Failed(test, messagesFor(result.failure()), duration);
                case CANCELLED -> new ProgressMessage.Failed(test, List.of(), duration);
            };
            reporter.progress(message);
        } else {
            logger.debug("result for unregistered test {}", id);
        }
        resolver.onResult(id);
    }

    private void onStepResult(TestEvent.StepResult event) {
        int id = event.id();
        if (!finished.add(id)) {
            logger.debug("dropping duplicate result for step {}", id);
            return;
        }
        TestStepResult result = event.result();
        switch (result.status()) {
            case OK -> summary.passedSteps++;
            case IGNORED -> summary.ignoredSteps++;
            case FAILED -> summary.failedSteps++;
        }
        TestIdentifier test = resolver.identifierFor(id);
        if (test != null) {
            Long duration = event.elapsedMillis();
            ProgressMessage message = switch (result.status()) {
                case OK -> new ProgressMessage.Passed(test, duration);
                case IGNORED -> new ProgressMessage.Skipped(test);
                case FAILED -> new ProgressMessage.Failed(test, messagesFor(result.failure()), duration);
            };
            reporter.progress(message);
        } else {
            logger.debug("result for unregistered step {}", id);
        }
        resolver.onStepResult(id);
    }

    private void onUncaughtError(TestEvent.UncaughtError event) {
        summary.failed++;
        summary.addUncaughtError(new TestSummary.UncaughtFailure(event.origin(), event.error()));
        String message = String.format(UNCAUGHT_ERROR_FORMAT, event.origin(), event.error().format());
        List<TestMessage> messages = TestMessage.of(message, false);
        for (int id : resolver.idsForOrigin(event.origin())) {
            TestIdentifier test = resolver.identifierFor(id);
            reporter.progress(new ProgressMessage.Failed(test, messages, null));
        }
        resolver.clearCurrent();
    }

    private static List<TestMessage> messagesFor(TestFailure failure) {
        return TestMessage.of(failure == null ? "Unknown failure" : failure.toString(), false);
    }

}
