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

import java.util.function.Consumer;

/**
 * The sink an engine sends one module's events to. Failed or cancelled results and uncaught
 * errors are counted in the run's {@link FailFastTracker} as they are sent. Step results are not
 * counted, a failed step reaches the tracker through its test's result.
 */
public class TestEventSender {

    private final Consumer<TestEvent> sink;
    private final FailFastTracker tracker;

    public TestEventSender(Consumer<TestEvent> sink, FailFastTracker tracker) {
        this.sink = sink;
        this.tracker = tracker;
    }

    public void send(TestEvent event) {
        if (isFailure(event)) {
            tracker.addFailure();
        }
        sink.accept(event);
    }

    private static boolean isFailure(TestEvent event) {
        if (event instanceof TestEvent.Result r) {
            return r.result().isFailure();
        }
        return event instanceof TestEvent.UncaughtError;
    }

}
