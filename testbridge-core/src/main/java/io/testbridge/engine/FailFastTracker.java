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

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts failures across all modules of a run and reports when the configured maximum is reached.
 * Once tripped it stays tripped for the run.
 */
public class FailFastTracker {

    private final Integer maxCount;
    private final AtomicInteger failures = new AtomicInteger();

    /**
     * @param maxCount failures after which no further module may start, or null to never stop
     */
    public FailFastTracker(Integer maxCount) {
        if (maxCount != null && maxCount < 1) {
            throw new IllegalArgumentException("fail-fast count must be at least 1: " + maxCount);
        }
        this.maxCount = maxCount;
    }

    public static FailFastTracker disabled() {
        return new FailFastTracker(null);
    }

    /**
     * Record one failure.
     *
     * @return true if the run should now stop
     */
    public boolean addFailure() {
        int count = failures.incrementAndGet();
        return maxCount != null && count >= maxCount;
    }

    public boolean shouldStop() {
        return maxCount != null && failures.get() >= maxCount;
    }

    public int getFailureCount() {
        return failures.get();
    }

    public boolean isEnabled() {
        return maxCount != null;
    }

}
