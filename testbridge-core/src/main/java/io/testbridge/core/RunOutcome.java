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

/**
 * The verdict of a finished run.
 *
 * @param message why the run failed, null when it passed
 */
public record RunOutcome(TestSummary summary, boolean usedOnly, boolean passed, String message) {

    public static final String ONLY_USED_MESSAGE = "Test failed because the \"only\" option was used";
    public static final String FAILED_MESSAGE = "Test failed";

    public static RunOutcome of(TestSummary summary, boolean usedOnly) {
        if (usedOnly) {
            return new RunOutcome(summary, true, false, ONLY_USED_MESSAGE);
        }
        if (summary.hasFailed()) {
            return new RunOutcome(summary, false, false, FAILED_MESSAGE);
        }
        return new RunOutcome(summary, false, true, null);
    }

}
