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

/**
 * Why a test or step failed.
 */
public record TestFailure(Kind kind, TestError error, int count, String details) {

    public enum Kind {
        ERROR,
        FAILED_STEPS,
        INCOMPLETE_STEPS,
        INCOMPLETE,
        LEAKED
    }

    public static TestFailure error(TestError error) {
        return new TestFailure(Kind.ERROR, error, 0, null);
    }

    public static TestFailure failedSteps(int count) {
        return new TestFailure(Kind.FAILED_STEPS, null, count, null);
    }

    public static TestFailure incompleteSteps() {
        return new TestFailure(Kind.INCOMPLETE_STEPS, null, 0, null);
    }

    public static TestFailure incomplete() {
        return new TestFailure(Kind.INCOMPLETE, null, 0, null);
    }

    public static TestFailure leaked(String details) {
        return new TestFailure(Kind.LEAKED, null, 0, details);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ERROR -> error == null ? "Unknown error" : error.format();
            case FAILED_STEPS -> count == 1 ? "1 test step failed." : count + " test steps failed.";
            case INCOMPLETE_STEPS -> "Completed while steps were still running. Ensure all steps are awaited with `await t.step(...)`.";
            case INCOMPLETE -> "Didn't complete before parent. Await step with `await t.step(...)`.";
            case LEAKED -> "Leaking async ops:\n" + details;
        };
    }

}
