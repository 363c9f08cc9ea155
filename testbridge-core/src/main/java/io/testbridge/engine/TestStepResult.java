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

public record TestStepResult(Status status, TestFailure failure) {

    public enum Status {
        OK,
        IGNORED,
        FAILED
    }

    private static final TestStepResult OK = new TestStepResult(Status.OK, null);
    private static final TestStepResult IGNORED = new TestStepResult(Status.IGNORED, null);

    public static TestStepResult ok() {
        return OK;
    }

    public static TestStepResult ignored() {
        return IGNORED;
    }

    public static TestStepResult failed(TestFailure failure) {
        return new TestStepResult(Status.FAILED, failure);
    }

    public boolean isFailure() {
        return status == Status.FAILED;
    }

}
