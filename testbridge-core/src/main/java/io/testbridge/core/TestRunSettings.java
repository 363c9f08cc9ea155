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

import io.testbridge.engine.TestEngine;

/**
 * How a run executes: the engine plus dispatch and engine options. Immutable, built with
 * {@link #builder(TestEngine)}.
 */
public class TestRunSettings {

    private final TestEngine engine;
    private final int concurrency;
    private final Integer failFast;
    private final Long shuffle;
    private final boolean traceOps;
    private final String rootUri;

    private TestRunSettings(Builder builder) {
        this.engine = builder.engine;
        this.concurrency = builder.concurrency;
        this.failFast = builder.failFast;
        this.shuffle = builder.shuffle;
        this.traceOps = builder.traceOps;
        this.rootUri = builder.rootUri;
    }

    public static Builder builder(TestEngine engine) {
        return new Builder(engine);
    }

    public TestEngine getEngine() {
        return engine;
    }

    public int getConcurrency() {
        return concurrency;
    }

    /**
     * @return failures after which no further module starts, or null when fail-fast is off
     */
    public Integer getFailFast() {
        return failFast;
    }

    public Long getShuffle() {
        return shuffle;
    }

    public boolean isTraceOps() {
        return traceOps;
    }

    public String getRootUri() {
        return rootUri;
    }

    // ========== Builder ==========

    public static class Builder {

        private final TestEngine engine;
        private int concurrency = 1;
        private Integer failFast;
        private Long shuffle;
        private boolean traceOps = true;
        private String rootUri;

        Builder(TestEngine engine) {
            if (engine == null) {
                throw new IllegalArgumentException("engine is required");
            }
            this.engine = engine;
        }

        /**
         * Maximum number of modules executing at once.
         */
        public Builder concurrency(int value) {
            if (value < 1) {
                throw new IllegalArgumentException("concurrency must be at least 1: " + value);
            }
            this.concurrency = value;
            return this;
        }

        /**
         * Stop starting modules after this many failures; null disables fail-fast.
         */
        public Builder failFast(Integer value) {
            if (value != null && value < 1) {
                throw new IllegalArgumentException("fail-fast count must be at least 1: " + value);
            }
            this.failFast = value;
            return this;
        }

        public Builder shuffle(Long seed) {
            this.shuffle = seed;
            return this;
        }

        public Builder traceOps(boolean value) {
            this.traceOps = value;
            return this;
        }

        /**
         * Workspace root, used to label modules relative to it.
         */
        public Builder rootUri(String value) {
            this.rootUri = value;
            return this;
        }

        public TestRunSettings build() {
            return new TestRunSettings(this);
        }
    }

}
