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

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The closed set of raw lifecycle events an engine emits while running a module.
 * <p>
 * Runtime ids are assigned by the engine and are unique within one run across all modules.
 * Consumers dispatch on {@link #kind()}; a switch expression over {@link Kind} is checked for
 * exhaustiveness by the compiler.
 */
public sealed interface TestEvent permits
        TestEvent.Register,
        TestEvent.Plan,
        TestEvent.Wait,
        TestEvent.Output,
        TestEvent.Result,
        TestEvent.StepRegister,
        TestEvent.StepWait,
        TestEvent.StepResult,
        TestEvent.UncaughtError,
        TestEvent.Sigint {

    enum Kind {
        REGISTER,
        PLAN,
        WAIT,
        OUTPUT,
        RESULT,
        STEP_REGISTER,
        STEP_WAIT,
        STEP_RESULT,
        UNCAUGHT_ERROR,
        SIGINT
    }

    Kind kind();

    /**
     * Serializes this event to a map for logging.
     */
    Map<String, Object> toJson();

    record Register(TestDescription description) implements TestEvent {

        @Override
        public Kind kind() {
            return Kind.REGISTER;
        }

        @Override
        public Map<String, Object> toJson() {
            Map<String, Object> map = envelope(this);
            map.put("id", description.id());
            map.put("name", description.name());
            map.put("origin", description.origin());
            return map;
        }
    }

    record Plan(TestPlan plan) implements TestEvent {

        @Override
        public Kind kind() {
            return Kind.PLAN;
        }

        @Override
        public Map<String, Object> toJson() {
            Map<String, Object> map = envelope(this);
            map.put("origin", plan.origin());
            map.put("total", plan.total());
            map.put("filteredOut", plan.filteredOut());
            map.put("usedOnly", plan.usedOnly());
            return map;
        }
    }

    record Wait(int id) implements TestEvent {

        @Override
        public Kind kind() {
            return Kind.WAIT;
        }

        @Override
        public Map<String, Object> toJson() {
            Map<String, Object> map = envelope(this);
            map.put("id", id);
            return map;
        }
    }

    record Output(byte[] bytes) implements TestEvent {

        public static Output of(String text) {
            return new Output(text.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public Kind kind() {
            return Kind.OUTPUT;
        }

        @Override
        public Map<String, Object> toJson() {
            Map<String, Object> map = envelope(this);
            map.put("length", bytes.length);
            return map;
        }
    }

    record Result(int id, TestResult result, long elapsedMillis) implements TestEvent {

        @Override
        public Kind kind() {
            return Kind.RESULT;
        }

        @Override
        public Map<String, Object> toJson() {
            Map<String, Object> map = envelope(this);
            map.put("id", id);
            map.put("status", result.status().name().toLowerCase());
            map.put("durationMillis", elapsedMillis);
            return map;
        }
    }

    record StepRegister(TestStepDescription description) implements TestEvent {

        @Override
        public Kind kind() {
            return Kind.STEP_REGISTER;
        }

        @Override
        public Map<String, Object> toJson() {
            Map<String, Object> map = envelope(this);
            map.put("id", description.id());
            map.put("name", description.name());
            map.put("parentId", description.parentId());
            map.put("level", description.level());
            return map;
        }
    }

    record StepWait(int id) implements TestEvent {

        @Override
        public Kind kind() {
            return Kind.STEP_WAIT;
        }

        @Override
        public Map<String, Object> toJson() {
            Map<String, Object> map = envelope(this);
            map.put("id", id);
            return map;
        }
    }

    record StepResult(int id, TestStepResult result, long elapsedMillis) implements TestEvent {

        @Override
        public Kind kind() {
            return Kind.STEP_RESULT;
        }

        @Override
        public Map<String, Object> toJson() {
            Map<String, Object> map = envelope(this);
            map.put("id", id);
            map.put("status", result.status().name().toLowerCase());
            map.put("durationMillis", elapsedMillis);
            return map;
        }
    }

    record UncaughtError(String origin, TestError error) implements TestEvent {

        @Override
        public Kind kind() {
            return Kind.UNCAUGHT_ERROR;
        }

        @Override
        public Map<String, Object> toJson() {
            Map<String, Object> map = envelope(this);
            map.put("origin", origin);
            map.put("message", error.message());
            return map;
        }
    }

    record Sigint() implements TestEvent {

        @Override
        public Kind kind() {
            return Kind.SIGINT;
        }

        @Override
        public Map<String, Object> toJson() {
            return envelope(this);
        }
    }

    private static Map<String, Object> envelope(TestEvent event) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", event.kind().name());
        return map;
    }

}
