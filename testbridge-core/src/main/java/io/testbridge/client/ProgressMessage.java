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
package io.testbridge.client;

import io.testbridge.model.TestIdentifier;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The body of a run progress notification.
 */
public sealed interface ProgressMessage permits
        ProgressMessage.Enqueued,
        ProgressMessage.Started,
        ProgressMessage.Output,
        ProgressMessage.Passed,
        ProgressMessage.Skipped,
        ProgressMessage.Failed,
        ProgressMessage.End {

    String type();

    Map<String, Object> toJson();

    record Enqueued(String moduleUri, List<String> ids) implements ProgressMessage {

        public Enqueued {
            ids = List.copyOf(ids);
        }

        @Override
        public String type() {
            return "enqueued";
        }

        @Override
        public Map<String, Object> toJson() {
            Map<String, Object> map = envelope(this);
            map.put("moduleUri", moduleUri);
            map.put("ids", ids);
            return map;
        }
    }

    record Started(TestIdentifier test) implements ProgressMessage {

        @Override
        public String type() {
            return "started";
        }

        @Override
        public Map<String, Object> toJson() {
            Map<String, Object> map = envelope(this);
            map.put("test", test.toJson());
            return map;
        }
    }

    /**
     * @param test     the test the output is attributed to, or null
     * @param location always null for now
     */
    record Output(String value, TestIdentifier test, String location) implements ProgressMessage {

        @Override
        public String type() {
            return "output";
        }

        @Override
        public Map<String, Object> toJson() {
            Map<String, Object> map = envelope(this);
            map.put("value", value);
            if (test != null) {
                map.put("test", test.toJson());
            }
            if (location != null) {
                map.put("location", location);
            }
            return map;
        }
    }

    record Passed(TestIdentifier test, Long duration) implements ProgressMessage {

        @Override
        public String type() {
            return "passed";
        }

        @Override
        public Map<String, Object> toJson() {
            Map<String, Object> map = envelope(this);
            map.put("test", test.toJson());
            if (duration != null) {
                map.put("duration", duration);
            }
            return map;
        }
    }

    record Skipped(TestIdentifier test) implements ProgressMessage {

        @Override
        public String type() {
            return "skipped";
        }

        @Override
        public Map<String, Object> toJson() {
            Map<String, Object> map = envelope(this);
            map.put("test", test.toJson());
            return map;
        }
    }

    record Failed(TestIdentifier test, List<TestMessage> messages, Long duration) implements ProgressMessage {

        public Failed {
            messages = List.copyOf(messages);
        }

        @Override
        public String type() {
            return "failed";
        }

        @Override
        public Map<String, Object> toJson() {
            Map<String, Object> map = envelope(this);
            map.put("test", test.toJson());
            List<Map<String, Object>> list = new ArrayList<>(messages.size());
            for (TestMessage message : messages) {
                list.add(message.toJson());
            }
            map.put("messages", list);
            if (duration != null) {
                map.put("duration", duration);
            }
            return map;
        }
    }

    /**
     * Last message of every run.
     *
     * @param message the failure reason, null when passed
     */
    record End(boolean passed, String message) implements ProgressMessage {

        @Override
        public String type() {
            return "end";
        }

        @Override
        public Map<String, Object> toJson() {
            Map<String, Object> map = envelope(this);
            map.put("passed", passed);
            if (message != null) {
                map.put("message", message);
            }
            return map;
        }
    }

    private static Map<String, Object> envelope(ProgressMessage message) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", message.type());
        return map;
    }

}
