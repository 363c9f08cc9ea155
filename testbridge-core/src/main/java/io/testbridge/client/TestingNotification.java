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

import io.testbridge.model.TestData;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Notifications sent to the editor client.
 */
public sealed interface TestingNotification permits
        TestingNotification.Module,
        TestingNotification.Progress {

    String method();

    Map<String, Object> toJson();

    enum ModuleKind {
        INSERT,
        REPLACE
    }

    /**
     * Tests discovered or changed for one module.
     */
    record Module(String moduleUri, ModuleKind kind, String label, List<TestData> tests) implements TestingNotification {

        public Module {
            tests = List.copyOf(tests);
        }

        @Override
        public String method() {
            return "testing/module";
        }

        @Override
        public Map<String, Object> toJson() {
            Map<String, Object> map = new LinkedHashMap<>();
            Map<String, Object> textDocument = new LinkedHashMap<>();
            textDocument.put("uri", moduleUri);
            map.put("textDocument", textDocument);
            map.put("kind", kind.name().toLowerCase());
            map.put("label", label);
            List<Map<String, Object>> list = new ArrayList<>(tests.size());
            for (TestData test : tests) {
                list.add(test.toJson());
            }
            map.put("tests", list);
            return map;
        }
    }

    record Progress(int runId, ProgressMessage message) implements TestingNotification {

        @Override
        public String method() {
            return "testing/progress";
        }

        @Override
        public Map<String, Object> toJson() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("id", runId);
            map.put("message", message.toJson());
            return map;
        }
    }

}
