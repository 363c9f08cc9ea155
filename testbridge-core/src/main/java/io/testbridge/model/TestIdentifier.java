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
package io.testbridge.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire-level test identifier. A null id addresses the whole module, a null stepId addresses a
 * top-level test.
 */
public record TestIdentifier(String moduleUri, String id, String stepId) {

    public static TestIdentifier module(String moduleUri) {
        return new TestIdentifier(moduleUri, null, null);
    }

    public static TestIdentifier test(String moduleUri, String id) {
        return new TestIdentifier(moduleUri, id, null);
    }

    public static TestIdentifier step(String moduleUri, String id, String stepId) {
        return new TestIdentifier(moduleUri, id, stepId);
    }

    @SuppressWarnings("unchecked")
    public static TestIdentifier fromMap(Map<String, Object> map) {
        Object textDocument = map.get("textDocument");
        String uri;
        if (textDocument instanceof Map) {
            uri = (String) ((Map<String, Object>) textDocument).get("uri");
        } else {
            uri = (String) map.get("moduleUri");
        }
        if (uri == null) {
            throw new IllegalArgumentException("test identifier without module uri: " + map);
        }
        return new TestIdentifier(uri, (String) map.get("id"), (String) map.get("stepId"));
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        Map<String, Object> textDocument = new LinkedHashMap<>();
        textDocument.put("uri", moduleUri);
        map.put("textDocument", textDocument);
        if (id != null) {
            map.put("id", id);
        }
        if (stepId != null) {
            map.put("stepId", stepId);
        }
        return map;
    }

}
