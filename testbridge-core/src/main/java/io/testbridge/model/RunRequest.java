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

import io.testbridge.common.Json;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * An editor request to execute tests.
 *
 * @param id      client-assigned run id, echoed on every progress notification
 * @param kind    run or debug
 * @param include tests or modules to run, or null to run everything known
 * @param exclude tests or modules to leave out, never null
 */
public record RunRequest(int id, RunKind kind, List<TestIdentifier> include, List<TestIdentifier> exclude) {

    public RunRequest {
        kind = kind == null ? RunKind.RUN : kind;
        include = include == null ? null : List.copyOf(include);
        exclude = exclude == null ? Collections.emptyList() : List.copyOf(exclude);
    }

    public static RunRequest of(int id, List<TestIdentifier> include, List<TestIdentifier> exclude) {
        return new RunRequest(id, RunKind.RUN, include, exclude);
    }

    public static RunRequest parse(String json) {
        Json j = Json.of(json);
        if (!j.isObject()) {
            throw new IllegalArgumentException("invalid run request: expected JSON object");
        }
        return fromMap(j.asMap());
    }

    @SuppressWarnings("unchecked")
    public static RunRequest fromMap(Map<String, Object> map) {
        Object id = map.get("id");
        if (!(id instanceof Number)) {
            throw new IllegalArgumentException("invalid run request: missing numeric id");
        }
        RunKind kind = RunKind.fromString((String) map.get("kind"));
        List<TestIdentifier> include = null;
        if (map.get("include") instanceof List<?> list) {
            include = toIdentifiers((List<Object>) list);
        }
        List<TestIdentifier> exclude = null;
        if (map.get("exclude") instanceof List<?> list) {
            exclude = toIdentifiers((List<Object>) list);
        }
        return new RunRequest(((Number) id).intValue(), kind, include, exclude);
    }

    @SuppressWarnings("unchecked")
    private static List<TestIdentifier> toIdentifiers(List<Object> list) {
        List<TestIdentifier> result = new ArrayList<>(list.size());
        for (Object o : list) {
            result.add(TestIdentifier.fromMap((Map<String, Object>) o));
        }
        return result;
    }

}
