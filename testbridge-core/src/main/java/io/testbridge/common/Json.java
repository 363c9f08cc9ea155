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
package io.testbridge.common;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;
import net.minidev.json.JSONStyle;
import net.minidev.json.JSONValue;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public class Json {

    private final DocumentContext doc;
    private final boolean array;
    private final boolean object;
    private final String prefix;

    private String prefix(String path) {
        return path.charAt(0) == '$' ? path : prefix + path;
    }

    public static Json of(Object any) {
        if (any == null) {
            throw new IllegalArgumentException("input must not be null");
        }
        if (any instanceof String s) {
            if (s.isBlank()) {
                throw new IllegalArgumentException("input string must not be empty or blank");
            }
            return new Json(JsonPath.parse(parseLenient(s)));
        } else if (any instanceof List || any instanceof Map) {
            return new Json(JsonPath.parse(any));
        } else {
            String json = JSONValue.toJSONString(any);
            return new Json(JsonPath.parse(json));
        }
    }

    public static Object parseLenient(String json) {
        if (json == null || json.isBlank()) {
            throw new RuntimeException("invalid json: input is null or blank");
        }
        try {
            Object result = JSONValue.parseKeepingOrder(json);
            if (!isMapOrList(result)) {
                throw new RuntimeException("invalid json: not a JSON object or array");
            }
            return result;
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("invalid json: " + e.getMessage(), e);
        }
    }

    public static boolean isMapOrList(Object o) {
        return o instanceof Map || o instanceof List;
    }

    private Json(DocumentContext doc) {
        this.doc = doc;
        array = (doc.json() instanceof List);
        object = (doc.json() instanceof Map);
        prefix = array ? "$" : "$.";
    }

    public <T> T get(String path) {
        return doc.read(prefix(path));
    }

    public <T> Optional<T> getOptional(String path) {
        try {
            return Optional.ofNullable(get(path));
        } catch (PathNotFoundException e) {
            return Optional.empty();
        }
    }

    public boolean pathExists(String path) {
        try {
            Object temp = doc.read(prefix(path));
            return temp != null;
        } catch (PathNotFoundException pnfe) {
            return false;
        }
    }

    public boolean isArray() {
        return array;
    }

    public boolean isObject() {
        return object;
    }

    public <T> T value() {
        return doc.read("$");
    }

    public List<Object> asList() {
        return value();
    }

    public Map<String, Object> asMap() {
        return value();
    }

    @Override
    public String toString() {
        return doc.jsonString();
    }

    private static final JSONStyle JSON_STYLE = new JSONStyle(JSONStyle.FLAG_PROTECT_4WEB);

    public static String stringifyStrict(Object o) {
        if (o instanceof Map || o instanceof List) {
            return JSONValue.toJSONString(o, JSON_STYLE);
        } else {
            return o == null ? "" : o.toString();
        }
    }

}
