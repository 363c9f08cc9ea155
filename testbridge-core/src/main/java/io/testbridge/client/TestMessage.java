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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A failure message shown in the editor, in plain text or markdown.
 */
public record TestMessage(boolean markdown, String value) {

    public static List<TestMessage> of(String message, boolean markdown) {
        return List.of(new TestMessage(markdown, message));
    }

    public Map<String, Object> toJson() {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("kind", markdown ? "markdown" : "plaintext");
        content.put("value", value);
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("message", content);
        return map;
    }

}
