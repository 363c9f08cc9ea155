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
 * Zero-based line / character range inside a module, as the editor counts them.
 */
public record SourceRange(int startLine, int startCharacter, int endLine, int endCharacter) {

    public static SourceRange of(int startLine, int startCharacter, int endLine, int endCharacter) {
        return new SourceRange(startLine, startCharacter, endLine, endCharacter);
    }

    @SuppressWarnings("unchecked")
    public static SourceRange fromMap(Map<String, Object> map) {
        Map<String, Object> start = (Map<String, Object>) map.get("start");
        Map<String, Object> end = (Map<String, Object>) map.get("end");
        return new SourceRange(
                intValue(start, "line"), intValue(start, "character"),
                intValue(end, "line"), intValue(end, "character"));
    }

    private static int intValue(Map<String, Object> map, String key) {
        Object value = map == null ? null : map.get(key);
        return value instanceof Number n ? n.intValue() : 0;
    }

    public Map<String, Object> toJson() {
        Map<String, Object> start = new LinkedHashMap<>();
        start.put("line", startLine);
        start.put("character", startCharacter);
        Map<String, Object> end = new LinkedHashMap<>();
        end.put("line", endLine);
        end.put("character", endCharacter);
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("start", start);
        map.put("end", end);
        return map;
    }

}
