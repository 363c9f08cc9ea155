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

import java.util.Collections;
import java.util.Set;

/**
 * The filter handed to the engine. Engines select tests by name, not by stable id.
 *
 * @param include names to run, or null to run every test not excluded
 * @param exclude names to skip
 */
public record NameFilter(Set<String> include, Set<String> exclude) {

    public NameFilter {
        include = include == null ? null : Set.copyOf(include);
        exclude = exclude == null ? Collections.emptySet() : Set.copyOf(exclude);
    }

    public static NameFilter all() {
        return new NameFilter(null, null);
    }

    public boolean matches(String name) {
        if (include != null && !include.contains(name)) {
            return false;
        }
        return !exclude.contains(name);
    }

}
