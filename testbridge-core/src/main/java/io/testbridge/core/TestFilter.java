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

import io.testbridge.engine.NameFilter;
import io.testbridge.model.TestDefinition;
import io.testbridge.model.TestModule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-module selection of tests, by stable id.
 * <p>
 * An inclusion set, when present, is the union of every include entry naming a test of the
 * module. The exclusion set only ever holds whole tests: steps cannot be excluded.
 */
public class TestFilter {

    private Map<String, TestDefinition> include;
    private final Map<String, TestDefinition> exclude = new LinkedHashMap<>();

    void include(TestDefinition def) {
        if (include == null) {
            include = new LinkedHashMap<>();
        }
        include.put(def.getId(), def);
    }

    void exclude(TestDefinition def) {
        exclude.put(def.getId(), def);
    }

    /**
     * @return the included tests, or null when every test of the module is selected
     */
    public Map<String, TestDefinition> getInclude() {
        return include == null ? null : Collections.unmodifiableMap(include);
    }

    public Map<String, TestDefinition> getExclude() {
        return Collections.unmodifiableMap(exclude);
    }

    /**
     * The stable ids this filter selects in {@code module}, reported to the editor as enqueued.
     * Included ids in the order they were requested, otherwise the module's top-level tests in
     * definition order; excluded ids removed.
     */
    public List<String> asIds(TestModule module) {
        List<String> ids = new ArrayList<>();
        if (include != null) {
            ids.addAll(include.keySet());
        } else {
            for (TestDefinition def : module.getDefinitions()) {
                if (def.isRoot()) {
                    ids.add(def.getId());
                }
            }
        }
        ids.removeIf(exclude::containsKey);
        return ids;
    }

    /**
     * The same selection expressed by test name, the way the engine filters.
     */
    public NameFilter toNameFilter() {
        Set<String> includeNames = null;
        if (include != null) {
            includeNames = new LinkedHashSet<>();
            for (TestDefinition def : include.values()) {
                includeNames.add(def.getName());
            }
        }
        Set<String> excludeNames = new LinkedHashSet<>();
        for (TestDefinition def : exclude.values()) {
            excludeNames.add(def.getName());
        }
        return new NameFilter(includeNames, excludeNames);
    }

    @Override
    public String toString() {
        return "TestFilter[include=" + (include == null ? null : include.keySet()) + ", exclude=" + exclude.keySet() + "]";
    }

}
