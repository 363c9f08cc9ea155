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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * The live mapping of module uri to its tests, shared between the editor layer and running
 * reporters. Every access happens under one lock scoped to a single read-modify-write; callers
 * must not block or send notifications inside {@link #withLock}.
 */
public class TestInventory {

    private final Map<String, TestModule> modules = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public <T> T withLock(Function<Map<String, TestModule>, T> action) {
        lock.lock();
        try {
            return action.apply(modules);
        } finally {
            lock.unlock();
        }
    }

    public void put(TestModule module) {
        withLock(m -> m.put(module.getModuleUri(), module));
    }

    public boolean remove(String moduleUri) {
        return withLock(m -> m.remove(moduleUri) != null);
    }

    public int size() {
        return withLock(Map::size);
    }

    /**
     * Load an inventory from a JSON file.
     *
     * @throws RuntimeException if the file cannot be read or parsed
     */
    public static TestInventory load(Path path) {
        try {
            return parse(Files.readString(path));
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("Failed to load inventory from: " + path, e);
        }
    }

    /**
     * Parse an inventory of the form:
     * <pre>
     * {
     *   "modules": [
     *     {
     *       "uri": "file:///project/a_test.ts",
     *       "version": "1",
     *       "tests": [
     *         {"id": "...", "name": "adds", "range": {...}},
     *         {"id": "...", "name": "step one", "parentId": "..."}
     *       ]
     *     }
     *   ]
     * }
     * </pre>
     * Parents must be listed before their steps.
     */
    @SuppressWarnings("unchecked")
    public static TestInventory parse(String json) {
        Json j = Json.of(json);
        if (!j.isObject()) {
            throw new RuntimeException("Invalid inventory: expected JSON object");
        }
        TestInventory inventory = new TestInventory();
        List<Map<String, Object>> modules = j.<List<Map<String, Object>>>getOptional("modules").orElse(List.of());
        for (Map<String, Object> m : modules) {
            String uri = (String) m.get("uri");
            if (uri == null) {
                throw new RuntimeException("Invalid inventory: module without uri");
            }
            Object version = m.get("version");
            TestModule module = new TestModule(uri, version == null ? "1" : version.toString());
            Object tests = m.get("tests");
            if (tests instanceof List) {
                for (Map<String, Object> t : (List<Map<String, Object>>) tests) {
                    Object range = t.get("range");
                    module.add(new TestDefinition(
                            (String) t.get("id"),
                            (String) t.get("name"),
                            range instanceof Map ? SourceRange.fromMap((Map<String, Object>) range) : null,
                            Boolean.TRUE.equals(t.get("dynamic")),
                            (String) t.get("parentId")));
                }
            }
            inventory.put(module);
        }
        return inventory;
    }

}
