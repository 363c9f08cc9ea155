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

import io.testbridge.model.TestIdentifier;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps the engine's per-run numeric ids to stable identifiers and tracks the one test or step
 * that output is currently attributed to.
 * <p>
 * Owned by the aggregator thread, so nothing here is synchronized. Entries are append-only.
 */
public class IdentityResolver {

    /**
     * @param parentId runtime id of the enclosing test or step, null for a top-level test
     */
    public record Entry(String origin, String name, Integer parentId, String stableId) {

        public boolean isRoot() {
            return parentId == null;
        }
    }

    private final Map<Integer, Entry> entries = new LinkedHashMap<>();
    private final Map<Integer, Integer> rootIds = new HashMap<>();
    private Integer current;

    public void register(int id, Entry entry) {
        entries.put(id, entry);
    }

    public Entry get(int id) {
        return entries.get(id);
    }

    public boolean isRegistered(int id) {
        return entries.containsKey(id);
    }

    /**
     * Resolve a runtime id to the identifier the editor knows. Intermediate steps between the
     * root test and the given step are never part of the result.
     *
     * @return the identifier, or null if the id was never registered
     */
    public TestIdentifier identifierFor(int id) {
        Entry entry = entries.get(id);
        if (entry == null) {
            return null;
        }
        int rootId = rootIdOf(id);
        Entry root = entries.get(rootId);
        if (rootId == id) {
            return TestIdentifier.test(entry.origin(), entry.stableId());
        }
        return TestIdentifier.step(entry.origin(), root.stableId(), entry.stableId());
    }

    /**
     * @return the runtime id of the top-level test that {@code id} belongs to
     */
    public int rootIdOf(int id) {
        Integer cached = rootIds.get(id);
        if (cached != null) {
            return cached;
        }
        int rootId = id;
        Entry entry = entries.get(id);
        while (entry != null && !entry.isRoot() && entries.containsKey(entry.parentId())) {
            rootId = entry.parentId();
            entry = entries.get(rootId);
        }
        rootIds.put(id, rootId);
        return rootId;
    }

    /**
     * Runtime ids registered for one module, in registration order.
     */
    public List<Integer> idsForOrigin(String origin) {
        List<Integer> ids = new ArrayList<>();
        entries.forEach((id, entry) -> {
            if (entry.origin().equals(origin)) {
                ids.add(id);
            }
        });
        return ids;
    }

    // ========== Current Test ==========

    public Integer getCurrent() {
        return current;
    }

    public void onWait(int id) {
        current = id;
    }

    public void onStepWait(int id) {
        Entry entry = entries.get(id);
        if (entry != null && current != null && current.equals(entry.parentId())) {
            current = id;
        }
    }

    public void onStepResult(int id) {
        Entry entry = entries.get(id);
        if (entry != null && current != null && current == id) {
            current = entry.parentId();
        }
    }

    public void onResult(int id) {
        if (current != null && current == id) {
            current = null;
        }
    }

    public void clearCurrent() {
        current = null;
    }

}
