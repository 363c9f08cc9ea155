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

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A test or step known to the editor, keyed by its stable id.
 */
public class TestDefinition {

    private final String id;
    private String name;
    private final SourceRange range;
    private final boolean dynamic;
    private final String parentId;
    private final Set<String> stepIds = new LinkedHashSet<>();

    public TestDefinition(String id, String name, SourceRange range, boolean dynamic, String parentId) {
        this.id = id;
        this.name = name;
        this.range = range;
        this.dynamic = dynamic;
        this.parentId = parentId;
    }

    public static TestDefinition root(String id, String name, SourceRange range) {
        return new TestDefinition(id, name, range, false, null);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    void setName(String name) {
        this.name = name;
    }

    public SourceRange getRange() {
        return range;
    }

    public boolean isDynamic() {
        return dynamic;
    }

    public String getParentId() {
        return parentId;
    }

    public boolean isRoot() {
        return parentId == null;
    }

    public Set<String> getStepIds() {
        return stepIds;
    }

    @Override
    public String toString() {
        return "TestDefinition[" + id + ", " + name + "]";
    }

}
