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

import io.testbridge.engine.TestDescription;
import io.testbridge.engine.TestStepDescription;
import io.testbridge.log.LogContext;
import org.slf4j.Logger;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The tests known for one module, keyed by stable id in definition order.
 * <p>
 * Tests the engine discovers while running are registered here under a content-derived id: a
 * SHA-256 of the module uri and the test name, plus the parent's stable id and nesting level for
 * steps. The same logical test therefore keeps its id across runs.
 * <p>
 * Not thread-safe, access goes through {@link TestInventory#withLock}.
 */
public class TestModule {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final String moduleUri;
    private final String scriptVersion;
    private final Map<String, TestDefinition> defs = new LinkedHashMap<>();

    public record Registration(String stableId, boolean isNew) {
    }

    public TestModule(String moduleUri, String scriptVersion) {
        this.moduleUri = moduleUri;
        this.scriptVersion = scriptVersion;
    }

    public TestModule add(TestDefinition def) {
        defs.put(def.getId(), def);
        if (def.getParentId() != null) {
            TestDefinition parent = defs.get(def.getParentId());
            if (parent != null) {
                parent.getStepIds().add(def.getId());
            }
        }
        return this;
    }

    public Registration registerDynamic(TestDescription desc) {
        return register(testId(moduleUri, desc.name()), desc.name(), null);
    }

    public Registration registerStepDynamic(TestStepDescription desc, String parentStableId) {
        String id = checksum(moduleUri, parentStableId, Integer.toString(desc.level()), desc.name());
        Registration registration = register(id, desc.name(), parentStableId);
        TestDefinition parent = defs.get(parentStableId);
        if (parent != null) {
            parent.getStepIds().add(id);
        }
        return registration;
    }

    private Registration register(String id, String name, String parentId) {
        TestDefinition existing = defs.get(id);
        if (existing == null) {
            defs.put(id, new TestDefinition(id, name, null, true, parentId));
            return new Registration(id, true);
        }
        if (!existing.getName().equals(name)) {
            // TODO: disambiguate colliding ids instead of relabelling the existing definition
            logger.debug("stable id collision in {}: '{}' relabelled to '{}'", moduleUri, existing.getName(), name);
            existing.setName(name);
        }
        return new Registration(id, false);
    }

    /**
     * The label the editor shows for this module: the path relative to the workspace root when the
     * module lives under it, the full uri when it lives elsewhere. Without a workspace root it is
     * the last path segment, the file name.
     */
    public String label(String rootUri) {
        if (rootUri == null) {
            return lastSegment(moduleUri);
        }
        if (moduleUri.startsWith("file:")) {
            try {
                URI relative = URI.create(rootUri).relativize(URI.create(moduleUri));
                if (!relative.isAbsolute()) {
                    return relative.toString();
                }
            } catch (IllegalArgumentException e) {
                logger.debug("cannot relativize {} against {}: {}", moduleUri, rootUri, e.getMessage());
            }
        }
        return moduleUri;
    }

    private static String lastSegment(String uri) {
        String path = uri;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        int slash = path.lastIndexOf('/');
        String segment = slash < 0 ? path : path.substring(slash + 1);
        return segment.isEmpty() ? uri : segment;
    }

    public TestData getTestData(String id) {
        TestDefinition def = defs.get(id);
        if (def == null) {
            return null;
        }
        List<TestData> steps = new ArrayList<>(def.getStepIds().size());
        for (String stepId : def.getStepIds()) {
            TestData step = getTestData(stepId);
            if (step != null) {
                steps.add(step);
            }
        }
        return new TestData(def.getId(), def.getName(), steps, def.getRange());
    }

    /**
     * The stable id a top-level test named {@code name} gets in module {@code moduleUri}.
     */
    public static String testId(String moduleUri, String name) {
        return checksum(moduleUri, name);
    }

    static String checksum(String... parts) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (String part : parts) {
                digest.update(part.getBytes(StandardCharsets.UTF_8));
            }
            byte[] hash = digest.digest();
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String getModuleUri() {
        return moduleUri;
    }

    public String getScriptVersion() {
        return scriptVersion;
    }

    public TestDefinition get(String id) {
        return defs.get(id);
    }

    public boolean contains(String id) {
        return defs.containsKey(id);
    }

    public Collection<TestDefinition> getDefinitions() {
        return defs.values();
    }

    public int size() {
        return defs.size();
    }

    public boolean isEmpty() {
        return defs.isEmpty();
    }

}
