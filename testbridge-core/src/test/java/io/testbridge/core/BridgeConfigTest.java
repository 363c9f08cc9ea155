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

import io.testbridge.engine.ScriptedEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class BridgeConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testParseFullConfig() {
        String json = """
            {
              "concurrency": 4,
              "failFast": 2,
              "shuffle": 12345678901,
              "traceOps": false,
              "rootUri": "file:///home/user/project/",
              "logLevel": "debug"
            }
            """;
        BridgeConfig config = BridgeConfig.parse(json);
        assertEquals(4, config.getConcurrency());
        assertEquals(2, config.getFailFast());
        assertEquals(12345678901L, config.getShuffle());
        assertEquals(Boolean.FALSE, config.getTraceOps());
        assertEquals("file:///home/user/project/", config.getRootUri());
        assertEquals("debug", config.getLogLevel());

        TestRunSettings settings = config.applyTo(TestRunSettings.builder(new ScriptedEngine())).build();
        assertEquals(4, settings.getConcurrency());
        assertEquals(2, settings.getFailFast());
        assertEquals(12345678901L, settings.getShuffle());
        assertFalse(settings.isTraceOps());
        assertEquals("file:///home/user/project/", settings.getRootUri());
    }

    @Test
    void testEmptyConfigKeepsDefaults() {
        BridgeConfig config = BridgeConfig.parse("{}");
        TestRunSettings settings = config.applyTo(TestRunSettings.builder(new ScriptedEngine())).build();
        assertEquals(1, settings.getConcurrency());
        assertNull(settings.getFailFast());
        assertNull(settings.getShuffle());
        assertTrue(settings.isTraceOps());
        assertNull(settings.getRootUri());
    }

    @Test
    void testCommandLineOverridesConfig() {
        BridgeConfig config = BridgeConfig.parse("{\"concurrency\": 4}");
        TestRunSettings settings = config.applyTo(TestRunSettings.builder(new ScriptedEngine())).concurrency(8).build();
        assertEquals(8, settings.getConcurrency());
    }

    @Test
    void testLoadFromFile() throws Exception {
        Path file = tempDir.resolve(BridgeConfig.DEFAULT_FILE);
        Files.writeString(file, "{\"failFast\": 1}");
        assertEquals(1, BridgeConfig.load(file).getFailFast());
    }

    @Test
    void testLoadMissingFile() {
        RuntimeException e = assertThrows(RuntimeException.class, () -> BridgeConfig.load(tempDir.resolve("nope.json")));
        assertTrue(e.getMessage().contains("nope.json"));
    }

    @Test
    void testInvalidConfig() {
        assertThrows(RuntimeException.class, () -> BridgeConfig.parse("[1, 2]"));
    }

    @Test
    void testInvalidSettingsRejected() {
        TestRunSettings.Builder builder = TestRunSettings.builder(new ScriptedEngine());
        assertThrows(IllegalArgumentException.class, () -> builder.concurrency(0));
        assertThrows(IllegalArgumentException.class, () -> builder.failFast(0));
        assertThrows(IllegalArgumentException.class, () -> TestRunSettings.builder(null));
    }

}
