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
package io.testbridge.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleTest {

    @AfterEach
    void afterEach() {
        Console.setColorsEnabled(false);
        Console.setOutput(System.out);
    }

    @Test
    void testStatusLinesWithoutColor() {
        Console.setColorsEnabled(false);
        assertEquals("adds ...", Console.started("adds", false));
        assertEquals("adds ... ok (12ms)", Console.finished("adds", false, Console.Status.OK, 12L));
        assertEquals("  inner ... ignored", Console.finished("inner", true, Console.Status.IGNORED, null));
        assertEquals("  inner ... FAILED (3ms)", Console.finished("inner", true, Console.Status.FAILED, 3L));
    }

    @Test
    void testFailureDetailIndentedBelowItsLine() {
        assertEquals(List.of("  line 1", "  line 2"), Console.failureDetail("line 1\nline 2", false));
        assertEquals(List.of("    boom"), Console.failureDetail("boom", true));
    }

    @Test
    void testStatusColors() {
        Console.setColorsEnabled(true);
        assertEquals(Console.GREEN + "ok" + Console.RESET, Console.Status.OK.render());
        assertEquals(Console.RED_BOLD + "FAILED" + Console.RESET, Console.Status.FAILED.render());
        String line = Console.finished("adds", false, Console.Status.FAILED, 5L);
        assertNotEquals("adds ... FAILED (5ms)", line);
        assertEquals("adds ... FAILED (5ms)", Console.stripAnsi(line));
    }

    @Test
    void testRunLevelText() {
        Console.setColorsEnabled(false);
        assertEquals("ok", Console.verdict(true, null));
        assertEquals("Test failed", Console.verdict(false, "Test failed"));
        assertEquals("all passed", Console.failedCount(0));
        assertEquals("2 failed", Console.failedCount(2));
        assertEquals("running 3 test(s) from a_test.ts", Console.enqueued(3, "a_test.ts"));
        assertEquals("Error: bad input", Console.error("bad input"));
        assertEquals(Console.FRAME_WIDTH, Console.frame().length());
    }

    @Test
    void testPrintGoesToOutput() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Console.setOutput(new PrintStream(out, true, StandardCharsets.UTF_8));
        Console.print("a");
        Console.println("b");
        assertEquals("ab" + System.lineSeparator(), out.toString(StandardCharsets.UTF_8));
    }

}
