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

import io.testbridge.log.LogContext;
import org.slf4j.Logger;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Terminal rendering of test progress: one status line per test or step, indented failure
 * details and the run summary frame. Every printed line is copied without ANSI codes to the
 * testbridge.console logger at TRACE level.
 */
public final class Console {

    private static final Logger logger = LogContext.CONSOLE_LOGGER;

    private static final Pattern ANSI_PATTERN = Pattern.compile("\u001B\\[[;\\d]*m");

    static final String RESET = "\u001B[0m";
    static final String RED_BOLD = "\u001B[91;1m";
    static final String GREEN = "\u001B[92m";
    static final String YELLOW = "\u001B[93m";
    static final String CYAN = "\u001B[36m";
    static final String GREY = "\u001B[90m";

    static final String STEP_INDENT = "  ";
    static final int FRAME_WIDTH = 60;

    /**
     * Outcome of a single test or step as shown at the end of its line.
     */
    public enum Status {

        OK("ok", GREEN),
        IGNORED("ignored", YELLOW),
        FAILED("FAILED", RED_BOLD);

        private final String text;
        private final String code;

        Status(String text, String code) {
            this.text = text;
            this.code = code;
        }

        public String render() {
            return paint(text, code);
        }

    }

    private static volatile boolean colorsEnabled = System.getenv("NO_COLOR") == null && System.console() != null;
    private static volatile PrintStream out = System.out;

    private Console() {
    }

    public static void setColorsEnabled(boolean enabled) {
        colorsEnabled = enabled;
    }

    public static void setOutput(PrintStream output) {
        out = output;
    }

    static String stripAnsi(String text) {
        return ANSI_PATTERN.matcher(text).replaceAll("");
    }

    private static String paint(String text, String code) {
        return colorsEnabled ? code + text + RESET : text;
    }

    private static String indent(boolean step) {
        return step ? STEP_INDENT : "";
    }

    // test and step lines

    public static String started(String name, boolean step) {
        return indent(step) + name + " ...";
    }

    public static String finished(String name, boolean step, Status status, Long durationMillis) {
        String line = started(name, step) + " " + status.render();
        return durationMillis == null ? line : line + paint(" (" + durationMillis + "ms)", GREY);
    }

    /**
     * Failure text of a test or step, one line per text line, indented one level below it.
     */
    public static List<String> failureDetail(String text, boolean step) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n")) {
            lines.add(indent(step) + STEP_INDENT + line);
        }
        return lines;
    }

    public static String enqueued(int count, String moduleLabel) {
        return paint("running " + count + " test(s) from " + moduleLabel, GREY);
    }

    // run level

    public static String verdict(boolean passed, String message) {
        return passed ? Status.OK.render() : paint(message, RED_BOLD);
    }

    public static String failedCount(int failed) {
        return failed > 0 ? paint(failed + " failed", RED_BOLD) : paint("all passed", GREEN);
    }

    public static String frame() {
        return "=".repeat(FRAME_WIDTH);
    }

    public static String error(String message) {
        return paint("Error: " + message, RED_BOLD);
    }

    public static String notice(String message) {
        return paint(message, CYAN);
    }

    public static String warning(String message) {
        return paint(message, YELLOW);
    }

    // output

    public static void println(String text) {
        out.println(text);
        if (logger.isTraceEnabled()) {
            logger.trace(stripAnsi(text));
        }
    }

    public static void println() {
        out.println();
    }

    /**
     * Raw test output, passed through without a trailing newline.
     */
    public static void print(String text) {
        out.print(text);
        if (logger.isTraceEnabled()) {
            logger.trace(stripAnsi(text));
        }
    }

}
