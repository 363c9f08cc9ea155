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

import io.testbridge.common.Json;
import io.testbridge.engine.TestError;
import io.testbridge.engine.TestFailure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counters and failures of one run. Mutated only by the aggregator thread and reported once,
 * after the verdict.
 */
public class TestSummary {

    public record Failure(String origin, String name, TestFailure failure) {
    }

    public record UncaughtFailure(String origin, TestError error) {
    }

    int total;
    int passed;
    int failed;
    int ignored;
    int passedSteps;
    int failedSteps;
    int ignoredSteps;
    int filteredOut;
    private final List<Failure> failures = new ArrayList<>();
    private final List<UncaughtFailure> uncaughtErrors = new ArrayList<>();
    private long startTime;
    private long endTime;

    void addFailure(Failure failure) {
        failures.add(failure);
    }

    void addUncaughtError(UncaughtFailure failure) {
        uncaughtErrors.add(failure);
    }

    void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    void setEndTime(long endTime) {
        this.endTime = endTime;
    }

    public int getTotal() {
        return total;
    }

    public int getPassed() {
        return passed;
    }

    public int getFailed() {
        return failed;
    }

    public int getIgnored() {
        return ignored;
    }

    public int getPassedSteps() {
        return passedSteps;
    }

    public int getFailedSteps() {
        return failedSteps;
    }

    public int getIgnoredSteps() {
        return ignoredSteps;
    }

    public int getFilteredOut() {
        return filteredOut;
    }

    public List<Failure> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    public List<UncaughtFailure> getUncaughtErrors() {
        return Collections.unmodifiableList(uncaughtErrors);
    }

    public long getDurationMillis() {
        return endTime - startTime;
    }

    public boolean hasFailed() {
        return failed > 0;
    }

    // ========== Serialization ==========

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total", total);
        map.put("passed", passed);
        map.put("failed", failed);
        map.put("ignored", ignored);
        map.put("passedSteps", passedSteps);
        map.put("failedSteps", failedSteps);
        map.put("ignoredSteps", ignoredSteps);
        map.put("filteredOut", filteredOut);
        map.put("durationMillis", getDurationMillis());
        List<Map<String, Object>> list = new ArrayList<>(failures.size());
        for (Failure f : failures) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("origin", f.origin());
            item.put("name", f.name());
            item.put("failure", f.failure().toString());
            list.add(item);
        }
        map.put("failures", list);
        List<Map<String, Object>> errors = new ArrayList<>(uncaughtErrors.size());
        for (UncaughtFailure u : uncaughtErrors) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("origin", u.origin());
            item.put("error", u.error().format());
            errors.add(item);
        }
        map.put("uncaughtErrors", errors);
        return map;
    }

    @Override
    public String toString() {
        return Json.stringifyStrict(toJson());
    }

}
