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

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Project configuration loaded from testbridge.json. Command line options override these values,
 * so apply this first.
 * <p>
 * Example testbridge.json:
 * <pre>
 * {
 *   "concurrency": 4,
 *   "failFast": 1,
 *   "shuffle": 42,
 *   "traceOps": true,
 *   "rootUri": "file:///home/user/project/",
 *   "logLevel": "debug"
 * }
 * </pre>
 */
public class BridgeConfig {

    public static final String DEFAULT_FILE = "testbridge.json";

    private Integer concurrency;
    private Integer failFast;
    private Long shuffle;
    private Boolean traceOps;
    private String rootUri;
    private String logLevel;

    /**
     * @throws RuntimeException if the file cannot be read or parsed
     */
    public static BridgeConfig load(Path configPath) {
        try {
            String content = Files.readString(configPath);
            return parse(content);
        } catch (Exception e) {
            throw new RuntimeException("Failed to load config from: " + configPath, e);
        }
    }

    public static BridgeConfig parse(String json) {
        Json j = Json.of(json);
        if (!j.isObject()) {
            throw new RuntimeException("Invalid config: expected JSON object");
        }
        BridgeConfig config = new BridgeConfig();
        j.<Number>getOptional("concurrency").ifPresent(n -> config.setConcurrency(n.intValue()));
        j.<Number>getOptional("failFast").ifPresent(n -> config.setFailFast(n.intValue()));
        j.<Number>getOptional("shuffle").ifPresent(n -> config.setShuffle(n.longValue()));
        j.<Boolean>getOptional("traceOps").ifPresent(config::setTraceOps);
        j.<String>getOptional("rootUri").ifPresent(config::setRootUri);
        j.<String>getOptional("logLevel").ifPresent(config::setLogLevel);
        return config;
    }

    public TestRunSettings.Builder applyTo(TestRunSettings.Builder builder) {
        if (concurrency != null) {
            builder.concurrency(concurrency);
        }
        if (failFast != null) {
            builder.failFast(failFast);
        }
        if (shuffle != null) {
            builder.shuffle(shuffle);
        }
        if (traceOps != null) {
            builder.traceOps(traceOps);
        }
        if (rootUri != null) {
            builder.rootUri(rootUri);
        }
        return builder;
    }

    public Integer getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(Integer concurrency) {
        this.concurrency = concurrency;
    }

    public Integer getFailFast() {
        return failFast;
    }

    public void setFailFast(Integer failFast) {
        this.failFast = failFast;
    }

    public Long getShuffle() {
        return shuffle;
    }

    public void setShuffle(Long shuffle) {
        this.shuffle = shuffle;
    }

    public Boolean getTraceOps() {
        return traceOps;
    }

    public void setTraceOps(Boolean traceOps) {
        this.traceOps = traceOps;
    }

    public String getRootUri() {
        return rootUri;
    }

    public void setRootUri(String rootUri) {
        this.rootUri = rootUri;
    }

    public String getLogLevel() {
        return logLevel;
    }

    public void setLogLevel(String logLevel) {
        this.logLevel = logLevel;
    }

}
