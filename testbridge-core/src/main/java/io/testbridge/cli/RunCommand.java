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

import io.testbridge.core.BridgeConfig;
import io.testbridge.core.RunOutcome;
import io.testbridge.core.TestRunManager;
import io.testbridge.core.TestRunSettings;
import io.testbridge.engine.TestEngine;
import io.testbridge.log.LogContext;
import io.testbridge.model.RunRequest;
import io.testbridge.model.TestInventory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ThreadLocalRandom;

/**
 * The 'run' subcommand: executes a run request against a test inventory with the first
 * {@link TestEngine} found on the class path.
 * <p>
 * Usage examples:
 * <pre>
 * # Run every test of the inventory
 * testbridge run inventory.json
 *
 * # Run a request, four modules at a time, stopping after the first failure
 * testbridge run -j 4 --fail-fast inventory.json request.json
 *
 * # Run with a custom project file
 * testbridge run -p custom.json inventory.json
 * </pre>
 */
@Command(
        name = "run",
        mixinStandardHelpOptions = true,
        description = "Run tests through the first available test engine",
        exitCodeOnInvalidInput = RunCommand.EXIT_ERROR,
        exitCodeOnExecutionException = RunCommand.EXIT_ERROR
)
public class RunCommand implements Callable<Integer> {

    public static final int EXIT_PASSED = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_ERROR = 3;

    @Parameters(
            index = "0",
            description = "Inventory JSON file listing the known modules and tests"
    )
    Path inventoryFile;

    @Parameters(
            index = "1",
            arity = "0..1",
            description = "Run request JSON file (default: run everything)"
    )
    Path requestFile;

    @Option(
            names = {"-j", "--concurrency"},
            description = "Number of modules executing at once (default: 1)"
    )
    Integer concurrency;

    @Option(
            names = {"--fail-fast"},
            arity = "0..1",
            fallbackValue = "1",
            description = "Stop starting modules after N failures (default N: 1)"
    )
    Integer failFast;

    @Option(
            names = {"--shuffle"},
            arity = "0..1",
            fallbackValue = "",
            description = "Shuffle test order within modules, with an optional seed"
    )
    String shuffle;

    @Option(
            names = {"--no-trace-ops"},
            description = "Do not trace async ops for leak reports"
    )
    boolean noTraceOps;

    @Option(
            names = {"-p", "--project"},
            description = "Path to project file (default: testbridge.json)"
    )
    String projectFile;

    @Option(
            names = {"--root"},
            description = "Workspace root uri, used to label modules"
    )
    String rootUri;

    @Option(
            names = {"--log-level"},
            description = "Log level: trace, debug, info, warn, error"
    )
    String logLevel;

    @Option(
            names = {"--no-color"},
            description = "Disable colored output"
    )
    boolean noColor;

    private BridgeConfig config;

    @Override
    public Integer call() {
        if (noColor) {
            Console.setColorsEnabled(false);
        }
        loadConfig();
        String effectiveLogLevel = logLevel != null ? logLevel : config == null ? null : config.getLogLevel();
        if (effectiveLogLevel != null) {
            LogContext.setRuntimeLogLevel(effectiveLogLevel);
        }
        TestEngine engine = findEngine();
        if (engine == null) {
            Console.println(Console.error("no test engine found on the class path"));
            return EXIT_ERROR;
        }
        try {
            TestRunSettings.Builder builder = TestRunSettings.builder(engine);
            // project file first, command line overrides
            if (config != null) {
                config.applyTo(builder);
            }
            if (concurrency != null) {
                builder.concurrency(concurrency);
            }
            if (failFast != null) {
                builder.failFast(failFast);
            }
            if (shuffle != null) {
                builder.shuffle(shuffle.isEmpty() ? ThreadLocalRandom.current().nextLong() : Long.parseLong(shuffle));
            }
            if (noTraceOps) {
                builder.traceOps(false);
            }
            if (rootUri != null) {
                builder.rootUri(rootUri);
            }
            TestRunSettings settings = builder.build();
            TestInventory inventory = TestInventory.load(inventoryFile);
            RunRequest request = requestFile == null
                    ? RunRequest.of(1, null, List.of())
                    : RunRequest.parse(Files.readString(requestFile));
            ConsoleTestingClient client = new ConsoleTestingClient();
            RunOutcome outcome;
            try (TestRunManager manager = new TestRunManager(inventory, client, settings)) {
                outcome = manager.runRequest(request).join();
            }
            client.printSummary(outcome, settings.getConcurrency());
            return outcome.passed() ? EXIT_PASSED : EXIT_FAILED;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            Console.println(Console.error(cause.getMessage()));
            return EXIT_ERROR;
        } catch (Exception e) {
            Console.println(Console.error(e.getMessage()));
            return EXIT_ERROR;
        }
    }

    private void loadConfig() {
        Path path = Path.of(projectFile != null ? projectFile : BridgeConfig.DEFAULT_FILE);
        if (Files.exists(path)) {
            try {
                config = BridgeConfig.load(path);
                Console.println(Console.notice("Loaded: " + path));
            } catch (Exception e) {
                Console.println(Console.warning("Failed to load project file: " + e.getMessage()));
            }
        }
    }

    static TestEngine findEngine() {
        Iterator<TestEngine> engines = ServiceLoader.load(TestEngine.class).iterator();
        return engines.hasNext() ? engines.next() : null;
    }

    // ========== Getters for programmatic access ==========

    public Path getInventoryFile() {
        return inventoryFile;
    }

    public Path getRequestFile() {
        return requestFile;
    }

    public Integer getConcurrency() {
        return concurrency;
    }

    public Integer getFailFast() {
        return failFast;
    }

    public String getShuffle() {
        return shuffle;
    }

    public boolean isNoTraceOps() {
        return noTraceOps;
    }

    public String getProjectFile() {
        return projectFile;
    }

    public String getRootUri() {
        return rootUri;
    }

}
