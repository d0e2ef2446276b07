package com.testbatch.cli;

import com.testbatch.core.config.ConfigLoader;
import com.testbatch.core.config.HarnessConfig;
import com.testbatch.core.model.BatchReport;
import com.testbatch.core.runner.TestRegistry;
import com.testbatch.core.suite.TestSuite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to run test suites.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Load configuration</li>
 *   <li>Discover suites via SPI and keep the enabled ones</li>
 *   <li>For each suite, register its tests and run them as one batch</li>
 *   <li>Print the overall result and set the exit code</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Run every enabled suite
 * testbatch run
 *
 * # Run selected suites with a custom config
 * testbatch run -c ci/testbatch.yaml --suite counter --suite parser
 * }</pre>
 *
 * <p>Exit code is 0 when every executed test passed, 1 otherwise.
 */
@Command(
    name = "run",
    description = "Run test suites, one batch per suite",
    mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: testbatch.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-s", "--suite"},
        description = "Suite id to run (repeatable, default: all enabled suites)"
    )
    private List<String> suiteIds = new ArrayList<>();

    private final PrintStream out;

    public RunCommand() {
        this(System.out);
    }

    RunCommand(PrintStream out) {
        this.out = out;
    }

    @Override
    public Integer call() {
        try {
            HarnessConfig config = ConfigLoader.load(configPath);
            List<TestSuite> suites = selectSuites(config);

            if (suites.isEmpty()) {
                System.err.println("✗ No test suite matched the selection");
                return 1;
            }

            TestRegistry registry = new TestRegistry(out, config.reportSettings());

            int batches = 0;
            int failedTests = 0;
            for (TestSuite suite : suites) {
                log.info("Running suite: {}", suite.getId());
                suite.registerTests(registry);

                Optional<BatchReport> report = registry.run();
                if (report.isEmpty()) {
                    log.warn("Suite {} registered no tests", suite.getId());
                    continue;
                }
                batches++;
                failedTests += report.get().failureCount();
            }

            out.println();
            out.println("Ran " + batches + " batch(es): " + failedTests + " failed test(s)");
            return failedTests == 0 ? 0 : 1;

        } catch (Exception e) {
            log.error("Test run failed", e);
            System.err.println("✗ Test run failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Loads suites via SPI, keeping those enabled by config and command line.
     */
    private List<TestSuite> selectSuites(HarnessConfig config) {
        List<TestSuite> selected = new ArrayList<>();
        for (TestSuite suite : ServiceLoader.load(TestSuite.class)) {
            if (!config.isSuiteEnabled(suite.getId())) {
                log.debug("Suite {} disabled by configuration", suite.getId());
                continue;
            }
            if (!suiteIds.isEmpty() && !suiteIds.contains(suite.getId())) {
                continue;
            }
            selected.add(suite);
        }

        for (String requested : suiteIds) {
            if (selected.stream().noneMatch(suite -> suite.getId().equals(requested))) {
                log.warn("Requested suite not found or disabled: {}", requested);
            }
        }
        return selected;
    }
}
