package com.testbatch.core;

import com.testbatch.core.check.FatalAssertion;
import com.testbatch.core.check.SourceLocation;
import com.testbatch.core.model.BatchReport;
import com.testbatch.core.model.TestBody;
import com.testbatch.core.runner.TestRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Process-wide default registry.
 *
 * <p>The default registry is created on first use and lives until the JVM exits. Creating it
 * registers a shutdown hook that runs whatever is still pending, so a registered test is
 * never dropped silently because the caller forgot the final {@link #run()}. If a test body
 * ends the JVM while its batch is running, the hook skips the flush and the exit proceeds.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * public static void main(String[] args) {
 *     Testing.addTest(CounterTests::incrementsOnce);
 *     Testing.addTest("reset clears state", CounterTests::resetClearsState);
 *     Testing.run();
 *
 *     Testing.addTest(CounterTests::secondBatch);
 *     // flushed as batch 1 at shutdown
 * }
 * }</pre>
 */
public final class Testing {

    private static final Logger log = LoggerFactory.getLogger(Testing.class);

    static final String SHUTDOWN_THREAD_NAME = "testbatch-shutdown-flush";

    private Testing() {
    }

    private static final class Holder {
        private static final TestRegistry DEFAULT_REGISTRY = createDefaultRegistry();
    }

    private static TestRegistry createDefaultRegistry() {
        TestRegistry registry = new TestRegistry();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> flush(registry), SHUTDOWN_THREAD_NAME));
        log.debug("Default test registry created, pending tests will be flushed at shutdown");
        return registry;
    }

    private static void flush(TestRegistry registry) {
        // A body that exits the JVM holds the registry lock. Waiting on it would hang the exit.
        registry.tryRun().ifPresent(report ->
            log.debug("Flushed batch {} with {} test(s) at shutdown", report.batchIndex(), report.total()));
    }

    /**
     * Returns the process-wide default registry.
     *
     * @return default registry
     */
    public static TestRegistry defaultRegistry() {
        return Holder.DEFAULT_REGISTRY;
    }

    /**
     * Adds a test named after its body to the default registry.
     *
     * @param body test body, typically a method reference
     */
    public static void addTest(TestBody body) {
        defaultRegistry().register(body);
    }

    /**
     * Adds a named test to the default registry.
     *
     * @param name display name
     * @param body test body
     */
    public static void addTest(String name, TestBody body) {
        defaultRegistry().register(name, body);
    }

    /**
     * Runs the pending tests of the default registry.
     *
     * @return report of the batch, or empty if no test was pending
     */
    public static Optional<BatchReport> run() {
        return defaultRegistry().run();
    }

    /**
     * Terminates the process if the condition is false.
     *
     * @param condition condition that must hold
     * @param message error message
     * @see FatalAssertion
     */
    public static void fatalAssert(boolean condition, String message) {
        if (!condition) {
            SourceLocation location = SourceLocation.ofCaller(Testing.class);
            FatalAssertion.standard().check(false, message, null, location.file(), location.line());
        }
    }
}
