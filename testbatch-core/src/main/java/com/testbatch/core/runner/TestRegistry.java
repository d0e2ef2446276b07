package com.testbatch.core.runner;

import com.testbatch.core.model.BatchReport;
import com.testbatch.core.model.TestBody;
import com.testbatch.core.model.TestCase;
import com.testbatch.core.model.TestOutcome;
import com.testbatch.core.report.ConsoleSummaryRenderer;
import com.testbatch.core.report.ReportSettings;
import com.testbatch.core.report.SummaryRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Collects tests into batches and runs them.
 *
 * <p>Tests are executed in registration order. Registering the same body twice runs it
 * twice. Each non-empty {@link #run()} executes every pending test through the
 * {@link OutcomeClassifier}, renders the batch summary, clears the pending list and
 * advances the batch index. A run with nothing pending does nothing at all: no output and
 * no batch index change.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * TestRegistry registry = new TestRegistry();
 * registry.register("parses numbers", () -> Integer.parseInt("42") == 42);
 * registry.register(ParserTests::rejectsEmptyInput);
 *
 * Optional<BatchReport> report = registry.run();   // prints "All tests (2) passed for batch 0."
 * }</pre>
 *
 * <p>Registries are meant to be driven from one thread. The lock only publishes the pending
 * tests to a shutdown hook thread, which uses {@link #tryRun()} so it never waits on a run
 * that is still in progress. A run works on a snapshot of the pending list: tests registered
 * by a running body land in the next batch.
 */
public class TestRegistry {

    private static final Logger log = LoggerFactory.getLogger(TestRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final List<TestCase> pending = new ArrayList<>();
    private final OutcomeClassifier classifier;
    private final SummaryRenderer renderer;
    private final PrintStream out;

    private long batchIndex = 0;

    /**
     * Creates a registry reporting to standard output.
     */
    public TestRegistry() {
        this(System.out, ReportSettings.defaults());
    }

    /**
     * Creates a registry reporting to the given sink.
     *
     * @param out report sink
     * @param settings console formatting settings
     */
    public TestRegistry(PrintStream out, ReportSettings settings) {
        this(out, new OutcomeClassifier(out, settings), new ConsoleSummaryRenderer(settings));
    }

    /**
     * Creates a registry with explicit collaborators.
     *
     * @param out report sink handed to the renderer
     * @param classifier executes single tests
     * @param renderer writes batch summaries
     */
    public TestRegistry(PrintStream out, OutcomeClassifier classifier, SummaryRenderer renderer) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
    }

    /**
     * Adds a test to the current batch.
     *
     * @param test test to add
     */
    public void register(TestCase test) {
        Objects.requireNonNull(test, "test must not be null");
        lock.lock();
        try {
            pending.add(test);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds a named test to the current batch.
     *
     * @param name display name, null or blank for the placeholder name
     * @param body test body
     */
    public void register(String name, TestBody body) {
        register(new TestCase(name, body));
    }

    /**
     * Adds a test named after the body itself.
     *
     * <p>A method reference such as {@code ParserTests::rejectsEmptyInput} is named
     * {@code "ParserTests::rejectsEmptyInput"}. Lambdas get the placeholder name.
     *
     * @param body test body
     */
    public void register(TestBody body) {
        Objects.requireNonNull(body, "body must not be null");
        register(new TestCase(TestNames.of(body), body));
    }

    /**
     * Runs the current batch.
     *
     * @return report of the batch, or empty if no test was pending
     */
    public Optional<BatchReport> run() {
        lock.lock();
        try {
            return runBatch();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs the current batch unless another thread is running one.
     *
     * @return report of the batch, or empty if no test was pending or a run was in progress
     */
    public Optional<BatchReport> tryRun() {
        if (!lock.tryLock()) {
            log.warn("A batch is still running, skipping the requested run");
            return Optional.empty();
        }
        try {
            return runBatch();
        } finally {
            lock.unlock();
        }
    }

    private Optional<BatchReport> runBatch() {
        // An empty run leaves the batch index untouched.
        if (pending.isEmpty()) {
            return Optional.empty();
        }

        List<TestCase> batch = List.copyOf(pending);
        pending.clear();
        long index = batchIndex++;

        log.debug("Running batch {} with {} test(s)", index, batch.size());

        List<TestOutcome> outcomes = new ArrayList<>(batch.size());
        for (TestCase test : batch) {
            outcomes.add(classifier.classify(test));
        }

        BatchReport report = new BatchReport(index, outcomes);
        renderer.render(report, out);

        log.info("Batch {} finished: {} of {} test(s) failed",
            report.batchIndex(), report.failureCount(), report.total());
        return Optional.of(report);
    }

    /**
     * Returns the number of tests waiting for the next run.
     *
     * @return pending test count
     */
    public int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the index the next non-empty batch will be reported under.
     *
     * @return current batch index
     */
    public long batchIndex() {
        lock.lock();
        try {
            return batchIndex;
        } finally {
            lock.unlock();
        }
    }
}
