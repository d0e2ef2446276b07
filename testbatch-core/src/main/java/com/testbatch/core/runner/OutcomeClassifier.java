package com.testbatch.core.runner;

import com.testbatch.core.check.ConditionFailure;
import com.testbatch.core.model.OutcomeKind;
import com.testbatch.core.model.TestCase;
import com.testbatch.core.model.TestOutcome;
import com.testbatch.core.report.ReportSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;
import java.util.Optional;

/**
 * Executes one test and turns whatever happened into a boolean plus a diagnostic.
 *
 * <p>Every execution writes a header block with the test name, then exactly one diagnostic:
 * <ul>
 *   <li>{@code Test succeeded.} - the body returned {@code true}</li>
 *   <li>{@code Test failed.} - the body returned {@code false}</li>
 *   <li>{@code Test failed:} followed by the assertion, file and line - a {@link ConditionFailure}</li>
 *   <li>{@code Test failed (<type>): <message>} - an exception of a known {@link ErrorCategory}</li>
 *   <li>{@code Test failed (unknown error).} - any other throwable</li>
 * </ul>
 *
 * <p>This is the only place where a {@link ConditionFailure} is caught. Nothing raised by a
 * test body escapes {@link #classify(TestCase)}. The classifier keeps no state between calls.
 */
public class OutcomeClassifier {

    private static final Logger log = LoggerFactory.getLogger(OutcomeClassifier.class);

    static final String NO_CONDITION = "<Unspecified condition literal>";
    static final String NO_FILE = "<Unspecified file>";
    static final String NO_LINE = "<Unspecified line>";
    static final String NO_MESSAGE = "<No error message>";

    private final PrintStream out;
    private final ReportSettings settings;

    /**
     * Creates a classifier writing to standard output.
     */
    public OutcomeClassifier() {
        this(System.out, ReportSettings.defaults());
    }

    /**
     * Creates a classifier writing to the given sink.
     *
     * @param out report sink
     * @param settings console formatting settings
     */
    public OutcomeClassifier(PrintStream out, ReportSettings settings) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Executes the test and returns whether it passed.
     *
     * @param test test to execute
     * @return true only if the body returned {@code true}
     */
    public boolean execute(TestCase test) {
        return classify(test).passed();
    }

    /**
     * Executes the test and returns its classified outcome.
     *
     * @param test test to execute
     * @return classified outcome, never null
     */
    public TestOutcome classify(TestCase test) {
        Objects.requireNonNull(test, "test must not be null");
        writeHeader(test.name());

        TestOutcome outcome = runBody(test);

        out.println(outcome.diagnostic());
        out.flush();
        return outcome;
    }

    private TestOutcome runBody(TestCase test) {
        try {
            boolean passed = test.body().run();
            return passed
                ? new TestOutcome(test.name(), OutcomeKind.SUCCEEDED, "Test succeeded.")
                : new TestOutcome(test.name(), OutcomeKind.RETURNED_FALSE, "Test failed.");
        } catch (ConditionFailure failure) {
            return new TestOutcome(test.name(), OutcomeKind.CONDITION_FAILED, describe(failure));
        } catch (Throwable error) {
            if (error instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            Optional<ErrorCategory> category = ErrorCategory.of(error);
            if (category.isPresent()) {
                log.debug("Test '{}' raised {}", test.name(), error.getClass().getName(), error);
                String message = error.getMessage() != null ? error.getMessage() : NO_MESSAGE;
                return new TestOutcome(test.name(), OutcomeKind.DOMAIN_ERROR,
                    "Test failed (" + category.get().label() + "): " + message);
            }
            log.debug("Test '{}' raised an unclassified throwable", test.name(), error);
            return new TestOutcome(test.name(), OutcomeKind.UNKNOWN_ERROR, "Test failed (unknown error).");
        }
    }

    private void writeHeader(String name) {
        String separator = settings.separatorLine();
        out.println(separator);
        out.println("\t" + name);
        out.println(separator);
    }

    /**
     * Formats the diagnostic of a condition failure. Absent fields become placeholders here.
     */
    static String describe(ConditionFailure failure) {
        boolean expected = failure.expectedTruth();
        String line = failure.location().lineNumber().isPresent()
            ? String.valueOf(failure.location().lineNumber().getAsInt())
            : NO_LINE;

        return "Test failed:" + System.lineSeparator()
            + "    Assertion " + failure.conditionText().orElse(NO_CONDITION)
            + " should have been " + expected + " but was " + !expected + "." + System.lineSeparator()
            + "    File: " + failure.location().fileName().orElse(NO_FILE) + System.lineSeparator()
            + "    Line: " + line;
    }
}
