package com.testbatch.core.check;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Process-terminating invariant check.
 *
 * <p>Unlike {@link Checks}, a fatal assertion is not part of test reporting. It can be used
 * anywhere for conditions that should be structurally impossible. On failure it writes a
 * diagnostic to its sink and terminates the process without unwinding.
 *
 * <p>Diagnostic format:
 * <pre>
 * Assertion &lt;condition&gt; failed.
 *     Message: &lt;message&gt;
 *     File: &lt;file&gt;
 *     Line: &lt;line&gt;
 * </pre>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * FatalAssertion.standard().check(index < size, "index out of range");
 * }</pre>
 */
public final class FatalAssertion {

    static final String NO_CONDITION = "<No condition literal specified>";
    static final String NO_MESSAGE = "<No error message specified>";
    static final String NO_FILE = "<Unspecified file>";
    static final String NO_LINE = "<Unspecified line>";

    private final PrintStream sink;
    private final ProcessTerminator terminator;

    /**
     * Creates a fatal assertion writing to the given sink.
     *
     * @param sink diagnostic sink
     * @param terminator how to end the process
     */
    public FatalAssertion(PrintStream sink, ProcessTerminator terminator) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.terminator = Objects.requireNonNull(terminator, "terminator must not be null");
    }

    /**
     * Returns an instance writing to the current standard error and halting the JVM.
     *
     * @return standard fatal assertion
     */
    public static FatalAssertion standard() {
        return new FatalAssertion(System.err, ProcessTerminator.abort());
    }

    PrintStream sink() {
        return sink;
    }

    /**
     * Checks the condition, recording the caller's file and line.
     *
     * @param condition condition that must hold
     * @param message error message, may be null
     */
    public void check(boolean condition, String message) {
        if (!condition) {
            SourceLocation location = SourceLocation.ofCaller(FatalAssertion.class);
            fail(message, null, location.file(), location.line());
        }
    }

    /**
     * Checks the condition. Every argument after the condition is optional.
     *
     * @param condition condition that must hold
     * @param message error message, may be null
     * @param conditionText source text of the condition, may be null
     * @param file source file, may be null
     * @param line line number, may be null
     */
    public void check(boolean condition, String message, String conditionText, String file, Integer line) {
        if (!condition) {
            fail(message, conditionText, file, line);
        }
    }

    private void fail(String message, String conditionText, String file, Integer line) {
        sink.println("Assertion " + (conditionText != null ? conditionText : NO_CONDITION) + " failed.");
        sink.println("    Message: " + (message != null ? message : NO_MESSAGE));
        sink.println("    File: " + (file != null ? file : NO_FILE));
        sink.println("    Line: " + (line != null ? String.valueOf(line) : NO_LINE));
        sink.flush();

        terminator.terminate(ProcessTerminator.ABORT_STATUS);

        throw new IllegalStateException("Process terminator returned after a fatal assertion");
    }
}
