package com.testbatch.core.model;

import java.util.Objects;

/**
 * Classified result of executing one test.
 *
 * @param testName display name of the executed test
 * @param kind how the execution ended
 * @param diagnostic the diagnostic text written to the report sink, without the header block
 */
public record TestOutcome(
    String testName,
    OutcomeKind kind,
    String diagnostic
) {
    /**
     * Compact constructor with validation.
     */
    public TestOutcome {
        Objects.requireNonNull(testName, "testName must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (diagnostic == null) {
            diagnostic = "";
        }
    }

    /**
     * Returns whether the test passed.
     *
     * @return true if the body returned {@code true}
     */
    public boolean passed() {
        return kind.isPass();
    }
}
