package com.testbatch.core.check;

import java.util.Objects;
import java.util.Optional;

/**
 * Signal raised when a checked condition inside a test did not hold.
 *
 * <p>This is not an error report. It carries the failed condition, where it was checked
 * and which truth value was expected, from the check helper up to the
 * {@link com.testbatch.core.runner.OutcomeClassifier}, which is the only place that catches it.
 * No stack trace is recorded.
 *
 * @see Checks
 */
public final class ConditionFailure extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String conditionText;
    private final SourceLocation location;
    private final boolean expectedTruth;

    /**
     * Creates a condition failure.
     *
     * @param conditionText source text of the condition, or null if unknown
     * @param location where the check was written, never null
     * @param expectedTruth truth value the condition should have had
     */
    public ConditionFailure(String conditionText, SourceLocation location, boolean expectedTruth) {
        super(null, null, false, false);
        this.conditionText = conditionText;
        this.location = Objects.requireNonNull(location, "location must not be null");
        this.expectedTruth = expectedTruth;
    }

    /**
     * Returns the condition source text if known.
     *
     * @return optional condition text
     */
    public Optional<String> conditionText() {
        return Optional.ofNullable(conditionText);
    }

    /**
     * Returns where the check was written.
     *
     * @return source location, parts may be absent
     */
    public SourceLocation location() {
        return location;
    }

    /**
     * Returns the truth value the condition was expected to have.
     *
     * @return true for {@code successRequires}, false for {@code failTestIf}
     */
    public boolean expectedTruth() {
        return expectedTruth;
    }

    @Override
    public String getMessage() {
        return "Assertion " + conditionText().orElse("<unspecified>")
            + " should have been " + expectedTruth + " but was " + !expectedTruth;
    }
}
