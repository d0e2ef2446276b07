package com.testbatch.core.model;

/**
 * How a single test execution ended.
 */
public enum OutcomeKind {
    /** Body returned {@code true}. */
    SUCCEEDED,
    /** Body returned {@code false} without raising anything. */
    RETURNED_FALSE,
    /** Body raised a structured condition failure from one of the checks. */
    CONDITION_FAILED,
    /** Body raised an exception of a known error category. */
    DOMAIN_ERROR,
    /** Body raised something outside every known category. */
    UNKNOWN_ERROR;

    /**
     * Returns whether this outcome counts as a passed test.
     *
     * @return true only for {@link #SUCCEEDED}
     */
    public boolean isPass() {
        return this == SUCCEEDED;
    }
}
