package com.testbatch.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated result of running one batch.
 *
 * <p>Outcomes are kept in registration order, so an outcome's position in
 * {@link #outcomes()} is the index reported for a failed test.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * registry.run().ifPresent(report -> {
 *     if (!report.allPassed()) {
 *         report.failures().forEach(f -> log.warn("{} ({}) failed", f.index(), f.name()));
 *     }
 * });
 * }</pre>
 *
 * @param batchIndex index of the batch, starting at 0
 * @param outcomes classified outcomes in registration order
 */
public record BatchReport(
    long batchIndex,
    List<TestOutcome> outcomes
) {
    /**
     * Compact constructor with validation.
     */
    public BatchReport {
        if (batchIndex < 0) {
            throw new IllegalArgumentException("batchIndex must not be negative: " + batchIndex);
        }
        Objects.requireNonNull(outcomes, "outcomes must not be null");
        outcomes = List.copyOf(outcomes);
    }

    /**
     * Returns the number of executed tests.
     *
     * @return test count
     */
    public int total() {
        return outcomes.size();
    }

    /**
     * Returns the failed tests in ascending index order.
     *
     * @return failed tests, empty if every test passed
     */
    public List<FailedTest> failures() {
        List<FailedTest> failed = new ArrayList<>();
        for (int i = 0; i < outcomes.size(); i++) {
            TestOutcome outcome = outcomes.get(i);
            if (!outcome.passed()) {
                failed.add(new FailedTest(i, outcome.testName()));
            }
        }
        return List.copyOf(failed);
    }

    /**
     * Returns the number of failed tests.
     *
     * @return failure count
     */
    public int failureCount() {
        return (int) outcomes.stream().filter(outcome -> !outcome.passed()).count();
    }

    /**
     * Returns true if no test of the batch failed.
     *
     * @return true if every outcome passed
     */
    public boolean allPassed() {
        return failureCount() == 0;
    }
}
