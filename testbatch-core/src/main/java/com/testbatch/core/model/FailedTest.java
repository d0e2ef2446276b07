package com.testbatch.core.model;

/**
 * Position and name of a test that failed within its batch.
 *
 * @param index zero-based registration index inside the batch
 * @param name display name of the test
 */
public record FailedTest(
    int index,
    String name
) {
}
