package com.testbatch.core.model;

import java.util.Objects;

/**
 * A registered unit test.
 *
 * <p>A test case is immutable. It lives in the pending list of a registry batch until that
 * batch is run, then it is discarded.
 *
 * @param name display label, defaults to {@link #DEFAULT_NAME} when null or blank
 * @param body test body to execute
 */
public record TestCase(
    String name,
    TestBody body
) {
    /**
     * Label used for tests registered without a usable name.
     */
    public static final String DEFAULT_NAME = "<Unnamed test>";

    /**
     * Compact constructor with validation.
     */
    public TestCase {
        Objects.requireNonNull(body, "body must not be null");
        if (name == null || name.isBlank()) {
            name = DEFAULT_NAME;
        }
    }

    /**
     * Creates an unnamed test case.
     *
     * @param body test body
     * @return test case labelled {@link #DEFAULT_NAME}
     */
    public static TestCase unnamed(TestBody body) {
        return new TestCase(null, body);
    }
}
