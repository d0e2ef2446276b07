package com.testbatch.core.model;

import java.io.Serializable;

/**
 * Body of a single unit test.
 *
 * <p>A body returns {@code true} when the test passed and {@code false} when it failed
 * without raising anything. Any exception thrown from the body is classified by the
 * {@link com.testbatch.core.runner.OutcomeClassifier}.
 *
 * <p>The interface is {@link Serializable} so that a method reference passed to
 * {@code TestRegistry.register(TestBody)} exposes its target method, which is used as the
 * test's display name.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * TestBody body = () -> Integer.parseInt("42") == 42;
 * TestBody reference = ParserTests::parsesPositiveNumbers;
 * }</pre>
 */
@FunctionalInterface
public interface TestBody extends Serializable {

    /**
     * Runs the test.
     *
     * @return true if the test passed
     * @throws Exception any error raised by the code under test
     */
    boolean run() throws Exception;
}
