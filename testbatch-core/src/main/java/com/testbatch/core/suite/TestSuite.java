package com.testbatch.core.suite;

import com.testbatch.core.runner.TestRegistry;

/**
 * A named group of tests that registers itself into a registry.
 *
 * <p>Suites are loaded through the Java Service Provider Interface. A suite names every
 * test it registers, nothing is discovered by reflection. The CLI runs each suite as one
 * batch.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class ParserSuite implements TestSuite {
 *     @Override
 *     public String getId() {
 *         return "parser";
 *     }
 *
 *     @Override
 *     public void registerTests(TestRegistry registry) {
 *         registry.register(ParserTests::parsesNumbers);
 *         registry.register("rejects empty input", ParserTests::rejectsEmptyInput);
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.testbatch.core.suite.TestSuite}
 */
public interface TestSuite {

    /**
     * Returns unique identifier for this suite.
     *
     * <p>Used in configuration and on the command line. Should be kebab-case.
     *
     * @return unique suite identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this suite.
     *
     * @return display name, defaults to the identifier
     */
    default String getDisplayName() {
        return getId();
    }

    /**
     * Registers the suite's tests, in execution order.
     *
     * @param registry registry to add tests to
     */
    void registerTests(TestRegistry registry);
}
