package com.testbatch.example;

import com.testbatch.core.runner.TestRegistry;
import com.testbatch.core.suite.TestSuite;

/**
 * Example suite exercising {@link ExampleCounter}.
 */
public class CounterSuite implements TestSuite {

    @Override
    public String getId() {
        return "counter";
    }

    @Override
    public String getDisplayName() {
        return "Example Counter Suite";
    }

    @Override
    public void registerTests(TestRegistry registry) {
        registry.register(CounterTests::incrementThenReset);
        registry.register(CounterTests::secondIncrementIsRejected);
        registry.register("increment after reset", CounterTests::incrementAfterResetSucceeds);
    }
}
