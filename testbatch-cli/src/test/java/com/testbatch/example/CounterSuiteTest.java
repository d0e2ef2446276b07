package com.testbatch.example;

import com.testbatch.core.model.BatchReport;
import com.testbatch.core.report.ReportSettings;
import com.testbatch.core.runner.TestRegistry;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CounterSuite} and {@link ExampleCounter}.
 */
class CounterSuiteTest {

    @Test
    void counter_incrementsOnlyOnceUntilReset() {
        ExampleCounter counter = new ExampleCounter();

        assertThat(counter.increment()).isTrue();
        assertThat(counter.increment()).isFalse();
        counter.reset();
        assertThat(counter.state()).isZero();
        assertThat(counter.increment()).isTrue();
    }

    @Test
    void suite_registersThreeTestsThatAllPass() {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        TestRegistry registry = new TestRegistry(
            new PrintStream(outputStream, true, StandardCharsets.UTF_8), ReportSettings.defaults());

        new CounterSuite().registerTests(registry);
        assertThat(registry.pendingCount()).isEqualTo(3);

        BatchReport report = registry.run().orElseThrow();

        assertThat(report.allPassed()).isTrue();
        assertThat(report.batchIndex()).isZero();
        assertThat(registry.batchIndex()).isEqualTo(1);
        assertThat(outputStream.toString(StandardCharsets.UTF_8)).contains("All tests (3) passed for batch 0.");
    }

    @Test
    void incrementThenReset_passesDirectly() {
        assertThat(CounterTests.incrementThenReset()).isTrue();
    }
}
