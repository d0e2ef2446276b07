package com.testbatch.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link BatchReport} and {@link TestCase}.
 */
class BatchReportTest {

    @Test
    void failures_reportsIndicesInAscendingOrder() {
        BatchReport report = new BatchReport(2, List.of(
            new TestOutcome("a", OutcomeKind.UNKNOWN_ERROR, null),
            new TestOutcome("b", OutcomeKind.SUCCEEDED, null),
            new TestOutcome("c", OutcomeKind.CONDITION_FAILED, null)));

        assertThat(report.total()).isEqualTo(3);
        assertThat(report.failureCount()).isEqualTo(2);
        assertThat(report.allPassed()).isFalse();
        assertThat(report.failures()).containsExactly(new FailedTest(0, "a"), new FailedTest(2, "c"));
    }

    @Test
    void constructor_negativeBatchIndex_throws() {
        assertThatThrownBy(() -> new BatchReport(-1, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void outcomes_areImmutable() {
        BatchReport report = new BatchReport(0, List.of(new TestOutcome("a", OutcomeKind.SUCCEEDED, "")));

        assertThatThrownBy(() -> report.outcomes().clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testCase_blankName_defaultsToPlaceholder() {
        assertThat(new TestCase(" ", () -> true).name()).isEqualTo(TestCase.DEFAULT_NAME);
        assertThat(TestCase.unnamed(() -> true).name()).isEqualTo(TestCase.DEFAULT_NAME);
    }

    @Test
    void testCase_nullBody_throws() {
        assertThatThrownBy(() -> new TestCase("x", null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("body");
    }
}
