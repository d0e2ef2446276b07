package com.testbatch.core.runner;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ErrorCategory}.
 */
class ErrorCategoryTest {

    @Test
    void of_matchesMostSpecificCategoryFirst() {
        assertThat(ErrorCategory.of(new NumberFormatException())).contains(ErrorCategory.INVALID_ARGUMENT);
        assertThat(ErrorCategory.of(new IllegalStateException())).contains(ErrorCategory.ILLEGAL_STATE);
        assertThat(ErrorCategory.of(new ArithmeticException())).contains(ErrorCategory.RUNTIME_ERROR);
        assertThat(ErrorCategory.of(new IOException())).contains(ErrorCategory.EXCEPTION);
    }

    @Test
    void of_error_isNotCategorized() {
        assertThat(ErrorCategory.of(new OutOfMemoryError())).isEmpty();
        assertThat(ErrorCategory.of(new Throwable())).isEmpty();
    }

    @Test
    void label_isSimpleTypeName() {
        assertThat(ErrorCategory.INVALID_ARGUMENT.label()).isEqualTo("IllegalArgumentException");
    }
}
