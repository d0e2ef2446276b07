package com.testbatch.core.check;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FatalAssertion}.
 *
 * <p>The terminator records the requested status instead of ending the JVM.
 */
class FatalAssertionTest {

    private ByteArrayOutputStream errorStream;
    private List<Integer> statuses;
    private FatalAssertion fatalAssertion;

    @BeforeEach
    void setUp() {
        errorStream = new ByteArrayOutputStream();
        statuses = new ArrayList<>();
        fatalAssertion = new FatalAssertion(
            new PrintStream(errorStream, true, StandardCharsets.UTF_8), statuses::add);
    }

    private String errors() {
        return errorStream.toString(StandardCharsets.UTF_8);
    }

    @Test
    void check_trueCondition_writesNothingAndReturns() {
        assertThatCode(() -> fatalAssertion.check(true, "never shown", "x", "X.java", 1))
            .doesNotThrowAnyException();

        assertThat(errors()).isEmpty();
        assertThat(statuses).isEmpty();
    }

    @Test
    void check_falseCondition_writesDiagnosticAndTerminates() {
        assertThatThrownBy(() -> fatalAssertion.check(false, "size mismatch", "a.size() == b.size()", "Merge.java", 12))
            .isInstanceOf(IllegalStateException.class);

        assertThat(errors())
            .contains("Assertion a.size() == b.size() failed.")
            .contains("    Message: size mismatch")
            .contains("    File: Merge.java")
            .contains("    Line: 12");
        assertThat(statuses).containsExactly(ProcessTerminator.ABORT_STATUS);
    }

    @Test
    void check_missingFields_usePlaceholders() {
        assertThatThrownBy(() -> fatalAssertion.check(false, null, null, null, null))
            .isInstanceOf(IllegalStateException.class);

        assertThat(errors())
            .contains("Assertion <No condition literal specified> failed.")
            .contains("Message: <No error message specified>")
            .contains("File: <Unspecified file>")
            .contains("Line: <Unspecified line>");
    }

    @Test
    void check_withMessageOnly_recordsCallerLocation() {
        assertThatThrownBy(() -> fatalAssertion.check(false, "boom"))
            .isInstanceOf(IllegalStateException.class);

        assertThat(errors())
            .contains("Message: boom")
            .contains("File: FatalAssertionTest.java");
    }

    @Test
    void check_terminatorThatReturns_neverReturnsNormally() {
        assertThatThrownBy(() -> fatalAssertion.check(false, "m", "c", "f", 1))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("terminator returned");
    }

    @Test
    void standard_usesCurrentStandardError() {
        PrintStream originalErr = System.err;
        PrintStream replacement = new PrintStream(errorStream, true, StandardCharsets.UTF_8);
        System.setErr(replacement);
        try {
            assertThat(FatalAssertion.standard().sink()).isSameAs(replacement);
        } finally {
            System.setErr(originalErr);
        }
    }
}
