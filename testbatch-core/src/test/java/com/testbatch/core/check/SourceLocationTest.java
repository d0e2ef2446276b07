package com.testbatch.core.check;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SourceLocation}.
 */
class SourceLocationTest {

    @Test
    void unknown_hasNoParts() {
        assertThat(SourceLocation.UNKNOWN.fileName()).isEmpty();
        assertThat(SourceLocation.UNKNOWN.lineNumber()).isEmpty();
    }

    @Test
    void constructor_blankFileAndNonPositiveLine_becomeAbsent() {
        SourceLocation location = new SourceLocation("  ", -1);

        assertThat(location.fileName()).isEmpty();
        assertThat(location.lineNumber()).isEmpty();
    }

    @Test
    void partsAreIndependent() {
        SourceLocation fileOnly = new SourceLocation("A.java", null);
        SourceLocation lineOnly = new SourceLocation(null, 7);

        assertThat(fileOnly.fileName()).contains("A.java");
        assertThat(fileOnly.lineNumber()).isEmpty();
        assertThat(lineOnly.fileName()).isEmpty();
        assertThat(lineOnly.lineNumber()).hasValue(7);
    }

    @Test
    void ofCaller_returnsCallingFrame() {
        SourceLocation location = SourceLocation.ofCaller();

        assertThat(location.fileName()).contains("SourceLocationTest.java");
        assertThat(location.lineNumber()).isPresent();
    }
}
