package com.testbatch.core.report;

/**
 * Console formatting settings shared by the classifier and the summary renderer.
 *
 * @param colors whether summary lines are wrapped in ANSI color codes
 * @param separator string repeated to draw the test header separator
 * @param separatorWidth number of separator repetitions
 */
public record ReportSettings(
    boolean colors,
    String separator,
    int separatorWidth
) {
    public static final String DEFAULT_SEPARATOR = "-";
    public static final int DEFAULT_SEPARATOR_WIDTH = 54;

    /**
     * Compact constructor with defaults.
     */
    public ReportSettings {
        if (separator == null || separator.isEmpty()) {
            separator = DEFAULT_SEPARATOR;
        }
        if (separatorWidth <= 0) {
            separatorWidth = DEFAULT_SEPARATOR_WIDTH;
        }
    }

    /**
     * Returns plain-text settings with the default separator.
     *
     * @return default settings
     */
    public static ReportSettings defaults() {
        return new ReportSettings(false, DEFAULT_SEPARATOR, DEFAULT_SEPARATOR_WIDTH);
    }

    /**
     * Returns the full separator line.
     *
     * @return separator repeated {@link #separatorWidth()} times
     */
    public String separatorLine() {
        return separator.repeat(separatorWidth);
    }
}
