package com.testbatch.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.testbatch.core.report.ReportSettings;

import java.util.List;

/**
 * Root configuration for TestBatch runs.
 *
 * <p>Loaded from {@code testbatch.yaml}. Missing sections fall back to defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * report:
 *   colors: true
 *   separator: "="
 *   separatorWidth: 40
 *
 * suites:
 *   enabled:
 *     - counter
 * }</pre>
 *
 * @param report console report configuration
 * @param suites suite selection
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HarnessConfig(
    @JsonProperty("report") ReportConfig report,
    @JsonProperty("suites") SuiteConfig suites
) {
    /**
     * Creates the default configuration: plain output, every suite enabled.
     *
     * @return default configuration
     */
    public static HarnessConfig defaults() {
        return new HarnessConfig(
            new ReportConfig(false, ReportSettings.DEFAULT_SEPARATOR, ReportSettings.DEFAULT_SEPARATOR_WIDTH),
            new SuiteConfig(List.of())
        );
    }

    /**
     * Converts the report section to renderer settings.
     *
     * @return report settings, defaults where the section or a value is missing
     */
    public ReportSettings reportSettings() {
        if (report == null) {
            return ReportSettings.defaults();
        }
        return new ReportSettings(
            Boolean.TRUE.equals(report.colors()),
            report.separator(),
            report.separatorWidth() != null ? report.separatorWidth() : 0
        );
    }

    /**
     * Checks if a suite is enabled.
     *
     * @param suiteId suite identifier
     * @return true if no suite list is configured or the list contains the id
     */
    public boolean isSuiteEnabled(String suiteId) {
        return suites == null || suites.isEnabled(suiteId);
    }

    /**
     * Console report configuration.
     *
     * @param colors enable ANSI colors
     * @param separator header separator string
     * @param separatorWidth header separator repetitions
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ReportConfig(
        @JsonProperty("colors") Boolean colors,
        @JsonProperty("separator") String separator,
        @JsonProperty("separatorWidth") Integer separatorWidth
    ) {}

    /**
     * Suite selection.
     *
     * @param enabled enabled suite ids, empty for all suites
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SuiteConfig(
        @JsonProperty("enabled") List<String> enabled
    ) {
        /**
         * Checks if a suite is enabled.
         *
         * @param suiteId suite identifier
         * @return true if the list is empty or contains the id
         */
        public boolean isEnabled(String suiteId) {
            return enabled == null || enabled.isEmpty() || enabled.contains(suiteId);
        }
    }
}
