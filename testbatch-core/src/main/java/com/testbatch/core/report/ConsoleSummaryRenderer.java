package com.testbatch.core.report;

import com.testbatch.core.model.BatchReport;
import com.testbatch.core.model.FailedTest;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * Renders the human-readable batch summary.
 *
 * <p><b>All tests passed:</b>
 * <pre>
 * All tests (3) passed for batch 0.
 * </pre>
 *
 * <p><b>Some tests failed:</b>
 * <pre>
 * 2 out of 3 test(s) failed for batch 1:
 * Following test(s) failed:
 *     0 (ParserTests::rejectsEmptyInput)
 *     2 (&lt;Unnamed test&gt;)
 * </pre>
 *
 * <p>ANSI colors are added around each line when {@link ReportSettings#colors()} is set.
 */
public class ConsoleSummaryRenderer implements SummaryRenderer {

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_RED = "\u001B[31m";

    private final ReportSettings settings;

    public ConsoleSummaryRenderer() {
        this(ReportSettings.defaults());
    }

    public ConsoleSummaryRenderer(ReportSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(BatchReport report, PrintStream out) {
        if (report.allPassed()) {
            out.println(colored(ANSI_BOLD + ANSI_GREEN,
                "All tests (" + report.total() + ") passed for batch " + report.batchIndex() + "."));
            out.flush();
            return;
        }

        List<FailedTest> failures = report.failures();
        out.println(colored(ANSI_BOLD + ANSI_RED,
            failures.size() + " out of " + report.total() + " test(s) failed for batch " + report.batchIndex() + ":"));
        out.println("Following test(s) failed:");
        for (FailedTest failure : failures) {
            out.println(colored(ANSI_RED, "    " + failure.index() + " (" + failure.name() + ")"));
        }
        out.println();
        out.flush();
    }

    private String colored(String color, String line) {
        return settings.colors() ? color + line + ANSI_RESET : line;
    }
}
