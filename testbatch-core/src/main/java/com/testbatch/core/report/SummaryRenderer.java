package com.testbatch.core.report;

import com.testbatch.core.model.BatchReport;

import java.io.PrintStream;

/**
 * Writes the summary of a finished batch.
 *
 * <p>The registry calls the renderer once per non-empty run, after every test of the batch
 * has been executed. Renderers only format; they never change the report.
 *
 * @see ConsoleSummaryRenderer
 */
public interface SummaryRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * @return renderer identifier, lowercase (e.g. "console")
     */
    String getId();

    /**
     * Renders the batch summary.
     *
     * @param report the finished batch
     * @param out report sink
     */
    void render(BatchReport report, PrintStream out);
}
