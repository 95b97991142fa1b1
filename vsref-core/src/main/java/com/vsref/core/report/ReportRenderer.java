package com.vsref.core.report;

/**
 * Interface for report renderers.
 *
 * <p>Renderers turn a {@link SolutionReport} into text for the console or a file. Use
 * {@link ReportRenderers#forFormat(String, boolean)} to pick one by format name.
 */
public interface ReportRenderer {

    /**
     * Returns the format name used to select this renderer (e.g. "text", "json").
     *
     * @return lowercase format name
     */
    String getFormat();

    /**
     * Renders the report.
     *
     * @param report report to render
     * @return rendered report, ending with a line separator
     */
    String render(SolutionReport report);
}
