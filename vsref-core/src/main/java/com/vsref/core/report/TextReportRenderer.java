package com.vsref.core.report;

import com.vsref.core.config.ResolverConfig.OutputConfig;
import com.vsref.core.model.Language;
import com.vsref.core.model.ProjectKind;

/**
 * Renders a report as an indented tree with optional ANSI color formatting.
 *
 * <p>Colors can be disabled for CI environments or when redirecting output.
 *
 * <p><b>Example Output:</b>
 * <pre>{@code
 * /src/App.sln (format version 12)
 *   [C#] App {8E1B7E2A-...}
 *       /src/App/App.csproj
 *       /src/App/Program.cs
 *   [Web Site] WebSite
 *       /src/WebSite
 *
 * 1 solution(s), 2 reference(s), 0 failure(s)
 * }</pre>
 */
public class TextReportRenderer implements ReportRenderer {

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_RED = "\u001B[31m";

    private static final String INDENT = "  ";
    private static final String NL = System.lineSeparator();

    private final boolean useColors;

    public TextReportRenderer(boolean useColors) {
        this.useColors = useColors;
    }

    @Override
    public String getFormat() {
        return OutputConfig.FORMAT_TEXT;
    }

    @Override
    public String render(SolutionReport report) {
        StringBuilder out = new StringBuilder();

        for (SolutionNode solution : report.solutions()) {
            out.append(color(ANSI_BOLD + ANSI_CYAN, solution.path()))
                .append(" (format version ").append(solution.formatVersion()).append(')').append(NL);

            for (EntryNode entry : solution.entries()) {
                appendEntry(out, entry);
            }
        }

        if (report.hasFailures()) {
            out.append(NL).append(color(ANSI_BOLD + ANSI_RED, "Failures:")).append(NL);
            for (LoadFailure failure : report.failures()) {
                out.append(INDENT).append(color(ANSI_RED, "✗ " + failure.path()))
                    .append(": ").append(failure.message()).append(NL);
            }
        }

        out.append(NL).append(color(ANSI_GREEN, String.format("%d solution(s), %d reference(s), %d failure(s)",
            report.solutions().size(), report.projectCount(), report.failures().size()))).append(NL);
        return out.toString();
    }

    private void appendEntry(StringBuilder out, EntryNode entry) {
        out.append(INDENT).append('[').append(label(entry.kind())).append("] ")
            .append(color(ANSI_BOLD, entry.name()));
        if (!entry.uniqueId().isEmpty()) {
            out.append(" {").append(entry.uniqueId()).append('}');
        }
        out.append(NL);

        out.append(INDENT).append(INDENT).append(INDENT).append(entry.path()).append(NL);
        for (String sourceFile : entry.sourceFiles()) {
            out.append(INDENT).append(INDENT).append(INDENT).append(sourceFile).append(NL);
        }
    }

    private static String label(ProjectKind kind) {
        return kind.language().map(Language::displayName).orElse("Web Site");
    }

    private String color(String code, String text) {
        return useColors ? code + text + ANSI_RESET : text;
    }
}
