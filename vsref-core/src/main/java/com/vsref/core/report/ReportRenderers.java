package com.vsref.core.report;

import com.vsref.core.config.ResolverConfig.OutputConfig;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Lookup of the available {@link ReportRenderer} implementations.
 */
public final class ReportRenderers {

    private ReportRenderers() {
        // Utility class
    }

    public static List<String> formats() {
        return List.of(OutputConfig.FORMAT_TEXT, OutputConfig.FORMAT_JSON);
    }

    /**
     * Returns the renderer for a format name.
     *
     * @param format format name, case-insensitive
     * @param colors whether the text renderer uses ANSI colors
     * @return renderer, or empty if the format is unknown
     */
    public static Optional<ReportRenderer> forFormat(String format, boolean colors) {
        if (format == null) {
            return Optional.empty();
        }
        return switch (format.trim().toLowerCase(Locale.ROOT)) {
            case OutputConfig.FORMAT_TEXT -> Optional.of(new TextReportRenderer(colors));
            case OutputConfig.FORMAT_JSON -> Optional.of(new JsonReportRenderer());
            default -> Optional.empty();
        };
    }
}
