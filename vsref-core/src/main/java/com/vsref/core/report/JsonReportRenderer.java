package com.vsref.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vsref.core.config.ResolverConfig.OutputConfig;

/**
 * Renders a report as pretty-printed JSON.
 *
 * <p>Record components become object fields; project kinds are written by enum name.
 */
public class JsonReportRenderer implements ReportRenderer {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String getFormat() {
        return OutputConfig.FORMAT_JSON;
    }

    @Override
    public String render(SolutionReport report) {
        try {
            return JSON_MAPPER.writeValueAsString(report) + System.lineSeparator();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report", e);
        }
    }
}
