package com.vsref.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Root configuration for reference resolution.
 *
 * <p>Loaded from {@code vsref.yaml}. Missing sections and keys take their default values,
 * so a partial file is always valid. Command-line options override these values.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * search:
 *   recursive: true
 *
 * resolve:
 *   cascade: true
 *   failFast: false
 *
 * output:
 *   format: json
 *   colors: false
 * }</pre>
 *
 * @param search argument expansion settings
 * @param resolve loading settings
 * @param output report settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResolverConfig(
    @JsonProperty("search") SearchConfig search,
    @JsonProperty("resolve") ResolveConfig resolve,
    @JsonProperty("output") OutputConfig output
) {
    public ResolverConfig {
        search = search != null ? search : SearchConfig.defaults();
        resolve = resolve != null ? resolve : ResolveConfig.defaults();
        output = output != null ? output : OutputConfig.defaults();
    }

    /**
     * Creates the default configuration: non-recursive search, no cascade, stop at the
     * first failure, colored text output.
     *
     * @return default configuration
     */
    public static ResolverConfig defaults() {
        return new ResolverConfig(SearchConfig.defaults(), ResolveConfig.defaults(), OutputConfig.defaults());
    }

    /**
     * @param recursive whether wildcard arguments also match in subdirectories
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SearchConfig(
        @JsonProperty("recursive") Boolean recursive
    ) {
        public SearchConfig {
            recursive = recursive != null ? recursive : Boolean.FALSE;
        }

        public static SearchConfig defaults() {
            return new SearchConfig(false);
        }
    }

    /**
     * @param cascade whether project files and web-site directories are loaded too
     * @param failFast whether to stop at the first file that fails to load
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ResolveConfig(
        @JsonProperty("cascade") Boolean cascade,
        @JsonProperty("failFast") Boolean failFast
    ) {
        public ResolveConfig {
            cascade = cascade != null ? cascade : Boolean.FALSE;
            failFast = failFast != null ? failFast : Boolean.TRUE;
        }

        public static ResolveConfig defaults() {
            return new ResolveConfig(false, true);
        }
    }

    /**
     * @param format report format, {@code text} or {@code json}
     * @param colors whether text reports use ANSI colors
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("format") String format,
        @JsonProperty("colors") Boolean colors
    ) {
        public static final String FORMAT_TEXT = "text";
        public static final String FORMAT_JSON = "json";

        public OutputConfig {
            format = format == null || format.isBlank() ? FORMAT_TEXT : format.trim().toLowerCase(Locale.ROOT);
            colors = colors != null ? colors : Boolean.TRUE;
        }

        public static OutputConfig defaults() {
            return new OutputConfig(FORMAT_TEXT, true);
        }
    }
}
