package com.vsref.core.solution;

import com.vsref.core.error.MalformedHeaderException;
import com.vsref.core.error.MalformedSolutionFileException;
import com.vsref.core.io.LineReader;

import java.io.IOException;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the solution file header and extracts the format version.
 *
 * <p><b>Header Format:</b></p>
 * <pre>{@code
 * Microsoft Visual Studio Solution File, Format Version 12.00
 * }</pre>
 *
 * <p>The header is expected on one of the first two lines; Visual Studio writes a blank
 * first line in some versions. A byte order mark and surrounding whitespace are ignored.
 */
public final class SolutionHeaderReader {

    static final String PREFIX = "Microsoft Visual Studio Solution File, Format Version";

    private static final int MAXIMUM_LINES_TO_READ = 2;
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    // Dotted version with 2 to 4 numeric components, e.g. 12.00
    private static final Pattern VERSION_PATTERN = Pattern.compile("^(?<major>\\d+)(?:\\.\\d+){1,3}$");

    private SolutionHeaderReader() {
        // Utility class
    }

    /**
     * Reads up to two lines looking for the header and returns its major format version.
     *
     * @param reader reader positioned at the start of the solution file
     * @return major format version (e.g. {@code 12})
     * @throws MalformedSolutionFileException if no header is found within two lines
     * @throws MalformedHeaderException if the header's version cannot be parsed
     * @throws IOException if the reader fails
     */
    public static int read(LineReader reader) throws IOException {
        Objects.requireNonNull(reader, "reader must not be null");

        for (int line = 0; line < MAXIMUM_LINES_TO_READ && reader.hasMore(); line++) {
            String candidate = normalize(reader.readLine());
            if (candidate.startsWith(PREFIX)) {
                return parseFormatVersion(candidate.substring(PREFIX.length()), reader.lineNumber());
            }
        }

        throw new MalformedSolutionFileException(
            "No solution file header found in the first " + MAXIMUM_LINES_TO_READ + " lines of " + reader.source());
    }

    /**
     * Parses the text following the header prefix.
     *
     * @param versionText text after the prefix, e.g. {@code " 12.00"}
     * @param lineNumber line of the header, for error messages
     * @return major version
     * @throws MalformedHeaderException if the text is not a dotted version number
     */
    static int parseFormatVersion(String versionText, int lineNumber) throws MalformedHeaderException {
        String version = versionText.trim();
        Matcher matcher = VERSION_PATTERN.matcher(version);
        if (!matcher.matches()) {
            throw new MalformedHeaderException("Invalid solution file format version '" + version + "'", lineNumber);
        }

        try {
            return Integer.parseInt(matcher.group("major"));
        } catch (NumberFormatException e) {
            throw new MalformedHeaderException("Solution file format version out of range: " + version, lineNumber);
        }
    }

    private static String normalize(String line) {
        String stripped = line.isEmpty() || line.charAt(0) != BYTE_ORDER_MARK ? line : line.substring(1);
        return stripped.strip();
    }
}
