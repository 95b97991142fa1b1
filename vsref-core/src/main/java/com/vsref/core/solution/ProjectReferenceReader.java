package com.vsref.core.solution;

import com.vsref.core.error.MalformedProjectReferenceException;
import com.vsref.core.io.LineReader;
import com.vsref.core.model.SolutionReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads one project reference block from a solution file.
 *
 * <p><b>Block Format:</b></p>
 * <pre>{@code
 * Project("{FAE04EC0-301F-11D3-BF4B-00C04F79EFBC}") = "Core", "src\Core\Core.csproj", "{GUID}"
 *     ProjectSection(ProjectDependencies) = postProject
 *     EndProjectSection
 * EndProject
 * }</pre>
 *
 * <p>Lines outside blocks (the header, {@code Global} sections, comments) are skipped. A
 * line starting with {@code Project} outside a block must match the header grammar; a block
 * must be closed by a line that is exactly {@code EndProject}.
 *
 * @see ProjectPathResolvers
 */
public final class ProjectReferenceReader {

    private static final Logger log = LoggerFactory.getLogger(ProjectReferenceReader.class);

    private static final String BEGIN = "Project";
    private static final String NESTED_BEGIN = "Project(";
    private static final String END = "EndProject";

    private static final String GUID = "[0-9A-Fa-f-]+";

    // Format: Project("{TYPE-GUID}") = "Name", "RelativePath", "{UNIQUE-GUID}"
    private static final Pattern HEADER_PATTERN = Pattern.compile(
        "^Project\\(\"\\{(?<typeId>" + GUID + ")\\}\"\\)\\s*=\\s*"
            + "\"(?<name>[^\"]+)\"\\s*,\\s*"
            + "\"(?<path>[^\"]+)\"\\s*,\\s*"
            + "\"\\{(?<uniqueId>" + GUID + ")\\}\"\\s*$"
    );

    private ProjectReferenceReader() {
        // Utility class
    }

    /**
     * Reads the next project reference.
     *
     * <p>If a {@link ProjectPathResolver} applies to the reference's type and the format
     * version, it consumes the rest of the block and supplies the path; otherwise the header
     * path is kept and the block is read up to {@code EndProject}.
     *
     * @param reader reader positioned anywhere in the solution file
     * @param formatVersion format version from the solution file header
     * @return next reference, or empty if the input holds no further block
     * @throws MalformedProjectReferenceException if a block is malformed or unterminated,
     *         or {@code EndProject} appears without a block
     * @throws IOException if the reader fails
     */
    public static Optional<SolutionReference> read(LineReader reader, int formatVersion) throws IOException {
        Objects.requireNonNull(reader, "reader must not be null");

        SolutionReference reference = null;
        int beginLine = 0;

        while (reader.hasMore()) {
            String line = reader.readLine();

            if (reference == null) {
                if (line.startsWith(BEGIN)) {
                    beginLine = reader.lineNumber();
                    reference = parseHeader(line, beginLine);

                    Optional<ProjectPathResolver> resolver = ProjectPathResolvers.find(reference.typeId(), formatVersion);
                    if (resolver.isPresent()) {
                        return Optional.of(reference.withRelativePath(resolver.get().resolvePath(reference, reader)));
                    }
                } else if (line.equals(END)) {
                    throw new MalformedProjectReferenceException(
                        END + " without a matching " + BEGIN + " line", reader.lineNumber());
                }
            } else if (line.equals(END)) {
                return Optional.of(reference);
            } else if (line.startsWith(NESTED_BEGIN)) {
                throw unterminated(reference, beginLine);
            }
        }

        if (reference != null) {
            throw unterminated(reference, beginLine);
        }
        return Optional.empty();
    }

    /**
     * Parses a {@code Project(...)} header line.
     *
     * @param line header line
     * @param lineNumber line number for error messages
     * @return reference carrying the header path
     * @throws MalformedProjectReferenceException if the line does not match the grammar
     */
    static SolutionReference parseHeader(String line, int lineNumber) throws MalformedProjectReferenceException {
        Matcher matcher = HEADER_PATTERN.matcher(line);
        if (!matcher.matches()) {
            throw new MalformedProjectReferenceException("Invalid project reference: " + line, lineNumber);
        }

        SolutionReference reference = new SolutionReference(
            matcher.group("name"),
            matcher.group("path"),
            matcher.group("typeId"),
            matcher.group("uniqueId")
        );
        log.debug("Found project reference: {} (type={}, path={})",
            reference.name(), reference.typeId(), reference.relativePath());
        return reference;
    }

    private static MalformedProjectReferenceException unterminated(SolutionReference reference, int beginLine) {
        return new MalformedProjectReferenceException(
            "Project reference '" + reference.name() + "' is not terminated by " + END, beginLine);
    }
}
