package com.vsref.core.solution;

import com.vsref.core.error.MalformedProjectReferenceException;
import com.vsref.core.io.LineReader;
import com.vsref.core.model.SolutionReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves the path of web-site references in solution files of format version 12 and later.
 *
 * <p>From Visual Studio 2012 on, the header path of a web site is a display name (often a
 * URL). The directory relative to the solution is stored in the {@code SlnRelativePath}
 * property of the block's first project section:
 *
 * <pre>{@code
 * Project("{E24C65DC-7377-472B-9ABA-BC803B73C61A}") = "WebSite", "http://localhost/WebSite", "{GUID}"
 *     ProjectSection(WebsiteProperties) = preProject
 *         TargetFrameworkMoniker = ".NETFramework,Version%3Dv4.5"
 *         SlnRelativePath = "WebSite\"
 *     EndProjectSection
 * EndProject
 * }</pre>
 */
public class WebSitePathResolver implements ProjectPathResolver {

    private static final Logger log = LoggerFactory.getLogger(WebSitePathResolver.class);

    static final String RELATIVE_PATH_KEY = "SlnRelativePath";

    private static final String END_SECTION = "EndProjectSection";
    private static final String END_PROJECT = "EndProject";
    private static final String NESTED_BEGIN = "Project(";

    // Format: KEY = "VALUE"
    private static final Pattern KEY_VALUE_PATTERN = Pattern.compile("^(?<key>[^=]+?)\\s*=\\s*\"(?<value>.+)\"$");

    @Override
    public String resolvePath(SolutionReference reference, LineReader reader) throws IOException {
        String relativePath = null;

        while (reader.hasMore()) {
            String line = reader.readLine().trim();

            if (line.equals(END_PROJECT)) {
                if (relativePath == null) {
                    throw missingKey(reference, reader);
                }
                log.debug("Resolved web site {} to {}", reference.name(), relativePath);
                return relativePath;
            }
            if (line.startsWith(NESTED_BEGIN)) {
                throw unterminated(reference, reader);
            }
            if (relativePath != null) {
                continue;
            }
            if (line.equals(END_SECTION)) {
                throw missingKey(reference, reader);
            }

            Matcher matcher = KEY_VALUE_PATTERN.matcher(line);
            if (matcher.matches() && RELATIVE_PATH_KEY.equals(matcher.group("key"))) {
                relativePath = matcher.group("value");
            }
        }

        throw unterminated(reference, reader);
    }

    private static MalformedProjectReferenceException unterminated(SolutionReference reference, LineReader reader) {
        return new MalformedProjectReferenceException(
            "Web site reference '" + reference.name() + "' is not terminated by " + END_PROJECT,
            reader.lineNumber());
    }

    private static MalformedProjectReferenceException missingKey(SolutionReference reference, LineReader reader) {
        return new MalformedProjectReferenceException(
            "Web site reference '" + reference.name() + "' has no " + RELATIVE_PATH_KEY + " property",
            reader.lineNumber());
    }
}
