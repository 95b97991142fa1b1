package com.vsref.core.solution;

import com.vsref.core.io.LineReader;
import com.vsref.core.model.SolutionReference;

import java.io.IOException;

/**
 * Recovers the real relative path of a project reference whose header path is not the
 * path on disk.
 *
 * <p>A resolver receives the reader positioned just after the block's
 * {@code Project(...)} header line and owns the rest of the block: it must consume every
 * line up to and including {@code EndProject} before returning.
 *
 * <p>Resolvers are stateless and registered in {@link ProjectPathResolvers}.
 *
 * @see WebSitePathResolver
 */
@FunctionalInterface
public interface ProjectPathResolver {

    /**
     * Reads the remainder of the project block and returns the corrected relative path.
     *
     * @param reference reference parsed from the block's header line
     * @param reader reader positioned inside the block
     * @return corrected path relative to the solution directory
     * @throws com.vsref.core.error.MalformedProjectReferenceException if the block lacks the
     *         metadata the resolver needs or is not terminated
     * @throws IOException if the reader fails
     */
    String resolvePath(SolutionReference reference, LineReader reader) throws IOException;
}
