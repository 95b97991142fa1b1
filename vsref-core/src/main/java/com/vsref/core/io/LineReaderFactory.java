package com.vsref.core.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens a {@link LineReader} for a path.
 */
@FunctionalInterface
public interface LineReaderFactory {

    /**
     * Opens a reader positioned before the first line of the file.
     *
     * @param path file to read
     * @return open reader; the caller closes it
     * @throws IOException if the file cannot be opened
     */
    LineReader open(Path path) throws IOException;
}
