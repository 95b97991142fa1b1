package com.vsref.core.io;

import java.io.Closeable;
import java.io.IOException;

/**
 * Forward-only, single-pass reader over the lines of a text source.
 *
 * <p>Callers must check {@link #hasMore()} before each {@link #readLine()}; reading past
 * the last line fails with {@link com.vsref.core.error.EndOfInputException}. Line
 * terminators are never part of the returned text.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * try (LineReader reader = LineReaders.forFile(path)) {
 *     while (reader.hasMore()) {
 *         String line = reader.readLine();
 *     }
 * }
 * }</pre>
 *
 * @see FileLineReader
 * @see StringLineReader
 */
public interface LineReader extends Closeable {

    /**
     * Returns whether another line is available.
     *
     * @return true if {@link #readLine()} will return a line
     * @throws IOException if the underlying source cannot be read
     */
    boolean hasMore() throws IOException;

    /**
     * Returns the next line without its terminator.
     *
     * @return next line
     * @throws com.vsref.core.error.EndOfInputException if the reader is exhausted
     * @throws IOException if the underlying source cannot be read
     */
    String readLine() throws IOException;

    /**
     * Returns the 1-based number of the line last returned by {@link #readLine()},
     * or {@code 0} before the first read.
     *
     * @return current line number
     */
    int lineNumber();

    /**
     * Returns a description of the source used in error messages.
     *
     * @return source description (file path or {@code "<text>"})
     */
    String source();
}
