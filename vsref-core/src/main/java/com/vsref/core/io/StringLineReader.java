package com.vsref.core.io;

import com.vsref.core.error.EndOfInputException;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * {@link LineReader} over in-memory text.
 *
 * <p>Both {@code \n} and {@code \r\n} separate lines. Empty text has no lines; text that
 * ends with a separator yields a trailing empty line, as splitting does.
 */
public class StringLineReader implements LineReader {

    private static final Pattern LINE_SEPARATOR = Pattern.compile("\r\n|\n");
    private static final String SOURCE = "<text>";

    private final List<String> lines;
    private int position;

    public StringLineReader(String text) {
        Objects.requireNonNull(text, "text must not be null");
        this.lines = text.isEmpty() ? List.of() : List.of(LINE_SEPARATOR.split(text, -1));
        this.position = 0;
    }

    @Override
    public boolean hasMore() {
        return position < lines.size();
    }

    @Override
    public String readLine() throws EndOfInputException {
        if (!hasMore()) {
            throw new EndOfInputException(SOURCE);
        }
        return lines.get(position++);
    }

    @Override
    public int lineNumber() {
        return position;
    }

    @Override
    public String source() {
        return SOURCE;
    }

    @Override
    public void close() {
        // Nothing to release
    }
}
