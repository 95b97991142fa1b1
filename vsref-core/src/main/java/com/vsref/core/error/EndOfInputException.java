package com.vsref.core.error;

/**
 * Thrown by a {@link com.vsref.core.io.LineReader} asked for a line after it was exhausted.
 */
public class EndOfInputException extends VisualStudioFileException {

    public EndOfInputException(String source) {
        super("No more lines to read from " + source);
    }
}
