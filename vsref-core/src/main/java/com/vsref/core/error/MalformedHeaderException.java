package com.vsref.core.error;

/**
 * Thrown when the solution file header is present but its format version cannot be parsed.
 */
public class MalformedHeaderException extends FileFormatException {

    public MalformedHeaderException(String message, int lineNumber) {
        super(message, lineNumber);
    }
}
