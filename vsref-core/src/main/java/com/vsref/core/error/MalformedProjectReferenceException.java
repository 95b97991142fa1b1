package com.vsref.core.error;

/**
 * Thrown when a {@code Project ... EndProject} block of a solution file is unterminated,
 * does not match the project header grammar, or lacks metadata its type requires.
 */
public class MalformedProjectReferenceException extends FileFormatException {

    public MalformedProjectReferenceException(String message, int lineNumber) {
        super(message, lineNumber);
    }
}
