package com.vsref.core.error;

/**
 * Thrown when no solution file header is found within the first lines of a file.
 */
public class MalformedSolutionFileException extends FileFormatException {

    public MalformedSolutionFileException(String message) {
        super(message);
    }
}
