package com.vsref.core.error;

/**
 * Thrown when the content of a Visual Studio file does not follow its format.
 *
 * <p>Carries the 1-based line number of the offending line when it is known,
 * or {@code 0} otherwise.
 */
public class FileFormatException extends VisualStudioFileException {

    private final int lineNumber;

    public FileFormatException(String message) {
        this(message, 0);
    }

    public FileFormatException(String message, int lineNumber) {
        super(lineNumber > 0 ? message + " (line " + lineNumber + ")" : message);
        this.lineNumber = lineNumber;
    }

    public FileFormatException(String message, Throwable cause) {
        super(message, cause);
        this.lineNumber = 0;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
