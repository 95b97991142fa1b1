package com.vsref.core.error;

import java.nio.file.Path;

/**
 * Thrown when a file's extension does not match the extension its type requires.
 */
public class WrongExtensionException extends VisualStudioFileException {

    private final String expectedExtension;

    public WrongExtensionException(Path path, String expectedExtension) {
        super("Invalid file extension for " + path + " (expected " + expectedExtension + ")");
        this.expectedExtension = expectedExtension;
    }

    public String getExpectedExtension() {
        return expectedExtension;
    }
}
