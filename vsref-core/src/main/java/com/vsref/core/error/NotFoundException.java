package com.vsref.core.error;

import java.nio.file.Path;

/**
 * Thrown when a file or directory does not exist at load time.
 */
public class NotFoundException extends VisualStudioFileException {

    private final transient Path path;

    public NotFoundException(Path path) {
        super("File not found at path: " + path);
        this.path = path;
    }

    public NotFoundException(String kind, Path path) {
        super(kind + " not found at path: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
