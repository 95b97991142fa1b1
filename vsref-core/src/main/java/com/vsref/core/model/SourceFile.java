package com.vsref.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A located source file.
 *
 * <p>Source files are leaves of the reference tree: nothing is read from them, so no
 * existence or extension check is made.
 *
 * @param path file path
 * @param language source language
 */
public record SourceFile(
    Path path,
    Language language
) {
    public SourceFile {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(language, "language must not be null");
    }

    public String fileName() {
        return path.getFileName().toString();
    }

    public String extension() {
        return language.sourceFileExtension();
    }
}
