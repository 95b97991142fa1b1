package com.vsref.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A solution reference of a supported kind, with its path resolved against the
 * solution directory.
 *
 * @param kind project kind
 * @param name project name from the solution
 * @param path project file or web-site directory path
 * @param uniqueId project GUID without braces
 */
public record ProjectEntry(
    ProjectKind kind,
    String name,
    Path path,
    String uniqueId
) {
    public ProjectEntry {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(path, "path must not be null");
        if (uniqueId == null) {
            uniqueId = "";
        }
    }
}
