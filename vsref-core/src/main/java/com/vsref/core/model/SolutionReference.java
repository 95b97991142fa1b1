package com.vsref.core.model;

import java.util.Objects;

/**
 * One {@code Project("{TYPE}") = "Name", "Path", "{GUID}" ... EndProject} block of a solution file.
 *
 * @param name project name as shown in the solution
 * @param relativePath project path relative to the solution directory, after path resolution
 * @param typeId project type GUID without braces
 * @param uniqueId project GUID without braces
 */
public record SolutionReference(
    String name,
    String relativePath,
    String typeId,
    String uniqueId
) {
    /**
     * Compact constructor with validation.
     */
    public SolutionReference {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(typeId, "typeId must not be null");
        Objects.requireNonNull(uniqueId, "uniqueId must not be null");
    }

    /**
     * Returns a copy of this reference with another relative path.
     *
     * @param path corrected relative path
     * @return new reference
     */
    public SolutionReference withRelativePath(String path) {
        return new SolutionReference(name, path, typeId, uniqueId);
    }
}
