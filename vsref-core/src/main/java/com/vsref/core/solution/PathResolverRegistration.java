package com.vsref.core.solution;

import com.vsref.core.model.ProjectKind;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * One row of the path resolver table: which resolver applies to which project type
 * from which format version on.
 *
 * @param typeId project type GUID, normalized to upper case without braces
 * @param minimumFormatVersion lowest format version the resolver applies to; raised to
 *        {@link FormatVersion#MINIMUM} if lower
 * @param factory creates the resolver
 */
public record PathResolverRegistration(
    String typeId,
    int minimumFormatVersion,
    Supplier<ProjectPathResolver> factory
) {
    public PathResolverRegistration {
        Objects.requireNonNull(typeId, "typeId must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
        if (typeId.isBlank()) {
            throw new IllegalArgumentException("typeId must not be blank");
        }
        typeId = ProjectKind.normalizeTypeId(typeId);
        minimumFormatVersion = Math.max(minimumFormatVersion, FormatVersion.MINIMUM);
    }

    /**
     * Checks whether this registration applies to a reference.
     *
     * @param referenceTypeId type GUID of the reference (braces and case ignored)
     * @param formatVersion format version of the solution file
     * @return true if the type matches and the format version is high enough
     */
    public boolean matches(String referenceTypeId, int formatVersion) {
        return referenceTypeId != null
            && typeId.equals(ProjectKind.normalizeTypeId(referenceTypeId))
            && formatVersion >= minimumFormatVersion;
    }
}
