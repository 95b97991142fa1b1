package com.vsref.core.solution;

import com.vsref.core.model.ProjectKind;

import java.util.List;
import java.util.Optional;

/**
 * Table of the registered {@link ProjectPathResolver}s.
 *
 * <p>Most project types need no resolver: the path in the {@code Project(...)} header is
 * already the relative path of the project file. Add a row here to support another
 * project type that stores its path elsewhere in the block.
 */
public final class ProjectPathResolvers {

    private static final List<PathResolverRegistration> REGISTRATIONS = List.of(
        new PathResolverRegistration(
            ProjectKind.WEB_SITE.typeId(),
            FormatVersion.VISUAL_STUDIO_2012,
            WebSitePathResolver::new)
    );

    private ProjectPathResolvers() {
        // Utility class
    }

    /**
     * Finds the resolver for a reference, if any applies.
     *
     * @param typeId project type GUID of the reference
     * @param formatVersion format version of the solution file
     * @return resolver of the first matching registration, or empty to keep the header path
     */
    public static Optional<ProjectPathResolver> find(String typeId, int formatVersion) {
        if (typeId == null || typeId.isBlank()) {
            throw new IllegalArgumentException("typeId must not be blank");
        }
        return REGISTRATIONS.stream()
            .filter(registration -> registration.matches(typeId, formatVersion))
            .findFirst()
            .map(registration -> registration.factory().get());
    }

    /**
     * Returns all registrations in lookup order.
     *
     * @return unmodifiable list of registrations
     */
    public static List<PathResolverRegistration> registrations() {
        return REGISTRATIONS;
    }
}
