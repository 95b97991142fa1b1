package com.vsref.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Source languages whose project and source files are understood.
 */
public enum Language {

    BASIC("Visual Basic", ".vbproj", ".vb"),
    CSHARP("C#", ".csproj", ".cs"),
    FSHARP("F#", ".fsproj", ".fs");

    private final String displayName;
    private final String projectFileExtension;
    private final String sourceFileExtension;

    Language(String displayName, String projectFileExtension, String sourceFileExtension) {
        this.displayName = displayName;
        this.projectFileExtension = projectFileExtension;
        this.sourceFileExtension = sourceFileExtension;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Returns the project file extension including the leading dot (e.g. {@code .csproj}).
     *
     * @return project file extension
     */
    public String projectFileExtension() {
        return projectFileExtension;
    }

    /**
     * Returns the source file extension including the leading dot (e.g. {@code .cs}).
     *
     * @return source file extension
     */
    public String sourceFileExtension() {
        return sourceFileExtension;
    }

    public static Optional<Language> fromProjectFileExtension(String extension) {
        return Arrays.stream(values())
            .filter(language -> language.projectFileExtension.equalsIgnoreCase(extension))
            .findFirst();
    }

    public static Optional<Language> fromSourceFileExtension(String extension) {
        return Arrays.stream(values())
            .filter(language -> language.sourceFileExtension.equalsIgnoreCase(extension))
            .findFirst();
    }
}
