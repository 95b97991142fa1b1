package com.vsref.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Project types a solution file can reference and that this library resolves.
 *
 * <p>Each kind is identified in the solution file by its project type GUID. Solution files
 * routinely reference other types (setup projects, database projects, solution folders);
 * those have no {@code ProjectKind} and {@link #fromTypeId(String)} returns empty for them.
 *
 * <p><b>Solution File Entry:</b></p>
 * <pre>{@code
 * Project("{FAE04EC0-301F-11D3-BF4B-00C04F79EFBC}") = "Core", "src\Core\Core.csproj", "{GUID}"
 * }</pre>
 */
public enum ProjectKind {

    BASIC("F184B08F-C81C-45F6-A57F-5ABD9991F28F", Language.BASIC),
    CSHARP("FAE04EC0-301F-11D3-BF4B-00C04F79EFBC", Language.CSHARP),
    FSHARP("F2A71F9B-5D33-465A-A702-920D77279786", Language.FSHARP),

    /** Web-site directory; sources are found by scanning the directory, not a project file. */
    WEB_SITE("E24C65DC-7377-472B-9ABA-BC803B73C61A", null);

    private final String typeId;
    private final Language language;

    ProjectKind(String typeId, Language language) {
        this.typeId = typeId;
        this.language = language;
    }

    /**
     * Returns the project type GUID, upper case and without braces.
     *
     * @return type identifier
     */
    public String typeId() {
        return typeId;
    }

    /**
     * Returns the language of the project file, empty for {@link #WEB_SITE}.
     *
     * @return project language
     */
    public Optional<Language> language() {
        return Optional.ofNullable(language);
    }

    public boolean isProjectFile() {
        return language != null;
    }

    /**
     * Looks up the kind for a project type GUID.
     *
     * <p>Comparison ignores case and surrounding braces.
     *
     * @param typeId type GUID as found in the solution file
     * @return matching kind, or empty for unsupported project types
     */
    public static Optional<ProjectKind> fromTypeId(String typeId) {
        if (typeId == null) {
            return Optional.empty();
        }
        String normalized = normalizeTypeId(typeId);
        return Arrays.stream(values())
            .filter(kind -> kind.typeId.equals(normalized))
            .findFirst();
    }

    /**
     * Normalizes a GUID for comparison: strips braces and whitespace, upper-cases.
     *
     * @param typeId raw type GUID
     * @return normalized type GUID
     */
    public static String normalizeTypeId(String typeId) {
        String trimmed = typeId.trim();
        if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed.toUpperCase(Locale.ROOT);
    }
}
