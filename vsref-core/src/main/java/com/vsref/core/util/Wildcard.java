package com.vsref.core.util;

/**
 * File name wildcards accepted in path arguments. Only {@code *} and {@code ?} are special.
 */
public final class Wildcard {

    public static final String ASTERISK = "*";
    public static final String QUESTION = "?";

    // Glob syntax that is literal in a wildcard
    private static final String GLOB_METACHARACTERS = "\\[]{}";

    private Wildcard() {
        // Utility class
    }

    /**
     * Returns a pattern matching every file with the given extension.
     *
     * @param extension extension including the leading dot
     * @return pattern such as {@code *.cs}
     */
    public static String forExtension(String extension) {
        return ASTERISK + extension;
    }

    public static boolean hasWildcard(String path) {
        if (path == null || path.isBlank()) {
            return false;
        }
        return path.contains(ASTERISK) || path.contains(QUESTION);
    }

    /**
     * Converts a wildcard to a {@code glob:} pattern, escaping every other glob metacharacter.
     *
     * @param wildcard file name pattern using {@code *} and {@code ?}
     * @return equivalent glob pattern
     */
    public static String toGlob(String wildcard) {
        StringBuilder glob = new StringBuilder(wildcard.length() + 8);
        for (char c : wildcard.toCharArray()) {
            if (GLOB_METACHARACTERS.indexOf(c) >= 0) {
                glob.append('\\');
            }
            glob.append(c);
        }
        return glob.toString();
    }
}
