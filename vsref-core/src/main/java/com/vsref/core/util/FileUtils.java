package com.vsref.core.util;

import java.io.File;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private static final char WINDOWS_SEPARATOR = '\\';

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds regular files in a directory whose file name matches a wildcard.
     *
     * <p>Example patterns: {@code *.cs}, {@code App?.sln}. Only {@code *} and {@code ?} are
     * wildcards; brackets and braces match themselves. Results are sorted by path.
     *
     * @param directory directory to search
     * @param fileNamePattern wildcard matched against file names only
     * @param recursive whether to descend into subdirectories
     * @return matching paths
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path directory, String fileNamePattern, boolean recursive) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + Wildcard.toGlob(fileNamePattern));
        int maxDepth = recursive ? Integer.MAX_VALUE : 1;

        try (Stream<Path> paths = Files.walk(directory, maxDepth)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> matcher.matches(path.getFileName()))
                .sorted()
                .toList();
        }
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return extension including the leading dot (e.g. {@code .sln}), or empty string if none
     */
    public static String getExtension(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? name.substring(lastDot) : "";
    }

    /**
     * Gets the file name without its extension.
     *
     * @param path file path
     * @return file name without extension
     */
    public static String getFileNameWithoutExtension(Path path) {
        String name = path.getFileName().toString();
        int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? name.substring(0, lastDot) : name;
    }

    /**
     * Converts Windows directory separators to the platform separator.
     *
     * <p>Solution and project files always use {@code \}; on Windows this is a no-op.
     *
     * @param path path string
     * @return path string with platform separators
     */
    public static String toPlatformSeparators(String path) {
        return path.replace(WINDOWS_SEPARATOR, File.separatorChar);
    }

    /**
     * Validates that a required string argument is present.
     *
     * @param value argument value
     * @param name argument name for the error message
     * @return the value
     * @throws IllegalArgumentException if the value is null, empty or whitespace only
     */
    public static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }
}
