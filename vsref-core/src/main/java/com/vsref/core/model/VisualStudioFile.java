package com.vsref.core.model;

import com.vsref.core.error.NotFoundException;
import com.vsref.core.error.WrongExtensionException;
import com.vsref.core.util.FileUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * A Visual Studio file (solution or project) located by path, with the extension its
 * type requires.
 *
 * <p>{@link #checkLoadable()} is the gate every loader runs before reading: the file must
 * exist and carry the expected extension (case-insensitive).
 *
 * @param path file path, with Windows separators converted to the platform separator
 * @param expectedExtension required extension including the leading dot
 */
public record VisualStudioFile(
    Path path,
    String expectedExtension
) {
    public VisualStudioFile {
        if (path == null) {
            throw new IllegalArgumentException("path must not be null");
        }
        FileUtils.requireNonBlank(expectedExtension, "expectedExtension");
    }

    /**
     * Creates a file from a path string as found in solution files or on the command line.
     *
     * @param filePath file path; must not be blank
     * @param expectedExtension required extension including the leading dot
     * @return located file
     * @throws IllegalArgumentException if either argument is blank
     */
    public static VisualStudioFile of(String filePath, String expectedExtension) {
        FileUtils.requireNonBlank(filePath, "filePath");
        return new VisualStudioFile(Paths.get(FileUtils.toPlatformSeparators(filePath)), expectedExtension);
    }

    /**
     * Returns the containing directory, or the current directory for a bare file name.
     *
     * @return directory path
     */
    public Path directory() {
        Path parent = path.getParent();
        return parent != null ? parent : Paths.get("").toAbsolutePath();
    }

    public String fileName() {
        return path.getFileName().toString();
    }

    public String fileNameNoExtension() {
        return FileUtils.getFileNameWithoutExtension(path);
    }

    /**
     * Resolves a path found inside this file against the file's directory.
     *
     * @param relativePath path relative to this file, Windows or platform separators
     * @return resolved path
     */
    public Path resolve(String relativePath) {
        return directory().resolve(FileUtils.toPlatformSeparators(relativePath));
    }

    /**
     * Verifies that the file exists and has the expected extension.
     *
     * @throws NotFoundException if the file does not exist
     * @throws WrongExtensionException if the extension differs from the expected one
     */
    public void checkLoadable() throws NotFoundException, WrongExtensionException {
        if (!Files.isRegularFile(path)) {
            throw new NotFoundException(path);
        }
        if (!expectedExtension.equalsIgnoreCase(FileUtils.getExtension(path))) {
            throw new WrongExtensionException(path, expectedExtension);
        }
    }
}
