package com.vsref.core.report;

/**
 * A file that could not be loaded.
 *
 * @param path file or directory path
 * @param error exception simple class name
 * @param message exception message
 */
public record LoadFailure(
    String path,
    String error,
    String message
) {
    public static LoadFailure of(String path, Exception exception) {
        return new LoadFailure(path, exception.getClass().getSimpleName(), exception.getMessage());
    }
}
