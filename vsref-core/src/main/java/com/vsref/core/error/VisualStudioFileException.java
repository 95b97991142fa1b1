package com.vsref.core.error;

import java.io.IOException;

/**
 * Base class for failures raised while locating or reading Visual Studio files.
 *
 * <p>All subclasses are fatal to the current {@code load()} call and are propagated
 * to the caller unchanged. Callers that process several files decide on their own
 * whether to skip a failing file and continue with the others.
 *
 * @see FileFormatException
 * @since 1.0.0
 */
public class VisualStudioFileException extends IOException {

    public VisualStudioFileException(String message) {
        super(message);
    }

    public VisualStudioFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
