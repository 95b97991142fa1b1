package com.vsref.core.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Factory methods for the built-in {@link LineReader} implementations.
 */
public final class LineReaders {

    private LineReaders() {
        // Utility class
    }

    /**
     * Returns the factory used when no other is configured: UTF-8 files on disk.
     *
     * @return default factory
     */
    public static LineReaderFactory fileFactory() {
        return FileLineReader::new;
    }

    public static LineReader forFile(Path path) throws IOException {
        return new FileLineReader(path);
    }

    public static LineReader forText(String text) {
        return new StringLineReader(text);
    }
}
