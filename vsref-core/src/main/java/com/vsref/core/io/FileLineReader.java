package com.vsref.core.io;

import com.vsref.core.error.EndOfInputException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link LineReader} over a file on disk.
 *
 * <p>Lines are split by {@link BufferedReader#readLine()}, so {@code \n}, {@code \r\n}
 * and {@code \r} all terminate a line. One line is read ahead to answer {@link #hasMore()}.
 * The file handle is held until {@link #close()}. A leading byte order mark is kept
 * in the first line.
 */
public class FileLineReader implements LineReader {

    private final Path path;
    private final BufferedReader reader;
    private String nextLine;
    private boolean lookedAhead;
    private int lineNumber;

    public FileLineReader(Path path) throws IOException {
        this(path, StandardCharsets.UTF_8);
    }

    public FileLineReader(Path path, Charset charset) throws IOException {
        this.path = Objects.requireNonNull(path, "path must not be null");
        // Undecodable bytes become U+FFFD instead of failing the read
        this.reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path), charset));
    }

    @Override
    public boolean hasMore() throws IOException {
        if (!lookedAhead) {
            nextLine = reader.readLine();
            lookedAhead = true;
        }
        return nextLine != null;
    }

    @Override
    public String readLine() throws IOException {
        if (!hasMore()) {
            throw new EndOfInputException(path.toString());
        }
        String line = nextLine;
        nextLine = null;
        lookedAhead = false;
        lineNumber++;
        return line;
    }

    @Override
    public int lineNumber() {
        return lineNumber;
    }

    @Override
    public String source() {
        return path.toString();
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
