package com.vsref.core.solution;

import com.vsref.core.error.MalformedProjectReferenceException;
import com.vsref.core.io.LineReader;
import com.vsref.core.io.LineReaderFactory;
import com.vsref.core.io.LineReaders;
import com.vsref.core.model.ProjectEntry;
import com.vsref.core.model.ProjectKind;
import com.vsref.core.model.SolutionReference;
import com.vsref.core.model.VisualStudioFile;
import com.vsref.core.project.ProjectFile;
import com.vsref.core.project.WebSiteDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A Visual Studio solution file and the projects and web sites it references.
 *
 * <p>{@link #load()} reads the header and every {@code Project ... EndProject} block, and
 * sorts the references into typed collections:
 * <ul>
 *   <li>Visual Basic, C# and F# project files ({@link ProjectFile})</li>
 *   <li>web-site directories ({@link WebSiteDirectory})</li>
 * </ul>
 * References of other project types (solution folders, setup or database projects) are
 * skipped. Paths are resolved against the solution's directory. The returned handles are
 * not loaded; call their {@code load()} to read their own content.
 *
 * <p><b>Reload Policy:</b> every load starts by clearing the previous result. The new result
 * is published only after the whole file has been read, so after a failed load every
 * collection is empty and {@link #formatVersion()} is {@link FormatVersion#UNDEFINED}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SolutionFile solution = new SolutionFile("C:\\Sln\\App.sln");
 * solution.load();
 * for (ProjectFile project : solution.csharpProjectFiles()) {
 *     project.load();
 * }
 * }</pre>
 *
 * <p>Instances are not thread-safe.
 */
public class SolutionFile {

    public static final String SOLUTION_FILE_EXTENSION = ".sln";

    private static final Logger log = LoggerFactory.getLogger(SolutionFile.class);

    private final VisualStudioFile file;
    private final LineReaderFactory readerFactory;

    private final List<ProjectEntry> entries = new ArrayList<>();
    private final List<ProjectFile> basicProjectFiles = new ArrayList<>();
    private final List<ProjectFile> csharpProjectFiles = new ArrayList<>();
    private final List<ProjectFile> fsharpProjectFiles = new ArrayList<>();
    private final List<WebSiteDirectory> webSiteDirectories = new ArrayList<>();
    private final List<ProjectFile> projectFiles = new ArrayList<>();
    private int formatVersion = FormatVersion.UNDEFINED;

    /**
     * Creates a solution file read from disk as UTF-8.
     *
     * @param filePath path to the solution file
     * @throws IllegalArgumentException if the path is blank
     */
    public SolutionFile(String filePath) {
        this(filePath, LineReaders.fileFactory());
    }

    public SolutionFile(Path filePath) {
        this(filePath, LineReaders.fileFactory());
    }

    public SolutionFile(Path filePath, LineReaderFactory readerFactory) {
        this(new VisualStudioFile(filePath, SOLUTION_FILE_EXTENSION), readerFactory);
    }

    /**
     * Creates a solution file read through the given factory.
     *
     * @param filePath path to the solution file
     * @param readerFactory opens the line reader used by {@link #load()}
     * @throws IllegalArgumentException if the path is blank
     */
    public SolutionFile(String filePath, LineReaderFactory readerFactory) {
        this(VisualStudioFile.of(filePath, SOLUTION_FILE_EXTENSION), readerFactory);
    }

    private SolutionFile(VisualStudioFile file, LineReaderFactory readerFactory) {
        this.file = file;
        this.readerFactory = Objects.requireNonNull(readerFactory, "readerFactory must not be null");
    }

    /**
     * Reads the solution file, replacing the result of any previous load.
     *
     * @throws com.vsref.core.error.NotFoundException if the file does not exist
     * @throws com.vsref.core.error.WrongExtensionException if the file is not a {@code .sln} file
     * @throws com.vsref.core.error.MalformedSolutionFileException if the header is missing
     * @throws com.vsref.core.error.MalformedHeaderException if the header version is invalid
     * @throws MalformedProjectReferenceException if a project block is malformed
     * @throws IOException if the file cannot be read
     */
    public void load() throws IOException {
        clear();
        file.checkLoadable();

        log.debug("Reading solution file: {}", file.path());

        int version;
        List<ProjectEntry> loaded = new ArrayList<>();
        try (LineReader reader = readerFactory.open(file.path())) {
            version = SolutionHeaderReader.read(reader);

            Optional<SolutionReference> reference;
            while ((reference = ProjectReferenceReader.read(reader, version)).isPresent()) {
                toEntry(reference.get(), reader.lineNumber()).ifPresent(loaded::add);
            }
        }

        publish(version, loaded);

        log.info("Loaded solution {} (format version {}): {} projects, {} web sites",
            file.fileName(), formatVersion, projectFiles.size(), webSiteDirectories.size());
    }

    private Optional<ProjectEntry> toEntry(SolutionReference reference, int lineNumber)
            throws MalformedProjectReferenceException {
        Optional<ProjectKind> kind = ProjectKind.fromTypeId(reference.typeId());
        if (kind.isEmpty()) {
            log.debug("Skipping project {} of unsupported type {}", reference.name(), reference.typeId());
            return Optional.empty();
        }

        Path path;
        try {
            path = file.resolve(reference.relativePath());
        } catch (InvalidPathException e) {
            throw new MalformedProjectReferenceException(
                "Invalid path '" + reference.relativePath() + "' for project " + reference.name(), lineNumber);
        }
        return Optional.of(new ProjectEntry(kind.get(), reference.name(), path, reference.uniqueId()));
    }

    private void publish(int version, List<ProjectEntry> loaded) {
        for (ProjectEntry entry : loaded) {
            if (entry.kind() == ProjectKind.WEB_SITE) {
                webSiteDirectories.add(WebSiteDirectory.from(entry));
                continue;
            }
            ProjectFile project = ProjectFile.from(entry);
            projectFiles.add(project);
            switch (entry.kind()) {
                case BASIC -> basicProjectFiles.add(project);
                case CSHARP -> csharpProjectFiles.add(project);
                case FSHARP -> fsharpProjectFiles.add(project);
                default -> throw new IllegalStateException("Unexpected project kind: " + entry.kind());
            }
        }
        entries.addAll(loaded);
        formatVersion = version;
    }

    private void clear() {
        entries.clear();
        basicProjectFiles.clear();
        csharpProjectFiles.clear();
        fsharpProjectFiles.clear();
        webSiteDirectories.clear();
        projectFiles.clear();
        formatVersion = FormatVersion.UNDEFINED;
    }

    /**
     * Returns the major format version of the last successfully loaded header.
     *
     * @return format version, or {@link FormatVersion#UNDEFINED} before a successful load
     */
    public int formatVersion() {
        return formatVersion;
    }

    /**
     * Returns every supported reference in file order.
     *
     * @return unmodifiable view of the resolved entries
     */
    public List<ProjectEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public List<ProjectFile> basicProjectFiles() {
        return Collections.unmodifiableList(basicProjectFiles);
    }

    public List<ProjectFile> csharpProjectFiles() {
        return Collections.unmodifiableList(csharpProjectFiles);
    }

    public List<ProjectFile> fsharpProjectFiles() {
        return Collections.unmodifiableList(fsharpProjectFiles);
    }

    /**
     * Returns the project files of all languages in file order.
     *
     * @return unmodifiable view of the project files
     */
    public List<ProjectFile> projectFiles() {
        return Collections.unmodifiableList(projectFiles);
    }

    public List<WebSiteDirectory> webSiteDirectories() {
        return Collections.unmodifiableList(webSiteDirectories);
    }

    public Path path() {
        return file.path();
    }

    public VisualStudioFile file() {
        return file;
    }

    @Override
    public String toString() {
        return file.path().toString();
    }
}
