package com.vsref.core.project;

import com.vsref.core.error.NotFoundException;
import com.vsref.core.model.Language;
import com.vsref.core.model.ProjectEntry;
import com.vsref.core.model.SourceFile;
import com.vsref.core.util.FileUtils;
import com.vsref.core.util.Wildcard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A web-site directory referenced by a solution.
 *
 * <p>Web sites have no project file: {@link #load()} scans the directory tree for Visual
 * Basic and C# source files.
 */
public class WebSiteDirectory {

    private static final Logger log = LoggerFactory.getLogger(WebSiteDirectory.class);

    private final String name;
    private final Path directoryPath;
    private final List<SourceFile> basicSourceFiles = new ArrayList<>();
    private final List<SourceFile> csharpSourceFiles = new ArrayList<>();

    /**
     * Creates a web-site directory.
     *
     * @param name web site name
     * @param directoryPath directory path, Windows or platform separators
     * @throws IllegalArgumentException if either argument is blank
     */
    public WebSiteDirectory(String name, String directoryPath) {
        this(FileUtils.requireNonBlank(name, "name"),
            Paths.get(FileUtils.toPlatformSeparators(FileUtils.requireNonBlank(directoryPath, "directoryPath"))));
    }

    public WebSiteDirectory(String name, Path directoryPath) {
        this.name = FileUtils.requireNonBlank(name, "name");
        this.directoryPath = Objects.requireNonNull(directoryPath, "directoryPath must not be null");
    }

    public static WebSiteDirectory from(ProjectEntry entry) {
        return new WebSiteDirectory(entry.name(), entry.path());
    }

    /**
     * Scans the directory tree for source files, replacing any previous result.
     *
     * @throws NotFoundException if the directory does not exist
     * @throws IOException if the directory cannot be traversed
     */
    public void load() throws IOException {
        if (!Files.isDirectory(directoryPath)) {
            throw new NotFoundException("Directory", directoryPath);
        }

        basicSourceFiles.clear();
        csharpSourceFiles.clear();

        collect(Language.BASIC, basicSourceFiles);
        collect(Language.CSHARP, csharpSourceFiles);

        log.debug("Loaded web site {} ({}): {} Visual Basic and {} C# source files",
            name, directoryPath, basicSourceFiles.size(), csharpSourceFiles.size());
    }

    private void collect(Language language, List<SourceFile> target) throws IOException {
        String pattern = Wildcard.forExtension(language.sourceFileExtension());
        for (Path path : FileUtils.findFiles(directoryPath, pattern, true)) {
            target.add(new SourceFile(path, language));
        }
    }

    public String name() {
        return name;
    }

    public Path directoryPath() {
        return directoryPath;
    }

    public List<SourceFile> basicSourceFiles() {
        return Collections.unmodifiableList(basicSourceFiles);
    }

    public List<SourceFile> csharpSourceFiles() {
        return Collections.unmodifiableList(csharpSourceFiles);
    }

    @Override
    public String toString() {
        return name + " (" + directoryPath + ")";
    }

    // Identity is name and directory; loaded sources are not compared
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WebSiteDirectory other)) {
            return false;
        }
        return name.equals(other.name) && directoryPath.equals(other.directoryPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, directoryPath);
    }
}
