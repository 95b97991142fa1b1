package com.vsref.core;

import com.vsref.core.error.NotFoundException;
import com.vsref.core.model.Language;
import com.vsref.core.model.SourceFile;
import com.vsref.core.project.ProjectFile;
import com.vsref.core.solution.SolutionFile;
import com.vsref.core.util.FileUtils;
import com.vsref.core.util.Wildcard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Visual Studio files of mixed types named by command-line style path arguments.
 *
 * <p><b>Argument Handling:</b>
 * <ul>
 *   <li>A wildcard ({@code *} or {@code ?}) in the directory part skips the argument</li>
 *   <li>A wildcard in the file name expands to the matching files of that directory</li>
 *   <li>Unsupported extensions are skipped</li>
 *   <li>A literal path with a supported extension must exist</li>
 * </ul>
 *
 * <p>Files are sorted by extension into solution, project and source buckets. Nothing is
 * loaded; the caller decides what to read.
 *
 * <pre>{@code
 * VisualStudioFiles files = VisualStudioFiles.expand(List.of("src/*.sln", "Tools.csproj"), true);
 * for (SolutionFile solution : files.solutionFiles()) {
 *     solution.load();
 * }
 * }</pre>
 */
public class VisualStudioFiles {

    private static final Logger log = LoggerFactory.getLogger(VisualStudioFiles.class);

    private final boolean recursive;

    private final List<SolutionFile> solutionFiles = new ArrayList<>();
    private final Map<Language, List<ProjectFile>> projectFiles = new EnumMap<>(Language.class);
    private final Map<Language, List<SourceFile>> sourceFiles = new EnumMap<>(Language.class);

    private VisualStudioFiles(boolean recursive) {
        this.recursive = recursive;
        for (Language language : Language.values()) {
            projectFiles.put(language, new ArrayList<>());
            sourceFiles.put(language, new ArrayList<>());
        }
    }

    /**
     * Expands path arguments into Visual Studio files.
     *
     * @param filePaths path arguments, possibly with wildcards in the file name
     * @param recursive whether wildcard arguments also match in subdirectories
     * @return files sorted by type
     * @throws IllegalArgumentException if an argument is blank
     * @throws NotFoundException if a literal path or the directory of a wildcard does not exist
     * @throws IOException if a directory cannot be searched
     */
    public static VisualStudioFiles expand(Collection<String> filePaths, boolean recursive) throws IOException {
        Objects.requireNonNull(filePaths, "filePaths must not be null");

        VisualStudioFiles files = new VisualStudioFiles(recursive);
        for (String filePath : filePaths) {
            files.add(filePath);
        }
        log.debug("Expanded {} arguments into {} solution files", filePaths.size(), files.solutionFiles.size());
        return files;
    }

    public static VisualStudioFiles expand(Collection<String> filePaths) throws IOException {
        return expand(filePaths, false);
    }

    private void add(String filePath) throws IOException {
        FileUtils.requireNonBlank(filePath, "filePath");

        String platformPath = FileUtils.toPlatformSeparators(filePath);
        int lastSeparator = platformPath.lastIndexOf(File.separatorChar);
        String directoryPart = lastSeparator >= 0 ? platformPath.substring(0, lastSeparator) : "";
        String fileName = platformPath.substring(lastSeparator + 1);

        if (Wildcard.hasWildcard(directoryPart)) {
            log.debug("Skipping argument with wildcard in directory: {}", filePath);
            return;
        }

        if (Wildcard.hasWildcard(fileName)) {
            Path directory = directoryPart.isEmpty()
                ? Paths.get("").toAbsolutePath()
                : Paths.get(lastSeparator == 0 ? File.separator : directoryPart);
            if (!Files.isDirectory(directory)) {
                throw new NotFoundException("Directory", directory);
            }
            for (Path match : FileUtils.findFiles(directory, fileName, recursive)) {
                addFile(match);
            }
            return;
        }

        addFile(Paths.get(platformPath));
    }

    private void addFile(Path path) throws NotFoundException {
        String extension = FileUtils.getExtension(path).toLowerCase(Locale.ROOT);

        if (SolutionFile.SOLUTION_FILE_EXTENSION.equals(extension)) {
            requireExists(path);
            solutionFiles.add(new SolutionFile(path));
            return;
        }

        var projectLanguage = Language.fromProjectFileExtension(extension);
        if (projectLanguage.isPresent()) {
            requireExists(path);
            projectFiles.get(projectLanguage.get()).add(new ProjectFile(projectLanguage.get(), path.toString()));
            return;
        }

        var sourceLanguage = Language.fromSourceFileExtension(extension);
        if (sourceLanguage.isPresent()) {
            requireExists(path);
            sourceFiles.get(sourceLanguage.get()).add(new SourceFile(path, sourceLanguage.get()));
            return;
        }

        log.trace("Skipping unsupported file: {}", path);
    }

    private static void requireExists(Path path) throws NotFoundException {
        if (!Files.isRegularFile(path)) {
            throw new NotFoundException(path);
        }
    }

    public List<SolutionFile> solutionFiles() {
        return Collections.unmodifiableList(solutionFiles);
    }

    public List<ProjectFile> basicProjectFiles() {
        return projectFiles(Language.BASIC);
    }

    public List<ProjectFile> csharpProjectFiles() {
        return projectFiles(Language.CSHARP);
    }

    public List<ProjectFile> fsharpProjectFiles() {
        return projectFiles(Language.FSHARP);
    }

    public List<SourceFile> basicSourceFiles() {
        return sourceFiles(Language.BASIC);
    }

    public List<SourceFile> csharpSourceFiles() {
        return sourceFiles(Language.CSHARP);
    }

    public List<SourceFile> fsharpSourceFiles() {
        return sourceFiles(Language.FSHARP);
    }

    public List<ProjectFile> projectFiles(Language language) {
        return Collections.unmodifiableList(projectFiles.get(language));
    }

    public List<SourceFile> sourceFiles(Language language) {
        return Collections.unmodifiableList(sourceFiles.get(language));
    }

    public boolean isEmpty() {
        return solutionFiles.isEmpty()
            && projectFiles.values().stream().allMatch(List::isEmpty)
            && sourceFiles.values().stream().allMatch(List::isEmpty);
    }
}
