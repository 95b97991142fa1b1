package com.vsref.core.project;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.vsref.core.error.FileFormatException;
import com.vsref.core.model.Language;
import com.vsref.core.model.ProjectEntry;
import com.vsref.core.model.SourceFile;
import com.vsref.core.model.VisualStudioFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * An MSBuild project file ({@code .vbproj}, {@code .csproj} or {@code .fsproj}) and the
 * source files it compiles.
 *
 * <p>Uses Jackson XML to read {@code Compile} items. Items marked as generated are skipped,
 * as are items whose extension is not the project language's source extension.
 *
 * <pre>{@code
 * <Project ToolsVersion="4.0" xmlns="http://schemas.microsoft.com/developer/msbuild/2003">
 *   <ItemGroup>
 *     <Compile Include="Program.cs" />
 *     <Compile Include="Properties\Resources.Designer.cs">
 *       <AutoGen>True</AutoGen>
 *     </Compile>
 *   </ItemGroup>
 * </Project>
 * }</pre>
 *
 * <p>The source list is empty until {@link #load()} succeeds and is replaced on every load.
 * Equality covers the language, name and file, not the loaded sources.
 */
public class ProjectFile {

    private static final Logger log = LoggerFactory.getLogger(ProjectFile.class);

    // Thread-safe and reusable across parse operations
    private static final XmlMapper XML_MAPPER = new XmlMapper();

    // XML Element Names
    private static final String ITEM_GROUP = "ItemGroup";
    private static final String COMPILE = "Compile";
    private static final String AUTO_GEN = "AutoGen";

    // XML Attribute Names
    private static final String INCLUDE = "Include";

    private final VisualStudioFile file;
    private final Language language;
    private final String projectName;
    private final List<SourceFile> sourceFiles = new ArrayList<>();

    /**
     * Creates a project file named after its file name.
     *
     * @param language project language
     * @param filePath path to the project file
     * @throws IllegalArgumentException if the path is blank
     */
    public ProjectFile(Language language, String filePath) {
        this(language, null, filePath);
    }

    /**
     * Creates a project file.
     *
     * @param language project language
     * @param projectName name from the solution; blank to use the file name without extension
     * @param filePath path to the project file
     * @throws IllegalArgumentException if the path is blank
     */
    public ProjectFile(Language language, String projectName, String filePath) {
        this(language, projectName, checkLanguage(language, filePath));
    }

    private ProjectFile(Language language, String projectName, VisualStudioFile file) {
        this.language = language;
        this.file = file;
        this.projectName = projectName == null || projectName.isBlank() ? file.fileNameNoExtension() : projectName;
    }

    /**
     * Creates the handle for a resolved solution entry.
     *
     * @param entry entry of a project file kind
     * @return project file, not yet loaded
     * @throws IllegalArgumentException if the entry is a web site
     */
    public static ProjectFile from(ProjectEntry entry) {
        Language language = entry.kind().language()
            .orElseThrow(() -> new IllegalArgumentException(entry.kind() + " is not a project file kind"));
        return new ProjectFile(language, entry.name(),
            new VisualStudioFile(entry.path(), language.projectFileExtension()));
    }

    private static VisualStudioFile checkLanguage(Language language, String filePath) {
        Objects.requireNonNull(language, "language must not be null");
        return VisualStudioFile.of(filePath, language.projectFileExtension());
    }

    /**
     * Reads the project file and collects its compiled source files.
     *
     * @throws com.vsref.core.error.NotFoundException if the file does not exist
     * @throws com.vsref.core.error.WrongExtensionException if the extension does not match the language
     * @throws FileFormatException if the file is not well-formed XML
     * @throws IOException if the file cannot be read
     */
    public void load() throws IOException {
        file.checkLoadable();
        sourceFiles.clear();

        JsonNode root = parseXml(file.path());
        if (root == null || root.isMissingNode()) {
            throw new FileFormatException("Empty project file " + file.path());
        }
        for (JsonNode itemGroup : ensureArray(root.get(ITEM_GROUP))) {
            for (JsonNode compile : ensureArray(itemGroup.get(COMPILE))) {
                addSourceFile(compile);
            }
        }

        log.debug("Loaded project {} ({}): {} source files", projectName, file.path(), sourceFiles.size());
    }

    private JsonNode parseXml(Path path) throws IOException {
        // The XML parser honours the byte order mark and encoding declaration
        try (InputStream in = Files.newInputStream(path)) {
            return XML_MAPPER.readTree(in);
        } catch (JsonProcessingException e) {
            throw new FileFormatException("Invalid project file " + path + ": " + e.getOriginalMessage(), e);
        }
    }

    private void addSourceFile(JsonNode compile) {
        if (isAutoGenerated(compile)) {
            log.trace("Skipping generated item in {}: {}", projectName, compile);
            return;
        }

        JsonNode include = compile.get(INCLUDE);
        if (include == null || !include.isTextual()) {
            return;
        }

        String includePath = include.asText();
        if (includePath.toLowerCase(Locale.ROOT).endsWith(language.sourceFileExtension())) {
            sourceFiles.add(new SourceFile(file.resolve(includePath), language));
        }
    }

    private static boolean isAutoGenerated(JsonNode compile) {
        JsonNode autoGen = compile.get(AUTO_GEN);
        return autoGen != null && Boolean.TRUE.toString().equalsIgnoreCase(autoGen.asText().trim());
    }

    private static List<JsonNode> ensureArray(JsonNode node) {
        if (node == null) {
            return List.of();
        }
        if (node.isArray()) {
            List<JsonNode> elements = new ArrayList<>();
            node.forEach(elements::add);
            return elements;
        }
        return List.of(node);
    }

    public String projectName() {
        return projectName;
    }

    public Language language() {
        return language;
    }

    public Path path() {
        return file.path();
    }

    public VisualStudioFile file() {
        return file;
    }

    /**
     * Returns the compiled source files found by the last successful {@link #load()}.
     *
     * @return unmodifiable view of the source files
     */
    public List<SourceFile> sourceFiles() {
        return Collections.unmodifiableList(sourceFiles);
    }

    @Override
    public String toString() {
        return projectName + " (" + file.path() + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProjectFile other)) {
            return false;
        }
        return language == other.language
            && projectName.equals(other.projectName)
            && file.equals(other.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(language, projectName, file);
    }
}
