package com.vsref.core;

import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Base class for tests that read Visual Studio files from disk.
 *
 * <p>Provides a temporary directory per test and helpers to lay out solution trees in it.
 * Paths use {@code /}; {@link Path#resolve(String)} maps them to the platform separator.
 */
public abstract class VsRefTestBase {

    protected static final String CSHARP_TYPE = "FAE04EC0-301F-11D3-BF4B-00C04F79EFBC";
    protected static final String BASIC_TYPE = "F184B08F-C81C-45F6-A57F-5ABD9991F28F";
    protected static final String FSHARP_TYPE = "F2A71F9B-5D33-465A-A702-920D77279786";
    protected static final String WEB_SITE_TYPE = "E24C65DC-7377-472B-9ABA-BC803B73C61A";
    protected static final String SOLUTION_FOLDER_TYPE = "2150E333-8FDC-42A3-9474-1A3956D46DE8";

    @TempDir
    protected Path tempDir;

    /**
     * Creates a file in the temp directory with the given content.
     *
     * @param relativePath path relative to tempDir (e.g., "App.sln" or "App/App.csproj")
     * @param content file content
     * @return the created file path
     * @throws IOException if file cannot be created
     */
    protected Path createFile(String relativePath, String content) throws IOException {
        Path filePath = tempDir.resolve(relativePath);
        Files.createDirectories(filePath.getParent());
        Files.writeString(filePath, content);
        return filePath;
    }

    protected Path createDirectory(String relativePath) throws IOException {
        return Files.createDirectories(tempDir.resolve(relativePath));
    }

    protected void createFiles(Map<String, String> files) throws IOException {
        for (Map.Entry<String, String> entry : files.entrySet()) {
            createFile(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Builds a {@code Project ... EndProject} block with the header path kept as is.
     */
    protected static String projectBlock(String typeId, String name, String path, String uniqueId) {
        return "Project(\"{" + typeId + "}\") = \"" + name + "\", \"" + path + "\", \"{" + uniqueId + "}\"\n"
            + "EndProject\n";
    }

    /**
     * Builds a minimal C# project file compiling the given sources.
     */
    protected static String csharpProject(String... includes) {
        StringBuilder xml = new StringBuilder("""
            <?xml version="1.0" encoding="utf-8"?>
            <Project ToolsVersion="4.0" xmlns="http://schemas.microsoft.com/developer/msbuild/2003">
              <ItemGroup>
            """);
        for (String include : includes) {
            xml.append("    <Compile Include=\"").append(include).append("\" />\n");
        }
        xml.append("""
              </ItemGroup>
            </Project>
            """);
        return xml.toString();
    }
}
