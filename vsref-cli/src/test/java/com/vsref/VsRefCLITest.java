package com.vsref;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for the {@code vsref} command line.
 */
class VsRefCLITest {

    private static final String SOLUTION = """
        Microsoft Visual Studio Solution File, Format Version 12.00
        Project("{FAE04EC0-301F-11D3-BF4B-00C04F79EFBC}") = "App", "App\\App.csproj", "{11111111-1111-1111-1111-111111111111}"
        EndProject
        """;

    private static final String PROJECT = """
        <Project>
          <ItemGroup>
            <Compile Include="Program.cs" />
          </ItemGroup>
        </Project>
        """;

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void resolve_validSolution_printsReferences() throws IOException {
        // Given
        Path sln = writeSolution();

        // When
        int exitCode = execute("resolve", "--no-color", sln.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("[C#] App").contains("1 solution(s), 1 reference(s), 0 failure(s)");
    }

    @Test
    void resolve_cascadeJson_includesSourceFiles() throws IOException {
        Path sln = writeSolution();

        int exitCode = execute("resolve", "--cascade", "--format", "json", sln.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("\"sourceFiles\"").contains("Program.cs").contains("\"cascaded\" : true");
    }

    @Test
    void resolve_configFile_suppliesDefaults() throws IOException {
        Path sln = writeSolution();
        Path config = tempDir.resolve("vsref.yaml");
        Files.writeString(config, """
            output:
              format: json
            """);

        int exitCode = execute("resolve", "-c", config.toString(), sln.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("\"solutions\"");
    }

    @Test
    void resolve_unknownFormat_failsWithMessage() throws IOException {
        Path sln = writeSolution();

        int exitCode = execute("resolve", "--format", "xml", sln.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("Unknown format: xml");
    }

    @Test
    void resolve_missingSolution_failsWithMessage() {
        int exitCode = execute("resolve", tempDir.resolve("Missing.sln").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("✗ Resolve failed").contains("Missing.sln");
    }

    @Test
    void resolve_keepGoing_reportsBrokenSolutionAndContinues() throws IOException {
        Path sln = writeSolution();
        Path broken = tempDir.resolve("Broken.sln");
        Files.writeString(broken, "garbage\n");

        int exitCode = execute("resolve", "--keep-going", "--no-color", broken.toString(), sln.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stdout()).contains("[C#] App").contains("✗ " + broken);
    }

    @Test
    void validate_mixedSolutions_reportsEachFile() throws IOException {
        Path sln = writeSolution();
        Path broken = tempDir.resolve("Broken.sln");
        Files.writeString(broken, "garbage\n");

        int exitCode = execute("validate", broken.toString(), sln.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stdout()).contains("✓ " + sln + " (format version 12, 1 references)");
        assertThat(stderr()).contains("✗ " + broken);
    }

    @Test
    void list_printsKindsAndResolvers() {
        int exitCode = execute("list");

        assertThat(exitCode).isZero();
        assertThat(stdout())
            .contains("C# project (GUID: {FAE04EC0-301F-11D3-BF4B-00C04F79EFBC})")
            .contains("WebSitePathResolver for WEB_SITE (from format version 12)");
    }

    @Test
    void noSubcommand_printsUsageHint() {
        int exitCode = execute();

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("vsref --help");
    }

    private Path writeSolution() throws IOException {
        Path projectDir = Files.createDirectories(tempDir.resolve("App"));
        Files.writeString(projectDir.resolve("App.csproj"), PROJECT);
        Files.writeString(projectDir.resolve("Program.cs"), "");
        Path sln = tempDir.resolve("App.sln");
        Files.writeString(sln, SOLUTION);
        return sln;
    }

    private int execute(String... args) {
        return VsRefCLI.createCommandLine().execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
