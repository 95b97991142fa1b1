package com.vsref.core.report;

import com.vsref.core.VsRefTestBase;
import com.vsref.core.error.MalformedSolutionFileException;
import com.vsref.core.error.NotFoundException;
import com.vsref.core.model.ProjectKind;
import com.vsref.core.solution.SolutionFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Functional tests for {@link SolutionReportBuilder}.
 */
class SolutionReportBuilderTest extends VsRefTestBase {

    private Path appSolution;

    @BeforeEach
    void createSolution() throws IOException {
        appSolution = createFile("App.sln", "Microsoft Visual Studio Solution File, Format Version 12.00\n"
            + projectBlock(CSHARP_TYPE, "App", "App\\App.csproj", "11111111-1111-1111-1111-111111111111")
            + """
            Project("{E24C65DC-7377-472B-9ABA-BC803B73C61A}") = "Site", "http://localhost/Site", "{22222222-2222-2222-2222-222222222222}"
            \tProjectSection(WebsiteProperties) = preProject
            \t\tSlnRelativePath = "Site\\"
            \tEndProjectSection
            EndProject
            """);
        createFile("App/App.csproj", csharpProject("Program.cs"));
        createFile("Site/Default.aspx.cs", "");
        createFile("Site/App_Code/Util.vb", "");
    }

    @Test
    void build_withoutCascade_listsEntriesWithoutSources() throws IOException {
        SolutionReport report = new SolutionReportBuilder(false, true).build(List.of(new SolutionFile(appSolution)));

        assertThat(report.cascaded()).isFalse();
        assertThat(report.solutions()).singleElement().satisfies(solution -> {
            assertThat(solution.formatVersion()).isEqualTo(12);
            assertThat(solution.entries()).extracting(EntryNode::name).containsExactly("App", "Site");
            assertThat(solution.entries()).allSatisfy(entry -> assertThat(entry.sourceFiles()).isEmpty());
        });
        assertThat(report.projectCount()).isEqualTo(2);
    }

    @Test
    void build_withCascade_addsSourceFiles() throws IOException {
        SolutionReport report = new SolutionReportBuilder(true, true).build(List.of(new SolutionFile(appSolution)));

        List<EntryNode> entries = report.solutions().get(0).entries();
        assertThat(entries.get(0).kind()).isEqualTo(ProjectKind.CSHARP);
        assertThat(entries.get(0).sourceFiles())
            .containsExactly(tempDir.resolve("App").resolve("Program.cs").toString());
        assertThat(entries.get(1).kind()).isEqualTo(ProjectKind.WEB_SITE);
        assertThat(entries.get(1).sourceFiles()).containsExactlyInAnyOrder(
            tempDir.resolve("Site").resolve("App_Code").resolve("Util.vb").toString(),
            tempDir.resolve("Site").resolve("Default.aspx.cs").toString());
        assertThat(report.hasFailures()).isFalse();
    }

    @Test
    void build_failFast_rethrowsFirstFailure() throws IOException {
        Path broken = createFile("Broken.sln", "not a solution\n");

        SolutionReportBuilder builder = new SolutionReportBuilder(false, true);

        assertThatThrownBy(() -> builder.build(List.of(new SolutionFile(broken), new SolutionFile(appSolution))))
            .isInstanceOf(MalformedSolutionFileException.class);
    }

    @Test
    void build_keepGoing_recordsFailureAndContinues() throws IOException {
        Path broken = createFile("Broken.sln", "not a solution\n");

        SolutionReport report = new SolutionReportBuilder(false, false)
            .build(List.of(new SolutionFile(broken), new SolutionFile(appSolution)));

        assertThat(report.solutions()).hasSize(1);
        assertThat(report.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.path()).isEqualTo(broken.toString());
            assertThat(failure.error()).isEqualTo("MalformedSolutionFileException");
        });
    }

    @Test
    void build_cascadeWithMissingProject_keepsSolutionAndRecordsFailure() throws IOException {
        Path sln = createFile("Other.sln", "Microsoft Visual Studio Solution File, Format Version 12.00\n"
            + projectBlock(CSHARP_TYPE, "Gone", "Gone\\Gone.csproj", "33333333-3333-3333-3333-333333333333"));

        SolutionReport report = new SolutionReportBuilder(true, false).build(List.of(new SolutionFile(sln)));

        assertThat(report.solutions()).singleElement()
            .satisfies(solution -> assertThat(solution.entries()).extracting(EntryNode::name).containsExactly("Gone"));
        assertThat(report.failures()).extracting(LoadFailure::error).containsExactly("NotFoundException");
    }

    @Test
    void build_cascadeFailFastWithMissingProject_throwsNotFound() throws IOException {
        Path sln = createFile("Other.sln", "Microsoft Visual Studio Solution File, Format Version 12.00\n"
            + projectBlock(CSHARP_TYPE, "Gone", "Gone\\Gone.csproj", "33333333-3333-3333-3333-333333333333"));

        SolutionReportBuilder builder = new SolutionReportBuilder(true, true);

        assertThatThrownBy(() -> builder.build(List.of(new SolutionFile(sln))))
            .isInstanceOf(NotFoundException.class);
    }
}
