package com.vsref.core.report;

import com.vsref.core.model.ProjectEntry;
import com.vsref.core.model.ProjectKind;
import com.vsref.core.model.SourceFile;
import com.vsref.core.project.ProjectFile;
import com.vsref.core.project.WebSiteDirectory;
import com.vsref.core.solution.SolutionFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Loads solution files and collects the results into a {@link SolutionReport}.
 *
 * <p><b>Cascade:</b> when enabled, every referenced project file and web-site directory is
 * loaded as well and its source files are added to the report.
 *
 * <p><b>Fail Fast:</b> when enabled, the first load failure is rethrown. Otherwise it is
 * recorded as a {@link LoadFailure} and the remaining files are processed; a solution whose
 * project fails to load stays in the report with that project's sources empty.
 */
public class SolutionReportBuilder {

    private static final Logger log = LoggerFactory.getLogger(SolutionReportBuilder.class);

    private final boolean cascade;
    private final boolean failFast;

    public SolutionReportBuilder(boolean cascade, boolean failFast) {
        this.cascade = cascade;
        this.failFast = failFast;
    }

    /**
     * Loads every solution and builds the report.
     *
     * @param solutionFiles solutions to load, in report order
     * @return report of loaded solutions and failures
     * @throws IOException the first failure, when fail-fast is enabled
     */
    public SolutionReport build(List<SolutionFile> solutionFiles) throws IOException {
        List<SolutionNode> solutions = new ArrayList<>();
        List<LoadFailure> failures = new ArrayList<>();

        for (SolutionFile solution : solutionFiles) {
            try {
                solution.load();
            } catch (IOException e) {
                handleFailure(solution.path().toString(), e, failures);
                continue;
            }
            solutions.add(toNode(solution, failures));
        }

        log.info("Resolved {} solutions ({} failures)", solutions.size(), failures.size());
        return new SolutionReport(solutions, failures, cascade);
    }

    private SolutionNode toNode(SolutionFile solution, List<LoadFailure> failures) throws IOException {
        Iterator<ProjectFile> projects = solution.projectFiles().iterator();
        Iterator<WebSiteDirectory> webSites = solution.webSiteDirectories().iterator();

        // Both handle lists follow the entry order
        List<EntryNode> entries = new ArrayList<>();
        for (ProjectEntry entry : solution.entries()) {
            List<SourceFile> sources = entry.kind() == ProjectKind.WEB_SITE
                ? loadWebSite(webSites.next(), failures)
                : loadProject(projects.next(), failures);
            entries.add(new EntryNode(entry.kind(), entry.name(), entry.path().toString(), entry.uniqueId(),
                sources.stream().map(source -> source.path().toString()).toList()));
        }
        return new SolutionNode(solution.path().toString(), solution.formatVersion(), entries);
    }

    private List<SourceFile> loadProject(ProjectFile project, List<LoadFailure> failures) throws IOException {
        if (!cascade) {
            return List.of();
        }
        try {
            project.load();
            return project.sourceFiles();
        } catch (IOException e) {
            handleFailure(project.path().toString(), e, failures);
            return List.of();
        }
    }

    private List<SourceFile> loadWebSite(WebSiteDirectory webSite, List<LoadFailure> failures) throws IOException {
        if (!cascade) {
            return List.of();
        }
        try {
            webSite.load();
            List<SourceFile> sources = new ArrayList<>(webSite.basicSourceFiles());
            sources.addAll(webSite.csharpSourceFiles());
            return sources;
        } catch (IOException e) {
            handleFailure(webSite.directoryPath().toString(), e, failures);
            return List.of();
        }
    }

    private void handleFailure(String path, IOException e, List<LoadFailure> failures) throws IOException {
        if (failFast) {
            throw e;
        }
        log.warn("Failed to load {}: {}", path, e.getMessage());
        failures.add(LoadFailure.of(path, e));
    }
}
