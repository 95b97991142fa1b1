package com.vsref.cli;

import com.vsref.core.VisualStudioFiles;
import com.vsref.core.config.ConfigLoader;
import com.vsref.core.config.ResolverConfig;
import com.vsref.core.report.ReportRenderer;
import com.vsref.core.report.ReportRenderers;
import com.vsref.core.report.SolutionReport;
import com.vsref.core.report.SolutionReportBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to resolve the references of solution files and print a report.
 *
 * <p>Runs the resolution pipeline:
 * <ol>
 *   <li>Load configuration ({@code vsref.yaml} unless {@code --config} is given)</li>
 *   <li>Expand path arguments into solution files</li>
 *   <li>Load every solution and, with {@code --cascade}, its projects and web sites</li>
 *   <li>Render the report as text or JSON</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Resolve one solution
 * vsref resolve App.sln
 *
 * # All solutions below the current directory, continuing past failures
 * vsref resolve --recursive --keep-going "*.sln"
 *
 * # Include project source files, as JSON
 * vsref resolve --cascade --format json App.sln
 * }</pre>
 *
 * <p>Exit code is 0 when every file loaded, 1 otherwise.
 */
@Command(
    name = "resolve",
    description = "Resolve the projects and web sites referenced by solution files",
    mixinStandardHelpOptions = true
)
public class ResolveCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ResolveCommand.class);

    @Parameters(
        arity = "1..*",
        description = "Solution files; wildcards are allowed in the file name (e.g. src/*.sln)"
    )
    private List<String> paths;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: vsref.yaml if present)"
    )
    private Path configPath;

    @Option(
        names = {"--cascade"},
        description = "Also load referenced project files and web-site directories"
    )
    private Boolean cascade;

    @Option(
        names = {"-r", "--recursive"},
        description = "Match wildcard arguments in subdirectories too"
    )
    private Boolean recursive;

    @Option(
        names = {"--keep-going"},
        description = "Report failing files and continue with the rest"
    )
    private Boolean keepGoing;

    @Option(
        names = {"-f", "--format"},
        description = "Report format: text or json (overrides config)"
    )
    private String format;

    @Option(
        names = {"--no-color"},
        description = "Disable ANSI colors in text reports"
    )
    private boolean noColor;

    @Override
    public Integer call() {
        try {
            ResolverConfig config = loadConfiguration();

            String reportFormat = format != null ? format : config.output().format();
            Optional<ReportRenderer> renderer =
                ReportRenderers.forFormat(reportFormat, config.output().colors() && !noColor);
            if (renderer.isEmpty()) {
                System.err.println("✗ Unknown format: " + reportFormat + ". Use: "
                    + String.join(", ", ReportRenderers.formats()));
                return 1;
            }

            boolean recursiveSearch = recursive != null ? recursive : config.search().recursive();
            VisualStudioFiles files = VisualStudioFiles.expand(paths, recursiveSearch);
            if (files.solutionFiles().isEmpty()) {
                System.err.println("✗ No solution files found in: " + String.join(" ", paths));
                return 1;
            }

            boolean cascadeLoad = cascade != null ? cascade : config.resolve().cascade();
            boolean failFast = keepGoing != null ? !keepGoing : config.resolve().failFast();
            log.debug("Resolving {} solutions (cascade: {}, failFast: {})",
                files.solutionFiles().size(), cascadeLoad, failFast);

            SolutionReport report = new SolutionReportBuilder(cascadeLoad, failFast).build(files.solutionFiles());
            System.out.print(renderer.get().render(report));

            return report.hasFailures() ? 1 : 0;

        } catch (IOException | IllegalArgumentException e) {
            log.error("Resolve failed", e);
            System.err.println("✗ Resolve failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Loads configuration from {@code --config}, or from {@code vsref.yaml} when it exists.
     */
    private ResolverConfig loadConfiguration() {
        if (configPath != null) {
            return ConfigLoader.load(configPath);
        }
        Path defaultPath = Paths.get(ConfigLoader.DEFAULT_CONFIG_FILE);
        return Files.exists(defaultPath) ? ConfigLoader.load(defaultPath) : ResolverConfig.defaults();
    }
}
