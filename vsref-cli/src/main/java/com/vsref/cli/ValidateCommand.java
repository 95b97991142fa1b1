package com.vsref.cli;

import com.vsref.core.VisualStudioFiles;
import com.vsref.core.solution.SolutionFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to check that solution files load.
 *
 * <p>Loads each solution without cascading and prints one {@code ✓} or {@code ✗} line per
 * file. Every file is checked; the exit code is 1 if any failed.
 */
@Command(
    name = "validate",
    description = "Check that solution files are well-formed",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(arity = "1..*", description = "Solution files; wildcards are allowed in the file name")
    private List<String> paths;

    @Option(names = {"-r", "--recursive"}, description = "Match wildcard arguments in subdirectories too")
    private boolean recursive;

    @Override
    public Integer call() {
        VisualStudioFiles files;
        try {
            files = VisualStudioFiles.expand(paths, recursive);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Validation failed", e);
            System.err.println("✗ " + e.getMessage());
            return 1;
        }

        if (files.solutionFiles().isEmpty()) {
            System.err.println("✗ No solution files found in: " + String.join(" ", paths));
            return 1;
        }

        int failures = 0;
        for (SolutionFile solution : files.solutionFiles()) {
            try {
                solution.load();
                System.out.printf("✓ %s (format version %d, %d references)%n",
                    solution.path(), solution.formatVersion(), solution.entries().size());
            } catch (IOException e) {
                failures++;
                log.debug("Validation of {} failed", solution.path(), e);
                System.err.println("✗ " + solution.path() + ": " + e.getMessage());
            }
        }

        log.info("Validated {} solutions, {} failed", files.solutionFiles().size(), failures);
        return failures == 0 ? 0 : 1;
    }
}
