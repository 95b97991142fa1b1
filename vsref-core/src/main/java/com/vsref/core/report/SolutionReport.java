package com.vsref.core.report;

import java.util.List;

/**
 * Result of resolving a set of solution files.
 *
 * <p>Immutable; built by {@link SolutionReportBuilder} and written by a {@link ReportRenderer}.
 *
 * @param solutions successfully loaded solutions in argument order
 * @param failures files that failed to load
 * @param cascaded whether project files and web-site directories were loaded too
 */
public record SolutionReport(
    List<SolutionNode> solutions,
    List<LoadFailure> failures,
    boolean cascaded
) {
    public SolutionReport {
        solutions = solutions != null ? List.copyOf(solutions) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public int projectCount() {
        return solutions.stream().mapToInt(solution -> solution.entries().size()).sum();
    }
}
