package com.vsref.core.report;

import com.vsref.core.model.ProjectKind;

import java.util.List;

/**
 * A project or web site referenced by a solution.
 *
 * @param kind project kind
 * @param name display name from the solution
 * @param path resolved project file or directory path
 * @param uniqueId project GUID without braces
 * @param sourceFiles source file paths; empty unless the report was cascaded
 */
public record EntryNode(
    ProjectKind kind,
    String name,
    String path,
    String uniqueId,
    List<String> sourceFiles
) {
    public EntryNode {
        sourceFiles = sourceFiles != null ? List.copyOf(sourceFiles) : List.of();
    }
}
