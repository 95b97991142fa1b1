package com.vsref.core.report;

import java.util.List;

/**
 * A loaded solution in a {@link SolutionReport}.
 *
 * @param path solution file path
 * @param formatVersion major format version from the header
 * @param entries referenced projects and web sites in file order
 */
public record SolutionNode(
    String path,
    int formatVersion,
    List<EntryNode> entries
) {
    public SolutionNode {
        entries = entries != null ? List.copyOf(entries) : List.of();
    }
}
