package com.designlens.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Output of the semantic grouping stage.
 * <p>
 * {@code groupedNodes + ungroupedNodes.size() == totalNodes} always holds and every
 * descriptor appears in at most one group's children.
 */
public record GroupingResult(
        LayoutStructure layoutStructure,
        List<SemanticGroup> groups,
        int totalNodes,
        int groupedNodes,
        List<ComponentDescriptor> ungroupedNodes,
        double confidence,
        long processingTimeMs,
        boolean fallback
) implements Serializable {

    public GroupingResult {
        groups = groups == null ? List.of() : List.copyOf(groups);
        ungroupedNodes = ungroupedNodes == null ? List.of() : List.copyOf(ungroupedNodes);
    }
}
