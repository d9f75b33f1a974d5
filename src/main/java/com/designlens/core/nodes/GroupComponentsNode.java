package com.designlens.core.nodes;

import com.designlens.core.grouping.SemanticGroupingService;
import com.designlens.core.logging.MdcContext;
import com.designlens.core.model.GroupingResult;
import com.designlens.core.state.AnalysisState;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Clusters descriptors into semantic groups, falling back to one group per descriptor
 * when the model cannot be used.
 */
@Component
public class GroupComponentsNode {

    private final SemanticGroupingService groupingService;

    public GroupComponentsNode(SemanticGroupingService groupingService) {
        this.groupingService = groupingService;
    }

    public Map<String, Object> apply(AnalysisState state) {
        MdcContext.setStage(state.runId(), "group_components");
        long start = System.currentTimeMillis();
        GroupingResult grouping = groupingService.group(state.designName(), state.descriptors());
        return Map.of(
                "grouping", grouping,
                "groupingMs", System.currentTimeMillis() - start
        );
    }
}
