package com.designlens.core.nodes;

import com.designlens.core.comparison.AnalysisComparison;
import com.designlens.core.comparison.ComparisonMetrics;
import com.designlens.core.logging.MdcContext;
import com.designlens.core.state.AnalysisState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Reports how validation changed the grouping result. Diagnostic only; nothing here
 * feeds back into the components.
 */
@Component
public class CompareStagesNode {

    private static final Logger log = LoggerFactory.getLogger(CompareStagesNode.class);

    public Map<String, Object> apply(AnalysisState state) {
        MdcContext.setStage(state.runId(), "compare_stages");
        if (state.grouping().isEmpty() || state.analysis().isEmpty()) {
            return Map.of();
        }
        ComparisonMetrics metrics = AnalysisComparison.compare(
                state.grouping().get(), state.analysis().get(), state.validationMs());
        List<String> issues = AnalysisComparison.identifyIssues(metrics);
        if (!issues.isEmpty()) {
            log.info("Comparison flagged {} issue(s): {}", issues.size(), issues);
        }
        return Map.of(
                "comparison", metrics,
                "issues", issues
        );
    }
}
