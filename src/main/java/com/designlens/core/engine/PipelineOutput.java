package com.designlens.core.engine;

import com.designlens.core.comparison.ComparisonMetrics;
import com.designlens.core.model.AnalysisResult;
import com.designlens.core.model.DesignTokenSet;
import com.designlens.core.model.GroupingResult;
import com.designlens.core.model.StyleMapping;

import java.util.List;

/**
 * Everything a caller gets back from one analysis run.
 */
public record PipelineOutput(
        String runId,
        String designName,
        int descriptorCount,
        DesignTokenSet tokens,
        GroupingResult grouping,
        AnalysisResult analysis,
        StyleMapping mapping,
        ComparisonMetrics comparison,
        List<String> issues,
        Timings timings
) {

    public PipelineOutput {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public record Timings(long extractMs, long groupingMs, long validationMs, long mappingMs, long totalMs) {}
}
