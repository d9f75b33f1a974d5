package com.designlens.core.comparison;

import java.io.Serializable;

/**
 * Grouping-only versus grouping-plus-validation figures. Illustrative reporting values,
 * not a contract: {@code processingEfficiency} in particular compares unrelated time bases.
 */
public record ComparisonMetrics(
        Improvement improvement,
        Coverage coverage,
        Accuracy accuracy,
        Performance performance
) implements Serializable {

    /**
     * @param componentCount   validated components minus semantic groups
     * @param confidenceChange confidence delta in percentage points
     */
    public record Improvement(int componentCount, double confidenceChange, double processingEfficiency)
            implements Serializable {}

    public record Coverage(int text, int interactive, int structural) implements Serializable {}

    /** Estimated accuracies in percent. */
    public record Accuracy(double grouping, double validation, double overallImprovement) implements Serializable {}

    public record Performance(long groupingMs, long validationMs, long totalMs) implements Serializable {}
}
