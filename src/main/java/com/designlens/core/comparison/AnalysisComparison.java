package com.designlens.core.comparison;

import com.designlens.core.model.AnalysisResult;
import com.designlens.core.model.GroupingResult;
import com.designlens.core.model.SemanticType;
import com.designlens.core.model.ValidatedComponent;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Pure reporting over the outputs of the grouping and validation stages.
 */
public final class AnalysisComparison {

    static final double IDEAL_COMPONENT_COUNT = 8.0;
    static final double ASSUMED_VISION_SECONDS = 60.0;

    static final double MIN_CONFIDENCE_IMPROVEMENT = 5.0;
    static final int MIN_TEXT_COVERAGE = 2;
    static final int MIN_INTERACTIVE_COVERAGE = 3;
    static final long MAX_TOTAL_MS = 45_000;

    private AnalysisComparison() {}

    public static ComparisonMetrics compare(GroupingResult grouping, AnalysisResult analysis, long validationTimeMs) {
        List<ValidatedComponent> components = analysis.components();
        int componentDelta = components.size() - grouping.groups().size();
        double confidenceChange = round2((analysis.confidence() - grouping.confidence()) * 100.0);

        int text = (int) components.stream().filter(c -> c.type() == SemanticType.TEXT).count();
        int interactive = (int) components.stream().filter(c -> c.type().isInteractive()).count();
        int structural = (int) components.stream().filter(c -> c.type().isStructural()).count();

        double groupingAccuracy = groupingAccuracy(grouping);
        double validationAccuracy = validationAccuracy(analysis);

        return new ComparisonMetrics(
                new ComparisonMetrics.Improvement(componentDelta, confidenceChange, efficiency(grouping, analysis)),
                new ComparisonMetrics.Coverage(text, interactive, structural),
                new ComparisonMetrics.Accuracy(groupingAccuracy, validationAccuracy,
                        round2(validationAccuracy - groupingAccuracy)),
                new ComparisonMetrics.Performance(grouping.processingTimeMs(), validationTimeMs,
                        grouping.processingTimeMs() + validationTimeMs));
    }

    /** Mean of completeness (groups out of 8, capped at 1) and confidence, in percent. */
    static double groupingAccuracy(GroupingResult grouping) {
        double completeness = Math.min(grouping.groups().size() / IDEAL_COMPONENT_COUNT, 1.0);
        return round2((completeness + grouping.confidence()) / 2.0 * 100.0);
    }

    /** Mean of completeness, confidence and the share of components with a target mapping, in percent. */
    static double validationAccuracy(AnalysisResult analysis) {
        List<ValidatedComponent> components = analysis.components();
        double completeness = Math.min(components.size() / IDEAL_COMPONENT_COUNT, 1.0);
        double mapped = components.isEmpty() ? 0.0
                : components.stream().filter(c -> c.targetMapping() != null
                        && c.targetMapping().componentName() != null).count() / (double) components.size();
        return round2((completeness + analysis.confidence() + mapped) / 3.0 * 100.0);
    }

    /**
     * Groups per second of grouping time against components per an assumed 60s of validation.
     * Zero when there is no grouping time base.
     */
    static double efficiency(GroupingResult grouping, AnalysisResult analysis) {
        if (grouping.processingTimeMs() <= 0 || grouping.groups().isEmpty()) {
            return 0.0;
        }
        double groupingRate = grouping.groups().size() / (grouping.processingTimeMs() / 1000.0);
        double visionRate = analysis.components().size() / ASSUMED_VISION_SECONDS;
        return round2((visionRate - groupingRate) / groupingRate * 100.0);
    }

    public static List<String> identifyIssues(ComparisonMetrics metrics) {
        var issues = new ArrayList<String>();
        if (metrics.improvement().confidenceChange() < MIN_CONFIDENCE_IMPROVEMENT) {
            issues.add("Low confidence improvement - consider enhancing prompts");
        }
        if (metrics.coverage().text() < MIN_TEXT_COVERAGE) {
            issues.add("Missing text elements - grouping might need better text analysis");
        }
        if (metrics.coverage().interactive() < MIN_INTERACTIVE_COVERAGE) {
            issues.add("Missing interactive elements - check button/input detection");
        }
        if (metrics.performance().totalMs() > MAX_TOTAL_MS) {
            issues.add("Processing time too high - consider optimization");
        }
        if (metrics.improvement().confidenceChange() < 0) {
            issues.add("Confidence decreased - visual validation might be contradicting grouping");
        }
        return issues;
    }

    public static String report(ComparisonMetrics metrics) {
        ComparisonMetrics.Improvement improvement = metrics.improvement();
        ComparisonMetrics.Coverage coverage = metrics.coverage();
        ComparisonMetrics.Accuracy accuracy = metrics.accuracy();
        ComparisonMetrics.Performance performance = metrics.performance();
        String summary = improvement.componentCount() > 0
                ? "Visual validation added " + improvement.componentCount() + " components with a "
                        + one(improvement.confidenceChange()) + "% confidence change."
                : "Visual validation confirmed and refined the semantic groups.";
        return "Two-stage analysis report\n\n"
                + "Improvement\n"
                + "  Component detection:   " + signed(improvement.componentCount()) + " components\n"
                + "  Confidence change:     " + signed(improvement.confidenceChange()) + "%\n"
                + "  Processing efficiency: " + one(improvement.processingEfficiency()) + "%\n\n"
                + "Coverage\n"
                + "  Text elements:         " + coverage.text() + "\n"
                + "  Interactive elements:  " + coverage.interactive() + "\n"
                + "  Structural elements:   " + coverage.structural() + "\n\n"
                + "Accuracy (estimated)\n"
                + "  Grouping:              " + one(accuracy.grouping()) + "%\n"
                + "  Validation:            " + one(accuracy.validation()) + "%\n"
                + "  Overall improvement:   " + signed(accuracy.overallImprovement()) + "%\n\n"
                + "Performance\n"
                + "  Grouping:              " + seconds(performance.groupingMs()) + "s\n"
                + "  Validation:            " + seconds(performance.validationMs()) + "s\n"
                + "  Total:                 " + seconds(performance.totalMs()) + "s\n\n"
                + summary + "\n";
    }

    private static String signed(int value) {
        return value > 0 ? "+" + value : String.valueOf(value);
    }

    private static String signed(double value) {
        return value > 0 ? "+" + one(value) : one(value);
    }

    private static String one(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    private static String seconds(long ms) {
        return String.format(Locale.ROOT, "%.1f", ms / 1000.0);
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
