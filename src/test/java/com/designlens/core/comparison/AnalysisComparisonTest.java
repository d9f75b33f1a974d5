package com.designlens.core.comparison;

import com.designlens.core.model.AnalysisResult;
import com.designlens.core.model.Bounds;
import com.designlens.core.model.GroupingResult;
import com.designlens.core.model.SemanticGroup;
import com.designlens.core.model.SemanticType;
import com.designlens.core.model.TargetMapping;
import com.designlens.core.model.ValidatedComponent;
import com.designlens.core.validation.VisionDefaults;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.designlens.core.TestDescriptors.group;
import static org.junit.jupiter.api.Assertions.*;

class AnalysisComparisonTest {

    private static GroupingResult fiveGroups() {
        var groups = new ArrayList<SemanticGroup>();
        for (int i = 1; i <= 5; i++) {
            groups.add(group("g" + i, "Group " + i, SemanticType.CONTAINER, Bounds.DEFAULT, List.of("n" + i), 0.7));
        }
        return new GroupingResult(null, groups, 5, 5, List.of(), 0.7, 2_000, false);
    }

    private static AnalysisResult eightComponents() {
        List<SemanticType> types = List.of(SemanticType.TEXT, SemanticType.TEXT, SemanticType.BUTTON,
                SemanticType.BUTTON, SemanticType.BUTTON, SemanticType.INPUT, SemanticType.CARD, SemanticType.LIST);
        var components = new ArrayList<ValidatedComponent>();
        for (int i = 0; i < types.size(); i++) {
            components.add(new ValidatedComponent("c" + i, types.get(i), "C" + i, "", Bounds.DEFAULT, Map.of(),
                    new TargetMapping("Box", Map.of()), null, null));
        }
        return new AnalysisResult(components, VisionDefaults.LAYOUT, VisionDefaults.DESIGN_SYSTEM, 0.85,
                List.of(), false);
    }

    @Test
    @DisplayName("Five groups at 0.7 against eight components at 0.85")
    void comparesStages() {
        ComparisonMetrics metrics = AnalysisComparison.compare(fiveGroups(), eightComponents(), 10_000);

        assertEquals(3, metrics.improvement().componentCount());
        assertEquals(15.0, metrics.improvement().confidenceChange(), 1e-9);
        assertEquals(-94.67, metrics.improvement().processingEfficiency(), 1e-9);
        assertEquals(new ComparisonMetrics.Coverage(2, 4, 2), metrics.coverage());
        assertEquals(66.25, metrics.accuracy().grouping(), 1e-9);
        assertEquals(95.0, metrics.accuracy().validation(), 1e-9);
        assertEquals(28.75, metrics.accuracy().overallImprovement(), 1e-9);
        assertEquals(new ComparisonMetrics.Performance(2_000, 10_000, 12_000), metrics.performance());
    }

    @Test
    @DisplayName("A healthy comparison raises no issues and reports the gain")
    void healthyRun() {
        ComparisonMetrics metrics = AnalysisComparison.compare(fiveGroups(), eightComponents(), 10_000);

        assertTrue(AnalysisComparison.identifyIssues(metrics).isEmpty());
        String report = AnalysisComparison.report(metrics);
        assertTrue(report.contains("Component detection:   +3 components"));
        assertTrue(report.contains("Confidence change:     +15.0%"));
        assertTrue(report.contains("Total:                 12.0s"));
        assertTrue(report.contains("Visual validation added 3 components with a 15.0% confidence change."));
    }

    @Test
    @DisplayName("Every threshold breach becomes an issue")
    void allIssues() {
        ComparisonMetrics metrics = new ComparisonMetrics(
                new ComparisonMetrics.Improvement(-1, -3.0, 0),
                new ComparisonMetrics.Coverage(1, 0, 0),
                new ComparisonMetrics.Accuracy(50, 40, -10),
                new ComparisonMetrics.Performance(20_000, 30_000, 50_000));

        List<String> issues = AnalysisComparison.identifyIssues(metrics);

        assertEquals(5, issues.size());
        assertEquals("Low confidence improvement - consider enhancing prompts", issues.get(0));
        assertEquals("Confidence decreased - visual validation might be contradicting grouping", issues.get(4));
        assertTrue(AnalysisComparison.report(metrics).contains("confirmed and refined the semantic groups"));
    }

    @Test
    @DisplayName("Efficiency is zero without a grouping time base")
    void efficiencyWithoutTime() {
        GroupingResult instant = new GroupingResult(null, fiveGroups().groups(), 5, 5, List.of(), 0.7, 0, false);

        assertEquals(0.0, AnalysisComparison.efficiency(instant, eightComponents()));
    }

    @Test
    @DisplayName("Validation accuracy counts components without a target mapping as unmapped")
    void unmappedComponents() {
        AnalysisResult analysis = new AnalysisResult(List.of(
                new ValidatedComponent("a", SemanticType.TEXT, "A", "", Bounds.DEFAULT, Map.of(), null, null, null),
                new ValidatedComponent("b", SemanticType.TEXT, "B", "", Bounds.DEFAULT, Map.of(),
                        new TargetMapping("Typography", Map.of()), null, null)),
                VisionDefaults.LAYOUT, VisionDefaults.DESIGN_SYSTEM, 0.5, List.of(), false);

        // (2/8 + 0.5 + 1/2) / 3
        assertEquals(41.67, AnalysisComparison.validationAccuracy(analysis), 1e-9);
    }
}
