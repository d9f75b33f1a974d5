package com.designlens.core.spatial;

import com.designlens.core.model.ComponentDescriptor;
import com.designlens.core.model.NodeKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.designlens.core.TestDescriptors.at;
import static com.designlens.core.TestDescriptors.node;
import static com.designlens.core.TestDescriptors.text;
import static org.junit.jupiter.api.Assertions.*;

class SpatialAnalyzerTest {

    @Nested
    @DisplayName("findSpatialClusters")
    class Clusters {

        @Test
        @DisplayName("Two nearby nodes form a cluster and a distant node stays isolated")
        void nearbyNodesCluster() {
            var a = at("a", 10, 10);
            var b = at("b", 20, 15);
            var c = at("c", 500, 500);

            var clusters = SpatialAnalyzer.findSpatialClusters(List.of(a, b, c));

            assertEquals(2, clusters.size());
            assertEquals(List.of(a, b), clusters.get(0));
            assertEquals(List.of(c), clusters.get(1));
            assertEquals(1, SpatialAnalyzer.multiMemberClusters(List.of(a, b, c)).size());
        }

        @Test
        @DisplayName("Clustering is transitive through intermediate nodes")
        void transitiveClusters() {
            var clusters = SpatialAnalyzer.findSpatialClusters(
                    List.of(at("a", 0, 0), at("b", 90, 0), at("c", 180, 0)));
            assertEquals(1, clusters.size());
            assertEquals(3, clusters.get(0).size());
        }

        @Test
        @DisplayName("An empty input yields no clusters")
        void emptyInput() {
            assertTrue(SpatialAnalyzer.findSpatialClusters(List.of()).isEmpty());
        }
    }

    @Nested
    @DisplayName("mergeVerticalSections")
    class Sections {

        @Test
        @DisplayName("A gap wider than 50px starts a new section")
        void splitsOnLargeGap() {
            var sections = SpatialAnalyzer.mergeVerticalSections(List.of(
                    at("d", 0, 300), at("a", 0, 0), at("b", 0, 20), at("c", 0, 40)));

            assertEquals(2, sections.size());
            assertEquals(3, sections.get(0).members().size());
            assertEquals(0.0, sections.get(0).startY());
            assertEquals(50.0, sections.get(0).endY());
            assertEquals(List.of("d"), sections.get(1).members().stream().map(ComponentDescriptor::id).toList());
        }

        @Test
        @DisplayName("Key elements prefer text content over names")
        void keyElements() {
            var sections = SpatialAnalyzer.mergeVerticalSections(List.of(
                    text("t", "Total: $96", 0, 0, 100, 20), node("r", "Card", NodeKind.RECTANGLE, 0, 30, 100, 20)));
            assertEquals(List.of("Total: $96", "Card"), sections.get(0).keyElements());
        }
    }

    @Test
    @DisplayName("Row alignments bucket by y within tolerance and sort by x")
    void rowAlignments() {
        var left = at("left", 10, 101);
        var right = at("right", 200, 98);
        var far = at("far", 10, 400);

        var rows = SpatialAnalyzer.findAxisAlignments(List.of(right, left, far), Axis.ROW);

        assertEquals(1, rows.size());
        assertEquals(100.0, rows.get(0).coordinate());
        assertEquals(List.of(left, right), rows.get(0).members());
    }

    @Test
    @DisplayName("Column alignments bucket by x")
    void columnAlignments() {
        var columns = SpatialAnalyzer.findAxisAlignments(
                List.of(at("a", 16, 0), at("b", 18, 200), at("c", 300, 0)), Axis.COLUMN);
        assertEquals(1, columns.size());
        assertEquals(2, columns.get(0).members().size());
    }

    @Test
    @DisplayName("Interaction candidates match names, tall text and large rectangles")
    void interactionCandidates() {
        var button = node("1", "Pay Button", NodeKind.FRAME, 0, 0, 10, 10);
        var tallText = text("2", "Hello", 0, 0, 50, 24);
        var bigRect = node("3", "Shape", NodeKind.RECTANGLE, 0, 0, 60, 40);
        var smallRect = node("4", "Dot", NodeKind.RECTANGLE, 0, 0, 10, 10);

        var candidates = SpatialAnalyzer.findInteractionCandidates(List.of(button, tallText, bigRect, smallRect));

        assertEquals(List.of(button, tallText, bigRect), candidates);
    }

    @Test
    @DisplayName("Text is classified as interactive, header and value independently")
    void classifyText() {
        var pay = text("1", "PAY & CONFIRM", 0, 500, 100, 20);
        var header = text("2", "Payment", 0, 40, 100, 20);
        var amount = text("3", "$96", 0, 420, 40, 20);
        var body = text("4", "Choose how you want to pay for this order", 0, 300, 300, 20);

        var classes = SpatialAnalyzer.classifyText(List.of(pay, header, amount, body));

        // "Payment" counts as interactive because it contains "pay"
        assertEquals(List.of(pay, header, body), classes.interactive());
        assertEquals(List.of(pay, header, amount), classes.headers());
        assertEquals(List.of(amount), classes.values());
    }

    @Test
    @DisplayName("Vertical bands split the overall height into thirds by top edge")
    void verticalBands() {
        var top = at("top", 0, 0);
        var middle = at("middle", 0, 120);
        var bottom = node("bottom", "b", NodeKind.RECTANGLE, 0, 250, 10, 50);

        var bands = SpatialAnalyzer.sectionByVerticalBand(List.of(top, middle, bottom));

        assertEquals(List.of(top), bands.top());
        assertEquals(List.of(middle), bands.middle());
        assertEquals(List.of(bottom), bands.bottom());
    }

    @Test
    @DisplayName("Type distribution counts kinds in first-seen order")
    void typeDistribution() {
        var distribution = SpatialAnalyzer.typeDistribution(List.of(
                text("1", "a", 0, 0, 1, 1), at("2", 0, 0), text("3", "b", 0, 0, 1, 1)));
        assertEquals(Map.of(NodeKind.TEXT, 2, NodeKind.RECTANGLE, 1), distribution);
        assertEquals(NodeKind.TEXT, distribution.keySet().iterator().next());
    }

    @Test
    @DisplayName("Container stats flag containers far above and below the average area")
    void containerStats() {
        var stats = SpatialAnalyzer.containerStats(List.of(
                node("1", "a", NodeKind.FRAME, 0, 0, 100, 100),
                node("2", "b", NodeKind.FRAME, 0, 0, 10, 10),
                node("3", "c", NodeKind.GROUP, 0, 0, 10, 10),
                at("4", 0, 0)));
        assertEquals(3, stats.count());
        assertEquals(1, stats.large());
        assertEquals(2, stats.small());
    }

    @Test
    @DisplayName("Layout patterns fall back to a fixed message")
    void layoutPatternsFallback() {
        assertEquals(List.of("No clear layout patterns detected"), SpatialAnalyzer.layoutPatterns(List.of()));
    }

    @Test
    @DisplayName("Layout patterns report header and bottom areas")
    void layoutPatterns() {
        var patterns = SpatialAnalyzer.layoutPatterns(List.of(
                at("1", 0, 10), node("2", "Pay Button", NodeKind.RECTANGLE, 0, 540, 300, 60)));
        assertTrue(patterns.contains("Header pattern: 1 elements in top area"));
        assertTrue(patterns.contains("Bottom action area: 1 elements near bottom"));
    }
}
