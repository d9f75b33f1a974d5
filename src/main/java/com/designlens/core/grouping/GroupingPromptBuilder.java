package com.designlens.core.grouping;

import com.designlens.core.model.Bounds;
import com.designlens.core.model.ComponentDescriptor;
import com.designlens.core.model.NodeKind;
import com.designlens.core.spatial.Axis;
import com.designlens.core.spatial.BandSections;
import com.designlens.core.spatial.ContainerStats;
import com.designlens.core.spatial.SpatialAnalyzer;
import com.designlens.core.spatial.TextClassification;
import com.designlens.core.spatial.VerticalSection;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders the grouping context document: design purpose, layout, structure, text,
 * spatial relationships and a node listing.
 */
public final class GroupingPromptBuilder {

    static final int MAX_LISTED_NODES = 50;
    static final int MAX_LISTED_CANDIDATES = 10;
    static final int MAX_LISTED_CLUSTERS = 5;

    private GroupingPromptBuilder() {}

    public static String build(String designName, List<ComponentDescriptor> descriptors) {
        int count = descriptors.size();
        return "You are analyzing the design \"" + designName + "\" to identify semantic UI components and their "
                + "layout relationships from " + count + " technical nodes.\n\n"
                + "## Design context\n" + designContext(descriptors) + "\n"
                + "## Layout structure\n" + layoutStructure(descriptors) + "\n"
                + "## Structural analysis\n" + structure(descriptors) + "\n"
                + "## Text content\n" + textContent(descriptors) + "\n"
                + "## Spatial groupings\n" + spatialGroupings(descriptors) + "\n"
                + "## Nodes\n" + nodeListing(descriptors) + "\n\n"
                + "## Task\n"
                + "Transform these " + count + " nodes into 5-12 logical UI components that reflect the actual design "
                + "structure. Group by visual section (header, content, footer) as well as by component. "
                + "Use section-aware names such as \"Header Section\", \"Payment Methods Section\", \"Total Display\" "
                + "or \"Primary Action Button\". Every group lists the ids of its member nodes in \"children\"; "
                + "use only ids from the node list and never put one id in two groups. "
                + "Group type is one of button, text, card, navigation, input, list, image, container, other. "
                + "Add layout properties (section, layout, priority, interactive) and a confidence between 0 and 1. "
                + "Include a layoutStructure with screenType, mainSections and userFlow.\n";
    }

    static String designContext(List<ComponentDescriptor> descriptors) {
        DesignPurpose.Match match = DesignPurpose.infer(descriptors);
        return "- Inferred design type: " + match.screenType().toUpperCase(Locale.ROOT) + "\n"
                + "- Confidence: " + match.confidenceLabel() + "\n"
                + "- Matching keywords: " + String.join(", ", match.matchedKeywords()) + "\n"
                + "- Expected user flow: " + match.expectedFlow() + "\n"
                + "- UI pattern expectations: " + match.patternExpectations() + "\n";
    }

    static String layoutStructure(List<ComponentDescriptor> descriptors) {
        Bounds overall = SpatialAnalyzer.overallBounds(descriptors);
        var sb = new StringBuilder();
        sb.append("- Canvas: ").append(fmt(overall.width())).append(" x ").append(fmt(overall.height()))
                .append(", y range ").append(fmt(overall.y())).append(" to ").append(fmt(overall.bottom())).append('\n');
        List<VerticalSection> sections = SpatialAnalyzer.mergeVerticalSections(descriptors);
        for (int i = 0; i < sections.size(); i++) {
            VerticalSection section = sections.get(i);
            sb.append("- Section ").append(i + 1).append(" (y ").append(fmt(section.startY())).append('-')
                    .append(fmt(section.endY())).append("): ").append(section.members().size()).append(" nodes; ")
                    .append(String.join(", ", section.keyElements().stream().limit(8).toList())).append('\n');
        }
        for (String pattern : SpatialAnalyzer.layoutPatterns(descriptors)) {
            sb.append("- ").append(pattern).append('\n');
        }
        BandSections bands = SpatialAnalyzer.sectionByVerticalBand(descriptors);
        sb.append("- Top third: ").append(bands.top().size()).append(" nodes, middle third: ")
                .append(bands.middle().size()).append(" nodes, bottom third: ").append(bands.bottom().size())
                .append(" nodes\n");
        return sb.toString();
    }

    static String structure(List<ComponentDescriptor> descriptors) {
        Map<NodeKind, Integer> distribution = SpatialAnalyzer.typeDistribution(descriptors);
        var sb = new StringBuilder();
        distribution.forEach((kind, n) -> sb.append("- ").append(kind).append(": ").append(n).append(" nodes\n"));
        ContainerStats stats = SpatialAnalyzer.containerStats(descriptors);
        sb.append("- Containers: ").append(stats.count()).append(", average area ")
                .append(Math.round(stats.averageArea())).append(" px2, ")
                .append(stats.large()).append(" large (likely sections), ")
                .append(stats.small()).append(" small (likely components)\n");
        List<ComponentDescriptor> candidates = SpatialAnalyzer.findInteractionCandidates(descriptors);
        sb.append("- Interaction candidates: ").append(candidates.size()).append('\n');
        for (ComponentDescriptor d : candidates.stream().limit(MAX_LISTED_CANDIDATES).toList()) {
            sb.append("  - ").append(d.type()).append(" \"").append(d.name()).append("\" ")
                    .append(fmt(d.bounds().width())).append('x').append(fmt(d.bounds().height())).append('\n');
        }
        return sb.toString();
    }

    static String textContent(List<ComponentDescriptor> descriptors) {
        List<ComponentDescriptor> text = SpatialAnalyzer.textNodes(descriptors);
        if (text.isEmpty()) {
            return "No text content found in design.\n";
        }
        TextClassification classification = SpatialAnalyzer.classifyText(descriptors);
        return "Found " + text.size() + " text elements: " + quoted(text) + "\n"
                + "- Interactive text: " + orNone(classification.interactive()) + "\n"
                + "- Headers/labels: " + orNone(classification.headers()) + "\n"
                + "- Values/data: " + orNone(classification.values()) + "\n";
    }

    static String spatialGroupings(List<ComponentDescriptor> descriptors) {
        List<List<ComponentDescriptor>> clusters = SpatialAnalyzer.multiMemberClusters(descriptors);
        var sb = new StringBuilder();
        sb.append("- ").append(clusters.size()).append(" spatial clusters\n")
                .append("- ").append(SpatialAnalyzer.findAxisAlignments(descriptors, Axis.ROW).size())
                .append(" row alignments\n")
                .append("- ").append(SpatialAnalyzer.findAxisAlignments(descriptors, Axis.COLUMN).size())
                .append(" column alignments\n");
        for (int i = 0; i < Math.min(MAX_LISTED_CLUSTERS, clusters.size()); i++) {
            Bounds anchor = clusters.get(i).get(0).bounds();
            sb.append("- Cluster ").append(i + 1).append(": ").append(clusters.get(i).size())
                    .append(" elements around (").append(fmt(anchor.x())).append(", ").append(fmt(anchor.y()))
                    .append(")\n");
        }
        return sb.toString();
    }

    static String nodeListing(List<ComponentDescriptor> descriptors) {
        return descriptors.stream()
                .limit(MAX_LISTED_NODES)
                .map(d -> "- id=" + d.id() + " " + d.type() + " \"" + d.name() + "\" "
                        + fmt(d.bounds().width()) + "x" + fmt(d.bounds().height())
                        + " at (" + fmt(d.bounds().x()) + ", " + fmt(d.bounds().y()) + ")"
                        + (d.hasText() ? " text:\"" + d.characters() + "\"" : ""))
                .collect(Collectors.joining("\n"));
    }

    private static String quoted(List<ComponentDescriptor> nodes) {
        return nodes.stream().map(d -> "\"" + d.characters() + "\"").collect(Collectors.joining(", "));
    }

    private static String orNone(List<ComponentDescriptor> nodes) {
        return nodes.isEmpty() ? "None identified" : quoted(nodes);
    }

    static String fmt(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(Math.round(value * 10) / 10.0);
    }
}
