package com.designlens.core.spatial;

import com.designlens.core.model.Bounds;
import com.designlens.core.model.ComponentDescriptor;
import com.designlens.core.model.NodeKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Geometric and textual heuristics over a descriptor list.
 * <p>
 * Every method is pure and order-sensitive: identical input in identical order gives
 * identical output. Callers needing order independence sort first.
 */
public final class SpatialAnalyzer {

    public static final double CLUSTER_THRESHOLD_PX = 100.0;
    public static final double ALIGNMENT_TOLERANCE_PX = 10.0;
    public static final double SECTION_GAP_PX = 50.0;

    private static final List<String> INTERACTION_NAME_KEYWORDS = List.of("button", "pay", "confirm", "back");
    private static final List<String> INTERACTIVE_TEXT_KEYWORDS = List.of(
            "pay", "confirm", "back", "add", "button", "click", "tap", "next", "continue", "cancel");
    private static final List<String> BUTTON_TEXT_KEYWORDS = List.of("pay", "add", "close", "back");
    private static final Pattern VALUE_PATTERN = Pattern.compile("^\\$?\\d+");

    private SpatialAnalyzer() {}

    /** Count of descriptors per node kind, in first-seen order. */
    public static Map<NodeKind, Integer> typeDistribution(List<ComponentDescriptor> descriptors) {
        Map<NodeKind, Integer> distribution = new LinkedHashMap<>();
        for (ComponentDescriptor d : descriptors) {
            distribution.merge(d.type(), 1, Integer::sum);
        }
        return distribution;
    }

    public static List<List<ComponentDescriptor>> findSpatialClusters(List<ComponentDescriptor> descriptors) {
        return findSpatialClusters(descriptors, CLUSTER_THRESHOLD_PX);
    }

    /**
     * Connected components of the graph linking descriptors whose centers lie closer than
     * {@code thresholdPx}. Singletons are included; clusters are ordered by their first member.
     */
    public static List<List<ComponentDescriptor>> findSpatialClusters(List<ComponentDescriptor> descriptors,
                                                                      double thresholdPx) {
        int n = descriptors.size();
        boolean[] visited = new boolean[n];
        List<List<ComponentDescriptor>> clusters = new ArrayList<>();
        for (int start = 0; start < n; start++) {
            if (visited[start]) continue;
            List<Integer> memberIndexes = new ArrayList<>();
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(start);
            visited[start] = true;
            while (!queue.isEmpty()) {
                int current = queue.poll();
                memberIndexes.add(current);
                Bounds bounds = descriptors.get(current).bounds();
                for (int other = 0; other < n; other++) {
                    if (!visited[other] && bounds.centerDistance(descriptors.get(other).bounds()) < thresholdPx) {
                        visited[other] = true;
                        queue.add(other);
                    }
                }
            }
            memberIndexes.sort(Integer::compare);
            clusters.add(memberIndexes.stream().map(descriptors::get).toList());
        }
        return clusters;
    }

    /** Clusters with at least two members. */
    public static List<List<ComponentDescriptor>> multiMemberClusters(List<ComponentDescriptor> descriptors) {
        return findSpatialClusters(descriptors).stream().filter(c -> c.size() > 1).toList();
    }

    public static List<Alignment> findAxisAlignments(List<ComponentDescriptor> descriptors, Axis axis) {
        return findAxisAlignments(descriptors, axis, ALIGNMENT_TOLERANCE_PX);
    }

    /**
     * Buckets descriptors by their coordinate rounded to {@code tolerancePx}, keeps buckets with
     * two or more members and sorts each along the orthogonal axis. Buckets come out in ascending
     * coordinate order.
     */
    public static List<Alignment> findAxisAlignments(List<ComponentDescriptor> descriptors, Axis axis,
                                                     double tolerancePx) {
        TreeMap<Double, List<ComponentDescriptor>> buckets = new TreeMap<>();
        for (ComponentDescriptor d : descriptors) {
            double coordinate = axis == Axis.ROW ? d.bounds().y() : d.bounds().x();
            double key = Math.round(coordinate / tolerancePx) * tolerancePx;
            buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(d);
        }
        Comparator<ComponentDescriptor> orthogonal = axis == Axis.ROW
                ? Comparator.comparingDouble(d -> d.bounds().x())
                : Comparator.comparingDouble(d -> d.bounds().y());
        List<Alignment> alignments = new ArrayList<>();
        buckets.forEach((coordinate, members) -> {
            if (members.size() >= 2) {
                List<ComponentDescriptor> sorted = new ArrayList<>(members);
                sorted.sort(orthogonal);
                alignments.add(new Alignment(axis, coordinate, sorted));
            }
        });
        return alignments;
    }

    /**
     * Likely interactive descriptors: names with button/pay/confirm/back, text taller than 20px,
     * or rectangles at least 50x30.
     */
    public static List<ComponentDescriptor> findInteractionCandidates(List<ComponentDescriptor> descriptors) {
        return descriptors.stream().filter(SpatialAnalyzer::isInteractionCandidate).toList();
    }

    static boolean isInteractionCandidate(ComponentDescriptor d) {
        String name = d.name().toLowerCase(Locale.ROOT);
        if (INTERACTION_NAME_KEYWORDS.stream().anyMatch(name::contains)) return true;
        if (d.type() == NodeKind.TEXT && d.bounds().height() > 20) return true;
        return d.type() == NodeKind.RECTANGLE && d.bounds().width() >= 50 && d.bounds().height() >= 30;
    }

    /** Classifies text descriptors that carry characters. Non-text descriptors are ignored. */
    public static TextClassification classifyText(List<ComponentDescriptor> descriptors) {
        List<ComponentDescriptor> interactive = new ArrayList<>();
        List<ComponentDescriptor> headers = new ArrayList<>();
        List<ComponentDescriptor> values = new ArrayList<>();
        for (ComponentDescriptor d : textNodes(descriptors)) {
            String text = d.characters();
            if (isInteractiveText(text)) interactive.add(d);
            if (isHeaderText(text, d.bounds())) headers.add(d);
            if (isValueText(text)) values.add(d);
        }
        return new TextClassification(interactive, headers, values);
    }

    static boolean isInteractiveText(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return INTERACTIVE_TEXT_KEYWORDS.stream().anyMatch(lower::contains);
    }

    static boolean isHeaderText(String text, Bounds bounds) {
        return text.length() < 20 && (text.contains("Payment")
                || text.contains("Total")
                || bounds.y() < 200
                || text.equals(text.toUpperCase(Locale.ROOT)));
    }

    static boolean isValueText(String text) {
        return VALUE_PATTERN.matcher(text).find();
    }

    /** Text descriptors with non-empty characters, in input order. */
    public static List<ComponentDescriptor> textNodes(List<ComponentDescriptor> descriptors) {
        return descriptors.stream().filter(d -> d.type() == NodeKind.TEXT && d.hasText()).toList();
    }

    /** Smallest box enclosing every descriptor; a zero box for an empty list. */
    public static Bounds overallBounds(List<ComponentDescriptor> descriptors) {
        if (descriptors.isEmpty()) {
            return new Bounds(0, 0, 0, 0);
        }
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (ComponentDescriptor d : descriptors) {
            Bounds b = d.bounds();
            minX = Math.min(minX, b.x());
            minY = Math.min(minY, b.y());
            maxX = Math.max(maxX, b.right());
            maxY = Math.max(maxY, b.bottom());
        }
        return new Bounds(minX, minY, maxX - minX, maxY - minY);
    }

    /** Assigns each descriptor to a third of the overall height by its top edge. */
    public static BandSections sectionByVerticalBand(List<ComponentDescriptor> descriptors) {
        Bounds overall = overallBounds(descriptors);
        double third = overall.height() / 3.0;
        List<ComponentDescriptor> top = new ArrayList<>();
        List<ComponentDescriptor> middle = new ArrayList<>();
        List<ComponentDescriptor> bottom = new ArrayList<>();
        for (ComponentDescriptor d : descriptors) {
            double offset = d.bounds().y() - overall.y();
            if (offset < third) {
                top.add(d);
            } else if (offset < 2 * third) {
                middle.add(d);
            } else {
                bottom.add(d);
            }
        }
        return new BandSections(top, middle, bottom);
    }

    /**
     * Sorts by top edge and starts a new section whenever the next node's top edge lies more
     * than 50px below the current node's bottom edge.
     */
    public static List<VerticalSection> mergeVerticalSections(List<ComponentDescriptor> descriptors) {
        List<ComponentDescriptor> sorted = new ArrayList<>(descriptors);
        sorted.sort(Comparator.comparingDouble(d -> d.bounds().y()));
        List<VerticalSection> sections = new ArrayList<>();
        List<ComponentDescriptor> current = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            ComponentDescriptor node = sorted.get(i);
            current.add(node);
            boolean last = i == sorted.size() - 1;
            if (last || sorted.get(i + 1).bounds().y() - node.bounds().bottom() > SECTION_GAP_PX) {
                sections.add(new VerticalSection(current.get(0).bounds().y(), node.bounds().bottom(), current));
                current = new ArrayList<>();
            }
        }
        return sections;
    }

    public static ContainerStats containerStats(List<ComponentDescriptor> descriptors) {
        List<ComponentDescriptor> containers = descriptors.stream().filter(d -> d.type().isContainer()).toList();
        double average = containers.stream().mapToDouble(d -> d.bounds().area()).average().orElse(0.0);
        int large = (int) containers.stream().filter(d -> d.bounds().area() > average * 2).count();
        int small = (int) containers.stream().filter(d -> d.bounds().area() < average * 0.5).count();
        return new ContainerStats(containers.size(), average, large, small);
    }

    /** Human-readable layout observations used in the grouping prompt. */
    public static List<String> layoutPatterns(List<ComponentDescriptor> descriptors) {
        List<String> patterns = new ArrayList<>();

        long buttons = descriptors.stream().filter(d -> {
            if (d.name().toLowerCase(Locale.ROOT).contains("button")) return true;
            String text = d.characters();
            return text != null && BUTTON_TEXT_KEYWORDS.stream().anyMatch(text.toLowerCase(Locale.ROOT)::contains);
        }).count();
        if (buttons >= 3) {
            patterns.add("Button grid detected: " + buttons + " interactive elements");
        }

        long topElements = descriptors.stream().filter(d -> d.bounds().y() < 100).count();
        if (topElements > 0) {
            patterns.add("Header pattern: " + topElements + " elements in top area");
        }

        double totalHeight = descriptors.stream().mapToDouble(d -> d.bounds().bottom()).max().orElse(0.0);
        long bottomElements = descriptors.stream().filter(d -> d.bounds().y() > totalHeight * 0.8).count();
        if (bottomElements > 0) {
            patterns.add("Bottom action area: " + bottomElements + " elements near bottom");
        }

        int columns = findAxisAlignments(descriptors, Axis.COLUMN).size();
        if (columns > 1) {
            patterns.add("Horizontal alignments: " + columns + " aligned groups detected");
        }

        return patterns.isEmpty() ? List.of("No clear layout patterns detected") : patterns;
    }
}
