package com.designlens.core.validation;

import com.designlens.core.model.Bounds;
import com.designlens.core.model.SemanticGroup;
import com.designlens.core.model.SemanticType;
import com.designlens.core.model.TargetMapping;
import com.designlens.core.model.ValidatedComponent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cross-references components reported by the vision model with the semantic groups
 * they were derived from.
 * <p>
 * A component matches a group by id first, then by the nearest unclaimed group whose center
 * lies within {@value #MATCH_DISTANCE_PX}px. Each group backs at most one component.
 */
public final class ComponentReconciler {

    private static final Logger log = LoggerFactory.getLogger(ComponentReconciler.class);

    static final double MATCH_DISTANCE_PX = 50.0;
    static final double BOUNDS_TOLERANCE_PX = 24.0;

    private ComponentReconciler() {}

    public record Outcome(List<ValidatedComponent> components, int missingMappings, int unconfirmedGroups) {

        public Outcome {
            components = List.copyOf(components);
        }
    }

    public static Outcome reconcile(List<VisionResponse.Component> reported, List<SemanticGroup> groups) {
        Set<String> claimedGroups = new HashSet<>();
        Set<String> usedIds = new HashSet<>();
        var components = new ArrayList<ValidatedComponent>();
        int missingMappings = 0;
        int index = 0;

        for (VisionResponse.Component raw : reported) {
            index++;
            if (raw == null) continue;
            Bounds reportedBounds = bounds(raw.bounds());
            SemanticGroup group = match(raw.id(), reportedBounds, groups, claimedGroups);
            if (group != null) {
                claimedGroups.add(group.id());
            }

            SemanticType type = SemanticType.fromValue(raw.type());
            if (type == SemanticType.OTHER && group != null) {
                type = group.type();
            }

            Bounds resolved = resolveBounds(reportedBounds, group);

            Map<String, Object> properties = new LinkedHashMap<>();
            if (raw.properties() != null) {
                properties.putAll(raw.properties());
            }
            if (group != null) {
                properties.putAll(group.properties());
                properties.put("groupConfidence", group.confidence());
            }

            TargetMapping mapping;
            if (raw.targetMapping() == null || isBlank(raw.targetMapping().componentName())) {
                missingMappings++;
                mapping = TargetComponentTable.forType(type);
            } else {
                mapping = new TargetMapping(raw.targetMapping().componentName(), raw.targetMapping().props());
            }

            String id = firstNonBlank(raw.id(), group == null ? null : group.id(), "component-" + index);
            if (!usedIds.add(id)) {
                id = id + "-" + index;
                usedIds.add(id);
            }
            String name = firstNonBlank(raw.name(), group == null ? null : group.name(), "Component " + index);
            String description = firstNonBlank(raw.description(), group == null ? null : group.description(), "");

            components.add(new ValidatedComponent(id, type, name, description, resolved, properties, mapping,
                    group == null ? null : group.id(), group == null ? null : group.firstChildId()));
        }

        int unconfirmed = (int) groups.stream().filter(g -> !claimedGroups.contains(g.id())).count();
        log.debug("Reconciled {} components against {} groups ({} unconfirmed)",
                components.size(), groups.size(), unconfirmed);
        return new Outcome(components, missingMappings, unconfirmed);
    }

    static SemanticGroup match(String id, Bounds bounds, List<SemanticGroup> groups, Set<String> claimed) {
        if (id != null) {
            for (SemanticGroup group : groups) {
                if (!claimed.contains(group.id()) && group.id().equals(id)) {
                    return group;
                }
            }
        }
        if (bounds == null) {
            return null;
        }
        SemanticGroup nearest = null;
        double best = MATCH_DISTANCE_PX;
        for (SemanticGroup group : groups) {
            if (claimed.contains(group.id())) continue;
            double distance = bounds.centerDistance(group.bounds());
            if (distance < best) {
                best = distance;
                nearest = group;
            }
        }
        return nearest;
    }

    /**
     * Reported bounds are kept only while every edge stays within the tolerance of the group's
     * bounds; otherwise the group's bounds win.
     */
    static Bounds resolveBounds(Bounds reported, SemanticGroup group) {
        if (group == null) {
            return reported == null ? Bounds.DEFAULT : reported;
        }
        if (reported == null || reported.maxEdgeDeviation(group.bounds()) > BOUNDS_TOLERANCE_PX) {
            return group.bounds();
        }
        return reported;
    }

    private static Bounds bounds(VisionResponse.Box box) {
        return box == null || !box.isComplete() ? null : new Bounds(box.x(), box.y(), box.width(), box.height());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (!isBlank(candidate)) {
                return candidate;
            }
        }
        return candidates[candidates.length - 1];
    }
}
