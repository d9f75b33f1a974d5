package com.designlens.core.grouping;

import com.designlens.core.model.ComponentDescriptor;
import com.designlens.core.model.GroupingResult;
import com.designlens.core.model.NodeKind;
import com.designlens.core.model.SemanticGroup;
import com.designlens.core.model.SemanticType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Model-free grouping: each of the first {@value #MAX_GROUPS} descriptors becomes its own group.
 */
public final class FallbackGrouper {

    public static final int MAX_GROUPS = 15;
    public static final double CONFIDENCE = 0.5;

    private FallbackGrouper() {}

    public static GroupingResult group(List<ComponentDescriptor> descriptors, long processingTimeMs) {
        int grouped = Math.min(MAX_GROUPS, descriptors.size());
        var groups = new ArrayList<SemanticGroup>(grouped);
        for (ComponentDescriptor d : descriptors.subList(0, grouped)) {
            groups.add(toGroup(d));
        }
        List<ComponentDescriptor> ungrouped = descriptors.subList(grouped, descriptors.size());
        return new GroupingResult(null, groups, descriptors.size(), grouped, ungrouped,
                CONFIDENCE, processingTimeMs, true);
    }

    static SemanticGroup toGroup(ComponentDescriptor d) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("interactive", d.name().toLowerCase(Locale.ROOT).contains("button"));
        properties.put("text", d.characters());
        String name = d.name().isBlank() ? d.type() + " Component" : d.name();
        return new SemanticGroup("fallback-" + d.id(), name, semanticType(d.type()),
                d.type() + " component", d.bounds(), List.of(d.id()), properties, CONFIDENCE);
    }

    /** TEXT maps to text; RECTANGLE, FRAME and GROUP to container; everything else to other. */
    public static SemanticType semanticType(NodeKind kind) {
        return switch (kind) {
            case TEXT -> SemanticType.TEXT;
            case RECTANGLE, FRAME, GROUP -> SemanticType.CONTAINER;
            default -> SemanticType.OTHER;
        };
    }
}
