package com.designlens.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * A semantic group confirmed (or derived) by visual validation.
 *
 * @param sourceGroupId id of the originating {@link SemanticGroup}, {@code null} when the
 *                      component was reported by the vision model without a matching group
 * @param sourceNodeId  first child descriptor id of the originating group (provenance)
 */
public record ValidatedComponent(
        String id,
        SemanticType type,
        String name,
        String description,
        Bounds bounds,
        Map<String, Object> properties,
        TargetMapping targetMapping,
        String sourceGroupId,
        String sourceNodeId
) implements Serializable {

    public ValidatedComponent {
        properties = ModelMaps.copyOf(properties);
    }
}
