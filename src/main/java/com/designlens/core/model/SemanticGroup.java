package com.designlens.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * A named, typed cluster of descriptors believed to form one logical UI component.
 * {@code children} holds descriptor ids from the same run.
 */
public record SemanticGroup(
        String id,
        String name,
        SemanticType type,
        String description,
        Bounds bounds,
        List<String> children,
        Map<String, Object> properties,
        double confidence
) implements Serializable {

    public SemanticGroup {
        children = children == null ? List.of() : List.copyOf(children);
        properties = ModelMaps.copyOf(properties);
    }

    public SemanticGroup withChildren(List<String> newChildren) {
        return new SemanticGroup(id, name, type, description, bounds, newChildren, properties, confidence);
    }

    public String firstChildId() {
        return children.isEmpty() ? null : children.get(0);
    }
}
