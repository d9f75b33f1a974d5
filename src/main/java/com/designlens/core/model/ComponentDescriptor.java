package com.designlens.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Flattened representation of one design-tree node with resolved geometry and style.
 * <p>
 * {@code id} is the only key later stages use to refer back to a descriptor.
 * {@code rawProperties} keeps the few known scalar extras (characters, visible, opacity,
 * componentId, clipsContent); everything else on the node is dropped at extraction.
 */
public record ComponentDescriptor(
        String id,
        String name,
        NodeKind type,
        Bounds bounds,
        Styling styling,
        Map<String, Object> rawProperties
) implements Serializable {

    public ComponentDescriptor {
        name = name == null ? "" : name;
        styling = styling == null ? Styling.EMPTY : styling;
        rawProperties = ModelMaps.copyOf(rawProperties);
    }

    /** Text content for TEXT nodes, {@code null} otherwise or when absent. */
    public String characters() {
        Object value = rawProperties.get("characters");
        return value instanceof String s ? s : null;
    }

    public boolean hasText() {
        String text = characters();
        return text != null && !text.isEmpty();
    }
}
