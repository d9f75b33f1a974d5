package com.designlens.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Final Style Mapper output consumed by an external code generator.
 * {@code content} and {@code imageUrl} may be {@code null}.
 */
public record MappedComponent(
        String id,
        String name,
        String targetComponent,
        Map<String, Object> props,
        Map<String, Object> styleAttributes,
        String content,
        String imageUrl
) implements Serializable {

    public MappedComponent {
        props = ModelMaps.copyOf(props);
        styleAttributes = ModelMaps.copyOf(styleAttributes);
    }
}
