package com.designlens.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Mapped components together with the named design system built from the run's tokens.
 */
public record StyleMapping(List<MappedComponent> components, MappedDesignSystem designSystem) implements Serializable {

    public StyleMapping {
        components = components == null ? List.of() : List.copyOf(components);
    }

    public record MappedDesignSystem(
            Map<String, String> colors,
            Map<String, Map<String, String>> typography,
            List<Double> spacing
    ) implements Serializable {}
}
