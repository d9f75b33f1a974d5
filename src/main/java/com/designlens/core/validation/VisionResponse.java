package com.designlens.core.validation;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * JSON shape the vision model is asked to return. Every field is optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VisionResponse(
        List<Component> components,
        Layout layout,
        DesignSystem designSystem,
        Double confidence,
        List<String> suggestions
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Component(
            String id,
            String type,
            String name,
            String description,
            Box bounds,
            Map<String, Object> properties,
            @JsonAlias("materialUIMapping") Mapping targetMapping
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Mapping(@JsonAlias("component") String componentName, Map<String, Object> props) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Box(Double x, Double y, Double width, Double height) {

        public boolean isComplete() {
            return x != null && y != null && width != null && height != null;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Layout(String structure, Boolean responsive, List<String> breakpoints, Spacing spacing) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Spacing(Boolean consistent, List<Double> units) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DesignSystem(Palette colors, Typography typography, Scale spacing, List<Double> borderRadius) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Palette(String primary, String secondary, String background, String text, String accent) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Typography(String fontFamily, List<Double> sizes, List<Integer> weights) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Scale(Double baseUnit, List<Double> scale) {}
}
