package com.designlens.core.design;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.List;

/**
 * One node of the design-tool document tree, as delivered by the file API.
 * <p>
 * Only the fields the pipeline reads are bound; every other field is ignored.
 * All fields are optional: a node without {@code absoluteBoundingBox} is traversed
 * but produces no descriptor.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DesignNode(
        String id,
        String name,
        String type,
        Boolean visible,
        Double opacity,
        List<DesignNode> children,
        BoundingBox absoluteBoundingBox,
        Rgba backgroundColor,
        List<Paint> fills,
        List<Paint> strokes,
        Double strokeWeight,
        List<Effect> effects,
        Double cornerRadius,
        String characters,
        TypeStyle style,
        String layoutMode,
        Double paddingLeft,
        Double paddingRight,
        Double paddingTop,
        Double paddingBottom,
        Double itemSpacing,
        Boolean clipsContent,
        String componentId
) implements Serializable {

    public DesignNode {
        children = children == null ? List.of() : children;
        fills = fills == null ? List.of() : fills;
        strokes = strokes == null ? List.of() : strokes;
        effects = effects == null ? List.of() : effects;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BoundingBox(Double x, Double y, Double width, Double height) implements Serializable {

        /** True when all four coordinates are present and finite. */
        public boolean isComplete() {
            return finite(x) && finite(y) && finite(width) && finite(height);
        }

        private static boolean finite(Double value) {
            return value != null && Double.isFinite(value);
        }
    }

    /** Color with channels normalized to [0,1]. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Rgba(double r, double g, double b, Double a) implements Serializable {

        public double alpha() {
            return a == null ? 1.0 : a;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Vector(double x, double y) implements Serializable {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ColorStop(double position, Rgba color) implements Serializable {}

    /**
     * A fill or stroke. {@code type} is SOLID, GRADIENT_LINEAR, GRADIENT_RADIAL, IMAGE, ...
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Paint(
            String type,
            Boolean visible,
            Double opacity,
            Rgba color,
            List<Vector> gradientHandlePositions,
            List<List<Double>> gradientTransform,
            List<ColorStop> gradientStops,
            String imageRef,
            String scaleMode
    ) implements Serializable {

        public boolean isVisible() {
            return visible == null || visible;
        }

        public boolean isSolid() {
            return "SOLID".equals(type) && color != null;
        }

        public boolean isLinearGradient() {
            return "GRADIENT_LINEAR".equals(type) && gradientStops != null && !gradientStops.isEmpty();
        }

        public boolean isImage() {
            return "IMAGE".equals(type);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Effect(String type, Boolean visible, Rgba color, Vector offset, Double radius, Double spread)
            implements Serializable {

        public boolean isVisible() {
            return visible == null || visible;
        }

        public boolean isShadow() {
            return "DROP_SHADOW".equals(type) || "INNER_SHADOW".equals(type);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TypeStyle(
            String fontFamily,
            Double fontWeight,
            Double fontSize,
            Double lineHeightPx,
            String textAlignHorizontal
    ) implements Serializable {}
}
