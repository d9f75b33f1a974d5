package com.designlens.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Resolved visual styling of one descriptor, split by concern.
 * Each sub-structure is {@code null} when the node carries nothing for that concern.
 */
public record Styling(
        ColorStyle colors,
        TypographyStyle typography,
        SpacingStyle spacing,
        BorderStyle borders,
        List<String> shadows,
        ImageStyle images
) implements Serializable {

    public static final Styling EMPTY = new Styling(null, null, null, null, List.of(), null);

    public Styling {
        shadows = shadows == null ? List.of() : List.copyOf(shadows);
    }

    public boolean hasImages() {
        return images != null && !images.imageRefs().isEmpty();
    }

    /** Hex colors; any of them may be {@code null}. */
    public record ColorStyle(String background, String text, String border) implements Serializable {}

    public record TypographyStyle(
            String fontFamily,
            Double fontSize,
            Integer fontWeight,
            Double lineHeight,
            String textAlign
    ) implements Serializable {}

    public record Padding(double top, double right, double bottom, double left) implements Serializable {

        public String toCss() {
            return px(top) + " " + px(right) + " " + px(bottom) + " " + px(left);
        }

        private static String px(double value) {
            return (value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value)) + "px";
        }
    }

    public record SpacingStyle(Padding padding, Double itemSpacing, String layoutMode) implements Serializable {}

    public record BorderStyle(Double radius, Double width, String style, String color) implements Serializable {}

    public record ImageStyle(List<String> imageRefs) implements Serializable {
        public ImageStyle {
            imageRefs = imageRefs == null ? List.of() : List.copyOf(imageRefs);
        }
    }
}
