package com.designlens.core.mapping;

import com.designlens.core.model.Bounds;
import com.designlens.core.model.Styling;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the style-attribute map (sx-style keys) for one component.
 */
final class StyleAttributes {

    private StyleAttributes() {}

    static Map<String, Object> build(Bounds bounds, Styling styling) {
        Map<String, Object> sx = new LinkedHashMap<>();
        if (bounds != null) {
            sx.put("width", bounds.width());
            sx.put("height", bounds.height());
            sx.put("minWidth", bounds.width());
            sx.put("minHeight", bounds.height());
        }
        if (styling == null) {
            return sx;
        }

        Styling.ColorStyle colors = styling.colors();
        if (colors != null) {
            sx.put("backgroundColor", colors.background());
            sx.put("color", colors.text());
            sx.put("borderColor", colors.border());
        }

        Styling.TypographyStyle typography = styling.typography();
        if (typography != null) {
            sx.put("fontFamily", typography.fontFamily());
            sx.put("fontSize", typography.fontSize());
            sx.put("fontWeight", typography.fontWeight());
            sx.put("lineHeight", typography.lineHeight() == null ? null : typography.lineHeight() + "px");
            sx.put("textAlign", typography.textAlign());
        }

        Styling.SpacingStyle spacing = styling.spacing();
        if (spacing != null && spacing.padding() != null) {
            sx.put("padding", spacing.padding().toCss());
        }

        Styling.BorderStyle borders = styling.borders();
        if (borders != null) {
            if (borders.radius() != null && borders.radius() > 0) {
                sx.put("borderRadius", borders.radius());
            }
            if (borders.width() != null && borders.width() > 0) {
                sx.put("border", px(borders.width()) + " " + (borders.style() == null ? "solid" : borders.style())
                        + " " + (borders.color() == null ? "#000" : borders.color()));
            }
        }

        if (!styling.shadows().isEmpty()) {
            sx.put("boxShadow", String.join(", ", styling.shadows()));
        }
        sx.values().removeIf(value -> value == null);
        return sx;
    }

    private static String px(double value) {
        return (value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value)) + "px";
    }
}
