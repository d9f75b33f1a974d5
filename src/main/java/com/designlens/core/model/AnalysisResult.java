package com.designlens.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Terminal artifact of grouping and validation. Persisted by the caller, never by the core.
 */
public record AnalysisResult(
        List<ValidatedComponent> components,
        Layout layout,
        DesignSystem designSystem,
        double confidence,
        List<String> suggestions,
        boolean fallback
) implements Serializable {

    public AnalysisResult {
        components = components == null ? List.of() : List.copyOf(components);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public record Layout(String structure, boolean responsive, List<String> breakpoints, Spacing spacing)
            implements Serializable {

        public Layout {
            breakpoints = breakpoints == null ? List.of() : List.copyOf(breakpoints);
        }
    }

    public record Spacing(boolean consistent, List<Double> units) implements Serializable {
        public Spacing {
            units = units == null ? List.of() : List.copyOf(units);
        }
    }

    public record DesignSystem(Palette colors, Typography typography, Scale spacing, List<Double> borderRadius)
            implements Serializable {

        public DesignSystem {
            borderRadius = borderRadius == null ? List.of() : List.copyOf(borderRadius);
        }
    }

    /** {@code accent} may be {@code null}. */
    public record Palette(String primary, String secondary, String background, String text, String accent)
            implements Serializable {}

    public record Typography(String fontFamily, List<Double> sizes, List<Integer> weights) implements Serializable {
        public Typography {
            sizes = sizes == null ? List.of() : List.copyOf(sizes);
            weights = weights == null ? List.of() : List.copyOf(weights);
        }
    }

    public record Scale(double baseUnit, List<Double> scale) implements Serializable {
        public Scale {
            scale = scale == null ? List.of() : List.copyOf(scale);
        }
    }
}
