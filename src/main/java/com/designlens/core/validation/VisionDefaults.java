package com.designlens.core.validation;

import com.designlens.core.model.AnalysisResult.DesignSystem;
import com.designlens.core.model.AnalysisResult.Layout;
import com.designlens.core.model.AnalysisResult.Palette;
import com.designlens.core.model.AnalysisResult.Scale;
import com.designlens.core.model.AnalysisResult.Spacing;
import com.designlens.core.model.AnalysisResult.Typography;

import java.util.List;

/**
 * Values used for any field the vision model leaves out.
 */
public final class VisionDefaults {

    public static final String STRUCTURE = "mixed";
    public static final List<String> BREAKPOINTS = List.of("xs", "sm", "md", "lg");
    public static final List<Double> SPACING_UNITS = List.of(8.0, 16.0, 24.0);
    public static final Layout LAYOUT = new Layout(STRUCTURE, false, BREAKPOINTS, new Spacing(false, SPACING_UNITS));

    public static final String PRIMARY = "#1976d2";
    public static final String SECONDARY = "#dc004e";
    public static final String BACKGROUND = "#ffffff";
    public static final String TEXT = "#333333";
    public static final String FONT_FAMILY = "Roboto";
    public static final List<Double> FONT_SIZES = List.of(14.0, 16.0, 18.0, 24.0);
    public static final List<Integer> FONT_WEIGHTS = List.of(400, 500, 700);
    public static final double BASE_UNIT = 8.0;
    public static final List<Double> SPACING_SCALE = List.of(8.0, 16.0, 24.0, 32.0);
    public static final List<Double> BORDER_RADIUS = List.of(4.0, 8.0, 12.0);

    public static final DesignSystem DESIGN_SYSTEM = new DesignSystem(
            new Palette(PRIMARY, SECONDARY, BACKGROUND, TEXT, null),
            new Typography(FONT_FAMILY, FONT_SIZES, FONT_WEIGHTS),
            new Scale(BASE_UNIT, SPACING_SCALE),
            BORDER_RADIUS);

    public static final double CONFIDENCE = 0.7;
    public static final double FALLBACK_MIN_CONFIDENCE = 0.6;
    public static final String COMPLETED_SUGGESTION = "Visual analysis completed";
    public static final String FALLBACK_SUGGESTION = "Consider using visual validation for more accurate analysis";

    private VisionDefaults() {}
}
