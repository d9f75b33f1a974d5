package com.designlens.core.validation;

import com.designlens.core.model.AnalysisResult.DesignSystem;
import com.designlens.core.model.AnalysisResult.Palette;
import com.designlens.core.model.AnalysisResult.Scale;
import com.designlens.core.model.AnalysisResult.Typography;
import com.designlens.core.model.Bounds;
import com.designlens.core.model.ComponentDescriptor;
import com.designlens.core.model.NodeKind;
import com.designlens.core.model.SemanticGroup;
import com.designlens.core.model.Styling;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds a design-system summary from the member descriptors of semantic groups,
 * without any model involvement.
 */
public final class DesignSystemDeriver {

    static final int MAX_COLORS = 5;
    static final int MAX_SPACING_VALUES = 8;
    static final List<Double> DEFAULT_RADII = List.of(4.0, 8.0, 16.0);

    private DesignSystemDeriver() {}

    public static DesignSystem derive(List<SemanticGroup> groups, Map<String, ComponentDescriptor> descriptorsById) {
        List<ComponentDescriptor> members = new ArrayList<>();
        for (SemanticGroup group : groups) {
            for (String id : group.children()) {
                ComponentDescriptor d = descriptorsById.get(id);
                if (d != null) {
                    members.add(d);
                }
            }
        }
        return new DesignSystem(palette(members), typography(members), spacing(groups), radii(members));
    }

    static Palette palette(List<ComponentDescriptor> members) {
        Set<String> colors = new LinkedHashSet<>();
        for (ComponentDescriptor d : members) {
            Styling.ColorStyle style = d.styling().colors();
            if (style == null) continue;
            String fill = style.background() != null ? style.background() : style.text();
            if (fill != null && !"#000000".equals(fill)) {
                colors.add(fill);
            }
        }
        List<String> palette = colors.stream().limit(MAX_COLORS).toList();
        return new Palette(
                palette.size() > 0 ? palette.get(0) : VisionDefaults.PRIMARY,
                palette.size() > 1 ? palette.get(1) : VisionDefaults.SECONDARY,
                VisionDefaults.BACKGROUND,
                VisionDefaults.TEXT,
                palette.size() > 2 ? palette.get(2) : null);
    }

    static Typography typography(List<ComponentDescriptor> members) {
        TreeSet<Double> sizes = new TreeSet<>();
        TreeSet<Integer> weights = new TreeSet<>();
        String family = VisionDefaults.FONT_FAMILY;
        for (ComponentDescriptor d : members) {
            Styling.TypographyStyle style = d.styling().typography();
            if (d.type() != NodeKind.TEXT || style == null) continue;
            if (style.fontSize() != null) sizes.add(style.fontSize());
            if (style.fontWeight() != null) weights.add(style.fontWeight());
            if (style.fontFamily() != null && !style.fontFamily().isBlank()) family = style.fontFamily();
        }
        return new Typography(family,
                sizes.isEmpty() ? VisionDefaults.FONT_SIZES : new ArrayList<>(sizes),
                weights.isEmpty() ? VisionDefaults.FONT_WEIGHTS : new ArrayList<>(weights));
    }

    /** Every group bounds value inside (0, 100), sorted; the smallest is the base unit. */
    static Scale spacing(List<SemanticGroup> groups) {
        TreeSet<Double> values = new TreeSet<>();
        for (SemanticGroup group : groups) {
            Bounds b = group.bounds();
            for (double value : new double[] {b.x(), b.y(), b.width(), b.height()}) {
                if (value > 0 && value < 100) {
                    values.add(value);
                }
            }
        }
        if (values.isEmpty()) {
            return new Scale(VisionDefaults.BASE_UNIT, VisionDefaults.SPACING_SCALE);
        }
        return new Scale(values.first(), values.stream().limit(MAX_SPACING_VALUES).toList());
    }

    static List<Double> radii(List<ComponentDescriptor> members) {
        TreeSet<Double> radii = new TreeSet<>();
        for (ComponentDescriptor d : members) {
            Styling.BorderStyle borders = d.styling().borders();
            if (borders != null && borders.radius() != null && borders.radius() > 0) {
                radii.add(borders.radius());
            }
        }
        return radii.isEmpty() ? DEFAULT_RADII : new ArrayList<>(radii);
    }
}
