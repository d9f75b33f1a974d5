package com.designlens.core.extraction;

import com.designlens.core.design.DesignNode;
import com.designlens.core.design.DesignNode.Paint;
import com.designlens.core.design.DesignNode.TypeStyle;
import com.designlens.core.model.DesignTokenSet;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Accumulates design tokens during one extraction traversal. Not shared between runs.
 */
class TokenCollector {

    static final double MAX_INFERRED_GAP = 100.0;

    private final Set<String> colors = new LinkedHashSet<>();
    private final Set<String> gradients = new LinkedHashSet<>();
    private final Set<String> fontFamilies = new LinkedHashSet<>();
    private final TreeSet<Double> fontSizes = new TreeSet<>();
    private final TreeSet<Integer> fontWeights = new TreeSet<>();
    private final TreeSet<Double> spacingValues = new TreeSet<>();
    private final Set<String> textStyles = new LinkedHashSet<>();

    void collect(DesignNode node) {
        collectPaints(node.fills(), true);
        collectPaints(node.strokes(), false);
        if ("TEXT".equals(node.type()) && node.style() != null) {
            collectText(node.style());
        }
        collectPadding(node);
        collectInferredGaps(node);
    }

    DesignTokenSet build() {
        return new DesignTokenSet(colors, gradients, fontFamilies, fontSizes, fontWeights, spacingValues, textStyles);
    }

    private void collectPaints(List<Paint> paints, boolean fills) {
        for (Paint paint : paints) {
            if (paint == null || !paint.isVisible()) continue;
            if (paint.isSolid()) {
                colors.add(ColorConverter.toHex(paint.color()));
            } else if (fills && paint.isLinearGradient()) {
                gradients.add(CssConverter.linearGradient(paint));
            }
        }
    }

    private void collectText(TypeStyle style) {
        if (style.fontFamily() != null && !style.fontFamily().isBlank()) {
            fontFamilies.add(style.fontFamily());
        }
        if (style.fontSize() != null && style.fontSize() > 0) {
            fontSizes.add(round(style.fontSize()));
        }
        if (style.fontWeight() != null && style.fontWeight() > 0) {
            fontWeights.add((int) Math.round(style.fontWeight()));
        }
        if (style.fontFamily() != null && style.fontWeight() != null && style.fontSize() != null) {
            textStyles.add(style.fontFamily() + "-" + Math.round(style.fontWeight()) + "-"
                    + ColorConverter.trim(style.fontSize()));
        }
    }

    private void collectPadding(DesignNode node) {
        addSpacing(node.paddingTop());
        addSpacing(node.paddingRight());
        addSpacing(node.paddingBottom());
        addSpacing(node.paddingLeft());
        addSpacing(node.itemSpacing());
    }

    /**
     * Gap between consecutive siblings along the parent's layout axis (VERTICAL sorts by y,
     * anything else by x): the next child's leading edge minus the current child's trailing
     * edge, kept when inside (0, 100).
     */
    private void collectInferredGaps(DesignNode parent) {
        boolean vertical = "VERTICAL".equals(parent.layoutMode());
        List<DesignNode.BoundingBox> boxes = new ArrayList<>();
        for (DesignNode child : parent.children()) {
            if (child != null && child.absoluteBoundingBox() != null && child.absoluteBoundingBox().isComplete()) {
                boxes.add(child.absoluteBoundingBox());
            }
        }
        boxes.sort(Comparator.comparingDouble(box -> vertical ? box.y() : box.x()));
        for (int i = 1; i < boxes.size(); i++) {
            DesignNode.BoundingBox previous = boxes.get(i - 1);
            DesignNode.BoundingBox current = boxes.get(i);
            double gap = vertical
                    ? current.y() - (previous.y() + previous.height())
                    : current.x() - (previous.x() + previous.width());
            if (gap > 0 && gap < MAX_INFERRED_GAP) {
                spacingValues.add(round(gap));
            }
        }
    }

    private void addSpacing(Double value) {
        if (value != null && value > 0) {
            spacingValues.add(round(value));
        }
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
