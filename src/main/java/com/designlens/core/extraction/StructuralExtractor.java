package com.designlens.core.extraction;

import com.designlens.core.design.DesignFile;
import com.designlens.core.design.DesignNode;
import com.designlens.core.design.DesignNode.BoundingBox;
import com.designlens.core.design.DesignNode.Effect;
import com.designlens.core.design.DesignNode.Paint;
import com.designlens.core.design.DesignNode.TypeStyle;
import com.designlens.core.model.Bounds;
import com.designlens.core.model.ComponentDescriptor;
import com.designlens.core.model.NodeKind;
import com.designlens.core.model.Styling;
import com.designlens.core.model.Styling.BorderStyle;
import com.designlens.core.model.Styling.ColorStyle;
import com.designlens.core.model.Styling.ImageStyle;
import com.designlens.core.model.Styling.Padding;
import com.designlens.core.model.Styling.SpacingStyle;
import com.designlens.core.model.Styling.TypographyStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flattens a design-tree into component descriptors and mines design tokens in the same pass.
 * <p>
 * Traversal is depth-first in declaration order. DOCUMENT, CANVAS and SLICE nodes are visited
 * but never emitted; nodes without a complete bounding box are skipped, their children are not.
 * The extractor holds no state between calls.
 */
@Service
public class StructuralExtractor {

    private static final Logger log = LoggerFactory.getLogger(StructuralExtractor.class);

    public ExtractionResult extract(DesignFile file) {
        if (file == null) {
            throw new NoExtractableStructureException("no extractable structure: design file is missing");
        }
        return extract(file.document());
    }

    public ExtractionResult extract(DesignNode root) {
        if (root == null) {
            throw new NoExtractableStructureException("no extractable structure: design tree is missing");
        }

        var descriptors = new ArrayList<ComponentDescriptor>();
        var tokens = new TokenCollector();
        int skipped = 0;

        Deque<DesignNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            DesignNode node = stack.pop();
            tokens.collect(node);

            if (!NodeKind.isTransparent(node.type())) {
                ComponentDescriptor descriptor = toDescriptor(node);
                if (descriptor != null) {
                    descriptors.add(descriptor);
                } else {
                    skipped++;
                }
            }

            List<DesignNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                if (children.get(i) != null) {
                    stack.push(children.get(i));
                }
            }
        }

        if (descriptors.isEmpty()) {
            throw new NoExtractableStructureException(
                    "no extractable structure: no node in the tree carries absolute geometry");
        }
        log.info("Extracted {} descriptors ({} nodes skipped)", descriptors.size(), skipped);
        return new ExtractionResult(descriptors, tokens.build());
    }

    ComponentDescriptor toDescriptor(DesignNode node) {
        BoundingBox box = node.absoluteBoundingBox();
        if (node.id() == null || box == null || !box.isComplete()) {
            log.debug("Skipping node {} ({}): missing id or geometry", node.id(), node.type());
            return null;
        }
        NodeKind kind = NodeKind.fromRaw(node.type());
        Bounds bounds = new Bounds(box.x(), box.y(), box.width(), box.height());
        return new ComponentDescriptor(node.id(), node.name(), kind, bounds, styling(node, kind), rawProperties(node));
    }

    private Styling styling(DesignNode node, NodeKind kind) {
        TypographyStyle typography = kind == NodeKind.TEXT ? typography(node.style()) : null;
        SpacingStyle spacing = kind.isContainer() || kind == NodeKind.COMPONENT || kind == NodeKind.INSTANCE
                ? spacing(node) : null;
        BorderStyle borders = kind == NodeKind.TEXT ? null : borders(node);
        return new Styling(colors(node, kind), typography, spacing, borders, shadows(node.effects()), images(node));
    }

    private ColorStyle colors(DesignNode node, NodeKind kind) {
        String fill = firstSolid(node.fills());
        String border = firstSolid(node.strokes());
        if (kind == NodeKind.TEXT) {
            return fill == null && border == null ? null : new ColorStyle(null, fill, border);
        }
        if (fill == null && node.backgroundColor() != null && node.backgroundColor().alpha() > 0) {
            fill = ColorConverter.toHex(node.backgroundColor());
        }
        return fill == null && border == null ? null : new ColorStyle(fill, null, border);
    }

    private static String firstSolid(List<Paint> paints) {
        for (Paint paint : paints) {
            if (paint != null && paint.isVisible() && paint.isSolid()) {
                return ColorConverter.toHex(paint.color());
            }
        }
        return null;
    }

    private static TypographyStyle typography(TypeStyle style) {
        if (style == null) {
            return null;
        }
        Integer weight = style.fontWeight() == null ? null : (int) Math.round(style.fontWeight());
        String align = style.textAlignHorizontal() == null ? null : style.textAlignHorizontal().toLowerCase(Locale.ROOT);
        return new TypographyStyle(style.fontFamily(), style.fontSize(), weight, style.lineHeightPx(), align);
    }

    private static SpacingStyle spacing(DesignNode node) {
        boolean hasPadding = node.paddingTop() != null || node.paddingRight() != null
                || node.paddingBottom() != null || node.paddingLeft() != null;
        if (!hasPadding && node.itemSpacing() == null && node.layoutMode() == null) {
            return null;
        }
        Padding padding = hasPadding
                ? new Padding(orZero(node.paddingTop()), orZero(node.paddingRight()),
                        orZero(node.paddingBottom()), orZero(node.paddingLeft()))
                : null;
        return new SpacingStyle(padding, node.itemSpacing(), node.layoutMode());
    }

    private static BorderStyle borders(DesignNode node) {
        String strokeColor = firstSolid(node.strokes());
        Double width = strokeColor != null ? node.strokeWeight() : null;
        if (node.cornerRadius() == null && strokeColor == null) {
            return null;
        }
        return new BorderStyle(node.cornerRadius(), width, strokeColor != null ? "solid" : null, strokeColor);
    }

    private static List<String> shadows(List<Effect> effects) {
        var shadows = new ArrayList<String>();
        for (Effect effect : effects) {
            if (effect != null && effect.isVisible() && effect.isShadow()) {
                shadows.add(CssConverter.boxShadow(effect));
            }
        }
        return shadows;
    }

    private static ImageStyle images(DesignNode node) {
        var refs = new ArrayList<String>();
        for (Paint paint : node.fills()) {
            if (paint != null && paint.isVisible() && paint.isImage()) {
                refs.add(paint.imageRef() != null ? paint.imageRef() : "image:" + node.id());
            }
        }
        return refs.isEmpty() ? null : new ImageStyle(refs);
    }

    private static Map<String, Object> rawProperties(DesignNode node) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("characters", node.characters());
        raw.put("visible", node.visible() == null ? Boolean.TRUE : node.visible());
        raw.put("opacity", node.opacity());
        raw.put("componentId", node.componentId());
        raw.put("clipsContent", node.clipsContent());
        return raw;
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }
}
