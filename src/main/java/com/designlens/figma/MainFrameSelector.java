package com.designlens.figma;

import com.designlens.core.design.DesignNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Picks the screen-sized frames of a document, used to choose what to export as a screenshot.
 */
public final class MainFrameSelector {

    private static final Logger log = LoggerFactory.getLogger(MainFrameSelector.class);

    static final double MIN_FRAME_SIZE = 200;

    private MainFrameSelector() {}

    /**
     * Returns ids of FRAME nodes larger than 200x200 whose names do not start with '_' or '.',
     * in depth-first order. When there are none, any FRAME not starting with '_' qualifies.
     */
    public static List<String> select(DesignNode document) {
        if (document == null) {
            return List.of();
        }
        List<String> frames = collect(document, MainFrameSelector::isMainFrame);
        if (frames.isEmpty()) {
            log.debug("No screen-sized frames found, falling back to any frame");
            frames = collect(document, node -> "FRAME".equals(node.type())
                    && !nameOf(node).startsWith("_"));
        }
        log.debug("Selected {} frame(s)", frames.size());
        return frames;
    }

    private static boolean isMainFrame(DesignNode node) {
        if (!"FRAME".equals(node.type()) || node.absoluteBoundingBox() == null
                || !node.absoluteBoundingBox().isComplete()) {
            return false;
        }
        var box = node.absoluteBoundingBox();
        String name = nameOf(node);
        return box.width() > MIN_FRAME_SIZE && box.height() > MIN_FRAME_SIZE
                && !name.startsWith("_") && !name.startsWith(".");
    }

    private static List<String> collect(DesignNode root, Predicate<DesignNode> accept) {
        var ids = new ArrayList<String>();
        var stack = new ArrayList<DesignNode>();
        stack.add(root);
        while (!stack.isEmpty()) {
            DesignNode node = stack.remove(stack.size() - 1);
            if (node == null) {
                continue;
            }
            if (node.id() != null && accept.test(node)) {
                ids.add(node.id());
            }
            List<DesignNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.add(children.get(i));
            }
        }
        return ids;
    }

    private static String nameOf(DesignNode node) {
        return node.name() == null ? "" : node.name();
    }
}
