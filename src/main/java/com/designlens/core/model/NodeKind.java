package com.designlens.core.model;

import java.util.Locale;
import java.util.Set;

/**
 * Kind of design-tree node a descriptor was extracted from.
 * <p>
 * {@link #OTHER} covers geometry-carrying kinds outside the table (vectors, lines, stars...).
 */
public enum NodeKind {
    TEXT,
    RECTANGLE,
    ELLIPSE,
    FRAME,
    GROUP,
    COMPONENT,
    INSTANCE,
    OTHER;

    private static final Set<String> TRANSPARENT = Set.of("DOCUMENT", "CANVAS", "SLICE");

    /**
     * Container kinds without visual bounds: their children are visited,
     * they themselves never produce a descriptor.
     */
    public static boolean isTransparent(String rawType) {
        return rawType != null && TRANSPARENT.contains(rawType.toUpperCase(Locale.ROOT));
    }

    public static NodeKind fromRaw(String rawType) {
        if (rawType == null || rawType.isBlank()) {
            return OTHER;
        }
        try {
            return NodeKind.valueOf(rawType.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }

    public boolean isShape() {
        return this == RECTANGLE || this == ELLIPSE;
    }

    public boolean isContainer() {
        return this == FRAME || this == GROUP;
    }
}
