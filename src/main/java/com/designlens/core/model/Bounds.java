package com.designlens.core.model;

import java.io.Serializable;

/**
 * Absolute axis-aligned box in design-canvas pixels.
 */
public record Bounds(double x, double y, double width, double height) implements Serializable {

    public static final Bounds DEFAULT = new Bounds(0, 0, 100, 50);

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    public double centerX() {
        return x + width / 2.0;
    }

    public double centerY() {
        return y + height / 2.0;
    }

    public double area() {
        return width * height;
    }

    /** Euclidean distance between the two box centers. */
    public double centerDistance(Bounds other) {
        double dx = centerX() - other.centerX();
        double dy = centerY() - other.centerY();
        return Math.sqrt(dx * dx + dy * dy);
    }

    /** Largest absolute difference between corresponding edges of the two boxes. */
    public double maxEdgeDeviation(Bounds other) {
        double left = Math.abs(x - other.x);
        double top = Math.abs(y - other.y);
        double right = Math.abs(right() - other.right());
        double bottom = Math.abs(bottom() - other.bottom());
        return Math.max(Math.max(left, top), Math.max(right, bottom));
    }
}
