package com.designlens.core.extraction;

import com.designlens.core.design.DesignNode.Rgba;

import java.util.Locale;

/**
 * Converts normalized [0,1] RGB channels into CSS color strings.
 */
public final class ColorConverter {

    private ColorConverter() {}

    /**
     * Six-digit lower-case hex, each channel clamped and rounded to the nearest byte.
     * {@code (1.0, 0.5019, 0.0)} becomes {@code #ff8000}.
     */
    public static String toHex(Rgba color) {
        return toHex(color.r(), color.g(), color.b());
    }

    public static String toHex(double r, double g, double b) {
        return String.format(Locale.ROOT, "#%02x%02x%02x", toByte(r), toByte(g), toByte(b));
    }

    /**
     * Hex when fully opaque, otherwise {@code rgba(r, g, b, a)} with the paint opacity folded in.
     */
    public static String toCss(Rgba color, Double paintOpacity) {
        double alpha = color.alpha() * (paintOpacity == null ? 1.0 : paintOpacity);
        if (alpha >= 1.0) {
            return toHex(color);
        }
        return String.format(Locale.ROOT, "rgba(%d, %d, %d, %s)",
                toByte(color.r()), toByte(color.g()), toByte(color.b()), trim(alpha));
    }

    static int toByte(double channel) {
        double clamped = Math.max(0.0, Math.min(1.0, channel));
        return (int) Math.round(clamped * 255.0);
    }

    static String trim(double value) {
        double rounded = Math.round(value * 100.0) / 100.0;
        if (rounded == Math.rint(rounded)) {
            return String.valueOf((long) rounded);
        }
        return String.valueOf(rounded);
    }
}
