package com.designlens.core.extraction;

import com.designlens.core.design.DesignNode.ColorStop;
import com.designlens.core.design.DesignNode.Effect;
import com.designlens.core.design.DesignNode.Paint;
import com.designlens.core.design.DesignNode.Rgba;
import com.designlens.core.design.DesignNode.Vector;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds CSS strings for gradient fills and shadow effects.
 */
public final class CssConverter {

    private static final Rgba BLACK = new Rgba(0, 0, 0, 0.25);

    private CssConverter() {}

    /**
     * {@code linear-gradient(<angle>deg, <color> <pos>%, ...)} with the angle snapped to 45 degrees.
     */
    public static String linearGradient(Paint paint) {
        List<ColorStop> gradientStops = paint.gradientStops() == null ? List.of() : paint.gradientStops();
        String stops = gradientStops.stream()
                .filter(Objects::nonNull)
                .map(CssConverter::stop)
                .collect(Collectors.joining(", "));
        return "linear-gradient(" + gradientAngle(paint) + "deg, " + stops + ")";
    }

    /**
     * CSS angle (0 = towards top, 90 = towards right) of a linear gradient.
     * Handle positions win when the first two are present; otherwise the rotation of the transform
     * matrix is used.
     */
    public static int gradientAngle(Paint paint) {
        List<Vector> handles = paint.gradientHandlePositions();
        double degrees;
        if (handles != null && handles.size() >= 2 && handles.get(0) != null && handles.get(1) != null) {
            double dx = handles.get(1).x() - handles.get(0).x();
            double dy = handles.get(1).y() - handles.get(0).y();
            degrees = Math.toDegrees(Math.atan2(dx, -dy));
        } else if (isMatrix(paint.gradientTransform())) {
            List<List<Double>> m = paint.gradientTransform();
            degrees = Math.toDegrees(Math.atan2(m.get(1).get(0), m.get(0).get(0))) + 90.0;
        } else {
            degrees = 180.0;
        }
        return snapTo45(degrees);
    }

    static int snapTo45(double degrees) {
        double normalized = ((degrees % 360.0) + 360.0) % 360.0;
        int snapped = (int) (Math.round(normalized / 45.0) * 45);
        return snapped % 360;
    }

    public static String boxShadow(Effect effect) {
        Vector offset = effect.offset() == null ? new Vector(0, 0) : effect.offset();
        Rgba color = effect.color() == null ? BLACK : effect.color();
        String shadow = String.format(Locale.ROOT, "%spx %spx %spx %spx %s",
                ColorConverter.trim(offset.x()),
                ColorConverter.trim(offset.y()),
                ColorConverter.trim(effect.radius() == null ? 0 : effect.radius()),
                ColorConverter.trim(effect.spread() == null ? 0 : effect.spread()),
                ColorConverter.toCss(color, null));
        return "INNER_SHADOW".equals(effect.type()) ? "inset " + shadow : shadow;
    }

    private static String stop(ColorStop stop) {
        String color = stop.color() == null ? "#000000" : ColorConverter.toCss(stop.color(), null);
        return color + " " + ColorConverter.trim(stop.position() * 100.0) + "%";
    }

    private static boolean isMatrix(List<List<Double>> m) {
        return m != null && m.size() >= 2
                && m.get(0) != null && m.get(0).size() >= 2
                && m.get(1) != null && m.get(1).size() >= 1
                && m.get(0).get(0) != null && m.get(1).get(0) != null;
    }
}
