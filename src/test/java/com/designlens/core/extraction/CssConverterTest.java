package com.designlens.core.extraction;

import com.designlens.core.design.DesignNode.ColorStop;
import com.designlens.core.design.DesignNode.Effect;
import com.designlens.core.design.DesignNode.Paint;
import com.designlens.core.design.DesignNode.Rgba;
import com.designlens.core.design.DesignNode.Vector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CssConverterTest {

    private static final Rgba ORANGE = new Rgba(1, 0.5019607843, 0, 1.0);
    private static final Rgba RED = new Rgba(1, 0, 0, 1.0);

    private static Paint gradient(List<Vector> handles, List<List<Double>> transform) {
        return new Paint("GRADIENT_LINEAR", true, null, null, handles, transform,
                List.of(new ColorStop(0, ORANGE), new ColorStop(1, RED)), null, null);
    }

    @Nested
    @DisplayName("gradientAngle")
    class GradientAngle {

        @Test
        @DisplayName("Top-to-bottom handles give 180deg")
        void topToBottom() {
            assertEquals(180, CssConverter.gradientAngle(
                    gradient(List.of(new Vector(0.5, 0), new Vector(0.5, 1)), null)));
        }

        @Test
        @DisplayName("Left-to-right handles give 90deg")
        void leftToRight() {
            assertEquals(90, CssConverter.gradientAngle(
                    gradient(List.of(new Vector(0, 0.5), new Vector(1, 0.5)), null)));
        }

        @Test
        @DisplayName("Diagonal handles snap to the nearest 45 degrees")
        void snapsDiagonal() {
            assertEquals(135, CssConverter.gradientAngle(
                    gradient(List.of(new Vector(0, 0), new Vector(1, 0.9)), null)));
        }

        @Test
        @DisplayName("Identity transform matrix gives 90deg when handles are absent")
        void usesTransformMatrix() {
            assertEquals(90, CssConverter.gradientAngle(
                    gradient(null, List.of(List.of(1.0, 0.0, 0.0), List.of(0.0, 1.0, 0.0)))));
        }

        @Test
        @DisplayName("Defaults to 180deg without handles or matrix")
        void defaultsTo180() {
            assertEquals(180, CssConverter.gradientAngle(gradient(null, null)));
        }

        @Test
        @DisplayName("A null handle falls back to the transform matrix")
        void nullHandleUsesMatrix() {
            List<Vector> handles = Arrays.asList(null, new Vector(1, 1));
            assertEquals(90, CssConverter.gradientAngle(
                    gradient(handles, List.of(List.of(1.0, 0.0, 0.0), List.of(0.0, 1.0, 0.0)))));
            assertEquals(180, CssConverter.gradientAngle(gradient(handles, null)));
        }

        @Test
        @DisplayName("snapTo45 normalizes negative angles and wraps 360 to 0")
        void snapNormalizes() {
            assertEquals(315, CssConverter.snapTo45(-45));
            assertEquals(0, CssConverter.snapTo45(350));
        }
    }

    @Test
    @DisplayName("linearGradient lists stops with percentage positions")
    void linearGradientString() {
        String css = CssConverter.linearGradient(gradient(List.of(new Vector(0.5, 0), new Vector(0.5, 1)), null));
        assertEquals("linear-gradient(180deg, #ff8000 0%, #ff0000 100%)", css);
    }

    @Test
    @DisplayName("linearGradient skips null stops")
    void linearGradientSkipsNullStops() {
        var paint = new Paint("GRADIENT_LINEAR", true, null, null, null, null,
                Arrays.asList(null, new ColorStop(1, RED)), null, null);
        assertEquals("linear-gradient(180deg, #ff0000 100%)", CssConverter.linearGradient(paint));
    }

    @Test
    @DisplayName("Drop shadows render offset, blur, spread and color")
    void dropShadow() {
        var effect = new Effect("DROP_SHADOW", true, new Rgba(0, 0, 0, 0.25), new Vector(0, 4), 8.0, null);
        assertEquals("0px 4px 8px 0px rgba(0, 0, 0, 0.25)", CssConverter.boxShadow(effect));
    }

    @Test
    @DisplayName("Inner shadows are prefixed with inset")
    void innerShadow() {
        var effect = new Effect("INNER_SHADOW", true, new Rgba(0, 0, 0, 1.0), new Vector(1, 2), 3.0, 1.0);
        assertEquals("inset 1px 2px 3px 1px #000000", CssConverter.boxShadow(effect));
    }
}
