package com.designlens.core.validation;

import com.designlens.core.model.AnalysisResult.DesignSystem;
import com.designlens.core.model.Bounds;
import com.designlens.core.model.ComponentDescriptor;
import com.designlens.core.model.NodeKind;
import com.designlens.core.model.SemanticGroup;
import com.designlens.core.model.SemanticType;
import com.designlens.core.model.Styling;
import com.designlens.core.model.TargetMapping;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.designlens.core.TestDescriptors.group;
import static org.junit.jupiter.api.Assertions.*;

class DesignSystemDeriverTest {

    private static ComponentDescriptor shape(String id, String background, double radius) {
        Styling styling = new Styling(new Styling.ColorStyle(background, null, null), null, null,
                new Styling.BorderStyle(radius, null, null, null), List.of(), null);
        return new ComponentDescriptor(id, id, NodeKind.RECTANGLE, new Bounds(0, 0, 10, 10), styling, Map.of());
    }

    private static ComponentDescriptor label(String id, String color, double size, int weight) {
        Styling styling = new Styling(new Styling.ColorStyle(null, color, null),
                new Styling.TypographyStyle("Inter", size, weight, null, null), null, null, List.of(), null);
        return new ComponentDescriptor(id, id, NodeKind.TEXT, new Bounds(0, 0, 10, 10), styling, Map.of());
    }

    private static Map<String, ComponentDescriptor> byId(ComponentDescriptor... descriptors) {
        Map<String, ComponentDescriptor> map = new LinkedHashMap<>();
        for (ComponentDescriptor d : descriptors) {
            map.put(d.id(), d);
        }
        return map;
    }

    @Test
    @DisplayName("Colors, type scale, spacing and radii come from group members")
    void derivesFromMembers() {
        Map<String, ComponentDescriptor> descriptors = byId(
                shape("a", "#ff8000", 12),
                label("b", "#000000", 20, 700),
                label("c", "#ffffff", 16, 400),
                shape("d", "#eeeeee", 8));
        List<SemanticGroup> groups = List.of(
                group("g1", "Pay", SemanticType.BUTTON, new Bounds(16, 540, 343, 64), List.of("a", "b"), 0.8),
                group("g2", "Screen", SemanticType.CONTAINER, new Bounds(0, 0, 375, 640), List.of("c", "d", "ghost"), 0.8));

        DesignSystem system = DesignSystemDeriver.derive(groups, descriptors);

        assertEquals("#ff8000", system.colors().primary());
        assertEquals("#ffffff", system.colors().secondary());
        assertEquals("#eeeeee", system.colors().accent());
        assertEquals(VisionDefaults.BACKGROUND, system.colors().background());
        assertEquals("Inter", system.typography().fontFamily());
        assertEquals(List.of(16.0, 20.0), system.typography().sizes());
        assertEquals(List.of(400, 700), system.typography().weights());
        assertEquals(16.0, system.spacing().baseUnit());
        assertEquals(List.of(16.0, 64.0), system.spacing().scale());
        assertEquals(List.of(8.0, 12.0), system.borderRadius());
    }

    @Test
    @DisplayName("Groups without resolvable members fall back to defaults")
    void defaultsWithoutMembers() {
        DesignSystem system = DesignSystemDeriver.derive(
                List.of(group("g", "Big", SemanticType.CONTAINER, new Bounds(0, 0, 375, 640), List.of("ghost"), 0.8)),
                Map.of());

        assertEquals(VisionDefaults.PRIMARY, system.colors().primary());
        assertNull(system.colors().accent());
        assertEquals(VisionDefaults.FONT_SIZES, system.typography().sizes());
        assertEquals(VisionDefaults.BASE_UNIT, system.spacing().baseUnit());
        assertEquals(DesignSystemDeriver.DEFAULT_RADII, system.borderRadius());
    }

    @Test
    @DisplayName("Every semantic type has a target component")
    void targetTable() {
        assertEquals(new TargetMapping("Button", Map.of("variant", "contained")),
                TargetComponentTable.forType(SemanticType.BUTTON));
        assertEquals("AppBar", TargetComponentTable.forType(SemanticType.NAVIGATION).componentName());
        assertEquals("Avatar", TargetComponentTable.forType(SemanticType.IMAGE).componentName());
        assertEquals("Box", TargetComponentTable.forType(SemanticType.OTHER).componentName());
        for (SemanticType type : SemanticType.values()) {
            assertNotNull(TargetComponentTable.forType(type));
        }
    }
}
