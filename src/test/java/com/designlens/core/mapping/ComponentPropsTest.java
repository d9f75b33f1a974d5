package com.designlens.core.mapping;

import com.designlens.core.model.Bounds;
import com.designlens.core.model.NodeKind;
import com.designlens.core.model.SemanticType;
import com.designlens.core.model.TargetMapping;
import com.designlens.core.model.ValidatedComponent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.designlens.core.TestDescriptors.node;
import static com.designlens.core.TestDescriptors.text;
import static org.junit.jupiter.api.Assertions.*;

class ComponentPropsTest {

    private static MappingSubject subject(String name, SemanticType type, TargetMapping mapping,
                                          Map<String, Object> properties) {
        return new MappingSubject(new ValidatedComponent("c", type, name, "", new Bounds(0, 0, 100, 40),
                properties, mapping, null, null), null);
    }

    @Test
    @DisplayName("Model props are kept when the model picked the same target")
    void keepsModelProps() {
        MappingSubject s = subject("Secondary Button", SemanticType.BUTTON,
                new TargetMapping("Button", Map.of("disableRipple", true, "variant", "text")), Map.of());

        Map<String, Object> props = ComponentProps.build(s, "Button");

        assertEquals(true, props.get("disableRipple"));
        assertEquals("outlined", props.get("variant"));
        assertEquals("medium", props.get("size"));
    }

    @Test
    @DisplayName("Model props are dropped when the target differs")
    void dropsForeignProps() {
        MappingSubject s = subject("Title", SemanticType.TEXT,
                new TargetMapping("Chip", Map.of("clickable", true)), Map.of());

        Map<String, Object> props = ComponentProps.build(s, "Typography");

        assertFalse(props.containsKey("clickable"));
        assertEquals("body1", props.get("variant"));
    }

    @Test
    @DisplayName("Typography variants follow the name")
    void typographyVariants() {
        assertEquals("h5", ComponentProps.build(subject("Payment", SemanticType.TEXT, null, Map.of()), "Typography")
                .get("variant"));
        assertEquals("body1", ComponentProps.build(subject("Payment Methods", SemanticType.TEXT, null, Map.of()),
                "Typography").get("variant"));
        assertEquals("h4", ComponentProps.build(subject("Amount", SemanticType.TEXT, null, Map.of()), "Typography")
                .get("variant"));
    }

    @Test
    @DisplayName("Selection is read from properties or the name")
    void selection() {
        assertTrue(ComponentProps.isSelected(subject("Cash", SemanticType.CARD, null, Map.of("selected", true))));
        assertTrue(ComponentProps.isSelected(subject("Cash", SemanticType.CARD, null, Map.of("state", "selected"))));
        assertTrue(ComponentProps.isSelected(subject("Active Tab", SemanticType.NAVIGATION, null, Map.of())));
        assertFalse(ComponentProps.isSelected(subject("Cash", SemanticType.CARD, null, Map.of("state", "idle"))));
    }

    @Test
    @DisplayName("Content falls back to name-based placeholders")
    void contentInference() {
        assertEquals("PAY & CONFIRM", ContentResolver.resolve(
                subject("Pay and Confirm", SemanticType.BUTTON, null, Map.of()), Map.of()));
        assertEquals("Select Payment Method", ContentResolver.resolve(
                subject("Select Payment Method Header", SemanticType.OTHER, null, Map.of()), Map.of()));
        assertNull(ContentResolver.resolve(subject("Divider", SemanticType.OTHER, null, Map.of()), Map.of()));
    }

    @Test
    @DisplayName("Text descriptors supply their characters; other kinds do not")
    void contentFromDescriptor() {
        ValidatedComponent component = new ValidatedComponent("c", SemanticType.TEXT, "Label", "",
                new Bounds(0, 0, 10, 10), Map.of(), null, "g", "t");

        assertEquals("Hello", ContentResolver.resolve(
                new MappingSubject(component, text("t", "Hello", 0, 0, 10, 10)), Map.of()));
        assertNull(ContentResolver.resolve(
                new MappingSubject(component, node("t", "Label", NodeKind.RECTANGLE, 0, 0, 10, 10)), Map.of()));
    }

    @Test
    @DisplayName("Target rules are applied top-down")
    void targetRules() {
        assertEquals("Button", TargetComponentRule.select(subject("Visa Button", SemanticType.CARD, null, Map.of())));
        assertEquals("Card", TargetComponentRule.select(subject("Cash", SemanticType.OTHER, null, Map.of())));
        assertEquals("Typography", TargetComponentRule.select(subject("Header", SemanticType.TEXT, null, Map.of())));
        assertEquals("Box", TargetComponentRule.select(subject("Divider", SemanticType.OTHER, null, Map.of())));
        assertEquals("Box", TargetComponentRule.select(new MappingSubject(
                new ValidatedComponent("c", SemanticType.CONTAINER, "Section", "", Bounds.DEFAULT, Map.of(), null,
                        null, "f"), node("f", "Section", NodeKind.FRAME, 0, 0, 10, 10))));
    }
}
