package com.designlens.core.validation;

import com.designlens.core.llm.CallSettings;
import com.designlens.core.llm.ImageInput;
import com.designlens.core.llm.LlmProperties;
import com.designlens.core.llm.LlmService;
import com.designlens.core.llm.ModelCallResult;
import com.designlens.core.model.AnalysisResult;
import com.designlens.core.model.Bounds;
import com.designlens.core.model.ComponentDescriptor;
import com.designlens.core.model.GroupingResult;
import com.designlens.core.model.NodeKind;
import com.designlens.core.model.SemanticGroup;
import com.designlens.core.model.SemanticType;
import com.designlens.core.model.ValidatedComponent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.designlens.core.TestDescriptors.group;
import static com.designlens.core.TestDescriptors.node;
import static com.designlens.core.TestDescriptors.text;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class VisualValidationServiceTest {

    private static final ImageInput SCREENSHOT = ImageInput.ofUrl("https://example.com/checkout.png");

    private static final List<ComponentDescriptor> DESCRIPTORS = List.of(
            node("h1", "Header", NodeKind.FRAME, 0, 0, 375, 100),
            text("t1", "Total: $96", 16, 420, 150, 24),
            node("b1", "Pay Button", NodeKind.RECTANGLE, 16, 540, 343, 64));

    private static final List<SemanticGroup> GROUPS = List.of(
            new SemanticGroup("g1", "Pay Button", SemanticType.BUTTON, "Primary action",
                    new Bounds(16, 540, 343, 64), List.of("b1"), Map.of("section", "footer"), 0.9),
            group("g2", "Total", SemanticType.TEXT, new Bounds(16, 420, 150, 24), List.of("t1"), 0.8),
            group("g3", "Header", SemanticType.CONTAINER, new Bounds(0, 0, 375, 100), List.of("h1"), 0.8));

    private LlmService llmService;
    private VisualValidationService service;

    @BeforeEach
    void setUp() {
        llmService = mock(LlmService.class);
        service = new VisualValidationService(llmService, new LlmProperties());
    }

    private static GroupingResult grouping(double confidence) {
        return new GroupingResult(null, GROUPS, 3, 3, List.of(), confidence, 10, false);
    }

    private void modelAnswers(ModelCallResult<VisionResponse> result) {
        when(llmService.visionCall(anyString(), anyString(), any(ImageInput.class), eq(VisionResponse.class),
                any(CallSettings.class))).thenReturn(result);
    }

    private static VisionResponse.Box box(double x, double y, double w, double h) {
        return new VisionResponse.Box(x, y, w, h);
    }

    @Test
    @DisplayName("Without a screenshot the analysis is derived from groups and the model is never called")
    void noImageUsesFallback() {
        AnalysisResult result = service.validate("Checkout", grouping(0.5), DESCRIPTORS, null);

        verifyNoInteractions(llmService);
        assertTrue(result.fallback());
        assertEquals(0.6, result.confidence());
        assertEquals(3, result.components().size());
        assertTrue(result.suggestions().contains("Visual validation unavailable: no screenshot supplied"));
        assertEquals(VisionDefaults.LAYOUT, result.layout());

        ValidatedComponent pay = result.components().get(0);
        assertEquals("g1", pay.id());
        assertEquals("g1", pay.sourceGroupId());
        assertEquals("b1", pay.sourceNodeId());
        assertEquals("Button", pay.targetMapping().componentName());
        assertEquals(false, pay.properties().get("interactive"));
        assertEquals("footer", pay.properties().get("section"));
    }

    @Test
    @DisplayName("A failed call keeps the grouping confidence when it is above the floor")
    void failedCallFallsBack() {
        modelAnswers(new ModelCallResult.Timeout<>(Duration.ofSeconds(60)));

        AnalysisResult result = service.validate("Checkout", grouping(0.8), DESCRIPTORS, SCREENSHOT);

        assertTrue(result.fallback());
        assertEquals(0.8, result.confidence());
        assertTrue(result.suggestions().get(1).startsWith("Visual validation unavailable: model call timed out"));
    }

    @Test
    @DisplayName("Reported components are reconciled with their groups")
    void reconcilesReportedComponents() {
        modelAnswers(new ModelCallResult.Ok<>(new VisionResponse(List.of(
                new VisionResponse.Component("g1", "button", null, null, box(20, 545, 340, 60), Map.of("state", "enabled"),
                        new VisionResponse.Mapping("Button", Map.of("variant", "contained", "color", "primary"))),
                new VisionResponse.Component("x", "unknown", "Order total", null, box(20, 425, 150, 24), null, null),
                new VisionResponse.Component(null, "input", null, null, box(100, 1000, 100, 40), null, null)),
                null, null, 0.0, null)));

        AnalysisResult result = service.validate("Checkout", grouping(0.8), DESCRIPTORS, SCREENSHOT);

        assertFalse(result.fallback());
        assertEquals(0.7, result.confidence());
        assertEquals(3, result.components().size());

        ValidatedComponent pay = result.components().get(0);
        assertEquals("Pay Button", pay.name());
        assertEquals(new Bounds(20, 545, 340, 60), pay.bounds());
        assertEquals("primary", pay.targetMapping().props().get("color"));
        assertEquals(0.9, pay.properties().get("groupConfidence"));
        assertEquals("enabled", pay.properties().get("state"));

        ValidatedComponent total = result.components().get(1);
        assertEquals(SemanticType.TEXT, total.type());
        assertEquals("g2", total.sourceGroupId());
        assertEquals("t1", total.sourceNodeId());
        assertEquals("Typography", total.targetMapping().componentName());

        ValidatedComponent unmatched = result.components().get(2);
        assertEquals("component-3", unmatched.id());
        assertNull(unmatched.sourceGroupId());
        assertNull(unmatched.sourceNodeId());
        assertEquals("TextField", unmatched.targetMapping().componentName());

        assertEquals(List.of(
                VisionDefaults.COMPLETED_SUGGESTION,
                "2 components had no target mapping; type defaults were applied",
                "1 semantic groups were not confirmed visually"), result.suggestions());
        assertEquals(VisionDefaults.LAYOUT, result.layout());
        assertEquals(VisionDefaults.DESIGN_SYSTEM, result.designSystem());
    }

    @Test
    @DisplayName("Low confidence and no interactive components add insights")
    void qualityInsights() {
        modelAnswers(new ModelCallResult.Ok<>(new VisionResponse(List.of(
                new VisionResponse.Component("g2", "text", null, null, null, null,
                        new VisionResponse.Mapping("Typography", Map.of()))),
                null, null, 0.4, List.of("Use a larger total"))));

        AnalysisResult result = service.validate("Checkout", grouping(0.8), DESCRIPTORS, SCREENSHOT);

        assertEquals(0.4, result.confidence());
        assertEquals("Use a larger total", result.suggestions().get(0));
        assertTrue(result.suggestions().contains(
                "Low analysis confidence; review component typing before generating code"));
        assertTrue(result.suggestions().contains("No interactive components identified; check buttons and inputs"));
        assertEquals(new Bounds(16, 420, 150, 24), result.components().get(0).bounds());
    }

    @Test
    @DisplayName("Partial design-system answers are completed with defaults")
    void designSystemDefaults() {
        AnalysisResult.DesignSystem system = VisualValidationService.designSystem(new VisionResponse.DesignSystem(
                new VisionResponse.Palette("#ff8000", " ", null, null, ""),
                new VisionResponse.Typography(null, List.of(), List.of(400, 700)),
                new VisionResponse.Scale(-1.0, null),
                null));

        assertEquals("#ff8000", system.colors().primary());
        assertEquals(VisionDefaults.SECONDARY, system.colors().secondary());
        assertNull(system.colors().accent());
        assertEquals(VisionDefaults.FONT_FAMILY, system.typography().fontFamily());
        assertEquals(VisionDefaults.FONT_SIZES, system.typography().sizes());
        assertEquals(List.of(400, 700), system.typography().weights());
        assertEquals(VisionDefaults.BASE_UNIT, system.spacing().baseUnit());
        assertEquals(VisionDefaults.BORDER_RADIUS, system.borderRadius());
    }

    @Test
    @DisplayName("Layout keeps reported values and skips null breakpoints")
    void layoutDefaults() {
        var breakpoints = new java.util.ArrayList<String>();
        breakpoints.add(null);
        breakpoints.add("md");

        AnalysisResult.Layout layout = VisualValidationService.layout(
                new VisionResponse.Layout("flex", true, breakpoints, null));

        assertEquals("flex", layout.structure());
        assertTrue(layout.responsive());
        assertEquals(List.of("md"), layout.breakpoints());
        assertEquals(VisionDefaults.SPACING_UNITS, layout.spacing().units());
        assertFalse(layout.spacing().consistent());
    }

    @Test
    @DisplayName("Confidence clamps into [0.1, 1.0]")
    void clampsConfidence() {
        assertEquals(0.7, VisualValidationService.clamp(null));
        assertEquals(0.1, VisualValidationService.clamp(0.05));
        assertEquals(1.0, VisualValidationService.clamp(2.0));
    }
}
