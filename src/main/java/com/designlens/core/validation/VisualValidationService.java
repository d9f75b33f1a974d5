package com.designlens.core.validation;

import com.designlens.core.llm.ImageInput;
import com.designlens.core.llm.LlmProperties;
import com.designlens.core.llm.LlmService;
import com.designlens.core.llm.ModelCallResult;
import com.designlens.core.model.AnalysisResult;
import com.designlens.core.model.AnalysisResult.DesignSystem;
import com.designlens.core.model.AnalysisResult.Layout;
import com.designlens.core.model.AnalysisResult.Palette;
import com.designlens.core.model.AnalysisResult.Scale;
import com.designlens.core.model.AnalysisResult.Spacing;
import com.designlens.core.model.AnalysisResult.Typography;
import com.designlens.core.model.ComponentDescriptor;
import com.designlens.core.model.GroupingResult;
import com.designlens.core.model.SemanticGroup;
import com.designlens.core.model.ValidatedComponent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Confirms semantic groups against a rendered screenshot with one vision-model call.
 * <p>
 * Without an image, or when the call does not return usable JSON, the result is derived
 * from the groups alone.
 */
@Service
public class VisualValidationService {

    private static final Logger log = LoggerFactory.getLogger(VisualValidationService.class);

    static final double LOW_CONFIDENCE = 0.7;

    private static final String SYSTEM_PROMPT = """
            You are a UI/UX expert converting design screens into React components built with Material-UI.
            You receive a screenshot together with semantic groups extracted from the design's structure.

            Your task is to:
            1. validate each group against what the screenshot shows
            2. map every component to the most appropriate Material-UI component
            3. describe the layout structure and the design system
            4. give a confidence score and improvement suggestions

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final LlmProperties llmProperties;

    public VisualValidationService(LlmService llmService, LlmProperties llmProperties) {
        this.llmService = llmService;
        this.llmProperties = llmProperties;
    }

    public AnalysisResult validate(String designName, GroupingResult grouping,
                                   List<ComponentDescriptor> descriptors, ImageInput image) {
        if (image == null || (!image.hasUrl() && !image.hasBytes())) {
            log.warn("No screenshot supplied, deriving analysis from semantic groups");
            return fallback(grouping, descriptors, "no screenshot supplied");
        }
        log.info("Validating {} groups against {}", grouping.groups().size(), image.describe());
        ModelCallResult<VisionResponse> outcome = llmService.visionCall(SYSTEM_PROMPT,
                VisionPromptBuilder.build(designName, grouping), image, VisionResponse.class,
                llmProperties.visionSettings());

        if (outcome instanceof ModelCallResult.Ok<VisionResponse> ok) {
            return fromResponse(ok.value(), grouping);
        } else if (outcome instanceof ModelCallResult.ParseError<VisionResponse>
                || outcome instanceof ModelCallResult.TransportError<VisionResponse>
                || outcome instanceof ModelCallResult.Timeout<VisionResponse>) {
            log.warn("Visual validation failed ({}), deriving analysis from semantic groups", outcome.describe());
            return fallback(grouping, descriptors, outcome.describe());
        }
        throw new IllegalStateException("Unhandled model call result " + outcome);
    }

    static AnalysisResult fromResponse(VisionResponse response, GroupingResult grouping) {
        ComponentReconciler.Outcome reconciled = ComponentReconciler.reconcile(
                response.components() == null ? List.of() : response.components(), grouping.groups());

        double confidence = clamp(response.confidence());
        List<String> suggestions = new ArrayList<>();
        if (response.suggestions() == null || response.suggestions().isEmpty()) {
            suggestions.add(VisionDefaults.COMPLETED_SUGGESTION);
        } else {
            response.suggestions().stream().filter(s -> s != null && !s.isBlank()).forEach(suggestions::add);
        }
        suggestions.addAll(qualityInsights(reconciled, confidence));

        log.info("Visual validation confirmed {} components (confidence {})",
                reconciled.components().size(), confidence);
        return new AnalysisResult(reconciled.components(), layout(response.layout()),
                designSystem(response.designSystem()), confidence, suggestions, false);
    }

    static AnalysisResult fallback(GroupingResult grouping, List<ComponentDescriptor> descriptors, String reason) {
        var components = new ArrayList<ValidatedComponent>();
        for (SemanticGroup group : grouping.groups()) {
            Map<String, Object> properties = new LinkedHashMap<>();
            properties.put("interactive", false);
            properties.putAll(group.properties());
            components.add(new ValidatedComponent(group.id(), group.type(), group.name(), group.description(),
                    group.bounds(), properties, TargetComponentTable.forType(group.type()), group.id(),
                    group.firstChildId()));
        }
        Map<String, ComponentDescriptor> byId = new LinkedHashMap<>();
        descriptors.forEach(d -> byId.putIfAbsent(d.id(), d));
        double confidence = Math.min(1.0, Math.max(VisionDefaults.FALLBACK_MIN_CONFIDENCE, grouping.confidence()));
        return new AnalysisResult(components, VisionDefaults.LAYOUT,
                DesignSystemDeriver.derive(grouping.groups(), byId), confidence,
                List.of(VisionDefaults.FALLBACK_SUGGESTION, "Visual validation unavailable: " + reason), true);
    }

    static List<String> qualityInsights(ComponentReconciler.Outcome reconciled, double confidence) {
        var insights = new ArrayList<String>();
        if (reconciled.missingMappings() > 0) {
            insights.add(reconciled.missingMappings() + " components had no target mapping; type defaults were applied");
        }
        if (confidence < LOW_CONFIDENCE) {
            insights.add("Low analysis confidence; review component typing before generating code");
        }
        if (reconciled.components().stream().noneMatch(c -> c.type().isInteractive())) {
            insights.add("No interactive components identified; check buttons and inputs");
        }
        if (reconciled.unconfirmedGroups() > 0) {
            insights.add(reconciled.unconfirmedGroups() + " semantic groups were not confirmed visually");
        }
        return insights;
    }

    static double clamp(Double confidence) {
        double value = confidence == null || confidence.isNaN() || confidence == 0
                ? VisionDefaults.CONFIDENCE : confidence;
        return Math.max(0.1, Math.min(1.0, value));
    }

    static Layout layout(VisionResponse.Layout raw) {
        if (raw == null) {
            return VisionDefaults.LAYOUT;
        }
        VisionResponse.Spacing spacing = raw.spacing();
        return new Layout(
                isBlank(raw.structure()) ? VisionDefaults.STRUCTURE : raw.structure(),
                raw.responsive() != null && raw.responsive(),
                listOr(raw.breakpoints(), VisionDefaults.BREAKPOINTS),
                new Spacing(spacing != null && spacing.consistent() != null && spacing.consistent(),
                        listOr(spacing == null ? null : spacing.units(), VisionDefaults.SPACING_UNITS)));
    }

    static DesignSystem designSystem(VisionResponse.DesignSystem raw) {
        if (raw == null) {
            return VisionDefaults.DESIGN_SYSTEM;
        }
        VisionResponse.Palette colors = raw.colors();
        Palette palette = colors == null
                ? VisionDefaults.DESIGN_SYSTEM.colors()
                : new Palette(
                        orDefault(colors.primary(), VisionDefaults.PRIMARY),
                        orDefault(colors.secondary(), VisionDefaults.SECONDARY),
                        orDefault(colors.background(), VisionDefaults.BACKGROUND),
                        orDefault(colors.text(), VisionDefaults.TEXT),
                        isBlank(colors.accent()) ? null : colors.accent());
        VisionResponse.Typography type = raw.typography();
        Typography typography = type == null
                ? VisionDefaults.DESIGN_SYSTEM.typography()
                : new Typography(
                        orDefault(type.fontFamily(), VisionDefaults.FONT_FAMILY),
                        listOr(type.sizes(), VisionDefaults.FONT_SIZES),
                        listOr(type.weights(), VisionDefaults.FONT_WEIGHTS));
        VisionResponse.Scale scale = raw.spacing();
        Scale spacing = scale == null
                ? VisionDefaults.DESIGN_SYSTEM.spacing()
                : new Scale(
                        scale.baseUnit() == null || scale.baseUnit() <= 0 ? VisionDefaults.BASE_UNIT : scale.baseUnit(),
                        listOr(scale.scale(), VisionDefaults.SPACING_SCALE));
        List<Double> radius = listOr(raw.borderRadius(), VisionDefaults.BORDER_RADIUS);
        return new DesignSystem(palette, typography, spacing, radius);
    }

    /** Non-null elements of {@code values}, or {@code fallback} when none remain. */
    private static <T> List<T> listOr(List<T> values, List<T> fallback) {
        if (values == null) {
            return fallback;
        }
        List<T> present = values.stream().filter(v -> v != null).toList();
        return present.isEmpty() ? fallback : present;
    }

    private static String orDefault(String value, String fallback) {
        return isBlank(value) ? fallback : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
