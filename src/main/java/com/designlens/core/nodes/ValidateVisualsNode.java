package com.designlens.core.nodes;

import com.designlens.core.logging.MdcContext;
import com.designlens.core.model.AnalysisResult;
import com.designlens.core.model.GroupingResult;
import com.designlens.core.state.AnalysisState;
import com.designlens.core.validation.VisualValidationService;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Confirms the semantic groups against the rendered screenshot and produces the
 * terminal {@link AnalysisResult}.
 */
@Component
public class ValidateVisualsNode {

    private final VisualValidationService validationService;

    public ValidateVisualsNode(VisualValidationService validationService) {
        this.validationService = validationService;
    }

    public Map<String, Object> apply(AnalysisState state) {
        MdcContext.setStage(state.runId(), "validate_visuals");
        GroupingResult grouping = state.grouping().orElseThrow(
                () -> new IllegalStateException("validate_visuals reached without a grouping result"));
        long start = System.currentTimeMillis();
        AnalysisResult analysis = validationService.validate(state.designName(), grouping,
                state.descriptors(), state.image().orElse(null));
        return Map.of(
                "analysis", analysis,
                "validationMs", System.currentTimeMillis() - start
        );
    }
}
