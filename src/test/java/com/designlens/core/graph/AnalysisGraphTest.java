package com.designlens.core.graph;

import com.designlens.core.extraction.StructuralExtractor;
import com.designlens.core.grouping.GroupingResponse;
import com.designlens.core.grouping.SemanticGroupingService;
import com.designlens.core.llm.CallSettings;
import com.designlens.core.llm.LlmProperties;
import com.designlens.core.llm.LlmService;
import com.designlens.core.llm.ModelCallResult;
import com.designlens.core.mapping.StyleMapperService;
import com.designlens.core.nodes.CompareStagesNode;
import com.designlens.core.nodes.ExtractStructureNode;
import com.designlens.core.nodes.GroupComponentsNode;
import com.designlens.core.nodes.MapStylesNode;
import com.designlens.core.nodes.ValidateVisualsNode;
import com.designlens.core.state.AnalysisState;
import com.designlens.core.validation.VisualValidationService;
import org.bsc.langgraph4j.RunnableConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.designlens.core.TestDescriptors.paymentScreen;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Runs the compiled graph end to end with real stage services and a mocked {@link LlmService}.
 */
class AnalysisGraphTest {

    static AnalysisGraph graph(LlmService llm) throws Exception {
        var props = new LlmProperties();
        return new AnalysisGraph(
                new ExtractStructureNode(new StructuralExtractor()),
                new GroupComponentsNode(new SemanticGroupingService(llm, props)),
                new ValidateVisualsNode(new VisualValidationService(llm, props)),
                new MapStylesNode(new StyleMapperService()),
                new CompareStagesNode());
    }

    @Test
    @DisplayName("Every stage writes its channel in a single pass")
    void runsAllStages() throws Exception {
        LlmService llm = mock(LlmService.class);
        when(llm.structuredCall(anyString(), anyString(), eq(GroupingResponse.class), any(CallSettings.class)))
                .thenReturn(new ModelCallResult.Ok<>(new GroupingResponse(null, List.of(
                        new GroupingResponse.Group("g1", "Header Section", "container", null, null,
                                List.of("1:2", "1:3"), Map.of("section", "header"), 0.9),
                        new GroupingResponse.Group("g2", "Primary Action Button", "button", null, null,
                                List.of(), null, 0.8)), 0.85)));

        AnalysisState state = graph(llm).getCompiledGraph()
                .invoke(Map.of("runId", "DLNS-2026-0001", "designName", "Checkout", "document", paymentScreen()),
                        RunnableConfig.builder().threadId("DLNS-2026-0001").build())
                .orElseThrow();

        assertEquals(11, state.descriptors().size());
        var grouping = state.grouping().orElseThrow();
        assertFalse(grouping.fallback());
        assertEquals(List.of("1:10", "1:11"), grouping.groups().get(1).children());
        var analysis = state.analysis().orElseThrow();
        assertTrue(analysis.fallback());
        assertEquals(2, analysis.components().size());
        assertEquals(2, state.mapping().orElseThrow().components().size());
        assertTrue(state.comparison().isPresent());
        verify(llm, never()).visionCall(anyString(), anyString(), any(), any(), any());
    }
}
