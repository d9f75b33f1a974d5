package com.designlens.core.nodes;

import com.designlens.core.logging.MdcContext;
import com.designlens.core.mapping.StyleMapperService;
import com.designlens.core.model.AnalysisResult;
import com.designlens.core.model.StyleMapping;
import com.designlens.core.state.AnalysisState;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class MapStylesNode {

    private final StyleMapperService mapperService;

    public MapStylesNode(StyleMapperService mapperService) {
        this.mapperService = mapperService;
    }

    public Map<String, Object> apply(AnalysisState state) {
        MdcContext.setStage(state.runId(), "map_styles");
        AnalysisResult analysis = state.analysis().orElseThrow(
                () -> new IllegalStateException("map_styles reached without an analysis result"));
        long start = System.currentTimeMillis();
        StyleMapping mapping = mapperService.map(analysis.components(), state.descriptors(),
                state.tokens(), state.assetUrls(), state.contentOverrides());
        return Map.of(
                "mapping", mapping,
                "mappingMs", System.currentTimeMillis() - start
        );
    }
}
