package com.designlens.core.nodes;

import com.designlens.core.extraction.ExtractionResult;
import com.designlens.core.extraction.NoExtractableStructureException;
import com.designlens.core.extraction.StructuralExtractor;
import com.designlens.core.logging.MdcContext;
import com.designlens.core.state.AnalysisState;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Flattens the design document into component descriptors and design tokens.
 * <p>
 * Throws {@link NoExtractableStructureException} when the document yields no descriptors;
 * the run aborts since no later stage has anything to work on.
 */
@Component
public class ExtractStructureNode {

    private final StructuralExtractor extractor;

    public ExtractStructureNode(StructuralExtractor extractor) {
        this.extractor = extractor;
    }

    public Map<String, Object> apply(AnalysisState state) {
        MdcContext.setStage(state.runId(), "extract_structure");
        long start = System.currentTimeMillis();
        ExtractionResult result = extractor.extract(state.document().orElseThrow(
                () -> new NoExtractableStructureException("no document supplied")));
        return Map.of(
                "descriptors", result.descriptors(),
                "tokens", result.tokens(),
                "extractMs", System.currentTimeMillis() - start
        );
    }
}
