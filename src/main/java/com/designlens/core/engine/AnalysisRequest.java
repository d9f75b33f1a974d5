package com.designlens.core.engine;

import com.designlens.core.design.DesignNode;
import com.designlens.core.llm.ImageInput;
import com.designlens.core.model.ModelMaps;

import java.util.Map;

/**
 * Input for one analysis run.
 *
 * @param designName       name used in prompts and logs; may be blank
 * @param document         root of the design tree
 * @param image            rendered screenshot, or {@code null} to skip visual validation
 * @param assetUrls        node id to exported image URL; null keys and values are dropped
 * @param contentOverrides component id to display text; null keys and values are dropped
 */
public record AnalysisRequest(
        String designName,
        DesignNode document,
        ImageInput image,
        Map<String, String> assetUrls,
        Map<String, String> contentOverrides
) {

    public AnalysisRequest {
        designName = designName == null ? "" : designName;
        assetUrls = ModelMaps.copyOf(assetUrls);
        contentOverrides = ModelMaps.copyOf(contentOverrides);
    }

    public static AnalysisRequest of(DesignNode document) {
        return new AnalysisRequest(document != null ? document.name() : "", document, null, null, null);
    }
}
