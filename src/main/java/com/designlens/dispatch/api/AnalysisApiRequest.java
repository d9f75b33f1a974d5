package com.designlens.dispatch.api;

import com.designlens.core.design.DesignNode;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/analyses.
 *
 * @param designName       display name; nullable, defaults to the root node's name
 * @param document         root of the design tree
 * @param imageUrl         public URL of the rendered screenshot; nullable, skips visual validation
 * @param assetUrls        node id to exported image URL; nullable
 * @param contentOverrides component id to display text; nullable
 */
public record AnalysisApiRequest(
        String designName,
        DesignNode document,
        String imageUrl,
        Map<String, String> assetUrls,
        Map<String, String> contentOverrides
) {}
