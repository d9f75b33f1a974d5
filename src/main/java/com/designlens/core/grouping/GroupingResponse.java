package com.designlens.core.grouping;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * JSON shape the reasoning model is asked to return. Every field is optional;
 * missing values are backfilled when the response is resolved against the descriptors.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GroupingResponse(Layout layoutStructure, List<Group> groups, Double confidence) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Layout(String screenType, List<String> mainSections, String userFlow) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Group(
            String id,
            String name,
            String type,
            String description,
            Box bounds,
            List<String> children,
            Map<String, Object> properties,
            Double confidence
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Box(Double x, Double y, Double width, Double height) {

        public boolean isComplete() {
            return x != null && y != null && width != null && height != null;
        }
    }
}
