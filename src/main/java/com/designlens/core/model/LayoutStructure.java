package com.designlens.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Coarse screen-level classification guiding section-aware validation prompts.
 */
public record LayoutStructure(String screenType, List<String> mainSections, String userFlow) implements Serializable {

    public LayoutStructure {
        mainSections = mainSections == null ? List.of() : List.copyOf(mainSections);
    }
}
