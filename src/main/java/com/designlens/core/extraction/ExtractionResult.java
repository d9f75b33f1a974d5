package com.designlens.core.extraction;

import com.designlens.core.model.ComponentDescriptor;
import com.designlens.core.model.DesignTokenSet;

import java.io.Serializable;
import java.util.List;

/**
 * Descriptors in depth-first traversal order plus the tokens mined from the same tree.
 */
public record ExtractionResult(List<ComponentDescriptor> descriptors, DesignTokenSet tokens) implements Serializable {

    public ExtractionResult {
        descriptors = List.copyOf(descriptors);
    }
}
