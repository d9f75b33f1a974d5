package com.designlens.core.spatial;

import com.designlens.core.model.ComponentDescriptor;

import java.util.List;

/**
 * Descriptors split into the top, middle and bottom thirds of the overall bounding box.
 */
public record BandSections(
        List<ComponentDescriptor> top,
        List<ComponentDescriptor> middle,
        List<ComponentDescriptor> bottom
) {

    public BandSections {
        top = List.copyOf(top);
        middle = List.copyOf(middle);
        bottom = List.copyOf(bottom);
    }
}
