package com.designlens.core.spatial;

import com.designlens.core.model.ComponentDescriptor;

import java.util.List;

/**
 * Text descriptors bucketed by role. A descriptor may appear in more than one bucket.
 */
public record TextClassification(
        List<ComponentDescriptor> interactive,
        List<ComponentDescriptor> headers,
        List<ComponentDescriptor> values
) {

    public TextClassification {
        interactive = List.copyOf(interactive);
        headers = List.copyOf(headers);
        values = List.copyOf(values);
    }
}
