package com.designlens.core.spatial;

import com.designlens.core.model.ComponentDescriptor;

import java.util.List;

/**
 * Two or more descriptors sharing a rounded coordinate on one axis.
 */
public record Alignment(Axis axis, double coordinate, List<ComponentDescriptor> members) {

    public Alignment {
        members = List.copyOf(members);
    }
}
