package com.designlens.core.spatial;

import com.designlens.core.model.ComponentDescriptor;

import java.util.List;

/**
 * Run of descriptors stacked vertically without a gap wider than the section threshold.
 */
public record VerticalSection(double startY, double endY, List<ComponentDescriptor> members) {

    public VerticalSection {
        members = List.copyOf(members);
    }

    /** Text content or, failing that, the name of each member. */
    public List<String> keyElements() {
        return members.stream()
                .map(d -> d.hasText() ? d.characters() : d.name())
                .filter(s -> s != null && !s.isEmpty())
                .toList();
    }
}
