package com.designlens.core.mapping;

import com.designlens.core.model.ComponentDescriptor;
import com.designlens.core.model.NodeKind;
import com.designlens.core.model.SemanticType;
import com.designlens.core.model.ValidatedComponent;

import java.util.Locale;

/**
 * A validated component paired with the descriptor it renders from (by provenance id),
 * which may be absent for components the vision model added on its own.
 */
record MappingSubject(ValidatedComponent component, ComponentDescriptor descriptor) {

    String lowerName() {
        return component.name() == null ? "" : component.name().toLowerCase(Locale.ROOT);
    }

    boolean nameContains(String keyword) {
        return lowerName().contains(keyword);
    }

    /** Node kind of the source descriptor; without one, text components count as TEXT. */
    NodeKind kind() {
        if (descriptor != null) {
            return descriptor.type();
        }
        return component.type() == SemanticType.TEXT ? NodeKind.TEXT : NodeKind.OTHER;
    }

    double height() {
        return component.bounds() == null ? 0 : component.bounds().height();
    }
}
