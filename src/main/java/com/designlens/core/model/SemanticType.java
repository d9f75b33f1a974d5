package com.designlens.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Semantic category of a grouped UI component.
 */
public enum SemanticType {
    BUTTON,
    TEXT,
    CARD,
    NAVIGATION,
    INPUT,
    LIST,
    IMAGE,
    CONTAINER,
    OTHER;

    /** Lenient parse: unknown or missing values map to {@link #OTHER}. */
    @JsonCreator
    public static SemanticType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        try {
            return SemanticType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isInteractive() {
        return this == BUTTON || this == INPUT || this == NAVIGATION;
    }

    public boolean isStructural() {
        return this == CARD || this == CONTAINER || this == LIST;
    }
}
