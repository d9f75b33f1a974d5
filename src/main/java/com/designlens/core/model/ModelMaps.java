package com.designlens.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable, order-preserving map copies for model records.
 * Null keys and null values are dropped; model-produced JSON routinely carries both.
 */
public final class ModelMaps {

    private ModelMaps() {}

    public static <V> Map<String, V> copyOf(Map<String, ? extends V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        var copy = new LinkedHashMap<String, V>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
