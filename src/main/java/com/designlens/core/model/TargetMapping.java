package com.designlens.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Target UI-library component name and props for one validated component.
 */
public record TargetMapping(String componentName, Map<String, Object> props) implements Serializable {

    public TargetMapping {
        props = ModelMaps.copyOf(props);
    }
}
