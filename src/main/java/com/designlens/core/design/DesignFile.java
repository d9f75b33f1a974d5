package com.designlens.core.design;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;

/**
 * A design-tool file payload: the file name plus its document tree.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DesignFile(String name, String lastModified, String thumbnailUrl, DesignNode document)
        implements Serializable {

    public static DesignFile of(String name, DesignNode document) {
        return new DesignFile(name, null, null, document);
    }

    public String displayName() {
        return name == null || name.isBlank() ? "Untitled" : name;
    }
}
