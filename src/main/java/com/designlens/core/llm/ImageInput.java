package com.designlens.core.llm;

import java.io.Serializable;

/**
 * Rendered screenshot handed to the vision model: either a URL or raw bytes with a MIME type.
 */
public record ImageInput(String url, byte[] bytes, String mimeType) implements Serializable {

    public static final String DEFAULT_MIME_TYPE = "image/png";

    public static ImageInput ofUrl(String url) {
        return new ImageInput(url, null, DEFAULT_MIME_TYPE);
    }

    public static ImageInput ofBytes(byte[] bytes, String mimeType) {
        return new ImageInput(null, bytes, mimeType == null ? DEFAULT_MIME_TYPE : mimeType);
    }

    public boolean hasBytes() {
        return bytes != null && bytes.length > 0;
    }

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }

    /** URL, or a size summary for byte input. Never the bytes themselves. */
    public String describe() {
        return hasUrl() ? url : (hasBytes() ? bytes.length + " bytes of " + mimeType : "no image");
    }
}
