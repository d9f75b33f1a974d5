package com.designlens.figma;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves a file key from a share URL or a bare key.
 */
public final class FigmaFileKeys {

    private static final Pattern URL_KEY = Pattern.compile("/(?:file|design)/([A-Za-z0-9_-]+)");

    private FigmaFileKeys() {}

    /**
     * Accepts a bare key (no '/' and longer than 10 characters) or a URL containing
     * {@code /file/<key>} or {@code /design/<key>}.
     *
     * @throws IllegalArgumentException when neither form matches
     */
    public static String extract(String urlOrId) {
        if (urlOrId == null || urlOrId.isBlank()) {
            throw new IllegalArgumentException("Invalid design file URL or id: empty");
        }
        String value = urlOrId.trim();
        if (!value.contains("/") && value.length() > 10) {
            return value;
        }
        Matcher matcher = URL_KEY.matcher(value);
        if (!matcher.find()) {
            throw new IllegalArgumentException("Invalid design file URL or id: " + value);
        }
        return matcher.group(1);
    }
}
