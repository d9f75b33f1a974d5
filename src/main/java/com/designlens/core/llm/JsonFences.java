package com.designlens.core.llm;

/**
 * Strips markdown code-fence wrapping and surrounding prose from model JSON.
 */
public final class JsonFences {

    private JsonFences() {}

    public static String strip(String raw) {
        if (raw == null) {
            return "";
        }
        String cleaned = raw.trim();
        int fence = cleaned.indexOf("```");
        if (fence >= 0) {
            int bodyStart = cleaned.indexOf('\n', fence);
            int closing = cleaned.lastIndexOf("```");
            if (bodyStart >= 0 && closing > bodyStart) {
                cleaned = cleaned.substring(bodyStart + 1, closing).trim();
            } else if (cleaned.startsWith("```json")) {
                cleaned = cleaned.substring(7).trim();
            } else if (cleaned.startsWith("```")) {
                cleaned = cleaned.substring(3).trim();
            }
        }
        int open = cleaned.indexOf('{');
        int close = cleaned.lastIndexOf('}');
        if (open >= 0 && close > open) {
            cleaned = cleaned.substring(open, close + 1);
        }
        return cleaned;
    }
}
