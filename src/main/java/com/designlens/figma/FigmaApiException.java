package com.designlens.figma;

/**
 * Thrown when the design-tool API answers with a non-2xx status or cannot be reached.
 * A status of {@code 0} means no HTTP response was received.
 */
public class FigmaApiException extends RuntimeException {

    private final int status;

    public FigmaApiException(int status, String message) {
        super(message);
        this.status = status;
    }

    public FigmaApiException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
    }

    public int getStatus() {
        return status;
    }
}
