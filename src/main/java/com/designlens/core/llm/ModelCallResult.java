package com.designlens.core.llm;

import java.time.Duration;

/**
 * Outcome of one external model call. Callers handle all four variants;
 * anything other than {@link Ok} sends the calling stage down its fallback path.
 */
public sealed interface ModelCallResult<T>
        permits ModelCallResult.Ok, ModelCallResult.ParseError, ModelCallResult.TransportError, ModelCallResult.Timeout {

    record Ok<T>(T value) implements ModelCallResult<T> {}

    /** The model answered, but with empty content or JSON that does not fit the schema. */
    record ParseError<T>(String message) implements ModelCallResult<T> {}

    /** Network failure, non-success status or any other error raised by the client. */
    record TransportError<T>(String message) implements ModelCallResult<T> {}

    record Timeout<T>(Duration after) implements ModelCallResult<T> {}

    default boolean isOk() {
        return this instanceof Ok;
    }

    /** Short reason for logs and suggestions. */
    default String describe() {
        if (this instanceof Ok) {
            return "ok";
        } else if (this instanceof ParseError<T> e) {
            return "unparsable model response: " + e.message();
        } else if (this instanceof TransportError<T> e) {
            return "model call failed: " + e.message();
        } else if (this instanceof Timeout<T> t) {
            return "model call timed out after " + t.after().toSeconds() + "s";
        }
        throw new IllegalStateException("Unknown result " + this);
    }
}
