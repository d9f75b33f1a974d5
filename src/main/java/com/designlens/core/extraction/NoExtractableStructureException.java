package com.designlens.core.extraction;

/**
 * Thrown when the design tree is absent or yields no descriptor at all.
 * This is the only failure the pipeline reports to its caller.
 */
public class NoExtractableStructureException extends RuntimeException {

    public NoExtractableStructureException(String message) {
        super(message);
    }
}
