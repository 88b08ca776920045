package com.stencil.core.renderer;

import com.stencil.core.model.SourceRange;

import java.util.Optional;

/**
 * Raised when a node tree cannot be turned into source code.
 *
 * <p>Rendering is all-or-nothing: once this is thrown no partial output exists.
 */
public class RenderException extends RuntimeException {

    private final SourceRange range;

    /**
     * Creates a render error.
     *
     * @param message description of the problem
     * @param range offending source position, or {@code null} if unknown
     */
    public RenderException(String message, SourceRange range) {
        super(message);
        this.range = range;
    }

    /**
     * Returns the source position the error refers to.
     *
     * @return the range, or empty when the offending node carries none
     */
    public Optional<SourceRange> getRange() {
        return Optional.ofNullable(range);
    }
}
