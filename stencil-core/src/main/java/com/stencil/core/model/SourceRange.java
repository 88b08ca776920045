package com.stencil.core.model;

/**
 * Character range in the template source, assigned by the parser.
 *
 * @param start zero-based offset of the first character
 * @param end zero-based offset one past the last character
 */
public record SourceRange(int start, int end) {

    /** Range used when the producer supplied no position. */
    public static final SourceRange UNKNOWN = new SourceRange(0, 0);

    /**
     * Compact constructor with validation.
     */
    public SourceRange {
        if (start < 0) {
            throw new IllegalArgumentException("start must not be negative: " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException("end must not be before start: " + start + ".." + end);
        }
    }

    @Override
    public String toString() {
        return "[" + start + ".." + end + "]";
    }
}
