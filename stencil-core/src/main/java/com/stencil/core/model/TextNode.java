package com.stencil.core.model;

import java.util.Objects;

/**
 * Literal template text, emitted verbatim into the output.
 *
 * @param content the literal text (may be empty or whitespace only)
 */
public record TextNode(String content) implements Node {

    /**
     * Compact constructor with validation.
     */
    public TextNode {
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Returns whether the text is empty or consists only of whitespace.
     *
     * @return true if no non-whitespace character is present
     */
    public boolean isBlank() {
        return content.isBlank();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitText(this);
    }
}
