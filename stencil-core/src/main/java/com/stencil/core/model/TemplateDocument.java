package com.stencil.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A parsed template together with the name of the file it was parsed from.
 *
 * @param sourceFileName originating template file name, used in the generated header
 * @param nodes top-level nodes in document order
 */
public record TemplateDocument(
    String sourceFileName,
    List<Node> nodes
) {
    /**
     * Compact constructor with validation.
     */
    public TemplateDocument {
        Objects.requireNonNull(sourceFileName, "sourceFileName must not be null");
        Objects.requireNonNull(nodes, "nodes must not be null");
        nodes = List.copyOf(nodes);
    }
}
