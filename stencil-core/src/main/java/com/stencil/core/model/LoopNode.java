package com.stencil.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Iteration over a collection expression.
 *
 * @param itemName name bound to each element inside the body
 * @param itemType optional type annotation for the bound element, {@code null} when absent
 * @param collection expression producing the collection to iterate
 * @param body nodes rendered once per element
 */
public record LoopNode(
    String itemName,
    String itemType,
    String collection,
    List<Node> body
) implements Node {

    /**
     * Compact constructor with validation.
     */
    public LoopNode {
        Objects.requireNonNull(itemName, "itemName must not be null");
        Objects.requireNonNull(collection, "collection must not be null");
        Objects.requireNonNull(body, "body must not be null");
        body = List.copyOf(body);
    }

    /**
     * Returns the item type annotation, if the template declared one.
     *
     * @return the annotation or empty
     */
    public Optional<String> itemTypeAnnotation() {
        return Optional.ofNullable(itemType);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLoop(this);
    }
}
