package com.stencil.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Two-armed branch on a boolean expression.
 *
 * <p>An absent {@code else} in the template is represented by an empty
 * {@code elseBranch}; both arms are always rendered.
 *
 * @param condition boolean expression in the target language
 * @param thenBranch nodes rendered when the condition holds
 * @param elseBranch nodes rendered otherwise
 */
public record ConditionalNode(
    String condition,
    List<Node> thenBranch,
    List<Node> elseBranch
) implements Node {

    /**
     * Compact constructor with validation.
     */
    public ConditionalNode {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(thenBranch, "thenBranch must not be null");
        Objects.requireNonNull(elseBranch, "elseBranch must not be null");
        thenBranch = List.copyOf(thenBranch);
        elseBranch = List.copyOf(elseBranch);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }
}
