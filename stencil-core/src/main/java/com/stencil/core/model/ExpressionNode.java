package com.stencil.core.model;

import java.util.Objects;

/**
 * Target-language expression whose string value is appended to the output.
 *
 * @param code expression source, copied into the generated file unchanged
 */
public record ExpressionNode(String code) implements Node {

    public ExpressionNode {
        Objects.requireNonNull(code, "code must not be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitExpression(this);
    }
}
