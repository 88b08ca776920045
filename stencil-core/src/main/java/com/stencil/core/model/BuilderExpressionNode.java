package com.stencil.core.model;

import java.util.Objects;

/**
 * Target-language expression that already evaluates to an output builder.
 *
 * <p>The value is merged into the output builder rather than stringified, which lets
 * templates call each other's generated functions without intermediate strings.
 *
 * @param code expression source, copied into the generated file unchanged
 */
public record BuilderExpressionNode(String code) implements Node {

    public BuilderExpressionNode {
        Objects.requireNonNull(code, "code must not be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBuilderExpression(this);
    }
}
