package com.stencil.core.model;

import java.util.Objects;

/**
 * Declares a labeled input parameter of the generated render functions.
 *
 * @param name parameter name, used both as label and as positional name
 * @param range source position of the declaration, for diagnostics
 * @param typeName target-language type of the parameter
 */
public record ParamDeclarationNode(
    String name,
    SourceRange range,
    String typeName
) implements Node {

    /**
     * Compact constructor with validation.
     */
    public ParamDeclarationNode {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(range, "range must not be null");
        Objects.requireNonNull(typeName, "typeName must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitParamDeclaration(this);
    }
}
