package com.stencil.core.model;

import java.util.Objects;

/**
 * Module import the generated file must contain.
 *
 * @param path import path as written after {@code import}, e.g. {@code user.{User}}
 */
public record ImportNode(String path) implements Node {

    public ImportNode {
        Objects.requireNonNull(path, "path must not be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitImport(this);
    }
}
