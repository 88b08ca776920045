package com.stencil.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Named function defined inside a template.
 *
 * <p>The body is rendered as its own scope: parameter declarations and imports inside it
 * belong to the function and never reach the enclosing document. Generated functions take
 * their arguments from {@code signatureHead}, so such parameters add nothing to the output.
 * Imports inside a body are accepted but not emitted; a module needing an import for a
 * function must declare it at the top level of the template.
 *
 * @param visibility whether the generated function is exported
 * @param signatureHead name and argument list, e.g. {@code item(name: String)}
 * @param body nodes forming the function's output
 * @param range source position of the definition
 */
public record FunctionDefinitionNode(
    Visibility visibility,
    String signatureHead,
    List<Node> body,
    SourceRange range
) implements Node {

    /**
     * Compact constructor with validation.
     */
    public FunctionDefinitionNode {
        Objects.requireNonNull(visibility, "visibility must not be null");
        Objects.requireNonNull(signatureHead, "signatureHead must not be null");
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(range, "range must not be null");
        body = List.copyOf(body);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFunctionDefinition(this);
    }
}
