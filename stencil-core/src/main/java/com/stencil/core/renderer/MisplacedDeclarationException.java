package com.stencil.core.renderer;

import com.stencil.core.model.SourceRange;

/**
 * A parameter declaration or import appeared inside a conditional branch or loop body.
 *
 * <p>Such declarations could not reach the generated signature or import block, so they
 * are rejected instead of being dropped.
 */
public class MisplacedDeclarationException extends RenderException {

    private final String declaration;
    private final ScopeKind scopeKind;

    /**
     * Creates the error.
     *
     * @param declaration what was declared, e.g. "import 'gleam/string'"
     * @param scopeKind scope the declaration was found in
     * @param range source position, or {@code null} if the node carries none
     */
    public MisplacedDeclarationException(String declaration, ScopeKind scopeKind, SourceRange range) {
        super(declaration + " is not allowed inside a " + scopeKind.description()
            + (range != null ? " at " + range : ""), range);
        this.declaration = declaration;
        this.scopeKind = scopeKind;
    }

    public String getDeclaration() {
        return declaration;
    }

    public ScopeKind getScopeKind() {
        return scopeKind;
    }
}
