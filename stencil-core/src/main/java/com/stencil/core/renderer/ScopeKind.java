package com.stencil.core.renderer;

/**
 * Kind of sibling sequence being rendered by one recursive call.
 */
public enum ScopeKind {
    /** Top level of the template document */
    DOCUMENT("document", true),
    /** Body of a template-defined function */
    FUNCTION_BODY("function body", true),
    /** Either arm of a conditional */
    CONDITIONAL_BRANCH("conditional branch", false),
    /** Body of a loop */
    LOOP_BODY("loop body", false);

    private final String description;
    private final boolean allowsDeclarations;

    ScopeKind(String description, boolean allowsDeclarations) {
        this.description = description;
        this.allowsDeclarations = allowsDeclarations;
    }

    /**
     * Returns whether parameter declarations and imports may appear in this scope.
     *
     * @return true for document and function-body scopes
     */
    public boolean allowsDeclarations() {
        return allowsDeclarations;
    }

    /**
     * Returns a human-readable name used in error messages.
     *
     * @return scope description
     */
    public String description() {
        return description;
    }
}
