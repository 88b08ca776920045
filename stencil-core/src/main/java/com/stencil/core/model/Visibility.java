package com.stencil.core.model;

/**
 * Visibility of a template-defined function in the generated module.
 */
public enum Visibility {
    /** Module-private function */
    PRIVATE,
    /** Exported function, emitted with {@code pub} */
    PUBLIC
}
