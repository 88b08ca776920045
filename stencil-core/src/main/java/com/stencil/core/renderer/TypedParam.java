package com.stencil.core.renderer;

import java.util.Objects;

/**
 * Declared parameter of a generated render function.
 *
 * @param name parameter label and name
 * @param typeName declared type
 */
record TypedParam(String name, String typeName) {

    TypedParam {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(typeName, "typeName must not be null");
    }
}
