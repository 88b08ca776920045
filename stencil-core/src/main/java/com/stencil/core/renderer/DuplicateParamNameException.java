package com.stencil.core.renderer;

import com.stencil.core.model.SourceRange;

import java.util.Objects;

/**
 * A parameter name was declared twice in the same scope.
 */
public class DuplicateParamNameException extends RenderException {

    private final String paramName;

    /**
     * Creates the error for the second declaration of {@code paramName}.
     *
     * @param paramName the repeated name
     * @param range position of the repeated declaration
     */
    public DuplicateParamNameException(String paramName, SourceRange range) {
        super("Duplicate parameter name '" + paramName + "' at " + range,
            Objects.requireNonNull(range, "range must not be null"));
        this.paramName = paramName;
    }

    /**
     * Returns the name that was declared more than once.
     *
     * @return parameter name
     */
    public String getParamName() {
        return paramName;
    }
}
