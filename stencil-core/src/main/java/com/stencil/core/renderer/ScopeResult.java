package com.stencil.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Everything collected while rendering one sibling sequence.
 *
 * <p>Parameters and imports are kept as ordered lists so the generated signature and import
 * block follow document order exactly.
 *
 * @param emittedStatements generated statement lines, indented relative to the scope
 * @param imports import paths in order of appearance, duplicates included
 * @param generatedFunctions complete function definitions found in this scope
 * @param declaredParams parameters in declaration order
 * @param usesLoopConstruct whether a loop was rendered here or in a nested scope
 * @param hasRenderableContent whether the scope produces output of its own
 */
record ScopeResult(
    List<String> emittedStatements,
    List<String> imports,
    List<String> generatedFunctions,
    List<TypedParam> declaredParams,
    boolean usesLoopConstruct,
    boolean hasRenderableContent
) {

    ScopeResult {
        Objects.requireNonNull(emittedStatements, "emittedStatements must not be null");
        Objects.requireNonNull(imports, "imports must not be null");
        Objects.requireNonNull(generatedFunctions, "generatedFunctions must not be null");
        Objects.requireNonNull(declaredParams, "declaredParams must not be null");
        emittedStatements = List.copyOf(emittedStatements);
        imports = List.copyOf(imports);
        generatedFunctions = List.copyOf(generatedFunctions);
        declaredParams = List.copyOf(declaredParams);
    }
}
