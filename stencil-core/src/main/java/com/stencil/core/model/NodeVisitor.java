package com.stencil.core.model;

/**
 * Exhaustive operation over the {@link Node} hierarchy.
 *
 * @param <R> result type of each visit
 */
public interface NodeVisitor<R> {

    R visitText(TextNode node);

    R visitExpression(ExpressionNode node);

    R visitBuilderExpression(BuilderExpressionNode node);

    R visitImport(ImportNode node);

    R visitParamDeclaration(ParamDeclarationNode node);

    R visitConditional(ConditionalNode node);

    R visitLoop(LoopNode node);

    R visitFunctionDefinition(FunctionDefinitionNode node);
}
