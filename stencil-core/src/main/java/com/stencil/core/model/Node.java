package com.stencil.core.model;

/**
 * One element of a parsed template tree.
 *
 * <p>The hierarchy is closed: every node kind is a record listed in the {@code permits}
 * clause, and every consumer handles all of them through {@link NodeVisitor}. Adding a
 * node kind therefore fails compilation until each visitor implements the new
 * {@code visit} method.
 *
 * <p><b>Node kinds:</b>
 * <ul>
 *   <li>{@link TextNode} - literal output text</li>
 *   <li>{@link ExpressionNode} - expression whose string value is appended</li>
 *   <li>{@link BuilderExpressionNode} - expression that already is an output builder</li>
 *   <li>{@link ImportNode} - module import required by the generated file</li>
 *   <li>{@link ParamDeclarationNode} - labeled input parameter of the render functions</li>
 *   <li>{@link ConditionalNode} - two-armed branch</li>
 *   <li>{@link LoopNode} - iteration over a collection expression</li>
 *   <li>{@link FunctionDefinitionNode} - nested named function</li>
 * </ul>
 *
 * @see NodeVisitor
 */
public sealed interface Node permits TextNode, ExpressionNode, BuilderExpressionNode, ImportNode,
    ParamDeclarationNode, ConditionalNode, LoopNode, FunctionDefinitionNode {

    /**
     * Dispatches to the {@code visit} method of {@code visitor} matching this node kind.
     *
     * @param visitor visitor to dispatch to
     * @param <R> visitor result type
     * @return the visitor's result
     */
    <R> R accept(NodeVisitor<R> visitor);
}
