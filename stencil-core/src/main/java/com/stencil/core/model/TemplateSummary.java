package com.stencil.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Structural statistics of a node tree.
 *
 * <p>Counts include nodes at every depth. {@code maxDepth} is the deepest nesting of
 * conditionals, loops and functions; a flat document has depth 0.
 *
 * @param nodeCount total number of nodes
 * @param params parameter declarations
 * @param imports import nodes
 * @param functions function definitions
 * @param conditionals conditional nodes
 * @param loops loop nodes
 * @param maxDepth deepest block nesting
 */
public record TemplateSummary(
    int nodeCount,
    int params,
    int imports,
    int functions,
    int conditionals,
    int loops,
    int maxDepth
) {

    /**
     * Computes the summary of a node sequence.
     *
     * @param nodes top-level nodes
     * @return summary over the whole tree
     */
    public static TemplateSummary of(List<Node> nodes) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        Counter counter = new Counter();
        int depth = counter.visitAll(nodes);
        return new TemplateSummary(
            counter.nodeCount,
            counter.params,
            counter.imports,
            counter.functions,
            counter.conditionals,
            counter.loops,
            depth
        );
    }

    @Override
    public String toString() {
        return nodeCount + " nodes, " + params + " params, " + imports + " imports, "
            + functions + " functions, " + conditionals + " conditionals, " + loops + " loops, depth " + maxDepth;
    }

    /**
     * Visitor returning the block depth below each node while tallying kinds.
     */
    private static final class Counter implements NodeVisitor<Integer> {
        private int nodeCount;
        private int params;
        private int imports;
        private int functions;
        private int conditionals;
        private int loops;

        int visitAll(List<Node> nodes) {
            int depth = 0;
            for (Node node : nodes) {
                nodeCount++;
                depth = Math.max(depth, node.accept(this));
            }
            return depth;
        }

        @Override
        public Integer visitText(TextNode node) {
            return 0;
        }

        @Override
        public Integer visitExpression(ExpressionNode node) {
            return 0;
        }

        @Override
        public Integer visitBuilderExpression(BuilderExpressionNode node) {
            return 0;
        }

        @Override
        public Integer visitImport(ImportNode node) {
            imports++;
            return 0;
        }

        @Override
        public Integer visitParamDeclaration(ParamDeclarationNode node) {
            params++;
            return 0;
        }

        @Override
        public Integer visitConditional(ConditionalNode node) {
            conditionals++;
            return 1 + Math.max(visitAll(node.thenBranch()), visitAll(node.elseBranch()));
        }

        @Override
        public Integer visitLoop(LoopNode node) {
            loops++;
            return 1 + visitAll(node.body());
        }

        @Override
        public Integer visitFunctionDefinition(FunctionDefinitionNode node) {
            functions++;
            return 1 + visitAll(node.body());
        }
    }
}
