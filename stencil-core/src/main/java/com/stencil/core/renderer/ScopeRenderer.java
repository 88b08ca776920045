package com.stencil.core.renderer;

import com.stencil.core.model.BuilderExpressionNode;
import com.stencil.core.model.ConditionalNode;
import com.stencil.core.model.ExpressionNode;
import com.stencil.core.model.FunctionDefinitionNode;
import com.stencil.core.model.ImportNode;
import com.stencil.core.model.LoopNode;
import com.stencil.core.model.Node;
import com.stencil.core.model.NodeVisitor;
import com.stencil.core.model.ParamDeclarationNode;
import com.stencil.core.model.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders one sequence of sibling nodes into a {@link ScopeResult}.
 *
 * <p>Each call owns a fresh accumulator. Nested sequences (conditional arms, loop bodies,
 * function bodies) are rendered by recursive calls, and only three things cross back into
 * the parent: the nested statements, wrapped in their enclosing construct; the loop-usage
 * flag; and generated functions. Parameters, imports and the content flag of a nested
 * scope stay behind.
 *
 * <p>Stateless and safe for concurrent use.
 */
final class ScopeRenderer {

    /**
     * Renders {@code nodes} in order.
     *
     * @param nodes sibling nodes
     * @param kind which kind of scope the siblings form
     * @return the collected scope state
     * @throws DuplicateParamNameException if a parameter name repeats within the scope
     * @throws MisplacedDeclarationException if a declaration appears where the scope forbids it
     */
    ScopeResult render(List<Node> nodes, ScopeKind kind) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        Objects.requireNonNull(kind, "kind must not be null");

        ScopeAccumulator scope = new ScopeAccumulator(kind);
        for (Node node : nodes) {
            node.accept(scope);
        }
        return scope.toResult();
    }

    /**
     * Mutable state of a single scope, discarded once the result is built.
     */
    private final class ScopeAccumulator implements NodeVisitor<Void> {
        private final ScopeKind kind;
        private final List<String> statements = new ArrayList<>();
        private final List<String> imports = new ArrayList<>();
        private final List<String> functions = new ArrayList<>();
        private final List<TypedParam> params = new ArrayList<>();
        private boolean usesLoopConstruct;
        private boolean hasRenderableContent;

        private ScopeAccumulator(ScopeKind kind) {
            this.kind = kind;
        }

        @Override
        public Void visitText(TextNode node) {
            statements.add(GleamSyntax.appendText(node.content()));
            hasRenderableContent = hasRenderableContent || !node.isBlank();
            return null;
        }

        @Override
        public Void visitExpression(ExpressionNode node) {
            statements.add(GleamSyntax.appendExpression(node.code()));
            hasRenderableContent = true;
            return null;
        }

        @Override
        public Void visitBuilderExpression(BuilderExpressionNode node) {
            statements.add(GleamSyntax.appendBuilder(node.code()));
            hasRenderableContent = true;
            return null;
        }

        @Override
        public Void visitImport(ImportNode node) {
            if (!kind.allowsDeclarations()) {
                throw new MisplacedDeclarationException("import '" + node.path() + "'", kind, null);
            }
            imports.add(node.path());
            return null;
        }

        @Override
        public Void visitParamDeclaration(ParamDeclarationNode node) {
            if (!kind.allowsDeclarations()) {
                throw new MisplacedDeclarationException(
                    "parameter declaration '" + node.name() + "'", kind, node.range());
            }
            // Linear scan in declaration order
            for (TypedParam param : params) {
                if (param.name().equals(node.name())) {
                    throw new DuplicateParamNameException(node.name(), node.range());
                }
            }
            params.add(new TypedParam(node.name(), node.typeName()));
            hasRenderableContent = true;
            return null;
        }

        @Override
        public Void visitConditional(ConditionalNode node) {
            ScopeResult thenScope = render(node.thenBranch(), ScopeKind.CONDITIONAL_BRANCH);
            ScopeResult elseScope = render(node.elseBranch(), ScopeKind.CONDITIONAL_BRANCH);

            statements.addAll(GleamSyntax.conditional(
                node.condition(), thenScope.emittedStatements(), elseScope.emittedStatements()));
            functions.addAll(thenScope.generatedFunctions());
            functions.addAll(elseScope.generatedFunctions());
            usesLoopConstruct = usesLoopConstruct
                || thenScope.usesLoopConstruct()
                || elseScope.usesLoopConstruct();
            hasRenderableContent = true;
            return null;
        }

        @Override
        public Void visitLoop(LoopNode node) {
            ScopeResult bodyScope = render(node.body(), ScopeKind.LOOP_BODY);

            statements.addAll(GleamSyntax.fold(
                node.collection(), node.itemName(), node.itemTypeAnnotation(), bodyScope.emittedStatements()));
            functions.addAll(bodyScope.generatedFunctions());
            usesLoopConstruct = true;
            hasRenderableContent = true;
            return null;
        }

        @Override
        public Void visitFunctionDefinition(FunctionDefinitionNode node) {
            ScopeResult bodyScope = render(node.body(), ScopeKind.FUNCTION_BODY);

            functions.add(GleamSyntax.function(
                node.visibility(), node.signatureHead(), bodyScope.emittedStatements()));
            // Nested definitions are hoisted to module level
            functions.addAll(bodyScope.generatedFunctions());
            usesLoopConstruct = usesLoopConstruct || bodyScope.usesLoopConstruct();
            return null;
        }

        private ScopeResult toResult() {
            return new ScopeResult(
                statements,
                imports,
                functions,
                params,
                usesLoopConstruct,
                hasRenderableContent
            );
        }
    }
}
