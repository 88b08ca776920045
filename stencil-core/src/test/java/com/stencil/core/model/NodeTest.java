package com.stencil.core.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the node records and {@link SourceRange}.
 */
class NodeTest {

    @Test
    void conditionalNode_copiesBranches() {
        List<Node> branch = new ArrayList<>(List.of(new TextNode("a")));
        ConditionalNode node = new ConditionalNode("flag", branch, List.of());

        branch.add(new TextNode("b"));

        assertThat(node.thenBranch()).hasSize(1);
        assertThatThrownBy(() -> node.thenBranch().add(new TextNode("c")))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void loopNode_withoutItemType_hasEmptyAnnotation() {
        LoopNode node = new LoopNode("item", null, "items", List.of());

        assertThat(node.itemTypeAnnotation()).isEmpty();
        assertThat(new LoopNode("item", "Item", "items", List.of()).itemTypeAnnotation()).contains("Item");
    }

    @Test
    void paramDeclarationNode_withBlankName_throwsException() {
        assertThatThrownBy(() -> new ParamDeclarationNode(" ", SourceRange.UNKNOWN, "String"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("blank");
    }

    @Test
    void nodes_withNullFields_throwException() {
        assertThatThrownBy(() -> new TextNode(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessage("content must not be null");
        assertThatThrownBy(() -> new FunctionDefinitionNode(null, "f()", List.of(), SourceRange.UNKNOWN))
            .isInstanceOf(NullPointerException.class)
            .hasMessage("visibility must not be null");
    }

    @Test
    void textNode_isBlank_detectsWhitespaceOnlyContent() {
        assertThat(new TextNode(" \n\t").isBlank()).isTrue();
        assertThat(new TextNode(" x ").isBlank()).isFalse();
    }

    @Test
    void sourceRange_rejectsInvalidBounds() {
        assertThatThrownBy(() -> new SourceRange(-1, 3))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SourceRange(5, 4))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("5..4");
    }

    @Test
    void sourceRange_toString_showsBounds() {
        assertThat(new SourceRange(3, 7)).hasToString("[3..7]");
    }

    @Test
    void accept_dispatchesToMatchingVisitMethod() {
        NodeVisitor<String> names = new NodeVisitor<>() {
            @Override
            public String visitText(TextNode node) {
                return "text";
            }

            @Override
            public String visitExpression(ExpressionNode node) {
                return "expression";
            }

            @Override
            public String visitBuilderExpression(BuilderExpressionNode node) {
                return "builder";
            }

            @Override
            public String visitImport(ImportNode node) {
                return "import";
            }

            @Override
            public String visitParamDeclaration(ParamDeclarationNode node) {
                return "param";
            }

            @Override
            public String visitConditional(ConditionalNode node) {
                return "if";
            }

            @Override
            public String visitLoop(LoopNode node) {
                return "for";
            }

            @Override
            public String visitFunctionDefinition(FunctionDefinitionNode node) {
                return "function";
            }
        };

        assertThat(new BuilderExpressionNode("b()").accept(names)).isEqualTo("builder");
        assertThat(new ImportNode("gleam/int").accept(names)).isEqualTo("import");
        assertThat(new LoopNode("x", null, "xs", List.of()).accept(names)).isEqualTo("for");
    }
}
