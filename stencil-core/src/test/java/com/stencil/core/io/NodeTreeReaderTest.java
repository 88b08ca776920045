package com.stencil.core.io;

import com.stencil.core.model.ConditionalNode;
import com.stencil.core.model.ExpressionNode;
import com.stencil.core.model.FunctionDefinitionNode;
import com.stencil.core.model.LoopNode;
import com.stencil.core.model.ParamDeclarationNode;
import com.stencil.core.model.SourceRange;
import com.stencil.core.model.TemplateDocument;
import com.stencil.core.model.TextNode;
import com.stencil.core.model.Visibility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link NodeTreeReader}.
 */
class NodeTreeReaderTest {

    private NodeTreeReader reader;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        reader = new NodeTreeReader();
    }

    @Test
    void readJson_withAllNodeTypes_decodesTree() throws IOException {
        String json = """
            {
              "source": "page.gleamx",
              "nodes": [
                {"type": "import", "path": "app/user.{type User}"},
                {"type": "param", "name": "users", "typeName": "List(User)", "range": {"start": 4, "end": 9}},
                {"type": "text", "content": "<ul>"},
                {"type": "for", "item": "user", "itemType": "User", "collection": "users", "body": [
                  {"type": "if", "condition": "user.active", "then": [
                    {"type": "builder", "code": "row(user)"}
                  ], "else": [
                    {"type": "expression", "code": "user.name"}
                  ]}
                ]},
                {"type": "function", "visibility": "public", "head": "row(user: User)", "body": []}
              ]
            }
            """;

        TemplateDocument document = reader.readJson(json, "fallback.json");

        assertThat(document.sourceFileName()).isEqualTo("page.gleamx");
        assertThat(document.nodes()).hasSize(5);
        assertThat(document.nodes().get(1))
            .isEqualTo(new ParamDeclarationNode("users", new SourceRange(4, 9), "List(User)"));
        assertThat(document.nodes().get(2)).isEqualTo(new TextNode("<ul>"));

        LoopNode loop = (LoopNode) document.nodes().get(3);
        assertThat(loop.itemTypeAnnotation()).contains("User");
        ConditionalNode conditional = (ConditionalNode) loop.body().get(0);
        assertThat(conditional.elseBranch()).containsExactly(new ExpressionNode("user.name"));

        FunctionDefinitionNode function = (FunctionDefinitionNode) document.nodes().get(4);
        assertThat(function.visibility()).isEqualTo(Visibility.PUBLIC);
        assertThat(function.range()).isEqualTo(SourceRange.UNKNOWN);
    }

    @Test
    void readJson_withBareArray_usesFallbackSourceName() throws IOException {
        TemplateDocument document = reader.readJson("[{\"type\": \"text\", \"content\": \"hi\"}]", "hi.tree.json");

        assertThat(document.sourceFileName()).isEqualTo("hi.tree.json");
        assertThat(document.nodes()).containsExactly(new TextNode("hi"));
    }

    @Test
    void readJson_withDefaults_appliesPrivateVisibilityAndEmptyElse() throws IOException {
        TemplateDocument document = reader.readJson("""
            [
              {"type": "function", "head": "f()", "body": []},
              {"type": "if", "condition": "c", "then": []}
            ]
            """, "x");

        assertThat(((FunctionDefinitionNode) document.nodes().get(0)).visibility()).isEqualTo(Visibility.PRIVATE);
        assertThat(((ConditionalNode) document.nodes().get(1)).elseBranch()).isEmpty();
    }

    @Test
    void read_withYamlFile_decodesTree() throws IOException {
        Path file = tempDir.resolve("greeting.tree.yaml");
        Files.writeString(file, """
            nodes:
              - type: param
                name: name
                typeName: String
              - type: text
                content: "Hello "
              - type: expression
                code: name
            """);

        TemplateDocument document = reader.read(file);

        assertThat(document.sourceFileName()).isEqualTo("greeting.tree.yaml");
        assertThat(document.nodes()).containsExactly(
            new ParamDeclarationNode("name", SourceRange.UNKNOWN, "String"),
            new TextNode("Hello "),
            new ExpressionNode("name"));
    }

    @Test
    void readJson_withUnknownType_reportsPointer() {
        String json = """
            {"nodes": [{"type": "text", "content": "a"}, {"type": "for", "item": "x", "collection": "xs",
              "body": [{"type": "loop"}]}]}
            """;

        assertThatThrownBy(() -> reader.readJson(json, "x"))
            .isInstanceOf(NodeTreeFormatException.class)
            .hasMessage("Unknown node type 'loop' at /nodes/1/body/0/type")
            .satisfies(e -> assertThat(((NodeTreeFormatException) e).getPointer()).isEqualTo("/nodes/1/body/0/type"));
    }

    @Test
    void readJson_withMissingField_reportsFieldName() {
        assertThatThrownBy(() -> reader.readJson("[{\"type\": \"param\", \"name\": \"x\"}]", "x"))
            .isInstanceOf(NodeTreeFormatException.class)
            .hasMessage("Missing field 'typeName' at /0");
    }

    @Test
    void readJson_withNonStringField_throwsException() {
        assertThatThrownBy(() -> reader.readJson("[{\"type\": \"text\", \"content\": 5}]", "x"))
            .isInstanceOf(NodeTreeFormatException.class)
            .hasMessage("Field 'content' must be a string at /0/content");
    }

    @Test
    void readJson_withInvalidRange_throwsException() {
        String json = "[{\"type\": \"param\", \"name\": \"x\", \"typeName\": \"Int\", \"range\": {\"start\": 9, \"end\": 2}}]";

        assertThatThrownBy(() -> reader.readJson(json, "x"))
            .isInstanceOf(NodeTreeFormatException.class)
            .hasMessageContaining("/0/range");
    }

    @Test
    void readJson_withoutNodes_throwsException() {
        assertThatThrownBy(() -> reader.readJson("{\"source\": \"a\"}", "x"))
            .isInstanceOf(NodeTreeFormatException.class)
            .hasMessage("Missing field 'nodes' at /");
        assertThatThrownBy(() -> reader.readJson("\"text\"", "x"))
            .isInstanceOf(NodeTreeFormatException.class);
        assertThatThrownBy(() -> reader.readJson("", "x"))
            .isInstanceOf(NodeTreeFormatException.class)
            .hasMessageContaining("Empty");
    }

    @Test
    void readJson_withUnknownVisibility_throwsException() {
        assertThatThrownBy(() -> reader.readJson(
                "[{\"type\": \"function\", \"visibility\": \"internal\", \"head\": \"f()\", \"body\": []}]", "x"))
            .isInstanceOf(NodeTreeFormatException.class)
            .hasMessageContaining("internal");
    }

    @Test
    void readJson_withMalformedJson_throwsIOException() {
        assertThatThrownBy(() -> reader.readJson("[{", "x"))
            .isInstanceOf(IOException.class);
    }

    @Test
    void isNodeTreeFile_acceptsJsonAndYamlOnly() {
        assertThat(NodeTreeReader.isNodeTreeFile(Path.of("a.json"))).isTrue();
        assertThat(NodeTreeReader.isNodeTreeFile(Path.of("a.tree.YML"))).isTrue();
        assertThat(NodeTreeReader.isNodeTreeFile(Path.of("a.gleam"))).isFalse();
    }
}
