package com.stencil.core.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.stencil.core.model.BuilderExpressionNode;
import com.stencil.core.model.ConditionalNode;
import com.stencil.core.model.ExpressionNode;
import com.stencil.core.model.FunctionDefinitionNode;
import com.stencil.core.model.ImportNode;
import com.stencil.core.model.LoopNode;
import com.stencil.core.model.Node;
import com.stencil.core.model.ParamDeclarationNode;
import com.stencil.core.model.SourceRange;
import com.stencil.core.model.TemplateDocument;
import com.stencil.core.model.TextNode;
import com.stencil.core.model.Visibility;
import com.stencil.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads node trees serialized by the template parser.
 *
 * <p>Documents are JSON, or YAML when the file ends in {@code .yaml}/{@code .yml}. The root
 * is either an object with {@code source} and {@code nodes} or a bare array of nodes.
 * Each node is an object discriminated by {@code type}:
 *
 * <pre>{@code
 * {
 *   "source": "greeting.gleamx",
 *   "nodes": [
 *     {"type": "param", "name": "name", "typeName": "String", "range": {"start": 8, "end": 12}},
 *     {"type": "text", "content": "Hello "},
 *     {"type": "expression", "code": "name"},
 *     {"type": "if", "condition": "is_admin", "then": [{"type": "text", "content": "!"}]},
 *     {"type": "for", "item": "item", "itemType": "Item", "collection": "items", "body": []},
 *     {"type": "function", "visibility": "public", "head": "title()", "body": []}
 *   ]
 * }
 * }</pre>
 *
 * <p>The tree is decoded by hand from Jackson's {@link JsonNode}. Structural problems raise
 * {@link NodeTreeFormatException} carrying the JSON pointer of the offending element.
 */
public class NodeTreeReader {

    private static final Logger log = LoggerFactory.getLogger(NodeTreeReader.class);

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public NodeTreeReader() {
        this.jsonMapper = new ObjectMapper();
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * Returns whether a file looks like a node-tree document by its extension.
     *
     * @param file candidate file
     * @return true for {@code .json}, {@code .yaml} and {@code .yml}
     */
    public static boolean isNodeTreeFile(Path file) {
        String extension = FileUtils.getExtension(file).toLowerCase(Locale.ROOT);
        return extension.equals("json") || isYamlExtension(extension);
    }

    /**
     * Reads a node-tree file.
     *
     * <p>When the document names no {@code source}, the file's own name is used.
     *
     * @param file JSON or YAML document
     * @return the decoded document
     * @throws IOException if the file cannot be read or is not valid JSON/YAML
     * @throws NodeTreeFormatException if the content does not describe a node tree
     */
    public TemplateDocument read(Path file) throws IOException {
        log.debug("Reading node tree from: {}", file);
        String content = FileUtils.readString(file);
        String fallbackName = file.getFileName().toString();
        String extension = FileUtils.getExtension(file).toLowerCase(Locale.ROOT);

        TemplateDocument document = isYamlExtension(extension)
            ? readYaml(content, fallbackName)
            : readJson(content, fallbackName);

        log.debug("Read {} top-level nodes from {}", document.nodes().size(), file);
        return document;
    }

    /**
     * Reads a JSON node-tree document.
     *
     * @param content JSON text
     * @param fallbackSourceName source name used when the document names none
     * @return the decoded document
     * @throws IOException if the text is not valid JSON
     */
    public TemplateDocument readJson(String content, String fallbackSourceName) throws IOException {
        return decode(jsonMapper.readTree(content), fallbackSourceName);
    }

    /**
     * Reads a YAML node-tree document.
     *
     * @param content YAML text
     * @param fallbackSourceName source name used when the document names none
     * @return the decoded document
     * @throws IOException if the text is not valid YAML
     */
    public TemplateDocument readYaml(String content, String fallbackSourceName) throws IOException {
        return decode(yamlMapper.readTree(content), fallbackSourceName);
    }

    /**
     * Decodes an already-parsed document tree.
     *
     * @param root document root
     * @param fallbackSourceName source name used when the document names none
     * @return the decoded document
     */
    public TemplateDocument decode(JsonNode root, String fallbackSourceName) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new NodeTreeFormatException("Empty node-tree document", "");
        }
        if (root.isArray()) {
            return new TemplateDocument(fallbackSourceName, decodeNodes(root, ""));
        }
        if (!root.isObject()) {
            throw new NodeTreeFormatException("Expected an object or an array of nodes", "");
        }

        String source = getTextOrDefault(root.get("source"), fallbackSourceName);
        JsonNode nodes = root.get("nodes");
        if (nodes == null) {
            throw new NodeTreeFormatException("Missing field 'nodes'", "");
        }
        return new TemplateDocument(source, decodeNodes(nodes, "/nodes"));
    }

    private List<Node> decodeNodes(JsonNode array, String pointer) {
        if (!array.isArray()) {
            throw new NodeTreeFormatException("Expected an array of nodes", pointer);
        }
        List<Node> nodes = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            nodes.add(decodeNode(array.get(i), pointer + "/" + i));
        }
        return nodes;
    }

    private Node decodeNode(JsonNode json, String pointer) {
        if (!json.isObject()) {
            throw new NodeTreeFormatException("Expected a node object", pointer);
        }
        String type = requireText(json, "type", pointer);

        return switch (type) {
            case "text" -> new TextNode(requireText(json, "content", pointer));
            case "expression" -> new ExpressionNode(requireText(json, "code", pointer));
            case "builder" -> new BuilderExpressionNode(requireText(json, "code", pointer));
            case "import" -> new ImportNode(requireText(json, "path", pointer));
            case "param" -> new ParamDeclarationNode(
                requireText(json, "name", pointer),
                decodeRange(json.get("range"), pointer + "/range"),
                requireText(json, "typeName", pointer)
            );
            case "if" -> new ConditionalNode(
                requireText(json, "condition", pointer),
                decodeNodes(requireField(json, "then", pointer), pointer + "/then"),
                json.has("else") ? decodeNodes(json.get("else"), pointer + "/else") : List.of()
            );
            case "for" -> new LoopNode(
                requireText(json, "item", pointer),
                getTextOrDefault(json.get("itemType"), null),
                requireText(json, "collection", pointer),
                decodeNodes(requireField(json, "body", pointer), pointer + "/body")
            );
            case "function" -> new FunctionDefinitionNode(
                decodeVisibility(json.get("visibility"), pointer + "/visibility"),
                requireText(json, "head", pointer),
                decodeNodes(requireField(json, "body", pointer), pointer + "/body"),
                decodeRange(json.get("range"), pointer + "/range")
            );
            default -> throw new NodeTreeFormatException("Unknown node type '" + type + "'", pointer + "/type");
        };
    }

    private SourceRange decodeRange(JsonNode json, String pointer) {
        if (json == null || json.isNull()) {
            return SourceRange.UNKNOWN;
        }
        JsonNode start = json.get("start");
        JsonNode end = json.get("end");
        if (start == null || end == null || !start.canConvertToInt() || !end.canConvertToInt()) {
            throw new NodeTreeFormatException("Range needs integer 'start' and 'end'", pointer);
        }
        try {
            return new SourceRange(start.intValue(), end.intValue());
        } catch (IllegalArgumentException e) {
            throw new NodeTreeFormatException(e.getMessage(), pointer);
        }
    }

    private Visibility decodeVisibility(JsonNode json, String pointer) {
        String value = getTextOrDefault(json, "private");
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "private" -> Visibility.PRIVATE;
            case "public", "pub" -> Visibility.PUBLIC;
            default -> throw new NodeTreeFormatException("Unknown visibility '" + value + "'", pointer);
        };
    }

    private JsonNode requireField(JsonNode json, String field, String pointer) {
        JsonNode value = json.get(field);
        if (value == null || value.isNull()) {
            throw new NodeTreeFormatException("Missing field '" + field + "'", pointer);
        }
        return value;
    }

    private String requireText(JsonNode json, String field, String pointer) {
        JsonNode value = requireField(json, field, pointer);
        if (!value.isTextual()) {
            throw new NodeTreeFormatException("Field '" + field + "' must be a string", pointer + "/" + field);
        }
        return value.asText();
    }

    private String getTextOrDefault(JsonNode node, String defaultValue) {
        if (node == null || !node.isTextual()) {
            return defaultValue;
        }
        return node.asText();
    }

    private static boolean isYamlExtension(String extension) {
        return extension.equals("yaml") || extension.equals("yml");
    }
}
