package com.stencil.core.renderer;

import com.stencil.core.model.Visibility;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Gleam source fragments emitted by the renderer.
 *
 * <p>Every generated statement rebinds the local {@code builder} to a new
 * {@code StringBuilder}, so blocks compose by threading that one name through
 * {@code case} arms and {@code list.fold} accumulators.
 *
 * <p>Multi-line fragments are returned as lists of lines without trailing newlines.
 * Indentation is only ever prefixed to a line, never inserted after a newline that is
 * part of a text literal, so literal content survives nesting unchanged.
 */
final class GleamSyntax {

    static final String INDENT = "    ";

    // Builder type and modules
    static final String BUILDER_TYPE = "StringBuilder";
    static final String BUILDER_IMPORT = "import gleam/string_builder.{type StringBuilder}";
    static final String LIST_IMPORT = "import gleam/list";

    // Builder operations
    private static final String BUILDER_VAR = "builder";
    private static final String BIND_BUILDER = "let builder = ";
    private static final String EMPTY_BUILDER = "string_builder.from_string(\"\")";
    private static final String APPEND = "string_builder.append(builder, ";
    private static final String APPEND_BUILDER = "string_builder.append_builder(builder, ";
    private static final String TO_STRING = "string_builder.to_string";

    // Entry points generated for renderable documents
    static final String RENDER_BUILDER_FUNCTION = "render_builder";
    static final String RENDER_FUNCTION = "render";

    private GleamSyntax() {
        // Utility class
    }

    static String header(String generatorName, String sourceFileName) {
        return "// DO NOT EDIT: Code generated by " + generatorName + " from " + sourceFileName;
    }

    static String importLine(String path) {
        return "import " + path;
    }

    static String appendText(String text) {
        return BIND_BUILDER + APPEND + "\"" + escape(text) + "\")";
    }

    static String appendExpression(String code) {
        return BIND_BUILDER + APPEND + code + ")";
    }

    static String appendBuilder(String code) {
        return BIND_BUILDER + APPEND_BUILDER + code + ")";
    }

    /**
     * Two-armed {@code case} on a boolean; each arm runs its statements and yields the builder.
     */
    static List<String> conditional(String condition, List<String> thenLines, List<String> elseLines) {
        List<String> lines = new ArrayList<>();
        lines.add(BIND_BUILDER + "case " + condition + " {");
        lines.addAll(indent(arm("True", thenLines)));
        lines.addAll(indent(arm("False", elseLines)));
        lines.add("}");
        return lines;
    }

    /**
     * {@code list.fold} over the collection with the builder as accumulator.
     */
    static List<String> fold(String collection, String itemName, Optional<String> itemType, List<String> bodyLines) {
        String binding = itemName + itemType.map(type -> ": " + type).orElse("");
        List<String> lines = new ArrayList<>();
        lines.add(BIND_BUILDER + "list.fold(" + collection + ", builder, fn(builder, " + binding + ") {");
        lines.addAll(indent(bodyLines));
        lines.add(INDENT + BUILDER_VAR);
        lines.add("})");
        return lines;
    }

    /**
     * Complete function returning a fresh builder filled by {@code bodyLines}.
     */
    static String function(Visibility visibility, String signatureHead, List<String> bodyLines) {
        String prefix = visibility == Visibility.PUBLIC ? "pub fn " : "fn ";
        return builderFunction(prefix + signatureHead + " -> " + BUILDER_TYPE, bodyLines);
    }

    static String renderBuilderFunction(List<TypedParam> params, List<String> bodyLines) {
        String signature = "pub fn " + RENDER_BUILDER_FUNCTION + "(" + parameterList(params) + ") -> " + BUILDER_TYPE;
        return builderFunction(signature, bodyLines);
    }

    static String renderFunction(List<TypedParam> params) {
        return "pub fn " + RENDER_FUNCTION + "(" + parameterList(params) + ") -> String {\n"
            + INDENT + TO_STRING + "(" + RENDER_BUILDER_FUNCTION + "(" + argumentList(params) + "))\n"
            + "}";
    }

    /**
     * Labeled parameters, {@code name name: Type}, in declaration order.
     */
    static String parameterList(List<TypedParam> params) {
        return params.stream()
            .map(param -> param.name() + " " + param.name() + ": " + param.typeName())
            .collect(Collectors.joining(", "));
    }

    /**
     * Labeled call arguments, {@code name: name}, matching {@link #parameterList(List)}.
     */
    static String argumentList(List<TypedParam> params) {
        return params.stream()
            .map(param -> param.name() + ": " + param.name())
            .collect(Collectors.joining(", "));
    }

    /**
     * Escapes double quotes for a Gleam string literal. No other character is touched.
     */
    static String escape(String text) {
        return text.replace("\"", "\\\"");
    }

    static List<String> indent(List<String> lines) {
        return lines.stream()
            .map(line -> INDENT + line)
            .toList();
    }

    private static List<String> arm(String pattern, List<String> bodyLines) {
        List<String> lines = new ArrayList<>();
        lines.add(pattern + " -> {");
        lines.addAll(indent(bodyLines));
        lines.add(INDENT + BUILDER_VAR);
        lines.add("}");
        return lines;
    }

    private static String builderFunction(String signature, List<String> bodyLines) {
        List<String> lines = new ArrayList<>();
        lines.add(signature + " {");
        lines.add(INDENT + BIND_BUILDER + EMPTY_BUILDER);
        lines.addAll(indent(bodyLines));
        lines.add(INDENT + BUILDER_VAR);
        lines.add("}");
        return String.join("\n", lines);
    }
}
