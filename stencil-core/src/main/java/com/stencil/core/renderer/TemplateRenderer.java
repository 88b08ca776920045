package com.stencil.core.renderer;

import com.stencil.core.model.Node;
import com.stencil.core.model.TemplateDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Turns a parsed template into a Gleam module exposing it as render functions.
 *
 * <p>The generated module contains, in this order:
 * <ol>
 *   <li>a {@code DO NOT EDIT} header naming the generator and the template file</li>
 *   <li>the {@code StringBuilder} import, {@code gleam/list} when any loop is present, and
 *       the template's own imports in document order (duplicates are kept)</li>
 *   <li>functions defined in the template, separated by blank lines</li>
 *   <li>{@code render_builder} and {@code render}, taking the declared parameters as labeled
 *       arguments, when the document has top-level content</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<Node> nodes = List.of(
 *     new ParamDeclarationNode("name", new SourceRange(8, 12), "String"),
 *     new TextNode("Hello "),
 *     new ExpressionNode("name"));
 *
 * String source = new TemplateRenderer().render(nodes, "stencil", "greeting.gleamx");
 * }</pre>
 *
 * <p>Rendering is deterministic and all-or-nothing: the same input always yields the same
 * text, and an error leaves no partial output. Instances hold no state and may be shared.
 */
public class TemplateRenderer {

    private static final Logger log = LoggerFactory.getLogger(TemplateRenderer.class);

    private final ScopeRenderer scopeRenderer = new ScopeRenderer();

    /**
     * Renders a template document.
     *
     * @param document parsed template and its file name
     * @param generatorName name of the generating program, written to the header
     * @return complete Gleam source
     * @throws RenderException if the tree contains a duplicate or misplaced declaration
     */
    public String render(TemplateDocument document, String generatorName) {
        Objects.requireNonNull(document, "document must not be null");
        return render(document.nodes(), generatorName, document.sourceFileName());
    }

    /**
     * Renders a node tree.
     *
     * @param nodes top-level nodes in document order
     * @param generatorName name of the generating program, written to the header
     * @param sourceFileName originating template file, written to the header
     * @return complete Gleam source
     * @throws RenderException if the tree contains a duplicate or misplaced declaration
     */
    public String render(List<Node> nodes, String generatorName, String sourceFileName) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        Objects.requireNonNull(generatorName, "generatorName must not be null");
        Objects.requireNonNull(sourceFileName, "sourceFileName must not be null");

        log.debug("Rendering {} top-level nodes from {}", nodes.size(), sourceFileName);

        ScopeResult document = scopeRenderer.render(nodes, ScopeKind.DOCUMENT);
        String source = assemble(document, generatorName, sourceFileName);

        log.debug("Rendered {}: {} params, {} functions, {} chars",
            sourceFileName, document.declaredParams().size(), document.generatedFunctions().size(), source.length());
        return source;
    }

    private String assemble(ScopeResult document, String generatorName, String sourceFileName) {
        StringBuilder sb = new StringBuilder();
        sb.append(GleamSyntax.header(generatorName, sourceFileName)).append("\n\n");

        appendImports(sb, document);

        if (!document.generatedFunctions().isEmpty()) {
            sb.append('\n');
            sb.append(String.join("\n\n", document.generatedFunctions())).append('\n');
        }

        // Documents holding only function definitions have nothing to render themselves
        if (document.hasRenderableContent()) {
            sb.append('\n');
            sb.append(GleamSyntax.renderBuilderFunction(document.declaredParams(), document.emittedStatements()));
            sb.append("\n\n");
            sb.append(GleamSyntax.renderFunction(document.declaredParams())).append('\n');
        }

        return sb.toString();
    }

    private void appendImports(StringBuilder sb, ScopeResult document) {
        sb.append(GleamSyntax.BUILDER_IMPORT).append('\n');
        if (document.usesLoopConstruct()) {
            sb.append(GleamSyntax.LIST_IMPORT).append('\n');
        }
        for (String path : document.imports()) {
            sb.append(GleamSyntax.importLine(path)).append('\n');
        }
    }
}
