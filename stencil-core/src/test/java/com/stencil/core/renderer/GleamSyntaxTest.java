package com.stencil.core.renderer;

import com.stencil.core.model.Visibility;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GleamSyntax}.
 */
class GleamSyntaxTest {

    @Test
    void escape_replacesOnlyDoubleQuotes() {
        assertThat(GleamSyntax.escape("a \"b\" \\n {c}")).isEqualTo("a \\\"b\\\" \\n {c}");
    }

    @Test
    void parameterList_usesLabeledParameters() {
        List<TypedParam> params = List.of(new TypedParam("name", "String"), new TypedParam("count", "Int"));

        assertThat(GleamSyntax.parameterList(params)).isEqualTo("name name: String, count count: Int");
        assertThat(GleamSyntax.argumentList(params)).isEqualTo("name: name, count: count");
    }

    @Test
    void parameterList_withNoParams_isEmpty() {
        assertThat(GleamSyntax.parameterList(List.of())).isEmpty();
        assertThat(GleamSyntax.renderFunction(List.of())).isEqualTo("""
            pub fn render() -> String {
                string_builder.to_string(render_builder())
            }""");
    }

    @Test
    void conditional_wrapsEachArmAndYieldsBuilder() {
        List<String> lines = GleamSyntax.conditional("ok", List.of("a"), List.of("b"));

        assertThat(lines).containsExactly(
            "let builder = case ok {",
            "    True -> {",
            "        a",
            "        builder",
            "    }",
            "    False -> {",
            "        b",
            "        builder",
            "    }",
            "}");
    }

    @Test
    void fold_withItemType_annotatesItem() {
        List<String> lines = GleamSyntax.fold("users", "user", Optional.of("User"), List.of("x"));

        assertThat(lines.get(0)).isEqualTo("let builder = list.fold(users, builder, fn(builder, user: User) {");
        assertThat(lines).endsWith("    builder", "})");
    }

    @Test
    void function_withPrivateVisibility_omitsPub() {
        assertThat(GleamSyntax.function(Visibility.PRIVATE, "row(x: Int)", List.of()))
            .isEqualTo("""
                fn row(x: Int) -> StringBuilder {
                    let builder = string_builder.from_string("")
                    builder
                }""");
        assertThat(GleamSyntax.function(Visibility.PUBLIC, "row()", List.of())).startsWith("pub fn row() ");
    }

    @Test
    void indent_prefixesEachLineOnly() {
        assertThat(GleamSyntax.indent(List.of("a", "b\nc"))).containsExactly("    a", "    b\nc");
    }
}
