package com.stencil.core.output;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link OutputContext}, {@link GeneratedOutput} and {@link GeneratedFile}.
 */
class OutputContextTest {

    @Test
    void getSettingOrDefault_returnsConfiguredValueOrDefault() {
        OutputContext context = new OutputContext("out", Map.of("console.colors", "false"));

        assertThat(context.getSettingOrDefault("console.colors", "true")).isEqualTo("false");
        assertThat(context.getSettingOrDefault("console.separator", "---")).isEqualTo("---");
    }

    @Test
    void constructor_withNullSettings_usesEmptyMap() {
        assertThat(new OutputContext("out", null).settings()).isEmpty();
    }

    @Test
    void constructor_withNullDirectory_throwsException() {
        assertThatThrownBy(() -> new OutputContext(null, Map.of()))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("outputDirectory");
    }

    @Test
    void generatedOutput_copiesFiles() {
        List<GeneratedFile> files = new ArrayList<>();
        files.add(new GeneratedFile("a.gleam", "a", "a.gleamx"));
        GeneratedOutput output = new GeneratedOutput(files);

        files.clear();

        assertThat(output.files()).hasSize(1);
        assertThatThrownBy(() -> new GeneratedFile("a.gleam", null, "a.gleamx"))
            .isInstanceOf(NullPointerException.class);
    }
}
