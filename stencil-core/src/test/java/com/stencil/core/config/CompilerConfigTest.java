package com.stencil.core.config;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link CompilerConfig}.
 */
class CompilerConfigTest {

    @Test
    void defaults_useDocumentedValues() {
        CompilerConfig config = CompilerConfig.defaults();

        assertThat(config.generator().name()).isEqualTo("stencil");
        assertThat(config.output().directory()).isEqualTo("./generated");
        assertThat(config.output().extension()).isEqualTo("gleam");
        assertThat(config.output().writer()).isEqualTo("filesystem");
    }

    @Test
    void outputSettings_withBlankValues_fallsBackToDefaults() {
        CompilerConfig.OutputSettings output = new CompilerConfig.OutputSettings(" ", "", null, null);

        assertThat(output.directory()).isEqualTo(CompilerConfig.DEFAULT_OUTPUT_DIRECTORY);
        assertThat(output.extension()).isEqualTo(CompilerConfig.DEFAULT_EXTENSION);
        assertThat(output.writer()).isEqualTo(CompilerConfig.DEFAULT_WRITER);
    }

    @Test
    void outputSettings_copiesSettings() {
        Map<String, String> settings = new HashMap<>(Map.of("console.colors", "false"));
        CompilerConfig.OutputSettings output = new CompilerConfig.OutputSettings(null, "txt", null, settings);

        settings.put("console.separator", "*");

        assertThat(output.settings()).containsOnlyKeys("console.colors");
        assertThat(output.extension()).isEqualTo("txt");
    }
}
