package com.stencil.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Root configuration for Stencil compilations.
 *
 * <p>Loaded from {@code stencil.yaml}. Missing sections and fields fall back to
 * {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * generator:
 *   name: "stencil"
 *
 * output:
 *   directory: "./src/generated"
 *   extension: "gleam"
 *   writer: filesystem
 *   settings:
 *     console.colors: "false"
 * }</pre>
 *
 * @param generator generator settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompilerConfig(
    @JsonProperty("generator") GeneratorSettings generator,
    @JsonProperty("output") OutputSettings output
) {
    public static final String DEFAULT_GENERATOR_NAME = "stencil";
    public static final String DEFAULT_OUTPUT_DIRECTORY = "./generated";
    public static final String DEFAULT_EXTENSION = "gleam";
    public static final String DEFAULT_WRITER = "filesystem";

    /**
     * Compact constructor filling absent sections with defaults.
     */
    public CompilerConfig {
        if (generator == null) {
            generator = new GeneratorSettings(null);
        }
        if (output == null) {
            output = new OutputSettings(null, null, null, null);
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static CompilerConfig defaults() {
        return new CompilerConfig(null, null);
    }

    /**
     * Generator settings.
     *
     * @param name generator name written to the header of every generated file
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GeneratorSettings(
        @JsonProperty("name") String name
    ) {
        public GeneratorSettings {
            if (name == null || name.isBlank()) {
                name = DEFAULT_GENERATOR_NAME;
            }
        }
    }

    /**
     * Output settings.
     *
     * @param directory directory generated files are written to
     * @param extension extension of generated files, without leading dot
     * @param writer ID of the output writer to use
     * @param settings writer-specific settings
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("directory") String directory,
        @JsonProperty("extension") String extension,
        @JsonProperty("writer") String writer,
        @JsonProperty("settings") Map<String, String> settings
    ) {
        public OutputSettings {
            if (directory == null || directory.isBlank()) {
                directory = DEFAULT_OUTPUT_DIRECTORY;
            }
            if (extension == null || extension.isBlank()) {
                extension = DEFAULT_EXTENSION;
            } else if (extension.startsWith(".")) {
                extension = extension.substring(1);
            }
            if (writer == null || writer.isBlank()) {
                writer = DEFAULT_WRITER;
            }
            settings = settings == null ? Map.of() : Map.copyOf(settings);
        }
    }
}
