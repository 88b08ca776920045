package com.stencil.core.output;

/**
 * Interface for writers that deliver generated source files to a destination.
 *
 * <p>Writers are discovered via Java Service Provider Interface (SPI) and selected by
 * {@link #getId()} from configuration or the command line.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class FileSystemWriter implements OutputWriter {
 *     @Override
 *     public String getId() {
 *         return "filesystem";
 *     }
 *
 *     @Override
 *     public void write(GeneratedOutput output, OutputContext context) {
 *         Path outputDir = Paths.get(context.outputDirectory());
 *         for (GeneratedFile file : output.files()) {
 *             Files.writeString(outputDir.resolve(file.relativePath()), file.content());
 *         }
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.stencil.core.output.OutputWriter}
 *
 * @see GeneratedOutput
 * @see OutputContext
 */
public interface OutputWriter {

    /**
     * Returns unique identifier for this writer.
     *
     * <p>Used for referencing the writer in configuration. Should be lowercase
     * (e.g., "filesystem", "console").
     *
     * @return unique writer identifier
     */
    String getId();

    /**
     * Returns human-readable description for listings.
     *
     * @return description
     */
    String getDescription();

    /**
     * Writes the generated files to the target destination.
     *
     * @param output the generated files
     * @param context destination directory and writer settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void write(GeneratedOutput output, OutputContext context);
}
