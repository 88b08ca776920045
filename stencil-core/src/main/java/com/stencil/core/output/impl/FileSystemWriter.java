package com.stencil.core.output.impl;

import com.stencil.core.output.GeneratedFile;
import com.stencil.core.output.GeneratedOutput;
import com.stencil.core.output.OutputContext;
import com.stencil.core.output.OutputWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writer that stores generated files on the filesystem.
 *
 * <p>Creates directory structure automatically and preserves relative paths.
 * Existing files are overwritten.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * OutputContext context = new OutputContext("./src/generated", Map.of());
 *
 * GeneratedOutput output = new GeneratedOutput(List.of(
 *     new GeneratedFile("views/greeting.gleam", source, "greeting.gleamx")
 * ));
 *
 * new FileSystemWriter().write(output, context);
 * // Creates: ./src/generated/views/greeting.gleam
 * }</pre>
 */
public class FileSystemWriter implements OutputWriter {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemWriter.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public String getDescription() {
        return "Writes generated sources below the output directory";
    }

    @Override
    public void write(GeneratedOutput output, OutputContext context) {
        Path outputDir = Paths.get(context.outputDirectory());
        logger.info("Writing {} files to filesystem at: {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }

        logger.info("Successfully wrote {} files to filesystem", output.files().size());
    }

    private void writeFile(Path outputDir, GeneratedFile file) {
        Path targetPath = outputDir.resolve(file.relativePath());
        logger.debug("Writing file: {}", targetPath);

        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }

            Files.writeString(targetPath, file.content());
            logger.info("Wrote file: {} ({} chars)", file.relativePath(), file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
