package com.stencil.cli;

import com.stencil.core.config.CompilerConfig;
import com.stencil.core.config.ConfigLoader;
import com.stencil.core.io.NodeTreeReader;
import com.stencil.core.model.TemplateDocument;
import com.stencil.core.output.GeneratedFile;
import com.stencil.core.output.GeneratedOutput;
import com.stencil.core.output.OutputContext;
import com.stencil.core.output.OutputWriter;
import com.stencil.core.renderer.TemplateRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to compile node-tree documents into Gleam modules.
 *
 * <p>Compilation is all-or-nothing: if any input fails to read or render, nothing is written.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Compile a directory of trees using stencil.yaml
 * stencil compile templates
 *
 * # Override output directory and writer
 * stencil compile greeting.tree.json -o src/views -w console
 * }</pre>
 */
@Command(
    name = "compile",
    description = "Compile node-tree documents into Gleam render functions",
    mixinStandardHelpOptions = true
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @Parameters(
        arity = "1..*",
        description = "Node-tree files or directories to compile"
    )
    private List<Path> inputs;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: stencil.yaml)"
    )
    private Path configPath = Paths.get("stencil.yaml");

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"-w", "--writer"},
        description = "Output writer ID (overrides config)"
    )
    private String writerId;

    @Option(
        names = {"--generator"},
        description = "Generator name written to file headers (overrides config)"
    )
    private String generatorName;

    @Option(
        names = {"--dry-run"},
        description = "Render everything but don't write output"
    )
    private boolean dryRun;

    @Override
    public Integer call() {
        try {
            CompilerConfig config = ConfigLoader.load(configPath);
            List<TreeFiles.TreeFile> treeFiles = TreeFiles.expand(inputs, configPath);
            log.info("Compiling {} node-tree files", treeFiles.size());

            if (treeFiles.isEmpty()) {
                System.err.println("✗ No node-tree files found");
                return 1;
            }

            GeneratedOutput output = compileAll(treeFiles, config);
            if (output == null) {
                System.err.println("✗ Compilation failed, nothing was written");
                return 1;
            }
            System.out.println("✓ Compiled " + output.files().size() + " templates");

            if (dryRun) {
                System.out.println("Dry run: no output written");
                return 0;
            }

            OutputWriter writer = findWriter(resolveWriterId(config));
            OutputContext context = new OutputContext(resolveOutputDirectory(config), config.output().settings());
            log.info("Writing output with: {}", writer.getId());
            writer.write(output, context);

            System.out.println("✓ Wrote output with " + writer.getId() + " writer to: " + context.outputDirectory());
            return 0;

        } catch (Exception e) {
            log.error("Compile failed", e);
            System.err.println("✗ Compile failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Renders every file; returns null when any of them failed.
     */
    private GeneratedOutput compileAll(List<TreeFiles.TreeFile> treeFiles, CompilerConfig config) {
        NodeTreeReader reader = new NodeTreeReader();
        TemplateRenderer renderer = new TemplateRenderer();
        String generator = generatorName != null ? generatorName : config.generator().name();
        String extension = config.output().extension();

        List<GeneratedFile> files = new ArrayList<>();
        int failures = 0;

        for (TreeFiles.TreeFile treeFile : treeFiles) {
            try {
                TemplateDocument document = reader.read(treeFile.file());
                String source = renderer.render(document, generator);
                files.add(new GeneratedFile(treeFile.outputPath(extension), source, document.sourceFileName()));
                log.debug("Compiled {} -> {}", treeFile.file(), treeFile.outputPath(extension));
            } catch (Exception e) {
                failures++;
                log.error("Failed to compile {}: {}", treeFile.file(), e.getMessage());
                System.err.println("✗ " + treeFile.file() + ": " + e.getMessage());
            }
        }

        return failures == 0 ? new GeneratedOutput(files) : null;
    }

    private String resolveWriterId(CompilerConfig config) {
        return writerId != null ? writerId : config.output().writer();
    }

    private String resolveOutputDirectory(CompilerConfig config) {
        Path directory = outputDir != null ? outputDir : Paths.get(config.output().directory());
        return directory.toAbsolutePath().toString();
    }

    private OutputWriter findWriter(String id) {
        log.debug("Discovering output writers via ServiceLoader");
        List<String> available = new ArrayList<>();
        for (OutputWriter writer : ServiceLoader.load(OutputWriter.class)) {
            if (writer.getId().equals(id)) {
                return writer;
            }
            available.add(writer.getId());
        }
        throw new IllegalArgumentException("Unknown writer '" + id + "', available: " + available);
    }
}
