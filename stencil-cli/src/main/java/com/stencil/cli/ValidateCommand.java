package com.stencil.cli;

import com.stencil.core.io.NodeTreeReader;
import com.stencil.core.model.TemplateDocument;
import com.stencil.core.model.TemplateSummary;
import com.stencil.core.renderer.TemplateRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to check node-tree documents without writing output.
 *
 * <p>Each file is read and rendered; a summary is printed for valid files and the error for
 * invalid ones.
 */
@Command(
    name = "validate",
    description = "Check that node-tree documents read and render",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    private static final String GENERATOR_NAME = "stencil";

    @Parameters(
        arity = "1..*",
        description = "Node-tree files or directories to validate"
    )
    private List<Path> inputs;

    @Override
    public Integer call() {
        List<TreeFiles.TreeFile> treeFiles;
        try {
            treeFiles = TreeFiles.expand(inputs, null);
        } catch (Exception e) {
            log.error("Validation failed", e);
            System.err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }

        NodeTreeReader reader = new NodeTreeReader();
        TemplateRenderer renderer = new TemplateRenderer();
        int failures = 0;

        for (TreeFiles.TreeFile treeFile : treeFiles) {
            try {
                TemplateDocument document = reader.read(treeFile.file());
                renderer.render(document, GENERATOR_NAME);
                System.out.println("✓ " + treeFile.file() + ": " + TemplateSummary.of(document.nodes()));
            } catch (Exception e) {
                failures++;
                log.error("Invalid node tree {}: {}", treeFile.file(), e.getMessage());
                System.err.println("✗ " + treeFile.file() + ": " + e.getMessage());
            }
        }

        System.out.println();
        System.out.println("Validated " + treeFiles.size() + " files, " + failures + " invalid");
        return failures == 0 ? 0 : 1;
    }
}
