package com.stencil.cli;

import com.stencil.core.io.NodeTreeReader;
import com.stencil.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Expands command-line inputs into node-tree files.
 */
final class TreeFiles {

    private static final Logger log = LoggerFactory.getLogger(TreeFiles.class);

    private static final String TREE_GLOB = "**.{json,yaml,yml}";
    private static final List<String> CONFIG_FILE_NAMES = List.of("stencil.yaml", "stencil.yml");

    private TreeFiles() {
        // Utility class
    }

    /**
     * A node-tree file and the directory its output path is relative to.
     *
     * @param file node-tree file
     * @param baseDirectory directory input the file was found under, or its parent for file inputs
     */
    record TreeFile(Path file, Path baseDirectory) {

        /**
         * Output path for the generated source, mirroring the file's place below its input directory.
         */
        String outputPath(String extension) {
            String name = FileUtils.outputFileName(file, extension);
            Path parent = baseDirectory.relativize(file).getParent();
            return parent == null ? name : parent.resolve(name).toString().replace('\\', '/');
        }
    }

    /**
     * Resolves each input to the node-tree files it denotes.
     *
     * <p>Directory searches skip compiler configuration files: any {@code stencil.yaml} or
     * {@code stencil.yml}, and {@code configFile} whatever its name. Files named explicitly
     * are always kept.
     *
     * @param inputs files or directories from the command line
     * @param configFile configuration file in use, or null
     * @return files in input order, directory contents sorted
     * @throws IOException if a directory cannot be walked
     * @throws IllegalArgumentException if an input does not exist
     */
    static List<TreeFile> expand(List<Path> inputs, Path configFile) throws IOException {
        Path excluded = configFile == null ? null : configFile.toAbsolutePath().normalize();
        List<TreeFile> files = new ArrayList<>();
        for (Path input : inputs) {
            if (FileUtils.isDirectory(input)) {
                for (Path file : FileUtils.findFiles(input, TREE_GLOB)) {
                    if (isConfigFile(file, excluded)) {
                        log.debug("Skipping configuration file: {}", file);
                    } else if (NodeTreeReader.isNodeTreeFile(file)) {
                        files.add(new TreeFile(file, input));
                    }
                }
            } else if (Files.isRegularFile(input)) {
                Path parent = input.toAbsolutePath().getParent();
                files.add(new TreeFile(input.toAbsolutePath(), parent));
            } else {
                throw new IllegalArgumentException("Input not found: " + input);
            }
        }
        return files;
    }

    private static boolean isConfigFile(Path file, Path excluded) {
        if (CONFIG_FILE_NAMES.contains(file.getFileName().toString())) {
            return true;
        }
        return excluded != null && file.toAbsolutePath().normalize().equals(excluded);
    }
}
