package com.stencil.core.util;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds files matching a glob pattern starting from a root directory.
     *
     * <p>The pattern is matched against paths relative to {@code rootPath}. Results are
     * sorted so that callers process files in a stable order.
     *
     * @param rootPath root directory to search from
     * @param globPattern glob pattern, e.g. {@code **.json}
     * @return sorted list of matching paths
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, String globPattern) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);

        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> matcher.matches(rootPath.relativize(path)))
                .sorted()
                .toList();
        }
    }

    /**
     * Reads a file as a UTF-8 string.
     *
     * @param path path to file
     * @return file content as string
     * @throws IOException if reading fails
     */
    public static String readString(Path path) throws IOException {
        return Files.readString(path);
    }

    /**
     * Checks if a path is a directory.
     *
     * @param path path to check
     * @return true if path is a directory
     */
    public static boolean isDirectory(Path path) {
        return Files.isDirectory(path);
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }

    /**
     * Derives the generated file name for a node-tree file.
     *
     * <p>Drops the tree file's extension and a trailing {@code .tree} marker, then appends
     * {@code extension}: {@code greeting.tree.json} becomes {@code greeting.gleam}.
     *
     * @param treeFile node-tree file
     * @param extension target extension without leading dot
     * @return output file name
     */
    public static String outputFileName(Path treeFile, String extension) {
        String baseName = stripExtension(treeFile.getFileName().toString());
        if (baseName.endsWith(".tree")) {
            baseName = baseName.substring(0, baseName.length() - ".tree".length());
        }
        return baseName + "." + extension;
    }

    private static String stripExtension(String fileName) {
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }
}
