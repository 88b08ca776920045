package com.stencil.core.output;

import java.util.Objects;

/**
 * Represents a generated file to be written.
 *
 * @param relativePath relative path for the file (e.g., "views/greeting.gleam")
 * @param content file content
 * @param sourceFileName template the content was generated from
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String sourceFileName
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
