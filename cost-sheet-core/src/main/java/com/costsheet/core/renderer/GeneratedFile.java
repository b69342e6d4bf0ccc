package com.costsheet.core.renderer;

import java.util.Objects;

/**
 * A generated artifact.
 *
 * @param relativePath file name relative to the output directory, e.g. {@code "1234 Cost Sheet 15012025.xlsx"}
 * @param content file bytes
 * @param contentType MIME type
 */
public record GeneratedFile(
    String relativePath,
    byte[] content,
    String contentType
) {
    public static final String XLSX = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";
    public static final String DOCX = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
    public static final String ZIP = "application/zip";

    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public int size() {
        return content.length;
    }
}
