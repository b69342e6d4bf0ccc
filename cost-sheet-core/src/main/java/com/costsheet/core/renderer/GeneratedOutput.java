package com.costsheet.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Collection of generated artifacts to be rendered.
 *
 * @param files generated artifacts
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public static GeneratedOutput of(GeneratedFile... files) {
        return new GeneratedOutput(List.of(files));
    }
}
