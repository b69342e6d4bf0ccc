package com.costsheet.core.renderer;

/**
 * Writes generated artifacts to a destination.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class FileSystemRenderer implements OutputRenderer {
 *     @Override
 *     public String getId() {
 *         return "filesystem";
 *     }
 *
 *     @Override
 *     public void render(GeneratedOutput output, RenderContext context) {
 *         Path outputDir = Path.of(context.outputDirectory());
 *         for (GeneratedFile file : output.files()) {
 *             Files.write(outputDir.resolve(file.relativePath()), file.content());
 *         }
 *     }
 * }
 * }</pre>
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * @return lowercase renderer identifier, e.g. {@code "filesystem"}
     */
    String getId();

    /**
     * Writes every file of the output.
     *
     * <p>Implementations validate required settings and throw {@link IllegalStateException}
     * if configuration is invalid or the destination cannot be written.
     *
     * @param output generated artifacts
     * @param context rendering context with configuration and settings
     * @throws IllegalStateException if an artifact cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
