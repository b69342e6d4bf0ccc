package com.costsheet.core.renderer.impl;

import com.costsheet.core.renderer.GeneratedFile;
import com.costsheet.core.renderer.GeneratedOutput;
import com.costsheet.core.renderer.OutputRenderer;
import com.costsheet.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Renderer that writes generated files to the filesystem.
 *
 * <p>Each file is written to a temporary file next to its target and then moved into
 * place, atomically where the filesystem supports it. The temporary file is deleted on
 * every failure path, so a partial file never appears under its final name.
 *
 * <p><b>Settings:</b>
 * <ul>
 *   <li>{@code overwrite} - {@code false} refuses to replace existing files (default {@code true})</li>
 * </ul>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = Path.of(context.outputDirectory()).toAbsolutePath().normalize();
        boolean overwrite = Boolean.parseBoolean(context.getSettingOrDefault(RenderContext.OVERWRITE, "true"));
        logger.info("Rendering {} files to filesystem at: {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file, overwrite);
        }
        logger.info("Successfully rendered {} files to filesystem", output.files().size());
    }

    /**
     * Writes a single file through a temporary file in the target directory.
     *
     * @param outputDir base output directory
     * @param file file to write
     * @param overwrite whether an existing file may be replaced
     */
    private void writeFile(Path outputDir, GeneratedFile file, boolean overwrite) {
        Path targetPath = outputDir.resolve(file.relativePath()).normalize();
        if (!targetPath.startsWith(outputDir)) {
            throw new IllegalStateException("File path escapes the output directory: " + file.relativePath());
        }
        if (!overwrite && Files.exists(targetPath)) {
            throw new IllegalStateException("File already exists: " + targetPath);
        }
        logger.debug("Writing file: {}", targetPath);

        Path temp = null;
        try {
            Path parentDir = targetPath.getParent();
            Files.createDirectories(parentDir);
            temp = Files.createTempFile(parentDir, ".costsheet-", ".tmp");
            Files.write(temp, file.content());
            move(temp, targetPath);
            logger.info("Wrote file: {} ({} bytes)", file.relativePath(), file.size());
        } catch (IOException | RuntimeException e) {
            IllegalStateException failure = new IllegalStateException("Failed to write file: " + file.relativePath(), e);
            deleteTemp(temp, failure);
            throw failure;
        }
    }

    private static void move(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}; falling back to a plain move", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteTemp(Path temp, IllegalStateException failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
