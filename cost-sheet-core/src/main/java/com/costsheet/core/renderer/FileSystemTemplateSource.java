package com.costsheet.core.renderer;

import com.costsheet.core.exception.TemplateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads templates from a directory. Identifiers resolving outside the directory are
 * treated as not found.
 */
public class FileSystemTemplateSource implements TemplateSource {

    private static final Logger log = LoggerFactory.getLogger(FileSystemTemplateSource.class);

    private final Path directory;

    public FileSystemTemplateSource(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null").toAbsolutePath().normalize();
    }

    @Override
    public byte[] fetch(String templateId) {
        Objects.requireNonNull(templateId, "templateId must not be null");
        Path file = directory.resolve(templateId).normalize();
        if (!file.startsWith(directory) || !Files.isRegularFile(file)) {
            throw TemplateException.notFound(templateId);
        }
        try {
            log.debug("Loaded template from file: {}", file);
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new TemplateException(TemplateException.Reason.NOT_FOUND, templateId,
                "Failed to read template file: " + file, e);
        }
    }
}
