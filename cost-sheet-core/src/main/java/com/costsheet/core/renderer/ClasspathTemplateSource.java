package com.costsheet.core.renderer;

import com.costsheet.core.exception.TemplateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Loads templates bundled on the classpath under a base path.
 */
public class ClasspathTemplateSource implements TemplateSource {

    private static final Logger log = LoggerFactory.getLogger(ClasspathTemplateSource.class);

    public static final String DEFAULT_BASE_PATH = "templates/";

    private final String basePath;
    private final ClassLoader classLoader;

    public ClasspathTemplateSource() {
        this(DEFAULT_BASE_PATH);
    }

    public ClasspathTemplateSource(String basePath) {
        Objects.requireNonNull(basePath, "basePath must not be null");
        this.basePath = basePath.isEmpty() || basePath.endsWith("/") ? basePath : basePath + "/";
        this.classLoader = ClasspathTemplateSource.class.getClassLoader();
    }

    @Override
    public byte[] fetch(String templateId) {
        Objects.requireNonNull(templateId, "templateId must not be null");
        String resource = basePath + templateId;
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw TemplateException.notFound(templateId);
            }
            log.debug("Loaded template from classpath: {}", resource);
            return in.readAllBytes();
        } catch (IOException e) {
            throw new TemplateException(TemplateException.Reason.NOT_FOUND, templateId,
                "Failed to read template from classpath: " + resource, e);
        }
    }
}
