package com.costsheet.core.renderer;

import com.costsheet.core.document.DocumentContext;
import com.costsheet.core.exception.TemplateException;
import com.deepoove.poi.XWPFTemplate;
import com.deepoove.poi.config.Configure;
import com.deepoove.poi.config.ConfigureBuilder;
import com.deepoove.poi.plugin.table.LoopRowTableRenderPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Objects;

/**
 * Word (.docx) template renderer backed by poi-tl.
 *
 * <p>Tag syntax:
 * <ul>
 *   <li>{@code {{key}}} - scalar variable, in the body, tables, headers and footers</li>
 *   <li>{@code {{list}}[field]} - placed in a table row, repeats that row once per record
 *       of one of the {@link DocumentContext#TABLE_LISTS}; the row is dropped when the list
 *       is empty</li>
 *   <li>{@code {{?flag}} ... {{/flag}}} - the enclosed paragraphs and tables are kept only
 *       when {@code flag} is true; over a list they repeat once per record</li>
 * </ul>
 * Unknown variables render as empty text.
 */
public class DocxTemplateRenderer implements TemplateRenderer {

    private static final Logger log = LoggerFactory.getLogger(DocxTemplateRenderer.class);

    private final TemplateSource source;

    public DocxTemplateRenderer(TemplateSource source) {
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public byte[] render(String templateId, DocumentContext context) {
        Objects.requireNonNull(context, "context must not be null");
        byte[] template = source.fetch(templateId);
        log.info("Rendering template: {}", templateId);

        try (XWPFTemplate document = XWPFTemplate.compile(new ByteArrayInputStream(template), configure());
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            document.render(context.values());
            document.write(out);
            log.debug("Rendered {} ({} bytes)", templateId, out.size());
            return out.toByteArray();
        } catch (IOException | RuntimeException e) {
            throw new TemplateException(TemplateException.Reason.RENDER_ERROR, templateId,
                "Failed to render template " + templateId + ": " + e.getMessage(), e);
        }
    }

    private static Configure configure() {
        LoopRowTableRenderPolicy rows = new LoopRowTableRenderPolicy(true);
        ConfigureBuilder builder = Configure.builder();
        DocumentContext.TABLE_LISTS.forEach(key -> builder.bind(key, rows));
        return builder.build();
    }
}
