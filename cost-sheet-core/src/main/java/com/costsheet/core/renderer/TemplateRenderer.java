package com.costsheet.core.renderer;

import com.costsheet.core.document.DocumentContext;
import com.costsheet.core.exception.TemplateException;

/**
 * Renders a named document template against a variable namespace.
 */
public interface TemplateRenderer {

    /**
     * Renders a template.
     *
     * @param templateId template identifier resolved by the renderer's template source
     * @param context variables
     * @return rendered document bytes
     * @throws TemplateException with reason {@code NOT_FOUND} when the template does not exist,
     *         {@code RENDER_ERROR} when it cannot be rendered
     */
    byte[] render(String templateId, DocumentContext context);
}
