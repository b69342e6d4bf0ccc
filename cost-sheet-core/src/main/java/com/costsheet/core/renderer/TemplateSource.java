package com.costsheet.core.renderer;

import com.costsheet.core.exception.TemplateException;

/**
 * Supplies template bytes by identifier.
 */
public interface TemplateSource {

    /**
     * Fetches a template.
     *
     * @param templateId template identifier, e.g. {@code "quotation.docx"}
     * @return template bytes
     * @throws TemplateException with reason {@code NOT_FOUND} if no such template exists
     */
    byte[] fetch(String templateId);
}
