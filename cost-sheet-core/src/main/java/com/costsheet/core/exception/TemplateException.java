package com.costsheet.core.exception;

/**
 * Thrown by template sources and renderers.
 */
public class TemplateException extends CostSheetException {

    /**
     * Failure reason.
     */
    public enum Reason {
        NOT_FOUND,
        RENDER_ERROR
    }

    private final Reason reason;
    private final String templateId;

    public TemplateException(Reason reason, String templateId, String message) {
        super(message);
        this.reason = reason;
        this.templateId = templateId;
    }

    public TemplateException(Reason reason, String templateId, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.templateId = templateId;
    }

    public static TemplateException notFound(String templateId) {
        return new TemplateException(Reason.NOT_FOUND, templateId, "Template not found: " + templateId);
    }

    public Reason getReason() {
        return reason;
    }

    public String getTemplateId() {
        return templateId;
    }
}
