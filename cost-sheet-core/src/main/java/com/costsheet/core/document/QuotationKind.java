package com.costsheet.core.document;

import java.util.Arrays;
import java.util.List;

/**
 * Quotation documents a project can produce.
 */
public enum QuotationKind {
    MAIN("Quotation", "quotation.docx"),
    RECOAIR("RecoAir Quotation", "recoair-quotation.docx");

    private final String artifactKind;
    private final String defaultTemplateId;

    QuotationKind(String artifactKind, String defaultTemplateId) {
        this.artifactKind = artifactKind;
        this.defaultTemplateId = defaultTemplateId;
    }

    /**
     * Artifact kind used in output file names.
     *
     * @return e.g. {@code "RecoAir Quotation"}
     */
    public String artifactKind() {
        return artifactKind;
    }

    public String defaultTemplateId() {
        return defaultTemplateId;
    }

    /**
     * Quotations produced for a context, in declaration order. May be empty.
     */
    public static List<QuotationKind> applicableTo(DocumentContext context) {
        return Arrays.stream(values()).filter(kind -> kind.appliesTo(context)).toList();
    }

    /**
     * Whether this quotation is produced for a context.
     *
     * <p>The RecoAir quotation is produced when any RecoAir unit is present. The main
     * quotation is produced unless the project is RecoAir only.
     *
     * @param context document context
     * @return true if applicable
     */
    public boolean appliesTo(DocumentContext context) {
        return switch (this) {
            case MAIN -> !context.flag(DocumentContext.RECOAIR_ONLY);
            case RECOAIR -> context.flag(DocumentContext.HAS_RECOAIR);
        };
    }
}
