package com.costsheet.core.renderer;

import com.costsheet.core.model.ProjectInfo;

import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Output file naming: {@code {number} {kind} {ddMMyyyy}[ Rev {revision}]{extension}}.
 *
 * <p>The date part is omitted when the project has no date, the revision suffix when it
 * has no revision. Characters not allowed in file names become {@code '-'}.
 */
public final class OutputFileNames {

    public static final String COST_SHEET = "Cost Sheet";
    public static final String QUOTATIONS = "Quotations";

    public static final String XLSX = ".xlsx";
    public static final String DOCX = ".docx";
    public static final String ZIP = ".zip";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("ddMMyyyy");

    private OutputFileNames() {
    }

    public static String of(ProjectInfo info, String artifactKind, String extension) {
        Objects.requireNonNull(info, "info must not be null");
        Objects.requireNonNull(artifactKind, "artifactKind must not be null");
        StringBuilder name = new StringBuilder();
        if (info.number() != null && !info.number().isBlank()) {
            name.append(info.number().trim()).append(' ');
        }
        name.append(artifactKind);
        if (info.date() != null) {
            name.append(' ').append(DATE.format(info.date()));
        }
        if (!info.revision().isBlank()) {
            name.append(" Rev ").append(info.revision().trim());
        }
        return sanitize(name.toString()) + extension;
    }

    private static String sanitize(String value) {
        return value.replaceAll("[\\\\/:*?\"<>|]", "-");
    }
}
