package com.costsheet.core.workbook;

import java.util.List;

/**
 * What the reader could not take from a workbook.
 *
 * @param fromProjectData true when the structure came from the hidden {@code ProjectData}
 *                        sheet, false when it was inferred from sheet names and titles
 * @param skipped sheets that were ignored, with the reason
 * @param warnings inconsistencies that did not stop reading
 */
public record ReadReport(
    boolean fromProjectData,
    List<SkippedSheet> skipped,
    List<String> warnings
) {
    public ReadReport {
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean hasProblems() {
        return !skipped.isEmpty() || !warnings.isEmpty();
    }

    /**
     * A sheet the reader ignored.
     *
     * @param sheetName sheet name
     * @param reason why it was skipped
     */
    public record SkippedSheet(String sheetName, String reason) {}
}
