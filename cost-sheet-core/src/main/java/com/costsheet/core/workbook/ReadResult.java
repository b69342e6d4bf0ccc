package com.costsheet.core.workbook;

import com.costsheet.core.aggregate.PricingSummary;
import com.costsheet.core.model.Project;

import java.util.Objects;

/**
 * Project recovered from a workbook, repriced.
 *
 * @param project recovered project tree
 * @param summary pricing summary of the recovered project
 * @param report skipped sheets and warnings
 */
public record ReadResult(
    Project project,
    PricingSummary summary,
    ReadReport report
) {
    public ReadResult {
        Objects.requireNonNull(project, "project must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        Objects.requireNonNull(report, "report must not be null");
    }
}
