package com.costsheet.core.service;

import com.costsheet.core.aggregate.PricingSummary;
import com.costsheet.core.exception.ValidationIssue;
import com.costsheet.core.model.Project;
import com.costsheet.core.renderer.GeneratedFile;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a {@link CostSheetService} call.
 *
 * @param success whether the call completed
 * @param project project the call worked on, null if it could not be obtained
 * @param summary pricing summary, null if pricing did not run
 * @param artifacts produced files, each already carrying its output file name
 * @param warnings non-fatal issues (pricing anomalies, reader warnings)
 * @param failure failure details, null on success
 * @param issues validation issues behind a validation failure
 */
public record GenerationResult(
    boolean success,
    Project project,
    PricingSummary summary,
    List<GeneratedFile> artifacts,
    List<String> warnings,
    GenerationFailure failure,
    List<ValidationIssue> issues
) {
    /**
     * Compact constructor with validation.
     */
    public GenerationResult {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        issues = issues == null ? List.of() : List.copyOf(issues);
        if (!success && failure == null) {
            throw new IllegalArgumentException("A failed result needs a failure");
        }
    }

    public static GenerationResult succeeded(Project project, PricingSummary summary,
                                             List<GeneratedFile> artifacts, List<String> warnings) {
        return new GenerationResult(true, project, summary, artifacts, warnings, null, List.of());
    }

    /**
     * Creates a failed result.
     *
     * @param project project, if it was obtained before the failure
     * @param failure failure details
     * @param issues validation issues, empty unless validation failed
     * @return failed result
     */
    public static GenerationResult failed(Project project, GenerationFailure failure, List<ValidationIssue> issues) {
        return new GenerationResult(false, project, null, List.of(), List.of(), failure, issues);
    }

    /**
     * The single artifact of the call (cost sheet, quotation or bundle).
     *
     * @return first artifact, empty when nothing was produced
     */
    public Optional<GeneratedFile> artifact() {
        return artifacts.isEmpty() ? Optional.empty() : Optional.of(artifacts.get(0));
    }
}
