package com.costsheet.core.service;

import java.util.Objects;

/**
 * Why a service call did not produce its artifacts.
 *
 * @param stage pipeline stage that failed
 * @param subject what failed, e.g. a project number, kind or template id
 * @param rule machine-readable failure code, e.g. {@code sheet-pool-exhausted}
 * @param message human-readable description
 */
public record GenerationFailure(
    Stage stage,
    String subject,
    String rule,
    String message
) {
    /**
     * Pipeline stages.
     */
    public enum Stage {
        VALIDATION,
        PRICING,
        WORKBOOK,
        READ,
        DOCUMENT,
        RENDER
    }

    public GenerationFailure {
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (subject == null) {
            subject = "";
        }
    }

    @Override
    public String toString() {
        return stage + " failed for " + subject + ": " + message + " [" + rule + "]";
    }
}
