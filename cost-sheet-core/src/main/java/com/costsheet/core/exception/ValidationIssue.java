package com.costsheet.core.exception;

import java.util.Objects;

/**
 * One problem found while validating a project.
 *
 * @param path location in the project tree, e.g. {@code levels[0].areas[1].items[2]}
 * @param rule rule identifier, e.g. {@code duplicate-reference}
 * @param message human-readable description
 */
public record ValidationIssue(
    String path,
    String rule,
    String message
) {
    public ValidationIssue {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        return path + ": " + message + " [" + rule + "]";
    }
}
