package com.costsheet.core.exception;

import java.util.List;

/**
 * Thrown when a project fails validation, before any file is produced.
 */
public class ProjectValidationException extends CostSheetException {

    private final List<ValidationIssue> issues;

    public ProjectValidationException(List<ValidationIssue> issues) {
        super(buildMessage(issues));
        this.issues = List.copyOf(issues);
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }

    private static String buildMessage(List<ValidationIssue> issues) {
        if (issues.size() == 1) {
            return "Project is invalid: " + issues.get(0);
        }
        return "Project is invalid (" + issues.size() + " issues), first: " + issues.get(0);
    }
}
