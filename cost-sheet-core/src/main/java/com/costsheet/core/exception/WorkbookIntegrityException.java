package com.costsheet.core.exception;

import java.util.List;

/**
 * Thrown when a synthesized workbook fails its post-write integrity check.
 */
public class WorkbookIntegrityException extends CostSheetException {

    private final List<String> violations;

    public WorkbookIntegrityException(List<String> violations) {
        super("Workbook integrity check failed: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
