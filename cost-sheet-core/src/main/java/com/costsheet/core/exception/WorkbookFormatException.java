package com.costsheet.core.exception;

/**
 * Thrown when bytes handed to the reader are not a workbook at all.
 */
public class WorkbookFormatException extends CostSheetException {

    public WorkbookFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
