package com.costsheet.core.exception;

/**
 * Root of the cost sheet exception hierarchy.
 */
public class CostSheetException extends RuntimeException {

    public CostSheetException(String message) {
        super(message);
    }

    public CostSheetException(String message, Throwable cause) {
        super(message, cause);
    }
}
