package com.costsheet.core.exception;

import com.costsheet.core.model.EquipmentKind;

/**
 * Thrown when the template workbook has fewer slot sheets of a kind than the project needs.
 */
public class SheetPoolExhaustedException extends CostSheetException {

    private final EquipmentKind kind;
    private final int requested;
    private final int available;

    public SheetPoolExhaustedException(EquipmentKind kind, int requested, int available) {
        super(String.format("Template has %d %s sheet(s) but %d are needed", available, kind.sheetPrefix(), requested));
        this.kind = kind;
        this.requested = requested;
        this.available = available;
    }

    public EquipmentKind getKind() {
        return kind;
    }

    public int getRequested() {
        return requested;
    }

    public int getAvailable() {
        return available;
    }
}
