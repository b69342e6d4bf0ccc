package com.costsheet.core.model;

/**
 * Scope of the satellite sheet an {@link EquipmentKind} spawns in the cost sheet.
 */
public enum SheetScope {
    /** One sheet per area */
    AREA,
    /** One sheet per item carrying the option */
    ITEM,
    /** Priced on the parent canopy sheet, no sheet of its own */
    NONE
}
