package com.costsheet.core.workbook;

import com.costsheet.core.model.EquipmentKind;

import java.util.Objects;

/**
 * A satellite sheet placed for an area (or, for item-scoped kinds, an item).
 *
 * @param kind equipment kind
 * @param levelIndex 0-based level position
 * @param areaNumber 1-based area number across the project
 * @param reference item reference for item-scoped sheets, null otherwise
 * @param name final sheet name
 */
public record PlacedSheet(
    EquipmentKind kind,
    int levelIndex,
    int areaNumber,
    String reference,
    String name
) {
    public PlacedSheet {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }
}
