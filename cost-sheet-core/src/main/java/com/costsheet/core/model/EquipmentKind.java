package com.costsheet.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Equipment kinds priced on a cost sheet.
 *
 * <p>Each kind carries the metadata the engines need: which summary category it rolls
 * into, whether and how it spawns a satellite sheet, the sheet name prefix, and the
 * feature flag key consulted before it is included in generated output.
 *
 * <p>{@link #CANOPY} is the item itself; every other kind is an option an item (or, for
 * area-scoped kinds, an area) can carry.
 */
public enum EquipmentKind {
    CANOPY("Canopy", KindCategory.MAIN_UNITS, SheetScope.AREA, "CANOPY", "canopy"),
    WALL_CLADDING("Wall Cladding", KindCategory.CLADDING, SheetScope.NONE, null, "wall-cladding"),
    FIRE_SUPPRESSION("Fire Suppression", KindCategory.FIRE_SUPPRESSION, SheetScope.AREA, "FIRE SUPP", "fire-suppression"),
    UV_C("UV-C System", KindCategory.ANCILLARY, SheetScope.AREA, "EBOX", "uv-c"),
    RECOAIR("RecoAir", KindCategory.ANCILLARY, SheetScope.AREA, "RECOAIR", "recoair"),
    REACTAWAY("Reactaway", KindCategory.ANCILLARY, SheetScope.AREA, "REACTAWAY", "reactaway"),
    SDU("SDU", KindCategory.ANCILLARY, SheetScope.ITEM, "SDU", "sdu");

    private final String label;
    private final KindCategory category;
    private final SheetScope sheetScope;
    private final String sheetPrefix;
    private final String featureKey;

    EquipmentKind(String label, KindCategory category, SheetScope sheetScope, String sheetPrefix, String featureKey) {
        this.label = label;
        this.category = category;
        this.sheetScope = sheetScope;
        this.sheetPrefix = sheetPrefix;
        this.featureKey = featureKey;
    }

    public String label() {
        return label;
    }

    public KindCategory category() {
        return category;
    }

    public SheetScope sheetScope() {
        return sheetScope;
    }

    /**
     * Prefix of the satellite sheet name, or null for kinds without a sheet.
     *
     * @return sheet prefix such as {@code "FIRE SUPP"}
     */
    public String sheetPrefix() {
        return sheetPrefix;
    }

    public String featureKey() {
        return featureKey;
    }

    /**
     * Whether this kind can appear in an item's options bag.
     *
     * @return true for every kind except {@link #CANOPY}
     */
    public boolean isItemOption() {
        return this != CANOPY;
    }

    /**
     * Whether this kind can be switched on for a whole area independently of its items.
     *
     * @return true for area-scoped ancillary systems
     */
    public boolean isAreaOption() {
        return this == UV_C || this == RECOAIR || this == REACTAWAY;
    }

    public boolean hasSheet() {
        return sheetScope != SheetScope.NONE;
    }

    /**
     * Kinds that spawn a satellite sheet, in sheet order.
     *
     * @return sheet-bearing kinds
     */
    public static List<EquipmentKind> sheetKinds() {
        return Arrays.stream(values()).filter(EquipmentKind::hasSheet).toList();
    }

    /**
     * Finds the kind whose sheet prefix starts the given sheet name.
     *
     * @param sheetName sheet name such as {@code "FIRE SUPP - Level 1 (2)"}
     * @return matching kind, if any
     */
    public static Optional<EquipmentKind> fromSheetName(String sheetName) {
        if (sheetName == null) {
            return Optional.empty();
        }
        String upper = sheetName.toUpperCase();
        return sheetKinds().stream()
            .filter(kind -> upper.startsWith(kind.sheetPrefix + " "))
            .findFirst();
    }
}
