package com.costsheet.core.model;

/**
 * Summary bucket an {@link EquipmentKind} rolls up into on the area subtotal.
 */
public enum KindCategory {
    /** Canopies and other main units */
    MAIN_UNITS,
    /** Wall cladding panels */
    CLADDING,
    /** Fire suppression tanks and pipework */
    FIRE_SUPPRESSION,
    /** UV-C control, SDUs, RecoAir, Reactaway */
    ANCILLARY
}
