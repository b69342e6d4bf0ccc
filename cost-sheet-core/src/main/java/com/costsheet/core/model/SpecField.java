package com.costsheet.core.model;

/**
 * Presentation-only specification fields of an {@link Item}.
 *
 * <p>None of these feed pricing. Model exception rules may mark any of them as not
 * applicable for a model family.
 */
public enum SpecField {
    LENGTH,
    WIDTH,
    HEIGHT,
    SECTIONS,
    LIGHTING,
    EXTRACT_VOLUME,
    EXTRACT_STATIC,
    SUPPLY_VOLUME,
    SUPPLY_STATIC,
    WEIGHT
}
