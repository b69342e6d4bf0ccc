package com.costsheet.core.aggregate;

import com.costsheet.core.model.EquipmentKind;

import java.math.BigDecimal;

/**
 * Project-wide figures for one equipment kind.
 *
 * @param kind equipment kind
 * @param count number of items carrying the kind
 * @param quantity summed option quantity, unspecified quantities counting as zero
 * @param total sum of the kind's area subtotals
 */
public record KindRollup(
    EquipmentKind kind,
    int count,
    int quantity,
    BigDecimal total
) {
}
