package com.costsheet.core.model;

import java.math.BigDecimal;

/**
 * One entry of an item's options bag.
 *
 * @param price option base price before shared-cost distribution
 * @param system optional system or model label (fire suppression system type, SDU model)
 * @param quantity optional quantity such as tank count; null when not yet specified
 */
public record ItemOption(
    BigDecimal price,
    String system,
    Integer quantity
) {
    public ItemOption {
        if (price == null) {
            price = BigDecimal.ZERO;
        }
    }

    public static ItemOption priced(BigDecimal price) {
        return new ItemOption(price, null, null);
    }

    /**
     * Quantity used in sums, with an unspecified quantity counting as zero.
     *
     * @return quantity or zero
     */
    public int quantityOrZero() {
        return quantity == null ? 0 : quantity;
    }
}
