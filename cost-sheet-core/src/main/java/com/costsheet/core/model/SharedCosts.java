package com.costsheet.core.model;

import java.math.BigDecimal;

/**
 * Delivery and commissioning amounts attached to a scope (area or level) for one
 * equipment kind.
 *
 * @param delivery delivery and installation pool, zero when absent
 * @param commissioning commissioning pool, zero when absent
 */
public record SharedCosts(
    BigDecimal delivery,
    BigDecimal commissioning
) {
    public static final SharedCosts NONE = new SharedCosts(BigDecimal.ZERO, BigDecimal.ZERO);

    public SharedCosts {
        if (delivery == null) {
            delivery = BigDecimal.ZERO;
        }
        if (commissioning == null) {
            commissioning = BigDecimal.ZERO;
        }
    }

    public BigDecimal amount(CostPool pool) {
        return switch (pool) {
            case DELIVERY -> delivery;
            case COMMISSIONING -> commissioning;
        };
    }

    public boolean hasAny() {
        return delivery.signum() != 0 || commissioning.signum() != 0;
    }
}
