package com.costsheet.core.pricing;

/**
 * How a shared cost pool of one equipment kind reaches the totals.
 */
public enum DistributionMode {
    /** Divided among the items carrying the kind */
    ABSORBED,
    /** Shown as its own subtotal line */
    EXPLICIT_ROW
}
