package com.costsheet.core.pricing;

/**
 * Severity of a {@link PricingAnomaly}.
 */
public enum AnomalySeverity {
    INFO,
    WARNING,
    ERROR
}
