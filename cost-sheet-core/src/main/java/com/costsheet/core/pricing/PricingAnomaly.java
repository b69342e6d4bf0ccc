package com.costsheet.core.pricing;

import com.costsheet.core.model.CostPool;
import com.costsheet.core.model.EquipmentKind;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A pricing condition that does not stop generation but deserves a user's attention.
 *
 * @param severity anomaly severity
 * @param level level name
 * @param area area name, null for level-wide anomalies
 * @param kind equipment kind concerned
 * @param pool cost pool concerned
 * @param amount amount involved
 * @param message human-readable description
 */
public record PricingAnomaly(
    AnomalySeverity severity,
    String level,
    String area,
    EquipmentKind kind,
    CostPool pool,
    BigDecimal amount,
    String message
) {
    public PricingAnomaly {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * A non-zero absorbed pool with no item to absorb it.
     */
    public static PricingAnomaly unabsorbed(String level, String area, EquipmentKind kind, CostPool pool, BigDecimal amount) {
        return new PricingAnomaly(AnomalySeverity.WARNING, level, area, kind, pool, amount,
            String.format("%s %s of %s in %s / %s has no item to absorb it; carried as an unabsorbed line",
                kind.label(), pool.label().toLowerCase(), amount, level, area == null ? "-" : area));
    }

    /**
     * A non-zero pool at the scope the engine is not using.
     */
    public static PricingAnomaly ignoredScope(String level, String area, EquipmentKind kind, CostPool pool, BigDecimal amount, SharedCostScope activeScope) {
        return new PricingAnomaly(AnomalySeverity.WARNING, level, area, kind, pool, amount,
            String.format("%s %s of %s in %s / %s ignored; shared costs are taken at %s scope",
                kind.label(), pool.label().toLowerCase(), amount, level, area == null ? "-" : area, activeScope));
    }
}
