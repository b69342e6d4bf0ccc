package com.costsheet.core.aggregate;

import com.costsheet.core.model.EquipmentKind;
import com.costsheet.core.pricing.ItemPrice;
import com.costsheet.core.pricing.PricingAnomaly;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fully priced project. Recomputed on every pass, never edited.
 *
 * @param levels priced levels in order
 * @param rollups per-kind project figures
 * @param total project grand total
 * @param anomalies pricing anomalies found while aggregating
 */
public record PricingSummary(
    List<LevelSummary> levels,
    Map<EquipmentKind, KindRollup> rollups,
    BigDecimal total,
    List<PricingAnomaly> anomalies
) {
    public PricingSummary {
        Objects.requireNonNull(total, "total must not be null");
        levels = levels == null ? List.of() : List.copyOf(levels);
        rollups = rollups == null || rollups.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(rollups));
        anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
    }

    public List<AreaSummary> allAreas() {
        return levels.stream().flatMap(level -> level.areas().stream()).toList();
    }

    public Optional<AreaSummary> area(int areaNumber) {
        return allAreas().stream().filter(area -> area.areaNumber() == areaNumber).findFirst();
    }

    public Optional<ItemPrice> itemPrice(String reference, EquipmentKind kind) {
        return allAreas().stream()
            .map(area -> area.kinds().get(kind))
            .filter(Objects::nonNull)
            .flatMap(subtotal -> subtotal.item(reference).stream())
            .findFirst();
    }

    public KindRollup rollup(EquipmentKind kind) {
        return rollups.getOrDefault(kind, new KindRollup(kind, 0, 0, BigDecimal.ZERO));
    }
}
