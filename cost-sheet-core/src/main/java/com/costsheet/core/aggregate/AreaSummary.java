package com.costsheet.core.aggregate;

import com.costsheet.core.model.EquipmentKind;
import com.costsheet.core.model.KindCategory;
import com.costsheet.core.util.Money;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Priced area.
 *
 * @param level level name
 * @param name area name
 * @param areaNumber 1-based position of the area across the whole project
 * @param kinds subtotal per priced kind, in kind order
 * @param categories subtotal per summary category
 * @param total sum of every kind subtotal
 */
public record AreaSummary(
    String level,
    String name,
    int areaNumber,
    Map<EquipmentKind, KindSubtotal> kinds,
    Map<KindCategory, BigDecimal> categories,
    BigDecimal total
) {
    public AreaSummary {
        Objects.requireNonNull(level, "level must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(total, "total must not be null");
        kinds = kinds == null || kinds.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(kinds));
        categories = categories == null || categories.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(categories));
    }

    public Optional<KindSubtotal> kind(EquipmentKind kind) {
        return Optional.ofNullable(kinds.get(kind));
    }

    public BigDecimal category(KindCategory category) {
        return categories.getOrDefault(category, Money.ZERO);
    }
}
