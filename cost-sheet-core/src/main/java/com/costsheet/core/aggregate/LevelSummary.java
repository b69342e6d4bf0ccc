package com.costsheet.core.aggregate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Priced level.
 *
 * @param name level name
 * @param areas priced areas in order
 * @param total sum of the area totals
 */
public record LevelSummary(
    String name,
    List<AreaSummary> areas,
    BigDecimal total
) {
    public LevelSummary {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(total, "total must not be null");
        areas = areas == null ? List.of() : List.copyOf(areas);
    }
}
