package com.costsheet.core.pricing;

import com.costsheet.core.model.CostPool;
import com.costsheet.core.model.EquipmentKind;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Computed price of one item for one equipment kind.
 *
 * @param reference item reference
 * @param kind equipment kind priced
 * @param base option (or main unit) price
 * @param shares absorbed shares per pool
 * @param total base plus every share
 */
public record ItemPrice(
    String reference,
    EquipmentKind kind,
    BigDecimal base,
    Map<CostPool, BigDecimal> shares,
    BigDecimal total
) {
    public ItemPrice {
        Objects.requireNonNull(reference, "reference must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(total, "total must not be null");
        shares = shares == null || shares.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(shares));
    }

    public BigDecimal share(CostPool pool) {
        return shares.getOrDefault(pool, BigDecimal.ZERO);
    }
}
