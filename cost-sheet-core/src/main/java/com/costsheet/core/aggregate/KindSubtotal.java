package com.costsheet.core.aggregate;

import com.costsheet.core.model.EquipmentKind;
import com.costsheet.core.model.SharedCosts;
import com.costsheet.core.pricing.ItemPrice;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Subtotal of one equipment kind within one area.
 *
 * @param kind equipment kind
 * @param items computed item prices, in item order
 * @param pools raw pools attributed to this area for the kind
 * @param delivery explicit delivery line
 * @param commissioning explicit commissioning line
 * @param unabsorbed absorbed pools that found no item to absorb them
 * @param total items plus every line
 */
public record KindSubtotal(
    EquipmentKind kind,
    List<ItemPrice> items,
    SharedCosts pools,
    BigDecimal delivery,
    BigDecimal commissioning,
    BigDecimal unabsorbed,
    BigDecimal total
) {
    public KindSubtotal {
        Objects.requireNonNull(kind, "kind must not be null");
        items = items == null ? List.of() : List.copyOf(items);
        pools = pools == null ? SharedCosts.NONE : pools;
        Objects.requireNonNull(delivery, "delivery must not be null");
        Objects.requireNonNull(commissioning, "commissioning must not be null");
        Objects.requireNonNull(unabsorbed, "unabsorbed must not be null");
        Objects.requireNonNull(total, "total must not be null");
    }

    public BigDecimal itemsTotal() {
        return items.stream().map(ItemPrice::total).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public Optional<ItemPrice> item(String reference) {
        return items.stream().filter(price -> price.reference().equals(reference)).findFirst();
    }
}
