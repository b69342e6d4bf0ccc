package com.costsheet.core.pricing;

import com.costsheet.core.model.CostPool;
import com.costsheet.core.model.EquipmentKind;
import com.costsheet.core.model.Item;
import com.costsheet.core.model.ItemOption;
import com.costsheet.core.model.SharedCosts;
import com.costsheet.core.model.SpecField;
import com.costsheet.core.util.Money;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pure pricing functions for a single item.
 *
 * <p>Final price of an item for a kind is its option price (the main unit price for
 * canopies) plus its share of every pool the {@link SharedCostPolicy} marks as absorbed.
 * Shares come from {@link Money#split(BigDecimal, int)} over the absorbers in scope order,
 * so the first absorber takes any rounding remainder.
 */
public class PricingRuleEngine {

    private final SharedCostPolicy policy;
    private final ModelExceptionTable modelExceptions;

    public PricingRuleEngine(SharedCostPolicy policy, ModelExceptionTable modelExceptions) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.modelExceptions = Objects.requireNonNull(modelExceptions, "modelExceptions must not be null");
    }

    public static PricingRuleEngine withDefaults() {
        return new PricingRuleEngine(SharedCostPolicy.defaults(), ModelExceptionTable.load());
    }

    public SharedCostPolicy policy() {
        return policy;
    }

    /**
     * Prices one item for one kind.
     *
     * @param item item to price
     * @param kind equipment kind
     * @param siblingsInScope every item of the pricing scope, in order, including {@code item}
     * @param sharedCosts pools of the scope for this kind
     * @return computed price
     * @throws IllegalArgumentException if the item does not carry the kind
     */
    public ItemPrice price(Item item, EquipmentKind kind, List<Item> siblingsInScope, SharedCosts sharedCosts) {
        BigDecimal base = Money.of(basePrice(item, kind));
        List<Item> absorbers = absorbers(kind, siblingsInScope);
        int position = indexOf(absorbers, item);

        Map<CostPool, BigDecimal> shares = new EnumMap<>(CostPool.class);
        BigDecimal total = base;
        for (CostPool pool : CostPool.values()) {
            BigDecimal amount = sharedCosts.amount(pool);
            if (!policy.isAbsorbed(kind, pool) || amount.signum() == 0 || position < 0) {
                continue;
            }
            BigDecimal share = Money.split(amount, absorbers.size()).get(position);
            shares.put(pool, share);
            total = total.add(share);
        }
        return new ItemPrice(item.reference(), kind, base, shares, total);
    }

    /**
     * Amount of a pool shown as its own line, zero when the pool is absorbed.
     */
    public BigDecimal explicitAmount(EquipmentKind kind, CostPool pool, SharedCosts sharedCosts) {
        return policy.isAbsorbed(kind, pool) ? Money.ZERO : Money.of(sharedCosts.amount(pool));
    }

    /**
     * Amount of an absorbed pool that has no absorber, zero otherwise.
     *
     * @param kind equipment kind
     * @param pool cost pool
     * @param sharedCosts pools of the scope
     * @param absorberCount number of items carrying the kind in scope
     * @return unabsorbed amount
     */
    public BigDecimal unabsorbedAmount(EquipmentKind kind, CostPool pool, SharedCosts sharedCosts, int absorberCount) {
        if (!policy.isAbsorbed(kind, pool) || absorberCount > 0) {
            return Money.ZERO;
        }
        return Money.of(sharedCosts.amount(pool));
    }

    /**
     * Items of the scope that absorb the kind's pools.
     *
     * @param kind equipment kind
     * @param siblingsInScope items of the scope
     * @return carrying items in scope order
     */
    public List<Item> absorbers(EquipmentKind kind, List<Item> siblingsInScope) {
        if (kind == EquipmentKind.CANOPY) {
            return siblingsInScope;
        }
        return siblingsInScope.stream().filter(sibling -> sibling.hasOption(kind)).toList();
    }

    /**
     * Presentation field read through the model exception table.
     */
    public SpecReading readSpec(Item item, SpecField field) {
        return modelExceptions.read(item, field);
    }

    private static BigDecimal basePrice(Item item, EquipmentKind kind) {
        if (kind == EquipmentKind.CANOPY) {
            return item.basePrice();
        }
        ItemOption option = item.option(kind).orElseThrow(() -> new IllegalArgumentException(
            "Item " + item.reference() + " does not carry " + kind.label()));
        return option.price();
    }

    private static int indexOf(List<Item> absorbers, Item item) {
        for (int i = 0; i < absorbers.size(); i++) {
            if (absorbers.get(i).reference().equals(item.reference())) {
                return i;
            }
        }
        return -1;
    }
}
