package com.costsheet.core.pricing;

import com.costsheet.core.model.CostPool;
import com.costsheet.core.model.EquipmentKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Table of (kind, pool) to {@link DistributionMode}.
 *
 * <p>Defaults: delivery is absorbed by the carrying items for every kind except canopies,
 * where it is an explicit row. Commissioning is always an explicit row and cannot be
 * overridden.
 */
public final class SharedCostPolicy {

    private static final Logger log = LoggerFactory.getLogger(SharedCostPolicy.class);

    private final Map<EquipmentKind, Map<CostPool, DistributionMode>> table;

    private SharedCostPolicy(Map<EquipmentKind, Map<CostPool, DistributionMode>> table) {
        this.table = table;
    }

    public static SharedCostPolicy defaults() {
        Map<EquipmentKind, Map<CostPool, DistributionMode>> table = new EnumMap<>(EquipmentKind.class);
        for (EquipmentKind kind : EquipmentKind.values()) {
            Map<CostPool, DistributionMode> row = new EnumMap<>(CostPool.class);
            row.put(CostPool.DELIVERY, kind == EquipmentKind.CANOPY ? DistributionMode.EXPLICIT_ROW : DistributionMode.ABSORBED);
            row.put(CostPool.COMMISSIONING, DistributionMode.EXPLICIT_ROW);
            table.put(kind, Collections.unmodifiableMap(row));
        }
        return new SharedCostPolicy(Collections.unmodifiableMap(table));
    }

    /**
     * Default policy with delivery modes overridden per kind.
     *
     * @param deliveryOverrides delivery mode per kind, may be null or empty
     * @return policy
     */
    public static SharedCostPolicy withDeliveryOverrides(Map<EquipmentKind, DistributionMode> deliveryOverrides) {
        SharedCostPolicy policy = defaults();
        if (deliveryOverrides == null) {
            return policy;
        }
        for (Map.Entry<EquipmentKind, DistributionMode> entry : deliveryOverrides.entrySet()) {
            policy = policy.with(entry.getKey(), CostPool.DELIVERY, entry.getValue());
        }
        return policy;
    }

    /**
     * Copy of this policy with one cell replaced.
     *
     * <p>Requests to absorb commissioning are ignored with a warning.
     *
     * @param kind equipment kind
     * @param pool cost pool
     * @param mode new mode
     * @return new policy
     */
    public SharedCostPolicy with(EquipmentKind kind, CostPool pool, DistributionMode mode) {
        if (pool == CostPool.COMMISSIONING && mode == DistributionMode.ABSORBED) {
            log.warn("Commissioning for {} cannot be absorbed; keeping it as an explicit row", kind.label());
            return this;
        }
        Map<EquipmentKind, Map<CostPool, DistributionMode>> copy = new EnumMap<>(table);
        Map<CostPool, DistributionMode> row = new EnumMap<>(copy.get(kind));
        row.put(pool, mode);
        copy.put(kind, Collections.unmodifiableMap(row));
        return new SharedCostPolicy(Collections.unmodifiableMap(copy));
    }

    public DistributionMode mode(EquipmentKind kind, CostPool pool) {
        return table.get(kind).get(pool);
    }

    public boolean isAbsorbed(EquipmentKind kind, CostPool pool) {
        return mode(kind, pool) == DistributionMode.ABSORBED;
    }
}
