package com.costsheet.core.aggregate;

import com.costsheet.core.config.FeatureFlags;
import com.costsheet.core.model.Area;
import com.costsheet.core.model.CostPool;
import com.costsheet.core.model.EquipmentKind;
import com.costsheet.core.model.Item;
import com.costsheet.core.model.KindCategory;
import com.costsheet.core.model.Level;
import com.costsheet.core.model.Project;
import com.costsheet.core.model.SharedCosts;
import com.costsheet.core.pricing.AnomalySeverity;
import com.costsheet.core.pricing.ItemPrice;
import com.costsheet.core.pricing.PricingAnomaly;
import com.costsheet.core.pricing.PricingRuleEngine;
import com.costsheet.core.pricing.SharedCostScope;
import com.costsheet.core.util.Money;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Folds a project into a {@link PricingSummary}.
 *
 * <p>Shared costs are taken from exactly one scope. At {@link SharedCostScope#AREA} scope
 * each area's pools are split over the area's carrying items. At
 * {@link SharedCostScope#LEVEL} scope absorbed level pools are split over the carrying
 * items of the whole level, while explicit lines and unabsorbed remainders are attributed
 * to the first area of the level that has the kind (or the first area when none has it).
 * Non-zero pools at the unused scope are reported as anomalies and left out of the totals.
 * Kinds switched off by the {@link FeatureFlags} are left out of every total.
 *
 * <p>Every total is an exact {@link BigDecimal} sum of the level below it.
 */
public class AggregationEngine {

    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

    private final PricingRuleEngine pricing;
    private final SharedCostScope scope;
    private final FeatureFlags features;

    public AggregationEngine(PricingRuleEngine pricing, SharedCostScope scope) {
        this(pricing, scope, FeatureFlags.allEnabled());
    }

    public AggregationEngine(PricingRuleEngine pricing, SharedCostScope scope, FeatureFlags features) {
        this.pricing = Objects.requireNonNull(pricing, "pricing must not be null");
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
        this.features = Objects.requireNonNull(features, "features must not be null");
    }

    public SharedCostScope scope() {
        return scope;
    }

    /**
     * Prices every item of the project and rolls the prices up.
     *
     * @param project project to price
     * @return immutable pricing summary
     */
    public PricingSummary aggregate(Project project) {
        Objects.requireNonNull(project, "project must not be null");
        log.info("Aggregating project {} ({} levels, {} shared-cost scope)",
            project.info().number(), project.levels().size(), scope);

        List<PricingAnomaly> anomalies = new ArrayList<>();
        List<LevelSummary> levels = new ArrayList<>();
        int areaNumber = 0;

        for (Level level : project.levels()) {
            reportIgnoredPools(level, anomalies);
            List<Item> levelItems = level.areas().stream().flatMap(area -> area.items().stream()).toList();
            Map<EquipmentKind, Integer> designated = designatedAreas(level, anomalies);

            List<AreaSummary> areas = new ArrayList<>();
            for (int index = 0; index < level.areas().size(); index++) {
                Area area = level.areas().get(index);
                areaNumber++;
                areas.add(priceArea(level, area, index, areaNumber, levelItems, designated, anomalies));
            }
            BigDecimal levelTotal = areas.stream().map(AreaSummary::total).reduce(Money.ZERO, BigDecimal::add);
            levels.add(new LevelSummary(level.name(), areas, levelTotal));
        }

        BigDecimal total = levels.stream().map(LevelSummary::total).reduce(Money.ZERO, BigDecimal::add);
        PricingSummary summary = new PricingSummary(levels, rollups(project, levels), total, anomalies);

        anomalies.forEach(anomaly -> log.warn("Pricing anomaly: {}", anomaly.message()));
        log.info("Project {} priced at {} across {} areas", project.info().number(), total, areaNumber);
        return summary;
    }

    private AreaSummary priceArea(Level level, Area area, int index, int areaNumber, List<Item> levelItems,
                                  Map<EquipmentKind, Integer> designated, List<PricingAnomaly> anomalies) {
        Map<EquipmentKind, KindSubtotal> kinds = new EnumMap<>(EquipmentKind.class);

        for (EquipmentKind kind : EquipmentKind.values()) {
            if (!features.isEnabled(kind)) {
                continue;
            }
            SharedCosts pools;
            SharedCosts attributed;
            List<Item> siblings;
            if (scope == SharedCostScope.AREA) {
                pools = area.sharedCosts(kind);
                attributed = pools;
                siblings = area.items();
            } else {
                pools = level.sharedCosts(kind);
                attributed = Integer.valueOf(index).equals(designated.get(kind)) ? pools : SharedCosts.NONE;
                siblings = levelItems;
            }

            if (!area.triggers(kind) && !attributed.hasAny()) {
                continue;
            }

            List<ItemPrice> prices = area.itemsCarrying(kind).stream()
                .map(item -> pricing.price(item, kind, siblings, pools))
                .toList();
            int absorberCount = pricing.absorbers(kind, siblings).size();

            BigDecimal delivery = pricing.explicitAmount(kind, CostPool.DELIVERY, attributed);
            BigDecimal commissioning = pricing.explicitAmount(kind, CostPool.COMMISSIONING, attributed);
            BigDecimal unabsorbed = Money.ZERO;
            for (CostPool pool : CostPool.values()) {
                BigDecimal amount = pricing.unabsorbedAmount(kind, pool, attributed, absorberCount);
                if (amount.signum() != 0) {
                    anomalies.add(PricingAnomaly.unabsorbed(level.name(), area.name(), kind, pool, amount));
                    unabsorbed = unabsorbed.add(amount);
                }
            }

            BigDecimal total = prices.stream().map(ItemPrice::total).reduce(Money.ZERO, BigDecimal::add)
                .add(delivery).add(commissioning).add(unabsorbed);
            kinds.put(kind, new KindSubtotal(kind, prices, attributed, delivery, commissioning, unabsorbed, total));
        }

        Map<KindCategory, BigDecimal> categories = new EnumMap<>(KindCategory.class);
        kinds.values().forEach(subtotal ->
            categories.merge(subtotal.kind().category(), subtotal.total(), BigDecimal::add));
        BigDecimal areaTotal = kinds.values().stream().map(KindSubtotal::total).reduce(Money.ZERO, BigDecimal::add);

        log.debug("Area {} ({}/{}) total {}", areaNumber, level.name(), area.name(), areaTotal);
        return new AreaSummary(level.name(), area.name(), areaNumber, kinds, categories, areaTotal);
    }

    /**
     * Index of the area each kind's level pools are attributed to. Empty at area scope.
     */
    private Map<EquipmentKind, Integer> designatedAreas(Level level, List<PricingAnomaly> anomalies) {
        Map<EquipmentKind, Integer> designated = new EnumMap<>(EquipmentKind.class);
        if (scope != SharedCostScope.LEVEL) {
            return designated;
        }
        for (EquipmentKind kind : EquipmentKind.values()) {
            if (level.areas().isEmpty()) {
                SharedCosts pools = level.sharedCosts(kind);
                for (CostPool pool : CostPool.values()) {
                    if (pools.amount(pool).signum() != 0) {
                        anomalies.add(new PricingAnomaly(AnomalySeverity.WARNING, level.name(), null, kind, pool,
                            pools.amount(pool), String.format("%s %s on level %s dropped; the level has no areas",
                                kind.label(), pool.label().toLowerCase(), level.name())));
                    }
                }
                continue;
            }
            int first = 0;
            for (int i = 0; i < level.areas().size(); i++) {
                if (level.areas().get(i).triggers(kind)) {
                    first = i;
                    break;
                }
            }
            designated.put(kind, first);
        }
        return designated;
    }

    private void reportIgnoredPools(Level level, List<PricingAnomaly> anomalies) {
        if (scope == SharedCostScope.AREA) {
            level.sharedCosts().forEach((kind, pools) -> {
                for (CostPool pool : CostPool.values()) {
                    if (pools.amount(pool).signum() != 0) {
                        anomalies.add(PricingAnomaly.ignoredScope(level.name(), null, kind, pool, pools.amount(pool), scope));
                    }
                }
            });
            return;
        }
        for (Area area : level.areas()) {
            area.sharedCosts().forEach((kind, pools) -> {
                for (CostPool pool : CostPool.values()) {
                    if (pools.amount(pool).signum() != 0) {
                        anomalies.add(PricingAnomaly.ignoredScope(level.name(), area.name(), kind, pool, pools.amount(pool), scope));
                    }
                }
            });
        }
    }

    private Map<EquipmentKind, KindRollup> rollups(Project project, List<LevelSummary> levels) {
        Map<EquipmentKind, KindRollup> rollups = new EnumMap<>(EquipmentKind.class);
        List<Item> items = project.allItems();
        for (EquipmentKind kind : EquipmentKind.values()) {
            if (!features.isEnabled(kind)) {
                continue;
            }
            int count = 0;
            int quantity = 0;
            for (Item item : items) {
                if (kind == EquipmentKind.CANOPY) {
                    count++;
                    quantity++;
                } else if (item.hasOption(kind)) {
                    count++;
                    quantity += item.option(kind).orElseThrow().quantityOrZero();
                }
            }
            BigDecimal total = levels.stream()
                .flatMap(level -> level.areas().stream())
                .map(area -> area.kinds().get(kind))
                .filter(Objects::nonNull)
                .map(KindSubtotal::total)
                .reduce(Money.ZERO, BigDecimal::add);
            if (count > 0 || total.signum() != 0) {
                rollups.put(kind, new KindRollup(kind, count, quantity, total));
            }
        }
        return rollups;
    }
}
