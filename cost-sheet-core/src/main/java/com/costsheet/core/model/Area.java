package com.costsheet.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An area within a level, e.g. a kitchen.
 *
 * @param name area name
 * @param options area-scoped kinds switched on independently of any item
 * @param items ordered items
 * @param sharedCosts area-scoped delivery/commissioning pools per kind
 */
public record Area(
    String name,
    Set<EquipmentKind> options,
    List<Item> items,
    Map<EquipmentKind, SharedCosts> sharedCosts
) {
    public Area {
        Objects.requireNonNull(name, "name must not be null");
        options = options == null || options.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(options));
        items = items == null ? List.of() : List.copyOf(items);
        sharedCosts = sharedCosts == null || sharedCosts.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(sharedCosts));
    }

    /**
     * Whether this area needs pricing (and a sheet) for the given kind.
     *
     * <p>Canopies are triggered by any item; every other kind by the area option or by
     * at least one item carrying it.
     *
     * @param kind equipment kind
     * @return true when triggered
     */
    public boolean triggers(EquipmentKind kind) {
        if (kind == EquipmentKind.CANOPY) {
            return !items.isEmpty();
        }
        return options.contains(kind) || items.stream().anyMatch(item -> item.hasOption(kind));
    }

    /**
     * Items carrying the given kind, in order. Every item carries {@link EquipmentKind#CANOPY}.
     *
     * @param kind equipment kind
     * @return carrying items
     */
    public List<Item> itemsCarrying(EquipmentKind kind) {
        if (kind == EquipmentKind.CANOPY) {
            return items;
        }
        return items.stream().filter(item -> item.hasOption(kind)).toList();
    }

    public SharedCosts sharedCosts(EquipmentKind kind) {
        return sharedCosts.getOrDefault(kind, SharedCosts.NONE);
    }

    public Area withItems(List<Item> newItems) {
        return new Area(name, options, newItems, sharedCosts);
    }

    public Area withOptions(Set<EquipmentKind> newOptions) {
        return new Area(name, newOptions, items, sharedCosts);
    }

    public Area withSharedCosts(Map<EquipmentKind, SharedCosts> newSharedCosts) {
        return new Area(name, options, items, newSharedCosts);
    }
}
