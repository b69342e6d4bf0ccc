package com.costsheet.core.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One canopy position.
 *
 * @param reference reference code, unique within the project
 * @param model model identifier, e.g. {@code KVF}, {@code CMWI}
 * @param configuration mounting configuration (Wall, Island, ...)
 * @param basePrice price of the main unit
 * @param spec presentation-only specification fields
 * @param options per-kind options carried by this item
 */
public record Item(
    String reference,
    String model,
    String configuration,
    BigDecimal basePrice,
    ItemSpec spec,
    Map<EquipmentKind, ItemOption> options
) {
    public Item {
        Objects.requireNonNull(reference, "reference must not be null");
        if (basePrice == null) {
            basePrice = BigDecimal.ZERO;
        }
        if (spec == null) {
            spec = ItemSpec.EMPTY;
        }
        options = options == null || options.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(options));
    }

    public boolean hasOption(EquipmentKind kind) {
        return options.containsKey(kind);
    }

    public Optional<ItemOption> option(EquipmentKind kind) {
        return Optional.ofNullable(options.get(kind));
    }

    /**
     * Copy of this item with one option added or replaced.
     *
     * @param kind option kind
     * @param option option value
     * @return new item
     */
    public Item withOption(EquipmentKind kind, ItemOption option) {
        Map<EquipmentKind, ItemOption> copy = new EnumMap<>(EquipmentKind.class);
        copy.putAll(options);
        copy.put(kind, option);
        return new Item(reference, model, configuration, basePrice, spec, copy);
    }

    public Item withSpec(ItemSpec newSpec) {
        return new Item(reference, model, configuration, basePrice, newSpec, options);
    }
}
