package com.costsheet.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A building level.
 *
 * @param name level name, user-editable
 * @param areas ordered areas
 * @param sharedCosts level-scoped delivery/commissioning pools per kind
 */
public record Level(
    String name,
    List<Area> areas,
    Map<EquipmentKind, SharedCosts> sharedCosts
) {
    public Level {
        Objects.requireNonNull(name, "name must not be null");
        areas = areas == null ? List.of() : List.copyOf(areas);
        sharedCosts = sharedCosts == null || sharedCosts.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(sharedCosts));
    }

    public SharedCosts sharedCosts(EquipmentKind kind) {
        return sharedCosts.getOrDefault(kind, SharedCosts.NONE);
    }

    public Level withName(String newName) {
        return new Level(newName, areas, sharedCosts);
    }

    public Level withAreas(List<Area> newAreas) {
        return new Level(name, newAreas, sharedCosts);
    }
}
