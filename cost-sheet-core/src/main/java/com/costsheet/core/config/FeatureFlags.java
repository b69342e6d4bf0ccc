package com.costsheet.core.config;

import com.costsheet.core.model.EquipmentKind;

/**
 * Feature flag lookup consulted before a kind's sheets or document sections are produced.
 */
public interface FeatureFlags {

    /**
     * Whether the named feature is on.
     *
     * @param name feature name, e.g. {@code fire-suppression}
     * @return true if enabled
     */
    boolean isEnabled(String name);

    /**
     * Whether a kind is produced. Canopies are always on; every other kind carries on them.
     */
    default boolean isEnabled(EquipmentKind kind) {
        return kind == EquipmentKind.CANOPY || isEnabled(kind.featureKey());
    }

    static FeatureFlags allEnabled() {
        return name -> true;
    }
}
