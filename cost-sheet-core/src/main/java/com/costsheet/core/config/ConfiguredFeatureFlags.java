package com.costsheet.core.config;

import java.util.Map;

/**
 * Feature flags backed by the {@code features:} map of {@code costsheet.yaml}.
 * Features not listed are enabled.
 */
public class ConfiguredFeatureFlags implements FeatureFlags {

    private final Map<String, Boolean> flags;

    public ConfiguredFeatureFlags(Map<String, Boolean> flags) {
        this.flags = flags == null ? Map.of() : Map.copyOf(flags);
    }

    @Override
    public boolean isEnabled(String name) {
        return !Boolean.FALSE.equals(flags.get(name));
    }
}
