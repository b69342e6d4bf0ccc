package com.costsheet.core.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Flat variable namespace consumed by a document template.
 *
 * <p>Values are strings, booleans, or lists of nested maps of the same shapes. Keys keep
 * insertion order.
 *
 * @param values variables by name
 */
public record DocumentContext(
    Map<String, Object> values
) {
    public static final String HAS_CANOPIES = "has_canopies";
    public static final String HAS_WALL_CLADDING = "has_wall_cladding";
    public static final String HAS_FIRE_SUPPRESSION = "has_fire_suppression";
    public static final String HAS_UV_C = "has_uv_c";
    public static final String HAS_RECOAIR = "has_recoair";
    public static final String HAS_REACTAWAY = "has_reactaway";
    public static final String HAS_SDU = "has_sdu";
    public static final String RECOAIR_ONLY = "recoair_only";

    /**
     * Lists rendered as repeated table rows.
     */
    public static final Set<String> TABLE_LISTS = Set.of(
        "canopies", "wall_cladding_items", "fire_suppression_items", "uv_c_items",
        "recoair_items", "reactaway_items", "sdu_items", "kind_totals");

    public DocumentContext {
        Objects.requireNonNull(values, "values must not be null");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /**
     * String form of a scalar variable.
     *
     * @param key variable name
     * @return value as text, null when absent
     */
    public String string(String key) {
        Object value = values.get(key);
        return value == null ? null : value.toString();
    }

    public boolean flag(String key) {
        return Boolean.TRUE.equals(values.get(key));
    }

    /**
     * List variable.
     *
     * @param key variable name
     * @return records of the list, empty when absent or not a list
     */
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> list(String key) {
        Object value = values.get(key);
        if (value instanceof List<?> list) {
            return (List<Map<String, Object>>) list;
        }
        return List.of();
    }
}
