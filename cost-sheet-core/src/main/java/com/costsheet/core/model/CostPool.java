package com.costsheet.core.model;

/**
 * Shared cost pools attached to an area or level rather than a single item.
 */
public enum CostPool {
    DELIVERY("Delivery and Installation"),
    COMMISSIONING("Commissioning");

    private final String label;

    CostPool(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
