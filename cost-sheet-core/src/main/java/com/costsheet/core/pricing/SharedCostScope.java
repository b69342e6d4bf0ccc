package com.costsheet.core.pricing;

/**
 * Scope whose shared cost pools the engines use. Pools at the other scope are ignored.
 */
public enum SharedCostScope {
    AREA,
    LEVEL
}
