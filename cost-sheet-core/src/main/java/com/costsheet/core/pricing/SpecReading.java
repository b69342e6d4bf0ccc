package com.costsheet.core.pricing;

/**
 * A presentation field as read through the model exception rules.
 *
 * <p>A suppressed field is {@link #notApplicable()}, which is distinct from a blank or
 * zero value.
 *
 * @param raw stored value, null when blank or not applicable
 * @param applicable false when a model rule suppresses the field
 */
public record SpecReading(
    String raw,
    boolean applicable
) {
    private static final SpecReading NOT_APPLICABLE = new SpecReading(null, false);

    public static SpecReading notApplicable() {
        return NOT_APPLICABLE;
    }

    public static SpecReading of(String raw) {
        return new SpecReading(raw, true);
    }

    public boolean isBlank() {
        return raw == null || raw.isBlank();
    }
}
