package com.costsheet.core.pricing;

import com.costsheet.core.model.SpecField;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * One row of the model exception table: models starting with {@code prefix} have the
 * {@code suppress} fields marked not applicable.
 *
 * @param prefix model prefix, matched case-insensitively
 * @param suppress suppressed presentation fields
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelExceptionRule(
    @JsonProperty("prefix") String prefix,
    @JsonProperty("suppress") Set<SpecField> suppress
) {
    public ModelExceptionRule {
        Objects.requireNonNull(prefix, "prefix must not be null");
        prefix = prefix.trim().toUpperCase(Locale.ROOT);
        suppress = suppress == null || suppress.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(suppress));
    }

    public boolean matches(String model) {
        return model != null && model.trim().toUpperCase(Locale.ROOT).startsWith(prefix);
    }
}
