package com.costsheet.core.pricing;

import com.costsheet.core.model.SpecField;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ModelExceptionTable}.
 */
class ModelExceptionTableTest {

    @Test
    void load_classpathResource_matchesBuiltInRules() {
        // When
        ModelExceptionTable table = ModelExceptionTable.load();

        // Then
        assertThat(table.rules()).hasSize(7);
        assertThat(table.rules()).containsExactlyElementsOf(ModelExceptionTable.defaults().rules());
    }

    @Test
    void suppressedFields_overlappingPrefixes_unionsRules() {
        ModelExceptionTable table = ModelExceptionTable.defaults();

        assertThat(table.suppressedFields("CMWI"))
            .containsExactlyInAnyOrder(SpecField.EXTRACT_STATIC, SpecField.SUPPLY_VOLUME, SpecField.SUPPLY_STATIC);
        assertThat(table.suppressedFields("CMWF")).containsExactly(SpecField.EXTRACT_STATIC);
    }

    @Test
    void suppressedFields_matchesIgnoringCaseAndWhitespace() {
        ModelExceptionTable table = ModelExceptionTable.defaults();

        assertThat(table.suppressedFields(" kvi-2 "))
            .containsExactlyInAnyOrder(SpecField.SUPPLY_VOLUME, SpecField.SUPPLY_STATIC);
    }

    @Test
    void suppressedFields_unknownOrNullModel_returnsEmpty() {
        ModelExceptionTable table = ModelExceptionTable.defaults();

        assertThat(table.suppressedFields("KVF")).isEmpty();
        assertThat(table.suppressedFields(null)).isEmpty();
    }

    @Test
    void constructor_nullRules_suppressesNothing() {
        ModelExceptionTable table = new ModelExceptionTable(null);

        assertThat(table.rules()).isEmpty();
        assertThat(table.suppressedFields("CMWI")).isEmpty();
    }

    @Test
    void rule_prefixIsNormalized() {
        ModelExceptionRule rule = new ModelExceptionRule(" uve ", Set.of(SpecField.SUPPLY_STATIC));

        assertThat(rule.prefix()).isEqualTo("UVE");
        assertThat(rule.matches("UVE-1500")).isTrue();
        assertThat(new ModelExceptionTable(List.of(rule)).suppressedFields("uve")).containsExactly(SpecField.SUPPLY_STATIC);
    }
}
