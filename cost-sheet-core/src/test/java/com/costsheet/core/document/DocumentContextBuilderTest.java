package com.costsheet.core.document;

import com.costsheet.core.TestProjects;
import com.costsheet.core.aggregate.AggregationEngine;
import com.costsheet.core.config.ConfiguredFeatureFlags;
import com.costsheet.core.config.FeatureFlags;
import com.costsheet.core.model.Area;
import com.costsheet.core.model.EquipmentKind;
import com.costsheet.core.model.Project;
import com.costsheet.core.pricing.ModelExceptionTable;
import com.costsheet.core.pricing.PricingRuleEngine;
import com.costsheet.core.pricing.SharedCostPolicy;
import com.costsheet.core.pricing.SharedCostScope;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DocumentContextBuilder}.
 */
class DocumentContextBuilderTest {

    private static final PricingRuleEngine PRICING =
        new PricingRuleEngine(SharedCostPolicy.defaults(), ModelExceptionTable.defaults());

    @Test
    void build_everyKind_setsScalarsAndFlags() {
        // When
        DocumentContext context = build(TestProjects.everyKind(), FeatureFlags.allEnabled());

        // Then
        assertThat(context.string("client_name")).isEqualTo("Jane Smith");
        assertThat(context.string("project_number")).isEqualTo("1234");
        assertThat(context.string("estimator_initials")).isEqualTo("YH/JS");
        assertThat(context.string("date")).isEqualTo("15 January 2025");
        assertThat(context.string("quote_reference")).isEqualTo("1234/01/25");
        assertThat(context.string("dear_line")).isEqualTo("Jane Smith,");
        assertThat(context.string("subject_line")).isEqualTo("Hotel Refit, Leeds");
        assertThat(context.string("grand_total")).isEqualTo("£24,640.00");
        assertThat(context.string("total_canopies")).isEqualTo("2");
        assertThat(context.flag(DocumentContext.HAS_CANOPIES)).isTrue();
        assertThat(context.flag(DocumentContext.HAS_WALL_CLADDING)).isTrue();
        assertThat(context.flag(DocumentContext.HAS_FIRE_SUPPRESSION)).isTrue();
        assertThat(context.flag(DocumentContext.HAS_UV_C)).isTrue();
        assertThat(context.flag(DocumentContext.HAS_RECOAIR)).isTrue();
        assertThat(context.flag(DocumentContext.HAS_SDU)).isTrue();
        assertThat(context.flag(DocumentContext.HAS_REACTAWAY)).isFalse();
        assertThat(context.flag(DocumentContext.RECOAIR_ONLY)).isFalse();
    }

    @Test
    void build_canopyRecords_applyModelExceptionsAndFormatting() {
        // When
        List<Map<String, Object>> canopies = build(TestProjects.everyKind(), FeatureFlags.allEnabled()).list("canopies");

        // Then
        assertThat(canopies).hasSize(2);
        Map<String, Object> uvf = canopies.get(0);
        assertThat(uvf).containsEntry("reference", "C1")
            .containsEntry("lighting", "LED SPOTS")
            .containsEntry("extract_volume", "1.5")
            .containsEntry("extract_static", "160")
            .containsEntry("price", "£6,000.00");
        Map<String, Object> island = canopies.get(1);
        assertThat(island).containsEntry("model", "CMWI")
            .containsEntry("lighting", "LED STRIP")
            .containsEntry("extract_static", "-")
            .containsEntry("supply_volume", "-");
    }

    @Test
    void build_optionRecords_includeAbsorbedSharesAndQuantities() {
        // When
        DocumentContext context = build(TestProjects.everyKind(), FeatureFlags.allEnabled());

        // Then
        assertThat(context.list("fire_suppression_items")).singleElement().satisfies(record -> assertThat(record)
            .containsEntry("tank_quantity", "2")
            .containsEntry("price", "£2,490.00"));
        assertThat(context.list("wall_cladding_items")).singleElement().satisfies(record -> assertThat(record)
            .containsEntry("positions", "rear, left")
            .containsEntry("description", "Cladding to rear and left walls"));
        assertThat(context.list("sdu_items")).singleElement()
            .satisfies(record -> assertThat(record).containsEntry("reference", "C2"));
        assertThat(context.list("recoair_items")).isEmpty();
    }

    @Test
    void build_unspecifiedTankQuantity_rendersTbd() {
        // When
        List<Map<String, Object>> items = build(TestProjects.twoFireSuppressionItems(), FeatureFlags.allEnabled())
            .list("fire_suppression_items");

        // Then
        assertThat(items).extracting(record -> record.get("tank_quantity")).containsExactly("2", "TBD");
        assertThat(items).extracting(record -> record.get("price")).containsExactly("£2,090.00", "£1,600.00");
    }

    @Test
    void build_levels_nestAreasWithTotals() {
        // When
        List<Map<String, Object>> levels = build(TestProjects.everyKind(), FeatureFlags.allEnabled()).list("levels");

        // Then
        assertThat(levels).singleElement().satisfies(level -> {
            assertThat(level).containsEntry("level_name", TestProjects.LEVEL)
                .containsEntry("level_total", "£24,640.00");
            @SuppressWarnings("unchecked")
            List<Map<String, Object>> areas = (List<Map<String, Object>>) level.get("areas");
            assertThat(areas).singleElement().satisfies(area -> assertThat(area)
                .containsEntry("area_name", TestProjects.AREA)
                .containsEntry("cladding_total", "£750.00")
                .containsEntry("total", "£24,640.00"));
        });
    }

    @Test
    void build_onlyRecoAirArea_setsRecoAirOnly() {
        // Given
        Project project = TestProjects.project(new Area("Plant Room", Set.of(EquipmentKind.RECOAIR), List.of(), Map.of()));

        // When
        DocumentContext context = build(project, FeatureFlags.allEnabled());

        // Then
        assertThat(context.flag(DocumentContext.RECOAIR_ONLY)).isTrue();
        assertThat(context.flag(DocumentContext.HAS_CANOPIES)).isFalse();
        assertThat(QuotationKind.MAIN.appliesTo(context)).isFalse();
        assertThat(QuotationKind.RECOAIR.appliesTo(context)).isTrue();
    }

    @Test
    void build_disabledFeature_clearsFlagAndList() {
        // Given
        FeatureFlags noFireSuppression = new ConfiguredFeatureFlags(Map.of("fire-suppression", false));

        // When
        DocumentContext context = build(TestProjects.everyKind(), noFireSuppression);

        // Then
        assertThat(context.flag(DocumentContext.HAS_FIRE_SUPPRESSION)).isFalse();
        assertThat(context.list("fire_suppression_items")).isEmpty();
        assertThat(context.list("kind_totals")).extracting(row -> row.get("kind"))
            .doesNotContain("FIRE_SUPPRESSION")
            .contains("CANOPY", "SDU");
    }

    @Test
    void build_disabledFeature_grandTotalExcludesIt() {
        // Given
        FeatureFlags noFireSuppression = new ConfiguredFeatureFlags(Map.of("fire-suppression", false));

        // When
        DocumentContext context = build(TestProjects.twoFireSuppressionItems(), noFireSuppression);

        // Then
        assertThat(context.flag(DocumentContext.HAS_FIRE_SUPPRESSION)).isFalse();
        assertThat(context.list("fire_suppression_items")).isEmpty();
        assertThat(context.string("grand_total")).isEqualTo("£9,000.00");
        assertThat(context.list("kind_totals")).extracting(row -> row.get("total")).containsExactly("£9,000.00");
    }

    @Test
    void build_sameInput_producesEqualContext() {
        Project project = TestProjects.everyKind();

        assertThat(build(project, FeatureFlags.allEnabled())).isEqualTo(build(project, FeatureFlags.allEnabled()));
    }

    @Test
    void appliesTo_mixedProject_producesBothQuotations() {
        DocumentContext context = build(TestProjects.everyKind(), FeatureFlags.allEnabled());

        assertThat(QuotationKind.MAIN.appliesTo(context)).isTrue();
        assertThat(QuotationKind.RECOAIR.appliesTo(context)).isTrue();
    }

    @Test
    void applicableTo_contextWithoutAnyQuotation_isEmpty() {
        // Given
        DocumentContext context = new DocumentContext(Map.of(
            DocumentContext.RECOAIR_ONLY, true,
            DocumentContext.HAS_RECOAIR, false));

        // When
        List<QuotationKind> kinds = QuotationKind.applicableTo(context);

        // Then
        assertThat(kinds).isEmpty();
        assertThat(QuotationKind.applicableTo(build(TestProjects.everyKind(), FeatureFlags.allEnabled())))
            .containsExactly(QuotationKind.MAIN, QuotationKind.RECOAIR);
    }

    private static DocumentContext build(Project project, FeatureFlags features) {
        return new DocumentContextBuilder(PRICING, features, new DisplayValues("£"))
            .build(project, new AggregationEngine(PRICING, SharedCostScope.AREA, features).aggregate(project));
    }
}
