package com.costsheet.core.pricing;

import com.costsheet.core.TestProjects;
import com.costsheet.core.model.CostPool;
import com.costsheet.core.model.EquipmentKind;
import com.costsheet.core.model.Item;
import com.costsheet.core.model.SharedCosts;
import com.costsheet.core.model.SpecField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PricingRuleEngine}.
 */
class PricingRuleEngineTest {

    private PricingRuleEngine engine;

    @BeforeEach
    void setUp() {
        engine = new PricingRuleEngine(SharedCostPolicy.defaults(), ModelExceptionTable.defaults());
    }

    @Test
    void price_twoCarryingItems_splitsDeliveryEvenly() {
        // Given
        Item first = TestProjects.withOption(TestProjects.canopy("C1", "KVF", "5000"), EquipmentKind.FIRE_SUPPRESSION, "1690", 2);
        Item second = TestProjects.withOption(TestProjects.canopy("C2", "KVF", "5000"), EquipmentKind.FIRE_SUPPRESSION, "1200", 1);
        List<Item> siblings = List.of(first, second);
        SharedCosts pools = TestProjects.delivery("800");

        // When
        ItemPrice firstPrice = engine.price(first, EquipmentKind.FIRE_SUPPRESSION, siblings, pools);
        ItemPrice secondPrice = engine.price(second, EquipmentKind.FIRE_SUPPRESSION, siblings, pools);

        // Then
        assertThat(firstPrice.total()).isEqualByComparingTo("2090");
        assertThat(secondPrice.total()).isEqualByComparingTo("1600");
        assertThat(firstPrice.share(CostPool.DELIVERY)).isEqualByComparingTo("400");
        assertThat(firstPrice.base()).isEqualByComparingTo("1690");
    }

    @Test
    void price_singleCarryingItem_absorbsWholePool() {
        // Given
        Item only = TestProjects.withOption(TestProjects.canopy("C1", "KVF", "5000"), EquipmentKind.FIRE_SUPPRESSION, "500", 1);

        // When
        ItemPrice price = engine.price(only, EquipmentKind.FIRE_SUPPRESSION, List.of(only), TestProjects.delivery("800"));

        // Then
        assertThat(price.total()).isEqualByComparingTo("1300");
    }

    @Test
    void price_nonCarryingSiblings_areNotAbsorbers() {
        // Given
        Item carrying = TestProjects.withOption(TestProjects.canopy("C1", "KVF", "5000"), EquipmentKind.UV_C, "1000", 1);
        Item plain = TestProjects.canopy("C2", "KVF", "5000");

        // When
        ItemPrice price = engine.price(carrying, EquipmentKind.UV_C, List.of(plain, carrying), TestProjects.delivery("300"));

        // Then
        assertThat(price.total()).isEqualByComparingTo("1300");
    }

    @Test
    void price_unevenPool_firstAbsorberTakesRemainder() {
        // Given
        Item a = TestProjects.withOption(TestProjects.canopy("A", "KVF", "1"), EquipmentKind.SDU, "0", 1);
        Item b = TestProjects.withOption(TestProjects.canopy("B", "KVF", "1"), EquipmentKind.SDU, "0", 1);
        Item c = TestProjects.withOption(TestProjects.canopy("C", "KVF", "1"), EquipmentKind.SDU, "0", 1);
        List<Item> siblings = List.of(a, b, c);
        SharedCosts pools = TestProjects.delivery("100");

        // When
        BigDecimal first = engine.price(a, EquipmentKind.SDU, siblings, pools).total();
        BigDecimal second = engine.price(b, EquipmentKind.SDU, siblings, pools).total();
        BigDecimal third = engine.price(c, EquipmentKind.SDU, siblings, pools).total();

        // Then
        assertThat(first).isEqualByComparingTo("33.34");
        assertThat(second).isEqualByComparingTo("33.33");
        assertThat(third).isEqualByComparingTo("33.33");
        assertThat(first.add(second).add(third)).isEqualByComparingTo("100");
    }

    @Test
    void price_canopyDelivery_staysExplicit() {
        // Given
        Item canopy = TestProjects.canopy("C1", "KVF", "5000");
        SharedCosts pools = new SharedCosts(new BigDecimal("1500"), new BigDecimal("300"));

        // When
        ItemPrice price = engine.price(canopy, EquipmentKind.CANOPY, List.of(canopy), pools);

        // Then
        assertThat(price.total()).isEqualByComparingTo("5000");
        assertThat(price.shares()).isEmpty();
        assertThat(engine.explicitAmount(EquipmentKind.CANOPY, CostPool.DELIVERY, pools)).isEqualByComparingTo("1500");
        assertThat(engine.explicitAmount(EquipmentKind.CANOPY, CostPool.COMMISSIONING, pools)).isEqualByComparingTo("300");
    }

    @Test
    void price_itemWithoutKind_throwsIllegalArgumentException() {
        // Given
        Item plain = TestProjects.canopy("C1", "KVF", "5000");

        // When / Then
        assertThatThrownBy(() -> engine.price(plain, EquipmentKind.FIRE_SUPPRESSION, List.of(plain), SharedCosts.NONE))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("C1");
    }

    @Test
    void unabsorbedAmount_noAbsorbers_returnsPool() {
        SharedCosts pools = TestProjects.delivery("800");

        assertThat(engine.unabsorbedAmount(EquipmentKind.FIRE_SUPPRESSION, CostPool.DELIVERY, pools, 0))
            .isEqualByComparingTo("800");
        assertThat(engine.unabsorbedAmount(EquipmentKind.FIRE_SUPPRESSION, CostPool.DELIVERY, pools, 1))
            .isEqualByComparingTo("0");
        assertThat(engine.unabsorbedAmount(EquipmentKind.CANOPY, CostPool.DELIVERY, pools, 0))
            .isEqualByComparingTo("0");
    }

    @Test
    void explicitAmount_absorbedPool_returnsZero() {
        assertThat(engine.explicitAmount(EquipmentKind.FIRE_SUPPRESSION, CostPool.DELIVERY, TestProjects.delivery("800")))
            .isEqualByComparingTo("0");
    }

    @Test
    void price_deliveryOverriddenToExplicit_leavesItemAtBase() {
        // Given
        PricingRuleEngine explicit = new PricingRuleEngine(
            SharedCostPolicy.defaults().with(EquipmentKind.FIRE_SUPPRESSION, CostPool.DELIVERY, DistributionMode.EXPLICIT_ROW),
            ModelExceptionTable.defaults());
        Item only = TestProjects.withOption(TestProjects.canopy("C1", "KVF", "5000"), EquipmentKind.FIRE_SUPPRESSION, "500", 1);

        // When
        ItemPrice price = explicit.price(only, EquipmentKind.FIRE_SUPPRESSION, List.of(only), TestProjects.delivery("800"));

        // Then
        assertThat(price.total()).isEqualByComparingTo("500");
    }

    @Test
    void readSpec_suppressedField_isNotApplicable() {
        // Given
        Item cmw = TestProjects.canopy("C1", "CMWF", "5000");

        // When
        SpecReading reading = engine.readSpec(cmw, SpecField.EXTRACT_STATIC);

        // Then
        assertThat(reading.applicable()).isFalse();
        assertThat(engine.readSpec(cmw, SpecField.EXTRACT_VOLUME).raw()).isEqualTo("1.25");
    }
}
