package com.costsheet.core.workbook;

import com.costsheet.core.model.EquipmentKind;
import com.costsheet.core.workbook.SheetNaming.ParsedName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SheetNaming}.
 */
class SheetNamingTest {

    @Test
    void slot_andSlotNumber_roundTrip() {
        String slot = SheetNaming.slot(EquipmentKind.FIRE_SUPPRESSION, 7);

        assertThat(slot).isEqualTo("FIRE SUPP #7");
        assertThat(SheetNaming.slotNumber(EquipmentKind.FIRE_SUPPRESSION, slot)).contains(7);
        assertThat(SheetNaming.slotNumber(EquipmentKind.CANOPY, slot)).isEmpty();
        assertThat(SheetNaming.isSlot(slot)).isTrue();
        assertThat(SheetNaming.isSlot("JOB TOTAL")).isFalse();
    }

    @Test
    void areaSheet_shortLevel_keepsFullName() {
        assertThat(SheetNaming.areaSheet(EquipmentKind.CANOPY, "Ground Floor", 1))
            .isEqualTo("CANOPY - Ground Floor (1)");
    }

    @Test
    void areaSheet_longLevel_shortensLevelToFit() {
        // When
        String name = SheetNaming.areaSheet(EquipmentKind.FIRE_SUPPRESSION, "A Very Long Level Name For Testing", 12);

        // Then
        assertThat(name).hasSizeLessThanOrEqualTo(SheetNaming.MAX_LENGTH);
        assertThat(name).startsWith("FIRE SUPP - A Very").endsWith(" (12)");
    }

    @Test
    void areaSheet_unsafeCharacters_areReplaced() {
        String name = SheetNaming.areaSheet(EquipmentKind.UV_C, "Level 1/2", 3);

        assertThat(name).isEqualTo("EBOX - Level 1 2 (3)");
    }

    @Test
    void itemSheet_includesReference() {
        assertThat(SheetNaming.itemSheet(EquipmentKind.SDU, "Ground Floor", 1, "C2"))
            .isEqualTo("SDU - Ground Floor (1) - C2");
    }

    @Test
    void unique_clashingName_appendsCounterIgnoringCase() {
        // Given
        Set<String> used = new HashSet<>();
        used.add("CANOPY - KITCHEN (1)");

        // When
        String first = SheetNaming.unique("Canopy - Kitchen (1)", used);
        String second = SheetNaming.unique("Canopy - Kitchen (1)", used);

        // Then
        assertThat(first).isEqualTo("Canopy - Kitchen (1)~2");
        assertThat(second).isEqualTo("Canopy - Kitchen (1)~3");
        assertThat(used).contains("CANOPY - KITCHEN (1)~2", "CANOPY - KITCHEN (1)~3");
    }

    @Test
    void parse_itemSheet_returnsParts() {
        ParsedName parsed = SheetNaming.parse("SDU - Ground Floor (1) - C2").orElseThrow();

        assertThat(parsed.kind()).isEqualTo(EquipmentKind.SDU);
        assertThat(parsed.level()).isEqualTo("Ground Floor");
        assertThat(parsed.areaNumber()).isEqualTo(1);
        assertThat(parsed.reference()).isEqualTo("C2");
    }

    @Test
    void parse_areaSheet_hasNoReference() {
        ParsedName parsed = SheetNaming.parse("fire supp - Basement (4)").orElseThrow();

        assertThat(parsed.kind()).isEqualTo(EquipmentKind.FIRE_SUPPRESSION);
        assertThat(parsed.areaNumber()).isEqualTo(4);
        assertThat(parsed.reference()).isNull();
    }

    @Test
    void parse_otherSheets_returnEmpty() {
        assertThat(SheetNaming.parse("Notes")).isEmpty();
        assertThat(SheetNaming.parse("CANOPY #3")).isEmpty();
    }
}
