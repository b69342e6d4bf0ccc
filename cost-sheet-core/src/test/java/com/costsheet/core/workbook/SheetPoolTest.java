package com.costsheet.core.workbook;

import com.costsheet.core.exception.SheetPoolExhaustedException;
import com.costsheet.core.model.EquipmentKind;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SheetPool}.
 */
class SheetPoolTest {

    @Test
    void acquire_returnsLowestFreeSlotFirst() {
        // Given
        SheetPool pool = new SheetPool(EquipmentKind.FIRE_SUPPRESSION, List.of("FIRE SUPP #2", "FIRE SUPP #1", "FIRE SUPP #10"));

        // When / Then
        assertThat(pool.acquire()).isEqualTo("FIRE SUPP #1");
        assertThat(pool.acquire()).isEqualTo("FIRE SUPP #2");
        assertThat(pool.available()).isEqualTo(1);
        assertThat(pool.capacity()).isEqualTo(3);
    }

    @Test
    void acquire_emptyPool_throwsSheetPoolExhaustedException() {
        // Given
        SheetPool pool = new SheetPool(EquipmentKind.SDU, List.of("SDU #1"));
        pool.acquire();

        // When / Then
        assertThatThrownBy(pool::acquire)
            .isInstanceOf(SheetPoolExhaustedException.class)
            .satisfies(e -> assertThat(((SheetPoolExhaustedException) e).getKind()).isEqualTo(EquipmentKind.SDU));
    }

    @Test
    void release_returnsSlotToPool() {
        // Given
        SheetPool pool = new SheetPool(EquipmentKind.CANOPY, List.of("CANOPY #1", "CANOPY #2"));
        String slot = pool.acquire();

        // When
        pool.release(slot);

        // Then
        assertThat(pool.available()).isEqualTo(2);
        assertThat(pool.acquire()).isEqualTo("CANOPY #1");
    }

    @Test
    void release_slotNotAcquired_throwsIllegalArgumentException() {
        SheetPool pool = new SheetPool(EquipmentKind.CANOPY, List.of("CANOPY #1"));

        assertThatThrownBy(() -> pool.release("CANOPY #1")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> pool.release("EBOX #1")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void ensureCapacity_tooManyRequested_reportsCounts() {
        SheetPool pool = new SheetPool(EquipmentKind.UV_C, List.of("EBOX #1", "EBOX #2"));

        assertThatThrownBy(() -> pool.ensureCapacity(3))
            .isInstanceOf(SheetPoolExhaustedException.class)
            .hasMessageContaining("2 EBOX")
            .hasMessageContaining("3 are needed");
    }

    @Test
    void constructor_nonSlotName_throwsIllegalArgumentException() {
        assertThatThrownBy(() -> new SheetPool(EquipmentKind.CANOPY, List.of("JOB TOTAL")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void discover_findsTemplateSlotsOfKind() throws IOException {
        try (XSSFWorkbook workbook = new TemplateWorkbookFactory().create(Map.of(
            EquipmentKind.CANOPY, 3, EquipmentKind.SDU, 2))) {

            SheetPool canopies = SheetPool.discover(workbook, EquipmentKind.CANOPY);
            SheetPool fireSuppression = SheetPool.discover(workbook, EquipmentKind.FIRE_SUPPRESSION);

            assertThat(canopies.capacity()).isEqualTo(3);
            assertThat(canopies.unused()).containsExactly("CANOPY #1", "CANOPY #2", "CANOPY #3");
            assertThat(fireSuppression.capacity()).isZero();
        }
    }
}
