package com.costsheet.core.workbook;

import com.costsheet.core.TestProjects;
import com.costsheet.core.config.ConfiguredFeatureFlags;
import com.costsheet.core.config.FeatureFlags;
import com.costsheet.core.exception.WorkbookFormatException;
import com.costsheet.core.model.Area;
import com.costsheet.core.model.EquipmentKind;
import com.costsheet.core.model.Item;
import com.costsheet.core.model.ItemOption;
import com.costsheet.core.model.Project;
import com.costsheet.core.pricing.ModelExceptionTable;
import com.costsheet.core.pricing.PricingRuleEngine;
import com.costsheet.core.pricing.SharedCostPolicy;
import com.costsheet.core.pricing.SharedCostScope;
import com.costsheet.core.workbook.ReadReport.SkippedSheet;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SpreadsheetReader}.
 */
class SpreadsheetReaderTest {

    private SpreadsheetReader reader;

    @BeforeEach
    void setUp() {
        reader = new SpreadsheetReader(
            new PricingRuleEngine(SharedCostPolicy.defaults(), ModelExceptionTable.defaults()), SharedCostScope.AREA);
    }

    @Test
    void read_withProjectData_recoversProjectAndPricing() {
        // Given
        byte[] workbook = write(TestProjects.twoFireSuppressionItems());

        // When
        ReadResult result = reader.read(workbook);

        // Then
        assertThat(result.report().fromProjectData()).isTrue();
        assertThat(result.report().hasProblems()).isFalse();
        assertThat(result.project().info()).isEqualTo(TestProjects.info());
        Area area = result.project().levels().get(0).areas().get(0);
        assertThat(area.name()).isEqualTo(TestProjects.AREA);
        assertThat(area.items()).extracting(Item::reference).containsExactly("C1", "C2");
        assertThat(area.sharedCosts(EquipmentKind.FIRE_SUPPRESSION).delivery()).isEqualByComparingTo("800");
        assertThat(result.summary().rollup(EquipmentKind.FIRE_SUPPRESSION).total()).isEqualByComparingTo("3690");
        assertThat(result.summary().total()).isEqualByComparingTo("12690");
    }

    @Test
    void read_blankQuantity_staysUnspecified() {
        // When
        ReadResult result = reader.read(write(TestProjects.twoFireSuppressionItems()));

        // Then
        Area area = result.project().levels().get(0).areas().get(0);
        ItemOption first = area.items().get(0).option(EquipmentKind.FIRE_SUPPRESSION).orElseThrow();
        ItemOption second = area.items().get(1).option(EquipmentKind.FIRE_SUPPRESSION).orElseThrow();
        assertThat(first.quantity()).isEqualTo(2);
        assertThat(second.quantity()).isNull();
    }

    @Test
    void read_withProjectData_recoversSpecificationFields() {
        // When
        ReadResult result = reader.read(write(TestProjects.everyKind()));

        // Then
        Item clad = result.project().allItems().get(0);
        assertThat(clad.model()).isEqualTo("UVF");
        assertThat(clad.configuration()).isEqualTo("Wall");
        assertThat(clad.spec().lightingType()).isEqualTo("LED SPOTS");
        assertThat(clad.spec().extractStatic()).isEqualTo("160 Pa");
        assertThat(clad.spec().wallCladding().positions()).containsExactly("rear", "left");
        assertThat(clad.option(EquipmentKind.WALL_CLADDING).orElseThrow().price()).isEqualByComparingTo("750");
        assertThat(result.project().allAreas().get(0).options()).containsExactly(EquipmentKind.RECOAIR);
        assertThat(result.summary().total()).isEqualByComparingTo("24640");
    }

    @Test
    void read_withoutProjectData_infersStructureFromSheets() {
        // Given
        byte[] workbook = edit(write(TestProjects.everyKind()), book -> {
            book.removeSheetAt(book.getSheetIndex(SheetLayout.PROJECT_DATA_SHEET));
            book.createSheet("Notes");
        });

        // When
        ReadResult result = reader.read(workbook);

        // Then
        assertThat(result.report().fromProjectData()).isFalse();
        assertThat(result.report().skipped()).extracting(SkippedSheet::sheetName).containsExactly("Notes");
        assertThat(result.project().levels()).singleElement()
            .satisfies(level -> assertThat(level.name()).isEqualTo(TestProjects.LEVEL));
        Area area = result.project().allAreas().get(0);
        assertThat(area.name()).isEqualTo(TestProjects.AREA);
        assertThat(area.options()).containsExactly(EquipmentKind.RECOAIR);
        assertThat(area.items().get(0).options().keySet()).containsExactlyInAnyOrder(
            EquipmentKind.WALL_CLADDING, EquipmentKind.FIRE_SUPPRESSION, EquipmentKind.UV_C);
        assertThat(area.items().get(1).option(EquipmentKind.SDU).orElseThrow().price()).isEqualByComparingTo("3200");
        assertThat(result.project().info().number()).isEqualTo("1234");
        assertThat(result.project().info().estimator()).isEqualTo("YH/JS");
        assertThat(result.summary().total()).isEqualByComparingTo("24640");
    }

    @Test
    void read_editedPrice_isRepriced() {
        // Given
        byte[] workbook = edit(write(TestProjects.twoFireSuppressionItems()), book ->
            Cells.setNumber(book.getSheet("FIRE SUPP - Ground Floor (1)"), SheetLayout.price(0),
                new BigDecimal("2000"), null));

        // When
        ReadResult result = reader.read(workbook);

        // Then
        assertThat(result.summary().rollup(EquipmentKind.FIRE_SUPPRESSION).total()).isEqualByComparingTo("4000");
    }

    @Test
    void read_referenceWithUserSuffix_stillMatches() {
        // Given
        byte[] workbook = edit(write(TestProjects.twoFireSuppressionItems()), book ->
            Cells.setString(book.getSheet("FIRE SUPP - Ground Floor (1)"), SheetLayout.reference(0), "C1 (rev)"));

        // When
        ReadResult result = reader.read(workbook);

        // Then
        assertThat(result.report().warnings()).isEmpty();
        assertThat(result.summary().itemPrice("C1", EquipmentKind.FIRE_SUPPRESSION).orElseThrow().total())
            .isEqualByComparingTo("2090");
    }

    @Test
    void read_canopyReferenceWithUserSuffix_keepsSatelliteOptions() {
        // Given
        byte[] workbook = edit(write(TestProjects.twoFireSuppressionItems()), book -> {
            book.removeSheetAt(book.getSheetIndex(SheetLayout.PROJECT_DATA_SHEET));
            Cells.setString(book.getSheet("CANOPY - Ground Floor (1)"), SheetLayout.reference(0), "C1 (rev)");
        });

        // When
        ReadResult result = reader.read(workbook);

        // Then
        assertThat(result.report().warnings()).noneSatisfy(warning -> assertThat(warning).contains("matches no canopy item"));
        Item first = result.project().allItems().get(0);
        assertThat(first.reference()).isEqualTo("C1 (rev)");
        assertThat(first.option(EquipmentKind.FIRE_SUPPRESSION).orElseThrow().price()).isEqualByComparingTo("1690");
        assertThat(result.summary().total()).isEqualByComparingTo("12690");
    }

    @Test
    void read_shortReferenceOnSatellite_doesNotPickLongerSibling() {
        // Given
        Project project = TestProjects.project(new Area(TestProjects.AREA, Set.of(), List.of(
            TestProjects.withOption(TestProjects.canopy("C1", "KVF", "5000"), EquipmentKind.FIRE_SUPPRESSION, "1690", 1),
            TestProjects.canopy("C10", "KVI", "4000")), Map.of()));
        byte[] workbook = edit(write(project), book ->
            book.removeSheetAt(book.getSheetIndex(SheetLayout.PROJECT_DATA_SHEET)));

        // When
        ReadResult result = reader.read(workbook);

        // Then
        assertThat(result.project().allItems().get(0).hasOption(EquipmentKind.FIRE_SUPPRESSION)).isTrue();
        assertThat(result.project().allItems().get(1).hasOption(EquipmentKind.FIRE_SUPPRESSION)).isFalse();
    }

    @Test
    void read_corruptProjectData_fallsBackToInference() {
        // Given
        byte[] workbook = edit(write(TestProjects.twoFireSuppressionItems()), book -> {
            Sheet data = book.getSheet(SheetLayout.PROJECT_DATA_SHEET);
            for (Row row : data) {
                if ("LEVEL".equals(row.getCell(0).getStringCellValue())) {
                    row.getCell(1).setCellValue("first");
                }
            }
        });

        // When
        ReadResult result = reader.read(workbook);

        // Then
        assertThat(result.report().fromProjectData()).isFalse();
        assertThat(result.report().warnings())
            .anySatisfy(warning -> assertThat(warning).startsWith("Project data unreadable"));
        assertThat(result.project().allItems()).extracting(Item::reference).containsExactly("C1", "C2");
        assertThat(result.summary().total()).isEqualByComparingTo("12690");
    }

    @Test
    void read_disabledFeature_leavesItOutOfTotals() {
        // Given
        FeatureFlags noFireSuppression = new ConfiguredFeatureFlags(Map.of("fire-suppression", false));
        SpreadsheetReader featureReader = new SpreadsheetReader(
            new PricingRuleEngine(SharedCostPolicy.defaults(), ModelExceptionTable.defaults()), SharedCostScope.AREA,
            noFireSuppression);
        byte[] workbook = SpreadsheetSynthesizerTest.synthesize(TestProjects.twoFireSuppressionItems(),
            SpreadsheetSynthesizerTest.settings(true), noFireSuppression);

        // When
        ReadResult result = featureReader.read(workbook);

        // Then
        assertThat(result.report().hasProblems()).isFalse();
        assertThat(result.summary().rollup(EquipmentKind.FIRE_SUPPRESSION).count()).isZero();
        assertThat(result.summary().total()).isEqualByComparingTo("9000");
    }

    @Test
    void read_unknownRowReference_isReportedNotFatal() {
        // Given
        byte[] workbook = edit(write(TestProjects.twoFireSuppressionItems()), book ->
            Cells.setString(book.getSheet("FIRE SUPP - Ground Floor (1)"), SheetLayout.reference(0), "X9"));

        // When
        ReadResult result = reader.read(workbook);

        // Then
        assertThat(result.report().warnings())
            .anySatisfy(warning -> assertThat(warning).contains("X9").contains("matches no item"))
            .anySatisfy(warning -> assertThat(warning).contains("C1").contains("has no row on its sheet"));
        assertThat(result.summary().itemPrice("C1", EquipmentKind.FIRE_SUPPRESSION).orElseThrow().base())
            .isEqualByComparingTo("0");
    }

    @Test
    void read_notAWorkbook_throwsWorkbookFormatException() {
        byte[] garbage = "not a workbook".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> reader.read(garbage)).isInstanceOf(WorkbookFormatException.class);
    }

    private static byte[] write(Project project) {
        return SpreadsheetSynthesizerTest.synthesize(project, SpreadsheetSynthesizerTest.settings(true), FeatureFlags.allEnabled());
    }

    private static byte[] edit(byte[] bytes, Consumer<XSSFWorkbook> change) {
        try (XSSFWorkbook workbook = SpreadsheetSynthesizerTest.open(bytes);
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            change.accept(workbook);
            workbook.write(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }
}
