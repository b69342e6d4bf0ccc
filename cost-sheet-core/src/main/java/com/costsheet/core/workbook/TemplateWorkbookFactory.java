package com.costsheet.core.workbook;

import com.costsheet.core.model.EquipmentKind;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.SheetVisibility;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Produces the template workbook the synthesizer fills in.
 *
 * <p>The built-in template holds {@code JOB TOTAL}, a hidden {@code Lists} sheet and, per
 * sheet-bearing kind, a pool of hidden slot sheets {@code "<PREFIX> #<n>"} with the block
 * labels and the {@code ITEM} / {@code CANOPY TYPE} placeholders written in.
 */
public class TemplateWorkbookFactory {

    private static final Logger log = LoggerFactory.getLogger(TemplateWorkbookFactory.class);

    /**
     * Builds a template with the given slot counts.
     *
     * @param poolSizes slot sheets per kind; kinds without an entry get none
     * @return new workbook, owned by the caller
     */
    public XSSFWorkbook create(Map<EquipmentKind, Integer> poolSizes) {
        XSSFWorkbook workbook = new XSSFWorkbook();
        Sheet jobTotal = workbook.createSheet(SheetLayout.JOB_TOTAL_SHEET);
        Cells.setString(jobTotal, "A1", "SHEET");
        Cells.setString(jobTotal, "B1", "TOTAL");

        Sheet lists = workbook.createSheet(SheetLayout.LISTS_SHEET);
        DropdownLayer.writeLists(lists);
        workbook.setSheetVisibility(workbook.getSheetIndex(lists), SheetVisibility.HIDDEN);

        int slots = 0;
        for (EquipmentKind kind : EquipmentKind.sheetKinds()) {
            int size = poolSizes.getOrDefault(kind, 0);
            for (int number = 1; number <= size; number++) {
                Sheet slot = workbook.createSheet(SheetNaming.slot(kind, number));
                writeSlotLayout(slot, kind);
                workbook.setSheetVisibility(workbook.getSheetIndex(slot), SheetVisibility.HIDDEN);
                slots++;
            }
        }
        log.debug("Built template workbook with {} slot sheets", slots);
        return workbook;
    }

    /**
     * Loads a template workbook from disk.
     *
     * @param templatePath path to an {@code .xlsx} template
     * @return workbook, owned by the caller
     * @throws IOException if the file cannot be read or is not a workbook
     */
    public XSSFWorkbook load(Path templatePath) throws IOException {
        log.debug("Loading template workbook from: {}", templatePath);
        try (InputStream in = Files.newInputStream(templatePath)) {
            return new XSSFWorkbook(in);
        }
    }

    private static void writeSlotLayout(Sheet sheet, EquipmentKind kind) {
        Cells.setString(sheet, "B3", "JOB NO");
        Cells.setString(sheet, "B5", "CUSTOMER");
        Cells.setString(sheet, "B7", "ESTIMATOR");
        Cells.setString(sheet, "F3", "PROJECT");
        Cells.setString(sheet, "F5", "LOCATION");
        Cells.setString(sheet, "F7", "DATE");
        Cells.setString(sheet, "I3", "REV");

        for (int block = 0; block < SheetLayout.MAX_ITEM_BLOCKS; block++) {
            int row = SheetLayout.itemRow(block);
            Cells.setString(sheet, SheetLayout.reference(block), SheetLayout.ITEM_PLACEHOLDER);
            Cells.setString(sheet, SheetLayout.model(block), SheetLayout.MODEL_PLACEHOLDER);
            if (kind == EquipmentKind.CANOPY) {
                Cells.setString(sheet, "C" + (row - 1), "CONFIG");
                Cells.setString(sheet, "D" + (row - 1), "MODEL");
                Cells.setString(sheet, "E" + (row - 1), "WIDTH");
                Cells.setString(sheet, "F" + (row - 1), "LENGTH");
                Cells.setString(sheet, "G" + (row - 1), "HEIGHT");
                Cells.setString(sheet, "H" + (row - 1), "SECTIONS");
                Cells.setString(sheet, "I" + (row - 1), "EXTRACT m3/s");
                Cells.setString(sheet, "K" + (row - 1), "SUPPLY m3/s");
                Cells.setString(sheet, "L" + (row - 1), "SUPPLY Pa");
                Cells.setString(sheet, "B" + (row + 1), "LIGHTING");
                Cells.setString(sheet, "B" + (row + 5), "WALL CLADDING");
                Cells.setString(sheet, "E" + (row + 8), "EXTRACT Pa");
                Cells.setString(sheet, "H" + (row + 8), "WEIGHT");
            } else {
                Cells.setString(sheet, "B" + (row + 2), "SYSTEM");
                Cells.setString(sheet, "B" + (row + 3), "QUANTITY");
            }
        }

        Cells.setString(sheet, "B182", "DELIVERY & INSTALLATION");
        Cells.setString(sheet, "B183", "COMMISSIONING");
        Cells.setString(sheet, "B185", "TOTAL");
    }
}
