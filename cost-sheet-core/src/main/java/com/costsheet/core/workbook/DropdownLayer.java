package com.costsheet.core.workbook;

import com.costsheet.core.model.EquipmentKind;
import org.apache.poi.ss.usermodel.DataValidation;
import org.apache.poi.ss.usermodel.DataValidationConstraint;
import org.apache.poi.ss.usermodel.DataValidationHelper;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.CellRangeAddressList;
import org.apache.poi.ss.util.CellReference;

import java.util.List;
import java.util.function.IntFunction;

/**
 * List validations on item blocks, backed by columns of the hidden {@code Lists} sheet.
 */
final class DropdownLayer {

    static final List<String> CONFIGURATIONS = List.of("Wall", "Island", "Single", "Double", "Corner");
    static final List<String> MODELS = List.of("KVF", "KVI", "KVE", "KVT", "UVF", "UVI", "UVE", "CMWF", "CMWI");
    static final List<String> LIGHTING = List.of(
        "LED STRIP L6 Inc DALI", "LED STRIP L12 inc DALI", "LED STRIP L18 Inc DALI",
        "Small LED Spots inc DALI", "LARGE LED Spots inc DALI");
    static final List<String> FIRE_SUPPRESSION_SYSTEMS = List.of(
        "1 TANK SYSTEM", "2 TANK SYSTEM", "3 TANK SYSTEM", "4 TANK SYSTEM", "5 TANK SYSTEM", "6 TANK SYSTEM",
        "1 TANK DISTANCE", "2 TANK DISTANCE", "3 TANK DISTANCE", "4 TANK DISTANCE", "5 TANK DISTANCE", "6 TANK DISTANCE",
        "NOBEL", "AMAREX", "OTHER");
    static final List<String> TANK_SIZES = List.of("1 TANK", "2 TANK", "3 TANK", "4 TANK", "5 TANK", "6 TANK");

    private static final List<NamedList> LISTS = List.of(
        new NamedList("CONFIGURATION", CONFIGURATIONS),
        new NamedList("MODEL", MODELS),
        new NamedList("LIGHTING", LIGHTING),
        new NamedList("FIRE SUPPRESSION", FIRE_SUPPRESSION_SYSTEMS),
        new NamedList("TANK SIZE", TANK_SIZES));

    private DropdownLayer() {
    }

    /**
     * Writes every list into its column of the {@code Lists} sheet, header in row 1.
     */
    static void writeLists(Sheet lists) {
        for (int column = 0; column < LISTS.size(); column++) {
            NamedList list = LISTS.get(column);
            row(lists, 0).createCell(column).setCellValue(list.header());
            for (int i = 0; i < list.values().size(); i++) {
                row(lists, i + 1).createCell(column).setCellValue(list.values().get(i));
            }
        }
    }

    /**
     * Adds the validations relevant to a placed sheet of the given kind.
     */
    static void apply(Sheet sheet, EquipmentKind kind) {
        if (kind == EquipmentKind.CANOPY) {
            validate(sheet, 0, SheetLayout::configuration);
            validate(sheet, 1, SheetLayout::model);
            validate(sheet, 2, SheetLayout::lighting);
        } else if (kind == EquipmentKind.FIRE_SUPPRESSION) {
            validate(sheet, 3, SheetLayout::system);
            validate(sheet, 4, SheetLayout::quantity);
        }
    }

    private static void validate(Sheet sheet, int listColumn, IntFunction<String> cellOfBlock) {
        CellRangeAddressList targets = new CellRangeAddressList();
        for (int block = 0; block < SheetLayout.MAX_ITEM_BLOCKS; block++) {
            CellReference ref = new CellReference(cellOfBlock.apply(block));
            targets.addCellRangeAddress(ref.getRow(), ref.getCol(), ref.getRow(), ref.getCol());
        }
        DataValidationHelper helper = sheet.getDataValidationHelper();
        DataValidationConstraint constraint = helper.createFormulaListConstraint(rangeOf(listColumn));
        DataValidation validation = helper.createValidation(constraint, targets);
        validation.setShowErrorBox(false);
        validation.setSuppressDropDownArrow(true);
        sheet.addValidationData(validation);
    }

    private static String rangeOf(int listColumn) {
        String column = CellReference.convertNumToColString(listColumn);
        int last = LISTS.get(listColumn).values().size() + 1;
        return SheetLayout.LISTS_SHEET + "!$" + column + "$2:$" + column + "$" + last;
    }

    private static Row row(Sheet sheet, int index) {
        Row row = sheet.getRow(index);
        return row == null ? sheet.createRow(index) : row;
    }

    private record NamedList(String header, List<String> values) {}
}
