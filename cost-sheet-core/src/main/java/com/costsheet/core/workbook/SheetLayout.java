package com.costsheet.core.workbook;

/**
 * Cell coordinates of the cost sheet layout.
 *
 * <p>Every priced sheet repeats the same item block every {@value #ITEM_ROW_SPACING} rows,
 * starting at row {@value #FIRST_ITEM_ROW}. Coordinates inside a block are relative to the
 * block's item row {@code r}: the reference and price sit two rows above it, the dimension
 * row is {@code r} itself, and the remaining fields hang below.
 */
public final class SheetLayout {

    public static final String JOB_TOTAL_SHEET = "JOB TOTAL";
    public static final String LISTS_SHEET = "Lists";
    public static final String PROJECT_DATA_SHEET = "ProjectData";

    public static final String ITEM_PLACEHOLDER = "ITEM";
    public static final String MODEL_PLACEHOLDER = "CANOPY TYPE";

    public static final String TITLE = "B1";
    public static final String JOB_NUMBER = "C3";
    public static final String CUSTOMER = "C5";
    public static final String ESTIMATOR = "C7";
    public static final String PROJECT_NAME = "G3";
    public static final String LOCATION = "G5";
    public static final String DATE = "G7";
    public static final String REVISION = "J3";

    public static final String DELIVERY = "N182";
    public static final String COMMISSIONING = "N183";
    public static final String SHEET_TOTAL = "N185";
    public static final String SHEET_TOTAL_FORMULA = "SUM(N12:N180)+N182+N183";

    public static final int FIRST_ITEM_ROW = 14;
    public static final int ITEM_ROW_SPACING = 17;
    public static final int MAX_ITEM_BLOCKS = 10;

    private SheetLayout() {
    }

    /**
     * 1-based item row of a block.
     *
     * @param block 0-based block index
     * @return item row
     */
    public static int itemRow(int block) {
        if (block < 0 || block >= MAX_ITEM_BLOCKS) {
            throw new IllegalArgumentException("Block index out of range: " + block);
        }
        return FIRST_ITEM_ROW + block * ITEM_ROW_SPACING;
    }

    public static String reference(int block) {
        return "B" + (itemRow(block) - 2);
    }

    public static String price(int block) {
        return "N" + (itemRow(block) - 2);
    }

    public static String configuration(int block) {
        return "C" + itemRow(block);
    }

    public static String model(int block) {
        return "D" + itemRow(block);
    }

    public static String width(int block) {
        return "E" + itemRow(block);
    }

    public static String length(int block) {
        return "F" + itemRow(block);
    }

    public static String height(int block) {
        return "G" + itemRow(block);
    }

    public static String sections(int block) {
        return "H" + itemRow(block);
    }

    public static String extractVolume(int block) {
        return "I" + itemRow(block);
    }

    public static String supplyVolume(int block) {
        return "K" + itemRow(block);
    }

    public static String supplyStatic(int block) {
        return "L" + itemRow(block);
    }

    public static String lighting(int block) {
        return "C" + (itemRow(block) + 1);
    }

    public static String system(int block) {
        return "C" + (itemRow(block) + 2);
    }

    public static String quantity(int block) {
        return "C" + (itemRow(block) + 3);
    }

    public static String claddingPositions(int block) {
        return "C" + (itemRow(block) + 5);
    }

    public static String claddingWidth(int block) {
        return "E" + (itemRow(block) + 5);
    }

    public static String claddingHeight(int block) {
        return "G" + (itemRow(block) + 5);
    }

    public static String claddingPrice(int block) {
        return "N" + (itemRow(block) + 5);
    }

    public static String extractStatic(int block) {
        return "F" + (itemRow(block) + 8);
    }

    public static String weight(int block) {
        return "I" + (itemRow(block) + 8);
    }

    /**
     * Whether a cell value is one of the template placeholders.
     *
     * @param value cell text, may be null
     * @return true for {@code ITEM} or {@code CANOPY TYPE}
     */
    public static boolean isPlaceholder(String value) {
        return value != null
            && (ITEM_PLACEHOLDER.equalsIgnoreCase(value.trim()) || MODEL_PLACEHOLDER.equalsIgnoreCase(value.trim()));
    }
}
