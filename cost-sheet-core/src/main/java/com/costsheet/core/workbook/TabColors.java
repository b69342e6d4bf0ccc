package com.costsheet.core.workbook;

import org.apache.poi.xssf.usermodel.DefaultIndexedColorMap;
import org.apache.poi.xssf.usermodel.XSSFColor;

import java.util.HexFormat;
import java.util.List;

/**
 * Tab colours cycled by level position.
 */
public final class TabColors {

    public static final List<String> ARGB = List.of(
        "FF92D050", "FF00B0F0", "FFFF9900", "FFFF00FF", "FF7030A0",
        "FFFF0000", "FF00FF00", "FF0070C0", "FFFFC000", "FF00FFFF");

    private TabColors() {
    }

    public static String argbForLevel(int levelIndex) {
        return ARGB.get(Math.floorMod(levelIndex, ARGB.size()));
    }

    public static XSSFColor forLevel(int levelIndex) {
        byte[] argb = HexFormat.of().parseHex(argbForLevel(levelIndex));
        return new XSSFColor(argb, new DefaultIndexedColorMap());
    }
}
