package com.costsheet.core.workbook;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.CellValue;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.CellReference;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cell access by A1 reference.
 */
final class Cells {

    private static final DataFormatter FORMATTER = new DataFormatter(Locale.UK);
    private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*(\\d+)");
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        DateTimeFormatter.ofPattern("dd/MM/yyyy", Locale.UK),
        DateTimeFormatter.ofPattern("d/M/yyyy", Locale.UK),
        DateTimeFormatter.ofPattern("d MMMM yyyy", Locale.UK)
    );

    private Cells() {
    }

    static Cell cell(Sheet sheet, String ref) {
        CellReference reference = new CellReference(ref);
        Row row = sheet.getRow(reference.getRow());
        if (row == null) {
            row = sheet.createRow(reference.getRow());
        }
        Cell cell = row.getCell(reference.getCol());
        if (cell == null) {
            cell = row.createCell(reference.getCol());
        }
        return cell;
    }

    static Cell existing(Sheet sheet, String ref) {
        CellReference reference = new CellReference(ref);
        Row row = sheet.getRow(reference.getRow());
        return row == null ? null : row.getCell(reference.getCol());
    }

    static void setString(Sheet sheet, String ref, String value) {
        Cell cell = cell(sheet, ref);
        if (value == null || value.isBlank()) {
            cell.setBlank();
        } else {
            cell.setCellValue(value);
        }
    }

    static void setNumber(Sheet sheet, String ref, BigDecimal value, CellStyle style) {
        Cell cell = cell(sheet, ref);
        if (value == null) {
            cell.setBlank();
        } else {
            cell.setCellValue(value.doubleValue());
        }
        if (style != null) {
            cell.setCellStyle(style);
        }
    }

    static void setNumber(Sheet sheet, String ref, int value) {
        cell(sheet, ref).setCellValue(value);
    }

    static void setDate(Sheet sheet, String ref, LocalDate value, CellStyle style) {
        Cell cell = cell(sheet, ref);
        if (value == null) {
            cell.setBlank();
            return;
        }
        cell.setCellValue(value);
        cell.setCellStyle(style);
    }

    static void setFormula(Sheet sheet, String ref, String formula, CellStyle style) {
        Cell cell = cell(sheet, ref);
        cell.setCellFormula(formula);
        if (style != null) {
            cell.setCellStyle(style);
        }
    }

    /**
     * Displayed text of a cell, trimmed. Blank cells read as null.
     */
    static String string(Sheet sheet, String ref, FormulaEvaluator evaluator) {
        Cell cell = existing(sheet, ref);
        if (cell == null) {
            return null;
        }
        String text = FORMATTER.formatCellValue(cell, evaluator).trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Numeric value of a cell at money scale. Blank or non-numeric cells read as null.
     */
    static BigDecimal decimal(Sheet sheet, String ref, FormulaEvaluator evaluator) {
        Cell cell = existing(sheet, ref);
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            CellValue value = evaluator.evaluate(cell);
            if (value == null) {
                return null;
            }
            if (value.getCellType() == CellType.NUMERIC) {
                return BigDecimal.valueOf(value.getNumberValue()).setScale(2, RoundingMode.HALF_UP);
            }
            return parseDecimal(value.getStringValue());
        }
        if (type == CellType.NUMERIC) {
            return BigDecimal.valueOf(cell.getNumericCellValue()).setScale(2, RoundingMode.HALF_UP);
        }
        if (type == CellType.STRING) {
            return parseDecimal(cell.getStringCellValue());
        }
        return null;
    }

    /**
     * Leading integer of a cell, so {@code "3 TANK"} reads as 3. Blank cells read as null.
     */
    static Integer integer(Sheet sheet, String ref, FormulaEvaluator evaluator) {
        String text = string(sheet, ref, evaluator);
        if (text == null) {
            return null;
        }
        Matcher matcher = LEADING_INTEGER.matcher(text);
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }

    static LocalDate date(Sheet sheet, String ref, FormulaEvaluator evaluator) {
        Cell cell = existing(sheet, ref);
        if (cell == null) {
            return null;
        }
        if (cell.getCellType() == CellType.NUMERIC && DateUtil.isCellDateFormatted(cell)) {
            return cell.getLocalDateTimeCellValue().toLocalDate();
        }
        return parseDate(string(sheet, ref, evaluator));
    }

    static LocalDate parseDate(String text) {
        if (text == null) {
            return null;
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(text.trim(), format);
            } catch (DateTimeParseException e) {
                // next format
            }
        }
        return null;
    }

    private static BigDecimal parseDecimal(String text) {
        if (text == null) {
            return null;
        }
        String cleaned = text.replaceAll("[£$€,\\s]", "");
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(cleaned).setScale(2, RoundingMode.HALF_UP);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
