package com.costsheet.core.workbook;

import com.costsheet.core.model.EquipmentKind;
import org.apache.poi.ss.util.WorkbookUtil;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sheet names of slot and placed sheets.
 *
 * <ul>
 *   <li>slot: {@code "<PREFIX> #<n>"}</li>
 *   <li>area sheet: {@code "<PREFIX> - <level> (<areaNo>)"}</li>
 *   <li>item sheet: {@code "SDU - <level> (<areaNo>) - <ref>"}</li>
 * </ul>
 *
 * <p>Names are made Excel-safe and fitted to {@value #MAX_LENGTH} characters by
 * shortening the level part first.
 */
public final class SheetNaming {

    public static final int MAX_LENGTH = 31;

    private static final Pattern SLOT = Pattern.compile("^(.+) #(\\d+)$");
    private static final Pattern PLACED = Pattern.compile(
        "^(?<prefix>CANOPY|FIRE SUPP|EBOX|RECOAIR|REACTAWAY|SDU)(?: - (?<level>.*?))? \\((?<area>\\d+)\\)(?: - (?<ref>.*))?$",
        Pattern.CASE_INSENSITIVE);

    private SheetNaming() {
    }

    public static String slot(EquipmentKind kind, int number) {
        return kind.sheetPrefix() + " #" + number;
    }

    /**
     * Slot number of a slot sheet of the given kind.
     *
     * @param kind equipment kind
     * @param sheetName sheet name
     * @return slot number, empty if the name is not a slot of that kind
     */
    public static Optional<Integer> slotNumber(EquipmentKind kind, String sheetName) {
        Matcher matcher = SLOT.matcher(sheetName);
        if (matcher.matches() && matcher.group(1).equalsIgnoreCase(kind.sheetPrefix())) {
            return Optional.of(Integer.valueOf(matcher.group(2)));
        }
        return Optional.empty();
    }

    public static boolean isSlot(String sheetName) {
        return EquipmentKind.sheetKinds().stream().anyMatch(kind -> slotNumber(kind, sheetName).isPresent());
    }

    public static String areaSheet(EquipmentKind kind, String level, int areaNumber) {
        return fit(kind.sheetPrefix(), level, " (" + areaNumber + ")");
    }

    public static String itemSheet(EquipmentKind kind, String level, int areaNumber, String reference) {
        return fit(kind.sheetPrefix(), level, " (" + areaNumber + ") - " + safe(reference));
    }

    /**
     * Makes a name unique against names already used, comparing without case like Excel does.
     *
     * @param name candidate name
     * @param used names already in use, upper-cased; the returned name is added
     * @return unique name
     */
    public static String unique(String name, Set<String> used) {
        String candidate = name;
        int counter = 2;
        while (used.contains(candidate.toUpperCase(Locale.ROOT))) {
            String suffix = "~" + counter++;
            int keep = Math.min(name.length(), MAX_LENGTH - suffix.length());
            candidate = name.substring(0, keep).stripTrailing() + suffix;
        }
        used.add(candidate.toUpperCase(Locale.ROOT));
        return candidate;
    }

    /**
     * Parses a placed sheet name.
     *
     * @param sheetName sheet name
     * @return parsed parts, empty for names that are not placed sheets
     */
    public static Optional<ParsedName> parse(String sheetName) {
        Matcher matcher = PLACED.matcher(sheetName.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String prefix = matcher.group("prefix").toUpperCase(Locale.ROOT);
        return EquipmentKind.sheetKinds().stream()
            .filter(kind -> kind.sheetPrefix().equals(prefix))
            .findFirst()
            .map(kind -> new ParsedName(kind, matcher.group("level"),
                Integer.parseInt(matcher.group("area")), matcher.group("ref")));
    }

    private static String fit(String prefix, String level, String tail) {
        String head = prefix + " - ";
        String safeLevel = safe(level);
        int room = MAX_LENGTH - head.length() - tail.length();
        if (room >= safeLevel.length()) {
            return head + safeLevel + tail;
        }
        if (room > 0) {
            String shortened = safeLevel.substring(0, room).stripTrailing();
            return shortened.isEmpty() ? prefix + tail : head + shortened + tail;
        }
        String name = prefix + tail;
        return name.length() <= MAX_LENGTH ? name : name.substring(0, MAX_LENGTH).stripTrailing();
    }

    private static String safe(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        return WorkbookUtil.createSafeSheetName(value.trim(), ' ').trim();
    }

    /**
     * Parts of a placed sheet name.
     *
     * @param kind equipment kind from the prefix
     * @param level level part, possibly shortened or absent
     * @param areaNumber area number
     * @param reference item reference for item sheets, null otherwise
     */
    public record ParsedName(EquipmentKind kind, String level, int areaNumber, String reference) {}
}
