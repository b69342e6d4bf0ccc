package com.costsheet.core.workbook;

import com.costsheet.core.model.Area;
import com.costsheet.core.model.EquipmentKind;
import com.costsheet.core.model.Item;
import com.costsheet.core.model.Level;
import com.costsheet.core.model.Project;
import com.costsheet.core.model.ProjectInfo;
import com.costsheet.core.model.SharedCosts;
import com.costsheet.core.pricing.SharedCostScope;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Hidden sheet persisting the project metadata and its explicit structure.
 *
 * <p>Column A holds a record type, the following columns its values, all as text:
 * <pre>
 * project.number | 1234
 * scope          | AREA
 * LEVEL          | levelIndex | name
 * LEVEL_POOL     | levelIndex | kind | delivery | commissioning
 * AREA           | levelIndex | areaNumber | name | options
 * ITEM           | areaNumber | reference | options
 * SHEET          | kind | areaNumber | reference | sheetName
 * </pre>
 *
 * <p>Option flags recorded here are authoritative; which sheets exist is derived from them.
 */
final class ProjectDataSheet {

    static final String FORMAT_VERSION = "1";

    private static final String LEVEL = "LEVEL";
    private static final String LEVEL_POOL = "LEVEL_POOL";
    private static final String AREA = "AREA";
    private static final String ITEM = "ITEM";
    private static final String SHEET = "SHEET";

    private ProjectDataSheet() {
    }

    static void write(Sheet sheet, Project project, SharedCostScope scope, List<PlacedSheet> placed) {
        Writer writer = new Writer(sheet);
        ProjectInfo info = project.info();
        writer.row("version", FORMAT_VERSION);
        writer.row("project.name", info.name());
        writer.row("project.number", info.number());
        writer.row("project.customer", info.customer());
        writer.row("project.company", info.company());
        writer.row("project.address", info.address());
        writer.row("project.location", info.location());
        writer.row("project.deliveryLocation", info.deliveryLocation());
        writer.row("project.estimator", info.estimator());
        writer.row("project.salesContact", info.salesContact());
        writer.row("project.date", info.date() == null ? null : info.date().toString());
        writer.row("project.revision", info.revision());
        writer.row("scope", scope.name());

        int areaNumber = 0;
        for (int levelIndex = 0; levelIndex < project.levels().size(); levelIndex++) {
            Level level = project.levels().get(levelIndex);
            writer.row(LEVEL, String.valueOf(levelIndex), level.name());
            for (Map.Entry<EquipmentKind, SharedCosts> pool : level.sharedCosts().entrySet()) {
                writer.row(LEVEL_POOL, String.valueOf(levelIndex), pool.getKey().name(),
                    pool.getValue().delivery().toPlainString(), pool.getValue().commissioning().toPlainString());
            }
            for (Area area : level.areas()) {
                areaNumber++;
                writer.row(AREA, String.valueOf(levelIndex), String.valueOf(areaNumber), area.name(), join(area.options()));
                for (Item item : area.items()) {
                    writer.row(ITEM, String.valueOf(areaNumber), item.reference(), join(item.options().keySet()));
                }
            }
        }

        for (PlacedSheet sheetRow : placed) {
            writer.row(SHEET, sheetRow.kind().name(), String.valueOf(sheetRow.areaNumber()),
                sheetRow.reference(), sheetRow.name());
        }
    }

    static Stored read(Sheet sheet) {
        DataFormatter formatter = new DataFormatter(Locale.UK);
        Map<String, String> values = new HashMap<>();
        List<StoredLevel> levels = new ArrayList<>();
        Map<Integer, Map<EquipmentKind, SharedCosts>> levelPools = new HashMap<>();
        List<StoredArea> areas = new ArrayList<>();
        List<StoredItem> items = new ArrayList<>();
        List<PlacedSheet> sheets = new ArrayList<>();

        for (Row row : sheet) {
            String[] cells = new String[Math.max(row.getLastCellNum(), 0)];
            for (int i = 0; i < cells.length; i++) {
                String text = formatter.formatCellValue(row.getCell(i));
                cells[i] = text.isEmpty() ? null : text;
            }
            if (cells.length == 0 || cells[0] == null) {
                continue;
            }
            switch (cells[0]) {
                case LEVEL -> levels.add(new StoredLevel(Integer.parseInt(at(cells, 1)), nonNull(at(cells, 2))));
                case LEVEL_POOL -> levelPools
                    .computeIfAbsent(Integer.parseInt(at(cells, 1)), k -> new EnumMap<>(EquipmentKind.class))
                    .put(EquipmentKind.valueOf(at(cells, 2)),
                        new SharedCosts(decimal(at(cells, 3)), decimal(at(cells, 4))));
                case AREA -> areas.add(new StoredArea(Integer.parseInt(at(cells, 1)), Integer.parseInt(at(cells, 2)),
                    nonNull(at(cells, 3)), kinds(at(cells, 4))));
                case ITEM -> items.add(new StoredItem(Integer.parseInt(at(cells, 1)), at(cells, 2), kinds(at(cells, 3))));
                case SHEET -> sheets.add(new PlacedSheet(EquipmentKind.valueOf(at(cells, 1)), -1,
                    Integer.parseInt(at(cells, 2)), at(cells, 3), at(cells, 4)));
                default -> values.put(cells[0], at(cells, 1));
            }
        }

        ProjectInfo info = new ProjectInfo(
            values.get("project.name"),
            values.get("project.number"),
            values.get("project.customer"),
            values.get("project.company"),
            values.get("project.address"),
            values.get("project.location"),
            values.get("project.deliveryLocation"),
            values.get("project.estimator"),
            values.get("project.salesContact"),
            values.get("project.date") == null ? null : LocalDate.parse(values.get("project.date")),
            values.get("project.revision"));
        SharedCostScope scope = values.get("scope") == null ? null : SharedCostScope.valueOf(values.get("scope"));

        List<StoredLevel> withPools = levels.stream()
            .map(level -> new StoredLevel(level.index(), level.name(), levelPools.getOrDefault(level.index(), Map.of())))
            .toList();
        return new Stored(info, scope, withPools, areas, items, sheets);
    }

    private static String join(Set<EquipmentKind> kinds) {
        return kinds.stream().map(Enum::name).sorted().collect(Collectors.joining(","));
    }

    private static Set<EquipmentKind> kinds(String joined) {
        Set<EquipmentKind> kinds = EnumSet.noneOf(EquipmentKind.class);
        if (joined == null || joined.isBlank()) {
            return kinds;
        }
        Arrays.stream(joined.split(",")).map(String::trim).filter(s -> !s.isEmpty())
            .map(EquipmentKind::valueOf).forEach(kinds::add);
        return kinds;
    }

    private static String at(String[] cells, int index) {
        return index < cells.length ? cells[index] : null;
    }

    private static String nonNull(String value) {
        return value == null ? "" : value;
    }

    private static BigDecimal decimal(String value) {
        return value == null ? BigDecimal.ZERO : new BigDecimal(value);
    }

    private static final class Writer {
        private final Sheet sheet;
        private int next;

        Writer(Sheet sheet) {
            this.sheet = sheet;
            this.next = sheet.getPhysicalNumberOfRows() == 0 ? 0 : sheet.getLastRowNum() + 1;
        }

        void row(String... values) {
            Row row = sheet.createRow(next++);
            for (int i = 0; i < values.length; i++) {
                if (values[i] != null) {
                    row.createCell(i).setCellValue(values[i]);
                }
            }
        }
    }

    /**
     * Contents of the sheet.
     */
    record Stored(ProjectInfo info, SharedCostScope scope, List<StoredLevel> levels, List<StoredArea> areas,
                  List<StoredItem> items, List<PlacedSheet> sheets) {

        List<StoredArea> areasOf(int levelIndex) {
            return areas.stream().filter(area -> area.levelIndex() == levelIndex).toList();
        }

        List<StoredItem> itemsOf(int areaNumber) {
            return items.stream().filter(item -> item.areaNumber() == areaNumber).toList();
        }
    }

    record StoredLevel(int index, String name, Map<EquipmentKind, SharedCosts> pools) {
        StoredLevel(int index, String name) {
            this(index, name, Map.of());
        }
    }

    record StoredArea(int levelIndex, int areaNumber, String name, Set<EquipmentKind> options) {}

    record StoredItem(int areaNumber, String reference, Set<EquipmentKind> options) {}
}
