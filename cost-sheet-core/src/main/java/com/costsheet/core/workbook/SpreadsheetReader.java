package com.costsheet.core.workbook;

import com.costsheet.core.aggregate.AggregationEngine;
import com.costsheet.core.aggregate.PricingSummary;
import com.costsheet.core.config.FeatureFlags;
import com.costsheet.core.exception.CostSheetException;
import com.costsheet.core.exception.WorkbookFormatException;
import com.costsheet.core.model.Area;
import com.costsheet.core.model.EquipmentKind;
import com.costsheet.core.model.Item;
import com.costsheet.core.model.ItemOption;
import com.costsheet.core.model.ItemSpec;
import com.costsheet.core.model.Level;
import com.costsheet.core.model.Project;
import com.costsheet.core.model.ProjectInfo;
import com.costsheet.core.model.SharedCosts;
import com.costsheet.core.model.WallCladding;
import com.costsheet.core.pricing.PricingRuleEngine;
import com.costsheet.core.pricing.SharedCostScope;
import com.costsheet.core.workbook.ProjectDataSheet.Stored;
import com.costsheet.core.workbook.ProjectDataSheet.StoredArea;
import com.costsheet.core.workbook.ProjectDataSheet.StoredItem;
import com.costsheet.core.workbook.ProjectDataSheet.StoredLevel;
import com.costsheet.core.workbook.ReadReport.SkippedSheet;
import com.costsheet.core.workbook.SheetNaming.ParsedName;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.SheetVisibility;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Reads a cost sheet workbook back into a project and reprices it.
 *
 * <p>When the hidden {@code ProjectData} sheet is present it supplies the structure and
 * the option flags; prices, pools and specification fields still come from the visible
 * sheets. Workbooks without it are inferred from sheet names and titles: canopy sheets
 * give levels, areas and items, satellite sheets give item options (or area options when
 * they carry no item rows), SDU sheet names give SDU options.
 *
 * <p>Sheets that cannot be read are skipped and listed in the {@link ReadReport}; the
 * result is partial rather than a failure. A {@code ProjectData} sheet that cannot be parsed
 * is reported as a warning and the structure is inferred instead.
 */
public class SpreadsheetReader {

    private static final Logger log = LoggerFactory.getLogger(SpreadsheetReader.class);

    private static final List<EquipmentKind> SATELLITE_KINDS = List.of(
        EquipmentKind.FIRE_SUPPRESSION, EquipmentKind.UV_C, EquipmentKind.RECOAIR,
        EquipmentKind.REACTAWAY, EquipmentKind.SDU);

    private final PricingRuleEngine pricing;
    private final SharedCostScope defaultScope;
    private final FeatureFlags features;

    public SpreadsheetReader(PricingRuleEngine pricing, SharedCostScope defaultScope) {
        this(pricing, defaultScope, FeatureFlags.allEnabled());
    }

    public SpreadsheetReader(PricingRuleEngine pricing, SharedCostScope defaultScope, FeatureFlags features) {
        this.pricing = Objects.requireNonNull(pricing, "pricing must not be null");
        this.defaultScope = Objects.requireNonNull(defaultScope, "defaultScope must not be null");
        this.features = Objects.requireNonNull(features, "features must not be null");
    }

    /**
     * Reads a workbook.
     *
     * @param bytes workbook bytes
     * @return recovered project, its pricing summary and the read report
     * @throws WorkbookFormatException if the bytes are not a workbook
     */
    public ReadResult read(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        Workbook workbook = open(bytes);
        try (workbook) {
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            Report report = new Report();
            Optional<Stored> stored = projectData(workbook, report);

            Project project;
            SharedCostScope scope;
            if (stored.isPresent()) {
                scope = stored.get().scope() == null ? defaultScope : stored.get().scope();
                log.info("Reading cost sheet {} from its project data", stored.get().info().number());
                project = fromProjectData(workbook, stored.get(), scope, evaluator, report);
            } else {
                scope = defaultScope;
                log.info("Reading cost sheet without project data; inferring structure from sheets");
                project = inferStructure(workbook, scope, evaluator, report);
            }

            PricingSummary summary = new AggregationEngine(pricing, scope, features).aggregate(project);
            ReadReport readReport = new ReadReport(stored.isPresent(), report.skipped, report.warnings);
            readReport.skipped().forEach(s -> log.warn("Skipped sheet {}: {}", s.sheetName(), s.reason()));
            readReport.warnings().forEach(w -> log.warn("Cost sheet warning: {}", w));
            return new ReadResult(project, summary, readReport);
        } catch (IOException e) {
            throw new CostSheetException("Failed to close workbook: " + e.getMessage(), e);
        }
    }

    private static Workbook open(byte[] bytes) {
        try {
            return WorkbookFactory.create(new ByteArrayInputStream(bytes));
        } catch (IOException | RuntimeException e) {
            throw new WorkbookFormatException("Not a readable workbook: " + e.getMessage(), e);
        }
    }

    private static Optional<Stored> projectData(Workbook workbook, Report report) {
        Sheet data = workbook.getSheet(SheetLayout.PROJECT_DATA_SHEET);
        if (data == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(ProjectDataSheet.read(data));
        } catch (RuntimeException e) {
            report.warn("Project data unreadable (%s); inferring structure from sheets", e.getMessage());
            return Optional.empty();
        }
    }

    // ---------------------------------------------------------------- project data path

    private Project fromProjectData(Workbook workbook, Stored stored, SharedCostScope scope,
                                    FormulaEvaluator evaluator, Report report) {
        List<Level> levels = new ArrayList<>();
        List<StoredLevel> storedLevels = stored.levels().stream()
            .sorted(Comparator.comparingInt(StoredLevel::index)).toList();

        for (StoredLevel storedLevel : storedLevels) {
            Map<EquipmentKind, SharedCosts> levelPools = new EnumMap<>(EquipmentKind.class);
            Set<EquipmentKind> kindsWithSheets = EnumSet.noneOf(EquipmentKind.class);
            List<Area> areas = new ArrayList<>();

            for (StoredArea storedArea : stored.areasOf(storedLevel.index())) {
                Map<EquipmentKind, List<Sheet>> sheets = sheetsOfArea(workbook, stored, storedLevel, storedArea, report);
                List<StoredItem> storedItems = stored.itemsOf(storedArea.areaNumber());
                List<String> references = storedItems.stream().map(StoredItem::reference).toList();
                String where = storedLevel.name() + " / " + storedArea.name();

                Map<String, Block> canopyRows = new LinkedHashMap<>();
                for (Sheet sheet : sheets.getOrDefault(EquipmentKind.CANOPY, List.of())) {
                    try {
                        canopyRows.putAll(matchBlocks(sheet, readBlocks(sheet, evaluator), references, report));
                    } catch (RuntimeException e) {
                        report.skip(sheet.getSheetName(), "unexpected layout: " + e.getMessage());
                    }
                }

                Map<EquipmentKind, Map<String, Block>> optionRows = new EnumMap<>(EquipmentKind.class);
                for (EquipmentKind kind : SATELLITE_KINDS) {
                    Map<String, Block> rows = new LinkedHashMap<>();
                    for (Sheet sheet : sheets.getOrDefault(kind, List.of())) {
                        try {
                            rows.putAll(matchBlocks(sheet, satelliteBlocks(sheet, kind, evaluator), references, report));
                        } catch (RuntimeException e) {
                            report.skip(sheet.getSheetName(), "unexpected layout: " + e.getMessage());
                        }
                    }
                    optionRows.put(kind, rows);
                }

                List<Item> items = new ArrayList<>();
                for (StoredItem storedItem : storedItems) {
                    items.add(rebuildItem(storedItem, canopyRows, optionRows, sheets, where, report, features));
                }
                for (Map.Entry<EquipmentKind, Map<String, Block>> entry : optionRows.entrySet()) {
                    for (String reference : entry.getValue().keySet()) {
                        boolean flagged = storedItems.stream()
                            .anyMatch(item -> item.reference().equals(reference) && item.options().contains(entry.getKey()));
                        if (!flagged) {
                            report.warn("%s row for %s in %s has no matching flag; ignored",
                                entry.getKey().label(), reference, where);
                        }
                    }
                }

                Map<EquipmentKind, SharedCosts> areaPools = new EnumMap<>(EquipmentKind.class);
                for (Map.Entry<EquipmentKind, List<Sheet>> entry : sheets.entrySet()) {
                    SharedCosts pools = readPools(entry.getValue(), evaluator);
                    kindsWithSheets.add(entry.getKey());
                    if (scope == SharedCostScope.AREA) {
                        if (pools.hasAny()) {
                            areaPools.put(entry.getKey(), pools);
                        }
                    } else {
                        levelPools.merge(entry.getKey(), pools, SpreadsheetReader::sum);
                    }
                }
                areas.add(new Area(storedArea.name(), storedArea.options(), items, areaPools));
            }

            Map<EquipmentKind, SharedCosts> finalLevelPools = new EnumMap<>(EquipmentKind.class);
            if (scope == SharedCostScope.LEVEL) {
                levelPools.forEach((kind, pools) -> {
                    if (pools.hasAny()) {
                        finalLevelPools.put(kind, pools);
                    }
                });
                storedLevel.pools().forEach((kind, pools) -> {
                    if (!kindsWithSheets.contains(kind)) {
                        finalLevelPools.put(kind, pools);
                    }
                });
            } else {
                finalLevelPools.putAll(storedLevel.pools());
            }
            levels.add(new Level(storedLevel.name(), areas, finalLevelPools));
        }
        return new Project(stored.info(), levels);
    }

    private static Item rebuildItem(StoredItem storedItem, Map<String, Block> canopyRows,
                                    Map<EquipmentKind, Map<String, Block>> optionRows,
                                    Map<EquipmentKind, List<Sheet>> sheets, String where, Report report,
                                    FeatureFlags features) {
        String reference = storedItem.reference();
        Block row = canopyRows.get(reference);
        if (row == null) {
            report.warn("Item %s in %s has no row on the canopy sheet", reference, where);
        }

        Map<EquipmentKind, ItemOption> options = new EnumMap<>(EquipmentKind.class);
        for (EquipmentKind kind : storedItem.options()) {
            boolean enabled = features.isEnabled(kind);
            if (kind == EquipmentKind.WALL_CLADDING) {
                if (enabled && (row == null || row.claddingPrice() == null)) {
                    report.warn("Item %s in %s is flagged for wall cladding but has no cladding price", reference, where);
                }
                options.put(kind, new ItemOption(row == null ? null : row.claddingPrice(), null, null));
                continue;
            }
            Block optionRow = optionRows.getOrDefault(kind, Map.of()).get(reference);
            if (optionRow == null) {
                if (enabled && (sheets.containsKey(kind) || kind == EquipmentKind.SDU)) {
                    report.warn("Item %s in %s is flagged for %s but has no row on its sheet",
                        reference, where, kind.label());
                }
                options.put(kind, new ItemOption(null, null, null));
            } else {
                options.put(kind, new ItemOption(optionRow.price(), optionRow.system(), optionRow.quantity()));
            }
        }

        if (row == null) {
            return new Item(reference, null, null, null, null, options);
        }
        return new Item(reference, row.model(), row.configuration(), row.price(), row.spec(), options);
    }

    private static Map<EquipmentKind, List<Sheet>> sheetsOfArea(Workbook workbook, Stored stored, StoredLevel level,
                                                               StoredArea area, Report report) {
        Map<EquipmentKind, List<Sheet>> sheets = new EnumMap<>(EquipmentKind.class);
        stored.sheets().stream()
            .filter(placed -> placed.areaNumber() == area.areaNumber())
            .forEach(placed -> {
                Optional<Sheet> sheet = locate(workbook, placed, level.name(), area.name());
                if (sheet.isPresent()) {
                    sheets.computeIfAbsent(placed.kind(), k -> new ArrayList<>()).add(sheet.get());
                } else {
                    report.warn("Sheet %s listed in project data is missing", placed.name());
                }
            });
        return sheets;
    }

    /**
     * Finds a placed sheet by name, then by title, then by parsed name.
     */
    private static Optional<Sheet> locate(Workbook workbook, PlacedSheet placed, String level, String area) {
        Sheet byName = workbook.getSheet(placed.name());
        if (byName != null && isVisible(workbook, byName)) {
            return Optional.of(byName);
        }
        String title = level + " - " + area + (placed.kind() == EquipmentKind.CANOPY ? "" : " - " + placed.kind().label());
        for (Sheet sheet : workbook) {
            if (!isVisible(workbook, sheet)) {
                continue;
            }
            String sheetTitle = Cells.string(sheet, SheetLayout.TITLE, null);
            Optional<ParsedName> parsed = SheetNaming.parse(sheet.getSheetName());
            boolean sameKind = parsed.map(name -> name.kind() == placed.kind()).orElse(false);
            boolean sameItem = placed.reference() == null
                || parsed.map(name -> ReferenceMatcher.sameItem(name.reference(), placed.reference())).orElse(false);
            if (sameKind && sameItem && title.equalsIgnoreCase(sheetTitle)) {
                return Optional.of(sheet);
            }
            if (sameKind && sameItem && parsed.get().areaNumber() == placed.areaNumber()) {
                return Optional.of(sheet);
            }
        }
        return Optional.empty();
    }

    // ---------------------------------------------------------------- structural inference

    private Project inferStructure(Workbook workbook, SharedCostScope scope, FormulaEvaluator evaluator, Report report) {
        Map<Integer, AreaDraft> drafts = new LinkedHashMap<>();
        List<ParsedSheet> satellites = new ArrayList<>();
        List<ParsedSheet> canopies = new ArrayList<>();

        for (Sheet sheet : workbook) {
            String name = sheet.getSheetName();
            if (!isVisible(workbook, sheet) || SheetLayout.JOB_TOTAL_SHEET.equalsIgnoreCase(name)) {
                continue;
            }
            Optional<ParsedName> parsed = SheetNaming.parse(name);
            if (parsed.isEmpty()) {
                report.skip(name, "unrecognised sheet name");
                continue;
            }
            ParsedSheet entry = new ParsedSheet(sheet, parsed.get());
            if (parsed.get().kind() == EquipmentKind.CANOPY) {
                canopies.add(entry);
            } else {
                satellites.add(entry);
            }
        }

        canopies.sort(Comparator.comparingInt(entry -> entry.name().areaNumber()));
        ProjectInfo info = null;
        for (ParsedSheet canopy : canopies) {
            String sheetName = canopy.sheet().getSheetName();
            try {
                String title = Cells.string(canopy.sheet(), SheetLayout.TITLE, evaluator);
                if (title == null) {
                    report.skip(sheetName, "missing title");
                    continue;
                }
                int separator = title.indexOf(" - ");
                if (separator < 0) {
                    report.skip(sheetName, "title is not '<level> - <area>': " + title);
                    continue;
                }
                if (drafts.containsKey(canopy.name().areaNumber())) {
                    report.skip(sheetName, "duplicate area number " + canopy.name().areaNumber());
                    continue;
                }
                AreaDraft draft = new AreaDraft(title.substring(0, separator).trim(), title.substring(separator + 3).trim());
                for (Block block : readBlocks(canopy.sheet(), evaluator)) {
                    if (draft.items.containsKey(block.reference())) {
                        report.warn("Duplicate reference %s on %s; first row kept", block.reference(), sheetName);
                        continue;
                    }
                    draft.items.put(block.reference(), canopyItem(block));
                }
                draft.addPools(EquipmentKind.CANOPY, readPools(List.of(canopy.sheet()), evaluator));
                drafts.put(canopy.name().areaNumber(), draft);
                if (info == null) {
                    info = readInfo(canopy.sheet(), evaluator);
                }
            } catch (RuntimeException e) {
                report.skip(sheetName, "unexpected layout: " + e.getMessage());
            }
        }

        for (ParsedSheet satellite : satellites) {
            String sheetName = satellite.sheet().getSheetName();
            AreaDraft draft = drafts.get(satellite.name().areaNumber());
            if (draft == null) {
                report.skip(sheetName, "no canopy sheet for area " + satellite.name().areaNumber());
                continue;
            }
            try {
                applySatellite(satellite, draft, evaluator, report);
            } catch (RuntimeException e) {
                report.skip(sheetName, "unexpected layout: " + e.getMessage());
            }
        }

        Map<String, List<AreaDraft>> byLevel = new LinkedHashMap<>();
        drafts.values().forEach(draft -> byLevel.computeIfAbsent(draft.level, k -> new ArrayList<>()).add(draft));

        List<Level> levels = new ArrayList<>();
        for (Map.Entry<String, List<AreaDraft>> entry : byLevel.entrySet()) {
            Map<EquipmentKind, SharedCosts> levelPools = new EnumMap<>(EquipmentKind.class);
            List<Area> areas = new ArrayList<>();
            for (AreaDraft draft : entry.getValue()) {
                Map<EquipmentKind, SharedCosts> areaPools = new EnumMap<>(EquipmentKind.class);
                draft.pools.forEach((kind, pools) -> {
                    if (!pools.hasAny()) {
                        return;
                    }
                    if (scope == SharedCostScope.AREA) {
                        areaPools.put(kind, pools);
                    } else {
                        levelPools.merge(kind, pools, SpreadsheetReader::sum);
                    }
                });
                areas.add(new Area(draft.name, draft.options, new ArrayList<>(draft.items.values()), areaPools));
            }
            levels.add(new Level(entry.getKey(), areas, levelPools));
        }

        if (info == null) {
            info = new ProjectInfo(null, null, null, null, null, null, null, null, null, null, null);
        }
        return new Project(info, levels);
    }

    private static void applySatellite(ParsedSheet satellite, AreaDraft draft, FormulaEvaluator evaluator, Report report) {
        Sheet sheet = satellite.sheet();
        EquipmentKind kind = satellite.name().kind();
        List<Block> blocks = satelliteBlocks(sheet, kind, evaluator);
        draft.addPools(kind, readPools(List.of(sheet), evaluator));

        if (kind == EquipmentKind.SDU) {
            String sheetReference = blocks.isEmpty() ? satellite.name().reference() : blocks.get(0).reference();
            Optional<String> match = ReferenceMatcher.match(sheetReference, draft.items.keySet());
            if (match.isEmpty()) {
                report.skip(sheet.getSheetName(), "no item matches SDU reference " + sheetReference);
                return;
            }
            Block block = blocks.isEmpty() ? null : blocks.get(0);
            ItemOption option = block == null
                ? new ItemOption(null, null, null)
                : new ItemOption(block.price(), block.system(), block.quantity());
            draft.items.computeIfPresent(match.get(), (ref, item) -> item.withOption(kind, option));
            return;
        }

        if (blocks.isEmpty()) {
            if (kind.isAreaOption()) {
                draft.options.add(kind);
            } else {
                report.warn("%s has no item rows", sheet.getSheetName());
            }
            return;
        }
        for (Block block : blocks) {
            Optional<String> match = ReferenceMatcher.match(block.reference(), draft.items.keySet());
            if (match.isEmpty()) {
                report.warn("%s row %s matches no canopy item", sheet.getSheetName(), block.reference());
                continue;
            }
            ItemOption option = new ItemOption(block.price(), block.system(), block.quantity());
            draft.items.computeIfPresent(match.get(), (ref, item) -> item.withOption(kind, option));
        }
    }

    private static ProjectInfo readInfo(Sheet sheet, FormulaEvaluator evaluator) {
        return new ProjectInfo(
            Cells.string(sheet, SheetLayout.PROJECT_NAME, evaluator),
            Cells.string(sheet, SheetLayout.JOB_NUMBER, evaluator),
            Cells.string(sheet, SheetLayout.CUSTOMER, evaluator),
            null,
            null,
            Cells.string(sheet, SheetLayout.LOCATION, evaluator),
            null,
            Cells.string(sheet, SheetLayout.ESTIMATOR, evaluator),
            null,
            Cells.date(sheet, SheetLayout.DATE, evaluator),
            Cells.string(sheet, SheetLayout.REVISION, evaluator));
    }

    private static Item canopyItem(Block block) {
        Map<EquipmentKind, ItemOption> options = new EnumMap<>(EquipmentKind.class);
        if (block.claddingPrice() != null) {
            options.put(EquipmentKind.WALL_CLADDING, new ItemOption(block.claddingPrice(), null, null));
        }
        return new Item(block.reference(), block.model(), block.configuration(), block.price(), block.spec(), options);
    }

    // ---------------------------------------------------------------- cell level

    private static List<Block> readBlocks(Sheet sheet, FormulaEvaluator evaluator) {
        List<Block> blocks = new ArrayList<>();
        for (int block = 0; block < SheetLayout.MAX_ITEM_BLOCKS; block++) {
            String reference = Cells.string(sheet, SheetLayout.reference(block), evaluator);
            String model = Cells.string(sheet, SheetLayout.model(block), evaluator);
            if (reference == null || SheetLayout.isPlaceholder(reference) || SheetLayout.isPlaceholder(model)) {
                continue;
            }
            String positions = Cells.string(sheet, SheetLayout.claddingPositions(block), evaluator);
            String claddingWidth = Cells.string(sheet, SheetLayout.claddingWidth(block), evaluator);
            String claddingHeight = Cells.string(sheet, SheetLayout.claddingHeight(block), evaluator);
            WallCladding cladding = positions == null && claddingWidth == null && claddingHeight == null
                ? null
                : new WallCladding(claddingWidth, claddingHeight,
                    positions == null ? List.of() : Arrays.stream(positions.split(",")).map(String::trim)
                        .filter(s -> !s.isEmpty()).toList());

            ItemSpec spec = new ItemSpec(
                Cells.string(sheet, SheetLayout.length(block), evaluator),
                Cells.string(sheet, SheetLayout.width(block), evaluator),
                Cells.string(sheet, SheetLayout.height(block), evaluator),
                Cells.string(sheet, SheetLayout.sections(block), evaluator),
                Cells.string(sheet, SheetLayout.lighting(block), evaluator),
                Cells.string(sheet, SheetLayout.extractVolume(block), evaluator),
                Cells.string(sheet, SheetLayout.extractStatic(block), evaluator),
                Cells.string(sheet, SheetLayout.supplyVolume(block), evaluator),
                Cells.string(sheet, SheetLayout.supplyStatic(block), evaluator),
                Cells.string(sheet, SheetLayout.weight(block), evaluator),
                cladding);

            blocks.add(new Block(reference, model,
                Cells.string(sheet, SheetLayout.configuration(block), evaluator),
                Cells.decimal(sheet, SheetLayout.price(block), evaluator),
                spec,
                Cells.decimal(sheet, SheetLayout.claddingPrice(block), evaluator),
                null,
                null));
        }
        return blocks;
    }

    private static List<Block> satelliteBlocks(Sheet sheet, EquipmentKind kind, FormulaEvaluator evaluator) {
        List<Block> blocks = new ArrayList<>();
        for (int block = 0; block < SheetLayout.MAX_ITEM_BLOCKS; block++) {
            String reference = Cells.string(sheet, SheetLayout.reference(block), evaluator);
            String model = Cells.string(sheet, SheetLayout.model(block), evaluator);
            if (reference == null || SheetLayout.isPlaceholder(reference) || SheetLayout.isPlaceholder(model)) {
                continue;
            }
            blocks.add(new Block(reference, model, null,
                Cells.decimal(sheet, SheetLayout.price(block), evaluator),
                null,
                null,
                Cells.string(sheet, SheetLayout.system(block), evaluator),
                Cells.integer(sheet, SheetLayout.quantity(block), evaluator)));
            if (kind == EquipmentKind.SDU) {
                break;
            }
        }
        return blocks;
    }

    /**
     * Blocks keyed by the known reference they match; unmatched rows are reported.
     */
    private static Map<String, Block> matchBlocks(Sheet sheet, List<Block> blocks, List<String> references, Report report) {
        Map<String, Block> matched = new LinkedHashMap<>();
        for (Block block : blocks) {
            Optional<String> reference = ReferenceMatcher.match(block.reference(), references);
            if (reference.isEmpty()) {
                report.warn("%s row %s matches no item in project data", sheet.getSheetName(), block.reference());
            } else {
                matched.putIfAbsent(reference.get(), block);
            }
        }
        return matched;
    }

    private static SharedCosts readPools(List<Sheet> sheets, FormulaEvaluator evaluator) {
        BigDecimal delivery = BigDecimal.ZERO;
        BigDecimal commissioning = BigDecimal.ZERO;
        for (Sheet sheet : sheets) {
            BigDecimal sheetDelivery = Cells.decimal(sheet, SheetLayout.DELIVERY, evaluator);
            BigDecimal sheetCommissioning = Cells.decimal(sheet, SheetLayout.COMMISSIONING, evaluator);
            delivery = delivery.add(sheetDelivery == null ? BigDecimal.ZERO : sheetDelivery);
            commissioning = commissioning.add(sheetCommissioning == null ? BigDecimal.ZERO : sheetCommissioning);
        }
        return new SharedCosts(delivery, commissioning);
    }

    private static SharedCosts sum(SharedCosts a, SharedCosts b) {
        return new SharedCosts(a.delivery().add(b.delivery()), a.commissioning().add(b.commissioning()));
    }

    private static boolean isVisible(Workbook workbook, Sheet sheet) {
        return workbook.getSheetVisibility(workbook.getSheetIndex(sheet)) == SheetVisibility.VISIBLE;
    }

    private record Block(String reference, String model, String configuration, BigDecimal price, ItemSpec spec,
                         BigDecimal claddingPrice, String system, Integer quantity) {}

    private record ParsedSheet(Sheet sheet, ParsedName name) {}

    private static final class AreaDraft {
        private final String level;
        private final String name;
        private final Set<EquipmentKind> options = EnumSet.noneOf(EquipmentKind.class);
        private final Map<String, Item> items = new LinkedHashMap<>();
        private final Map<EquipmentKind, SharedCosts> pools = new EnumMap<>(EquipmentKind.class);

        AreaDraft(String level, String name) {
            this.level = level;
            this.name = name;
        }

        void addPools(EquipmentKind kind, SharedCosts sheetPools) {
            pools.merge(kind, sheetPools, SpreadsheetReader::sum);
        }
    }

    private static final class Report {
        private final List<SkippedSheet> skipped = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();

        void skip(String sheetName, String reason) {
            skipped.add(new SkippedSheet(sheetName, reason));
        }

        void warn(String format, Object... args) {
            warnings.add(String.format(format, args));
        }
    }
}
