package com.costsheet.core.workbook;

import com.costsheet.core.aggregate.AreaSummary;
import com.costsheet.core.aggregate.KindSubtotal;
import com.costsheet.core.aggregate.PricingSummary;
import com.costsheet.core.config.CostSheetConfig.WorkbookSettings;
import com.costsheet.core.config.FeatureFlags;
import com.costsheet.core.exception.CostSheetException;
import com.costsheet.core.exception.WorkbookIntegrityException;
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
import com.costsheet.core.pricing.SharedCostScope;
import com.costsheet.core.util.Initials;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.SheetVisibility;
import org.apache.poi.xssf.usermodel.XSSFFormulaEvaluator;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Materializes a priced project into a cost sheet workbook.
 *
 * <p>Satellite sheets are popped from per-kind {@link SheetPool}s of hidden slot sheets in
 * the template, renamed, filled and made visible. Unused slots are deleted, a
 * {@code JOB TOTAL} sheet sums every placed sheet's total cell and a hidden
 * {@code ProjectData} sheet records the project structure for the reader.
 *
 * <p>Sheet order: area by area (canopy, fire suppression, UV-C, RecoAir, Reactaway, SDU),
 * then {@code JOB TOTAL}, then hidden sheets.
 */
public class SpreadsheetSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(SpreadsheetSynthesizer.class);

    private static final List<EquipmentKind> AREA_SHEET_ORDER = List.of(
        EquipmentKind.CANOPY, EquipmentKind.FIRE_SUPPRESSION, EquipmentKind.UV_C,
        EquipmentKind.RECOAIR, EquipmentKind.REACTAWAY);

    private final TemplateWorkbookFactory templates;
    private final WorkbookSettings settings;
    private final FeatureFlags features;
    private final SharedCostScope scope;

    public SpreadsheetSynthesizer(TemplateWorkbookFactory templates, WorkbookSettings settings,
                                  FeatureFlags features, SharedCostScope scope) {
        this.templates = Objects.requireNonNull(templates, "templates must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.features = Objects.requireNonNull(features, "features must not be null");
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
    }

    /**
     * Writes the cost sheet workbook.
     *
     * @param project project to write
     * @param summary pricing summary of the same project
     * @return workbook bytes
     * @throws com.costsheet.core.exception.SheetPoolExhaustedException if the template has too few slots
     * @throws WorkbookIntegrityException if the finished workbook fails its integrity check
     */
    public byte[] synthesize(Project project, PricingSummary summary) {
        Objects.requireNonNull(project, "project must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        log.info("Synthesizing cost sheet for project {}", project.info().number());

        try (XSSFWorkbook workbook = openTemplate()) {
            Styles styles = new Styles(workbook);
            Map<EquipmentKind, SheetPool> pools = discoverPools(workbook);
            List<Placement> plan = plan(project, summary);
            reserve(plan, pools);

            Set<String> usedNames = new HashSet<>();
            workbook.forEach(sheet -> usedNames.add(sheet.getSheetName().toUpperCase()));
            List<PlacedSheet> placed = new ArrayList<>();
            for (Placement placement : plan) {
                placed.add(place(workbook, placement, pools.get(placement.kind()), usedNames, project.info(), styles));
            }

            discardUnused(workbook, pools);
            writeJobTotal(workbook, placed, styles);
            ensureLists(workbook);
            writeProjectData(workbook, project, placed);
            order(workbook, placed);
            verify(workbook, placed);
            activateFirstSheet(workbook);

            XSSFFormulaEvaluator.evaluateAllFormulaCells(workbook);
            workbook.setForceFormulaRecalculation(true);

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            workbook.write(out);
            log.info("Cost sheet written: {} placed sheets, {} bytes", placed.size(), out.size());
            return out.toByteArray();
        } catch (IOException e) {
            throw new CostSheetException("Failed to write cost sheet workbook: " + e.getMessage(), e);
        }
    }

    private XSSFWorkbook openTemplate() throws IOException {
        if (settings.templatePath() != null && !settings.templatePath().isBlank()) {
            return templates.load(Path.of(settings.templatePath()));
        }
        return templates.create(settings.poolSizes());
    }

    private static Map<EquipmentKind, SheetPool> discoverPools(XSSFWorkbook workbook) {
        Map<EquipmentKind, SheetPool> pools = new EnumMap<>(EquipmentKind.class);
        for (EquipmentKind kind : EquipmentKind.sheetKinds()) {
            pools.put(kind, SheetPool.discover(workbook, kind));
        }
        return pools;
    }

    private List<Placement> plan(Project project, PricingSummary summary) {
        List<Placement> plan = new ArrayList<>();
        List<AreaSummary> areaSummaries = summary.allAreas();
        int areaIndex = 0;
        for (int levelIndex = 0; levelIndex < project.levels().size(); levelIndex++) {
            Level level = project.levels().get(levelIndex);
            for (Area area : level.areas()) {
                AreaSummary areaSummary = areaSummaries.get(areaIndex++);
                for (EquipmentKind kind : AREA_SHEET_ORDER) {
                    boolean wanted = kind == EquipmentKind.CANOPY || areaSummary.kind(kind).isPresent();
                    if (wanted && features.isEnabled(kind)) {
                        plan.add(new Placement(kind, levelIndex, level, area, areaSummary, null));
                    }
                }
                if (features.isEnabled(EquipmentKind.SDU)) {
                    List<Item> sduItems = area.itemsCarrying(EquipmentKind.SDU);
                    for (Item item : sduItems) {
                        plan.add(new Placement(EquipmentKind.SDU, levelIndex, level, area, areaSummary, item));
                    }
                    boolean sduPools = areaSummary.kind(EquipmentKind.SDU).map(s -> s.pools().hasAny()).orElse(false);
                    if (sduItems.isEmpty() && sduPools) {
                        log.warn("SDU shared costs in {} / {} have no SDU sheet to sit on and are not written",
                            level.name(), area.name());
                    }
                }
            }
        }
        return plan;
    }

    private static void reserve(List<Placement> plan, Map<EquipmentKind, SheetPool> pools) {
        Map<EquipmentKind, Integer> demand = new EnumMap<>(EquipmentKind.class);
        plan.forEach(placement -> demand.merge(placement.kind(), 1, Integer::sum));
        demand.forEach((kind, count) -> pools.get(kind).ensureCapacity(count));
    }

    private PlacedSheet place(XSSFWorkbook workbook, Placement placement, SheetPool pool, Set<String> usedNames,
                              ProjectInfo info, Styles styles) {
        String slot = pool.acquire();
        usedNames.remove(slot.toUpperCase());
        EquipmentKind kind = placement.kind();
        int areaNumber = placement.summary().areaNumber();
        String desired = placement.item() == null
            ? SheetNaming.areaSheet(kind, placement.level().name(), areaNumber)
            : SheetNaming.itemSheet(kind, placement.level().name(), areaNumber, placement.item().reference());
        String name = SheetNaming.unique(desired, usedNames);

        int index = workbook.getSheetIndex(slot);
        workbook.setSheetName(index, name);
        workbook.setSheetVisibility(index, SheetVisibility.VISIBLE);
        XSSFSheet sheet = workbook.getSheetAt(index);
        sheet.setTabColor(TabColors.forLevel(placement.levelIndex()));
        log.debug("Placed {} on slot {}", name, slot);

        writeHeader(sheet, info, placement, styles);
        SharedCosts pools = placement.summary().kind(kind).map(KindSubtotal::pools).orElse(SharedCosts.NONE);
        if (kind == EquipmentKind.CANOPY) {
            writeCanopies(sheet, placement.area().items(), styles);
        } else if (kind == EquipmentKind.SDU) {
            writeOptions(sheet, kind, List.of(placement.item()), styles);
            if (!isFirstSduOfArea(placement)) {
                pools = SharedCosts.NONE;
            }
        } else {
            writeOptions(sheet, kind, placement.area().itemsCarrying(kind), styles);
        }
        Cells.setNumber(sheet, SheetLayout.DELIVERY, pools.delivery(), styles.money());
        Cells.setNumber(sheet, SheetLayout.COMMISSIONING, pools.commissioning(), styles.money());
        Cells.setFormula(sheet, SheetLayout.SHEET_TOTAL, SheetLayout.SHEET_TOTAL_FORMULA, styles.money());
        DropdownLayer.apply(sheet, kind);

        return new PlacedSheet(kind, placement.levelIndex(), areaNumber,
            placement.item() == null ? null : placement.item().reference(), name);
    }

    private static boolean isFirstSduOfArea(Placement placement) {
        List<Item> sduItems = placement.area().itemsCarrying(EquipmentKind.SDU);
        return !sduItems.isEmpty() && sduItems.get(0).reference().equals(placement.item().reference());
    }

    private static void writeHeader(Sheet sheet, ProjectInfo info, Placement placement, Styles styles) {
        String title = placement.level().name() + " - " + placement.area().name();
        if (placement.kind() != EquipmentKind.CANOPY) {
            title = title + " - " + placement.kind().label();
        }
        Cells.setString(sheet, SheetLayout.TITLE, title);
        Cells.setString(sheet, SheetLayout.JOB_NUMBER, info.number());
        Cells.setString(sheet, SheetLayout.CUSTOMER, info.customer());
        Cells.setString(sheet, SheetLayout.ESTIMATOR, Initials.of(info.estimator()));
        Cells.setString(sheet, SheetLayout.PROJECT_NAME, info.name());
        Cells.setString(sheet, SheetLayout.LOCATION, info.location());
        Cells.setDate(sheet, SheetLayout.DATE, info.date(), styles.date());
        Cells.setString(sheet, SheetLayout.REVISION, info.revision());
    }

    private void writeCanopies(Sheet sheet, List<Item> items, Styles styles) {
        for (int block = 0; block < items.size(); block++) {
            Item item = items.get(block);
            ItemSpec spec = item.spec();
            Cells.setString(sheet, SheetLayout.reference(block), item.reference());
            Cells.setNumber(sheet, SheetLayout.price(block), item.basePrice(), styles.money());
            Cells.setString(sheet, SheetLayout.configuration(block), item.configuration());
            Cells.setString(sheet, SheetLayout.model(block), item.model());
            Cells.setString(sheet, SheetLayout.width(block), spec.width());
            Cells.setString(sheet, SheetLayout.length(block), spec.length());
            Cells.setString(sheet, SheetLayout.height(block), spec.height());
            Cells.setString(sheet, SheetLayout.sections(block), spec.sections());
            Cells.setString(sheet, SheetLayout.extractVolume(block), spec.extractVolume());
            Cells.setString(sheet, SheetLayout.supplyVolume(block), spec.supplyVolume());
            Cells.setString(sheet, SheetLayout.supplyStatic(block), spec.supplyStatic());
            Cells.setString(sheet, SheetLayout.lighting(block), spec.lightingType());
            Cells.setString(sheet, SheetLayout.extractStatic(block), spec.extractStatic());
            Cells.setString(sheet, SheetLayout.weight(block), spec.weight());

            if (item.hasOption(EquipmentKind.WALL_CLADDING) && features.isEnabled(EquipmentKind.WALL_CLADDING)) {
                ItemOption cladding = item.option(EquipmentKind.WALL_CLADDING).orElseThrow();
                WallCladding geometry = spec.wallCladding();
                Cells.setString(sheet, SheetLayout.claddingPositions(block),
                    geometry == null ? null : String.join(", ", geometry.positions()));
                Cells.setString(sheet, SheetLayout.claddingWidth(block), geometry == null ? null : geometry.width());
                Cells.setString(sheet, SheetLayout.claddingHeight(block), geometry == null ? null : geometry.height());
                Cells.setNumber(sheet, SheetLayout.claddingPrice(block), cladding.price(), styles.money());
            }
        }
    }

    private static void writeOptions(Sheet sheet, EquipmentKind kind, List<Item> items, Styles styles) {
        for (int block = 0; block < items.size(); block++) {
            Item item = items.get(block);
            ItemOption option = item.option(kind).orElseThrow();
            Cells.setString(sheet, SheetLayout.reference(block), item.reference());
            Cells.setString(sheet, SheetLayout.model(block), item.model());
            Cells.setNumber(sheet, SheetLayout.price(block), option.price(), styles.money());
            Cells.setString(sheet, SheetLayout.system(block), option.system());
            if (option.quantity() == null) {
                Cells.setString(sheet, SheetLayout.quantity(block), null);
            } else if (kind == EquipmentKind.FIRE_SUPPRESSION) {
                Cells.setString(sheet, SheetLayout.quantity(block), option.quantity() + " TANK");
            } else {
                Cells.setNumber(sheet, SheetLayout.quantity(block), option.quantity());
            }
        }
    }

    private void discardUnused(XSSFWorkbook workbook, Map<EquipmentKind, SheetPool> pools) {
        int discarded = 0;
        for (SheetPool pool : pools.values()) {
            for (String slot : pool.unused()) {
                int index = workbook.getSheetIndex(slot);
                if (settings.removeUnusedSheets()) {
                    workbook.removeSheetAt(index);
                } else {
                    workbook.setSheetVisibility(index, SheetVisibility.HIDDEN);
                }
                discarded++;
            }
        }
        log.debug("{} {} unused slot sheets", settings.removeUnusedSheets() ? "Removed" : "Kept hidden", discarded);
    }

    private static void writeJobTotal(XSSFWorkbook workbook, List<PlacedSheet> placed, Styles styles) {
        Sheet jobTotal = workbook.getSheet(SheetLayout.JOB_TOTAL_SHEET);
        if (jobTotal == null) {
            jobTotal = workbook.createSheet(SheetLayout.JOB_TOTAL_SHEET);
        }
        for (int i = jobTotal.getLastRowNum(); i >= 0; i--) {
            if (jobTotal.getRow(i) != null) {
                jobTotal.removeRow(jobTotal.getRow(i));
            }
        }
        Cells.setString(jobTotal, "A1", "SHEET");
        Cells.setString(jobTotal, "B1", "TOTAL");
        int row = 2;
        for (PlacedSheet sheet : placed) {
            Cells.setString(jobTotal, "A" + row, sheet.name());
            Cells.setFormula(jobTotal, "B" + row, quote(sheet.name()) + "!" + SheetLayout.SHEET_TOTAL, styles.money());
            row++;
        }
        Cells.setString(jobTotal, "A" + row, "GRAND TOTAL");
        String grandTotal = placed.isEmpty() ? "0" : "SUM(B2:B" + (row - 1) + ")";
        Cells.setFormula(jobTotal, "B" + row, grandTotal, styles.money());
        workbook.setSheetVisibility(workbook.getSheetIndex(jobTotal), SheetVisibility.VISIBLE);
    }

    private static void ensureLists(XSSFWorkbook workbook) {
        Sheet lists = workbook.getSheet(SheetLayout.LISTS_SHEET);
        if (lists == null) {
            lists = workbook.createSheet(SheetLayout.LISTS_SHEET);
            DropdownLayer.writeLists(lists);
        }
        workbook.setSheetVisibility(workbook.getSheetIndex(lists), SheetVisibility.HIDDEN);
    }

    private void writeProjectData(XSSFWorkbook workbook, Project project, List<PlacedSheet> placed) {
        int existing = workbook.getSheetIndex(SheetLayout.PROJECT_DATA_SHEET);
        if (existing >= 0) {
            workbook.removeSheetAt(existing);
        }
        Sheet data = workbook.createSheet(SheetLayout.PROJECT_DATA_SHEET);
        ProjectDataSheet.write(data, project, scope, placed);
        workbook.setSheetVisibility(workbook.getSheetIndex(data), SheetVisibility.VERY_HIDDEN);
    }

    private static void order(XSSFWorkbook workbook, List<PlacedSheet> placed) {
        List<String> ordered = new ArrayList<>();
        placed.forEach(sheet -> ordered.add(sheet.name()));
        ordered.add(SheetLayout.JOB_TOTAL_SHEET);
        for (Sheet sheet : workbook) {
            if (!ordered.contains(sheet.getSheetName())) {
                ordered.add(sheet.getSheetName());
            }
        }
        for (int position = 0; position < ordered.size(); position++) {
            workbook.setSheetOrder(ordered.get(position), position);
        }
    }

    private static void verify(XSSFWorkbook workbook, List<PlacedSheet> placed) {
        List<String> violations = new ArrayList<>();
        for (PlacedSheet sheet : placed) {
            int index = workbook.getSheetIndex(sheet.name());
            if (index < 0) {
                violations.add("placed sheet " + sheet.name() + " is missing");
            } else if (workbook.getSheetVisibility(index) != SheetVisibility.VISIBLE) {
                violations.add("placed sheet " + sheet.name() + " is hidden");
            }
        }
        for (int index = 0; index < workbook.getNumberOfSheets(); index++) {
            String name = workbook.getSheetName(index);
            if (SheetNaming.isSlot(name) && workbook.getSheetVisibility(index) == SheetVisibility.VISIBLE) {
                violations.add("slot sheet " + name + " is visible");
            }
        }
        if (workbook.getSheetIndex(SheetLayout.JOB_TOTAL_SHEET) < 0) {
            violations.add(SheetLayout.JOB_TOTAL_SHEET + " is missing");
        }
        if (!violations.isEmpty()) {
            throw new WorkbookIntegrityException(violations);
        }
    }

    private static void activateFirstSheet(XSSFWorkbook workbook) {
        for (Sheet sheet : workbook) {
            sheet.setSelected(false);
        }
        workbook.setActiveSheet(0);
        workbook.setSelectedTab(0);
        workbook.setFirstVisibleTab(0);
    }

    private static String quote(String sheetName) {
        return "'" + sheetName.replace("'", "''") + "'";
    }

    private record Placement(EquipmentKind kind, int levelIndex, Level level, Area area, AreaSummary summary, Item item) {}

    private record Styles(CellStyle money, CellStyle date) {
        Styles(XSSFWorkbook workbook) {
            this(style(workbook, "\"£\"#,##0.00"), style(workbook, "dd/MM/yyyy"));
        }

        private static CellStyle style(XSSFWorkbook workbook, String format) {
            CellStyle style = workbook.createCellStyle();
            style.setDataFormat(workbook.createDataFormat().getFormat(format));
            return style;
        }
    }
}
