package com.costsheet.core.document;

import com.costsheet.core.aggregate.AreaSummary;
import com.costsheet.core.aggregate.KindRollup;
import com.costsheet.core.aggregate.KindSubtotal;
import com.costsheet.core.aggregate.LevelSummary;
import com.costsheet.core.aggregate.PricingSummary;
import com.costsheet.core.config.FeatureFlags;
import com.costsheet.core.model.Area;
import com.costsheet.core.model.EquipmentKind;
import com.costsheet.core.model.Item;
import com.costsheet.core.model.ItemOption;
import com.costsheet.core.model.KindCategory;
import com.costsheet.core.model.Level;
import com.costsheet.core.model.Project;
import com.costsheet.core.model.ProjectInfo;
import com.costsheet.core.model.SpecField;
import com.costsheet.core.model.WallCladding;
import com.costsheet.core.pricing.ItemPrice;
import com.costsheet.core.pricing.PricingRuleEngine;
import com.costsheet.core.util.Initials;
import com.costsheet.core.util.Money;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Flattens a priced project into the {@link DocumentContext} a quotation template reads.
 *
 * <p>The builder is pure: the same project and summary always produce an equal context.
 * Kinds switched off by the feature flags have their flag set to false and their lists
 * left empty.
 *
 * <p><b>Namespace:</b>
 * <ul>
 *   <li>scalars: {@code client_name}, {@code company}, {@code address}, {@code project_name},
 *       {@code location}, {@code project_number}, {@code estimator}, {@code estimator_initials},
 *       {@code sales_contact}, {@code delivery_location}, {@code date}, {@code quote_reference},
 *       {@code revision}, {@code dear_line}, {@code subject_line}, {@code grand_total},
 *       {@code total_canopies}</li>
 *   <li>flags: {@code has_canopies}, {@code has_wall_cladding}, {@code has_fire_suppression},
 *       {@code has_uv_c}, {@code has_recoair}, {@code has_reactaway}, {@code has_sdu},
 *       {@code recoair_only}</li>
 *   <li>lists: {@code canopies}, {@code wall_cladding_items}, {@code fire_suppression_items},
 *       {@code sdu_items}, {@code recoair_items}, {@code uv_c_items}, {@code reactaway_items},
 *       {@code levels} (nested areas and canopies), {@code kind_totals}</li>
 * </ul>
 */
public class DocumentContextBuilder {

    private static final Logger log = LoggerFactory.getLogger(DocumentContextBuilder.class);

    private static final Map<EquipmentKind, String> FLAG_KEYS = new EnumMap<>(Map.of(
        EquipmentKind.CANOPY, DocumentContext.HAS_CANOPIES,
        EquipmentKind.WALL_CLADDING, DocumentContext.HAS_WALL_CLADDING,
        EquipmentKind.FIRE_SUPPRESSION, DocumentContext.HAS_FIRE_SUPPRESSION,
        EquipmentKind.UV_C, DocumentContext.HAS_UV_C,
        EquipmentKind.RECOAIR, DocumentContext.HAS_RECOAIR,
        EquipmentKind.REACTAWAY, DocumentContext.HAS_REACTAWAY,
        EquipmentKind.SDU, DocumentContext.HAS_SDU));

    private static final Map<EquipmentKind, String> LIST_KEYS = new EnumMap<>(Map.of(
        EquipmentKind.CANOPY, "canopies",
        EquipmentKind.WALL_CLADDING, "wall_cladding_items",
        EquipmentKind.FIRE_SUPPRESSION, "fire_suppression_items",
        EquipmentKind.UV_C, "uv_c_items",
        EquipmentKind.RECOAIR, "recoair_items",
        EquipmentKind.REACTAWAY, "reactaway_items",
        EquipmentKind.SDU, "sdu_items"));

    private final PricingRuleEngine pricing;
    private final FeatureFlags features;
    private final DisplayValues display;

    public DocumentContextBuilder(PricingRuleEngine pricing, FeatureFlags features, DisplayValues display) {
        this.pricing = Objects.requireNonNull(pricing, "pricing must not be null");
        this.features = Objects.requireNonNull(features, "features must not be null");
        this.display = Objects.requireNonNull(display, "display must not be null");
    }

    /**
     * Builds the context.
     *
     * @param project project
     * @param summary pricing summary of the same project
     * @return document context
     */
    public DocumentContext build(Project project, PricingSummary summary) {
        Objects.requireNonNull(project, "project must not be null");
        Objects.requireNonNull(summary, "summary must not be null");

        Map<String, Object> values = new LinkedHashMap<>();
        putScalars(values, project.info());

        Map<EquipmentKind, Boolean> present = presentKinds(project);
        present.forEach((kind, has) -> values.put(FLAG_KEYS.get(kind), has));
        boolean onlyRecoAir = present.get(EquipmentKind.RECOAIR) && present.entrySet().stream()
            .filter(entry -> entry.getKey() != EquipmentKind.RECOAIR)
            .noneMatch(Map.Entry::getValue);
        values.put(DocumentContext.RECOAIR_ONLY, onlyRecoAir);

        Map<EquipmentKind, List<Map<String, Object>>> lists = new EnumMap<>(EquipmentKind.class);
        for (EquipmentKind kind : EquipmentKind.values()) {
            lists.put(kind, new ArrayList<>());
        }
        List<Map<String, Object>> levelViews = new ArrayList<>();
        List<AreaSummary> areaSummaries = summary.allAreas();
        int areaIndex = 0;

        for (int levelIndex = 0; levelIndex < project.levels().size(); levelIndex++) {
            Level level = project.levels().get(levelIndex);
            LevelSummary levelSummary = summary.levels().get(levelIndex);
            List<Map<String, Object>> areaViews = new ArrayList<>();
            for (Area area : level.areas()) {
                AreaSummary areaSummary = areaSummaries.get(areaIndex++);
                List<Map<String, Object>> areaCanopies = new ArrayList<>();
                for (Item item : area.items()) {
                    for (EquipmentKind kind : EquipmentKind.values()) {
                        if (!present.get(kind) || !carries(item, kind)) {
                            continue;
                        }
                        Map<String, Object> record = itemRecord(level, area, areaSummary, item, kind, summary);
                        lists.get(kind).add(record);
                        if (kind == EquipmentKind.CANOPY) {
                            areaCanopies.add(record);
                        }
                    }
                }
                areaViews.add(areaView(area, areaSummary, areaCanopies));
            }
            Map<String, Object> levelView = new LinkedHashMap<>();
            levelView.put("level_name", display.text(level.name()));
            levelView.put("level_total", display.money(levelSummary.total()));
            levelView.put("areas", areaViews);
            levelViews.add(levelView);
        }

        lists.forEach((kind, records) -> values.put(LIST_KEYS.get(kind), records));
        values.put("levels", levelViews);
        values.put("kind_totals", kindTotals(summary, present));
        values.put("grand_total", display.money(summary.total()));
        values.put("total_canopies", String.valueOf(present.get(EquipmentKind.CANOPY)
            ? summary.rollup(EquipmentKind.CANOPY).count() : 0));

        log.debug("Built document context with {} variables for project {}", values.size(), project.info().number());
        return new DocumentContext(values);
    }

    private void putScalars(Map<String, Object> values, ProjectInfo info) {
        values.put("client_name", display.text(info.customer()));
        values.put("company", display.text(info.company()));
        values.put("address", display.text(info.address()));
        values.put("project_name", display.text(info.name()));
        values.put("location", display.text(info.location()));
        values.put("project_number", display.text(info.number()));
        values.put("estimator", display.text(info.estimator()));
        values.put("estimator_initials", display.text(Initials.of(info.estimator())));
        values.put("sales_contact", display.text(info.salesContact()));
        values.put("delivery_location", display.text(info.deliveryLocation()));
        values.put("date", display.date(info.date()));
        values.put("quote_reference", display.quoteReference(info.number(), info.date()));
        values.put("revision", info.revision());
        values.put("dear_line", display.dearLine(info.customer()));
        values.put("subject_line", display.subjectLine(info.name(), info.location()));
    }

    /**
     * Kinds present anywhere in the project and enabled, scanning every area and item.
     */
    private Map<EquipmentKind, Boolean> presentKinds(Project project) {
        Map<EquipmentKind, Boolean> present = new EnumMap<>(EquipmentKind.class);
        for (EquipmentKind kind : EquipmentKind.values()) {
            boolean found = project.allAreas().stream().anyMatch(area -> area.triggers(kind));
            present.put(kind, found && features.isEnabled(kind));
        }
        return present;
    }

    private static boolean carries(Item item, EquipmentKind kind) {
        return kind == EquipmentKind.CANOPY || item.hasOption(kind);
    }

    private Map<String, Object> itemRecord(Level level, Area area, AreaSummary areaSummary, Item item,
                                           EquipmentKind kind, PricingSummary summary) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("level", display.text(level.name()));
        record.put("area", display.text(area.name()));
        record.put("area_number", String.valueOf(areaSummary.areaNumber()));
        record.put("reference", display.text(item.reference()));
        record.put("model", display.text(item.model()));

        BigDecimal price = summary.itemPrice(item.reference(), kind).map(ItemPrice::total)
            .orElseGet(() -> kind == EquipmentKind.CANOPY
                ? Money.of(item.basePrice())
                : Money.of(item.option(kind).map(ItemOption::price).orElse(null)));

        switch (kind) {
            case CANOPY -> {
                record.put("configuration", display.text(item.configuration()));
                record.put("length", spec(item, SpecField.LENGTH, display::stripUnits));
                record.put("width", spec(item, SpecField.WIDTH, display::stripUnits));
                record.put("height", spec(item, SpecField.HEIGHT, display::stripUnits));
                record.put("sections", spec(item, SpecField.SECTIONS, display::text));
                record.put("lighting", spec(item, SpecField.LIGHTING, display::lighting));
                record.put("extract_volume", spec(item, SpecField.EXTRACT_VOLUME, display::volume));
                record.put("extract_static", spec(item, SpecField.EXTRACT_STATIC, display::stripUnits));
                record.put("supply_volume", spec(item, SpecField.SUPPLY_VOLUME, display::volume));
                record.put("supply_static", spec(item, SpecField.SUPPLY_STATIC, display::stripUnits));
                record.put("weight", spec(item, SpecField.WEIGHT, display::stripUnits));
            }
            case WALL_CLADDING -> {
                WallCladding cladding = item.spec().wallCladding();
                record.put("width", display.stripUnits(cladding == null ? null : cladding.width()));
                record.put("height", display.stripUnits(cladding == null ? null : cladding.height()));
                record.put("positions", cladding == null || cladding.positions().isEmpty()
                    ? DisplayValues.BLANK : String.join(", ", cladding.positions()));
                record.put("description", display.claddingDescription(cladding == null ? List.of() : cladding.positions()));
            }
            case FIRE_SUPPRESSION -> {
                ItemOption option = item.option(kind).orElseThrow();
                record.put("system", display.text(option.system()));
                record.put("tank_quantity", display.quantity(option.quantity()));
            }
            default -> {
                ItemOption option = item.option(kind).orElseThrow();
                record.put("system", display.text(option.system()));
                record.put("quantity", display.quantity(option.quantity()));
            }
        }
        record.put("price", display.money(price));
        return record;
    }

    private String spec(Item item, SpecField field, UnaryOperator<String> format) {
        return display.reading(pricing.readSpec(item, field), format);
    }

    private Map<String, Object> areaView(Area area, AreaSummary areaSummary, List<Map<String, Object>> canopies) {
        BigDecimal delivery = Money.ZERO;
        BigDecimal commissioning = Money.ZERO;
        BigDecimal unabsorbed = Money.ZERO;
        for (KindSubtotal subtotal : areaSummary.kinds().values()) {
            delivery = delivery.add(subtotal.delivery());
            commissioning = commissioning.add(subtotal.commissioning());
            unabsorbed = unabsorbed.add(subtotal.unabsorbed());
        }
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("area_name", display.text(area.name()));
        view.put("area_number", String.valueOf(areaSummary.areaNumber()));
        view.put("main_units_total", display.money(areaSummary.category(KindCategory.MAIN_UNITS)));
        view.put("cladding_total", display.money(areaSummary.category(KindCategory.CLADDING)));
        view.put("fire_suppression_total", display.money(areaSummary.category(KindCategory.FIRE_SUPPRESSION)));
        view.put("ancillary_total", display.money(areaSummary.category(KindCategory.ANCILLARY)));
        view.put("delivery_total", display.money(delivery));
        view.put("commissioning_total", display.money(commissioning));
        view.put("unabsorbed_total", display.money(unabsorbed));
        view.put("total", display.money(areaSummary.total()));
        view.put("canopies", canopies);
        return view;
    }

    private List<Map<String, Object>> kindTotals(PricingSummary summary, Map<EquipmentKind, Boolean> present) {
        List<Map<String, Object>> totals = new ArrayList<>();
        for (EquipmentKind kind : EquipmentKind.values()) {
            if (!present.get(kind)) {
                continue;
            }
            KindRollup rollup = summary.rollup(kind);
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("kind", kind.name());
            row.put("label", kind.label());
            row.put("count", String.valueOf(rollup.count()));
            row.put("quantity", String.valueOf(rollup.quantity()));
            row.put("total", display.money(rollup.total()));
            totals.add(row);
        }
        return totals;
    }
}
