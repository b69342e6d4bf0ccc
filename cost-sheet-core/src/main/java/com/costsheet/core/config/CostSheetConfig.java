package com.costsheet.core.config;

import com.costsheet.core.document.QuotationKind;
import com.costsheet.core.model.EquipmentKind;
import com.costsheet.core.pricing.DistributionMode;
import com.costsheet.core.pricing.SharedCostPolicy;
import com.costsheet.core.pricing.SharedCostScope;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Root configuration, loaded from {@code costsheet.yaml}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "Kitchen ventilation estimates"
 *
 * pricing:
 *   sharedCostScope: AREA
 *   delivery:
 *     UV_C: EXPLICIT_ROW
 *
 * workbook:
 *   templatePath: "./templates/cost-sheet.xlsx"
 *   poolSizes:
 *     CANOPY: 40
 *   removeUnusedSheets: true
 *
 * documents:
 *   templateDirectory: "./templates"
 *   templates:
 *     MAIN: "quotation.docx"
 *     RECOAIR: "recoair-quotation.docx"
 *   currencySymbol: "£"
 *
 * features:
 *   reactaway: false
 *
 * output:
 *   directory: "./output"
 * }</pre>
 *
 * @param project project settings
 * @param pricing pricing settings
 * @param workbook workbook synthesis settings
 * @param documents quotation document settings
 * @param features feature flags by name
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CostSheetConfig(
    @JsonProperty("project") ProjectSettings project,
    @JsonProperty("pricing") PricingSettings pricing,
    @JsonProperty("workbook") WorkbookSettings workbook,
    @JsonProperty("documents") DocumentSettings documents,
    @JsonProperty("features") Map<String, Boolean> features,
    @JsonProperty("output") OutputSettings output
) {
    /**
     * Default slot sheet pool size per kind.
     */
    public static final Map<EquipmentKind, Integer> DEFAULT_POOL_SIZES;

    static {
        Map<EquipmentKind, Integer> sizes = new EnumMap<>(EquipmentKind.class);
        sizes.put(EquipmentKind.CANOPY, 30);
        sizes.put(EquipmentKind.FIRE_SUPPRESSION, 30);
        sizes.put(EquipmentKind.UV_C, 10);
        sizes.put(EquipmentKind.RECOAIR, 10);
        sizes.put(EquipmentKind.REACTAWAY, 10);
        sizes.put(EquipmentKind.SDU, 30);
        DEFAULT_POOL_SIZES = Collections.unmodifiableMap(sizes);
    }

    public CostSheetConfig {
        if (project == null) {
            project = new ProjectSettings("cost-sheet");
        }
        if (pricing == null) {
            pricing = new PricingSettings(null, null);
        }
        if (workbook == null) {
            workbook = new WorkbookSettings(null, null, null);
        }
        if (documents == null) {
            documents = new DocumentSettings(null, null, null);
        }
        if (features == null) {
            features = Map.of();
        }
        if (output == null) {
            output = new OutputSettings(null);
        }
    }

    /**
     * Creates a default configuration: area-scoped shared costs, built-in template
     * workbook, classpath quotation templates, every feature enabled.
     *
     * @return default configuration
     */
    public static CostSheetConfig defaults() {
        return new CostSheetConfig(null, null, null, null, null, null);
    }

    public FeatureFlags featureFlags() {
        return new ConfiguredFeatureFlags(features);
    }

    /**
     * Project settings.
     *
     * @param name display name of this installation
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectSettings(
        @JsonProperty("name") String name
    ) {}

    /**
     * Pricing settings.
     *
     * @param sharedCostScope scope whose pools are used (default AREA)
     * @param delivery delivery distribution overrides per kind
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PricingSettings(
        @JsonProperty("sharedCostScope") SharedCostScope sharedCostScope,
        @JsonProperty("delivery") Map<EquipmentKind, DistributionMode> delivery
    ) {
        public PricingSettings {
            if (sharedCostScope == null) {
                sharedCostScope = SharedCostScope.AREA;
            }
            if (delivery == null) {
                delivery = Map.of();
            }
        }

        public SharedCostPolicy policy() {
            return SharedCostPolicy.withDeliveryOverrides(delivery);
        }
    }

    /**
     * Workbook settings.
     *
     * @param templatePath optional template workbook; the built-in template is used when absent
     * @param poolSizes slot sheets per kind for the built-in template
     * @param removeUnusedSheets whether unused slot sheets are deleted (default true)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WorkbookSettings(
        @JsonProperty("templatePath") String templatePath,
        @JsonProperty("poolSizes") Map<EquipmentKind, Integer> poolSizes,
        @JsonProperty("removeUnusedSheets") Boolean removeUnusedSheets
    ) {
        public WorkbookSettings {
            Map<EquipmentKind, Integer> sizes = new EnumMap<>(DEFAULT_POOL_SIZES);
            if (poolSizes != null) {
                sizes.putAll(poolSizes);
            }
            poolSizes = Collections.unmodifiableMap(sizes);
            if (removeUnusedSheets == null) {
                removeUnusedSheets = Boolean.TRUE;
            }
        }

        public int poolSize(EquipmentKind kind) {
            return poolSizes.getOrDefault(kind, 0);
        }
    }

    /**
     * Quotation document settings.
     *
     * @param templateDirectory directory holding templates; templates load from the classpath when absent
     * @param templates template id per quotation kind
     * @param currencySymbol currency symbol for money values (default £)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DocumentSettings(
        @JsonProperty("templateDirectory") String templateDirectory,
        @JsonProperty("templates") Map<QuotationKind, String> templates,
        @JsonProperty("currencySymbol") String currencySymbol
    ) {
        public DocumentSettings {
            Map<QuotationKind, String> ids = new EnumMap<>(QuotationKind.class);
            for (QuotationKind kind : QuotationKind.values()) {
                ids.put(kind, kind.defaultTemplateId());
            }
            if (templates != null) {
                ids.putAll(templates);
            }
            templates = Collections.unmodifiableMap(ids);
            if (currencySymbol == null) {
                currencySymbol = "£";
            }
        }

        public String templateId(QuotationKind kind) {
            return templates.get(kind);
        }
    }

    /**
     * Output settings.
     *
     * @param directory output directory (default {@code ./output})
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("directory") String directory
    ) {
        public OutputSettings {
            if (directory == null) {
                directory = "./output";
            }
        }
    }
}
