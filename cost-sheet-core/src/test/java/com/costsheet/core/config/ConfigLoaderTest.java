package com.costsheet.core.config;

import com.costsheet.core.document.QuotationKind;
import com.costsheet.core.model.CostPool;
import com.costsheet.core.model.EquipmentKind;
import com.costsheet.core.pricing.DistributionMode;
import com.costsheet.core.pricing.SharedCostScope;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("costsheet.yaml");
        Files.writeString(configFile, """
            project:
              name: "Kitchen estimates"

            pricing:
              sharedCostScope: LEVEL
              delivery:
                UV_C: EXPLICIT_ROW

            workbook:
              poolSizes:
                CANOPY: 5
              removeUnusedSheets: false

            documents:
              templateDirectory: "./templates"
              templates:
                RECOAIR: "reco.docx"
              currencySymbol: "€"

            features:
              reactaway: false

            output:
              directory: "./out"
            """);

        CostSheetConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("Kitchen estimates");
        assertThat(config.pricing().sharedCostScope()).isEqualTo(SharedCostScope.LEVEL);
        assertThat(config.pricing().policy().mode(EquipmentKind.UV_C, CostPool.DELIVERY))
            .isEqualTo(DistributionMode.EXPLICIT_ROW);
        assertThat(config.workbook().poolSize(EquipmentKind.CANOPY)).isEqualTo(5);
        assertThat(config.workbook().poolSize(EquipmentKind.SDU)).isEqualTo(30);
        assertThat(config.workbook().removeUnusedSheets()).isFalse();
        assertThat(config.documents().templateDirectory()).isEqualTo("./templates");
        assertThat(config.documents().templateId(QuotationKind.RECOAIR)).isEqualTo("reco.docx");
        assertThat(config.documents().templateId(QuotationKind.MAIN)).isEqualTo("quotation.docx");
        assertThat(config.documents().currencySymbol()).isEqualTo("€");
        assertThat(config.featureFlags().isEnabled(EquipmentKind.REACTAWAY)).isFalse();
        assertThat(config.featureFlags().isEnabled(EquipmentKind.SDU)).isTrue();
        assertThat(config.output().directory()).isEqualTo("./out");
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("costsheet.yaml");
        Files.writeString(configFile, """
            project:
              name: "Minimal"
            """);

        CostSheetConfig config = ConfigLoader.load(configFile);

        assertThat(config.pricing().sharedCostScope()).isEqualTo(SharedCostScope.AREA);
        assertThat(config.workbook().templatePath()).isNull();
        assertThat(config.workbook().removeUnusedSheets()).isTrue();
        assertThat(config.documents().currencySymbol()).isEqualTo("£");
        assertThat(config.output().directory()).isEqualTo("./output");
    }

    @Test
    void load_missingFile_returnsDefaults() {
        CostSheetConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(CostSheetConfig.defaults());
    }

    @Test
    void load_nullPath_returnsDefaults() {
        assertThat(ConfigLoader.load(null)).isEqualTo(CostSheetConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("costsheet.yaml");
        Files.writeString(configFile, "pricing: [unclosed");

        CostSheetConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(CostSheetConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("costsheet.yaml");
        Files.writeString(configFile, "");

        CostSheetConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(CostSheetConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(CostSheetConfig.defaults());
    }

    @Test
    void featureFlags_unlistedFeature_isEnabled() {
        FeatureFlags flags = new ConfiguredFeatureFlags(null);

        assertThat(flags.isEnabled("anything")).isTrue();
        assertThat(FeatureFlags.allEnabled().isEnabled(EquipmentKind.SDU)).isTrue();
    }
}
