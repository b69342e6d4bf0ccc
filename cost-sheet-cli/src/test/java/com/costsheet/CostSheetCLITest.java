package com.costsheet;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for the {@code costsheet} command line.
 */
class CostSheetCLITest {

    private static final String PROJECT = """
        {
          "info": {
            "name": "Hotel Refit",
            "number": "1234",
            "customer": "Jane Smith",
            "estimator": "Yazan Hunjul",
            "date": "2025-01-15"
          },
          "levels": [
            {
              "name": "Ground Floor",
              "areas": [
                {
                  "name": "Main Kitchen",
                  "items": [
                    {
                      "reference": "C1",
                      "model": "KVF",
                      "configuration": "Wall",
                      "basePrice": 5000,
                      "options": { "FIRE_SUPPRESSION": { "price": 1690, "quantity": 2 } }
                    },
                    {
                      "reference": "C2",
                      "model": "KVI",
                      "configuration": "Island",
                      "basePrice": 4000,
                      "options": { "FIRE_SUPPRESSION": { "price": 1200 } }
                    }
                  ],
                  "sharedCosts": { "FIRE_SUPPRESSION": { "delivery": 800 } }
                }
              ]
            }
          ]
        }
        """;

    private static final String CONFIG = """
        workbook:
          poolSizes:
            CANOPY: 2
            FIRE_SUPPRESSION: 2
            UV_C: 1
            RECOAIR: 1
            REACTAWAY: 1
            SDU: 2
        """;

    @TempDir
    Path tempDir;

    private Path projectFile;
    private Path configFile;
    private Path outputDir;

    @BeforeEach
    void setUp() throws IOException {
        projectFile = Files.writeString(tempDir.resolve("project.json"), PROJECT);
        configFile = Files.writeString(tempDir.resolve("costsheet.yaml"), CONFIG);
        outputDir = tempDir.resolve("out");
    }

    @Test
    void generate_validProject_writesCostSheet() {
        // When
        int exitCode = run("generate", projectFile.toString(), "-c", configFile.toString(), "-o", outputDir.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(outputDir.resolve("1234 Cost Sheet 15012025.xlsx")).isRegularFile();
    }

    @Test
    void generate_withQuotation_writesBothArtifacts() {
        // When
        int exitCode = run("generate", projectFile.toString(), "--with-quotation",
            "-c", configFile.toString(), "-o", outputDir.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(outputDir.resolve("1234 Cost Sheet 15012025.xlsx")).isRegularFile();
        assertThat(outputDir.resolve("1234 Quotation 15012025.docx")).isRegularFile();
    }

    @Test
    void quote_fromGeneratedCostSheet_writesQuotation() {
        // Given
        run("generate", projectFile.toString(), "-c", configFile.toString(), "-o", outputDir.toString());
        Path costSheet = outputDir.resolve("1234 Cost Sheet 15012025.xlsx");

        // When
        int exitCode = run("quote", costSheet.toString(), "-c", configFile.toString(), "-o", outputDir.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(outputDir.resolve("1234 Quotation 15012025.docx")).isRegularFile();
    }

    @Test
    void revise_generatedCostSheet_writesRevisionA() {
        // Given
        run("generate", projectFile.toString(), "-c", configFile.toString(), "-o", outputDir.toString());
        Path costSheet = outputDir.resolve("1234 Cost Sheet 15012025.xlsx");

        // When
        int exitCode = run("revise", costSheet.toString(), "-c", configFile.toString(), "-o", outputDir.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(outputDir.resolve("1234 Cost Sheet 15012025 Rev A.xlsx")).isRegularFile();
    }

    @Test
    void summary_projectFile_exitsZero() {
        assertThat(run("summary", projectFile.toString(), "-c", configFile.toString())).isZero();
    }

    @Test
    void validate_validProject_exitsZero() {
        assertThat(run("validate", projectFile.toString(), "-c", configFile.toString())).isZero();
    }

    @Test
    void validate_duplicateReference_exitsOne() throws IOException {
        // Given
        Path invalid = Files.writeString(tempDir.resolve("invalid.json"), PROJECT.replace("\"C2\"", "\"C1\""));

        // When
        int exitCode = run("validate", invalid.toString(), "-c", configFile.toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void generate_missingProjectFile_exitsOne() {
        int exitCode = run("generate", tempDir.resolve("missing.json").toString(), "-c", configFile.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(outputDir).doesNotExist();
    }

    @Test
    void generate_invalidProject_writesNothing() throws IOException {
        // Given
        Path invalid = Files.writeString(tempDir.resolve("invalid.json"), PROJECT.replace("\"1234\"", "\"\""));

        // When
        int exitCode = run("generate", invalid.toString(), "-c", configFile.toString(), "-o", outputDir.toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(outputDir).doesNotExist();
    }

    private static int run(String... args) {
        return CostSheetCLI.commandLine().execute(args);
    }
}
