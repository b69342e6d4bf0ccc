package com.costsheet.core.service;

import com.costsheet.core.TestProjects;
import com.costsheet.core.model.EquipmentKind;
import com.costsheet.core.model.Item;
import com.costsheet.core.model.Project;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ProjectFiles}.
 */
class ProjectFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void write_thenRead_preservesProjectTree() throws IOException {
        // Given
        Path file = tempDir.resolve("project.json");
        Project project = TestProjects.everyKind();

        // When
        ProjectFiles.write(file, project);
        Project read = ProjectFiles.read(file);

        // Then
        assertThat(read).usingRecursiveComparison()
            .withComparatorForType(BigDecimal::compareTo, BigDecimal.class)
            .isEqualTo(project);
        assertThat(Files.readString(file)).contains("\"date\" : \"2025-01-15\"");
    }

    @Test
    void parse_handWrittenJson_appliesDefaults() throws IOException {
        // Given
        String json = """
            {
              "info": { "name": "Canteen", "number": "0042", "date": "2025-03-01", "extra": "ignored" },
              "levels": [
                {
                  "name": "Basement",
                  "areas": [
                    {
                      "name": "Prep",
                      "options": ["RECOAIR"],
                      "items": [
                        {
                          "reference": "K1",
                          "model": "KVF",
                          "basePrice": 4200,
                          "options": { "FIRE_SUPPRESSION": { "price": 1500 } }
                        }
                      ],
                      "sharedCosts": { "FIRE_SUPPRESSION": { "delivery": 300 } }
                    }
                  ]
                }
              ]
            }
            """;

        // When
        Project project = ProjectFiles.parse(json);

        // Then
        assertThat(project.info().revision()).isEmpty();
        assertThat(project.info().date()).isEqualTo(LocalDate.of(2025, 3, 1));
        Item item = project.allItems().get(0);
        assertThat(item.basePrice()).isEqualByComparingTo("4200");
        assertThat(item.option(EquipmentKind.FIRE_SUPPRESSION).orElseThrow().quantity()).isNull();
        assertThat(project.allAreas().get(0).options()).containsExactly(EquipmentKind.RECOAIR);
        assertThat(project.allAreas().get(0).sharedCosts(EquipmentKind.FIRE_SUPPRESSION).commissioning())
            .isEqualByComparingTo("0");
    }

    @Test
    void read_emptyFile_throwsIOException() throws IOException {
        Path file = Files.writeString(tempDir.resolve("empty.json"), "");

        assertThatThrownBy(() -> ProjectFiles.read(file)).isInstanceOf(IOException.class);
    }
}
