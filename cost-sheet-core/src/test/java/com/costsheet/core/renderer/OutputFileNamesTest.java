package com.costsheet.core.renderer;

import com.costsheet.core.TestProjects;
import com.costsheet.core.model.ProjectInfo;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link OutputFileNames}.
 */
class OutputFileNamesTest {

    @Test
    void of_datedProject_includesNumberKindAndDate() {
        assertThat(OutputFileNames.of(TestProjects.info(), OutputFileNames.COST_SHEET, OutputFileNames.XLSX))
            .isEqualTo("1234 Cost Sheet 15012025.xlsx");
    }

    @Test
    void of_revisedProject_appendsRevision() {
        ProjectInfo revised = TestProjects.info().withRevision("A");

        assertThat(OutputFileNames.of(revised, "Quotation", OutputFileNames.DOCX))
            .isEqualTo("1234 Quotation 15012025 Rev A.docx");
    }

    @Test
    void of_noNumberOrDate_keepsKindOnly() {
        ProjectInfo bare = new ProjectInfo("Hotel", null, null, null, null, null, null, null, null, null, null);

        assertThat(OutputFileNames.of(bare, OutputFileNames.QUOTATIONS, OutputFileNames.ZIP)).isEqualTo("Quotations.zip");
    }

    @Test
    void of_illegalCharacters_areReplaced() {
        ProjectInfo slashed = new ProjectInfo("Hotel", "12/34", null, null, null, null, null, null, null,
            LocalDate.of(2025, 1, 15), null);

        assertThat(OutputFileNames.of(slashed, OutputFileNames.COST_SHEET, OutputFileNames.XLSX))
            .isEqualTo("12-34 Cost Sheet 15012025.xlsx");
    }
}
