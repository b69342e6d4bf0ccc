package com.costsheet.core.renderer;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link QuotationBundler}.
 */
class QuotationBundlerTest {

    private final QuotationBundler bundler = new QuotationBundler();

    @Test
    void bundle_twoDocuments_writesOneEntryEach() throws IOException {
        // Given
        List<GeneratedFile> files = List.of(
            docx("1234 Quotation 15012025.docx", "main"),
            docx("1234 RecoAir Quotation 15012025.docx", "recoair"));

        // When
        byte[] archive = bundler.bundle(files);

        // Then
        List<String> names = new ArrayList<>();
        List<String> contents = new ArrayList<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                names.add(entry.getName());
                contents.add(new String(zip.readAllBytes(), StandardCharsets.UTF_8));
            }
        }
        assertThat(names).containsExactly("1234 Quotation 15012025.docx", "1234 RecoAir Quotation 15012025.docx");
        assertThat(contents).containsExactly("main", "recoair");
    }

    @Test
    void bundle_duplicateNames_throwsIllegalArgumentException() {
        List<GeneratedFile> files = List.of(docx("same.docx", "a"), docx("same.docx", "b"));

        assertThatThrownBy(() -> bundler.bundle(files))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("same.docx");
    }

    @Test
    void bundle_noDocuments_throwsIllegalArgumentException() {
        assertThatThrownBy(() -> bundler.bundle(List.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Nothing to bundle");
    }

    private static GeneratedFile docx(String name, String content) {
        return new GeneratedFile(name, content.getBytes(StandardCharsets.UTF_8), GeneratedFile.DOCX);
    }
}
