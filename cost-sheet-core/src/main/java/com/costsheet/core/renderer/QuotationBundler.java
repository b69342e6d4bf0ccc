package com.costsheet.core.renderer;

import com.costsheet.core.exception.CostSheetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Bundles several rendered documents into one ZIP archive.
 */
public class QuotationBundler {

    private static final Logger log = LoggerFactory.getLogger(QuotationBundler.class);

    /**
     * Writes the files into a ZIP archive, one entry per file named by its relative path.
     *
     * @param files documents to bundle
     * @return archive bytes
     * @throws IllegalArgumentException if there are no files or two files share a name
     */
    public byte[] bundle(List<GeneratedFile> files) {
        if (files.isEmpty()) {
            throw new IllegalArgumentException("Nothing to bundle");
        }
        Set<String> names = new HashSet<>();
        try (ByteArrayOutputStream out = new ByteArrayOutputStream();
             ZipOutputStream zip = new ZipOutputStream(out)) {
            for (GeneratedFile file : files) {
                if (!names.add(file.relativePath())) {
                    throw new IllegalArgumentException("Duplicate entry in bundle: " + file.relativePath());
                }
                zip.putNextEntry(new ZipEntry(file.relativePath()));
                zip.write(file.content());
                zip.closeEntry();
            }
            zip.finish();
            log.debug("Bundled {} documents", files.size());
            return out.toByteArray();
        } catch (IOException e) {
            throw new CostSheetException("Failed to bundle documents", e);
        }
    }
}
