package com.costsheet.cli;

import com.costsheet.core.config.ConfigLoader;
import com.costsheet.core.config.CostSheetConfig;
import com.costsheet.core.exception.ValidationIssue;
import com.costsheet.core.renderer.GeneratedOutput;
import com.costsheet.core.renderer.OutputRenderer;
import com.costsheet.core.renderer.RenderContext;
import com.costsheet.core.renderer.impl.FileSystemRenderer;
import com.costsheet.core.service.GenerationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Helpers shared by the subcommands.
 */
final class CommandSupport {

    private static final Logger log = LoggerFactory.getLogger(CommandSupport.class);

    private CommandSupport() {
    }

    static CostSheetConfig loadConfiguration(Path configPath) {
        log.debug("Loading configuration from: {}", configPath);
        return ConfigLoader.load(configPath);
    }

    static boolean isWorkbook(Path input) {
        String name = input.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".xlsx") || name.endsWith(".xlsm");
    }

    /**
     * Writes the artifacts of a successful result.
     *
     * @param result service result
     * @param outputDir output directory option, null to use the configured one
     * @param config configuration
     * @return directory written to
     */
    static Path writeArtifacts(GenerationResult result, Path outputDir, CostSheetConfig config) {
        Path directory = outputDir != null ? outputDir : Path.of(config.output().directory());
        OutputRenderer renderer = new FileSystemRenderer();
        RenderContext context = new RenderContext(directory.toString(), Map.of(RenderContext.OVERWRITE, "true"));
        renderer.render(new GeneratedOutput(result.artifacts()), context);
        result.artifacts().forEach(file -> System.out.println("✓ Wrote " + directory.resolve(file.relativePath())));
        return directory;
    }

    static void printWarnings(GenerationResult result) {
        for (String warning : result.warnings()) {
            System.out.println("⚠ " + warning);
        }
    }

    /**
     * Prints a failed result to stderr.
     *
     * @param result failed service result
     * @return exit code 1
     */
    static int printFailure(GenerationResult result) {
        System.err.println("✗ " + result.failure());
        for (ValidationIssue issue : result.issues()) {
            System.err.println("  - " + issue);
        }
        return 1;
    }
}
