package com.costsheet.cli;

import com.costsheet.core.config.CostSheetConfig;
import com.costsheet.core.service.CostSheetService;
import com.costsheet.core.service.GenerationResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to rewrite a cost sheet under its next revision letter.
 */
@Command(
    name = "revise",
    description = "Read a cost sheet, advance its revision and write it again",
    mixinStandardHelpOptions = true
)
public class ReviseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReviseCommand.class);

    @Parameters(index = "0", description = "Cost sheet workbook (.xlsx)")
    private Path workbook;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: costsheet.yaml)")
    private Path configPath = Paths.get("costsheet.yaml");

    @Option(names = {"-o", "--output"}, description = "Output directory (overrides config)")
    private Path outputDir;

    @Override
    public Integer call() {
        try {
            log.info("Revising cost sheet: {}", workbook.toAbsolutePath());
            CostSheetConfig config = CommandSupport.loadConfiguration(configPath);
            GenerationResult result = new CostSheetService(config).revise(Files.readAllBytes(workbook));
            if (!result.success()) {
                return CommandSupport.printFailure(result);
            }
            CommandSupport.printWarnings(result);
            CommandSupport.writeArtifacts(result, outputDir, config);
            System.out.println("✓ Revision " + result.project().info().revision());
            return 0;

        } catch (Exception e) {
            log.error("Revision failed", e);
            System.err.println("✗ Revision failed: " + e.getMessage());
            return 1;
        }
    }
}
