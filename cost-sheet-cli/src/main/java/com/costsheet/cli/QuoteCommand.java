package com.costsheet.cli;

import com.costsheet.core.config.CostSheetConfig;
import com.costsheet.core.service.CostSheetService;
import com.costsheet.core.service.GenerationResult;
import com.costsheet.core.service.ProjectFiles;
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
 * Command to write the quotation document(s).
 *
 * <p>The input is either a cost sheet workbook, read back including any edits made in
 * the spreadsheet, or a project JSON file. When both a main and a RecoAir quotation apply
 * they are written as one ZIP bundle.
 */
@Command(
    name = "quote",
    description = "Generate the quotation from a cost sheet workbook or a project JSON file",
    mixinStandardHelpOptions = true
)
public class QuoteCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(QuoteCommand.class);

    @Parameters(index = "0", description = "Cost sheet (.xlsx) or project JSON file")
    private Path input;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: costsheet.yaml)")
    private Path configPath = Paths.get("costsheet.yaml");

    @Option(names = {"-o", "--output"}, description = "Output directory (overrides config)")
    private Path outputDir;

    @Override
    public Integer call() {
        try {
            log.info("Generating quotation from: {}", input.toAbsolutePath());
            CostSheetConfig config = CommandSupport.loadConfiguration(configPath);
            CostSheetService service = new CostSheetService(config);

            GenerationResult result = CommandSupport.isWorkbook(input)
                ? service.generateQuotation(Files.readAllBytes(input))
                : service.generateQuotation(ProjectFiles.read(input));
            if (!result.success()) {
                return CommandSupport.printFailure(result);
            }
            CommandSupport.printWarnings(result);
            CommandSupport.writeArtifacts(result, outputDir, config);
            return 0;

        } catch (Exception e) {
            log.error("Quotation failed", e);
            System.err.println("✗ Quotation failed: " + e.getMessage());
            return 1;
        }
    }
}
