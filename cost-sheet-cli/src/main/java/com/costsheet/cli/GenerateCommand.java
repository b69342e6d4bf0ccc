package com.costsheet.cli;

import com.costsheet.core.config.CostSheetConfig;
import com.costsheet.core.model.Project;
import com.costsheet.core.service.CostSheetService;
import com.costsheet.core.service.GenerationResult;
import com.costsheet.core.service.ProjectFiles;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to write the cost sheet workbook for a project.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * costsheet generate project.json
 * costsheet generate project.json --with-quotation -o output
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Generate the cost sheet workbook from a project JSON file",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Parameters(index = "0", description = "Project JSON file")
    private Path projectFile;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: costsheet.yaml)")
    private Path configPath = Paths.get("costsheet.yaml");

    @Option(names = {"-o", "--output"}, description = "Output directory (overrides config)")
    private Path outputDir;

    @Option(names = {"--with-quotation"}, description = "Also write the quotation document(s)")
    private boolean withQuotation;

    @Override
    public Integer call() {
        try {
            log.info("Generating cost sheet from: {}", projectFile.toAbsolutePath());
            CostSheetConfig config = CommandSupport.loadConfiguration(configPath);
            Project project = ProjectFiles.read(projectFile);
            CostSheetService service = new CostSheetService(config);

            GenerationResult result = service.generateCostSheet(project);
            if (!result.success()) {
                return CommandSupport.printFailure(result);
            }
            CommandSupport.printWarnings(result);
            CommandSupport.writeArtifacts(result, outputDir, config);

            if (withQuotation) {
                GenerationResult quotation = service.generateQuotation(project);
                if (!quotation.success()) {
                    return CommandSupport.printFailure(quotation);
                }
                CommandSupport.writeArtifacts(quotation, outputDir, config);
            }

            System.out.println("✓ Project total: " + result.summary().total());
            return 0;

        } catch (Exception e) {
            log.error("Generation failed", e);
            System.err.println("✗ Generation failed: " + e.getMessage());
            return 1;
        }
    }
}
