package com.costsheet.cli;

import com.costsheet.core.aggregate.AreaSummary;
import com.costsheet.core.aggregate.KindRollup;
import com.costsheet.core.aggregate.KindSubtotal;
import com.costsheet.core.aggregate.LevelSummary;
import com.costsheet.core.aggregate.PricingSummary;
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
 * Command to print the pricing summary of a project JSON file or cost sheet.
 */
@Command(
    name = "summary",
    description = "Print level, area and equipment totals of a project or cost sheet",
    mixinStandardHelpOptions = true
)
public class SummaryCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SummaryCommand.class);

    @Parameters(index = "0", description = "Project JSON file or cost sheet (.xlsx)")
    private Path input;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: costsheet.yaml)")
    private Path configPath = Paths.get("costsheet.yaml");

    @Override
    public Integer call() {
        try {
            log.info("Summarizing: {}", input.toAbsolutePath());
            CostSheetService service = new CostSheetService(CommandSupport.loadConfiguration(configPath));
            GenerationResult result = CommandSupport.isWorkbook(input)
                ? service.readCostSheet(Files.readAllBytes(input))
                : service.price(ProjectFiles.read(input));
            if (!result.success()) {
                return CommandSupport.printFailure(result);
            }
            printSummary(result.project().info().number(), result.summary());
            CommandSupport.printWarnings(result);
            return 0;

        } catch (Exception e) {
            log.error("Summary failed", e);
            System.err.println("✗ Summary failed: " + e.getMessage());
            return 1;
        }
    }

    private void printSummary(String projectNumber, PricingSummary summary) {
        System.out.println("Project " + projectNumber);
        for (LevelSummary level : summary.levels()) {
            System.out.println("  " + level.name() + ": " + level.total());
            for (AreaSummary area : level.areas()) {
                System.out.println("    (" + area.areaNumber() + ") " + area.name() + ": " + area.total());
                for (KindSubtotal kind : area.kinds().values()) {
                    System.out.println("      " + kind.kind().label() + ": " + kind.total());
                }
            }
        }
        System.out.println();
        for (KindRollup rollup : summary.rollups().values()) {
            System.out.printf("  %-18s count %3d  quantity %3d  %s%n",
                rollup.kind().label(), rollup.count(), rollup.quantity(), rollup.total());
        }
        System.out.println("  Total: " + summary.total());
    }
}
