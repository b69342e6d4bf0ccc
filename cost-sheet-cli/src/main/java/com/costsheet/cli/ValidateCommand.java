package com.costsheet.cli;

import com.costsheet.core.exception.ValidationIssue;
import com.costsheet.core.model.Project;
import com.costsheet.core.service.CostSheetService;
import com.costsheet.core.service.ProjectFiles;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to validate a project JSON file.
 */
@Command(
    name = "validate",
    description = "Validate a project JSON file",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Project JSON file to validate")
    private Path projectFile;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: costsheet.yaml)")
    private Path configPath = Paths.get("costsheet.yaml");

    @Override
    public Integer call() {
        try {
            log.info("Validating project: {}", projectFile);
            Project project = ProjectFiles.read(projectFile);
            CostSheetService service = new CostSheetService(CommandSupport.loadConfiguration(configPath));

            List<ValidationIssue> issues = service.validate(project);
            if (issues.isEmpty()) {
                System.out.println("✓ Project " + project.info().number() + " is valid");
                return 0;
            }
            System.err.println("✗ Project has " + issues.size() + " issue(s):");
            issues.forEach(issue -> System.err.println("  - " + issue));
            return 1;

        } catch (Exception e) {
            log.error("Validation failed", e);
            System.err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }
}
