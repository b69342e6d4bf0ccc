package com.costsheet;

import com.costsheet.cli.GenerateCommand;
import com.costsheet.cli.QuoteCommand;
import com.costsheet.cli.ReviseCommand;
import com.costsheet.cli.SummaryCommand;
import com.costsheet.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for the cost sheet generator.
 *
 * <p>Turns a kitchen ventilation project (levels, areas, canopy items and their options)
 * into a priced cost sheet workbook and a quotation document.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Write the cost sheet for a project JSON file</li>
 *   <li>{@code quote} - Write the quotation from a cost sheet or project JSON file</li>
 *   <li>{@code validate} - Check a project JSON file</li>
 *   <li>{@code summary} - Print the pricing summary of a project or cost sheet</li>
 *   <li>{@code revise} - Rewrite a cost sheet under its next revision letter</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Write the cost sheet
 * costsheet generate project.json -o output
 *
 * # Quote from the (possibly hand-edited) cost sheet
 * costsheet quote "output/1234 Cost Sheet 15012025.xlsx"
 *
 * # Print totals with debug logging
 * costsheet -v summary project.json
 * }</pre>
 */
@Command(
    name = "costsheet",
    mixinStandardHelpOptions = true,
    version = "Cost Sheet Generator 1.0.0-SNAPSHOT",
    description = "Kitchen ventilation cost sheet and quotation generator",
    subcommands = {
        GenerateCommand.class,
        QuoteCommand.class,
        ValidateCommand.class,
        SummaryCommand.class,
        ReviseCommand.class
    }
)
public class CostSheetCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CostSheetCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("Cost Sheet Generator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'costsheet --help' to see available commands");
        System.out.println("Use 'costsheet <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return command line ready to execute
     */
    public static CommandLine commandLine() {
        CostSheetCLI cli = new CostSheetCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
