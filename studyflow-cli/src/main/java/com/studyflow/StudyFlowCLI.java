package com.studyflow;

import com.studyflow.cli.ExportCommand;
import com.studyflow.cli.FixCommand;
import com.studyflow.cli.GenerateCommand;
import com.studyflow.cli.ListCommand;
import com.studyflow.cli.MapCommand;
import com.studyflow.cli.NormalizeCommand;
import com.studyflow.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for StudyFlow.
 *
 * <p>StudyFlow builds the visit schedule and Table of Procedures of a clinical trial,
 * checks it against the ICF and SAP, and repairs what can be repaired automatically.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Generate a study flow from endpoints and visit labels</li>
 *   <li>{@code validate} - Validate a study flow, optionally against ICF and SAP</li>
 *   <li>{@code fix} - Apply auto-fixes to validation issues</li>
 *   <li>{@code export} - Export the Table of Procedures</li>
 *   <li>{@code normalize} - Normalize free-text visit labels</li>
 *   <li>{@code map} - Map procedure text to the catalog</li>
 *   <li>{@code list} - List exporters, renderers, catalog categories or rules</li>
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
 * # Generate a 24 week study
 * studyflow generate -e "primary:HbA1c change from baseline" -w 24
 *
 * # Validate against the SAP
 * studyflow validate studyflow.json --sap sap.yaml
 *
 * # Fix everything that can be fixed
 * studyflow fix studyflow.json --all
 * }</pre>
 */
@Command(
    name = "studyflow",
    mixinStandardHelpOptions = true,
    version = "StudyFlow 1.0.0-SNAPSHOT",
    description = "Clinical trial study flow engine",
    subcommands = {
        GenerateCommand.class,
        ValidateCommand.class,
        FixCommand.class,
        ExportCommand.class,
        NormalizeCommand.class,
        MapCommand.class,
        ListCommand.class
    }
)
public class StudyFlowCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StudyFlowCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("StudyFlow - Clinical Trial Study Flow Engine");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'studyflow --help' to see available commands");
        System.out.println("Use 'studyflow <command> --help' for command-specific help");
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
     * Builds the command line with global options applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        StudyFlowCLI cli = new StudyFlowCLI();
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
