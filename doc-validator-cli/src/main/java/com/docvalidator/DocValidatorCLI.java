package com.docvalidator;

import com.docvalidator.cli.CrossRefCommand;
import com.docvalidator.cli.StatusCommand;
import com.docvalidator.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for DocValidator.
 *
 * <p>DocValidator checks a set of markdown documents for structure, required content,
 * terminology definitions and cross-reference integrity.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code validate} - Validate documentation files</li>
 *   <li>{@code cross-ref} - Show resolved links and term usages</li>
 *   <li>{@code status} - Show per-file validation status</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all log output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Exit codes:</b> 0 success, 1 validation failed, 2 invocation or I/O error.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Validate everything under ./docs
 * doc-validator validate
 *
 * # Strict run with JSON output
 * doc-validator validate --strict --format json
 *
 * # Where is ATO used?
 * doc-validator cross-ref --term ATO
 * }</pre>
 */
@Command(
    name = "doc-validator",
    mixinStandardHelpOptions = true,
    version = "DocValidator 1.0.0-SNAPSHOT",
    description = "Documentation validation and cross-reference checker",
    subcommands = {
        ValidateCommand.class,
        CrossRefCommand.class,
        StatusCommand.class
    }
)
public class DocValidatorCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DocValidatorCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all log output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("DocValidator - Documentation Validation and Cross-Reference Checker");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'doc-validator --help' to see available commands");
        System.out.println("Use 'doc-validator <command> --help' for command-specific help");
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
        log.debug("Log level set to {}", root.getLevel());
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        DocValidatorCLI cli = new DocValidatorCLI();
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
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
