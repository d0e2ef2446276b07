package com.testbatch;

import ch.qos.logback.classic.Level;
import com.testbatch.cli.ListCommand;
import com.testbatch.cli.RunCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for TestBatch.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code run} - Run test suites, one batch per suite</li>
 *   <li>{@code list} - List available test suites</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose logging</li>
 *   <li>{@code -q, --quiet} - Log errors only</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Run every suite
 * testbatch run
 *
 * # Run one suite with debug logging
 * testbatch -v run --suite counter
 * }</pre>
 */
@Command(
    name = "testbatch",
    mixinStandardHelpOptions = true,
    version = "TestBatch 1.0.0-SNAPSHOT",
    description = "In-process unit test harness with batched console reporting",
    subcommands = {
        RunCommand.class,
        ListCommand.class
    }
)
public class TestBatchCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TestBatchCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all log output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("TestBatch - In-process unit test harness");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'testbatch --help' to see available commands");
        System.out.println("Use 'testbatch <command> --help' for command-specific help");
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
            root.setLevel(Level.WARN);
        }
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        TestBatchCLI cli = new TestBatchCLI();
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
