package com.testbatch.cli;

import com.testbatch.core.suite.TestSuite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;

import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list available test suites.
 *
 * <p>Discovers suites via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * testbatch list
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available test suites",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Override
    public Integer call() {
        System.out.println("Available Suites:");
        System.out.println();

        boolean found = false;
        for (TestSuite suite : ServiceLoader.load(TestSuite.class)) {
            found = true;
            System.out.printf("  • %s (ID: %s)%n", suite.getDisplayName(), suite.getId());
        }

        if (!found) {
            log.warn("No TestSuite providers registered on the classpath");
            System.out.println("  No suites found.");
        }

        return 0;
    }
}
