package com.stencil.cli;

import com.stencil.core.output.OutputWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list available output writers.
 *
 * <p>Discovers writers via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * stencil list writers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available output writers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: writers",
        defaultValue = "writers"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase()) {
            case "writers", "writer" -> listWriters();
            default -> {
                log.error("Unknown type: {}. Use: writers", type);
                yield 1;
            }
        };
    }

    private int listWriters() {
        System.out.println("Available Writers:");
        System.out.println();

        boolean found = false;
        for (OutputWriter writer : ServiceLoader.load(OutputWriter.class)) {
            found = true;
            System.out.printf("  • %s%n", writer.getId());
            System.out.printf("    %s%n", writer.getDescription());
            System.out.println();
        }

        if (!found) {
            System.out.println("  No writers found.");
        }

        return 0;
    }
}
