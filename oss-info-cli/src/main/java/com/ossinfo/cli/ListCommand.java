package com.ossinfo.cli;

import com.ossinfo.core.parser.DependencyListParser;
import com.ossinfo.core.parser.DependencyListParsers;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list the dependency list parsers.
 *
 * <p>Discovers parsers via Java Service Provider Interface (SPI).
 */
@Command(
    name = "list",
    description = "List available dependency list parsers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Parsers:");
        out.println();

        List<DependencyListParser> parsers = DependencyListParsers.discover();
        for (DependencyListParser parser : parsers) {
            out.printf("  • %s (ID: %s)%n", parser.getDisplayName(), parser.getId());
            out.printf("    Selected by: %s%n", selectedBy(parser));
            out.println();
        }

        if (parsers.isEmpty()) {
            out.println("  No parsers found.");
        }
        out.flush();
        return 0;
    }

    private static String selectedBy(DependencyListParser parser) {
        return switch (parser.getId()) {
            case ReportInputOptions.TREE_PARSER_ID -> "default";
            case ReportInputOptions.FLAT_LIST_PARSER_ID -> "--skip-pretty";
            default -> "not selectable";
        };
    }
}
