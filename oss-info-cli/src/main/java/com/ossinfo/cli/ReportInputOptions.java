package com.ossinfo.cli;

import com.ossinfo.core.parser.DependencyListParser;
import com.ossinfo.core.parser.DependencyListParsers;
import com.ossinfo.core.parser.DependencyReportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Input options shared by the commands that read a dependency report.
 */
public class ReportInputOptions {

    private static final Logger log = LoggerFactory.getLogger(ReportInputOptions.class);

    static final String TREE_PARSER_ID = "gradle-tree";
    static final String FLAT_LIST_PARSER_ID = "flat-list";

    @Option(
        names = {"-i", "--input"},
        paramLabel = "FILE",
        description = "Dependency report to read (default: standard input)"
    )
    private Path input;

    @Option(
        names = {"--skip-pretty"},
        description = "Input is already one dependency per line, skip tree extraction"
    )
    private boolean skipPretty;

    /**
     * Returns the report file, or null when reading standard input.
     */
    Path input() {
        return input;
    }

    /**
     * Returns the parser selected by {@code --skip-pretty}.
     *
     * @return flat-list parser with {@code --skip-pretty}, tree parser otherwise
     */
    DependencyListParser parser() {
        return DependencyListParsers.byId(skipPretty ? FLAT_LIST_PARSER_ID : TREE_PARSER_ID);
    }

    /**
     * Reads and parses the report.
     *
     * @return sorted, deduplicated dependencies
     * @throws DependencyReportException if the report is malformed
     * @throws IOException if the input file cannot be opened
     */
    List<String> readDependencies() throws DependencyReportException, IOException {
        DependencyListParser parser = parser();
        log.debug("Parsing {} with {}", input == null ? "standard input" : input, parser.getDisplayName());

        if (input == null) {
            // stdin stays open for the JVM
            BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            return parser.parse(reader);
        }
        try (BufferedReader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            return parser.parse(reader);
        }
    }
}
