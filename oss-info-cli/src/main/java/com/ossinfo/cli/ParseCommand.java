package com.ossinfo.cli;

import com.ossinfo.core.parser.DependencyReportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to print the direct dependencies of a report without contacting any repository.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ./gradlew :app:dependencies --configuration releaseRuntimeClasspath | ossinfo parse
 * ossinfo parse -i dependencies.txt
 * }</pre>
 */
@Command(
    name = "parse",
    description = "Print the dependencies found in a Gradle dependency report, one per line",
    mixinStandardHelpOptions = true
)
public class ParseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ParseCommand.class);

    @Mixin
    private ReportInputOptions inputOptions;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            List<String> dependencies = inputOptions.readDependencies();
            dependencies.forEach(out::println);
            out.flush();
            log.info("Found {} dependencies", dependencies.size());
            return 0;
        } catch (DependencyReportException | IOException e) {
            log.error("Parse failed", e);
            spec.commandLine().getErr().println("✗ Parse failed: " + e.getMessage());
            return 1;
        }
    }
}
