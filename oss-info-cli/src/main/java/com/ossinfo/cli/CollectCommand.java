package com.ossinfo.cli;

import com.ossinfo.core.config.ConfigLoader;
import com.ossinfo.core.config.OssInfoConfig;
import com.ossinfo.core.parser.DependencyReportException;
import com.ossinfo.core.renderer.CsvReportWriter;
import com.ossinfo.core.repository.ArtifactFetchException;
import com.ossinfo.core.repository.ArtifactInfoCollector;
import com.ossinfo.core.repository.CollectionResult;
import com.ossinfo.core.repository.HttpArtifactInfoClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to collect open source information for the dependencies of a report.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Load {@code ossinfo.yaml}</li>
 *   <li>Parse the report into a dependency list</li>
 *   <li>Fetch metadata and POM of every dependency from its repository</li>
 *   <li>Write the report to standard output</li>
 * </ol>
 *
 * <p>Dependencies that cannot be fetched are left out of the report and make the command
 * exit with code 1 once the report has been written.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ./gradlew :app:dependencies --configuration releaseRuntimeClasspath | ossinfo collect > oss.csv
 * ossinfo collect -i dependencies.txt -c ossinfo.yaml
 * }</pre>
 */
@Command(
    name = "collect",
    description = "Fetch name, description and licenses of the dependencies in a Gradle dependency report",
    mixinStandardHelpOptions = true
)
public class CollectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CollectCommand.class);

    /**
     * Report formats.
     */
    enum Format {
        CSV
    }

    @Mixin
    private ReportInputOptions inputOptions;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: ossinfo.yaml next to the report, else in the working directory)"
    )
    private Path configPath;

    @Option(
        names = {"--format"},
        description = "Report format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})"
    )
    private Format format = Format.CSV;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        try {
            OssInfoConfig config = ConfigLoader.load(configPath, inputOptions.input());

            List<String> dependencies = inputOptions.readDependencies();
            log.info("Found {} dependencies", dependencies.size());

            ArtifactInfoCollector collector =
                new ArtifactInfoCollector(HttpArtifactInfoClient.create(config), config.http().concurrency());
            CollectionResult result = collector.collect(dependencies);

            writeReport(result);

            if (result.hasFailures()) {
                err.println("✗ Failed to fetch " + result.failures().size() + " of "
                    + dependencies.size() + " dependencies: " + String.join(", ", result.failures()));
                return 1;
            }
            return 0;
        } catch (DependencyReportException e) {
            log.error("Failed to parse dependency report", e);
            err.println("✗ Failed to parse dependency report: " + e.getMessage());
            return 1;
        } catch (ArtifactFetchException | IOException e) {
            log.error("Collect failed", e);
            err.println("✗ Collect failed: " + e.getMessage());
            return 1;
        }
    }

    private void writeReport(CollectionResult result) throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        switch (format) {
            case CSV -> new CsvReportWriter().write(result, out);
        }
    }
}
