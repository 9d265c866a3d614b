package com.ossinfo;

import ch.qos.logback.classic.Level;
import com.ossinfo.cli.CollectCommand;
import com.ossinfo.cli.ListCommand;
import com.ossinfo.cli.ParseCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.AutoComplete;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for OSS Info.
 *
 * <p>OSS Info reads the dependency tree that Gradle prints for one configuration, keeps the
 * direct dependencies and looks up their name, description and licenses in Maven repositories.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code collect} - Parse a report and print artifact information as CSV</li>
 *   <li>{@code parse} - Parse a report and print the dependency list</li>
 *   <li>{@code list} - List available dependency list parsers</li>
 *   <li>{@code generate-completion} - Print a bash completion script</li>
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
 * # Collect license information of the app's release dependencies
 * ./gradlew :app:dependencies --configuration releaseRuntimeClasspath | ossinfo collect > oss.csv
 *
 * # Only print the direct dependencies
 * ossinfo parse -i dependencies.txt
 *
 * # Input already is one dependency per line
 * ossinfo collect --skip-pretty -i dependencies.txt
 * }</pre>
 */
@Command(
    name = "ossinfo",
    mixinStandardHelpOptions = true,
    version = "OSS Info 1.0.0-SNAPSHOT",
    description = "Collects open source information for the dependencies of a Gradle dependency report",
    subcommands = {
        CollectCommand.class,
        ParseCommand.class,
        ListCommand.class,
        AutoComplete.GenerateCompletion.class
    }
)
public class OssInfoCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(OssInfoCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("OSS Info - open source information for Gradle dependencies");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'ossinfo --help' to see available commands");
        System.out.println("Use 'ossinfo <command> --help' for command-specific help");
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
        log.debug("Logging level set to {}", root.getLevel());
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line, applying the global logging options before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        OssInfoCLI cli = new OssInfoCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
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
