package com.ossinfo;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link OssInfoCLI}.
 */
class OssInfoCLITest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @AfterEach
    void resetLogging() {
        rootLogger().setLevel(Level.INFO);
    }

    @Test
    void version_printsVersion() {
        int exitCode = execute("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("OSS Info 1.0.0-SNAPSHOT");
    }

    @Test
    void help_listsSubcommands() {
        int exitCode = execute("--help");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("collect", "parse", "list");
    }

    @Test
    void verbose_setsDebugLevelBeforeSubcommand() {
        execute("-v", "list");

        assertThat(rootLogger().getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void quiet_setsErrorLevel() {
        execute("-q", "list");

        assertThat(rootLogger().getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void unknownSubcommand_returnsUsageError() {
        int exitCode = execute("frobnicate");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("frobnicate");
    }

    @Test
    void generateCompletion_printsBashScript() {
        int exitCode = execute("generate-completion");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("ossinfo");
    }

    private int execute(String... args) {
        CommandLine commandLine = OssInfoCLI.createCommandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private static ch.qos.logback.classic.Logger rootLogger() {
        return (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    }
}
