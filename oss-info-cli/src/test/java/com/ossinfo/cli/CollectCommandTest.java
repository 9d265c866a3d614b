package com.ossinfo.cli;

import com.ossinfo.OssInfoCLI;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CollectCommand} against a local repository server.
 */
class CollectCommandTest {

    private static final Map<String, String> REPOSITORY = Map.of(
        "/com/example/widget/maven-metadata.xml", """
            <metadata>
              <groupId>com.example</groupId>
              <artifactId>widget</artifactId>
              <versioning>
                <latest>2.1.0-beta</latest>
                <release>2.0.0</release>
              </versioning>
            </metadata>
            """,
        "/com/example/widget/2.0.0/widget-2.0.0.pom", """
            <project>
              <groupId>com.example</groupId>
              <artifactId>widget</artifactId>
              <version>2.0.0</version>
              <packaging>jar</packaging>
              <name>Widget</name>
              <description>Widgets for everyone</description>
              <licenses>
                <license><name>MIT License</name></license>
              </licenses>
            </project>
            """
    );

    @TempDir
    Path tempDir;

    private HttpServer server;
    private Path configFile;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::serve);
        server.start();

        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        configFile = tempDir.resolve("ossinfo.yaml");
        Files.writeString(configFile, """
            repositories:
              central: "%s"
              google: "%s"
            http:
              concurrency: 2
              timeoutSeconds: 5
            """.formatted(baseUrl, baseUrl));
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void collect_allFound_printsCsvAndSucceeds() throws IOException {
        Path report = tempDir.resolve("dependencies.txt");
        Files.writeString(report, """
            releaseRuntimeClasspath - Runtime classpath of compilation 'release'
            \\--- com.example:widget:1.0.0 -> 1.5.0
                 \\--- com.example:gadget:0.1
            """);

        int exitCode = execute("collect", "-i", report.toString(), "-c", configFile.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).hasSize(2);
        assertThat(out.toString().lines().findFirst())
            .hasValueSatisfying(header -> assertThat(header).startsWith("Dependency,").contains("Licenses"));
        assertThat(out.toString())
            .contains("com.example:widget,1.5.0,2.0.0,jar,Widget,")
            .contains("Widgets for everyone")
            .contains("MIT");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void collect_withoutConfigOption_usesConfigNextToReport() throws IOException {
        Path report = tempDir.resolve("flat.txt");
        Files.writeString(report, "com.example:widget:1.0.0\n");

        int exitCode = execute("collect", "--skip-pretty", "-i", report.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("com.example:widget,1.0.0,2.0.0,jar,Widget,");
    }

    @Test
    void collect_someMissing_writesFoundAndFails() throws IOException {
        Path report = tempDir.resolve("flat.txt");
        Files.writeString(report, """
            com.example:widget
            com.example:nowhere:3.0
            """);

        int exitCode = execute("collect", "--skip-pretty", "--format", "csv",
            "-i", report.toString(), "-c", configFile.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).contains("com.example:widget,").contains(",2.0.0,jar,Widget,").doesNotContain("nowhere");
        assertThat(err.toString()).contains("✗ Failed to fetch 1 of 2 dependencies: com.example:nowhere:3.0");
    }

    @Test
    void collect_malformedReport_failsWithoutFetching() throws IOException {
        Path report = tempDir.resolve("broken.txt");
        Files.writeString(report, "\\--- com.example:widget:1.0:extra\n");

        int exitCode = execute("collect", "-i", report.toString(), "-c", configFile.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).contains("✗ Failed to parse dependency report: Unexpected dependency format");
    }

    @Test
    void collect_unknownFormat_isUsageError() throws IOException {
        Path report = tempDir.resolve("dependencies.txt");
        Files.writeString(report, "\\--- com.example:widget:1.0\n");

        int exitCode = execute("collect", "--format", "xlsx", "-i", report.toString());

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    private int execute(String... args) {
        CommandLine commandLine = OssInfoCLI.createCommandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private void serve(HttpExchange exchange) throws IOException {
        String body = REPOSITORY.get(exchange.getRequestURI().getPath());
        if (body == null) {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
            return;
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream response = exchange.getResponseBody()) {
            response.write(bytes);
        }
    }
}
