package com.ossinfo.core.renderer;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ossinfo.core.model.ArtifactInfo;
import com.ossinfo.core.model.License;
import com.ossinfo.core.repository.CollectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Writes collected artifact information as CSV, one row per dependency.
 *
 * <p><b>Columns:</b>
 * <ol>
 *   <li>{@code Dependency} - {@code group:artifact}</li>
 *   <li>{@code Version (Input)} - version found in the dependency report, empty if none</li>
 *   <li>{@code Version (Latest)} - version of the POM that was read</li>
 *   <li>{@code Packaging}, {@code Name}, {@code Description} - from the POM</li>
 *   <li>{@code Licenses} - SPDX identifiers joined by {@code /}</li>
 * </ol>
 *
 * <p>Dependencies whose information could not be fetched are left out. The target writer is
 * flushed but not closed.
 */
public class CsvReportWriter {

    private static final Logger log = LoggerFactory.getLogger(CsvReportWriter.class);

    private static final String LICENSE_SEPARATOR = "/";

    private final CsvMapper csvMapper;
    private final CsvSchema schema;

    public CsvReportWriter() {
        this.csvMapper = new CsvMapper();
        this.csvMapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
        this.schema = csvMapper.schemaFor(Row.class).withHeader();
    }

    /**
     * Writes the report.
     *
     * @param result collected artifact information
     * @param target destination, e.g. standard output
     * @throws IOException if writing fails
     */
    public void write(CollectionResult result, Writer target) throws IOException {
        int written = 0;
        try (SequenceWriter rows = csvMapper.writer(schema).writeValues(target)) {
            for (String dependency : result.dependencies()) {
                Optional<ArtifactInfo> artifact = result.artifact(dependency);
                if (artifact.isEmpty()) {
                    log.info("Skipping {}: no artifact information", dependency);
                    continue;
                }
                rows.write(Row.of(dependency, artifact.get()));
                written++;
            }
        }
        target.flush();
        log.debug("Wrote {} CSV rows", written);
    }

    /**
     * One CSV row.
     */
    @JsonPropertyOrder({"Dependency", "Version (Input)", "Version (Latest)", "Packaging", "Name", "Description", "Licenses"})
    record Row(
        @JsonProperty("Dependency") String dependency,
        @JsonProperty("Version (Input)") String inputVersion,
        @JsonProperty("Version (Latest)") String latestVersion,
        @JsonProperty("Packaging") String packaging,
        @JsonProperty("Name") String name,
        @JsonProperty("Description") String description,
        @JsonProperty("Licenses") String licenses
    ) {
        static Row of(String dependency, ArtifactInfo artifact) {
            String[] segments = dependency.split(":", -1);
            String groupAndArtifact = segments.length > 1 ? segments[0] + ":" + segments[1] : dependency;
            String inputVersion = segments.length > 2 ? segments[2] : "";

            return new Row(
                groupAndArtifact,
                inputVersion,
                nullToEmpty(artifact.version()),
                nullToEmpty(artifact.packaging()),
                nullToEmpty(artifact.name()),
                nullToEmpty(artifact.description()),
                artifact.licenses().stream()
                    .map(License::id)
                    .collect(Collectors.joining(LICENSE_SEPARATOR))
            );
        }

        private static String nullToEmpty(String value) {
            return value == null ? "" : value;
        }
    }
}
