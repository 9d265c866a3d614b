package com.ossinfo.core.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Parser for dependency lists that were already extracted from a Gradle report by hand,
 * one dependency per line.
 *
 * <p>Lines carrying a version ({@code group:artifact:version...}) are normalized with
 * {@link CoordinateNormalizer}; lines without one ({@code group:artifact}) are kept as they
 * are. Blank lines are ignored.
 *
 * <p><b>Example input:</b>
 * <pre>{@code
 * androidx.activity:activity-compose:1.3.0 -> 1.4.0 (*)
 * androidx.activity:activity-compose:1.4.0
 * androidx.appcompat:appcompat
 * }</pre>
 * yields {@code [androidx.activity:activity-compose:1.4.0, androidx.appcompat:appcompat]}.
 */
public class FlatListNormalizer implements DependencyListParser {

    private static final Logger log = LoggerFactory.getLogger(FlatListNormalizer.class);

    private static final String PARSER_ID = "flat-list";
    private static final String DISPLAY_NAME = "Flattened Dependency List";
    private static final int VERSIONED_SEGMENT_COUNT = 3;

    @Override
    public String getId() {
        return PARSER_ID;
    }

    @Override
    public String getDisplayName() {
        return DISPLAY_NAME;
    }

    @Override
    public List<String> parse(Reader reader) throws DependencyReportException {
        BufferedReader lines = reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader);
        SortedSet<String> coordinates = new TreeSet<>();

        try {
            String line;
            while ((line = lines.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                coordinates.add(normalizeLine(trimmed));
            }
        } catch (IOException e) {
            throw new DependencyReportException(DependencyReportException.Kind.IO,
                "Failed to read dependency list: " + e.getMessage(), e);
        }

        log.debug("Parsed {} distinct dependencies from flattened list", coordinates.size());
        return List.copyOf(coordinates);
    }

    private String normalizeLine(String line) throws DependencyReportException {
        if (line.split(":", -1).length == VERSIONED_SEGMENT_COUNT) {
            return CoordinateNormalizer.normalizeToString(line);
        }
        return line;
    }
}
