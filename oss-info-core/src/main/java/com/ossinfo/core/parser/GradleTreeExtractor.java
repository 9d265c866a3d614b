package com.ossinfo.core.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.List;
import java.util.OptionalInt;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the dependency tree printed by {@code gradle <project>:dependencies --configuration <name>}.
 *
 * <p>Only the dependencies a configuration declares directly are extracted. Transitive
 * dependencies are skipped, except that {@code project :name} nodes are transparent: the
 * direct dependencies of a referenced project count as direct dependencies of the
 * configuration, recursively through chains of project references.
 *
 * <p><b>Parsing Strategy:</b>
 * <ol>
 *   <li>Skip build output until the first root-level tree line ({@code +--- } or {@code \--- })</li>
 *   <li>Compute each line's depth from the column of its tree art, five columns per level</li>
 *   <li>On a {@code project :name} line, open its children as the current level</li>
 *   <li>Skip lines deeper than the current level, accept and normalize the others</li>
 *   <li>Treat the first line without tree art as the end of the tree</li>
 * </ol>
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * +--- g:a:1.0
 * |    \--- g2:b:2.0
 * \--- project :lib
 *      \--- g3:c:3.0
 * }</pre>
 * yields {@code [g:a:1.0, g3:c:3.0]}.
 *
 * <p>The report must contain the tree of exactly one configuration. Without a
 * {@code --configuration} filter Gradle prints one tree per configuration, which is rejected.
 *
 * @see <a href="https://docs.gradle.org/current/userguide/viewing_debugging_dependencies.html">Viewing and debugging dependencies</a>
 */
public class GradleTreeExtractor implements DependencyListParser {

    private static final Logger log = LoggerFactory.getLogger(GradleTreeExtractor.class);

    private static final String PARSER_ID = "gradle-tree";
    private static final String DISPLAY_NAME = "Gradle Dependency Tree";

    /** Columns per nesting level: one for {@code |} or space, four for the connector. */
    static final int INDENT_WIDTH = 5;

    private static final Pattern TREE_ART = Pattern.compile("[+\\\\]--- ");
    private static final String PROJECT_PREFIX = "project ";

    static final String MISSING_CONFIGURATION_MESSAGE =
        "Please specify a configuration filter, e.g. `--configuration releaseRuntimeClasspath`";

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
        ExtractionState state = new ExtractionState();

        try {
            String line;
            while ((line = lines.readLine()) != null) {
                state.accept(line);
            }
        } catch (IOException e) {
            throw new DependencyReportException(DependencyReportException.Kind.IO,
                "Failed to read dependency report: " + e.getMessage(), e);
        }

        log.debug("Extracted {} direct dependencies from dependency tree", state.coordinates.size());
        return List.copyOf(state.coordinates);
    }

    /**
     * Computes the nesting depth of a report line.
     *
     * @param line report line
     * @return depth, or empty when the line carries no tree art
     * @throws DependencyReportException if the tree art is not aligned to a level
     */
    static OptionalInt depthOf(String line) throws DependencyReportException {
        Matcher matcher = TREE_ART.matcher(line);
        if (!matcher.find()) {
            return OptionalInt.empty();
        }
        int column = matcher.start();
        if (column % INDENT_WIDTH != 0) {
            throw DependencyReportException.indentation("Unexpected indent of " + column + " columns: " + line);
        }
        return OptionalInt.of(column / INDENT_WIDTH);
    }

    /**
     * Returns the dependency token that follows the tree art of a line.
     */
    static String tokenOf(String line) {
        Matcher matcher = TREE_ART.matcher(line);
        if (!matcher.find()) {
            throw new IllegalArgumentException("Line has no tree art: " + line);
        }
        return line.substring(matcher.end()).trim();
    }

    /**
     * Line-by-line state of one extraction.
     */
    private static final class ExtractionState {

        private final SortedSet<String> coordinates = new TreeSet<>();
        private boolean foundStart;
        private boolean ended;
        private int currentLevel;

        void accept(String line) throws DependencyReportException {
            OptionalInt depth = depthOf(line);
            log.trace("depth={} line={}", depth, line);

            if (!foundStart || ended) {
                if (depth.isEmpty()) {
                    return;
                }
                if (depth.getAsInt() != 0) {
                    throw DependencyReportException.indentation("Unexpected indent before the root of the tree: " + line);
                }
                if (ended) {
                    throw new DependencyReportException(DependencyReportException.Kind.MISSING_CONFIGURATION,
                        MISSING_CONFIGURATION_MESSAGE);
                }
                foundStart = true;
            }

            if (depth.isEmpty()) {
                ended = true;
                return;
            }
            int level = depth.getAsInt();
            String token = tokenOf(line);

            // \--- project :lib
            //      \--- xxx:yyy:zzz
            if (token.startsWith(PROJECT_PREFIX)) {
                currentLevel = level + 1;
                return;
            }

            // \--- xxx:yyy:zzz
            //      \--- transitive:yyy:zzz
            if (currentLevel < level) {
                return;
            }

            // also leaves a project:
            // +--- project :lib
            // |    \--- xxx:yyy:zzz
            // \--- xxx:yyy:zzz
            currentLevel = level;
            coordinates.add(CoordinateNormalizer.normalizeToString(token));
        }
    }
}
