package com.ossinfo.core.parser;

import java.io.Reader;
import java.io.StringReader;
import java.util.List;

/**
 * Turns a textual dependency listing into a deduplicated, sorted list of coordinates.
 *
 * <p>Parsers are discovered via Java Service Provider Interface (SPI). Each one understands
 * a single input layout, e.g. the full ASCII tree printed by {@code gradle dependencies} or
 * a flattened list with one coordinate per line.
 *
 * <p>Implementations hold no state between calls and may be used concurrently on
 * independent inputs. A parse either returns the complete list or fails; there are no
 * partial results.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.ossinfo.core.parser.DependencyListParser}
 *
 * @see DependencyListParsers
 */
public interface DependencyListParser {

    /**
     * Returns unique identifier for this parser (kebab-case, e.g. "gradle-tree").
     *
     * @return unique parser identifier
     */
    String getId();

    /**
     * Returns human-readable display name used in CLI output.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Parses the listing read from {@code reader}.
     *
     * <p>The reader is consumed line by line but not closed.
     *
     * @param reader listing source
     * @return coordinates sorted lexicographically, without duplicates
     * @throws DependencyReportException if the listing is malformed or cannot be read
     */
    List<String> parse(Reader reader) throws DependencyReportException;

    /**
     * Parses a listing held in memory.
     *
     * @param listing listing text
     * @return coordinates sorted lexicographically, without duplicates
     * @throws DependencyReportException if the listing is malformed
     */
    default List<String> parse(String listing) throws DependencyReportException {
        return parse(new StringReader(listing));
    }
}
