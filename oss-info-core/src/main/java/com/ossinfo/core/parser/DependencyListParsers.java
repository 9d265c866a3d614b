package com.ossinfo.core.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Lookup of the {@link DependencyListParser} implementations registered via SPI.
 */
public final class DependencyListParsers {

    private DependencyListParsers() {
    }

    /**
     * Discovers all registered parsers.
     *
     * @return parsers in registration order
     */
    public static List<DependencyListParser> discover() {
        List<DependencyListParser> parsers = new ArrayList<>();
        ServiceLoader.load(DependencyListParser.class).forEach(parsers::add);
        return parsers;
    }

    /**
     * Finds a registered parser by its identifier.
     *
     * @param id parser identifier, e.g. "gradle-tree"
     * @return the parser
     * @throws IllegalArgumentException if no parser has that identifier
     */
    public static DependencyListParser byId(String id) {
        return discover().stream()
            .filter(parser -> parser.getId().equals(id))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown dependency list parser: " + id));
    }
}
