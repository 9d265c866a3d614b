package com.ossinfo.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * License declared by a POM, identified by its SPDX identifier when the license name is known.
 *
 * <p>POM files carry free-form license names. Common spellings of the licenses below are
 * mapped to their SPDX identifiers; every other name is kept verbatim.
 *
 * @param id SPDX identifier, or the raw license name when it is not recognized
 * @see <a href="https://spdx.org/licenses/">SPDX License List</a>
 */
public record License(String id) {

    public static final String APACHE_2_0 = "Apache-2.0";
    public static final String BSD_2_CLAUSE = "BSD-2-Clause";
    public static final String BSD_3_CLAUSE = "BSD-3-Clause";
    public static final String ISC = "ISC";
    public static final String MIT = "MIT";

    private static final Map<String, String> KNOWN_NAMES = Map.ofEntries(
        Map.entry("The Apache Software License, Version 2.0", APACHE_2_0),
        Map.entry("The Apache License, Version 2.0", APACHE_2_0),
        Map.entry("Apache License, Version 2.0", APACHE_2_0),
        Map.entry("Apache 2.0", APACHE_2_0),
        Map.entry("Simplified BSD License", BSD_2_CLAUSE),
        Map.entry("New BSD License", BSD_3_CLAUSE),
        Map.entry("BSD 3-Clause", BSD_3_CLAUSE),
        Map.entry("ISC License", ISC),
        Map.entry("MIT License", MIT),
        Map.entry("The MIT License", MIT)
    );

    /**
     * Compact constructor with validation.
     */
    public License {
        Objects.requireNonNull(id, "id must not be null");
    }

    /**
     * Classifies a license name as written in a POM.
     *
     * @param name license name, e.g. {@code "The Apache Software License, Version 2.0"}
     * @return license with the SPDX identifier, or with {@code name} itself when unknown
     */
    public static License fromName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        String trimmed = name.trim();
        return new License(KNOWN_NAMES.getOrDefault(trimmed, trimmed));
    }

    /**
     * Returns whether the license name was mapped to an SPDX identifier.
     *
     * @return true for a recognized license
     */
    public boolean isKnown() {
        return KNOWN_NAMES.containsValue(id);
    }

    @Override
    public String toString() {
        return id;
    }
}
