package com.ossinfo.core.model;

import java.util.Objects;

/**
 * Canonical {@code group:artifact:version} coordinate of a published dependency.
 *
 * <p>The version is always the final, resolved version of the dependency, never the
 * version that was requested before conflict resolution.
 *
 * @param groupId dependency group
 * @param artifactId dependency artifact
 * @param version resolved version
 */
public record Coordinate(
    String groupId,
    String artifactId,
    String version
) {
    /**
     * Compact constructor with validation.
     */
    public Coordinate {
        Objects.requireNonNull(groupId, "groupId must not be null");
        Objects.requireNonNull(artifactId, "artifactId must not be null");
        Objects.requireNonNull(version, "version must not be null");
    }

    /**
     * Returns the canonical string form, {@code group:artifact:version}.
     *
     * @return canonical coordinate
     */
    @Override
    public String toString() {
        return groupId + ":" + artifactId + ":" + version;
    }
}
