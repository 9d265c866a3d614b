package com.ossinfo.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Descriptive information about an artifact, read from its POM.
 *
 * @param groupId POM group, may be null when inherited from a parent POM
 * @param artifactId POM artifact
 * @param version POM version, may be null when inherited from a parent POM
 * @param packaging packaging type (jar, aar, pom, ...)
 * @param name human readable name
 * @param description project description
 * @param licenses declared licenses, empty when the POM declares none
 */
public record ArtifactInfo(
    String groupId,
    String artifactId,
    String version,
    String packaging,
    String name,
    String description,
    List<License> licenses
) {
    /**
     * Compact constructor with validation.
     */
    public ArtifactInfo {
        Objects.requireNonNull(artifactId, "artifactId must not be null");
        licenses = licenses == null ? List.of() : List.copyOf(licenses);
    }
}
