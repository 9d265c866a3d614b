package com.ossinfo.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Artifact-level {@code maven-metadata.xml} of a Maven repository.
 *
 * @param groupId artifact group
 * @param artifactId artifact name
 * @param version top-level version element, rarely present
 * @param latestVersion {@code versioning/latest}
 * @param releaseVersion {@code versioning/release}
 * @see <a href="https://maven.apache.org/ref/3.9.4/maven-repository-metadata/">Repository metadata</a>
 */
public record MavenMetadata(
    String groupId,
    String artifactId,
    String version,
    String latestVersion,
    String releaseVersion
) {
    /**
     * Compact constructor with validation.
     */
    public MavenMetadata {
        Objects.requireNonNull(groupId, "groupId must not be null");
        Objects.requireNonNull(artifactId, "artifactId must not be null");
    }

    /**
     * Picks the version whose POM describes the artifact: the release version, then the
     * latest version, then the top-level version element.
     *
     * @return preferred version, empty when the metadata lists none
     */
    public Optional<String> preferredVersion() {
        if (releaseVersion != null) {
            return Optional.of(releaseVersion);
        }
        if (latestVersion != null) {
            return Optional.of(latestVersion);
        }
        return Optional.ofNullable(version);
    }
}
