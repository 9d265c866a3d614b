package com.ossinfo.core.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a dependency to its directory in the Maven repository layout.
 *
 * <p>{@code androidx.core:core-ktx:1.1.0} maps to {@code androidx/core/core-ktx}. The version
 * is ignored: metadata is always read for the artifact as a whole.
 *
 * @see <a href="https://maven.apache.org/repository/layout.html">Maven Repository Layout</a>
 */
public final class ArtifactPath {

    private static final Logger log = LoggerFactory.getLogger(ArtifactPath.class);

    private ArtifactPath() {
    }

    /**
     * Returns the repository-relative directory of an artifact.
     *
     * @param dependency {@code group:artifact} or {@code group:artifact:version}
     * @return path such as {@code javax/inject/javax.inject}
     * @throws IllegalArgumentException if the group or artifact is missing
     */
    public static String of(String dependency) {
        String[] segments = dependency.split(":", -1);

        String groupId = segments[0].trim();
        if (groupId.isEmpty()) {
            throw new IllegalArgumentException("Missing group id: " + dependency);
        }
        if (segments.length < 2 || segments[1].trim().isEmpty()) {
            throw new IllegalArgumentException("Missing artifact id: " + dependency);
        }
        String artifactId = segments[1].trim();

        if (segments.length > 2) {
            log.info("Ignoring version of {}", dependency);
        }

        return groupId.replace('.', '/') + "/" + artifactId;
    }
}
