package com.ossinfo.core.repository;

import com.ossinfo.core.model.ArtifactInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of fetching the information of a list of dependencies.
 *
 * @param dependencies every requested dependency, in request order
 * @param artifacts information of the dependencies that were fetched, keyed by dependency
 * @param failures dependencies whose information could not be fetched, in request order
 */
public record CollectionResult(
    List<String> dependencies,
    Map<String, ArtifactInfo> artifacts,
    List<String> failures
) {
    /**
     * Compact constructor with validation.
     */
    public CollectionResult {
        Objects.requireNonNull(dependencies, "dependencies must not be null");
        dependencies = List.copyOf(dependencies);
        artifacts = artifacts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    /**
     * Returns the information fetched for a dependency.
     *
     * @param dependency requested dependency
     * @return information, empty if the fetch failed
     */
    public Optional<ArtifactInfo> artifact(String dependency) {
        return Optional.ofNullable(artifacts.get(dependency));
    }

    /**
     * Returns whether any dependency could not be fetched.
     *
     * @return true if at least one fetch failed
     */
    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
