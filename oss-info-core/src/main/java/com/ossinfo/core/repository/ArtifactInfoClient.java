package com.ossinfo.core.repository;

import com.ossinfo.core.model.ArtifactInfo;

/**
 * Retrieves descriptive information about a published artifact.
 *
 * <p>Implementations must be safe to call from several threads at once.
 */
@FunctionalInterface
public interface ArtifactInfoClient {

    /**
     * Fetches the information of the newest release of an artifact.
     *
     * @param dependency {@code group:artifact[:version]}; the version does not select the POM
     * @return artifact information
     * @throws ArtifactFetchException if the artifact cannot be fetched or its documents cannot be read
     */
    ArtifactInfo fetch(String dependency) throws ArtifactFetchException;
}
