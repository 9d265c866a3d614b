package com.ossinfo.core.repository;

/**
 * Failure to retrieve or read the metadata of one artifact.
 */
public class ArtifactFetchException extends Exception {

    public ArtifactFetchException(String message) {
        super(message);
    }

    public ArtifactFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
