package com.ossinfo.core.repository;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Access to the Maven repository snapshot under {@code src/test/resources/repository}.
 */
final class RepositoryResources {

    static final String ROOT = "/repository/";

    private RepositoryResources() {
    }

    static String read(String path) {
        byte[] bytes = readBytes(path);
        if (bytes == null) {
            throw new IllegalArgumentException("No test resource " + ROOT + path);
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Returns the resource content, or null if there is no such resource.
     */
    static byte[] readBytes(String path) {
        try (InputStream in = RepositoryResources.class.getResourceAsStream(ROOT + path)) {
            return in == null ? null : in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
