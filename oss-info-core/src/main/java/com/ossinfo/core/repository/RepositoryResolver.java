package com.ossinfo.core.repository;

import com.ossinfo.core.config.OssInfoConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Chooses the Maven repository that hosts a dependency.
 *
 * <p>Android artifacts ({@code androidx.*}, {@code com.google.android.*} by default) are
 * published to Google's Maven repository only; everything else is looked up on Maven Central.
 */
public class RepositoryResolver {

    private static final Logger log = LoggerFactory.getLogger(RepositoryResolver.class);

    private final String centralUrl;
    private final String googleUrl;
    private final List<String> googleGroupPrefixes;

    public RepositoryResolver(OssInfoConfig.RepositoryConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.centralUrl = stripTrailingSlash(config.central());
        this.googleUrl = stripTrailingSlash(config.google());
        this.googleGroupPrefixes = config.googleGroupPrefixes();
    }

    /**
     * Returns the base URL of the repository that hosts {@code dependency}.
     *
     * @param dependency {@code group:artifact[:version]}
     * @return repository base URL without trailing slash
     */
    public String resolve(String dependency) {
        for (String prefix : googleGroupPrefixes) {
            if (dependency.startsWith(prefix)) {
                log.debug("{} matches group prefix {}, using {}", dependency, prefix, googleUrl);
                return googleUrl;
            }
        }
        log.debug("{} resolved to {}", dependency, centralUrl);
        return centralUrl;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
