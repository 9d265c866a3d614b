package com.ossinfo.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration for OSS Info.
 *
 * <p>Loaded from {@code ossinfo.yaml}. Every section is optional; missing sections and
 * values fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * repositories:
 *   central: "https://repo1.maven.org/maven2"
 *   google: "https://dl.google.com/android/maven2"
 *   googleGroupPrefixes:
 *     - androidx
 *     - com.google.android
 *
 * http:
 *   concurrency: 8
 *   timeoutSeconds: 30
 * }</pre>
 *
 * @param repositories repository locations
 * @param http HTTP client settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OssInfoConfig(
    @JsonProperty("repositories") RepositoryConfig repositories,
    @JsonProperty("http") HttpConfig http
) {
    public static final String MAVEN_CENTRAL_URL = "https://repo1.maven.org/maven2";
    public static final String GOOGLE_MAVEN_URL = "https://dl.google.com/android/maven2";
    public static final List<String> GOOGLE_GROUP_PREFIXES = List.of("androidx", "com.google.android");
    public static final int DEFAULT_CONCURRENCY = 8;
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;

    /**
     * Compact constructor filling absent sections with defaults.
     */
    public OssInfoConfig {
        if (repositories == null) {
            repositories = RepositoryConfig.defaults();
        }
        if (http == null) {
            http = HttpConfig.defaults();
        }
    }

    /**
     * Creates the default configuration: Maven Central, Google's Maven repository for
     * Android groups, eight concurrent requests.
     *
     * @return default configuration
     */
    public static OssInfoConfig defaults() {
        return new OssInfoConfig(RepositoryConfig.defaults(), HttpConfig.defaults());
    }

    /**
     * Repository locations.
     *
     * @param central base URL of Maven Central (or a mirror)
     * @param google base URL of Google's Maven repository (or a mirror)
     * @param googleGroupPrefixes group prefixes that are served from {@code google}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RepositoryConfig(
        @JsonProperty("central") String central,
        @JsonProperty("google") String google,
        @JsonProperty("googleGroupPrefixes") List<String> googleGroupPrefixes
    ) {
        public RepositoryConfig {
            if (central == null || central.isBlank()) {
                central = MAVEN_CENTRAL_URL;
            }
            if (google == null || google.isBlank()) {
                google = GOOGLE_MAVEN_URL;
            }
            googleGroupPrefixes = googleGroupPrefixes == null ? GOOGLE_GROUP_PREFIXES : List.copyOf(googleGroupPrefixes);
        }

        public static RepositoryConfig defaults() {
            return new RepositoryConfig(MAVEN_CENTRAL_URL, GOOGLE_MAVEN_URL, GOOGLE_GROUP_PREFIXES);
        }
    }

    /**
     * HTTP client settings.
     *
     * @param concurrency maximum number of artifacts fetched at the same time
     * @param timeoutSeconds connect and read timeout per request
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HttpConfig(
        @JsonProperty("concurrency") Integer concurrency,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds
    ) {
        public HttpConfig {
            if (concurrency == null || concurrency < 1) {
                concurrency = DEFAULT_CONCURRENCY;
            }
            if (timeoutSeconds == null || timeoutSeconds < 1) {
                timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
            }
        }

        public static HttpConfig defaults() {
            return new HttpConfig(DEFAULT_CONCURRENCY, DEFAULT_TIMEOUT_SECONDS);
        }
    }
}
