package com.ossinfo.core.repository;

import com.ossinfo.core.config.OssInfoConfig;
import com.ossinfo.core.model.ArtifactInfo;
import com.ossinfo.core.model.MavenMetadata;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link ArtifactInfoClient} that reads a Maven repository over HTTP.
 *
 * <p><b>Retrieval Strategy:</b>
 * <ol>
 *   <li>GET {@code <repository>/<group path>/<artifact>/maven-metadata.xml}</li>
 *   <li>Pick the release version, else the latest version, else the metadata version</li>
 *   <li>GET {@code <repository>/<group path>/<artifact>/<version>/<artifact>-<version>.pom}</li>
 * </ol>
 *
 * @see <a href="https://maven.apache.org/repository/layout.html">Maven Repository Layout</a>
 */
public class HttpArtifactInfoClient implements ArtifactInfoClient {

    private static final Logger log = LoggerFactory.getLogger(HttpArtifactInfoClient.class);

    private static final String ACCEPT_XML = "application/xml,text/xml";
    private static final String METADATA_FILE = "maven-metadata.xml";

    private final OkHttpClient client;
    private final RepositoryResolver repositoryResolver;
    private final MavenMetadataReader metadataReader = new MavenMetadataReader();
    private final PomReader pomReader = new PomReader();

    public HttpArtifactInfoClient(OkHttpClient client, RepositoryResolver repositoryResolver) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.repositoryResolver = Objects.requireNonNull(repositoryResolver, "repositoryResolver must not be null");
    }

    /**
     * Creates a client from configuration.
     *
     * @param config tool configuration
     * @return client using the configured repositories and timeouts
     */
    public static HttpArtifactInfoClient create(OssInfoConfig config) {
        Duration timeout = Duration.ofSeconds(config.http().timeoutSeconds());
        OkHttpClient client = new OkHttpClient.Builder()
            .connectTimeout(timeout)
            .readTimeout(timeout)
            .build();
        return new HttpArtifactInfoClient(client, new RepositoryResolver(config.repositories()));
    }

    @Override
    public ArtifactInfo fetch(String dependency) throws ArtifactFetchException {
        return fetch(dependency, repositoryResolver.resolve(dependency));
    }

    /**
     * Fetches artifact information from an explicit repository.
     *
     * @param dependency {@code group:artifact[:version]}
     * @param repositoryUrl repository base URL
     * @return artifact information
     * @throws ArtifactFetchException if a document cannot be fetched or read
     */
    ArtifactInfo fetch(String dependency, String repositoryUrl) throws ArtifactFetchException {
        String artifactRoot;
        try {
            artifactRoot = repositoryUrl + "/" + ArtifactPath.of(dependency);
        } catch (IllegalArgumentException e) {
            throw new ArtifactFetchException(e.getMessage(), e);
        }

        String metadataUrl = artifactRoot + "/" + METADATA_FILE;
        MavenMetadata metadata = metadataReader.read(get(metadataUrl));
        log.debug("Read {}: {}", METADATA_FILE, metadata);

        if (metadata.releaseVersion() == null && metadata.latestVersion() == null && metadata.version() != null) {
            log.info("Using <version> of {} for {}", METADATA_FILE, dependency);
        }
        String version = metadata.preferredVersion()
            .orElseThrow(() -> new ArtifactFetchException("Missing release, latest and version: " + metadataUrl));

        String pomUrl = artifactRoot + "/" + version + "/" + metadata.artifactId() + "-" + version + ".pom";
        return pomReader.read(get(pomUrl));
    }

    private String get(String url) throws ArtifactFetchException {
        Request request = new Request.Builder()
            .url(url)
            .header("Accept", ACCEPT_XML)
            .get()
            .build();

        log.debug("GET {}", url);
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new ArtifactFetchException("Server returned " + response.code() + " for " + url);
            }
            ResponseBody body = response.body();
            String content = body != null ? body.string() : "";
            log.trace("{}: {}", url, content);
            return content;
        } catch (IOException e) {
            throw new ArtifactFetchException("Failed to request " + url + ": " + e.getMessage(), e);
        }
    }
}
