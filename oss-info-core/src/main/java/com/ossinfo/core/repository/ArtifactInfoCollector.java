package com.ossinfo.core.repository;

import com.ossinfo.core.model.ArtifactInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Fetches artifact information for many dependencies on a bounded worker pool.
 *
 * <p>A failing dependency does not stop the others: it is logged and reported in
 * {@link CollectionResult#failures()}. The pool lives for one {@link #collect(List)} call.
 */
public class ArtifactInfoCollector {

    private static final Logger log = LoggerFactory.getLogger(ArtifactInfoCollector.class);

    private final ArtifactInfoClient client;
    private final int concurrency;

    public ArtifactInfoCollector(ArtifactInfoClient client, int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be positive: " + concurrency);
        }
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.concurrency = concurrency;
    }

    /**
     * Fetches the information of every dependency.
     *
     * @param dependencies dependencies as {@code group:artifact[:version]}
     * @return fetched information and failures, in the order of {@code dependencies}
     * @throws ArtifactFetchException if the calling thread is interrupted while waiting
     */
    public CollectionResult collect(List<String> dependencies) throws ArtifactFetchException {
        log.info("Fetching artifact information for {} dependencies ({} concurrent requests)",
            dependencies.size(), concurrency);

        ExecutorService executor = Executors.newFixedThreadPool(concurrency);
        try {
            Map<String, Future<ArtifactInfo>> pending = new LinkedHashMap<>();
            for (String dependency : dependencies) {
                pending.put(dependency, executor.submit(() -> client.fetch(dependency)));
            }

            Map<String, ArtifactInfo> artifacts = new LinkedHashMap<>();
            List<String> failures = new ArrayList<>();
            for (Map.Entry<String, Future<ArtifactInfo>> entry : pending.entrySet()) {
                String dependency = entry.getKey();
                try {
                    artifacts.put(dependency, entry.getValue().get());
                    log.debug("Fetched {}", dependency);
                } catch (ExecutionException e) {
                    log.warn("Failed to request artifact info of {}: {}", dependency, e.getCause().getMessage());
                    failures.add(dependency);
                }
            }

            log.info("Fetched {} of {} dependencies", artifacts.size(), dependencies.size());
            return new CollectionResult(dependencies, artifacts, failures);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ArtifactFetchException("Interrupted while fetching artifact information", e);
        } finally {
            executor.shutdownNow();
        }
    }
}
