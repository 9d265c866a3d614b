package com.ossinfo.core.repository;

import com.ossinfo.core.model.ArtifactInfo;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ArtifactInfoCollector}.
 */
class ArtifactInfoCollectorTest {

    private static ArtifactInfo info(String dependency) {
        String[] segments = dependency.split(":");
        return new ArtifactInfo(segments[0], segments[1], "9.9", "jar", segments[1], null, List.of());
    }

    @Test
    void collect_allSucceed_keepsRequestOrder() throws ArtifactFetchException {
        ArtifactInfoCollector collector = new ArtifactInfoCollector(ArtifactInfoCollectorTest::info, 4);
        List<String> dependencies = List.of("z:last:1", "a:first:2", "m:middle");

        CollectionResult result = collector.collect(dependencies);

        assertThat(result.dependencies()).containsExactlyElementsOf(dependencies);
        assertThat(result.artifacts().keySet()).containsExactlyElementsOf(dependencies);
        assertThat(result.artifact("a:first:2")).map(ArtifactInfo::artifactId).contains("first");
        assertThat(result.hasFailures()).isFalse();
    }

    @Test
    void collect_someFail_reportsFailuresAndKeepsOthers() throws ArtifactFetchException {
        ArtifactInfoClient client = dependency -> {
            if (dependency.startsWith("bad")) {
                throw new ArtifactFetchException("Server returned 404 for " + dependency);
            }
            return info(dependency);
        };
        ArtifactInfoCollector collector = new ArtifactInfoCollector(client, 2);

        CollectionResult result = collector.collect(List.of("bad:one", "good:two", "bad:three"));

        assertThat(result.failures()).containsExactly("bad:one", "bad:three");
        assertThat(result.artifacts()).containsOnlyKeys("good:two");
        assertThat(result.artifact("bad:one")).isEmpty();
        assertThat(result.hasFailures()).isTrue();
    }

    @Test
    void collect_runtimeFailure_isReportedAsFailure() throws ArtifactFetchException {
        ArtifactInfoCollector collector = new ArtifactInfoCollector(dependency -> {
            throw new IllegalStateException("boom");
        }, 1);

        CollectionResult result = collector.collect(List.of("g:a"));

        assertThat(result.failures()).containsExactly("g:a");
    }

    @Test
    void collect_neverExceedsConcurrency() throws ArtifactFetchException {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        ArtifactInfoClient client = dependency -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                TimeUnit.MILLISECONDS.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            running.decrementAndGet();
            return info(dependency);
        };

        List<String> dependencies = IntStream.range(0, 12)
            .mapToObj(i -> "g:a" + i)
            .toList();
        CollectionResult result = new ArtifactInfoCollector(client, 3).collect(dependencies);

        assertThat(result.artifacts()).hasSize(12);
        assertThat(peak.get()).isBetween(1, 3);
    }

    @Test
    void collect_requestsRunConcurrently() throws ArtifactFetchException {
        CountDownLatch bothStarted = new CountDownLatch(2);
        ArtifactInfoClient client = dependency -> {
            bothStarted.countDown();
            try {
                if (!bothStarted.await(5, TimeUnit.SECONDS)) {
                    throw new ArtifactFetchException("requests were serialized");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ArtifactFetchException("interrupted", e);
            }
            return info(dependency);
        };

        CollectionResult result = new ArtifactInfoCollector(client, 2).collect(List.of("g:a", "g:b"));

        assertThat(result.hasFailures()).isFalse();
    }

    @Test
    void collect_emptyList_returnsEmptyResult() throws ArtifactFetchException {
        CollectionResult result = new ArtifactInfoCollector(ArtifactInfoCollectorTest::info, 8).collect(List.of());

        assertThat(result.dependencies()).isEmpty();
        assertThat(result.artifacts()).isEmpty();
        assertThat(result.failures()).isEmpty();
    }

    @Test
    void constructor_nonPositiveConcurrency_throws() {
        assertThatThrownBy(() -> new ArtifactInfoCollector(ArtifactInfoCollectorTest::info, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("concurrency must be positive: 0");
    }
}
