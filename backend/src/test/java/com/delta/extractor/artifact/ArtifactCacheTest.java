package com.delta.extractor.artifact;

import com.delta.extractor.config.ExtractorConfig;
import com.delta.extractor.config.ExtractorProperties;
import com.delta.extractor.error.ExtractionFailureException;
import com.delta.extractor.http.ResilientHttpClient;
import com.delta.extractor.model.ArtifactRecord;
import com.delta.extractor.model.ExtractedFields;
import com.delta.extractor.resilience.CircuitBreakerRegistry;
import com.delta.extractor.resilience.RetryExecutor;
import com.delta.extractor.state.StateStore;
import com.delta.extractor.support.MutableClock;
import com.delta.extractor.util.HashUtils;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArtifactCacheTest {
    private static final String PLAYER_V1 = "/s/player/v1/player_ias.vflset/en_US/base.js";
    private static final String PLAYER_V2 = "/s/player/v2/player_ias.vflset/en_US/base.js";

    @TempDir
    Path tempDir;

    private MockWebServer server;
    private ExecutorService httpExecutor;
    private ExecutorService extractionExecutor;
    private MutableClock clock;
    private ExtractorProperties properties;
    private StateStore stateStore;

    private final Map<String, MockResponse> routes = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> hits = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String path = request.getPath();
                hits.computeIfAbsent(path, ignored -> new AtomicInteger()).incrementAndGet();
                MockResponse response = routes.get(path);
                return response == null ? new MockResponse().setResponseCode(404) : response;
            }
        });
        server.start();

        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        properties = new ExtractorProperties();
        properties.getHttp().setPerHostDelayMs(0);
        properties.getHttp().setRequestTimeoutSeconds(5);
        properties.getArtifact().setDocumentUrl(server.url("/watch").toString());
        properties.getArtifact().setBaseUrl(server.url("/").toString());
        properties.getArtifact().setTtlSeconds(3600);
        properties.getArtifact().setCacheSize(2);
        httpExecutor = Executors.newFixedThreadPool(2);
        extractionExecutor = Executors.newFixedThreadPool(1);
        stateStore = new StateStore(
            tempDir.resolve("state"),
            Duration.ofSeconds(3600),
            ".part",
            ExtractorConfig.defaultObjectMapper(),
            clock
        );

        routes.put("/watch", document(PLAYER_V1));
        routes.put(PLAYER_V1, script("19461"));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        httpExecutor.shutdownNow();
        extractionExecutor.shutdownNow();
    }

    @Test
    void synchronizesOnceWithinTtl() {
        ArtifactCache cache = newCache();

        ArtifactRecord first = cache.getCurrent();
        clock.advance(Duration.ofMinutes(30));
        ArtifactRecord second = cache.getCurrent();

        assertThat(second.versionId()).isEqualTo(first.versionId());
        assertThat(first.fields().signatureTimestamp()).isEqualTo("19461");
        assertThat(hitsFor("/watch")).isEqualTo(1);
        assertThat(hitsFor(PLAYER_V1)).isEqualTo(1);
    }

    @Test
    void concurrentCallersShareOneSynchronization() throws Exception {
        routes.put("/watch", document(PLAYER_V1).setBodyDelay(300, TimeUnit.MILLISECONDS));
        ArtifactCache cache = newCache();
        int callers = 6;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<ArtifactRecord>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return cache.getCurrent();
                }));
            }
            start.countDown();

            for (Future<ArtifactRecord> result : results) {
                ArtifactRecord artifact = result.get(10, TimeUnit.SECONDS);
                assertThat(artifact.versionId()).isEqualTo(HashUtils.sha256Hex(scriptBody("19461")));
                assertThat(artifact.fields().signatureTimestamp()).isEqualTo("19461");
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(hitsFor("/watch")).isEqualTo(1);
        assertThat(hitsFor(PLAYER_V1)).isEqualTo(1);
    }

    @Test
    void versionIdIsTheContentHashAndIsPersisted() {
        ArtifactCache cache = newCache();

        ArtifactRecord artifact = cache.getCurrent();

        assertThat(artifact.versionId()).isEqualTo(HashUtils.sha256Hex(scriptBody("19461")));
        assertThat(artifact.urlVersionId()).isEqualTo(HashUtils.sha256Hex(server.url(PLAYER_V1).toString()));
        assertThat(stateStore.getArtifact(artifact.versionId())).isPresent();
    }

    @Test
    void forcedRefreshWithUnchangedReferenceSkipsScriptFetch() {
        ArtifactCache cache = newCache();
        cache.getCurrent();

        cache.getCurrent(true);

        assertThat(hitsFor("/watch")).isEqualTo(2);
        assertThat(hitsFor(PLAYER_V1)).isEqualTo(1);
    }

    @Test
    void persistedArtifactIsReusedByAFreshInstance() {
        newCache().getCurrent();

        ArtifactRecord reloaded = newCache().getCurrent();

        assertThat(reloaded.fields().signatureTimestamp()).isEqualTo("19461");
        assertThat(hitsFor("/watch")).isEqualTo(2);
        assertThat(hitsFor(PLAYER_V1)).isEqualTo(1);
    }

    @Test
    void newUrlWithSameContentResolvesToExistingVersion() {
        ArtifactCache cache = newCache();
        ArtifactRecord original = cache.getCurrent();
        routes.put("/watch", document(PLAYER_V2));
        routes.put(PLAYER_V2, script("19461"));

        ArtifactRecord refreshed = cache.getCurrent(true);

        assertThat(refreshed.versionId()).isEqualTo(original.versionId());
        assertThat(hitsFor(PLAYER_V2)).isEqualTo(1);
        assertThat(cache.cachedVersionIds()).containsExactly(original.versionId());
    }

    @Test
    void missingReferenceWithoutPriorArtifactIsAHardError() {
        routes.put("/watch", new MockResponse().setResponseCode(200).setBody("<html><body>no player</body></html>"));
        ArtifactCache cache = newCache();

        assertThatThrownBy(cache::getCurrent)
            .isInstanceOf(ExtractionFailureException.class)
            .hasMessageContaining("script reference");
    }

    @Test
    void missingSignatureTimestampIsNotReplacedByDefault() {
        routes.put(PLAYER_V1, new MockResponse().setResponseCode(200).setBody("var nothing=1;"));
        ArtifactCache cache = newCache();

        assertThatThrownBy(cache::getCurrent)
            .isInstanceOf(ExtractionFailureException.class)
            .satisfies(error -> assertThat(((ExtractionFailureException) error).field()).isEqualTo("signatureTimestamp"));
        assertThat(cache.cachedVersionIds()).isEmpty();
    }

    @Test
    void failedRefreshFallsBackToPreviousArtifact() {
        ArtifactCache cache = newCache();
        ArtifactRecord original = cache.getCurrent();
        routes.put("/watch", new MockResponse().setResponseCode(503));

        ArtifactRecord fallback = cache.getCurrent(true);

        assertThat(fallback.versionId()).isEqualTo(original.versionId());
        assertThat(fallback.failureCount()).isEqualTo(1);
        assertThat(hitsFor("/watch")).isEqualTo(3);
        assertThat(stateStore.getArtifact(original.versionId()).orElseThrow().failureCount()).isEqualTo(1);
    }

    @Test
    void overCapacityInsertEvictsLeastRecentlyCreated() {
        ArtifactCache cache = newCache();
        Instant base = clock.instant();

        cache.remember(artifact("newest", base.plus(Duration.ofMinutes(2))));
        cache.remember(artifact("oldest", base));
        cache.remember(artifact("middle", base.plus(Duration.ofMinutes(1))));

        assertThat(cache.cachedVersionIds()).containsExactlyInAnyOrder("newest", "middle");
    }

    @Test
    void snapshotDescribesCurrentArtifact() {
        ArtifactCache cache = newCache();
        assertThat(cache.snapshot().currentVersionId()).isNull();

        ArtifactRecord artifact = cache.getCurrent();

        assertThat(cache.snapshot().currentVersionId()).isEqualTo(artifact.versionId());
        assertThat(cache.snapshot().signatureTimestamp()).isEqualTo("19461");
        assertThat(cache.snapshot().refreshedAt()).isEqualTo(clock.instant());
    }

    private ArtifactCache newCache() {
        return new ArtifactCache(
            new ResilientHttpClient(properties, httpExecutor),
            stateStore,
            new RetryExecutor(1, 2.0, 0.0, duration -> { }),
            new CircuitBreakerRegistry(properties.getBreaker(), clock),
            new ArtifactFieldExtractor(properties),
            new ExtractionDriftMonitor(properties),
            extractionExecutor,
            properties,
            clock
        );
    }

    private int hitsFor(String path) {
        AtomicInteger count = hits.get(path);
        return count == null ? 0 : count.get();
    }

    private static MockResponse document(String playerPath) {
        return new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "text/html")
            .setBody("<html><script>ytcfg.set({\"jsUrl\":\"" + playerPath + "\"});</script></html>");
    }

    private static MockResponse script(String sts) {
        return new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/javascript")
            .setBody(scriptBody(sts));
    }

    private static String scriptBody(String sts) {
        return "var a={sts:" + sts + "};var Xy=function(a){return a.split(\"\").reverse().join(\"\")};u.signature=Xy(s);";
    }

    private static ArtifactRecord artifact(String versionId, Instant createdAt) {
        return new ArtifactRecord(
            versionId,
            "url-" + versionId,
            "https://example.test/" + versionId + ".js",
            new ExtractedFields("1", Optional.empty(), Optional.empty()),
            "2.0",
            createdAt,
            createdAt,
            0
        );
    }
}
