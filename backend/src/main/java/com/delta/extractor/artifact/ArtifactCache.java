package com.delta.extractor.artifact;

import com.delta.extractor.config.ExtractorProperties;
import com.delta.extractor.error.ExtractionFailureException;
import com.delta.extractor.error.StateStoreException;
import com.delta.extractor.http.ResilientHttpClient;
import com.delta.extractor.model.ArtifactCacheSnapshot;
import com.delta.extractor.model.ArtifactRecord;
import com.delta.extractor.model.ExtractedFields;
import com.delta.extractor.model.HttpFetchResult;
import com.delta.extractor.resilience.CircuitBreakerRegistry;
import com.delta.extractor.resilience.RetryExecutor;
import com.delta.extractor.state.StateStore;
import com.delta.extractor.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Two-tier cache of the current versioned script artifact. Memory is checked first, then the
 * {@link StateStore}; the network is touched only when both miss.
 *
 * <p>Only one synchronization runs at a time. Readers never block on it: the current artifact
 * is swapped through a single reference, so they see either the previous or the new record.
 */
@Service
public class ArtifactCache {
    private static final Logger log = LoggerFactory.getLogger(ArtifactCache.class);
    private static final String DOCUMENT_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    private static final String SCRIPT_ACCEPT = "application/javascript,text/javascript,*/*;q=0.8";

    private final ResilientHttpClient httpClient;
    private final StateStore stateStore;
    private final RetryExecutor retryExecutor;
    private final CircuitBreakerRegistry breakers;
    private final ArtifactFieldExtractor extractor;
    private final ExtractionDriftMonitor driftMonitor;
    private final ExecutorService extractionExecutor;
    private final ExtractorProperties.Artifact properties;
    private final Clock clock;
    private final Duration ttl;

    private final ReentrantLock syncLock = new ReentrantLock();
    private final ReentrantLock entriesLock = new ReentrantLock();
    private final Map<String, CacheEntry> entries = new LinkedHashMap<>();
    private final Map<String, String> urlAliases = new HashMap<>();
    private final AtomicReference<Current> current = new AtomicReference<>();

    private record Current(ArtifactRecord artifact, Instant refreshedAt) {
    }

    public ArtifactCache(
        ResilientHttpClient httpClient,
        StateStore stateStore,
        RetryExecutor retryExecutor,
        CircuitBreakerRegistry breakers,
        ArtifactFieldExtractor extractor,
        ExtractionDriftMonitor driftMonitor,
        @Qualifier("extractionExecutor") ExecutorService extractionExecutor,
        ExtractorProperties properties,
        Clock clock
    ) {
        this.httpClient = httpClient;
        this.stateStore = stateStore;
        this.retryExecutor = retryExecutor;
        this.breakers = breakers;
        this.extractor = extractor;
        this.driftMonitor = driftMonitor;
        this.extractionExecutor = extractionExecutor;
        this.properties = properties.getArtifact();
        this.clock = clock;
        this.ttl = Duration.ofSeconds(this.properties.getTtlSeconds());
    }

    public ArtifactRecord getCurrent() {
        return getCurrent(false);
    }

    public ArtifactRecord getCurrent(boolean forceRefresh) {
        Current snapshot = current.get();
        if (!forceRefresh && isFresh(snapshot)) {
            return snapshot.artifact();
        }
        return synchronize(forceRefresh);
    }

    public ArtifactRecord synchronize() {
        return synchronize(true);
    }

    private ArtifactRecord synchronize(boolean forced) {
        syncLock.lock();
        try {
            Current before = current.get();
            if (!forced && isFresh(before)) {
                // refreshed by another caller while we waited for the lock
                return before.artifact();
            }
            try {
                ArtifactRecord artifact = resolveArtifact();
                current.set(new Current(artifact, clock.instant()));
                return artifact;
            } catch (RuntimeException e) {
                if (before == null) {
                    log.error("Artifact sync failed and no previous artifact is available", e);
                    throw e;
                }
                ArtifactRecord degraded = before.artifact().withFailure();
                log.warn(
                    "Artifact sync failed, falling back to {} (failures={}): {}",
                    shortId(degraded.versionId()),
                    degraded.failureCount(),
                    e.getMessage()
                );
                persistQuietly(degraded);
                remember(degraded);
                current.set(new Current(degraded, before.refreshedAt()));
                return degraded;
            }
        } finally {
            syncLock.unlock();
        }
    }

    private ArtifactRecord resolveArtifact() {
        String documentUrl = properties.getDocumentUrl();
        log.info("Syncing artifact from {}", documentUrl);
        HttpFetchResult document = retryExecutor.execute(
            "fetch_source_document",
            breakers.breaker(CircuitBreakerRegistry.ARTIFACT_DOCUMENT),
            () -> httpClient.fetchOrThrow(documentUrl, DOCUMENT_ACCEPT)
        );

        Optional<String> reference = extractor.extractReferenceUrl(document.body());
        if (reference.isEmpty()) {
            driftMonitor.recordAttempt(false);
            throw new ExtractionFailureException("referenceUrl", "Failed to extract script reference from " + documentUrl);
        }
        String referenceUrl = reference.get();
        String urlVersionId = HashUtils.sha256Hex(referenceUrl);

        Optional<ArtifactRecord> byUrl = lookupByUrlVersion(urlVersionId);
        if (byUrl.isPresent()) {
            log.info("Using cached artifact {} for {}", shortId(byUrl.get().versionId()), referenceUrl);
            return byUrl.get();
        }

        log.info("Fetching script {}", referenceUrl);
        HttpFetchResult script = retryExecutor.execute(
            "fetch_script",
            breakers.breaker(CircuitBreakerRegistry.ARTIFACT_SCRIPT),
            () -> httpClient.fetchOrThrow(referenceUrl, SCRIPT_ACCEPT)
        );
        String body = script.body() == null ? "" : script.body();
        String versionId = script.bodyBytes() == null ? HashUtils.sha256Hex(body) : HashUtils.sha256Hex(script.bodyBytes());

        Optional<ArtifactRecord> byContent = lookupByVersion(versionId);
        if (byContent.isPresent()) {
            log.info("Script at {} matches cached artifact {}", referenceUrl, shortId(versionId));
            linkAlias(urlVersionId, versionId);
            return byContent.get();
        }

        ExtractedFields fields = extractOffThread(body);
        Instant now = clock.instant();
        ArtifactRecord artifact = new ArtifactRecord(
            versionId,
            urlVersionId,
            referenceUrl,
            fields,
            properties.getExtractionMethodVersion(),
            now,
            now,
            0
        );
        remember(artifact);
        stateStore.putArtifact(artifact);
        log.info("Synced artifact {} (signatureTimestamp={})", shortId(versionId), fields.signatureTimestamp());
        return artifact;
    }

    private ExtractedFields extractOffThread(String body) {
        CompletableFuture<ExtractedFields> future = CompletableFuture.supplyAsync(
            () -> extractor.extractFields(body),
            extractionExecutor
        );
        try {
            ExtractedFields fields = future.get(properties.getExtractionTimeoutSeconds(), TimeUnit.SECONDS);
            driftMonitor.recordAttempt(true);
            return fields;
        } catch (TimeoutException e) {
            future.cancel(true);
            driftMonitor.recordAttempt(false);
            throw new ExtractionFailureException(
                "fields",
                "Field extraction timed out after " + properties.getExtractionTimeoutSeconds() + "s",
                e
            );
        } catch (ExecutionException e) {
            driftMonitor.recordAttempt(false);
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof ExtractionFailureException extractionFailure) {
                throw extractionFailure;
            }
            throw new ExtractionFailureException("fields", "Field extraction failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ExtractionFailureException("fields", "Interrupted while extracting fields", e);
        }
    }

    private Optional<ArtifactRecord> lookupByUrlVersion(String urlVersionId) {
        String versionId;
        entriesLock.lock();
        try {
            versionId = urlAliases.get(urlVersionId);
        } finally {
            entriesLock.unlock();
        }
        if (versionId != null) {
            Optional<ArtifactRecord> inMemory = lookupInMemory(versionId);
            if (inMemory.isPresent()) {
                return inMemory;
            }
        }
        return stateStore.getArtifactByUrlVersion(urlVersionId).map(this::validatedFromDisk);
    }

    private Optional<ArtifactRecord> lookupByVersion(String versionId) {
        Optional<ArtifactRecord> inMemory = lookupInMemory(versionId);
        if (inMemory.isPresent()) {
            return inMemory;
        }
        return stateStore.getArtifact(versionId).map(this::validatedFromDisk);
    }

    private Optional<ArtifactRecord> lookupInMemory(String versionId) {
        Instant now = clock.instant();
        entriesLock.lock();
        try {
            CacheEntry entry = entries.get(versionId);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.artifact().isExpired(now, ttl)) {
                drop(versionId);
                return Optional.empty();
            }
            ArtifactRecord validated = entry.artifact().validatedAt(now);
            entries.put(versionId, entry.touched(validated, now));
            return Optional.of(validated);
        } finally {
            entriesLock.unlock();
        }
    }

    private ArtifactRecord validatedFromDisk(ArtifactRecord artifact) {
        ArtifactRecord validated = artifact.validatedAt(clock.instant());
        persistQuietly(validated);
        remember(validated);
        return validated;
    }

    /**
     * Inserts or replaces an entry; when over capacity the entry with the oldest creation
     * time is evicted.
     */
    void remember(ArtifactRecord artifact) {
        Instant now = clock.instant();
        entriesLock.lock();
        try {
            CacheEntry existing = entries.get(artifact.versionId());
            entries.put(
                artifact.versionId(),
                existing == null ? CacheEntry.of(artifact, now) : existing.touched(artifact, now)
            );
            if (artifact.urlVersionId() != null) {
                urlAliases.put(artifact.urlVersionId(), artifact.versionId());
            }
            while (entries.size() > properties.getCacheSize()) {
                String oldest = entries.values().stream()
                    .min(Comparator.comparing(CacheEntry::createdAt))
                    .map(entry -> entry.artifact().versionId())
                    .orElseThrow();
                drop(oldest);
                log.info("Evicted artifact {} from memory cache", shortId(oldest));
            }
        } finally {
            entriesLock.unlock();
        }
    }

    private void linkAlias(String urlVersionId, String versionId) {
        entriesLock.lock();
        try {
            urlAliases.put(urlVersionId, versionId);
        } finally {
            entriesLock.unlock();
        }
        try {
            stateStore.linkUrlVersion(urlVersionId, versionId);
        } catch (StateStoreException e) {
            log.warn("Could not persist URL alias for artifact {}", shortId(versionId), e);
        }
    }

    // caller holds entriesLock
    private void drop(String versionId) {
        entries.remove(versionId);
        urlAliases.values().removeIf(versionId::equals);
    }

    private void persistQuietly(ArtifactRecord artifact) {
        try {
            stateStore.putArtifact(artifact);
        } catch (StateStoreException e) {
            log.warn("Could not persist artifact {}", shortId(artifact.versionId()), e);
        }
    }

    private boolean isFresh(Current snapshot) {
        if (snapshot == null || snapshot.refreshedAt() == null) {
            return false;
        }
        return Duration.between(snapshot.refreshedAt(), clock.instant()).compareTo(ttl) <= 0;
    }

    public List<String> cachedVersionIds() {
        entriesLock.lock();
        try {
            return new ArrayList<>(entries.keySet());
        } finally {
            entriesLock.unlock();
        }
    }

    public ArtifactCacheSnapshot snapshot() {
        Current snapshot = current.get();
        ArtifactRecord artifact = snapshot == null ? null : snapshot.artifact();
        return new ArtifactCacheSnapshot(
            artifact == null ? null : artifact.versionId(),
            artifact == null ? null : artifact.sourceUrl(),
            artifact == null || artifact.fields() == null ? null : artifact.fields().signatureTimestamp(),
            snapshot == null ? null : snapshot.refreshedAt(),
            cachedVersionIds(),
            driftMonitor.failureRate()
        );
    }

    private static String shortId(String versionId) {
        if (versionId == null) {
            return "<none>";
        }
        return versionId.length() <= 12 ? versionId : versionId.substring(0, 12) + "...";
    }
}
