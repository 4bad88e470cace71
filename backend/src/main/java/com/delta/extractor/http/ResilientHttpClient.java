package com.delta.extractor.http;

import com.delta.extractor.config.ExtractorProperties;
import com.delta.extractor.error.HttpStatusException;
import com.delta.extractor.error.TransportFailureException;
import com.delta.extractor.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Single-attempt HTTP access with a global concurrency limit and per-host pacing.
 * Retries belong to {@link com.delta.extractor.resilience.RetryExecutor}.
 */
@Service
public class ResilientHttpClient {
    private static final Logger log = LoggerFactory.getLogger(ResilientHttpClient.class);
    private static final Set<String> RESTRICTED_HEADERS = Set.of(
        "connection", "content-length", "expect", "host", "upgrade"
    );

    private final ExtractorProperties.Http properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();

    public ResilientHttpClient(
        ExtractorProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties.getHttp();
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(this.properties.getConnectTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(this.properties.getGlobalConcurrency());
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        boolean acquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;
            enforcePerHostDelay(host);

            HttpRequest request = baseRequest(uri, acceptHeader).GET().build();
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            noteRateLimit(host, response.statusCode());
            byte[] responseBytes = response.body();
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8),
                responseBytes,
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, errorCodeOf(e), describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        } finally {
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    /**
     * Like {@link #get(String, String)} but turns any non-2xx outcome into an exception the
     * retry classifier understands.
     */
    public HttpFetchResult fetchOrThrow(String url, String acceptHeader) {
        HttpFetchResult result = get(url, acceptHeader);
        if (result.isSuccessful()) {
            return result;
        }
        if (result.errorCode() != null) {
            throw new TransportFailureException(result.errorCode(), String.valueOf(result.errorMessage()));
        }
        throw new HttpStatusException(result.statusCode(), url, "Unexpected response status");
    }

    /**
     * Opens a streaming GET. When {@code offset > 0} a {@code Range: bytes=offset-} header is sent.
     * The caller owns and must close the response body.
     */
    public HttpResponse<InputStream> openStream(String url, long offset) throws IOException, InterruptedException {
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            throw new HttpStatusException(400, url, "URL missing host or malformed");
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        boolean acquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;
            enforcePerHostDelay(host);
            HttpRequest.Builder builder = baseRequest(uri, "*/*");
            if (offset > 0) {
                builder.header("Range", "bytes=" + offset + "-");
            }
            HttpResponse<InputStream> response = client.send(builder.GET().build(), HttpResponse.BodyHandlers.ofInputStream());
            noteRateLimit(host, response.statusCode());
            return response;
        } finally {
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private HttpRequest.Builder baseRequest(URI uri, String acceptHeader) {
        String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", safeAccept)
            .header("Accept-Language", "en-US,en;q=0.9");
        for (Map.Entry<String, String> header : properties.getHeaders().entrySet()) {
            String name = header.getKey();
            if (name == null || name.isBlank() || header.getValue() == null) {
                continue;
            }
            String lower = name.toLowerCase(Locale.ROOT);
            if (RESTRICTED_HEADERS.contains(lower) || lower.equals("user-agent") || lower.equals("accept")) {
                continue;
            }
            builder.header(name, header.getValue());
        }
        return builder;
    }

    private void noteRateLimit(String host, int statusCode) {
        if (statusCode == 403 || statusCode == 429) {
            log.warn("Host {} answered {}; pausing requests for {}s", host, statusCode, properties.getRateLimitBackoffSeconds());
            extendBackoff(host, Duration.ofSeconds(properties.getRateLimitBackoffSeconds()));
        }
    }

    private void enforcePerHostDelay(String host) throws InterruptedException {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(host, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            hostNextAllowed.put(host, Instant.now().plusMillis(properties.getPerHostDelayMs()));
        }
    }

    private void extendBackoff(String host, Duration duration) {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant candidate = Instant.now().plus(duration);
            Instant current = hostNextAllowed.getOrDefault(host, Instant.now());
            if (candidate.isAfter(current)) {
                hostNextAllowed.put(host, candidate);
            }
        }
    }

    // HttpClient reports a refused connection as a ConnectException with no message
    static String errorCodeOf(IOException error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 8) {
            if (current instanceof ConnectException) {
                return "connection_refused";
            }
            if (current instanceof NoRouteToHostException) {
                return "network_unreachable";
            }
            current = current.getCause();
            depth++;
        }
        return "io_error";
    }

    private static String describe(IOException error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
