package com.delta.extractor.http;

import com.delta.extractor.config.ExtractorProperties;
import com.delta.extractor.error.HttpStatusException;
import com.delta.extractor.error.TransportFailureException;
import com.delta.extractor.model.HttpFetchResult;
import com.delta.extractor.resilience.FailureClass;
import com.delta.extractor.resilience.FailureClassifier;
import com.delta.extractor.resilience.RetryExecutor;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResilientHttpClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private ResilientHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        ExtractorProperties properties = new ExtractorProperties();
        properties.getHttp().setPerHostDelayMs(0);
        properties.getHttp().setRequestTimeoutSeconds(5);
        properties.getHttp().setUserAgent("extractor-test/1.0");
        properties.getHttp().setHeaders(Map.of("X-Client", "tests", "Host", "ignored.example"));
        executor = Executors.newFixedThreadPool(2);
        client = new ResilientHttpClient(properties, executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void getReturnsBodyAndSendsConfiguredHeaders() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("hello").setHeader("Content-Type", "text/plain"));

        HttpFetchResult result = client.get(server.url("/doc").toString(), "text/plain");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("hello");
        assertThat(result.contentType()).isEqualTo("text/plain");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("User-Agent")).isEqualTo("extractor-test/1.0");
        assertThat(request.getHeader("X-Client")).isEqualTo("tests");
        assertThat(request.getHeader("Accept")).isEqualTo("text/plain");
    }

    @Test
    void fetchOrThrowRaisesStatusException() {
        server.enqueue(new MockResponse().setResponseCode(404));

        assertThatThrownBy(() -> client.fetchOrThrow(server.url("/missing").toString(), "*/*"))
            .isInstanceOf(HttpStatusException.class)
            .satisfies(error -> assertThat(((HttpStatusException) error).statusCode()).isEqualTo(404));
    }

    @Test
    void fetchOrThrowRaisesTransportFailureForInvalidUrl() {
        assertThatThrownBy(() -> client.fetchOrThrow("http://", "*/*"))
            .isInstanceOf(TransportFailureException.class)
            .satisfies(error -> assertThat(((TransportFailureException) error).errorCode()).isEqualTo("invalid_url"));
    }

    @Test
    void refusedConnectionIsRetryable() throws Exception {
        MockWebServer closed = new MockWebServer();
        closed.start();
        String url = closed.url("/x").toString();
        closed.shutdown();
        AtomicInteger calls = new AtomicInteger();
        RetryExecutor retryExecutor = new RetryExecutor(3, 2.0, 0.0, duration -> { });

        assertThatThrownBy(() -> retryExecutor.execute("fetch document", () -> {
            calls.incrementAndGet();
            return client.fetchOrThrow(url, null);
        }))
            .isInstanceOf(TransportFailureException.class)
            .satisfies(error -> {
                assertThat(((TransportFailureException) error).errorCode()).isEqualTo("connection_refused");
                assertThat(FailureClassifier.classify(error)).isEqualTo(FailureClass.RETRYABLE);
            });
        assertThat(calls).hasValue(4);
    }

    @Test
    void errorCodeFollowsTheCauseChain() {
        IOException wrapped = new IOException("send failed", new ConnectException());

        assertThat(ResilientHttpClient.errorCodeOf(wrapped)).isEqualTo("connection_refused");
        assertThat(ResilientHttpClient.errorCodeOf(new IOException("stream closed"))).isEqualTo("io_error");
    }

    @Test
    void openStreamSendsRangeHeaderWhenResuming() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(206).setBody("tail"));

        HttpResponse<InputStream> response = client.openStream(server.url("/file").toString(), 3000);
        try (InputStream body = response.body()) {
            assertThat(new String(body.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("tail");
        }

        assertThat(response.statusCode()).isEqualTo(206);
        assertThat(server.takeRequest().getHeader("Range")).isEqualTo("bytes=3000-");
    }

    @Test
    void openStreamOmitsRangeHeaderForFreshTransfer() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("all"));

        HttpResponse<InputStream> response = client.openStream(server.url("/file").toString(), 0);
        response.body().close();

        assertThat(server.takeRequest().getHeader("Range")).isNull();
    }
}
