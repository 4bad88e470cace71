package com.delta.extractor.config;

import com.delta.extractor.resilience.CircuitBreakerRegistry;
import com.delta.extractor.resilience.RetryExecutor;
import com.delta.extractor.resilience.Sleeper;
import com.delta.extractor.state.StateStore;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExtractorConfig {

    @Bean(name = "transferExecutor", destroyMethod = "shutdown")
    public ExecutorService transferExecutor(ExtractorProperties properties) {
        return Executors.newFixedThreadPool(properties.getTransfer().getMaxConcurrentTransfers(), namedThreads("transfer-worker"));
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ExtractorProperties properties) {
        int size = Math.max(4, properties.getHttp().getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size, namedThreads("http-io"));
    }

    @Bean(name = "extractionExecutor", destroyMethod = "shutdown")
    public ExecutorService extractionExecutor(ExtractorProperties properties) {
        return Executors.newFixedThreadPool(properties.getArtifact().getMaxWorkers(), namedThreads("artifact-extract"));
    }

    @Bean
    public ObjectMapper objectMapper() {
        return defaultObjectMapper();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(ExtractorProperties properties, Clock clock) {
        return new CircuitBreakerRegistry(properties.getBreaker(), clock);
    }

    @Bean
    public RetryExecutor retryExecutor(ExtractorProperties properties, Sleeper sleeper) {
        return RetryExecutor.fromProperties(properties.getRetry(), sleeper);
    }

    @Bean
    public StateStore stateStore(ExtractorProperties properties, ObjectMapper objectMapper, Clock clock) {
        return new StateStore(
            Path.of(properties.getState().getDir()),
            Duration.ofSeconds(properties.getArtifact().getTtlSeconds()),
            properties.getTransfer().getPartSuffix(),
            objectMapper,
            clock
        );
    }

    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.registerModule(new Jdk8Module());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
