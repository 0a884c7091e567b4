package com.openforge.parley.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.openforge.parley.semantic.EmbeddingProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - Embedding executor  → the only place with non-trivial latency; everything else is synchronous
 *  - Java HttpClient     → used by the HTTP embedding provider; no WebClient, no RestTemplate
 *  - Jackson ObjectMapper → persistence snapshots and the embeddings wire format
 *  - Clock               → memory timestamps and idle-session expiry; replaced in tests
 */
@Configuration
public class AppConfig {

    /**
     * Bounded pool for embedding computation. Callers always await with a
     * timeout (see SemanticMatcher), so a stuck provider never blocks a session.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService parleyEmbeddingExecutor(EmbeddingProperties embeddingProperties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread t = new Thread(runnable, "parley-embed-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(embeddingProperties.workerThreads(), factory);
    }

    /**
     * Single, shared HttpClient instance.
     * 10 s connect timeout; per-request read timeouts are set at call site.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper:
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored (stored snapshots may carry older fields)
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
