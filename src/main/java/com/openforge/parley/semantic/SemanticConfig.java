package com.openforge.parley.semantic;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.util.concurrent.ExecutorService;

/**
 * Wires the embedding provider and the shared {@link SemanticMatcher}.
 *
 * The provider is picked by {@code parley.embedding.provider}:
 *   hashing (default)  local feature hashing, no network
 *   http               OpenAI-compatible /embeddings endpoint
 */
@Slf4j
@Configuration
public class SemanticConfig {

    @Bean
    public EmbeddingProvider embeddingProvider(EmbeddingProperties properties,
                                               HttpClient httpClient,
                                               ObjectMapper objectMapper) {
        String kind = properties.provider() == null ? "hashing" : properties.provider().trim().toLowerCase();
        EmbeddingProvider provider = switch (kind) {
            case "http"    -> new HttpEmbeddingProvider(httpClient, objectMapper, properties);
            case "hashing" -> new HashingEmbeddingProvider(properties.hashingDimensions());
            default -> throw new IllegalStateException(
                    "Unknown parley.embedding.provider '" + properties.provider() + "' (expected hashing or http)");
        };
        log.info("[Embed] Using embedding provider {}", provider.name());
        return provider;
    }

    @Bean
    public SemanticMatcher semanticMatcher(EmbeddingProvider provider,
                                           @Qualifier("parleyEmbeddingExecutor") ExecutorService executor,
                                           CircuitBreaker embeddingCircuitBreaker,
                                           Retry embeddingRetry,
                                           TimeLimiter embeddingTimeLimiter,
                                           EmbeddingProperties properties) {
        return new SemanticMatcher(provider, executor,
                embeddingCircuitBreaker, embeddingRetry, embeddingTimeLimiter,
                properties.cacheSize());
    }
}
