package com.openforge.parley.semantic;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for the embedding provider used by the semantic matcher.
 *
 * application.yml:
 *
 * parley:
 *   embedding:
 *     provider: hashing            # hashing | http
 *     base-url: https://api.openai.com/v1
 *     api-key: ${EMBEDDING_API_KEY:sk-placeholder}
 *     model: text-embedding-3-small
 *     dimensions: 1536
 *     timeout-seconds: 30
 *     call-timeout-millis: 2000
 *     cache-size: 10000
 *
 * "hashing" needs no network and is the default; "http" calls any
 * OpenAI-compatible /embeddings endpoint.
 */
@ConfigurationProperties(prefix = "parley.embedding")
public record EmbeddingProperties(
        @DefaultValue("hashing") String provider,
        String baseUrl,
        String apiKey,
        @DefaultValue("text-embedding-3-small") String model,
        @DefaultValue("1536") int dimensions,
        @DefaultValue("30") int timeoutSeconds,
        @DefaultValue("2000") long callTimeoutMillis,
        @DefaultValue("10000") long cacheSize,
        @DefaultValue("512") int hashingDimensions,
        @DefaultValue("4") int workerThreads
) {}
