package com.openforge.parley.config;

import com.openforge.parley.semantic.EmbeddingException;
import com.openforge.parley.semantic.EmbeddingProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Programmatic Resilience4j wiring for the embedding provider.
 *
 * One named instance of each primitive, "embedding":
 *   • TimeLimiter     caps every embedding call; a timeout degrades the score to 0
 *   • Retry           one extra attempt for transient provider errors
 *   • CircuitBreaker  stops hammering a dead provider; while OPEN the
 *                      SemanticMatcher answers in degraded mode immediately
 */
@Configuration
public class Resilience4jConfig {

    public static final String EMBEDDING = "embedding";

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 20 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(20)
                .minimumNumberOfCalls(10)
                .failureRateThreshold(50)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .recordExceptions(EmbeddingException.class, TimeoutException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker(EMBEDDING);
        return registry;
    }

    @Bean
    public CircuitBreaker embeddingCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(EMBEDDING);
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(200))
                .retryExceptions(EmbeddingException.class)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry(EMBEDDING);
        return registry;
    }

    @Bean
    public Retry embeddingRetry(RetryRegistry registry) {
        return registry.retry(EMBEDDING);
    }

    // ── Time Limiter ─────────────────────────────────────────────────────────

    @Bean
    public TimeLimiter embeddingTimeLimiter(EmbeddingProperties embeddingProperties) {
        return TimeLimiter.of(EMBEDDING, TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(embeddingProperties.callTimeoutMillis()))
                .cancelRunningFuture(true)
                .build());
    }
}
