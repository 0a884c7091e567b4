package com.openforge.parley.semantic;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Embedding similarity and nearest-neighbour search.
 *
 * Call graph for every embedding:
 *
 *   embed(text)
 *     └─ Caffeine cache (exact string key)
 *          ↓ miss
 *     └─ CircuitBreaker
 *          └─ TimeLimiter (await on the embedding pool)
 *               └─ Retry
 *                    └─ provider.embed(text)
 *
 * Degraded mode: if the provider throws, times out or the circuit is open,
 * the call yields no vector, every score that depends on it is 0.0 and the
 * result is flagged {@code degraded}. The pipeline continues; nothing blocks
 * longer than the time limiter allows.
 *
 * Thread-safe. Shared by all sessions.
 */
@Slf4j
public class SemanticMatcher {

    private final EmbeddingProvider provider;
    private final ExecutorService   executor;
    private final CircuitBreaker    circuitBreaker;
    private final Retry             retry;
    private final TimeLimiter       timeLimiter;

    private final Cache<String, List<Float>> cache;

    private volatile boolean degraded;

    public SemanticMatcher(EmbeddingProvider provider,
                           ExecutorService executor,
                           CircuitBreaker circuitBreaker,
                           Retry retry,
                           TimeLimiter timeLimiter,
                           long cacheSize) {
        this.provider       = provider;
        this.executor       = executor;
        this.circuitBreaker = circuitBreaker;
        this.retry          = retry;
        this.timeLimiter    = timeLimiter;
        this.cache          = Caffeine.newBuilder()
                .maximumSize(cacheSize)
                .recordStats()
                .build();
    }

    /** Stand-alone wiring with default resilience settings, for use outside Spring. */
    public SemanticMatcher(EmbeddingProvider provider, ExecutorService executor, Duration timeout) {
        this(provider, executor,
                CircuitBreaker.ofDefaults("embedding"),
                Retry.ofDefaults("embedding"),
                TimeLimiter.of(timeout),
                10_000);
    }

    // ── Embedding ────────────────────────────────────────────────────────────

    /**
     * Embedding for {@code text}, or empty when the provider is unavailable.
     * Blank text has no embedding but does not count as a degradation.
     */
    public Optional<List<Float>> embed(String text) {
        return attempt(text).vector();
    }

    /** True if the most recent provider call failed. Status only; results carry their own flag. */
    public boolean isDegraded() {
        return degraded;
    }

    public String providerName() {
        return provider.name();
    }

    // ── Similarity ───────────────────────────────────────────────────────────

    /** Cosine similarity clamped to [0, 1]; 0.0 when either side cannot be embedded. */
    public double similarity(String a, String b) {
        Optional<List<Float>> va = embed(a);
        if (va.isEmpty()) return 0.0;
        Optional<List<Float>> vb = embed(b);
        if (vb.isEmpty()) return 0.0;
        return cosine(va.get(), vb.get());
    }

    /**
     * Candidates scoring at least {@code threshold}, sorted by score descending.
     * Equal scores keep declaration order.
     */
    public MatchResult mostSimilar(String query, List<String> candidates, double threshold) {
        return rank(query, candidates, threshold, candidates.size());
    }

    /** Top {@code topK} documents by similarity, no threshold. */
    public MatchResult search(String query, List<String> documents, int topK) {
        return rank(query, documents, 0.0, topK);
    }

    /**
     * Best label of a labelled example bank: the label whose best example
     * scores highest, if that score reaches {@code threshold}. Ties go to the
     * label declared first (iteration order of {@code bank}).
     */
    public <L> Optional<LabelMatch<L>> bestLabel(String query,
                                                 Map<L, List<String>> bank,
                                                 double threshold) {
        LabelMatch<L> best = null;
        for (Map.Entry<L, List<String>> entry : bank.entrySet()) {
            MatchResult result = mostSimilar(query, entry.getValue(), threshold);
            if (result.degraded()) {
                return Optional.empty();
            }
            Optional<Match> top = result.best();
            if (top.isPresent() && (best == null || top.get().score() > best.score())) {
                best = new LabelMatch<>(entry.getKey(), top.get().text(), top.get().score());
            }
        }
        return Optional.ofNullable(best);
    }

    /** Cosine similarity of two vectors, clamped to [0, 1]. */
    public static double cosine(List<Float> a, List<Float> b) {
        if (a == null || b == null || a.isEmpty() || a.size() != b.size()) return 0.0;
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i), y = b.get(i);
            dot += x * y;
            na  += x * x;
            nb  += y * y;
        }
        if (na == 0 || nb == 0) return 0.0;
        double cos = dot / (Math.sqrt(na) * Math.sqrt(nb));
        return Math.max(0.0, Math.min(1.0, cos));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private MatchResult rank(String query, List<String> candidates, double threshold, int limit) {
        if (candidates.isEmpty() || limit <= 0) {
            return MatchResult.empty(false);
        }
        Attempt queryAttempt = attempt(query);
        if (queryAttempt.vector().isEmpty()) {
            return MatchResult.empty(queryAttempt.failed());
        }
        Optional<List<Float>> queryVector = queryAttempt.vector();

        List<Match> matches = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            String candidate = candidates.get(i);
            Attempt attempt = attempt(candidate);
            if (attempt.failed()) {
                return MatchResult.empty(true);
            }
            Optional<List<Float>> v = attempt.vector();
            double score = v.map(vec -> cosine(queryVector.get(), vec)).orElse(0.0);
            if (score >= threshold) {
                matches.add(new Match(candidate, i, score));
            }
        }
        // List.sort is stable: equal scores keep declaration order
        matches.sort(Comparator.comparingDouble(Match::score).reversed());
        if (matches.size() > limit) {
            matches = matches.subList(0, limit);
        }
        return new MatchResult(matches, false);
    }

    /** Outcome of one embedding call; {@code failed} is false for blank text. */
    private record Attempt(Optional<List<Float>> vector, boolean failed) {

        static Attempt of(List<Float> vector) {
            return new Attempt(Optional.of(vector), false);
        }

        static Attempt none(boolean failed) {
            return new Attempt(Optional.empty(), failed);
        }
    }

    private Attempt attempt(String text) {
        if (isBlank(text)) {
            return Attempt.none(false);
        }
        List<Float> cached = cache.getIfPresent(text);
        if (cached != null) {
            return Attempt.of(cached);
        }

        Supplier<CompletableFuture<List<Float>>> async = () -> CompletableFuture.supplyAsync(
                Retry.decorateSupplier(retry, () -> provider.embed(text)), executor);
        Callable<List<Float>> guarded = CircuitBreaker.decorateCallable(circuitBreaker,
                TimeLimiter.decorateFutureSupplier(timeLimiter, async));

        try {
            List<Float> vector = List.copyOf(guarded.call());
            cache.put(text, vector);
            markHealthy();
            return Attempt.of(vector);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            markDegraded(e);
            return Attempt.none(true);
        } catch (Exception e) {
            markDegraded(e);
            return Attempt.none(true);
        }
    }

    private void markDegraded(Exception cause) {
        if (!degraded) {
            log.warn("[Embed] Provider {} unavailable, similarity degraded to 0: {}",
                    provider.name(), cause.toString());
        }
        degraded = true;
    }

    private void markHealthy() {
        if (degraded) {
            log.info("[Embed] Provider {} recovered.", provider.name());
        }
        degraded = false;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
