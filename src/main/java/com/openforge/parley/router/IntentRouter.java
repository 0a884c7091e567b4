package com.openforge.parley.router;

import com.openforge.parley.nlu.ExtractedEntity;
import com.openforge.parley.nlu.Intent;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Chain-of-responsibility dispatch of classified intents.
 *
 * Chain layout:
 *
 *   [0]      ClarificationHandler  reserved, always first
 *   [1..n-2] registered handlers   in registration or position order
 *   [n-1]    FallbackHandler       reserved, always last, always accepts
 *
 * A handler that throws is logged, counted as a failure, and skipped. The
 * fallback failing is the only terminal error ({@link RoutingException}).
 *
 * Metrics (Micrometer):
 *   parley.router.handler           timer,   tags handler, outcome
 *   parley.router.handler.failures  counter, tag handler
 *
 * Routing reads a snapshot of the chain, so registration may happen while
 * other threads route.
 */
@Slf4j
public class IntentRouter {

    static final String METRIC_HANDLER  = "parley.router.handler";
    static final String METRIC_FAILURES = "parley.router.handler.failures";

    private final MeterRegistry meterRegistry;
    private final Map<String, HandlerStats> stats = new ConcurrentHashMap<>();

    private volatile List<IntentHandler> chain;

    public IntentRouter(ClarificationHandler clarification, FallbackHandler fallback, MeterRegistry meterRegistry) {
        this(List.of(clarification, fallback), meterRegistry);
    }

    /**
     * Router over an explicit chain.
     *
     * @throws RoutingException if the chain does not start with a
     *         {@link ClarificationHandler} and end with a {@link FallbackHandler}
     */
    public IntentRouter(List<IntentHandler> chain, MeterRegistry meterRegistry) {
        if (chain.size() < 2
                || !(chain.get(0) instanceof ClarificationHandler)
                || !(chain.get(chain.size() - 1) instanceof FallbackHandler)) {
            throw new RoutingException("Handler chain must start with clarification and end with fallback: "
                    + names(chain));
        }
        this.meterRegistry = meterRegistry;
        List<IntentHandler> copy = new ArrayList<>();
        for (IntentHandler h : chain) {
            requireUniqueName(copy, h.name());
            copy.add(h);
        }
        this.chain = List.copyOf(copy);
    }

    // ── Routing ──────────────────────────────────────────────────────────────

    /**
     * Dispatches {@code intent} to the first handler that accepts it.
     *
     * @throws RoutingException if the fallback handler fails
     */
    public RouteResult route(Intent intent, Map<String, ExtractedEntity> entities, RoutingContext context) {
        Intent routed = intent == null ? Intent.unknown() : intent;
        Map<String, ExtractedEntity> ents = entities == null ? routed.entities() : entities;
        RoutingContext ctx = context == null ? RoutingContext.of(null, null) : context;

        List<IntentHandler> snapshot = chain;
        for (int i = 0; i < snapshot.size(); i++) {
            IntentHandler handler = snapshot.get(i);
            boolean isFallback = i == snapshot.size() - 1;

            boolean accepts;
            try {
                accepts = handler.canHandle(routed, ctx);
            } catch (RuntimeException e) {
                failed(handler, isFallback, "canHandle", e);
                continue;
            }
            if (!accepts) continue;

            long start = System.nanoTime();
            try {
                HandlerResult result = handler.handle(routed, ents, ctx);
                if (result == null) {
                    throw new IllegalStateException("handler returned null");
                }
                long elapsed = System.nanoTime() - start;
                record(handler, elapsed, "success");
                log.debug("[Router] {} {} ({}) → {} in {} µs", routed.category(),
                        String.format("%.2f", routed.confidence()), routed.source(),
                        handler.name(), TimeUnit.NANOSECONDS.toMicros(elapsed));
                return new RouteResult(handler.name(), result, routed.confidence());
            } catch (RuntimeException e) {
                record(handler, System.nanoTime() - start, "failure");
                failed(handler, isFallback, "handle", e);
            }
        }
        throw new RoutingException("No handler accepted " + routed.category() + "; chain " + names(snapshot));
    }

    // ── Registration ─────────────────────────────────────────────────────────

    /** Adds {@code handler} just before the fallback. */
    public synchronized void register(IntentHandler handler) {
        register(handler, chain.size() - 1);
    }

    /**
     * Inserts {@code handler} at {@code position}, which must lie strictly
     * between the reserved handlers (1 .. size-1).
     */
    public synchronized void register(IntentHandler handler, int position) {
        if (position < 1 || position > chain.size() - 1) {
            throw new IllegalArgumentException("Position " + position + " is outside 1.." + (chain.size() - 1));
        }
        if (handler instanceof ClarificationHandler || handler instanceof FallbackHandler) {
            throw new IllegalArgumentException("Reserved handler type cannot be registered: " + handler.name());
        }
        requireUniqueName(chain, handler.name());
        List<IntentHandler> next = new ArrayList<>(chain);
        next.add(position, handler);
        chain = List.copyOf(next);
        log.info("[Router] Registered handler '{}' at position {}", handler.name(), position);
    }

    /**
     * @return true if a handler with this name was removed
     * @throws IllegalArgumentException for the reserved handlers
     */
    public synchronized boolean remove(String name) {
        List<IntentHandler> current = chain;
        if (current.get(0).name().equals(name) || current.get(current.size() - 1).name().equals(name)) {
            throw new IllegalArgumentException("Reserved handler cannot be removed: " + name);
        }
        List<IntentHandler> next = new ArrayList<>(current);
        boolean removed = next.removeIf(h -> h.name().equals(name));
        if (removed) {
            chain = List.copyOf(next);
            log.info("[Router] Removed handler '{}'", name);
        }
        return removed;
    }

    // ── Introspection ────────────────────────────────────────────────────────

    public List<String> handlerNames() {
        return names(chain);
    }

    public Optional<HandlerStats.Snapshot> stats(String handler) {
        return Optional.ofNullable(stats.get(handler)).map(HandlerStats::snapshot);
    }

    /** Snapshots in chain order, for handlers that have been exercised. */
    public Map<String, HandlerStats.Snapshot> allStats() {
        Map<String, HandlerStats.Snapshot> out = new LinkedHashMap<>();
        for (String name : handlerNames()) {
            HandlerStats s = stats.get(name);
            if (s != null) out.put(name, s.snapshot());
        }
        return out;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private void failed(IntentHandler handler, boolean isFallback, String phase, RuntimeException e) {
        statsFor(handler).recordFailure();
        meterRegistry.counter(METRIC_FAILURES, "handler", handler.name()).increment();
        if (isFallback) {
            log.error("[Router] Fallback handler '{}' failed in {}", handler.name(), phase, e);
            throw new RoutingException("Fallback handler '" + handler.name() + "' failed", e);
        }
        log.warn("[Router] Handler '{}' failed in {}, skipping: {}", handler.name(), phase, e.toString());
    }

    private void record(IntentHandler handler, long nanos, String outcome) {
        if ("success".equals(outcome)) {
            statsFor(handler).recordCall(nanos);
        }
        Timer.builder(METRIC_HANDLER)
                .tag("handler", handler.name())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    private HandlerStats statsFor(IntentHandler handler) {
        return stats.computeIfAbsent(handler.name(), HandlerStats::new);
    }

    private static void requireUniqueName(List<IntentHandler> chain, String name) {
        if (chain.stream().anyMatch(h -> h.name().equals(name))) {
            throw new IllegalArgumentException("Duplicate handler name: " + name);
        }
    }

    private static List<String> names(List<IntentHandler> chain) {
        return chain.stream().map(IntentHandler::name).toList();
    }
}
