package com.openforge.parley.router;

import java.time.Duration;
import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;

/**
 * Per-handler counters kept by the router, independent of the meter registry.
 */
public class HandlerStats {

    private final String          handler;
    private final LongAdder       calls       = new LongAdder();
    private final LongAdder       failures    = new LongAdder();
    private final LongAdder       totalNanos  = new LongAdder();
    private final LongAccumulator maxNanos    = new LongAccumulator(Math::max, 0);

    public HandlerStats(String handler) {
        this.handler = handler;
    }

    void recordCall(long nanos) {
        calls.increment();
        totalNanos.add(nanos);
        maxNanos.accumulate(nanos);
    }

    void recordFailure() {
        failures.increment();
    }

    public Snapshot snapshot() {
        long n = calls.sum();
        return new Snapshot(handler, n, failures.sum(),
                Duration.ofNanos(n == 0 ? 0 : totalNanos.sum() / n),
                Duration.ofNanos(maxNanos.get()));
    }

    /**
     * @param calls    successful handle() calls
     * @param failures exceptions thrown from canHandle() or handle()
     */
    public record Snapshot(String handler, long calls, long failures, Duration meanLatency, Duration maxLatency) {}
}
