package com.openforge.parley.session;

import com.openforge.parley.memory.ContextualMemory;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One conversation. Owns its short-term buffer and preferences through
 * {@link ContextualMemory}; utterances of one session are processed one at
 * a time under {@link #getLock()}.
 *
 * Status only moves forward: ACTIVE → CLOSED or ACTIVE → EXPIRED.
 */
@Getter
public class Session {

    private final String              id;
    private final String              userId;
    private final Instant             startedAt;
    private final Map<String, String> metadata;
    private final ContextualMemory    memory;
    private final ReentrantLock       lock = new ReentrantLock();

    private volatile Instant lastActivityAt;

    @Getter(AccessLevel.NONE)
    private final AtomicReference<SessionStatus> status = new AtomicReference<>(SessionStatus.ACTIVE);

    Session(String id, String userId, Instant startedAt, Map<String, String> metadata, ContextualMemory memory) {
        this.id             = id;
        this.userId         = userId;
        this.startedAt      = startedAt;
        this.metadata       = metadata == null ? Map.of() : Map.copyOf(metadata);
        this.memory         = memory;
        this.lastActivityAt = startedAt;
    }

    public SessionStatus getStatus() {
        return status.get();
    }

    public boolean isActive() {
        return status.get() == SessionStatus.ACTIVE;
    }

    public void touch(Instant now) {
        lastActivityAt = now;
    }

    public boolean isIdleSince(Instant now, Duration timeout) {
        return lastActivityAt.plus(timeout).isBefore(now);
    }

    /** @return true if this call ended the session */
    boolean end(SessionStatus terminal) {
        return status.compareAndSet(SessionStatus.ACTIVE, terminal);
    }
}
