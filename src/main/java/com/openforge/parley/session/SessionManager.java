package com.openforge.parley.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.parley.config.ParleyProperties;
import com.openforge.parley.config.ParleyProperties.MemoryProperties;
import com.openforge.parley.memory.ContextualMemory;
import com.openforge.parley.memory.LongTermMemory;
import com.openforge.parley.memory.Preference;
import com.openforge.parley.memory.PreferenceRules;
import com.openforge.parley.storage.PersistenceBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens, looks up and ends sessions.
 *
 * Ending a session (close or idle expiry) flushes it:
 *   1. The preference observations made in this session are appended to the
 *      backend as a new record "prefs:{owner}:{sessionId}:{uuid}"
 *   2. A SUMMARY entry is written to long-term memory if any turn was recorded
 *
 * The owner is the user, or the session id for anonymous sessions. Opening
 * a session sums the counts of every record of its owner, so learning carries
 * across sessions. Records are never rewritten, so two sessions of one user
 * ending in any order both keep what they learned.
 *
 * End and flush happen under the session lock: a turn in flight finishes its
 * current stage, sees the session ended, and writes nothing further.
 */
@Slf4j
@Service
public class SessionManager {

    static final String PREFS_PREFIX = "prefs:";

    /** One session's preference observations, as appended to the backend. */
    record PreferenceRecord(String owner, String sessionId, List<Preference> observations) {}

    private final LongTermMemory     longTerm;
    private final PersistenceBackend backend;
    private final PreferenceRules    rules;
    private final MemoryProperties   properties;
    private final ObjectMapper       objectMapper;
    private final Clock              clock;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    @Autowired
    public SessionManager(LongTermMemory longTerm,
                          PersistenceBackend backend,
                          PreferenceRules rules,
                          ParleyProperties properties,
                          ObjectMapper objectMapper,
                          Clock clock) {
        this(longTerm, backend, rules, properties.memory(), objectMapper, clock);
    }

    public SessionManager(LongTermMemory longTerm,
                          PersistenceBackend backend,
                          PreferenceRules rules,
                          MemoryProperties properties,
                          ObjectMapper objectMapper,
                          Clock clock) {
        this.longTerm     = longTerm;
        this.backend      = backend;
        this.rules        = rules;
        this.properties   = properties;
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    // ── Open / lookup ────────────────────────────────────────────────────────

    /**
     * Opens a session, or returns it if already open. An id whose session has
     * ended may be reused; it starts fresh.
     */
    public Session open(String sessionId, String userId, Map<String, String> metadata) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        return sessions.compute(sessionId, (id, existing) -> {
            if (existing != null && existing.isActive()) {
                return existing;
            }
            ContextualMemory memory = new ContextualMemory(id, userId, longTerm, rules, properties);
            restorePreferences(memory);
            Session session = new Session(id, userId, clock.instant(), metadata, memory);
            log.info("[Session] Opened {} (user={})", id, userId);
            return session;
        });
    }

    /** @throws SessionNotFoundException if no session with this id is open */
    public Session get(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public Optional<Session> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    public Collection<Session> openSessions() {
        return List.copyOf(sessions.values());
    }

    // ── End ──────────────────────────────────────────────────────────────────

    /** @throws SessionNotFoundException if no session with this id is open */
    public Session close(String sessionId) {
        Session session = get(sessionId);
        end(session, SessionStatus.CLOSED);
        return session;
    }

    /** Expires every session idle longer than the configured timeout. @return expired ids */
    public List<String> expireIdle(Instant now) {
        List<String> expired = new ArrayList<>();
        for (Session session : sessions.values()) {
            if (session.isIdleSince(now, properties.sessionTimeout()) && end(session, SessionStatus.EXPIRED)) {
                expired.add(session.getId());
            }
        }
        if (!expired.isEmpty()) {
            log.info("[Session] Expired {} idle session(s): {}", expired.size(), expired);
        }
        return expired;
    }

    @Scheduled(fixedDelayString = "${parley.memory.expiry-sweep-interval:PT1M}")
    public void sweep() {
        expireIdle(clock.instant());
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private boolean end(Session session, SessionStatus terminal) {
        if (!session.end(terminal)) {
            return false;
        }
        session.getLock().lock();
        try {
            flush(session);
        } finally {
            session.getLock().unlock();
            sessions.remove(session.getId(), session);
        }
        log.info("[Session] {} {}", session.getId(), terminal == SessionStatus.CLOSED ? "closed" : "expired");
        return true;
    }

    private void flush(Session session) {
        ContextualMemory memory = session.getMemory();
        List<Preference> observed = memory.preferences().learnedObservations();
        if (!observed.isEmpty()) {
            String owner = owner(memory);
            try {
                String json = objectMapper.writeValueAsString(new PreferenceRecord(owner, memory.sessionId(), observed));
                backend.save(preferencesPrefix(owner) + memory.sessionId() + ":" + UUID.randomUUID(), json, null);
            } catch (JsonProcessingException | RuntimeException e) {
                log.warn("[Session] Failed to flush preferences of {}: {}", session.getId(), e.getMessage());
            }
        }
        if (memory.recordedTurns() > 0) {
            try {
                memory.storeSummary();
            } catch (RuntimeException e) {
                log.warn("[Session] Failed to store summary of {}: {}", session.getId(), e.getMessage());
            }
        }
    }

    private void restorePreferences(ContextualMemory memory) {
        String owner = owner(memory);
        try {
            Map<List<String>, Integer> counts = new LinkedHashMap<>();
            int records = 0;
            for (PersistenceBackend.StoredValue stored : backend.scan(preferencesPrefix(owner))) {
                PreferenceRecord record;
                try {
                    record = objectMapper.readValue(stored.value(), PreferenceRecord.class);
                } catch (JsonProcessingException e) {
                    log.warn("[Session] Skipping unreadable preference record {}: {}", stored.key(), e.getOriginalMessage());
                    continue;
                }
                if (!owner.equals(record.owner()) || record.observations() == null) continue;
                records++;
                for (Preference p : record.observations()) {
                    counts.merge(List.of(p.category(), p.key(), p.value()), p.observationCount(), Integer::sum);
                }
            }
            if (records > 0) {
                List<Preference> total = new ArrayList<>(counts.size());
                counts.forEach((slot, n) -> total.add(new Preference(slot.get(0), slot.get(1), slot.get(2), 0.0, n, false)));
                memory.preferences().restore(total);
                log.debug("[Session] Restored {} preference(s) of {} from {} record(s)", total.size(), owner, records);
            }
        } catch (RuntimeException e) {
            log.warn("[Session] Could not restore preferences of {}: {}", owner, e.getMessage());
        }
    }

    private static String owner(ContextualMemory memory) {
        return memory.userId() != null ? memory.userId() : memory.sessionId();
    }

    private static String preferencesPrefix(String owner) {
        return PREFS_PREFIX + owner + ":";
    }
}
