package com.openforge.parley.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.parley.semantic.SemanticMatcher;
import com.openforge.parley.storage.PersistenceBackend;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Long-term memory: an append-only semantic store shared by all sessions.
 *
 * Operation groups:
 *
 *   store()         embed + append + write through to the backend
 *   search()        nearest entries to a query
 *   prune/consolidate  explicit, caller-invoked removal; nothing is evicted silently
 *
 * Appends and searches run concurrently under the read lock. Prune and
 * consolidate take the write lock, so they never interleave with an append.
 */
@Slf4j
public class LongTermMemory {

    static final String KEY_PREFIX = "ltm:";

    private final SemanticMatcher    matcher;
    private final PersistenceBackend backend;
    private final ObjectMapper       objectMapper;
    private final Clock              clock;

    private final ConcurrentLinkedDeque<MemoryEntry> entries = new ConcurrentLinkedDeque<>();
    private final ReentrantReadWriteLock             lock    = new ReentrantReadWriteLock();

    public LongTermMemory(SemanticMatcher matcher,
                          PersistenceBackend backend,
                          ObjectMapper objectMapper,
                          Clock clock) {
        this.matcher      = matcher;
        this.backend      = backend;
        this.objectMapper = objectMapper;
        this.clock        = clock;
        restore();
    }

    /** Serialized form written to the backend; the vector travels separately. */
    record StoredEntry(String id, String sessionId, MemoryType type, String content,
                               Map<String, String> metadata, double importance, Instant createdAt) {
        static StoredEntry of(MemoryEntry e) {
            return new StoredEntry(e.id(), e.sessionId(), e.type(), e.content(),
                    e.metadata(), e.importance(), e.createdAt());
        }

        MemoryEntry toEntry(List<Float> embedding) {
            return new MemoryEntry(id, sessionId, type, content, embedding, metadata, importance, createdAt);
        }
    }

    // ── Store ────────────────────────────────────────────────────────────────

    public MemoryEntry store(String sessionId,
                             MemoryType type,
                             String content,
                             Map<String, String> metadata,
                             double importance) {
        List<Float> embedding = matcher.embed(content).orElse(List.of());
        MemoryEntry entry = new MemoryEntry(UUID.randomUUID().toString(), sessionId, type, content,
                embedding, metadata, importance, clock.instant());

        lock.readLock().lock();
        try {
            entries.addLast(entry);
        } finally {
            lock.readLock().unlock();
        }
        persist(entry);
        log.debug("[Memory] Stored {} memory for session {} (importance={}, searchable={})",
                type, sessionId, importance, entry.isSearchable());
        return entry;
    }

    // ── Search ───────────────────────────────────────────────────────────────

    public List<MemoryRecord> search(String query, int topK) {
        return search(query, topK, 0.0, e -> true);
    }

    /**
     * Entries nearest to {@code query}, best first, limited to those accepted
     * by {@code filter} and scoring at least {@code minScore}. Equal scores
     * list newer entries first. Empty when the query cannot be embedded.
     */
    public List<MemoryRecord> search(String query, int topK, double minScore, Predicate<MemoryEntry> filter) {
        if (topK <= 0) return List.of();
        Optional<List<Float>> queryVector = matcher.embed(query);
        if (queryVector.isEmpty()) {
            return List.of();
        }

        List<MemoryRecord> hits = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (MemoryEntry entry : entries) {
                if (!entry.isSearchable() || !filter.test(entry)) continue;
                double score = SemanticMatcher.cosine(queryVector.get(), entry.embedding());
                if (score >= minScore) {
                    hits.add(new MemoryRecord(entry, score));
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        hits.sort(Comparator.comparingDouble(MemoryRecord::score).reversed()
                .thenComparing(r -> r.entry().createdAt(), Comparator.reverseOrder()));
        return hits.size() > topK ? List.copyOf(hits.subList(0, topK)) : List.copyOf(hits);
    }

    // ── Prune & consolidate ──────────────────────────────────────────────────

    /** Removes entries older than {@code maxAge}. @return number removed */
    public int prune(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        return removeWhere(e -> e.createdAt().isBefore(cutoff), "age > " + maxAge);
    }

    /**
     * Trims the store to {@code maxCount} entries. Keeps the most important
     * (newest first on ties) when {@code keepMostRelevant}, otherwise the newest.
     *
     * @return number removed
     */
    public int prune(int maxCount, boolean keepMostRelevant) {
        if (maxCount < 0) {
            throw new IllegalArgumentException("maxCount must be >= 0, got " + maxCount);
        }
        lock.writeLock().lock();
        try {
            if (entries.size() <= maxCount) return 0;
            Comparator<MemoryEntry> newestFirst =
                    Comparator.comparing(MemoryEntry::createdAt, Comparator.reverseOrder());
            Comparator<MemoryEntry> keepOrder = keepMostRelevant
                    ? Comparator.comparingDouble(MemoryEntry::importance).reversed().thenComparing(newestFirst)
                    : newestFirst;
            Set<String> keep = new HashSet<>();
            entries.stream().sorted(keepOrder).limit(maxCount).forEach(e -> keep.add(e.id()));
            return removeLocked(e -> !keep.contains(e.id()), "count > " + maxCount);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Merges entries with the same type and normalised content, keeping the
     * earliest one. @return number of duplicates removed
     */
    public int consolidate() {
        lock.writeLock().lock();
        try {
            Map<String, MemoryEntry> earliest = new LinkedHashMap<>();
            for (MemoryEntry e : entries) {
                earliest.merge(dedupKey(e), e,
                        (a, b) -> b.createdAt().isBefore(a.createdAt()) ? b : a);
            }
            Set<String> keep = new HashSet<>();
            earliest.values().forEach(e -> keep.add(e.id()));
            int removed = removeLocked(e -> !keep.contains(e.id()), "duplicate");
            if (removed > 0) {
                log.info("[Memory] Consolidated {} duplicate entries, {} remain", removed, entries.size());
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ── Introspection ────────────────────────────────────────────────────────

    public int size() {
        return entries.size();
    }

    /** Snapshot in insertion order. */
    public List<MemoryEntry> entries() {
        return List.copyOf(entries);
    }

    public List<MemoryEntry> entriesFor(String sessionId) {
        return entries.stream().filter(e -> e.sessionId().equals(sessionId)).toList();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private int removeWhere(Predicate<MemoryEntry> condition, String reason) {
        lock.writeLock().lock();
        try {
            return removeLocked(condition, reason);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private int removeLocked(Predicate<MemoryEntry> condition, String reason) {
        List<MemoryEntry> removed = entries.stream().filter(condition).toList();
        entries.removeIf(condition);
        for (MemoryEntry e : removed) {
            try {
                backend.delete(KEY_PREFIX + e.id());
            } catch (RuntimeException ex) {
                log.warn("[Memory] Failed to delete {} from {}: {}", e.id(), backend.name(), ex.getMessage());
            }
        }
        if (!removed.isEmpty()) {
            log.info("[Memory] Pruned {} entries ({})", removed.size(), reason);
        }
        return removed.size();
    }

    /** Reloads entries written by earlier runs, oldest first. Unreadable rows are skipped. */
    private void restore() {
        List<PersistenceBackend.StoredValue> stored;
        try {
            stored = backend.scan(KEY_PREFIX);
        } catch (RuntimeException e) {
            log.warn("[Memory] Could not reload long-term memory from {}: {}", backend.name(), e.getMessage());
            return;
        }
        List<MemoryEntry> loaded = new ArrayList<>(stored.size());
        for (PersistenceBackend.StoredValue value : stored) {
            try {
                loaded.add(objectMapper.readValue(value.value(), StoredEntry.class).toEntry(value.embedding()));
            } catch (JsonProcessingException e) {
                log.warn("[Memory] Skipping unreadable entry {}: {}", value.key(), e.getOriginalMessage());
            }
        }
        loaded.sort(Comparator.comparing(MemoryEntry::createdAt));
        entries.addAll(loaded);
        if (!loaded.isEmpty()) {
            log.info("[Memory] Restored {} long-term entries from {}", loaded.size(), backend.name());
        }
    }

    private void persist(MemoryEntry entry) {
        try {
            String json = objectMapper.writeValueAsString(StoredEntry.of(entry));
            backend.save(KEY_PREFIX + entry.id(), json, entry.embedding());
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[Memory] Failed to persist memory {} to {}: {}", entry.id(), backend.name(), e.getMessage());
        }
    }

    private static String dedupKey(MemoryEntry e) {
        return e.type() + "|" + e.content().trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
