package com.openforge.parley.storage;

import java.util.List;
import java.util.Optional;

/**
 * Key/value store with an optional vector per entry, consumed by long-term
 * memory and the session manager. The storage engine is pluggable.
 *
 * Implementations must be thread-safe.
 */
public interface PersistenceBackend {

    /** Insert or replace. {@code embedding} may be null for non-searchable values. */
    void save(String key, String value, List<Float> embedding);

    Optional<String> load(String key);

    /** Nearest entries to {@code embedding} by similarity, best first. */
    List<StoredHit> query(List<Float> embedding, int topK);

    /**
     * Every entry whose key starts with {@code keyPrefix}, in no particular
     * order. The embedding is empty for entries saved without one.
     */
    List<StoredValue> scan(String keyPrefix);

    /** @return true if something was removed */
    boolean delete(String key);

    String name();

    record StoredHit(String key, String value, double score) {}

    record StoredValue(String key, String value, List<Float> embedding) {}
}
