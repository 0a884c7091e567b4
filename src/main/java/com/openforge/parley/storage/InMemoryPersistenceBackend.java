package com.openforge.parley.storage;

import com.openforge.parley.semantic.SemanticMatcher;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local backend. Default when no vector store is configured;
 * contents are lost on restart.
 */
public class InMemoryPersistenceBackend implements PersistenceBackend {

    private record Stored(String value, List<Float> embedding) {}

    private final Map<String, Stored> store = new ConcurrentHashMap<>();

    @Override
    public void save(String key, String value, List<Float> embedding) {
        store.put(key, new Stored(value, embedding == null ? List.of() : List.copyOf(embedding)));
    }

    @Override
    public Optional<String> load(String key) {
        Stored stored = store.get(key);
        return stored == null ? Optional.empty() : Optional.of(stored.value());
    }

    @Override
    public List<StoredHit> query(List<Float> embedding, int topK) {
        if (embedding == null || embedding.isEmpty() || topK <= 0) {
            return List.of();
        }
        return store.entrySet().stream()
                .filter(e -> !e.getValue().embedding().isEmpty())
                .map(e -> new StoredHit(e.getKey(), e.getValue().value(),
                        SemanticMatcher.cosine(embedding, e.getValue().embedding())))
                .sorted(Comparator.comparingDouble(StoredHit::score).reversed()
                        .thenComparing(StoredHit::key))
                .limit(topK)
                .toList();
    }

    @Override
    public List<StoredValue> scan(String keyPrefix) {
        return store.entrySet().stream()
                .filter(e -> e.getKey().startsWith(keyPrefix))
                .map(e -> new StoredValue(e.getKey(), e.getValue().value(), e.getValue().embedding()))
                .toList();
    }

    @Override
    public boolean delete(String key) {
        return store.remove(key) != null;
    }

    @Override
    public String name() {
        return "in-memory";
    }

    public int size() {
        return store.size();
    }
}
