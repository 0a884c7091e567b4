package com.openforge.parley.memory;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A single long-term memory entry.
 *
 * @param sessionId  the session that created it
 * @param embedding  empty when the embedding provider was unavailable at store time
 * @param importance 0.0 – 1.0; higher survives relevance pruning
 */
public record MemoryEntry(
        String              id,
        String              sessionId,
        MemoryType          type,
        String              content,
        List<Float>         embedding,
        Map<String, String> metadata,
        double              importance,
        Instant             createdAt
) {
    public MemoryEntry {
        embedding  = embedding == null ? List.of() : List.copyOf(embedding);
        metadata   = metadata == null ? Map.of() : Map.copyOf(metadata);
        importance = Math.max(0.0, Math.min(1.0, importance));
    }

    public boolean isSearchable() {
        return !embedding.isEmpty();
    }
}
