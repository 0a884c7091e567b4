package com.openforge.parley.memory;

/**
 * A long-term memory entry returned from a search.
 *
 * @param score cosine similarity to the query (0.0 – 1.0)
 */
public record MemoryRecord(MemoryEntry entry, double score) {

    public String content() {
        return entry.content();
    }

    public MemoryType type() {
        return entry.type();
    }
}
