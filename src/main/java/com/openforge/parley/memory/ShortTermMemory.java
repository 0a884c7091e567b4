package com.openforge.parley.memory;

import com.openforge.parley.nlu.IntentCategory;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-capacity, ordered turn buffer. Adding to a full buffer evicts the
 * oldest turn. The size never exceeds the capacity.
 */
public class ShortTermMemory {

    private final int capacity;
    private final ArrayDeque<Turn> turns;

    public ShortTermMemory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
        this.turns    = new ArrayDeque<>(capacity);
    }

    /** @return the evicted turn, if the buffer was full */
    public synchronized Optional<Turn> add(Turn turn) {
        Turn evicted = turns.size() == capacity ? turns.pollFirst() : null;
        turns.addLast(turn);
        return Optional.ofNullable(evicted);
    }

    /** Oldest first. */
    public synchronized List<Turn> turns() {
        return List.copyOf(turns);
    }

    public synchronized Optional<Turn> last() {
        return Optional.ofNullable(turns.peekLast());
    }

    /** True iff the last turn's intent category equals {@code candidate}. */
    public synchronized boolean isTopicContinuation(IntentCategory candidate) {
        Turn last = turns.peekLast();
        return last != null && candidate != null && last.category() == candidate;
    }

    public synchronized int size() {
        return turns.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized void clear() {
        turns.clear();
    }
}
