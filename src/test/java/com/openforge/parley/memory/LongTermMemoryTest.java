package com.openforge.parley.memory;

import com.openforge.parley.MutableClock;
import com.openforge.parley.TestFixtures;
import com.openforge.parley.storage.InMemoryPersistenceBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LongTermMemoryTest {

    private MutableClock               clock;
    private InMemoryPersistenceBackend backend;
    private LongTermMemory             memory;

    @BeforeEach
    void setUp() {
        clock   = MutableClock.startingAt("2026-01-01T10:00:00Z");
        backend = new InMemoryPersistenceBackend();
        memory  = new LongTermMemory(TestFixtures.hashingMatcher(), backend, TestFixtures.objectMapper(), clock);
    }

    private MemoryEntry store(String session, String content, double importance) {
        MemoryEntry entry = memory.store(session, MemoryType.FACT, content, Map.of(), importance);
        clock.advance(Duration.ofMinutes(1));
        return entry;
    }

    // =========================================================================
    //  Store and search
    // =========================================================================

    @Nested
    @DisplayName("Store and search")
    class StoreAndSearch {

        @Test
        @DisplayName("stored entries are embedded and written through to the backend")
        void writeThrough() {
            MemoryEntry entry = store("s1", "the user prefers dark mode", 0.8);

            assertThat(entry.isSearchable()).isTrue();
            assertThat(entry.createdAt()).isEqualTo(clock.instant().minus(Duration.ofMinutes(1)));
            assertThat(backend.load(LongTermMemory.KEY_PREFIX + entry.id()))
                    .hasValueSatisfying(json -> assertThat(json).contains("the user prefers dark mode"));
        }

        @Test
        @DisplayName("search returns the nearest entries first")
        void nearestFirst() {
            store("s1", "the user prefers dark mode", 0.5);
            store("s1", "python decorators wrap functions", 0.5);
            store("s1", "the capital of france is paris", 0.5);

            List<MemoryRecord> hits = memory.search("python decorators", 2);

            assertThat(hits).hasSize(2);
            assertThat(hits.get(0).content()).isEqualTo("python decorators wrap functions");
            assertThat(hits.get(0).score()).isGreaterThan(hits.get(1).score());
        }

        @Test
        @DisplayName("filter and minimum score narrow the hits")
        void filtered() {
            store("s1", "python decorators wrap functions", 0.5);
            store("s2", "python decorators are syntactic sugar", 0.5);

            List<MemoryRecord> hits = memory.search("python decorators", 5, 0.1, e -> e.sessionId().equals("s2"));

            assertThat(hits).singleElement()
                    .extracting(MemoryRecord::content).isEqualTo("python decorators are syntactic sugar");
            assertThat(memory.search("python decorators", 5, 1.01, e -> true)).isEmpty();
        }

        @Test
        @DisplayName("an entry stored while embeddings are down is kept but not searchable")
        void degradedStore() {
            LongTermMemory degraded = new LongTermMemory(TestFixtures.failingMatcher(), backend,
                    TestFixtures.objectMapper(), clock);

            MemoryEntry entry = degraded.store("s1", MemoryType.FACT, "remember me", Map.of(), 0.5);

            assertThat(entry.isSearchable()).isFalse();
            assertThat(degraded.size()).isEqualTo(1);
            assertThat(degraded.search("remember me", 3)).isEmpty();
        }

        @Test
        @DisplayName("a store built over an existing backend reloads and searches earlier entries")
        void reloadedAfterRestart() {
            MemoryEntry fact = store("s1", "the user prefers dark mode", 0.8);
            backend.save("prefs:alice", "[]", null);

            LongTermMemory restarted = new LongTermMemory(TestFixtures.hashingMatcher(), backend,
                    TestFixtures.objectMapper(), clock);

            assertThat(restarted.entries()).singleElement().satisfies(e -> {
                assertThat(e.id()).isEqualTo(fact.id());
                assertThat(e.type()).isEqualTo(MemoryType.FACT);
                assertThat(e.createdAt()).isEqualTo(fact.createdAt());
                assertThat(e.embedding()).isEqualTo(fact.embedding());
            });
            assertThat(restarted.search("dark mode", 3)).extracting(MemoryRecord::content)
                    .containsExactly("the user prefers dark mode");
        }

        @Test
        @DisplayName("unreadable stored rows are skipped on reload")
        void unreadableSkipped() {
            store("s1", "kept", 0.5);
            backend.save(LongTermMemory.KEY_PREFIX + "broken", "not json", null);

            LongTermMemory restarted = new LongTermMemory(TestFixtures.hashingMatcher(), backend,
                    TestFixtures.objectMapper(), clock);

            assertThat(restarted.entries()).extracting(MemoryEntry::content).containsExactly("kept");
        }

        @Test
        @DisplayName("entriesFor returns only the given session's entries")
        void entriesFor() {
            store("s1", "one", 0.5);
            store("s2", "two", 0.5);

            assertThat(memory.entriesFor("s2")).extracting(MemoryEntry::content).containsExactly("two");
        }
    }

    // =========================================================================
    //  Prune and consolidate
    // =========================================================================

    @Nested
    @DisplayName("Prune and consolidate")
    class PruneAndConsolidate {

        @Test
        @DisplayName("prune by age removes older entries from memory and backend")
        void pruneByAge() {
            MemoryEntry old = store("s1", "old fact", 0.5);
            clock.advance(Duration.ofDays(2));
            store("s1", "new fact", 0.5);

            int removed = memory.prune(Duration.ofDays(1));

            assertThat(removed).isEqualTo(1);
            assertThat(memory.entries()).extracting(MemoryEntry::content).containsExactly("new fact");
            assertThat(backend.load(LongTermMemory.KEY_PREFIX + old.id())).isEmpty();
        }

        @Test
        @DisplayName("prune by count keeps the most important entries")
        void pruneKeepsMostImportant() {
            store("s1", "low", 0.1);
            store("s1", "high", 0.9);
            store("s1", "mid", 0.5);

            assertThat(memory.prune(2, true)).isEqualTo(1);
            assertThat(memory.entries()).extracting(MemoryEntry::content).containsExactly("high", "mid");
        }

        @Test
        @DisplayName("prune by count without relevance keeps the newest entries")
        void pruneKeepsNewest() {
            store("s1", "first", 0.9);
            store("s1", "second", 0.1);
            store("s1", "third", 0.1);

            memory.prune(2, false);

            assertThat(memory.entries()).extracting(MemoryEntry::content).containsExactly("second", "third");
        }

        @Test
        @DisplayName("prune by count is a no-op under the limit and rejects negatives")
        void pruneBounds() {
            store("s1", "only", 0.5);

            assertThat(memory.prune(5, true)).isZero();
            assertThatThrownBy(() -> memory.prune(-1, true)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("consolidate merges duplicates of the same type, keeping the earliest")
        void consolidate() {
            MemoryEntry first = store("s1", "User likes  Examples", 0.5);
            store("s1", "user likes examples", 0.5);
            memory.store("s1", MemoryType.FEEDBACK, "user likes examples", Map.of(), 0.5);

            int removed = memory.consolidate();

            assertThat(removed).isEqualTo(1);
            assertThat(memory.entries()).extracting(MemoryEntry::id).contains(first.id());
            assertThat(memory.size()).isEqualTo(2);
        }
    }
}
