package com.openforge.parley.session;

import com.openforge.parley.MutableClock;
import com.openforge.parley.TestFixtures;
import com.openforge.parley.config.ParleyProperties.MemoryProperties;
import com.openforge.parley.memory.LongTermMemory;
import com.openforge.parley.memory.MemoryEntry;
import com.openforge.parley.memory.MemoryType;
import com.openforge.parley.memory.Preference;
import com.openforge.parley.memory.PreferenceRules;
import com.openforge.parley.memory.Turn;
import com.openforge.parley.memory.Utterance;
import com.openforge.parley.storage.InMemoryPersistenceBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionManagerTest {

    private MutableClock               clock;
    private InMemoryPersistenceBackend backend;
    private LongTermMemory             longTerm;
    private SessionManager             manager;

    @BeforeEach
    void setUp() {
        clock    = MutableClock.startingAt("2026-01-01T10:00:00Z");
        backend  = new InMemoryPersistenceBackend();
        longTerm = new LongTermMemory(TestFixtures.hashingMatcher(), backend, TestFixtures.objectMapper(), clock);
        manager  = new SessionManager(longTerm, backend, new PreferenceRules(), MemoryProperties.defaults(),
                TestFixtures.objectMapper(), clock);
    }

    private static Turn turn(String text, String sessionId) {
        return Turn.of(Utterance.of(text, sessionId), "ok", null, null);
    }

    // =========================================================================
    //  Open / lookup
    // =========================================================================

    @Nested
    @DisplayName("Open and lookup")
    class OpenAndLookup {

        @Test
        @DisplayName("opening an active id returns the same session")
        void reusesActive() {
            Session first = manager.open("s1", "alice", Map.of("channel", "cli"));

            assertThat(manager.open("s1", "alice", null)).isSameAs(first);
            assertThat(first.getMetadata()).containsEntry("channel", "cli");
            assertThat(first.getStartedAt()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("get fails for an unknown id")
        void unknown() {
            assertThatThrownBy(() -> manager.get("nope"))
                    .isInstanceOf(SessionNotFoundException.class)
                    .hasMessageContaining("nope");
            assertThat(manager.find(null)).isEmpty();
        }

        @Test
        @DisplayName("a blank id is rejected")
        void blankId() {
            assertThatThrownBy(() -> manager.open(" ", "alice", null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("a closed id can be reopened and starts fresh")
        void reopenAfterClose() {
            Session first = manager.open("s1", "alice", null);
            first.getMemory().recordTurn(turn("hello", "s1"));
            manager.close("s1");

            Session second = manager.open("s1", "alice", null);

            assertThat(second).isNotSameAs(first);
            assertThat(second.isActive()).isTrue();
            assertThat(second.getMemory().recordedTurns()).isZero();
        }
    }

    // =========================================================================
    //  Close
    // =========================================================================

    @Nested
    @DisplayName("Close")
    class Close {

        @Test
        @DisplayName("close flushes preferences and writes a summary of recorded turns")
        void flushes() {
            Session session = manager.open("s1", "alice", null);
            session.getMemory().recordTurn(turn("show me an example", "s1"));

            Session closed = manager.close("s1");

            assertThat(closed.getStatus()).isEqualTo(SessionStatus.CLOSED);
            assertThat(manager.find("s1")).isEmpty();
            assertThat(backend.scan(SessionManager.PREFS_PREFIX + "alice:")).singleElement()
                    .satisfies(stored -> {
                        assertThat(stored.key()).startsWith("prefs:alice:s1:");
                        assertThat(stored.value()).contains("use_examples");
                    });
            assertThat(longTerm.entriesFor("s1")).extracting(MemoryEntry::type)
                    .containsExactly(MemoryType.SUMMARY);
        }

        @Test
        @DisplayName("a session without turns leaves no summary and no preference record")
        void noTurnsNoSummary() {
            manager.open("s1", "alice", null);
            manager.close("s1");

            assertThat(longTerm.size()).isZero();
            assertThat(backend.scan(SessionManager.PREFS_PREFIX)).isEmpty();
        }

        @Test
        @DisplayName("closing twice fails the second time")
        void closeTwice() {
            manager.open("s1", "alice", null);
            manager.close("s1");

            assertThatThrownBy(() -> manager.close("s1")).isInstanceOf(SessionNotFoundException.class);
        }

        @Test
        @DisplayName("preferences learned in one session carry over to the user's next session")
        void preferencesCarryOver() {
            Session first = manager.open("s1", "alice", null);
            for (int i = 0; i < 3; i++) first.getMemory().recordTurn(turn("give an example", "s1"));
            manager.close("s1");

            Session second = manager.open("s2", "alice", null);

            assertThat(second.getMemory().preferences().isActive("explanation_style", "use_examples")).isTrue();
        }

        @Test
        @DisplayName("two open sessions of one user both keep what they learned, whichever closes last")
        void concurrentSessionsOfOneUser() {
            Session a = manager.open("a", "alice", null);
            Session b = manager.open("b", "alice", null);
            for (int i = 0; i < 3; i++) a.getMemory().recordTurn(turn("show me an example", "a"));
            b.getMemory().recordTurn(turn("explain it step by step", "b"));

            manager.close("a");
            manager.close("b");
            Session c = manager.open("c", "alice", null);

            assertThat(c.getMemory().preferences().isActive("explanation_style", "use_examples")).isTrue();
            assertThat(c.getMemory().preferences().get("explanation_style", "step_by_step", "true"))
                    .get().extracting(Preference::observationCount).isEqualTo(1);
        }

        @Test
        @DisplayName("restored counts are not written again, so they never double")
        void noDoubleCounting() {
            Session first = manager.open("s1", "alice", null);
            first.getMemory().recordTurn(turn("give an example", "s1"));
            manager.close("s1");
            manager.open("s1", "alice", null).getMemory().recordTurn(turn("another example", "s1"));
            manager.close("s1");
            manager.open("s2", "alice", null);
            manager.close("s2");

            Session latest = manager.open("s3", "alice", null);

            assertThat(latest.getMemory().preferences().get("explanation_style", "use_examples", "true"))
                    .get().extracting(Preference::observationCount).isEqualTo(2);
        }

        @Test
        @DisplayName("another user's records are not restored")
        void otherUser() {
            manager.open("s1", "alice", null).getMemory().recordTurn(turn("give an example", "s1"));
            manager.close("s1");

            Session bob = manager.open("s2", "bob", null);

            assertThat(bob.getMemory().preferences().snapshot()).isEmpty();
        }

        @Test
        @DisplayName("anonymous sessions persist preferences under the session id")
        void anonymous() {
            manager.open("s9", null, null).getMemory().recordTurn(turn("show me an example", "s9"));
            manager.close("s9");

            assertThat(backend.scan(SessionManager.PREFS_PREFIX + "s9:")).hasSize(1);
        }
    }

    // =========================================================================
    //  Expiry
    // =========================================================================

    @Nested
    @DisplayName("Idle expiry")
    class Expiry {

        @Test
        @DisplayName("sessions idle past the timeout expire and are removed")
        void expires() {
            Session idle = manager.open("idle", "alice", null);
            manager.open("busy", "bob", null);

            clock.advance(Duration.ofMinutes(20));
            manager.get("busy").touch(clock.instant());
            clock.advance(Duration.ofMinutes(11));

            assertThat(manager.expireIdle(clock.instant())).containsExactly("idle");
            assertThat(idle.getStatus()).isEqualTo(SessionStatus.EXPIRED);
            assertThat(manager.find("idle")).isEmpty();
            assertThat(manager.find("busy")).isPresent();
        }

        @Test
        @DisplayName("exactly at the timeout a session is still open")
        void boundary() {
            manager.open("s1", "alice", null);
            clock.advance(Duration.ofMinutes(30));

            assertThat(manager.expireIdle(clock.instant())).isEmpty();
        }

        @Test
        @DisplayName("the scheduled sweep uses the manager's clock")
        void sweep() {
            manager.open("s1", "alice", null);
            clock.advance(Duration.ofHours(1));

            manager.sweep();

            assertThat(manager.openSessions()).isEmpty();
        }
    }
}
