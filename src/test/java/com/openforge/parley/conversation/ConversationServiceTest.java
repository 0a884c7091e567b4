package com.openforge.parley.conversation;

import com.openforge.parley.MutableClock;
import com.openforge.parley.TestFixtures;
import com.openforge.parley.config.ParleyProperties.MemoryProperties;
import com.openforge.parley.decompose.QueryDecomposer;
import com.openforge.parley.decompose.TaskStatus;
import com.openforge.parley.memory.AdaptiveContext;
import com.openforge.parley.memory.LongTermMemory;
import com.openforge.parley.memory.Preference;
import com.openforge.parley.memory.PreferenceRules;
import com.openforge.parley.memory.Turn;
import com.openforge.parley.memory.Utterance;
import com.openforge.parley.nlu.IntentCategory;
import com.openforge.parley.nlu.SentimentAnalyzer;
import com.openforge.parley.router.ClarificationHandler;
import com.openforge.parley.router.ConversationalHandler;
import com.openforge.parley.router.FallbackHandler;
import com.openforge.parley.router.HandlerResult;
import com.openforge.parley.router.IntentHandler;
import com.openforge.parley.router.IntentRouter;
import com.openforge.parley.session.SessionManager;
import com.openforge.parley.session.SessionNotFoundException;
import com.openforge.parley.session.SessionStatus;
import com.openforge.parley.storage.InMemoryPersistenceBackend;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationServiceTest {

    private MutableClock        clock;
    private SessionManager      sessions;
    private IntentRouter        router;
    private ConversationService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T10:00:00Z");
        InMemoryPersistenceBackend backend = new InMemoryPersistenceBackend();
        LongTermMemory longTerm = new LongTermMemory(TestFixtures.hashingMatcher(), backend,
                TestFixtures.objectMapper(), clock);
        sessions = new SessionManager(longTerm, backend, new PreferenceRules(), MemoryProperties.defaults(),
                TestFixtures.objectMapper(), clock);
        router = new IntentRouter(new ClarificationHandler(0.6), new FallbackHandler(), new SimpleMeterRegistry());
        router.register(new ConversationalHandler());
        service = new ConversationService(sessions, new SentimentAnalyzer(), new QueryDecomposer(),
                TestFixtures.classifier(), router, clock);
        service.openSession("s1", "alice", null);
    }

    // =========================================================================
    //  Pipeline
    // =========================================================================

    @Nested
    @DisplayName("Processing an utterance")
    class Process {

        @Test
        @DisplayName("small talk is answered by the conversational handler and remembered")
        void smallTalk() {
            ConversationResult result = service.process("s1", "thank you");

            assertThat(result.cancelled()).isFalse();
            assertThat(result.outcomes()).singleElement().satisfies(o -> {
                assertThat(o.route().handledBy()).isEqualTo(ConversationalHandler.NAME);
                assertThat(o.intent().category()).isEqualTo(IntentCategory.CONVERSATIONAL);
                assertThat(o.task().status()).isEqualTo(TaskStatus.COMPLETED);
            });
            assertThat(result.response()).isEqualTo("You're welcome! Happy to help.");
            assertThat(sessions.get("s1").getMemory().recordedTurns()).isEqualTo(1);
        }

        @Test
        @DisplayName("a sequential utterance runs each subtask in order and records one turn per task")
        void compound() {
            ConversationResult result = service.process("s1", "search for rust tutorials then thank you");

            assertThat(result.tasks()).hasSize(2);
            assertThat(result.plan().executionOrder()).containsExactly(0, 1);
            assertThat(result.outcomes()).extracting(o -> o.route().handledBy())
                    .containsExactly(FallbackHandler.NAME, ConversationalHandler.NAME);
            assertThat(service.getContext("s1").shortTermHistory()).extracting(Turn::text)
                    .containsExactly("search for rust tutorials", "thank you");
        }

        @Test
        @DisplayName("blank input is answered by the clarification handler and not remembered")
        void blankInput() {
            ConversationResult result = service.process("s1", "   ");

            assertThat(result.outcomes()).singleElement().satisfies(o -> {
                assertThat(o.intent().isUnknown()).isTrue();
                assertThat(o.route().handledBy()).isEqualTo(ClarificationHandler.NAME);
                assertThat(o.route().isClarification()).isTrue();
            });
            assertThat(result.response()).isEqualTo("Sorry, I didn't quite get that. Could you rephrase it?");
            assertThat(sessions.get("s1").getMemory().recordedTurns()).isZero();
        }

        @Test
        @DisplayName("processing touches the session")
        void touches() {
            clock.advance(Duration.ofMinutes(10));
            service.process("s1", "thank you");

            assertThat(sessions.get("s1").getLastActivityAt()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("a session closed mid-turn skips the remaining tasks and records nothing more")
        void closedMidTurn() {
            router.register(IntentHandler.forCategories("closer", Set.of(IntentCategory.FETCH),
                    (intent, entities, ctx) -> {
                        sessions.close(ctx.sessionId());
                        return HandlerResult.of("closing");
                    }));
            var session = sessions.get("s1");

            ConversationResult result = service.process("s1", "search for rust tutorials then thank you");

            assertThat(result.cancelled()).isTrue();
            assertThat(result.outcomes()).hasSize(2);
            assertThat(result.outcomes().get(0).response()).isEqualTo("closing");
            assertThat(result.outcomes().get(1).isHandled()).isFalse();
            assertThat(result.outcomes().get(1).task().status()).isEqualTo(TaskStatus.SKIPPED);
            assertThat(session.getStatus()).isEqualTo(SessionStatus.CLOSED);
            assertThat(session.getMemory().recordedTurns()).isZero();
        }

        @Test
        @DisplayName("an unknown or closed session is rejected")
        void unknownSession() {
            service.closeSession("s1");

            assertThatThrownBy(() -> service.process("s1", "hello"))
                    .isInstanceOf(SessionNotFoundException.class);
        }
    }

    // =========================================================================
    //  Individual operations
    // =========================================================================

    @Nested
    @DisplayName("Individual operations")
    class Operations {

        @Test
        @DisplayName("recorded turns feed the adaptive context")
        void recordTurn() {
            service.recordTurn("s1", Turn.of(new Utterance("2 + 2", clock.instant(), "s1"), "4",
                    service.classifyIntent("2 + 2", null), null));

            AdaptiveContext context = service.getContext("s1");

            assertThat(context.lastCategory()).isEqualTo(IntentCategory.MATH);
            assertThat(context.shortTermHistory()).hasSize(1);
        }

        @Test
        @DisplayName("recording into an ended session fails")
        void recordIntoEnded() {
            var session = sessions.get("s1");
            Turn turn = Turn.of(new Utterance("hi", clock.instant(), "s1"), "hello", null, null);
            service.closeSession("s1");

            assertThatThrownBy(() -> service.recordTurn("s1", turn))
                    .isInstanceOf(SessionNotFoundException.class);
            assertThat(session.isActive()).isFalse();
        }

        @Test
        @DisplayName("feedback updates the session's preferences")
        void feedback() {
            service.process("s1", "explain python decorators");

            List<Preference> updated = service.learnFromFeedback("s1", "that was too long", null);

            assertThat(updated).extracting(Preference::path).containsExactly("explanation_style.concise");
        }

        @Test
        @DisplayName("decomposeQuery and route are exposed on their own")
        void standalone() {
            assertThat(service.decomposeQuery("compare java and kotlin")).hasSize(2);
            assertThat(service.route(null, null, null).handledBy()).isEqualTo(ClarificationHandler.NAME);
        }
    }
}
