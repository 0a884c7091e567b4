package com.openforge.parley.router;

import com.openforge.parley.nlu.EntityType;
import com.openforge.parley.nlu.ExtractedEntity;
import com.openforge.parley.nlu.Intent;
import com.openforge.parley.nlu.IntentCategory;
import com.openforge.parley.nlu.IntentSource;
import com.openforge.parley.nlu.SlotValue;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IntentRouterTest {

    private SimpleMeterRegistry registry;
    private IntentRouter        router;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        router   = new IntentRouter(new ClarificationHandler(0.6), new FallbackHandler(), registry);
    }

    private static Intent intent(IntentCategory category, double confidence) {
        return new Intent(category, confidence, Map.of(), Map.of(), IntentSource.PATTERN);
    }

    private static IntentHandler webSearch() {
        return IntentHandler.forCategories("web-search", Set.of(IntentCategory.FETCH),
                (intent, entities, ctx) -> HandlerResult.of("searching for " + ctx.taskText()));
    }

    private static IntentHandler throwing(String name) {
        return IntentHandler.forCategories(name, Set.of(IntentCategory.FETCH),
                (intent, entities, ctx) -> { throw new IllegalStateException("boom"); });
    }

    // =========================================================================
    //  Dispatch
    // =========================================================================

    @Nested
    @DisplayName("Dispatch")
    class Dispatch {

        @Test
        @DisplayName("a low-confidence fetch intent is clarified, not searched")
        void lowConfidenceClarified() {
            router.register(webSearch());

            RouteResult result = router.route(intent(IntentCategory.FETCH, 0.3), null,
                    RoutingContext.of("s1", "look up rust"));

            assertThat(result.handledBy()).isEqualTo(ClarificationHandler.NAME);
            assertThat(result.isClarification()).isTrue();
            assertThat(result.result().response()).isEqualTo("Just to be sure, is this a fetch request?");
            assertThat(result.confidence()).isEqualTo(0.3);
        }

        @Test
        @DisplayName("a confident fetch intent reaches the registered handler")
        void confidentHandled() {
            router.register(webSearch());

            RouteResult result = router.route(intent(IntentCategory.FETCH, 0.9), null,
                    RoutingContext.of("s1", "look up rust"));

            assertThat(result.handledBy()).isEqualTo("web-search");
            assertThat(result.result().response()).isEqualTo("searching for look up rust");
        }

        @Test
        @DisplayName("a missing required slot is asked for by name")
        void missingSlot() {
            Intent fetch = new Intent(IntentCategory.FETCH, 0.9, Map.of(),
                    Map.of("url", new SlotValue("url", null, true, EntityType.URL)), IntentSource.PATTERN);

            RouteResult result = router.route(fetch, null, null);

            assertThat(result.handledBy()).isEqualTo(ClarificationHandler.NAME);
            assertThat(result.result().response()).isEqualTo("Could you tell me the url?");
            assertThat(result.result().data()).containsEntry("missingSlots", List.of("url"));
        }

        @Test
        @DisplayName("an unknown intent asks the user to rephrase")
        void unknownIntent() {
            RouteResult result = router.route(null, null, null);

            assertThat(result.handledBy()).isEqualTo(ClarificationHandler.NAME);
            assertThat(result.result().response()).startsWith("Sorry, I didn't quite get that");
        }

        @Test
        @DisplayName("a confident intent nobody claims reaches the fallback")
        void fallback() {
            RouteResult result = router.route(intent(IntentCategory.MATH, 0.95), null, null);

            assertThat(result.handledBy()).isEqualTo(FallbackHandler.NAME);
            assertThat(result.isClarification()).isFalse();
            assertThat(result.result().data()).containsEntry("category", "MATH");
        }
    }

    // =========================================================================
    //  Failures
    // =========================================================================

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("a throwing handler is skipped and counted")
        void throwingSkipped() {
            router.register(throwing("flaky"));
            router.register(webSearch());

            RouteResult result = router.route(intent(IntentCategory.FETCH, 0.9), null, RoutingContext.of("s1", "x"));

            assertThat(result.handledBy()).isEqualTo("web-search");
            assertThat(router.stats("flaky")).get().satisfies(s -> {
                assertThat(s.failures()).isEqualTo(1);
                assertThat(s.calls()).isZero();
            });
            assertThat(registry.counter(IntentRouter.METRIC_FAILURES, "handler", "flaky").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("a canHandle exception counts as declining")
        void canHandleThrows() {
            IntentHandler broken = mock(IntentHandler.class);
            when(broken.name()).thenReturn("broken");
            when(broken.canHandle(any(), any())).thenThrow(new IllegalArgumentException("bad"));
            router.register(broken);

            RouteResult result = router.route(intent(IntentCategory.CODE, 0.9), null, null);

            assertThat(result.handledBy()).isEqualTo(FallbackHandler.NAME);
            verify(broken, never()).handle(any(), any(), any());
            assertThat(router.stats("broken")).get().extracting(HandlerStats.Snapshot::failures).isEqualTo(1L);
        }

        @Test
        @DisplayName("a null result is a handler failure")
        void nullResult() {
            router.register(IntentHandler.forCategories("silent", Set.of(IntentCategory.CODE),
                    (intent, entities, ctx) -> null));

            assertThat(router.route(intent(IntentCategory.CODE, 0.9), null, null).handledBy())
                    .isEqualTo(FallbackHandler.NAME);
            assertThat(router.stats("silent")).get().extracting(HandlerStats.Snapshot::failures).isEqualTo(1L);
        }

        @Test
        @DisplayName("the fallback failing is a routing error")
        void fallbackFails() {
            FallbackHandler broken = new FallbackHandler() {
                @Override
                public HandlerResult handle(Intent intent, Map<String, ExtractedEntity> e, RoutingContext ctx) {
                    throw new IllegalStateException("down");
                }
            };
            IntentRouter r = new IntentRouter(new ClarificationHandler(0.6), broken, registry);

            assertThatThrownBy(() -> r.route(intent(IntentCategory.MATH, 0.9), null, null))
                    .isInstanceOf(RoutingException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("a chain without the reserved ends is rejected")
        void badChain() {
            assertThatThrownBy(() -> new IntentRouter(List.of(new FallbackHandler(), new ClarificationHandler(0.6)),
                    registry)).isInstanceOf(RoutingException.class);
            assertThatThrownBy(() -> new IntentRouter(List.of(new ClarificationHandler(0.6)), registry))
                    .isInstanceOf(RoutingException.class);
        }
    }

    // =========================================================================
    //  Registration
    // =========================================================================

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("handlers are appended before the fallback")
        void appendBeforeFallback() {
            router.register(webSearch());
            router.register(new ConversationalHandler());

            assertThat(router.handlerNames())
                    .containsExactly("clarification", "web-search", "conversational", "fallback");
        }

        @Test
        @DisplayName("a position inserts between the reserved handlers")
        void position() {
            router.register(webSearch());
            router.register(new ConversationalHandler(), 1);

            assertThat(router.handlerNames())
                    .containsExactly("clarification", "conversational", "web-search", "fallback");
        }

        @Test
        @DisplayName("reserved positions, reserved types and duplicate names are rejected")
        void rejected() {
            router.register(webSearch());

            assertThatThrownBy(() -> router.register(new ConversationalHandler(), 0))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> router.register(new ConversationalHandler(), 3))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> router.register(new FallbackHandler()))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> router.register(webSearch()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("web-search");
        }

        @Test
        @DisplayName("remove drops a handler but never a reserved one")
        void remove() {
            router.register(webSearch());

            assertThat(router.remove("web-search")).isTrue();
            assertThat(router.remove("web-search")).isFalse();
            assertThat(router.handlerNames()).containsExactly("clarification", "fallback");
            assertThatThrownBy(() -> router.remove("fallback")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> router.remove("clarification")).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("successful calls are timed per handler")
    void metrics() {
        router.register(webSearch());
        router.route(intent(IntentCategory.FETCH, 0.9), null, RoutingContext.of("s1", "a"));
        router.route(intent(IntentCategory.FETCH, 0.9), null, RoutingContext.of("s1", "b"));

        Timer timer = registry.find(IntentRouter.METRIC_HANDLER)
                .tag("handler", "web-search").tag("outcome", "success").timer();

        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(router.stats("web-search")).get().extracting(HandlerStats.Snapshot::calls).isEqualTo(2L);
        assertThat(router.allStats()).containsOnlyKeys("web-search");
    }
}
