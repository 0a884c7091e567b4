package com.openforge.parley.conversation;

import com.openforge.parley.decompose.ExecutionPlan;
import com.openforge.parley.decompose.QueryDecomposer;
import com.openforge.parley.decompose.Task;
import com.openforge.parley.decompose.TaskStatus;
import com.openforge.parley.memory.AdaptiveContext;
import com.openforge.parley.memory.ContextualMemory;
import com.openforge.parley.memory.FeedbackContext;
import com.openforge.parley.memory.Preference;
import com.openforge.parley.memory.Turn;
import com.openforge.parley.memory.Utterance;
import com.openforge.parley.nlu.ClassificationContext;
import com.openforge.parley.nlu.ExtractedEntity;
import com.openforge.parley.nlu.Intent;
import com.openforge.parley.nlu.IntentClassifier;
import com.openforge.parley.nlu.Sentiment;
import com.openforge.parley.nlu.SentimentAnalyzer;
import com.openforge.parley.router.IntentRouter;
import com.openforge.parley.router.RouteResult;
import com.openforge.parley.router.RoutingContext;
import com.openforge.parley.session.Session;
import com.openforge.parley.session.SessionClosedException;
import com.openforge.parley.session.SessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Entry point of the core. Runs one utterance through the whole pipeline:
 *
 *   1. SENTIMENT  mood of the raw utterance (side channel, never blocks)
 *   2. DECOMPOSE  split into subtasks
 *   3. PLAN       order subtasks by their dependencies
 *   4. per task, in plan order:
 *        CLASSIFY with the session's adaptive context
 *        ROUTE     to the first accepting handler
 *        RECORD    the turn in session memory
 *
 * The whole utterance runs under the session lock, so one session's
 * utterances never interleave. The session status is checked before each
 * stage; once the session is closed or expired the remaining tasks are
 * marked SKIPPED and nothing more is written to memory. Handler effects that
 * already happened are not undone.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationService {

    private final SessionManager    sessionManager;
    private final SentimentAnalyzer sentimentAnalyzer;
    private final QueryDecomposer   decomposer;
    private final IntentClassifier  classifier;
    private final IntentRouter      router;
    private final Clock             clock;

    // ── Pipeline ─────────────────────────────────────────────────────────────

    /**
     * @throws com.openforge.parley.session.SessionNotFoundException if the session is not open
     * @throws SessionClosedException if the session ended before processing started
     */
    public ConversationResult process(String sessionId, String text) {
        Session session = sessionManager.get(sessionId);
        session.getLock().lock();
        try {
            requireActive(session);

            Sentiment sentiment = sentimentAnalyzer.analyze(text);
            List<Task> tasks = decomposer.decompose(text);
            if (tasks.isEmpty()) {
                // blank input still gets an answer, from the clarification handler
                tasks = List.of(Task.simple(text == null ? "" : text.trim()));
            }
            ExecutionPlan plan = decomposer.createExecutionPlan(tasks);
            if (!session.isActive()) {
                return cancelled(session, sentiment, tasks, plan, List.of());
            }

            Map<Integer, Task> byIndex = new HashMap<>();
            tasks.forEach(t -> byIndex.put(t.index(), t));

            List<TaskOutcome> outcomes = new ArrayList<>(tasks.size());
            for (int index : plan.executionOrder()) {
                Task task = byIndex.get(index);
                if (!session.isActive()) {
                    return cancelled(session, sentiment, tasks, plan, outcomes);
                }
                outcomes.add(handle(session, task, sentiment));
            }
            session.touch(clock.instant());

            log.debug("[Conversation] {} '{}' → {} task(s), mood {}", sessionId, abbreviate(text),
                    tasks.size(), sentiment.mood());
            return new ConversationResult(sessionId, sentiment, tasks, plan, outcomes, false);
        } finally {
            session.getLock().unlock();
        }
    }

    // ── Individual operations ────────────────────────────────────────────────

    public Intent classifyIntent(String text, ClassificationContext context) {
        return classifier.classify(text, context);
    }

    public List<Task> decomposeQuery(String text) {
        return decomposer.decompose(text);
    }

    public RouteResult route(Intent intent, Map<String, ExtractedEntity> entities, RoutingContext context) {
        return router.route(intent, entities, context);
    }

    /** Adaptive context with long-term entries relevant to the session's latest turn. */
    public AdaptiveContext getContext(String sessionId) {
        ContextualMemory memory = sessionManager.get(sessionId).getMemory();
        String query = memory.shortTerm().last().map(Turn::text).orElse(null);
        return memory.getAdaptiveContext(query);
    }

    public AdaptiveContext getContext(String sessionId, String query) {
        return sessionManager.get(sessionId).getMemory().getAdaptiveContext(query);
    }

    /** @throws SessionClosedException if the session is no longer active */
    public void recordTurn(String sessionId, Turn turn) {
        Session session = sessionManager.get(sessionId);
        withLock(session, () -> {
            requireActive(session);
            session.getMemory().recordTurn(turn);
            session.touch(clock.instant());
            return null;
        });
    }

    public List<Preference> learnFromFeedback(String sessionId, String feedback, FeedbackContext context) {
        Session session = sessionManager.get(sessionId);
        return withLock(session, () -> {
            requireActive(session);
            session.touch(clock.instant());
            return session.getMemory().learnFromFeedback(feedback, context == null ? FeedbackContext.none() : context);
        });
    }

    public Session openSession(String sessionId, String userId, Map<String, String> metadata) {
        return sessionManager.open(sessionId, userId, metadata);
    }

    public Session closeSession(String sessionId) {
        return sessionManager.close(sessionId);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private TaskOutcome handle(Session session, Task task, Sentiment sentiment) {
        ContextualMemory memory = session.getMemory();
        AdaptiveContext context = memory.getAdaptiveContext(task.text());
        Intent intent = classifier.classify(task.text(), context.toClassificationContext());

        RoutingContext routing = new RoutingContext(session.getId(), task.text(), context, sentiment);
        RouteResult route = router.route(intent, intent.entities(), routing);

        // re-checked: the session may have ended while the handler ran; blank input is not remembered
        if (session.isActive() && !task.text().isBlank()) {
            Utterance utterance = new Utterance(task.text(), clock.instant(), session.getId());
            memory.recordTurn(Turn.of(utterance, route.result().response(), intent, sentiment));
        }
        return new TaskOutcome(task.withStatus(TaskStatus.COMPLETED), intent, route);
    }

    private ConversationResult cancelled(Session session, Sentiment sentiment, List<Task> tasks,
                                         ExecutionPlan plan, List<TaskOutcome> done) {
        List<TaskOutcome> outcomes = new ArrayList<>(done);
        for (int index : plan.executionOrder().subList(done.size(), plan.executionOrder().size())) {
            tasks.stream()
                    .filter(t -> t.index() == index)
                    .findFirst()
                    .ifPresent(t -> outcomes.add(new TaskOutcome(t.withStatus(TaskStatus.SKIPPED), null, null)));
        }
        log.info("[Conversation] Session {} ended mid-turn ({}); {} task(s) skipped",
                session.getId(), session.getStatus(), outcomes.size() - done.size());
        return new ConversationResult(session.getId(), sentiment, tasks, plan, outcomes, true);
    }

    private static void requireActive(Session session) {
        if (!session.isActive()) {
            throw new SessionClosedException(session.getId(), session.getStatus());
        }
    }

    private static <T> T withLock(Session session, Supplier<T> action) {
        session.getLock().lock();
        try {
            return action.get();
        } finally {
            session.getLock().unlock();
        }
    }

    private static String abbreviate(String text) {
        if (text == null) return "";
        return text.length() <= 60 ? text : text.substring(0, 60) + "...";
    }
}
