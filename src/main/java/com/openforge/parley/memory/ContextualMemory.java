package com.openforge.parley.memory;

import com.openforge.parley.config.ParleyProperties.MemoryProperties;
import com.openforge.parley.nlu.IntentCategory;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * One session's memory: its own short-term buffer and preferences, plus a
 * view of the shared long-term store scoped to the session and its user.
 *
 * Lifecycle of a turn:
 *   recordTurn() → buffer (oldest evicted) → preference rules → long-term if important
 *   learnFromFeedback() → preference rules or verbatim FEEDBACK entry → last turn promoted
 */
@Slf4j
public class ContextualMemory {

    static final String META_USER     = "user";
    static final String META_CATEGORY = "category";

    private static final double INTERACTION_IMPORTANCE = 0.7;
    private static final double FEEDBACK_IMPORTANCE    = 0.6;
    private static final double SUMMARY_IMPORTANCE     = 0.5;

    private final String           sessionId;
    private final String           userId;
    private final ShortTermMemory  shortTerm;
    private final UserPreferences  preferences;
    private final LongTermMemory   longTerm;
    private final PreferenceRules  rules;
    private final MemoryProperties properties;

    private final AtomicInteger recordedTurns = new AtomicInteger();
    private final Map<IntentCategory, Integer> categoryCounts = new EnumMap<>(IntentCategory.class);

    public ContextualMemory(String sessionId,
                            String userId,
                            LongTermMemory longTerm,
                            PreferenceRules rules,
                            MemoryProperties properties) {
        this.sessionId   = sessionId;
        this.userId      = userId;
        this.shortTerm   = new ShortTermMemory(properties.shortTermCapacity());
        this.preferences = new UserPreferences(properties.promotionThreshold());
        this.longTerm    = longTerm;
        this.rules       = rules;
        this.properties  = properties;
    }

    // ── Turns ────────────────────────────────────────────────────────────────

    public void recordTurn(Turn turn) {
        shortTerm.add(turn);
        recordedTurns.incrementAndGet();
        synchronized (categoryCounts) {
            categoryCounts.merge(turn.category(), 1, Integer::sum);
        }
        for (PreferenceRules.Observation o : rules.observe(turn.text())) {
            Preference p = preferences.learn(o.category(), o.key(), o.value());
            if (p.observationCount() == preferences.promotionThreshold()) {
                log.info("[Memory] Session {} preference {} became active", sessionId, p.path());
            }
        }
        if (turn.important()) {
            promote(turn);
        }
    }

    // ── Context ──────────────────────────────────────────────────────────────

    public AdaptiveContext getAdaptiveContext(String query) {
        List<Turn> history = shortTerm.turns();
        IntentCategory last = history.isEmpty() ? null : history.get(history.size() - 1).category();
        boolean continuation = history.size() >= 2
                && history.get(history.size() - 2).category() == last;

        List<MemoryRecord> relevant = query == null || query.isBlank() || properties.relevantTopK() == 0
                ? List.of()
                : longTerm.search(query, properties.relevantTopK(), properties.minRelevance(), ownedBySessionOrUser());

        return new AdaptiveContext(sessionId, history, last, continuation,
                preferences.activePreferences(), relevant);
    }

    // ── Feedback ─────────────────────────────────────────────────────────────

    /**
     * Applies feedback on the last answer.
     *
     * @return preferences updated; empty when the feedback matched no rule and
     *         was stored verbatim instead
     */
    public List<Preference> learnFromFeedback(String feedback, FeedbackContext context) {
        List<PreferenceRules.Observation> observations = rules.fromFeedback(feedback, context);
        List<Preference> updated = observations.stream()
                .map(o -> preferences.learn(o.category(), o.key(), o.value()))
                .toList();
        if (updated.isEmpty() && feedback != null && !feedback.isBlank()) {
            longTerm.store(sessionId, MemoryType.FEEDBACK, feedback, ownerMetadata(), FEEDBACK_IMPORTANCE);
            log.debug("[Memory] Unmapped feedback stored verbatim for session {}", sessionId);
        }
        shortTerm.last().ifPresent(this::promote);
        return updated;
    }

    // ── Session end ──────────────────────────────────────────────────────────

    /** Plain-text digest written as a SUMMARY entry when the session ends. */
    public String summarize() {
        String categories;
        synchronized (categoryCounts) {
            categories = categoryCounts.entrySet().stream()
                    .map(e -> e.getKey().name().toLowerCase(Locale.ROOT) + "=" + e.getValue())
                    .collect(Collectors.joining(", "));
        }
        String prefs = preferences.activePreferences().stream()
                .map(p -> p.path() + "=" + p.value())
                .collect(Collectors.joining(", "));
        return "Session %s: %d turns; intents [%s]; preferences [%s]"
                .formatted(sessionId, recordedTurns.get(), categories, prefs);
    }

    public MemoryEntry storeSummary() {
        return longTerm.store(sessionId, MemoryType.SUMMARY, summarize(), ownerMetadata(), SUMMARY_IMPORTANCE);
    }

    // ── Accessors ────────────────────────────────────────────────────────────

    public String sessionId()            { return sessionId; }
    public String userId()               { return userId; }
    public ShortTermMemory shortTerm()   { return shortTerm; }
    public UserPreferences preferences() { return preferences; }
    public int recordedTurns()           { return recordedTurns.get(); }

    // ── Private helpers ──────────────────────────────────────────────────────

    private void promote(Turn turn) {
        Map<String, String> metadata = new HashMap<>(ownerMetadata());
        metadata.put(META_CATEGORY, turn.category().name());
        String content = "User: " + turn.text()
                + (turn.response() == null ? "" : "\nAssistant: " + turn.response());
        longTerm.store(sessionId, MemoryType.INTERACTION, content, metadata, INTERACTION_IMPORTANCE);
    }

    private Map<String, String> ownerMetadata() {
        return userId == null ? Map.of() : Map.of(META_USER, userId);
    }

    private Predicate<MemoryEntry> ownedBySessionOrUser() {
        return e -> sessionId.equals(e.sessionId())
                || (userId != null && userId.equals(e.metadata().get(META_USER)));
    }
}
