package com.openforge.parley.memory;

import com.openforge.parley.nlu.ClassificationContext;
import com.openforge.parley.nlu.IntentCategory;

import java.util.List;

/**
 * Everything the classifier and handlers may know about a session when
 * answering {@code query}.
 *
 * @param lastCategory        category of the most recent turn, or {@code null}
 * @param isTopicContinuation the two most recent turns share a category
 * @param relevantLongTerm    nearest long-term entries for the query
 */
public record AdaptiveContext(String sessionId,
                              List<Turn> shortTermHistory,
                              IntentCategory lastCategory,
                              boolean isTopicContinuation,
                              List<Preference> activePreferences,
                              List<MemoryRecord> relevantLongTerm) {

    public AdaptiveContext {
        shortTermHistory  = List.copyOf(shortTermHistory);
        activePreferences = List.copyOf(activePreferences);
        relevantLongTerm  = List.copyOf(relevantLongTerm);
    }

    public static AdaptiveContext empty(String sessionId) {
        return new AdaptiveContext(sessionId, List.of(), null, false, List.of(), List.of());
    }

    public ClassificationContext toClassificationContext() {
        return ClassificationContext.after(lastCategory);
    }

    public boolean hasActivePreference(String category, String key) {
        return activePreferences.stream()
                .anyMatch(p -> p.category().equals(category) && p.key().equals(key));
    }
}
