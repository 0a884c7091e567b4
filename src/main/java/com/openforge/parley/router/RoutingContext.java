package com.openforge.parley.router;

import com.openforge.parley.memory.AdaptiveContext;
import com.openforge.parley.nlu.Sentiment;

/**
 * Per-call routing input beyond the intent itself.
 *
 * @param taskText the (sub)task text being routed
 * @param memory   adaptive context of the session, may be empty
 */
public record RoutingContext(String sessionId, String taskText, AdaptiveContext memory, Sentiment sentiment) {

    public RoutingContext {
        memory    = memory == null ? AdaptiveContext.empty(sessionId) : memory;
        sentiment = sentiment == null ? Sentiment.neutral() : sentiment;
    }

    public static RoutingContext of(String sessionId, String taskText) {
        return new RoutingContext(sessionId, taskText, null, null);
    }
}
