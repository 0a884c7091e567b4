package com.openforge.parley.router;

import java.util.Map;

/**
 * What a handler produced.
 *
 * @param clarification the response asks the user for more information
 */
public record HandlerResult(String response, Map<String, Object> data, boolean clarification) {

    public HandlerResult {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static HandlerResult of(String response) {
        return new HandlerResult(response, Map.of(), false);
    }

    public static HandlerResult of(String response, Map<String, Object> data) {
        return new HandlerResult(response, data, false);
    }

    public static HandlerResult clarification(String question) {
        return new HandlerResult(question, Map.of(), true);
    }
}
