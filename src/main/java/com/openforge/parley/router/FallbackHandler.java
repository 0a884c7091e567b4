package com.openforge.parley.router;

import com.openforge.parley.nlu.ExtractedEntity;
import com.openforge.parley.nlu.Intent;

import java.util.Map;

/** Reserved last link. Always accepts, so routing is exhaustive. */
public class FallbackHandler implements IntentHandler {

    public static final String NAME = "fallback";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean canHandle(Intent intent, RoutingContext context) {
        return true;
    }

    @Override
    public HandlerResult handle(Intent intent, Map<String, ExtractedEntity> entities, RoutingContext context) {
        return HandlerResult.of("I don't understand how to help with that yet.",
                Map.of("category", intent.category().name()));
    }
}
