package com.openforge.parley.router;

import com.openforge.parley.nlu.ExtractedEntity;
import com.openforge.parley.nlu.Intent;
import com.openforge.parley.nlu.IntentCategory;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * A link in the routing chain. Handlers are asked in priority order; the
 * first whose {@link #canHandle} returns true handles the intent.
 *
 * A handler that throws from either method is treated as unable to handle.
 */
public interface IntentHandler {

    /** Unique within a router. */
    String name();

    boolean canHandle(Intent intent, RoutingContext context);

    HandlerResult handle(Intent intent, Map<String, ExtractedEntity> entities, RoutingContext context);

    /** Handler body supplied by an external integration. */
    @FunctionalInterface
    interface HandlerFunction {
        HandlerResult apply(Intent intent, Map<String, ExtractedEntity> entities, RoutingContext context);
    }

    /** Adapts a function into a handler that accepts the given categories. */
    static IntentHandler forCategories(String name, Set<IntentCategory> categories, HandlerFunction function) {
        Set<IntentCategory> accepted = categories.isEmpty()
                ? EnumSet.noneOf(IntentCategory.class)
                : EnumSet.copyOf(categories);
        return new IntentHandler() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public boolean canHandle(Intent intent, RoutingContext context) {
                return accepted.contains(intent.category());
            }

            @Override
            public HandlerResult handle(Intent intent, Map<String, ExtractedEntity> entities, RoutingContext context) {
                return function.apply(intent, entities, context);
            }

            @Override
            public String toString() {
                return name + accepted;
            }
        };
    }
}
