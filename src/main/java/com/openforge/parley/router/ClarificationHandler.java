package com.openforge.parley.router;

import com.openforge.parley.nlu.ExtractedEntity;
import com.openforge.parley.nlu.Intent;
import com.openforge.parley.nlu.SlotValue;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reserved first link. Takes every intent that is not confident enough or
 * lacks a required slot, and asks the user instead of forwarding.
 */
public class ClarificationHandler implements IntentHandler {

    public static final String NAME = "clarification";

    private final double threshold;

    public ClarificationHandler(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean canHandle(Intent intent, RoutingContext context) {
        return intent.confidence() < threshold || intent.hasMissingRequiredSlot();
    }

    @Override
    public HandlerResult handle(Intent intent, Map<String, ExtractedEntity> entities, RoutingContext context) {
        List<String> missing = intent.slots().values().stream()
                .filter(SlotValue::isMissingRequired)
                .map(SlotValue::name)
                .toList();
        if (!missing.isEmpty()) {
            return new HandlerResult("Could you tell me the " + String.join(" and ", missing) + "?",
                    Map.of("missingSlots", missing), true);
        }
        if (intent.isUnknown()) {
            return HandlerResult.clarification("Sorry, I didn't quite get that. Could you rephrase it?");
        }
        String category = intent.category().name().toLowerCase(Locale.ROOT);
        return new HandlerResult("Just to be sure, is this a " + category + " request?",
                Map.of("suggestedCategory", intent.category().name()), true);
    }

    public double threshold() {
        return threshold;
    }
}
