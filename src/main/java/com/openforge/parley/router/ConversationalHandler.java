package com.openforge.parley.router;

import com.openforge.parley.nlu.ExtractedEntity;
import com.openforge.parley.nlu.Intent;
import com.openforge.parley.nlu.IntentCategory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Small talk: greetings, thanks, farewells and "how are you".
 */
@Component
public class ConversationalHandler implements IntentHandler {

    public static final String NAME = "conversational";

    private static final Pattern GREETING = Pattern.compile("\\b(hi|hello|hey|greetings|good\\s+(morning|afternoon|evening))\\b");
    private static final Pattern FAREWELL = Pattern.compile("\\b(bye|goodbye|see you|farewell|good night)\\b");
    private static final Pattern THANKS   = Pattern.compile("\\b(thank|thanks|thx|appreciate)\\b");
    private static final Pattern WELLBEING = Pattern.compile("\\bhow are you\\b");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean canHandle(Intent intent, RoutingContext context) {
        return intent.category() == IntentCategory.CONVERSATIONAL;
    }

    @Override
    public HandlerResult handle(Intent intent, Map<String, ExtractedEntity> entities, RoutingContext context) {
        String text = context.taskText() == null ? "" : context.taskText().toLowerCase(Locale.ROOT);
        if (WELLBEING.matcher(text).find()) {
            return reply("I'm doing well, thank you! What can I do for you?", "wellbeing");
        }
        if (FAREWELL.matcher(text).find()) {
            return reply("Goodbye! Feel free to return anytime you need assistance.", "farewell");
        }
        if (THANKS.matcher(text).find()) {
            return reply("You're welcome! Happy to help.", "thanks");
        }
        if (GREETING.matcher(text).find()) {
            return reply("Hello! How can I help you today?", "greeting");
        }
        return reply("Got it.", "acknowledgement");
    }

    private static HandlerResult reply(String text, String kind) {
        return HandlerResult.of(text, Map.of("kind", kind));
    }
}
