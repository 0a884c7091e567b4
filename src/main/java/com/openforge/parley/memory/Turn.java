package com.openforge.parley.memory;

import com.openforge.parley.nlu.Intent;
import com.openforge.parley.nlu.IntentCategory;
import com.openforge.parley.nlu.Sentiment;

import java.time.Instant;
import java.util.Objects;

/**
 * One user-utterance/assistant-response exchange. Immutable.
 *
 * @param important promote to long-term memory when recorded
 */
public record Turn(Utterance utterance,
                   String response,
                   Intent intent,
                   Sentiment sentiment,
                   Instant timestamp,
                   boolean important) {

    public Turn {
        Objects.requireNonNull(utterance, "utterance");
        intent    = intent == null ? Intent.unknown() : intent;
        sentiment = sentiment == null ? Sentiment.neutral() : sentiment;
        timestamp = timestamp == null ? utterance.timestamp() : timestamp;
    }

    public static Turn of(Utterance utterance, String response, Intent intent, Sentiment sentiment) {
        return new Turn(utterance, response, intent, sentiment, utterance.timestamp(), false);
    }

    public Turn markImportant() {
        return new Turn(utterance, response, intent, sentiment, timestamp, true);
    }

    public IntentCategory category() {
        return intent.category();
    }

    public String text() {
        return utterance.text();
    }
}
