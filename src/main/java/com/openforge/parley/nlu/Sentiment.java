package com.openforge.parley.nlu;

import java.util.List;

/**
 * Mood reading of a single utterance.
 *
 * @param intensity  emotional strength, 1.0 is baseline, capped at 3.0
 * @param indicators surface cues such as {@code emphatic} or {@code uncertain}
 * @param confidence how strongly the lexicon supports {@code mood}, in [0, 1]
 */
public record Sentiment(Mood mood, double intensity, List<String> indicators, double confidence) {

    public Sentiment {
        indicators = List.copyOf(indicators);
    }

    public static Sentiment neutral() {
        return new Sentiment(Mood.NEUTRAL, 1.0, List.of(), 0.0);
    }

    public String tone() {
        return mood.tone();
    }
}
