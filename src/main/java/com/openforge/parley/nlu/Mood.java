package com.openforge.parley.nlu;

/**
 * Detected user mood. Declaration order breaks score ties in
 * {@link SentimentAnalyzer}. Each mood carries the tone a responder should adopt.
 */
public enum Mood {
    FRUSTRATED("extra_supportive"),
    CONFIDENT("challenging"),
    EXCITED("enthusiastic"),
    CURIOUS("exploratory"),
    BORED("advanced"),
    NEUTRAL("balanced");

    private final String tone;

    Mood(String tone) {
        this.tone = tone;
    }

    public String tone() {
        return tone;
    }
}
