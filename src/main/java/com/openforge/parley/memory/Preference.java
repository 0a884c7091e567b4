package com.openforge.parley.memory;

/**
 * A learned user preference, e.g. {@code explanation_style.use_examples = true}.
 *
 * @param confidence       {@code min(1, observationCount / promotionThreshold)}
 * @param observationCount consistent observations of this exact value
 * @param active           {@code observationCount >= promotionThreshold}
 */
public record Preference(String category,
                         String key,
                         String value,
                         double confidence,
                         int observationCount,
                         boolean active) {

    public String path() {
        return category + "." + key;
    }

    @Override
    public String toString() {
        return path() + "=" + value + " (" + observationCount + (active ? ", active)" : ")");
    }
}
