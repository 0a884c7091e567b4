package com.openforge.parley.memory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Observation counts per (category, key, value).
 *
 * Confidence rises with every consistent observation and never falls; a
 * value becomes active once observed {@code promotionThreshold} times. If
 * several values of one key are active, the most observed one (then the
 * first learned) is surfaced.
 *
 * Counts loaded with {@link #restore} are kept apart from those learned
 * since, so a session persists only what it observed itself.
 */
public class UserPreferences {

    private record Slot(String category, String key, String value) {}

    private final int promotionThreshold;
    private final Map<Slot, Integer> observations = new LinkedHashMap<>();
    private final Map<Slot, Integer> learned      = new LinkedHashMap<>();

    public UserPreferences(int promotionThreshold) {
        if (promotionThreshold < 1) {
            throw new IllegalArgumentException("promotionThreshold must be >= 1, got " + promotionThreshold);
        }
        this.promotionThreshold = promotionThreshold;
    }

    public synchronized Preference learn(String category, String key, String value) {
        Slot slot = new Slot(category, key, value);
        int count = observations.merge(slot, 1, Integer::sum);
        learned.merge(slot, 1, Integer::sum);
        return toPreference(slot, count);
    }

    public synchronized Optional<Preference> get(String category, String key, String value) {
        Integer count = observations.get(new Slot(category, key, value));
        return count == null ? Optional.empty() : Optional.of(toPreference(new Slot(category, key, value), count));
    }

    /** One active value per (category, key), in first-learned order. */
    public synchronized List<Preference> activePreferences() {
        Map<String, Preference> best = new LinkedHashMap<>();
        observations.forEach((slot, count) -> {
            if (count < promotionThreshold) return;
            Preference candidate = toPreference(slot, count);
            best.merge(candidate.path(), candidate,
                    (a, b) -> b.observationCount() > a.observationCount() ? b : a);
        });
        return List.copyOf(best.values());
    }

    public synchronized boolean isActive(String category, String key) {
        return activePreferences().stream()
                .anyMatch(p -> p.category().equals(category) && p.key().equals(key));
    }

    /** Every observed value, most observed first. */
    public synchronized List<Preference> snapshot() {
        List<Preference> all = new ArrayList<>();
        observations.forEach((slot, count) -> all.add(toPreference(slot, count)));
        all.sort(Comparator.comparingInt(Preference::observationCount).reversed());
        return all;
    }

    /** Observations made through {@link #learn} only, excluding restored counts. */
    public synchronized List<Preference> learnedObservations() {
        List<Preference> out = new ArrayList<>();
        learned.forEach((slot, count) -> out.add(toPreference(slot, count)));
        return out;
    }

    /**
     * Loads persisted counts. A count already higher in memory is kept, so
     * restoring never lowers confidence.
     */
    public synchronized void restore(List<Preference> persisted) {
        for (Preference p : persisted) {
            observations.merge(new Slot(p.category(), p.key(), p.value()),
                    p.observationCount(), Math::max);
        }
    }

    public int promotionThreshold() {
        return promotionThreshold;
    }

    private Preference toPreference(Slot slot, int count) {
        double confidence = Math.min(1.0, (double) count / promotionThreshold);
        return new Preference(slot.category(), slot.key(), slot.value(), confidence, count,
                count >= promotionThreshold);
    }
}
