package com.openforge.parley.nlu;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link EntityExtractor}.
 *
 * @param entities first entity per type, keyed by {@link EntityType#key()}
 * @param spans    every surviving entity span, in text order
 * @param slots    slot values in schema order
 */
public record Extraction(Map<String, ExtractedEntity> entities,
                         List<ExtractedEntity> spans,
                         Map<String, SlotValue> slots) {

    public Extraction {
        entities = Map.copyOf(entities);
        spans    = List.copyOf(spans);
        slots    = Collections.unmodifiableMap(new LinkedHashMap<>(slots));
    }

    public static Extraction empty() {
        return new Extraction(Map.of(), List.of(), Map.of());
    }

    public long missingRequired() {
        return slots.values().stream().filter(SlotValue::isMissingRequired).count();
    }

    /** Confidence multiplier: {@code factor} raised to the number of unfilled required slots. */
    public double penalty(double factor) {
        return Math.pow(factor, missingRequired());
    }

    public boolean has(EntityType type) {
        return entities.containsKey(type.key());
    }
}
