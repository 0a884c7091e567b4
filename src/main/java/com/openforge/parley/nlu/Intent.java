package com.openforge.parley.nlu;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Classified, slot-filled purpose of an utterance.
 *
 * Confidence is clamped into [0, 1] on construction; maps are copied and
 * unmodifiable.
 */
public record Intent(IntentCategory category,
                     double confidence,
                     Map<String, ExtractedEntity> entities,
                     Map<String, SlotValue> slots,
                     IntentSource source) {

    private static final Intent UNKNOWN =
            new Intent(IntentCategory.UNKNOWN, 0.0, Map.of(), Map.of(), IntentSource.FALLBACK);

    public Intent {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(source, "source");
        confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
        entities   = entities == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entities));
        slots      = slots == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(slots));
    }

    public static Intent unknown() {
        return UNKNOWN;
    }

    public boolean isUnknown() {
        return category == IntentCategory.UNKNOWN;
    }

    public boolean hasMissingRequiredSlot() {
        return slots.values().stream().anyMatch(SlotValue::isMissingRequired);
    }

    public Intent withConfidence(double newConfidence) {
        return new Intent(category, newConfidence, entities, slots, source);
    }
}
