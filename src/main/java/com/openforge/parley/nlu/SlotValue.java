package com.openforge.parley.nlu;

/**
 * A slot after extraction. {@code value} is {@code null} when the slot is unfilled.
 */
public record SlotValue(String name, String value, boolean required, EntityType type) {

    public static SlotValue unfilled(SlotSpec spec) {
        return new SlotValue(spec.name(), null, spec.required(), spec.type());
    }

    public static SlotValue filled(SlotSpec spec, String value) {
        return new SlotValue(spec.name(), value, spec.required(), spec.type());
    }

    public boolean isFilled() {
        return value != null;
    }

    public boolean isMissingRequired() {
        return required && value == null;
    }
}
