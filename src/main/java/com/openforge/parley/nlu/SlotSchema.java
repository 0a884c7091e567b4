package com.openforge.parley.nlu;

import java.util.List;

/** Ordered slot specs of one intent pattern. */
public record SlotSchema(List<SlotSpec> slots) {

    public static final SlotSchema EMPTY = new SlotSchema(List.of());

    public SlotSchema {
        slots = List.copyOf(slots);
    }

    public static SlotSchema of(SlotSpec... slots) {
        return new SlotSchema(List.of(slots));
    }

    public boolean isEmpty() {
        return slots.isEmpty();
    }
}
