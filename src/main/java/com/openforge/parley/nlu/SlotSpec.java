package com.openforge.parley.nlu;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A named parameter an intent needs. Patterns are tried in order; group 1 of
 * the first one that matches is the slot value. When none match, the first
 * extracted entity of {@code type} fills the slot.
 */
public record SlotSpec(String name, EntityType type, boolean required, List<Pattern> patterns) {

    public SlotSpec {
        patterns = List.copyOf(patterns);
    }

    public static SlotSpec required(String name, EntityType type, String... regexes) {
        return new SlotSpec(name, type, true, compile(regexes));
    }

    public static SlotSpec optional(String name, EntityType type, String... regexes) {
        return new SlotSpec(name, type, false, compile(regexes));
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
