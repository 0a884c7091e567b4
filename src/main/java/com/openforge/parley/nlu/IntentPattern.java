package com.openforge.parley.nlu;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One recognised grammar of a category. A full match covers the whole
 * normalised utterance; a partial match starts on a word boundary anywhere in it.
 */
public final class IntentPattern {

    public enum MatchKind { FULL, PARTIAL, NONE }

    private final IntentCategory category;
    private final String         name;
    private final Pattern        full;
    private final Pattern        partial;
    private final SlotSchema     schema;

    public IntentPattern(IntentCategory category, String name, String regex, SlotSchema schema) {
        this.category = category;
        this.name     = name;
        this.full     = Pattern.compile("(?:" + regex + ")", Pattern.CASE_INSENSITIVE);
        this.partial  = Pattern.compile("\\b(?:" + regex + ")", Pattern.CASE_INSENSITIVE);
        this.schema   = schema == null ? SlotSchema.EMPTY : schema;
    }

    public IntentPattern(IntentCategory category, String name, String regex) {
        this(category, name, regex, SlotSchema.EMPTY);
    }

    public MatchKind match(String normalized) {
        if (full.matcher(normalized).matches()) return MatchKind.FULL;
        Matcher m = partial.matcher(normalized);
        return m.find() ? MatchKind.PARTIAL : MatchKind.NONE;
    }

    public IntentCategory category() { return category; }
    public String name()             { return name; }
    public SlotSchema schema()       { return schema; }

    @Override
    public String toString() {
        return category + "/" + name;
    }
}
