package com.openforge.parley.nlu;

/**
 * One typed span found in an utterance. {@code start} inclusive, {@code end} exclusive.
 */
public record ExtractedEntity(EntityType type, String value, int start, int end) {

    public int length() {
        return end - start;
    }

    public boolean overlaps(ExtractedEntity other) {
        return start < other.end && other.start < end;
    }

    public ExtractedEntity withType(EntityType newType) {
        return new ExtractedEntity(newType, value, start, end);
    }
}
