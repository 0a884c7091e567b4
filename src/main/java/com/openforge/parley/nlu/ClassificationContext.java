package com.openforge.parley.nlu;

/**
 * What the classifier may know about the conversation so far.
 *
 * @param previousCategory category of the last recorded turn, or {@code null}
 */
public record ClassificationContext(IntentCategory previousCategory) {

    private static final ClassificationContext EMPTY = new ClassificationContext(null);

    public static ClassificationContext empty() {
        return EMPTY;
    }

    public static ClassificationContext after(IntentCategory previousCategory) {
        return new ClassificationContext(previousCategory);
    }

    public boolean continues(IntentCategory candidate) {
        return previousCategory != null && previousCategory == candidate;
    }
}
