package com.openforge.parley.nlu;

/**
 * Classifier stage that produced an intent. Declaration order is the
 * tie-break priority on equal confidence.
 */
public enum IntentSource {
    PATTERN,
    SLOT,
    SEMANTIC,
    FALLBACK
}
