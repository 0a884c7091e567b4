package com.openforge.parley.memory;

/**
 * What the answer being judged looked like.
 *
 * @param usedExamples        the answer illustrated with examples
 * @param detailedExplanation the answer was a long, detailed explanation
 */
public record FeedbackContext(boolean usedExamples, boolean detailedExplanation) {

    public static FeedbackContext none() {
        return new FeedbackContext(false, false);
    }
}
