package com.openforge.parley.semantic;

import java.util.List;

/**
 * Turns text into a dense vector. Implementations may block and may throw
 * {@link EmbeddingException}; {@link SemanticMatcher} owns timeouts and degradation.
 */
public interface EmbeddingProvider {

    List<Float> embed(String text);

    /** Short identifier used in logs and the startup summary. */
    String name();
}
