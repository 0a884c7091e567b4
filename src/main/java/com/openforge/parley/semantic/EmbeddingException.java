package com.openforge.parley.semantic;

/**
 * Raised by an {@link EmbeddingProvider} when no vector can be produced.
 * Never escapes {@link SemanticMatcher}: it is absorbed into a degraded score.
 */
public class EmbeddingException extends RuntimeException {

    public EmbeddingException(String message) { super(message); }

    public EmbeddingException(String message, Throwable cause) { super(message, cause); }
}
